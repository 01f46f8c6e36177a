package com.example.acl.security.exception;

import lombok.Getter;

@Getter
public class ReservedPredicateException extends AclException {

    private final String predicate;

    public ReservedPredicateException(String predicate, String reason) {
        super(AclErrorKind.RESERVED_PREDICATE_VIOLATION, reason);
        this.predicate = predicate;
    }
}
