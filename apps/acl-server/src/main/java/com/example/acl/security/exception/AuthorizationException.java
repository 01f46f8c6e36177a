package com.example.acl.security.exception;

import lombok.Getter;

@Getter
public class AuthorizationException extends AclException {

    private final String userId;
    private final String predicate;

    public AuthorizationException(String userId, String predicate, String detail) {
        super(AclErrorKind.PERMISSION_DENIED, detail);
        this.userId = userId;
        this.predicate = predicate;
    }

    public static AuthorizationException unauthorizedTo(String operation, String userId, String predicate) {
        return new AuthorizationException(userId, predicate,
                "unauthorized to " + operation + " the predicate " + predicate);
    }
}
