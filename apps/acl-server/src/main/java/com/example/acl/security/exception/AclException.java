package com.example.acl.security.exception;

import lombok.Getter;

@Getter
public abstract class AclException extends RuntimeException {

    private final AclErrorKind kind;

    protected AclException(AclErrorKind kind, String detail) {
        super(kind.format(detail));
        this.kind = kind;
    }

    protected AclException(AclErrorKind kind, String detail, Throwable cause) {
        super(kind.format(detail), cause);
        this.kind = kind;
    }
}
