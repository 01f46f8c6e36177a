package com.example.acl.security.exception;

/**
 * Stable error kinds. Clients match on {@link #name()} appearing in the message.
 */
public enum AclErrorKind {
    INVALID_CREDENTIALS("InvalidCredentials"),
    TOKEN_EXPIRED("TokenExpired"),
    TOKEN_INVALID("TokenInvalid"),
    REFRESH_EXPIRED("RefreshExpired"),
    REFRESH_INVALID("RefreshInvalid"),
    PERMISSION_DENIED("PermissionDenied"),
    RESERVED_PREDICATE_VIOLATION("ReservedPredicateViolation"),
    UNAUTHENTICATED("Unauthenticated");

    private final String code;

    AclErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    String format(String detail) {
        return detail == null || detail.isBlank() ? code : code + ": " + detail;
    }
}
