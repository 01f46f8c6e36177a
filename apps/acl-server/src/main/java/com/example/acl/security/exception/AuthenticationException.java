package com.example.acl.security.exception;

// Caller could not be identified: bad credentials, unusable token, or no token where one is required.
public class AuthenticationException extends AclException {

    public AuthenticationException(AclErrorKind kind, String detail) {
        super(kind, detail);
    }

    public AuthenticationException(AclErrorKind kind, String detail, Throwable cause) {
        super(kind, detail, cause);
    }

    public static AuthenticationException invalidCredentials() {
        return new AuthenticationException(AclErrorKind.INVALID_CREDENTIALS, "invalid username or password");
    }

    public static AuthenticationException unauthenticated(String detail) {
        return new AuthenticationException(AclErrorKind.UNAUTHENTICATED, detail);
    }
}
