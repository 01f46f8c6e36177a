package com.example.acl.exception;

import java.time.Instant;

/**
 * @param error   stable category, e.g. {@code authorization_error}
 * @param message client-visible message; ACL failures start with their error kind
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
