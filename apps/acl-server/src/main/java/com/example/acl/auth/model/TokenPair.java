package com.example.acl.auth.model;

import java.time.Instant;

/**
 * Tokens returned by login and refresh.
 */
public record TokenPair(
        String accessToken,
        String refreshToken,
        Instant accessExpiresAt,
        Instant refreshExpiresAt
) {
}
