package com.example.acl.auth.model;

import java.time.Instant;

/**
 * Server-side state behind an opaque refresh token.
 */
public record RefreshTokenData(
        String userId,
        Instant issuedAt,
        Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
