package com.example.acl.auth.model;

import java.time.Instant;
import java.util.Set;

/**
 * Verified content of an access token. Group names are as of issue time.
 */
public record AccessClaims(
        String userId,
        Set<String> groups,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt
) {
    public AccessClaims {
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }
}
