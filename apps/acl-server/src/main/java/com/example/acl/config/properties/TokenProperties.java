package com.example.acl.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for access/refresh token issuance.
 */
@ConfigurationProperties(prefix = "app.auth.token")
public record TokenProperties(
        String signingSecret,
        String issuer,
        Duration accessTtl,
        Duration refreshTtl,
        int maxRefreshTokens,
        Duration refreshGrace
) {
    /**
     * HS256 needs at least 256 bits of key material.
     */
    public static final int MIN_SECRET_LENGTH = 32;

    public TokenProperties {
        if (signingSecret == null || signingSecret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "app.auth.token.signing-secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = "acl-server";
        }
        if (accessTtl == null) {
            accessTtl = Duration.ofHours(6);
        }
        if (refreshTtl == null) {
            refreshTtl = Duration.ofDays(30);
        }
        if (maxRefreshTokens <= 0) {
            maxRefreshTokens = 10000;
        }
        if (refreshGrace == null || refreshGrace.isNegative()) {
            refreshGrace = Duration.ofDays(1);
        }
    }

    /**
     * How long a stored refresh token outlives its expiry, so a late redemption reports
     * {@code RefreshExpired} rather than {@code RefreshInvalid}.
     */
    public Duration refreshRetention() {
        return refreshTtl.plus(refreshGrace);
    }
}
