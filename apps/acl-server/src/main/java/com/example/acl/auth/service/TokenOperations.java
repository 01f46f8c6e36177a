package com.example.acl.auth.service;

import com.example.acl.auth.model.AccessClaims;
import com.example.acl.auth.model.TokenPair;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Issues and verifies access/refresh token pairs.
 * Implementations differ in where refresh tokens live: Redis (shared) or in-memory (single instance).
 */
public interface TokenOperations {

    /**
     * Checks the password and issues a fresh pair carrying the user's current groups.
     * Fails with {@code InvalidCredentials} for a wrong password and for an unknown user alike.
     */
    @NonNull
    Mono<TokenPair> authenticate(@NonNull String username, @NonNull String password);

    /**
     * Verifies signature and expiry of an access token.
     * Fails with {@code TokenExpired} or {@code TokenInvalid}.
     */
    @NonNull
    Mono<AccessClaims> verifyAccess(@NonNull String accessToken);

    /**
     * Redeems a refresh token for a new pair. The token is consumed before the pair is issued,
     * so of two concurrent redemptions at most one succeeds.
     * Fails with {@code RefreshExpired} or {@code RefreshInvalid}.
     */
    @NonNull
    Mono<TokenPair> refresh(@NonNull String refreshToken);

    /**
     * Discards an unused refresh token. Unknown tokens are ignored.
     */
    @NonNull
    Mono<Void> revoke(@NonNull String refreshToken);
}
