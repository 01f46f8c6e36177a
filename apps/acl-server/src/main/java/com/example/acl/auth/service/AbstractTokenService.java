package com.example.acl.auth.service;

import com.example.acl.auth.model.AccessClaims;
import com.example.acl.auth.model.RefreshTokenData;
import com.example.acl.auth.model.TokenPair;
import com.example.acl.authz.store.AclStoreOperations;
import com.example.acl.common.util.StringSanitizer;
import com.example.acl.config.properties.TokenProperties;
import com.example.acl.observability.AclMetrics;
import com.example.acl.security.exception.AclErrorKind;
import com.example.acl.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import reactor.core.publisher.Mono;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Shared token logic: password check, JWT minting and verification, refresh rotation.
 * Subclasses only decide where refresh tokens are kept.
 */
@Slf4j
public abstract class AbstractTokenService implements TokenOperations {

    static final String GROUPS_CLAIM = "groups";

    private static final int REFRESH_TOKEN_BYTES = 32;

    protected final AclStoreOperations store;
    protected final PasswordEncoder passwordEncoder;
    protected final JwtEncoder jwtEncoder;
    protected final ReactiveJwtDecoder jwtDecoder;
    protected final TokenProperties properties;
    protected final AclMetrics metrics;
    protected final Clock clock;

    private final SecureRandom random = new SecureRandom();

    protected AbstractTokenService(
            AclStoreOperations store,
            PasswordEncoder passwordEncoder,
            JwtEncoder jwtEncoder,
            ReactiveJwtDecoder jwtDecoder,
            TokenProperties properties,
            AclMetrics metrics,
            Clock clock) {
        this.store = store;
        this.passwordEncoder = passwordEncoder;
        this.jwtEncoder = jwtEncoder;
        this.jwtDecoder = jwtDecoder;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Stores a new refresh token. The store keeps it for {@code ttl}, which runs past the token's own
     * expiry; expiry itself is decided from {@link RefreshTokenData} against the clock.
     */
    @NonNull
    protected abstract Mono<Void> storeRefreshToken(@NonNull String token, @NonNull RefreshTokenData data, @NonNull Duration ttl);

    /**
     * Atomically removes and returns a refresh token's data; empty if unknown or already consumed.
     */
    @NonNull
    protected abstract Mono<RefreshTokenData> consumeRefreshToken(@NonNull String token);

    @NonNull
    protected abstract Mono<Void> removeRefreshToken(@NonNull String token);

    @Override
    @NonNull
    public Mono<TokenPair> authenticate(@NonNull String username, @NonNull String password) {
        return store.findUser(username)
                .filter(user -> passwordEncoder.matches(password, user.passwordHash()))
                .switchIfEmpty(Mono.error(AuthenticationException::invalidCredentials))
                .flatMap(user -> issue(user.name()))
                .doOnNext(pair -> {
                    metrics.recordLogin(true);
                    log.info("User {} logged in", StringSanitizer.forLog(username));
                })
                .doOnError(AuthenticationException.class, e -> {
                    metrics.recordLogin(false);
                    log.warn("Login failed for {}", StringSanitizer.forLog(username));
                });
    }

    @Override
    @NonNull
    public Mono<AccessClaims> verifyAccess(@NonNull String accessToken) {
        // The decoder throws on unparseable input before returning a Mono.
        return Mono.defer(() -> jwtDecoder.decode(accessToken))
                .onErrorMap(JwtException.class, e -> new AuthenticationException(
                        AclErrorKind.TOKEN_INVALID, "access token rejected", e))
                .flatMap(this::toClaims);
    }

    private Mono<AccessClaims> toClaims(Jwt jwt) {
        String subject = jwt.getSubject();
        Instant expiresAt = jwt.getExpiresAt();
        List<String> groups = jwt.getClaimAsStringList(GROUPS_CLAIM);
        if (subject == null || subject.isBlank() || expiresAt == null || groups == null) {
            return Mono.error(new AuthenticationException(AclErrorKind.TOKEN_INVALID, "access token is missing claims"));
        }
        if (!clock.instant().isBefore(expiresAt)) {
            log.debug("Access token of {} expired at {}", StringSanitizer.forLog(subject), expiresAt);
            return Mono.error(new AuthenticationException(AclErrorKind.TOKEN_EXPIRED, "access token has expired"));
        }
        return Mono.just(new AccessClaims(subject, new HashSet<>(groups), jwt.getId(), jwt.getIssuedAt(), expiresAt));
    }

    @Override
    @NonNull
    public Mono<TokenPair> refresh(@NonNull String refreshToken) {
        if (!isWellFormed(refreshToken)) {
            metrics.recordTokenRefresh(false);
            return Mono.error(refreshInvalid("malformed refresh token"));
        }

        return consumeRefreshToken(refreshToken)
                .switchIfEmpty(Mono.error(() -> refreshInvalid("refresh token is unknown or already used")))
                .flatMap(data -> {
                    if (data.isExpired(clock.instant())) {
                        return Mono.error(new AuthenticationException(
                                AclErrorKind.REFRESH_EXPIRED, "refresh token has expired"));
                    }
                    return store.findUser(data.userId())
                            .switchIfEmpty(Mono.error(() -> refreshInvalid("user no longer exists")))
                            .flatMap(user -> issue(user.name()));
                })
                .doOnNext(pair -> metrics.recordTokenRefresh(true))
                .doOnError(AuthenticationException.class, e -> {
                    metrics.recordTokenRefresh(false);
                    log.warn("Refresh rejected for token {}: {}", StringSanitizer.maskToken(refreshToken), e.getMessage());
                });
    }

    @Override
    @NonNull
    public Mono<Void> revoke(@NonNull String refreshToken) {
        if (!isWellFormed(refreshToken)) {
            return Mono.empty();
        }
        return removeRefreshToken(refreshToken)
                .doOnSuccess(v -> log.debug("Revoked refresh token {}", StringSanitizer.maskToken(refreshToken)));
    }

    /**
     * Mints a new pair for the user, embedding the groups the store reports right now.
     */
    @NonNull
    protected Mono<TokenPair> issue(@NonNull String userId) {
        return store.loadUserGroups(userId)
                .defaultIfEmpty(Set.of())
                .flatMap(groups -> {
                    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
                    Instant accessExpiresAt = now.plus(properties.accessTtl());
                    Instant refreshExpiresAt = now.plus(properties.refreshTtl());

                    String accessToken = encodeAccessToken(userId, groups, now, accessExpiresAt);
                    String refreshToken = newRefreshToken();
                    RefreshTokenData data = new RefreshTokenData(userId, now, refreshExpiresAt);

                    return storeRefreshToken(refreshToken, data, properties.refreshRetention())
                            .thenReturn(new TokenPair(accessToken, refreshToken, accessExpiresAt, refreshExpiresAt));
                });
    }

    private String encodeAccessToken(String userId, Set<String> groups, Instant issuedAt, Instant expiresAt) {
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(properties.issuer())
                .subject(userId)
                .id(UUID.randomUUID().toString())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .claim(GROUPS_CLAIM, List.copyOf(groups))
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }

    private String newRefreshToken() {
        byte[] bytes = new byte[REFRESH_TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean isWellFormed(String token) {
        return token != null && token.matches("^[A-Za-z0-9_-]{20,128}$");
    }

    private static AuthenticationException refreshInvalid(String detail) {
        return new AuthenticationException(AclErrorKind.REFRESH_INVALID, detail);
    }
}
