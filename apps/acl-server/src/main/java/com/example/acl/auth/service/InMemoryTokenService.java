package com.example.acl.auth.service;

import com.example.acl.auth.model.RefreshTokenData;
import com.example.acl.authz.store.AclStoreOperations;
import com.example.acl.common.util.StringSanitizer;
import com.example.acl.config.properties.TokenProperties;
import com.example.acl.observability.AclMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Token service keeping refresh tokens in a Caffeine cache, for single-instance deployments.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.cache.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTokenService extends AbstractTokenService {

    private final Cache<String, RefreshTokenData> refreshTokens;

    public InMemoryTokenService(
            @NonNull AclStoreOperations store,
            @NonNull PasswordEncoder passwordEncoder,
            @NonNull JwtEncoder jwtEncoder,
            @NonNull ReactiveJwtDecoder jwtDecoder,
            @NonNull TokenProperties properties,
            @NonNull AclMetrics metrics,
            @NonNull Clock clock) {
        super(store, passwordEncoder, jwtEncoder, jwtDecoder, properties, metrics, clock);

        this.refreshTokens = Caffeine.newBuilder()
                .expireAfterWrite(properties.refreshRetention())
                .maximumSize(properties.maxRefreshTokens())
                .build();

        log.info("In-memory token service initialized (single-instance mode, max-refresh-tokens={})",
                properties.maxRefreshTokens());
    }

    @Override
    @NonNull
    protected Mono<Void> storeRefreshToken(@NonNull String token, @NonNull RefreshTokenData data, @NonNull Duration ttl) {
        return Mono.fromRunnable(() -> {
            refreshTokens.put(token, data);
            log.debug("Stored refresh token {} for {}", StringSanitizer.maskToken(token),
                    StringSanitizer.forLog(data.userId()));
        });
    }

    @Override
    @NonNull
    protected Mono<RefreshTokenData> consumeRefreshToken(@NonNull String token) {
        return Mono.fromCallable(() -> refreshTokens.asMap().remove(token));
    }

    @Override
    @NonNull
    protected Mono<Void> removeRefreshToken(@NonNull String token) {
        return Mono.fromRunnable(() -> refreshTokens.invalidate(token));
    }
}
