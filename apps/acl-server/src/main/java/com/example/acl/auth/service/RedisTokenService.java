package com.example.acl.auth.service;

import com.example.acl.auth.model.RefreshTokenData;
import com.example.acl.authz.store.AclStoreOperations;
import com.example.acl.config.properties.TokenProperties;
import com.example.acl.observability.AclMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisOperations;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Token service keeping refresh tokens in Redis so every instance can redeem them.
 * Redemption uses GETDEL, which makes consumption atomic across instances.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.cache.type", havingValue = "redis")
public class RedisTokenService extends AbstractTokenService {

    private static final String REFRESH_KEY = "acl:refresh:";

    private final ReactiveRedisOperations<String, String> redisOps;
    private final ObjectMapper objectMapper;

    public RedisTokenService(
            @NonNull ReactiveRedisOperations<String, String> redisOps,
            @NonNull ObjectMapper objectMapper,
            @NonNull AclStoreOperations store,
            @NonNull PasswordEncoder passwordEncoder,
            @NonNull JwtEncoder jwtEncoder,
            @NonNull ReactiveJwtDecoder jwtDecoder,
            @NonNull TokenProperties properties,
            @NonNull AclMetrics metrics,
            @NonNull Clock clock) {
        super(store, passwordEncoder, jwtEncoder, jwtDecoder, properties, metrics, clock);
        this.redisOps = redisOps;
        this.objectMapper = objectMapper;
    }

    @Override
    @NonNull
    protected Mono<Void> storeRefreshToken(@NonNull String token, @NonNull RefreshTokenData data, @NonNull Duration ttl) {
        try {
            String json = objectMapper.writeValueAsString(data);
            return redisOps.opsForValue()
                    .set(REFRESH_KEY + token, json, ttl)
                    .then();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize refresh token data: {}", e.getMessage());
            return Mono.error(e);
        }
    }

    @Override
    @NonNull
    protected Mono<RefreshTokenData> consumeRefreshToken(@NonNull String token) {
        return redisOps.opsForValue()
                .getAndDelete(REFRESH_KEY + token)
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, RefreshTokenData.class));
                    } catch (JsonProcessingException e) {
                        log.error("Failed to deserialize refresh token data: {}", e.getMessage());
                        return Mono.empty();
                    }
                });
    }

    @Override
    @NonNull
    protected Mono<Void> removeRefreshToken(@NonNull String token) {
        return redisOps.delete(REFRESH_KEY + token).then();
    }
}
