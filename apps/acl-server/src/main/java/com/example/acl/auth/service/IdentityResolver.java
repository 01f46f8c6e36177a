package com.example.acl.auth.service;

import com.example.acl.auth.model.AccessClaims;
import com.example.acl.auth.model.Identity;
import com.example.acl.auth.model.ResolvedIdentity;
import com.example.acl.authz.cache.PermissionCache;
import com.example.acl.common.util.StringSanitizer;
import com.example.acl.config.properties.AclProperties;
import com.example.acl.security.exception.AclErrorKind;
import com.example.acl.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.Set;

/**
 * Turns request credentials into an {@link Identity}.
 *
 * <p>An expired access token is exchanged transparently when a refresh token accompanies it.
 * Guardians membership is looked up in the current permission snapshot rather than read from the
 * token, so granting or revoking it takes effect within one refresh interval.
 */
@Slf4j
@Component
public class IdentityResolver {

    private final TokenOperations tokens;
    private final PermissionCache cache;
    private final String guardiansGroup;
    private final String grootUser;

    public IdentityResolver(TokenOperations tokens, PermissionCache cache, AclProperties properties) {
        this.tokens = tokens;
        this.cache = cache;
        this.guardiansGroup = properties.guardiansGroup();
        this.grootUser = properties.grootUser();
    }

    @NonNull
    public Mono<ResolvedIdentity> resolve(@Nullable String accessToken, @Nullable String refreshToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return Mono.just(ResolvedIdentity.of(Identity.unauthenticated()));
        }

        return tokens.verifyAccess(accessToken)
                .map(claims -> ResolvedIdentity.of(toIdentity(claims)))
                .onErrorResume(AuthenticationException.class, e -> {
                    if (e.getKind() != AclErrorKind.TOKEN_EXPIRED) {
                        return Mono.error(e);
                    }
                    if (refreshToken == null || refreshToken.isBlank()) {
                        return Mono.error(AuthenticationException.unauthenticated(
                                "access token has expired, log in again or send a refresh token"));
                    }
                    log.debug("Access token expired, refreshing with {}", StringSanitizer.maskToken(refreshToken));
                    return tokens.refresh(refreshToken)
                            .flatMap(pair -> tokens.verifyAccess(pair.accessToken())
                                    .map(claims -> new ResolvedIdentity(toIdentity(claims), pair)));
                });
    }

    @NonNull
    Identity toIdentity(@NonNull AccessClaims claims) {
        String user = claims.userId();
        boolean guardian = grootUser.equals(user) || cache.groupsOf(user).contains(guardiansGroup);
        Set<String> groups = new HashSet<>(claims.groups());
        groups.remove(guardiansGroup);
        if (guardian) {
            groups.add(guardiansGroup);
        }
        return Identity.user(user, groups, guardian);
    }
}
