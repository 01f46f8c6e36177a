package com.example.acl.auth.filter;

import com.example.acl.auth.context.IdentityContextHolder;
import com.example.acl.auth.model.ResolvedIdentity;
import com.example.acl.auth.model.TokenPair;
import com.example.acl.auth.service.IdentityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Resolves the caller from {@code X-Access-Token} (and {@code X-Refresh-Token}) and puts the
 * identity into the reactive context. Requests without a token continue as anonymous.
 *
 * <p>Registered only inside the security filter chain, so it is not a bean.
 */
@Slf4j
@RequiredArgsConstructor
public class AccessTokenFilter implements WebFilter {

    public static final String ACCESS_TOKEN_HEADER = "X-Access-Token";
    public static final String REFRESH_TOKEN_HEADER = "X-Refresh-Token";

    // Token endpoints take their credentials from the body.
    private static final Set<String> TOKEN_ENDPOINTS = Set.of("/api/v1/login", "/api/v1/refresh", "/api/v1/logout");

    private final IdentityResolver identityResolver;

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        if (TOKEN_ENDPOINTS.contains(exchange.getRequest().getPath().value())) {
            return chain.filter(exchange);
        }

        HttpHeaders headers = exchange.getRequest().getHeaders();
        return identityResolver.resolve(headers.getFirst(ACCESS_TOKEN_HEADER), headers.getFirst(REFRESH_TOKEN_HEADER))
                .flatMap(resolved -> {
                    resolved.refreshed().ifPresent(pair -> exposeRefreshedTokens(exchange, pair));
                    return continueWithIdentity(resolved, exchange, chain);
                });
    }

    private void exposeRefreshedTokens(ServerWebExchange exchange, TokenPair pair) {
        HttpHeaders responseHeaders = exchange.getResponse().getHeaders();
        responseHeaders.set(ACCESS_TOKEN_HEADER, pair.accessToken());
        responseHeaders.set(REFRESH_TOKEN_HEADER, pair.refreshToken());
        log.debug("Returned refreshed tokens in response headers");
    }

    private Mono<Void> continueWithIdentity(ResolvedIdentity resolved, ServerWebExchange exchange, WebFilterChain chain) {
        return chain.filter(exchange)
                .contextWrite(IdentityContextHolder.withIdentity(resolved.identity()));
    }
}
