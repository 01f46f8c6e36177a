package com.example.acl.config;

import com.example.acl.auth.filter.AccessTokenFilter;
import com.example.acl.auth.service.IdentityResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;

@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    // Predicate-level decisions are made in the request gateway; this chain only resolves the caller.
    @Bean
    public SecurityWebFilterChain aclSecurityFilterChain(ServerHttpSecurity http, IdentityResolver identityResolver) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable) // Token API, no browser session
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .addFilterAt(new AccessTokenFilter(identityResolver), SecurityWebFiltersOrder.AUTHENTICATION)
                .build();
    }
}
