package com.example.acl.auth.context;

import com.example.acl.auth.model.Identity;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

public final class IdentityContextHolder {

    private static final String IDENTITY_KEY = Identity.class.getName();

    private IdentityContextHolder() {
        // Utility class
    }

    /**
     * Identity of the current request; anonymous when the token filter did not run.
     */
    public static Mono<Identity> getIdentity() {
        return Mono.deferContextual(ctx -> Mono.just(ctx.getOrDefault(IDENTITY_KEY, Identity.unauthenticated())));
    }

    public static Function<Context, Context> withIdentity(Identity identity) {
        return context -> context.put(IDENTITY_KEY, identity);
    }
}
