package com.example.acl.auth.model;

import java.util.Set;

/**
 * The caller a request runs as.
 *
 * @param userId    user name, null when anonymous
 * @param groups    groups used for permission lookup
 * @param guardian  whether predicate checks are bypassed; resolved per request, never taken from the token
 * @param anonymous true when the request carried no access token
 */
public record Identity(String userId, Set<String> groups, boolean guardian, boolean anonymous) {

    private static final Identity ANONYMOUS = new Identity(null, Set.of(), false, true);

    public Identity {
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }

    public static Identity unauthenticated() {
        return ANONYMOUS;
    }

    public static Identity user(String userId, Set<String> groups, boolean guardian) {
        return new Identity(userId, groups, guardian, false);
    }

    /**
     * Name for logs and audit events.
     */
    public String displayName() {
        return anonymous ? "anonymous" : userId;
    }
}
