package com.example.acl.auth.model;

import java.util.Optional;

/**
 * An identity plus the tokens minted if the access token had to be refreshed on the way.
 */
public record ResolvedIdentity(Identity identity, TokenPair refreshedTokens) {

    public static ResolvedIdentity of(Identity identity) {
        return new ResolvedIdentity(identity, null);
    }

    public Optional<TokenPair> refreshed() {
        return Optional.ofNullable(refreshedTokens);
    }
}
