package com.example.acl.engine;

import java.util.Map;

/**
 * @param uids blank node label (without {@code _:}) to assigned node id
 */
public record MutationResult(Map<String, String> uids) {

    public MutationResult {
        uids = uids == null ? Map.of() : Map.copyOf(uids);
    }
}
