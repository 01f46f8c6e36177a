package com.example.acl.web.dto;

import org.springframework.lang.Nullable;

/**
 * Mutation body; each part holds N-Quad text.
 */
public record MutateRequest(
        @Nullable String set,
        @Nullable String delete
) {
}
