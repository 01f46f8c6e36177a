package com.example.acl.web.dto;

import org.springframework.lang.Nullable;

/**
 * Alter body. Exactly one of the three parts is expected.
 *
 * @param schema   schema statements, e.g. {@code name: string @index(exact) .}
 * @param dropAttr predicate to drop
 * @param dropAll  drop every predicate and all data
 */
public record AlterBody(
        @Nullable String schema,
        @Nullable String dropAttr,
        boolean dropAll
) {
}
