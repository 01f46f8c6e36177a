package com.example.acl.request.model;

import java.util.Objects;

/**
 * Schema of one predicate, e.g. {@code name} with definition {@code string @index(exact)}.
 */
public record PredicateSchema(String predicate, String definition) {

    public PredicateSchema {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(definition, "definition");
    }

    /**
     * Scalar type, the first token of the definition.
     */
    public String type() {
        String trimmed = definition.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    public String toSchemaLine() {
        return predicate + ": " + definition + " .";
    }
}
