package com.example.acl.request.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A schema change: new or changed predicate definitions, a single predicate drop,
 * or dropping everything.
 */
public record AlterRequest(List<PredicateSchema> schema, String dropAttr, boolean dropAll) {

    public AlterRequest {
        schema = schema == null ? List.of() : List.copyOf(schema);
        if (dropAttr != null && dropAttr.isBlank()) {
            dropAttr = null;
        }
    }

    public static AlterRequest schema(List<PredicateSchema> schema) {
        return new AlterRequest(schema, null, false);
    }

    public static AlterRequest drop(String predicate) {
        return new AlterRequest(List.of(), predicate, false);
    }

    public static AlterRequest dropEverything() {
        return new AlterRequest(List.of(), null, true);
    }

    public Set<String> modifiedPredicates() {
        Set<String> predicates = new LinkedHashSet<>();
        schema.forEach(s -> predicates.add(s.predicate()));
        if (dropAttr != null) {
            predicates.add(dropAttr);
        }
        return predicates;
    }
}
