package com.example.acl.request.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Triples to add and triples to remove, applied together or not at all.
 */
public record MutationRequest(List<NQuad> set, List<NQuad> delete) {

    public MutationRequest {
        set = set == null ? List.of() : List.copyOf(set);
        delete = delete == null ? List.of() : List.copyOf(delete);
    }

    public static MutationRequest ofSet(List<NQuad> set) {
        return new MutationRequest(set, List.of());
    }

    public static MutationRequest ofDelete(List<NQuad> delete) {
        return new MutationRequest(List.of(), delete);
    }

    public boolean isEmpty() {
        return set.isEmpty() && delete.isEmpty();
    }

    /**
     * Named predicates written by this mutation. Wildcard predicates are excluded.
     */
    public Set<String> writtenPredicates() {
        List<NQuad> all = new ArrayList<>(set);
        all.addAll(delete);
        Set<String> predicates = new LinkedHashSet<>();
        for (NQuad quad : all) {
            if (!quad.isWildcardPredicate()) {
                predicates.add(quad.predicate());
            }
        }
        return predicates;
    }

    public boolean hasWildcardDelete() {
        return delete.stream().anyMatch(NQuad::isWildcardPredicate);
    }
}
