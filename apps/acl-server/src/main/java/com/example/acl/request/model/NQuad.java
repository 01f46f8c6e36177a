package com.example.acl.request.model;

import java.util.Objects;

/**
 * One triple of a mutation.
 *
 * @param subject   node id ({@code 0x1f}) or blank node ({@code _:alice})
 * @param predicate edge name, or {@link #WILDCARD} in a delete
 * @param object    literal value, node reference, or {@link #WILDCARD} in a delete
 * @param kind      how to interpret {@code object}
 */
public record NQuad(String subject, String predicate, String object, ObjectKind kind) {

    public static final String WILDCARD = "*";

    public enum ObjectKind {
        LITERAL, NODE, WILDCARD
    }

    public NQuad {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(kind, "kind");
    }

    public static NQuad literal(String subject, String predicate, String value) {
        return new NQuad(subject, predicate, value, ObjectKind.LITERAL);
    }

    public static NQuad node(String subject, String predicate, String target) {
        return new NQuad(subject, predicate, target, ObjectKind.NODE);
    }

    public static NQuad wildcard(String subject, String predicate) {
        return new NQuad(subject, predicate, WILDCARD, ObjectKind.WILDCARD);
    }

    public boolean isWildcardPredicate() {
        return WILDCARD.equals(predicate);
    }

    public boolean isBlankSubject() {
        return subject.startsWith("_:");
    }
}
