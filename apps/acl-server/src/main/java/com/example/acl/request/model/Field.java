package com.example.acl.request.model;

import java.util.Objects;

/**
 * A projected field: a predicate's values, or with {@code count} the number of them.
 * The pseudo predicate {@code uid} yields the node id and is not access controlled.
 */
public record Field(String predicate, boolean count) {

    public static final String UID = "uid";

    public Field {
        Objects.requireNonNull(predicate, "predicate");
    }

    public static Field of(String predicate) {
        return new Field(predicate, false);
    }

    public static Field count(String predicate) {
        return new Field(predicate, true);
    }

    public boolean isUid() {
        return UID.equals(predicate);
    }

    public boolean isGated() {
        return !isUid();
    }

    public String outputKey() {
        return count ? "count(" + predicate + ")" : predicate;
    }
}
