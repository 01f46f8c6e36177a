package com.example.acl.request.model;

import java.util.Objects;

public record OrderBy(String predicate, boolean descending) {

    public OrderBy {
        Objects.requireNonNull(predicate, "predicate");
    }

    public static OrderBy asc(String predicate) {
        return new OrderBy(predicate, false);
    }

    public static OrderBy desc(String predicate) {
        return new OrderBy(predicate, true);
    }
}
