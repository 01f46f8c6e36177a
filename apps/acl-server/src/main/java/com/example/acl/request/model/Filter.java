package com.example.acl.request.model;

import java.util.Objects;

public record Filter(Function function, String predicate, String value) {

    public enum Function {
        HAS, EQ
    }

    public Filter {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(predicate, "predicate");
        if (function == Function.EQ && value == null) {
            throw new IllegalArgumentException("eq filter requires a value");
        }
    }

    public static Filter has(String predicate) {
        return new Filter(Function.HAS, predicate, null);
    }

    public static Filter eq(String predicate, String value) {
        return new Filter(Function.EQ, predicate, value);
    }
}
