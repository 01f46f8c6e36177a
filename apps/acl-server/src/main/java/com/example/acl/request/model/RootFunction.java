package com.example.acl.request.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Root selection function of a query block.
 *
 * @param function  selection function
 * @param predicate predicate the function reads; null for {@code uid} and {@code type}
 * @param args      function arguments: the value for {@code eq}, node ids for {@code uid},
 *                  the type name for {@code type}
 */
public record RootFunction(Function function, String predicate, List<String> args) {

    public enum Function {
        HAS, EQ, UID, TYPE
    }

    public RootFunction {
        Objects.requireNonNull(function, "function");
        args = args == null ? List.of() : List.copyOf(args);
        if ((function == Function.HAS || function == Function.EQ) && (predicate == null || predicate.isBlank())) {
            throw new IllegalArgumentException(function.name().toLowerCase(Locale.ROOT) + "() requires a predicate");
        }
        if (function == Function.EQ && args.size() != 1) {
            throw new IllegalArgumentException("eq() requires exactly one value");
        }
    }

    public static RootFunction has(String predicate) {
        return new RootFunction(Function.HAS, predicate, List.of());
    }

    public static RootFunction eq(String predicate, String value) {
        return new RootFunction(Function.EQ, predicate, List.of(value));
    }

    public static RootFunction uid(String... uids) {
        return new RootFunction(Function.UID, null, List.of(uids));
    }

    public static RootFunction type(String typeName) {
        return new RootFunction(Function.TYPE, null, List.of(typeName));
    }

    /**
     * Whether selecting by this function reads a predicate and is therefore subject to READ.
     */
    public boolean isGated() {
        return predicate != null;
    }
}
