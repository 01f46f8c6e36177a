package com.example.acl.authz.enforcement;

import java.util.Locale;

public enum RequestKind {
    QUERY, MUTATION, ALTER, SCHEMA;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
