package com.example.acl.authz.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Predicate permission bits. A rule's permission is the sum of the granted codes,
 * so 6 is READ and WRITE, 7 is everything.
 */
public enum Permission {
    /**
     * Query the predicate.
     */
    READ(4),

    /**
     * Set or delete triples whose edge is the predicate.
     */
    WRITE(2),

    /**
     * Alter or drop the predicate's schema.
     */
    MODIFY(1);

    public static final int NONE = 0;
    public static final int ALL = 7;

    private final int code;

    Permission(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isGrantedBy(int mask) {
        return (mask & code) != 0;
    }

    public static int mask(Permission... permissions) {
        int mask = NONE;
        for (Permission permission : permissions) {
            mask |= permission.code;
        }
        return mask;
    }

    public static Set<Permission> decode(int mask) {
        validate(mask);
        EnumSet<Permission> granted = EnumSet.noneOf(Permission.class);
        for (Permission permission : values()) {
            if (permission.isGrantedBy(mask)) {
                granted.add(permission);
            }
        }
        return granted;
    }

    public static int validate(int mask) {
        if (mask < NONE || mask > ALL) {
            throw new IllegalArgumentException("permission must be between 0 and 7, got " + mask);
        }
        return mask;
    }
}
