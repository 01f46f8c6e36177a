package com.example.acl.authz.model;

import java.util.Objects;

/**
 * A single grant: the permission bitmask a group holds on one predicate.
 */
public record AclRule(String predicate, int permission) {

    public AclRule {
        Objects.requireNonNull(predicate, "predicate");
        if (predicate.isBlank()) {
            throw new IllegalArgumentException("predicate must not be blank");
        }
        Permission.validate(permission);
    }

    public static AclRule of(String predicate, Permission... permissions) {
        return new AclRule(predicate, Permission.mask(permissions));
    }

    public boolean grants(Permission permission) {
        return permission.isGrantedBy(this.permission);
    }
}
