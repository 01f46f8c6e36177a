package com.example.acl.authz.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Set;
import java.util.TreeSet;

/**
 * A user account. The password is only ever held as a salted hash.
 */
public record AclUser(String name, String passwordHash, Set<String> groups) {

    public AclUser {
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }

    public AclUser withGroup(String group) {
        Set<String> updated = new TreeSet<>(groups);
        updated.add(group);
        return new AclUser(name, passwordHash, updated);
    }

    public AclUser withoutGroup(String group) {
        Set<String> updated = new TreeSet<>(groups);
        updated.remove(group);
        return new AclUser(name, passwordHash, updated);
    }

    @JsonIgnore
    public boolean isMemberOf(String group) {
        return groups.contains(group);
    }
}
