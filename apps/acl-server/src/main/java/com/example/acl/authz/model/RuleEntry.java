package com.example.acl.authz.model;

import java.util.Comparator;

/**
 * One row of the flattened rule table: group, predicate, permission.
 */
public record RuleEntry(String group, String predicate, int permission) {

    public static final Comparator<RuleEntry> BY_GROUP_THEN_PREDICATE =
            Comparator.comparing(RuleEntry::group).thenComparing(RuleEntry::predicate);

    public static RuleEntry of(String group, AclRule rule) {
        return new RuleEntry(group, rule.predicate(), rule.permission());
    }
}
