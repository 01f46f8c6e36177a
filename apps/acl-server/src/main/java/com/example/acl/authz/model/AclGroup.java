package com.example.acl.authz.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named group and its rules, at most one per predicate.
 *
 * @param name  unique group name
 * @param rules rules in insertion order
 */
public record AclGroup(String name, List<AclRule> rules) {

    public AclGroup {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static AclGroup named(String name) {
        return new AclGroup(name, List.of());
    }

    /**
     * Returns a copy with {@code rule} added, replacing any earlier rule on the same predicate.
     */
    public AclGroup withRule(AclRule rule) {
        Map<String, AclRule> byPredicate = indexByPredicate();
        byPredicate.put(rule.predicate(), rule);
        return new AclGroup(name, new ArrayList<>(byPredicate.values()));
    }

    public AclGroup withoutRule(String predicate) {
        Map<String, AclRule> byPredicate = indexByPredicate();
        byPredicate.remove(predicate);
        return new AclGroup(name, new ArrayList<>(byPredicate.values()));
    }

    public Optional<AclRule> ruleFor(String predicate) {
        return rules.stream()
                .filter(rule -> rule.predicate().equals(predicate))
                .findFirst();
    }

    private Map<String, AclRule> indexByPredicate() {
        Map<String, AclRule> byPredicate = new LinkedHashMap<>();
        rules.forEach(rule -> byPredicate.put(rule.predicate(), rule));
        return byPredicate;
    }
}
