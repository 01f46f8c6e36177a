package com.example.acl.authz.cache;

import com.example.acl.authz.model.Membership;
import com.example.acl.authz.model.Permission;
import com.example.acl.authz.model.RuleEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable view of every group's grants and every user's memberships as of one load.
 * Built completely before it is published, so readers never see entries from two loads.
 */
public final class PermissionSnapshot {

    private static final PermissionSnapshot EMPTY = new PermissionSnapshot(0, Instant.EPOCH, Map.of(), Map.of(), 0);

    private final long generation;
    private final Instant loadedAt;
    private final Map<String, Map<String, Integer>> permissionsByGroup;
    private final Map<String, Set<String>> groupsByUser;
    private final int ruleCount;

    private PermissionSnapshot(
            long generation,
            Instant loadedAt,
            Map<String, Map<String, Integer>> permissionsByGroup,
            Map<String, Set<String>> groupsByUser,
            int ruleCount) {
        this.generation = generation;
        this.loadedAt = loadedAt;
        this.permissionsByGroup = permissionsByGroup;
        this.groupsByUser = groupsByUser;
        this.ruleCount = ruleCount;
    }

    /**
     * Snapshot used before the first successful load: no grants, no memberships.
     */
    public static PermissionSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot. Rules are applied in order, so a later rule for the same
     * (group, predicate) replaces an earlier one.
     */
    public static PermissionSnapshot build(
            long generation,
            Instant loadedAt,
            Collection<RuleEntry> rules,
            Collection<Membership> memberships) {

        Map<String, Map<String, Integer>> byGroup = new HashMap<>();
        for (RuleEntry rule : rules) {
            byGroup.computeIfAbsent(rule.group(), g -> new HashMap<>())
                    .put(rule.predicate(), Permission.validate(rule.permission()));
        }

        Map<String, Set<String>> byUser = new HashMap<>();
        for (Membership membership : memberships) {
            byUser.computeIfAbsent(membership.user(), u -> new TreeSet<>()).add(membership.group());
        }

        Map<String, Map<String, Integer>> frozenGroups = new HashMap<>();
        byGroup.forEach((group, grants) -> frozenGroups.put(group, Map.copyOf(grants)));
        Map<String, Set<String>> frozenUsers = new HashMap<>();
        byUser.forEach((user, groups) -> frozenUsers.put(user, Set.copyOf(groups)));

        int ruleCount = frozenGroups.values().stream().mapToInt(Map::size).sum();
        return new PermissionSnapshot(generation, loadedAt,
                Map.copyOf(frozenGroups), Map.copyOf(frozenUsers), ruleCount);
    }

    /**
     * Permission bitmask of one group on one predicate, 0 when there is no rule.
     */
    public int lookup(String group, String predicate) {
        Map<String, Integer> grants = permissionsByGroup.get(group);
        if (grants == null) {
            return Permission.NONE;
        }
        return grants.getOrDefault(predicate, Permission.NONE);
    }

    /**
     * Union of the bitmasks every listed group holds on the predicate.
     */
    public int lookupEffective(Collection<String> groups, String predicate) {
        int mask = Permission.NONE;
        for (String group : groups) {
            mask |= lookup(group, predicate);
        }
        return mask;
    }

    public Set<String> groupsOf(String user) {
        return groupsByUser.getOrDefault(user, Set.of());
    }

    public long generation() {
        return generation;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public int ruleCount() {
        return ruleCount;
    }

    @Override
    public String toString() {
        return "PermissionSnapshot{generation=" + generation
                + ", loadedAt=" + loadedAt
                + ", groups=" + permissionsByGroup.size()
                + ", rules=" + ruleCount + '}';
    }
}
