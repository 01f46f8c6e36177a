package com.example.acl.authz.guard;

import com.example.acl.config.properties.AclProperties;
import com.example.acl.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Protects the system predicate namespace.
 *
 * <p>Consulted before any permission lookup on alter requests: a reserved predicate may only be
 * re-asserted with its current definition, never changed or dropped, whoever the caller is.
 */
@Slf4j
@Component
public class ReservedPredicateGuard {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Reserved predicates that persist the ACL graph itself.
     */
    private static final Set<String> ACL_PREDICATE_SUFFIXES = Set.of(
            "xid", "password", "user.group", "acl.rule", "rule.predicate", "rule.permission");

    private final String prefix;

    public ReservedPredicateGuard(AclProperties properties) {
        this.prefix = properties.reservedPrefix().toLowerCase(Locale.ROOT);
    }

    public boolean isReserved(@Nullable String predicate) {
        return predicate != null && predicate.toLowerCase(Locale.ROOT).startsWith(prefix);
    }

    /**
     * True for the reserved predicates holding users, groups and rules. Only guardians may touch them.
     */
    public boolean isAclPredicate(@Nullable String predicate) {
        if (!isReserved(predicate)) {
            return false;
        }
        String suffix = predicate.toLowerCase(Locale.ROOT).substring(prefix.length());
        return ACL_PREDICATE_SUFFIXES.contains(suffix);
    }

    /**
     * Decides whether a predicate may be altered.
     *
     * @param predicate name as the caller wrote it
     * @param proposed  new definition, or null for a drop
     * @param current   existing definition, or null when the predicate has none
     */
    @NonNull
    public AlterDecision checkAlter(@NonNull String predicate, @Nullable String proposed, @Nullable String current) {
        if (!isReserved(predicate)) {
            return AlterDecision.allow();
        }
        if (proposed == null) {
            log.warn("Rejected drop of reserved predicate {}", StringSanitizer.forLog(predicate));
            return AlterDecision.deny("predicate " + predicate + " is reserved and is not allowed to be dropped");
        }
        if (current != null && normalize(proposed).equals(normalize(current))) {
            return AlterDecision.allow();
        }
        log.warn("Rejected modification of reserved predicate {}", StringSanitizer.forLog(predicate));
        return AlterDecision.deny("predicate " + predicate + " is reserved and is not allowed to be modified");
    }

    /**
     * Collapses whitespace and drops the optional statement terminator.
     */
    @NonNull
    static String normalize(@NonNull String definition) {
        String collapsed = WHITESPACE.matcher(definition.trim()).replaceAll(" ");
        if (collapsed.endsWith(".")) {
            collapsed = collapsed.substring(0, collapsed.length() - 1).trim();
        }
        return collapsed;
    }
}
