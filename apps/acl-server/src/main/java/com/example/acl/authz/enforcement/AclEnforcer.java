package com.example.acl.authz.enforcement;

import com.example.acl.auth.model.Identity;
import com.example.acl.authz.audit.AclAuditService;
import com.example.acl.authz.cache.PermissionCache;
import com.example.acl.authz.guard.AlterDecision;
import com.example.acl.authz.guard.ReservedPredicateGuard;
import com.example.acl.authz.model.Permission;
import com.example.acl.common.util.StringSanitizer;
import com.example.acl.request.model.AlterRequest;
import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.NQuad;
import com.example.acl.request.model.PredicateSchema;
import com.example.acl.request.model.QueryRequest;
import com.example.acl.security.exception.AuthenticationException;
import com.example.acl.security.exception.AuthorizationException;
import com.example.acl.security.exception.ReservedPredicateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides, per request kind, what an identity may do with the predicates a request names.
 *
 * <ul>
 *   <li>Query: unreadable clauses are removed silently. An anonymous caller whose root function
 *       is unreadable gets {@code PermissionDenied} instead of an empty block.</li>
 *   <li>Mutation: WRITE on every predicate or the whole request is rejected.</li>
 *   <li>Alter: reserved-namespace check first, then MODIFY on every predicate.</li>
 *   <li>Schema read: any logged-in caller.</li>
 * </ul>
 *
 * Guardians skip every predicate check but not the reserved-namespace check.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AclEnforcer {

    private final PermissionCache cache;
    private final ReservedPredicateGuard guard;
    private final AclAuditService audit;

    public boolean canRead(@NonNull Identity identity, @NonNull String predicate) {
        return isGranted(identity, predicate, Permission.READ);
    }

    public boolean canWrite(@NonNull Identity identity, @NonNull String predicate) {
        return isGranted(identity, predicate, Permission.WRITE);
    }

    public boolean canModify(@NonNull Identity identity, @NonNull String predicate) {
        return isGranted(identity, predicate, Permission.MODIFY);
    }

    private boolean isGranted(Identity identity, String predicate, Permission permission) {
        if (identity.guardian()) {
            return true;
        }
        if (identity.anonymous() || guard.isAclPredicate(predicate)) {
            return false;
        }
        return permission.isGrantedBy(cache.lookupEffective(identity.groups(), predicate));
    }

    /**
     * @return the query with every unreadable clause removed
     * @throws AuthorizationException for an anonymous caller whose root function is unreadable
     */
    @NonNull
    public QueryRequest authorizeQuery(@NonNull Identity identity, @NonNull QueryRequest query) {
        if (identity.guardian()) {
            audit.allowed(RequestKind.QUERY, identity, List.of());
            return query;
        }

        QueryRewriter.Result result = QueryRewriter.rewrite(query, predicate -> canRead(identity, predicate));

        if (identity.anonymous() && !result.deniedRoots().isEmpty()) {
            String alias = result.deniedRoots().get(0);
            String predicate = query.blocks().stream()
                    .filter(b -> b.alias().equals(alias))
                    .findFirst()
                    .map(b -> b.root().predicate())
                    .orElse(alias);
            audit.denied(RequestKind.QUERY, identity, List.of(predicate), "anonymous root read");
            throw AuthorizationException.unauthorizedTo("read", null, predicate);
        }

        if (result.isUnchanged()) {
            audit.allowed(RequestKind.QUERY, identity, List.of());
        } else {
            List<String> removed = new ArrayList<>(result.elided());
            removed.addAll(result.deniedRoots());
            log.debug("Query by {} rewritten: {} blocks dropped, {} predicates elided",
                    StringSanitizer.forLog(identity.displayName()), result.deniedRoots().size(), result.elided().size());
            audit.elided(RequestKind.QUERY, identity, removed);
        }
        return result.query();
    }

    /**
     * @throws AuthorizationException naming the first predicate the caller may not write
     */
    public void authorizeMutation(@NonNull Identity identity, @NonNull MutationRequest mutation) {
        Set<String> predicates = mutation.writtenPredicates();
        if (identity.guardian()) {
            audit.allowed(RequestKind.MUTATION, identity, predicates);
            return;
        }

        // Deleting every edge of a node touches predicates we cannot enumerate.
        if (mutation.hasWildcardDelete()) {
            audit.denied(RequestKind.MUTATION, identity, List.of(NQuad.WILDCARD), "wildcard delete");
            throw AuthorizationException.unauthorizedTo("mutate", identity.userId(), NQuad.WILDCARD);
        }

        for (String predicate : predicates) {
            if (!canWrite(identity, predicate)) {
                audit.denied(RequestKind.MUTATION, identity, List.of(predicate), "missing WRITE");
                throw AuthorizationException.unauthorizedTo("mutate", identity.userId(), predicate);
            }
        }
        audit.allowed(RequestKind.MUTATION, identity, predicates);
    }

    /**
     * @param currentSchema current definition of each predicate the request touches that has one
     * @throws ReservedPredicateException when a reserved predicate would change or be dropped
     * @throws AuthorizationException     naming the first predicate the caller may not modify
     */
    public void authorizeAlter(
            @NonNull Identity identity,
            @NonNull AlterRequest alter,
            @NonNull Map<String, String> currentSchema) {

        for (PredicateSchema entry : alter.schema()) {
            rejectIfReserved(identity, guard.checkAlter(
                    entry.predicate(), entry.definition(), currentSchema.get(entry.predicate())), entry.predicate());
        }
        if (alter.dropAttr() != null) {
            rejectIfReserved(identity, guard.checkAlter(
                    alter.dropAttr(), null, currentSchema.get(alter.dropAttr())), alter.dropAttr());
        }

        Set<String> predicates = alter.modifiedPredicates();
        if (identity.guardian()) {
            audit.allowed(RequestKind.ALTER, identity, predicates);
            return;
        }

        if (alter.dropAll()) {
            audit.denied(RequestKind.ALTER, identity, List.of(), "drop all");
            throw new AuthorizationException(identity.userId(), null, "only guardians may drop all data");
        }

        for (String predicate : predicates) {
            if (!canModify(identity, predicate)) {
                audit.denied(RequestKind.ALTER, identity, List.of(predicate), "missing MODIFY");
                throw AuthorizationException.unauthorizedTo("alter", identity.userId(), predicate);
            }
        }
        audit.allowed(RequestKind.ALTER, identity, predicates);
    }

    private void rejectIfReserved(Identity identity, AlterDecision decision, String predicate) {
        if (!decision.allowed()) {
            audit.denied(RequestKind.ALTER, identity, List.of(predicate), decision.reason());
            throw new ReservedPredicateException(predicate, decision.reason());
        }
    }

    /**
     * @throws AuthenticationException {@code Unauthenticated} for anonymous callers
     */
    public void authorizeSchemaRead(@NonNull Identity identity) {
        if (identity.anonymous()) {
            audit.denied(RequestKind.SCHEMA, identity, List.of(), "not logged in");
            throw AuthenticationException.unauthenticated("schema queries require a logged-in user");
        }
        audit.allowed(RequestKind.SCHEMA, identity, List.of());
    }
}
