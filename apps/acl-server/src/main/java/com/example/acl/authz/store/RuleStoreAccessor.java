package com.example.acl.authz.store;

import com.example.acl.authz.model.Membership;
import com.example.acl.authz.model.RuleEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.Comparator;

/**
 * Read-only view of the persisted rule graph used to build permission snapshots.
 * Does not cache and does not retry; a failed load surfaces as an error signal.
 */
@Component
@RequiredArgsConstructor
public class RuleStoreAccessor {

    private final AclStoreOperations store;

    /**
     * Every rule, ordered by group then predicate.
     */
    @NonNull
    public Flux<RuleEntry> loadAll() {
        return store.loadRules().sort(RuleEntry.BY_GROUP_THEN_PREDICATE);
    }

    @NonNull
    public Flux<Membership> loadMemberships() {
        return store.loadMemberships()
                .sort(Comparator.comparing(Membership::user).thenComparing(Membership::group));
    }
}
