package com.example.acl.authz.store;

import com.example.acl.authz.model.AclGroup;
import com.example.acl.authz.model.AclRule;
import com.example.acl.authz.model.AclUser;
import com.example.acl.authz.model.Membership;
import com.example.acl.authz.model.RuleEntry;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Persistent user/group/rule graph.
 * Implementations can use MongoDB (shared by every instance) or in-memory (single node) storage.
 */
public interface AclStoreOperations {

    /**
     * Streams every rule of every group.
     */
    @NonNull
    Flux<RuleEntry> loadRules();

    /**
     * Streams every user-to-group membership.
     */
    @NonNull
    Flux<Membership> loadMemberships();

    /**
     * Current group names of a user; empty when the user does not exist.
     */
    @NonNull
    Mono<Set<String>> loadUserGroups(@NonNull String userName);

    @NonNull
    Mono<AclUser> findUser(@NonNull String name);

    @NonNull
    Mono<AclGroup> findGroup(@NonNull String name);

    /**
     * Creates a user. Fails with {@link IllegalStateException} if the name is taken.
     */
    @NonNull
    Mono<AclUser> createUser(@NonNull String name, @NonNull String passwordHash);

    /**
     * Deletes a user and with it all of its memberships.
     */
    @NonNull
    Mono<Boolean> deleteUser(@NonNull String name);

    /**
     * Creates an empty group. Fails with {@link IllegalStateException} if the name is taken.
     */
    @NonNull
    Mono<AclGroup> createGroup(@NonNull String name);

    @NonNull
    Mono<AclUser> addUserToGroup(@NonNull String userName, @NonNull String groupName);

    @NonNull
    Mono<AclUser> removeUserFromGroup(@NonNull String userName, @NonNull String groupName);

    /**
     * Adds a rule to a group, replacing any existing rule on the same predicate.
     */
    @NonNull
    Mono<AclGroup> setRule(@NonNull String groupName, @NonNull AclRule rule);

    @NonNull
    Mono<AclGroup> removeRule(@NonNull String groupName, @NonNull String predicate);
}
