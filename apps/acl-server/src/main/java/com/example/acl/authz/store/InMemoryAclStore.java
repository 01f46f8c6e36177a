package com.example.acl.authz.store;

import com.example.acl.authz.model.AclGroup;
import com.example.acl.authz.model.AclRule;
import com.example.acl.authz.model.AclUser;
import com.example.acl.authz.model.Membership;
import com.example.acl.authz.model.RuleEntry;
import com.example.acl.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of AclStoreOperations for single-node deployments and tests.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.acl.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryAclStore implements AclStoreOperations {

    private final ConcurrentHashMap<String, AclUser> users = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AclGroup> groups = new ConcurrentHashMap<>();

    public InMemoryAclStore() {
        log.info("In-memory ACL store initialized (single-node mode)");
    }

    @Override
    @NonNull
    public Flux<RuleEntry> loadRules() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(groups.values())))
                .flatMapIterable(group -> group.rules().stream()
                        .map(rule -> RuleEntry.of(group.name(), rule))
                        .toList());
    }

    @Override
    @NonNull
    public Flux<Membership> loadMemberships() {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(users.values())))
                .flatMapIterable(user -> user.groups().stream()
                        .map(group -> new Membership(user.name(), group))
                        .toList());
    }

    @Override
    @NonNull
    public Mono<Set<String>> loadUserGroups(@NonNull String userName) {
        return Mono.fromCallable(() -> {
            AclUser user = users.get(userName);
            return user != null ? user.groups() : Set.<String>of();
        });
    }

    @Override
    @NonNull
    public Mono<AclUser> findUser(@NonNull String name) {
        return Mono.fromCallable(() -> users.get(name));
    }

    @Override
    @NonNull
    public Mono<AclGroup> findGroup(@NonNull String name) {
        return Mono.fromCallable(() -> groups.get(name));
    }

    @Override
    @NonNull
    public Mono<AclUser> createUser(@NonNull String name, @NonNull String passwordHash) {
        return Mono.fromCallable(() -> {
            AclUser created = new AclUser(name, passwordHash, Set.of());
            if (users.putIfAbsent(name, created) != null) {
                throw new IllegalStateException("user " + name + " already exists");
            }
            log.debug("Created user {}", StringSanitizer.forLog(name));
            return created;
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteUser(@NonNull String name) {
        return Mono.fromCallable(() -> users.remove(name) != null);
    }

    @Override
    @NonNull
    public Mono<AclGroup> createGroup(@NonNull String name) {
        return Mono.fromCallable(() -> {
            AclGroup created = AclGroup.named(name);
            if (groups.putIfAbsent(name, created) != null) {
                throw new IllegalStateException("group " + name + " already exists");
            }
            log.debug("Created group {}", StringSanitizer.forLog(name));
            return created;
        });
    }

    @Override
    @NonNull
    public Mono<AclUser> addUserToGroup(@NonNull String userName, @NonNull String groupName) {
        return Mono.fromCallable(() -> {
            requireGroup(groupName);
            return requireUpdated(userName, users.computeIfPresent(userName, (k, user) -> user.withGroup(groupName)));
        });
    }

    @Override
    @NonNull
    public Mono<AclUser> removeUserFromGroup(@NonNull String userName, @NonNull String groupName) {
        return Mono.fromCallable(() ->
                requireUpdated(userName, users.computeIfPresent(userName, (k, user) -> user.withoutGroup(groupName))));
    }

    @Override
    @NonNull
    public Mono<AclGroup> setRule(@NonNull String groupName, @NonNull AclRule rule) {
        return Mono.fromCallable(() -> {
            AclGroup updated = groups.computeIfPresent(groupName, (k, group) -> group.withRule(rule));
            if (updated == null) {
                throw new IllegalArgumentException("group " + groupName + " does not exist");
            }
            return updated;
        });
    }

    @Override
    @NonNull
    public Mono<AclGroup> removeRule(@NonNull String groupName, @NonNull String predicate) {
        return Mono.fromCallable(() -> {
            AclGroup updated = groups.computeIfPresent(groupName, (k, group) -> group.withoutRule(predicate));
            if (updated == null) {
                throw new IllegalArgumentException("group " + groupName + " does not exist");
            }
            return updated;
        });
    }

    private void requireGroup(String groupName) {
        if (!groups.containsKey(groupName)) {
            throw new IllegalArgumentException("group " + groupName + " does not exist");
        }
    }

    private AclUser requireUpdated(String userName, AclUser updated) {
        if (updated == null) {
            throw new IllegalArgumentException("user " + userName + " does not exist");
        }
        return updated;
    }
}
