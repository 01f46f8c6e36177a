package com.example.acl.authz.admin;

import com.example.acl.auth.model.Identity;
import com.example.acl.authz.model.AclGroup;
import com.example.acl.authz.model.AclRule;
import com.example.acl.authz.model.AclUser;
import com.example.acl.authz.model.Membership;
import com.example.acl.authz.store.AclStoreOperations;
import com.example.acl.common.util.StringSanitizer;
import com.example.acl.config.properties.AclProperties;
import com.example.acl.security.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Guardian-only management of users, groups and rules. A user may also read its own record.
 *
 * <p>Changes are written to the store only. They reach enforcement when each instance next
 * refreshes its permission cache.
 */
@Slf4j
@Service
public class AclAdminService {

    static final int MIN_PASSWORD_LENGTH = 6;

    private final AclStoreOperations store;
    private final PasswordEncoder passwordEncoder;
    private final String grootUser;
    private final String guardiansGroup;

    public AclAdminService(AclStoreOperations store, PasswordEncoder passwordEncoder, AclProperties properties) {
        this.store = store;
        this.passwordEncoder = passwordEncoder;
        this.grootUser = properties.grootUser();
        this.guardiansGroup = properties.guardiansGroup();
    }

    @NonNull
    public Mono<UserSummary> createUser(@NonNull Identity caller, @NonNull String name, @NonNull String password) {
        return requireGuardian(caller, "create users")
                .then(Mono.defer(() -> {
                    if (!StringSanitizer.isValidUserId(name)) {
                        return Mono.<AclUser>error(new IllegalArgumentException("invalid user name"));
                    }
                    if (password.length() < MIN_PASSWORD_LENGTH) {
                        return Mono.<AclUser>error(new IllegalArgumentException(
                                "password must have at least " + MIN_PASSWORD_LENGTH + " characters"));
                    }
                    return store.createUser(name, passwordEncoder.encode(password));
                }))
                .map(AclAdminService::summarize)
                .doOnNext(u -> log.info("User {} created by {}", StringSanitizer.forLog(name), caller.displayName()));
    }

    @NonNull
    public Mono<Boolean> deleteUser(@NonNull Identity caller, @NonNull String name) {
        return requireGuardian(caller, "delete users")
                .then(Mono.defer(() -> grootUser.equals(name)
                        ? Mono.<Boolean>error(new IllegalArgumentException("user " + grootUser + " cannot be deleted"))
                        : store.deleteUser(name)))
                .doOnNext(deleted -> log.info("User {} {} by {}", StringSanitizer.forLog(name),
                        deleted ? "deleted" : "not found, nothing deleted", caller.displayName()));
    }

    @NonNull
    public Mono<AclGroup> createGroup(@NonNull Identity caller, @NonNull String name) {
        return requireGuardian(caller, "create groups")
                .then(Mono.defer(() -> {
                    if (!StringSanitizer.isValidUserId(name)) {
                        return Mono.<AclGroup>error(new IllegalArgumentException("invalid group name"));
                    }
                    return store.createGroup(name);
                }))
                .doOnNext(g -> log.info("Group {} created by {}", StringSanitizer.forLog(name), caller.displayName()));
    }

    @NonNull
    public Mono<UserSummary> addUserToGroup(@NonNull Identity caller, @NonNull String user, @NonNull String group) {
        return requireGuardian(caller, "change memberships")
                .then(Mono.defer(() -> store.addUserToGroup(user, group)))
                .map(AclAdminService::summarize);
    }

    @NonNull
    public Mono<UserSummary> removeUserFromGroup(@NonNull Identity caller, @NonNull String user, @NonNull String group) {
        return requireGuardian(caller, "change memberships")
                .then(Mono.defer(() -> grootUser.equals(user) && guardiansGroup.equals(group)
                        ? Mono.<AclUser>error(new IllegalArgumentException(grootUser + " cannot leave " + guardiansGroup))
                        : store.removeUserFromGroup(user, group)))
                .map(AclAdminService::summarize);
    }

    /**
     * Grants a group a permission on a predicate, replacing any earlier grant on the same predicate.
     */
    @NonNull
    public Mono<AclGroup> setRule(@NonNull Identity caller, @NonNull String group, @NonNull AclRule rule) {
        return requireGuardian(caller, "change rules")
                .then(Mono.defer(() -> store.setRule(group, rule)))
                .doOnNext(g -> log.info("Rule {}={} set on group {} by {}", StringSanitizer.forLog(rule.predicate()),
                        rule.permission(), StringSanitizer.forLog(group), caller.displayName()));
    }

    @NonNull
    public Mono<AclGroup> removeRule(@NonNull Identity caller, @NonNull String group, @NonNull String predicate) {
        return requireGuardian(caller, "change rules")
                .then(Mono.defer(() -> store.removeRule(group, predicate)));
    }

    /**
     * A user's groups with their rules and members. Guardians may read anyone; other users only themselves.
     */
    @NonNull
    public Mono<UserDetails> describeUser(@NonNull Identity caller, @NonNull String name) {
        Mono<Void> allowed = !caller.anonymous() && name.equals(caller.userId())
                ? Mono.empty()
                : requireGuardian(caller, "read other users");
        return allowed
                .then(Mono.defer(() -> store.findUser(name)))
                .flatMap(this::describe);
    }

    private Mono<UserDetails> describe(AclUser user) {
        Mono<Map<String, List<String>>> membersByGroup = store.loadMemberships()
                .filter(membership -> user.groups().contains(membership.group()))
                .collectMultimap(Membership::group, Membership::user)
                .map(multimap -> {
                    Map<String, List<String>> sorted = new HashMap<>();
                    multimap.forEach((group, members) -> sorted.put(group, members.stream().sorted().toList()));
                    return sorted;
                });

        return membersByGroup.flatMap(members -> Flux.fromIterable(new TreeSet<>(user.groups()))
                .concatMap(group -> store.findGroup(group)
                        .map(found -> new UserDetails.GroupDetails(found.name(), found.rules(),
                                members.getOrDefault(group, List.of()))))
                .collectList()
                .map(groups -> new UserDetails(user.name(), groups)));
    }

    private static Mono<Void> requireGuardian(Identity caller, String action) {
        if (caller.guardian()) {
            return Mono.empty();
        }
        return Mono.error(new AuthorizationException(caller.userId(), null,
                "only guardians may " + action));
    }

    private static UserSummary summarize(AclUser user) {
        return new UserSummary(user.name(), user.groups());
    }
}
