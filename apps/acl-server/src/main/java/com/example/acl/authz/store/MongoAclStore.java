package com.example.acl.authz.store;

import com.example.acl.authz.model.AclGroup;
import com.example.acl.authz.model.AclRule;
import com.example.acl.authz.model.AclUser;
import com.example.acl.authz.model.Membership;
import com.example.acl.authz.model.RuleEntry;
import com.example.acl.authz.store.document.AclGroupDoc;
import com.example.acl.authz.store.document.AclUserDoc;
import com.example.acl.authz.store.repository.AclGroupRepository;
import com.example.acl.authz.store.repository.AclUserRepository;
import com.example.acl.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * MongoDB implementation of AclStoreOperations, shared by every server instance.
 * Each instance's permission cache reloads from here on its own schedule.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.acl.store", havingValue = "mongo")
public class MongoAclStore implements AclStoreOperations {

    static final int MAX_CONFLICT_RETRIES = 5;

    private static final Duration CONFLICT_BACKOFF = Duration.ofMillis(20);

    private final AclUserRepository userRepository;
    private final AclGroupRepository groupRepository;

    public MongoAclStore(AclUserRepository userRepository, AclGroupRepository groupRepository) {
        this.userRepository = userRepository;
        this.groupRepository = groupRepository;
        log.info("MongoDB ACL store initialized");
    }

    @Override
    @NonNull
    public Flux<RuleEntry> loadRules() {
        return groupRepository.findAllByOrderByNameAsc()
                .flatMapIterable(doc -> toModel(doc).rules().stream()
                        .map(rule -> RuleEntry.of(doc.getName(), rule))
                        .toList());
    }

    @Override
    @NonNull
    public Flux<Membership> loadMemberships() {
        return userRepository.findAll()
                .flatMapIterable(doc -> doc.getGroups().stream()
                        .map(group -> new Membership(doc.getName(), group))
                        .toList());
    }

    @Override
    @NonNull
    public Mono<Set<String>> loadUserGroups(@NonNull String userName) {
        return userRepository.findById(userName)
                .map(doc -> Set.copyOf(doc.getGroups()))
                .defaultIfEmpty(Set.of());
    }

    @Override
    @NonNull
    public Mono<AclUser> findUser(@NonNull String name) {
        return userRepository.findById(name).map(this::toModel);
    }

    @Override
    @NonNull
    public Mono<AclGroup> findGroup(@NonNull String name) {
        return groupRepository.findById(name).map(this::toModel);
    }

    @Override
    @NonNull
    public Mono<AclUser> createUser(@NonNull String name, @NonNull String passwordHash) {
        AclUserDoc doc = AclUserDoc.builder()
                .name(name)
                .passwordHash(passwordHash)
                .createdAt(Instant.now())
                .build();
        return userRepository.insert(doc)
                .onErrorMap(DuplicateKeyException.class,
                        e -> new IllegalStateException("user " + name + " already exists", e))
                .doOnSuccess(saved -> log.debug("Created user {}", StringSanitizer.forLog(name)))
                .map(this::toModel);
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteUser(@NonNull String name) {
        return userRepository.existsById(name)
                .flatMap(exists -> exists
                        ? userRepository.deleteById(name).thenReturn(true)
                        : Mono.just(false));
    }

    @Override
    @NonNull
    public Mono<AclGroup> createGroup(@NonNull String name) {
        AclGroupDoc doc = AclGroupDoc.builder()
                .name(name)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        return groupRepository.insert(doc)
                .onErrorMap(DuplicateKeyException.class,
                        e -> new IllegalStateException("group " + name + " already exists", e))
                .map(this::toModel);
    }

    @Override
    @NonNull
    public Mono<AclUser> addUserToGroup(@NonNull String userName, @NonNull String groupName) {
        return groupRepository.existsById(groupName)
                .flatMap(exists -> exists
                        ? updateUser(userName, groups -> {
                            if (!groups.contains(groupName)) {
                                groups.add(groupName);
                            }
                        })
                        : Mono.<AclUser>error(new IllegalArgumentException("group " + groupName + " does not exist")));
    }

    @Override
    @NonNull
    public Mono<AclUser> removeUserFromGroup(@NonNull String userName, @NonNull String groupName) {
        return updateUser(userName, groups -> groups.remove(groupName));
    }

    @Override
    @NonNull
    public Mono<AclGroup> setRule(@NonNull String groupName, @NonNull AclRule rule) {
        return updateGroup(groupName, group -> group.withRule(rule));
    }

    @Override
    @NonNull
    public Mono<AclGroup> removeRule(@NonNull String groupName, @NonNull String predicate) {
        return updateGroup(groupName, group -> group.withoutRule(predicate));
    }

    private Mono<AclGroup> updateGroup(String groupName, UnaryOperator<AclGroup> change) {
        Mono<AclGroupDoc> attempt = Mono.defer(() -> groupRepository.findById(groupName)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("group " + groupName + " does not exist")))
                .flatMap(doc -> {
                    AclGroup updated = change.apply(toModel(doc));
                    doc.setRules(updated.rules().stream()
                            .map(rule -> new AclGroupDoc.RuleDoc(rule.predicate(), rule.permission()))
                            .toList());
                    doc.setUpdatedAt(Instant.now());
                    return groupRepository.save(doc);
                }));
        return retryOnConflict(attempt, "group " + groupName).map(this::toModel);
    }

    private Mono<AclUser> updateUser(String userName, Consumer<List<String>> change) {
        Mono<AclUserDoc> attempt = Mono.defer(() -> requireUser(userName)
                .flatMap(doc -> {
                    List<String> groups = new ArrayList<>(doc.getGroups());
                    change.accept(groups);
                    doc.setGroups(groups);
                    return userRepository.save(doc);
                }));
        return retryOnConflict(attempt, "user " + userName).map(this::toModel);
    }

    /**
     * Re-runs a read-modify-write cycle when another writer saved the document in between.
     */
    private <T> Mono<T> retryOnConflict(Mono<T> attempt, String target) {
        return attempt.retryWhen(Retry.backoff(MAX_CONFLICT_RETRIES, CONFLICT_BACKOFF)
                .filter(OptimisticLockingFailureException.class::isInstance)
                .doBeforeRetry(signal -> log.warn("Concurrent update of {}, retry {}",
                        StringSanitizer.forLog(target), signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> new IllegalStateException(
                        target + " is being modified concurrently, try again", signal.failure())));
    }

    private Mono<AclUserDoc> requireUser(String userName) {
        return userRepository.findById(userName)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("user " + userName + " does not exist")));
    }

    private AclUser toModel(AclUserDoc doc) {
        return new AclUser(doc.getName(), doc.getPasswordHash(), Set.copyOf(doc.getGroups()));
    }

    private AclGroup toModel(AclGroupDoc doc) {
        return new AclGroup(doc.getName(), doc.getRules().stream()
                .map(rule -> new AclRule(rule.getPredicate(), rule.getPermission()))
                .toList());
    }
}
