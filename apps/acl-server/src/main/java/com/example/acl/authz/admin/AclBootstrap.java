package com.example.acl.authz.admin;

import com.example.acl.authz.cache.PermissionCache;
import com.example.acl.authz.store.AclStoreOperations;
import com.example.acl.config.properties.AclProperties;
import com.example.acl.engine.SchemaOperations;
import com.example.acl.request.model.PredicateSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.lang.NonNull;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * First-start setup: installs the system predicates, creates the guardians group and the
 * groot user, then loads the permission cache. Safe to run on every start.
 */
@Slf4j
@Component
public class AclBootstrap implements ApplicationRunner {

    private static final Duration BOOTSTRAP_TIMEOUT = Duration.ofSeconds(30);

    private final AclStoreOperations store;
    private final SchemaOperations schemaOperations;
    private final PermissionCache cache;
    private final PasswordEncoder passwordEncoder;
    private final AclProperties properties;

    public AclBootstrap(
            AclStoreOperations store,
            SchemaOperations schemaOperations,
            PermissionCache cache,
            PasswordEncoder passwordEncoder,
            AclProperties properties) {
        this.store = store;
        this.schemaOperations = schemaOperations;
        this.cache = cache;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        bootstrap().block(BOOTSTRAP_TIMEOUT);
    }

    @NonNull
    public Mono<Void> bootstrap() {
        String guardians = properties.guardiansGroup();
        String groot = properties.grootUser();

        return schemaOperations.bootstrapReserved(systemSchema(properties.reservedPrefix()))
                .then(store.findGroup(guardians)
                        .switchIfEmpty(Mono.defer(() -> {
                            log.info("Creating group {}", guardians);
                            return store.createGroup(guardians);
                        })))
                .then(store.findUser(groot)
                        .switchIfEmpty(Mono.defer(() -> {
                            log.info("Creating user {}", groot);
                            return store.createUser(groot, passwordEncoder.encode(properties.grootPassword()));
                        })))
                .flatMap(user -> user.isMemberOf(guardians)
                        ? Mono.just(user)
                        : store.addUserToGroup(groot, guardians))
                .then(cache.refresh())
                .doOnNext(snapshot -> log.info("ACL bootstrap complete, snapshot generation {}", snapshot.generation()))
                .then();
    }

    /**
     * Predicates that hold the ACL graph and node types.
     */
    @NonNull
    static List<PredicateSchema> systemSchema(@NonNull String prefix) {
        return List.of(
                new PredicateSchema(prefix + "xid", "string @index(exact) @upsert"),
                new PredicateSchema(prefix + "password", "password"),
                new PredicateSchema(prefix + "user.group", "[uid] @reverse"),
                new PredicateSchema(prefix + "acl.rule", "[uid]"),
                new PredicateSchema(prefix + "rule.predicate", "string @index(exact) @upsert"),
                new PredicateSchema(prefix + "rule.permission", "int"),
                new PredicateSchema(prefix + "type", "[string] @index(exact)"));
    }
}
