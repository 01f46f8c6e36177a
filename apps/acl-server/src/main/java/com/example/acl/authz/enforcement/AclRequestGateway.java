package com.example.acl.authz.enforcement;

import com.example.acl.auth.model.Identity;
import com.example.acl.engine.ExecutionEngine;
import com.example.acl.engine.MutationResult;
import com.example.acl.engine.SchemaOperations;
import com.example.acl.request.model.AlterRequest;
import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.PredicateSchema;
import com.example.acl.request.model.QueryRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Entry point for data requests: authorizes with {@link AclEnforcer}, then hands the
 * (possibly rewritten) request to the engine. Nothing reaches the engine unauthorized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AclRequestGateway {

    private final AclEnforcer enforcer;
    private final ExecutionEngine engine;
    private final SchemaOperations schemaOperations;

    @NonNull
    public Mono<ObjectNode> query(@NonNull Identity identity, @NonNull QueryRequest query) {
        return Mono.fromCallable(() -> enforcer.authorizeQuery(identity, query))
                .flatMap(engine::query);
    }

    @NonNull
    public Mono<MutationResult> mutate(@NonNull Identity identity, @NonNull MutationRequest mutation) {
        if (mutation.isEmpty()) {
            return Mono.error(new IllegalArgumentException("mutation has no set or delete triples"));
        }
        return Mono.fromRunnable(() -> enforcer.authorizeMutation(identity, mutation))
                .then(Mono.defer(() -> engine.mutate(mutation)));
    }

    @NonNull
    public Mono<Void> alter(@NonNull Identity identity, @NonNull AlterRequest alter) {
        if (!alter.dropAll() && alter.dropAttr() == null && alter.schema().isEmpty()) {
            return Mono.error(new IllegalArgumentException("alter has no schema, drop_attr or drop_all"));
        }
        return currentSchema(alter)
                .doOnNext(current -> enforcer.authorizeAlter(identity, alter, current))
                .then(Mono.defer(() -> apply(alter)));
    }

    @NonNull
    public Flux<PredicateSchema> schema(@NonNull Identity identity) {
        return Mono.fromRunnable(() -> enforcer.authorizeSchemaRead(identity))
                .thenMany(schemaOperations.listSchema());
    }

    private Mono<Map<String, String>> currentSchema(AlterRequest alter) {
        return Flux.fromIterable(alter.modifiedPredicates())
                .flatMap(predicate -> schemaOperations.getSchema(predicate)
                        .map(definition -> Map.entry(predicate, definition)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private Mono<Void> apply(AlterRequest alter) {
        if (alter.dropAll()) {
            log.info("Dropping all data");
            return schemaOperations.dropAll();
        }
        Mono<Void> drop = alter.dropAttr() != null ? schemaOperations.drop(alter.dropAttr()) : Mono.empty();
        return drop.thenMany(Flux.fromIterable(alter.schema())
                        .concatMap(entry -> schemaOperations.applySchemaAlter(entry.predicate(), entry.definition())))
                .then();
    }
}
