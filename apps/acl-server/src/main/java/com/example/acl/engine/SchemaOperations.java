package com.example.acl.engine;

import com.example.acl.request.model.PredicateSchema;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Predicate schema management.
 */
public interface SchemaOperations {

    /**
     * Current definition of a predicate; empty when it has none.
     */
    @NonNull
    Mono<String> getSchema(@NonNull String predicate);

    @NonNull
    Mono<Void> applySchemaAlter(@NonNull String predicate, @NonNull String definition);

    /**
     * Removes the predicate's schema and all of its data.
     */
    @NonNull
    Mono<Void> drop(@NonNull String predicate);

    /**
     * Removes all data and every schema entry except the bootstrapped system predicates.
     */
    @NonNull
    Mono<Void> dropAll();

    @NonNull
    Flux<PredicateSchema> listSchema();

    /**
     * Installs system predicates unconditionally. Only called at startup, never on behalf of a caller.
     */
    @NonNull
    Mono<Void> bootstrapReserved(@NonNull List<PredicateSchema> schema);
}
