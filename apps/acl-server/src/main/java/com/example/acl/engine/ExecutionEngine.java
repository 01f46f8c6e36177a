package com.example.acl.engine;

import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.QueryRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Evaluates requests that have already passed access control.
 * Implementations know nothing about users or permissions.
 */
public interface ExecutionEngine {

    /**
     * Evaluates every block of the query. Blocks that select nothing are left out of the result.
     */
    @NonNull
    Mono<ObjectNode> query(@NonNull QueryRequest request);

    /**
     * Applies all deletes then all sets atomically.
     *
     * @return node ids assigned to the request's blank nodes
     */
    @NonNull
    Mono<MutationResult> mutate(@NonNull MutationRequest request);
}
