package com.example.acl.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for the ACL engine.
 * Tag values come from fixed vocabularies (request kind, outcome) so cardinality stays bounded.
 */
@Component
public class AclMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;

    private final Counter refreshSuccess;
    private final Counter refreshFailure;
    private final Counter loginSuccess;
    private final Counter loginFailure;
    private final Counter tokenRefresh;
    private final Counter tokenRefreshFailure;

    private final AtomicLong snapshotGeneration = new AtomicLong();
    private final AtomicLong snapshotRules = new AtomicLong();
    private final ConcurrentHashMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();

    public AclMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.refreshSuccess = Counter.builder("acl.cache.refresh")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Permission snapshot reloads")
                .register(registry);

        this.refreshFailure = Counter.builder("acl.cache.refresh")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Failed permission snapshot reloads")
                .register(registry);

        this.loginSuccess = Counter.builder("auth.login")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Successful logins")
                .register(registry);

        this.loginFailure = Counter.builder("auth.login")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Failed logins")
                .register(registry);

        this.tokenRefresh = Counter.builder("auth.token.refresh")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Refresh tokens redeemed")
                .register(registry);

        this.tokenRefreshFailure = Counter.builder("auth.token.refresh")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Rejected refresh attempts")
                .register(registry);

        Gauge.builder("acl.cache.generation", snapshotGeneration, AtomicLong::get)
                .description("Generation of the published permission snapshot")
                .register(registry);

        Gauge.builder("acl.cache.rules", snapshotRules, AtomicLong::get)
                .description("Rules held by the published permission snapshot")
                .register(registry);
    }

    public void recordRefreshSuccess(long generation, long ruleCount) {
        refreshSuccess.increment();
        snapshotGeneration.set(generation);
        snapshotRules.set(ruleCount);
    }

    public void recordRefreshFailure() {
        refreshFailure.increment();
    }

    public void recordLogin(boolean success) {
        (success ? loginSuccess : loginFailure).increment();
    }

    public void recordTokenRefresh(boolean success) {
        (success ? tokenRefresh : tokenRefreshFailure).increment();
    }

    /**
     * Records an enforcement decision.
     *
     * @param request request kind: query, mutation, alter or schema
     * @param outcome allow, deny or elided
     */
    public void recordDecision(@NonNull String request, @NonNull String outcome) {
        decisionCounters.computeIfAbsent(request + ":" + outcome, key -> Counter.builder("acl.decision")
                .tag("request", request)
                .tag("outcome", outcome)
                .description("Enforcement decisions")
                .register(registry))
                .increment();
    }
}
