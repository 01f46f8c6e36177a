package com.example.acl.authz.cache;

import com.example.acl.authz.store.RuleStoreAccessor;
import com.example.acl.config.properties.AclProperties;
import com.example.acl.observability.AclMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local permission cache.
 *
 * <p>Readers always get the currently published {@link PermissionSnapshot} without blocking.
 * A background task rebuilds the snapshot from the rule store every refresh interval and
 * swaps it in atomically. When a load fails the previous snapshot stays authoritative.
 * Instances do not coordinate, so a grant becomes visible on each instance at its next
 * refresh.
 */
@Slf4j
@Component
public class PermissionCache implements SmartLifecycle {

    private final RuleStoreAccessor accessor;
    private final AclMetrics metrics;
    private final Duration configuredInterval;
    private final Clock clock;

    private final AtomicReference<PermissionSnapshot> current = new AtomicReference<>(PermissionSnapshot.empty());
    private final AtomicReference<Mono<PermissionSnapshot>> inFlight = new AtomicReference<>();
    private final AtomicLong generations = new AtomicLong();

    private volatile Scheduler scheduler;
    private volatile Disposable refreshTask;

    public PermissionCache(RuleStoreAccessor accessor, AclMetrics metrics, AclProperties properties, Clock clock) {
        this.accessor = accessor;
        this.metrics = metrics;
        this.configuredInterval = properties.refreshInterval();
        this.clock = clock;
    }

    @NonNull
    public PermissionSnapshot snapshot() {
        return current.get();
    }

    public int lookup(@NonNull String group, @NonNull String predicate) {
        return current.get().lookup(group, predicate);
    }

    public int lookupEffective(@NonNull Collection<String> groups, @NonNull String predicate) {
        return current.get().lookupEffective(groups, predicate);
    }

    @NonNull
    public Set<String> groupsOf(@NonNull String user) {
        return current.get().groupsOf(user);
    }

    /**
     * Reloads the snapshot. Concurrent callers share the load already running.
     * Never errors: on failure the returned snapshot is the retained one.
     */
    @NonNull
    public Mono<PermissionSnapshot> refresh() {
        return Mono.defer(() -> {
            Mono<PermissionSnapshot> running = inFlight.get();
            if (running != null) {
                return running;
            }
            Mono<PermissionSnapshot> load = loadAndPublish()
                    .doFinally(signal -> inFlight.set(null))
                    .cache();
            Mono<PermissionSnapshot> witness = inFlight.compareAndExchange(null, load);
            return witness != null ? witness : load;
        });
    }

    private Mono<PermissionSnapshot> loadAndPublish() {
        return Mono.zip(accessor.loadAll().collectList(), accessor.loadMemberships().collectList())
                .map(loaded -> PermissionSnapshot.build(
                        generations.incrementAndGet(), clock.instant(), loaded.getT1(), loaded.getT2()))
                .doOnNext(snapshot -> {
                    current.set(snapshot);
                    metrics.recordRefreshSuccess(snapshot.generation(), snapshot.ruleCount());
                    log.debug("Published {}", snapshot);
                })
                .onErrorResume(e -> {
                    PermissionSnapshot retained = current.get();
                    metrics.recordRefreshFailure();
                    log.warn("ACL refresh failed, keeping snapshot generation {}: {}",
                            retained.generation(), e.getMessage());
                    return Mono.just(retained);
                });
    }

    /**
     * Starts periodic refresh, loading immediately and then every {@code interval}.
     */
    public synchronized void start(@NonNull Duration interval) {
        if (refreshTask != null && !refreshTask.isDisposed()) {
            log.debug("ACL refresh already running");
            return;
        }
        scheduler = Schedulers.newSingle("acl-cache-refresh", true);
        refreshTask = Flux.interval(Duration.ZERO, interval, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> refresh())
                .subscribe();
        log.info("ACL cache refresh started (interval={})", interval);
    }

    public synchronized void stop() {
        if (refreshTask != null) {
            refreshTask.dispose();
            refreshTask = null;
        }
        if (scheduler != null) {
            scheduler.dispose();
            scheduler = null;
        }
        log.info("ACL cache refresh stopped");
    }

    @Override
    public void start() {
        start(configuredInterval);
    }

    @Override
    public boolean isRunning() {
        Disposable task = refreshTask;
        return task != null && !task.isDisposed();
    }
}
