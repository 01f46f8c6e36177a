package com.example.acl.authz.cache;

import com.example.acl.authz.model.AclRule;
import com.example.acl.authz.model.Membership;
import com.example.acl.authz.model.Permission;
import com.example.acl.authz.model.RuleEntry;
import com.example.acl.authz.store.InMemoryAclStore;
import com.example.acl.authz.store.RuleStoreAccessor;
import com.example.acl.observability.AclMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.util.function.Tuple2;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.acl.util.AclFixtures.aclProperties;
import static com.example.acl.util.AclFixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("PermissionCache")
class PermissionCacheTest {

    private SimpleMeterRegistry registry;
    private AclMetrics metrics;
    private InMemoryAclStore store;
    private PermissionCache cache;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AclMetrics(registry);
        store = new InMemoryAclStore();
        cache = new PermissionCache(new RuleStoreAccessor(store), metrics, aclProperties(), Clock.systemUTC());

        store.createGroup("dev").block();
        store.createUser("alice", "hash").block();
        store.addUserToGroup("alice", "dev").block();
    }

    @AfterEach
    void tearDown() {
        cache.stop();
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        @Test
        @DisplayName("should not see a new rule until the next refresh")
        void shouldApplyRulesOnlyOnRefresh() {
            cache.refresh().block();
            store.setRule("dev", AclRule.of("name", Permission.READ)).block();

            assertThat(cache.lookup("dev", "name")).isZero();

            cache.refresh().block();

            assertThat(cache.lookup("dev", "name")).isEqualTo(Permission.READ.code());
            assertThat(cache.lookupEffective(Set.of("dev"), "name")).isEqualTo(Permission.READ.code());
            assertThat(cache.groupsOf("alice")).containsExactly("dev");
        }

        @Test
        @DisplayName("should revert a revoked rule after the next refresh")
        void shouldRevertRevokedRule() {
            store.setRule("dev", AclRule.of("name", Permission.READ)).block();
            cache.refresh().block();
            store.removeRule("dev", "name").block();

            assertThat(cache.lookup("dev", "name")).isEqualTo(Permission.READ.code());

            cache.refresh().block();

            assertThat(cache.lookup("dev", "name")).isZero();
        }

        @Test
        @DisplayName("should increase the generation on every successful load")
        void shouldIncreaseGeneration() {
            long first = cache.refresh().block().generation();
            long second = cache.refresh().block().generation();

            assertThat(second).isGreaterThan(first);
            assertThat(registry.get("acl.cache.generation").gauge().value()).isEqualTo(second);
        }

        @Test
        @DisplayName("should keep the previous snapshot when loading fails")
        void shouldRetainSnapshotOnFailure() {
            RuleStoreAccessor accessor = mock(RuleStoreAccessor.class);
            when(accessor.loadAll()).thenReturn(Flux.just(rule("dev", "name", Permission.READ)));
            when(accessor.loadMemberships()).thenReturn(Flux.just(new Membership("alice", "dev")));
            PermissionCache failing = new PermissionCache(accessor, metrics, aclProperties(), Clock.systemUTC());
            PermissionSnapshot loaded = failing.refresh().block();

            when(accessor.loadAll()).thenReturn(Flux.error(new IllegalStateException("store unavailable")));

            StepVerifier.create(failing.refresh())
                    .assertNext(snapshot -> assertThat(snapshot).isSameAs(loaded))
                    .verifyComplete();

            assertThat(failing.lookup("dev", "name")).isEqualTo(Permission.READ.code());
            assertThat(registry.get("acl.cache.refresh").tag("outcome", "failure").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should share one load between concurrent refresh calls")
        void shouldBeSingleFlight() {
            AtomicInteger loads = new AtomicInteger();
            RuleStoreAccessor accessor = mock(RuleStoreAccessor.class);
            when(accessor.loadAll()).thenReturn(Flux.defer(() -> {
                loads.incrementAndGet();
                return Flux.<RuleEntry>empty().delaySubscription(Duration.ofMillis(200));
            }));
            when(accessor.loadMemberships()).thenReturn(Flux.empty());
            PermissionCache slow = new PermissionCache(accessor, metrics, aclProperties(), Clock.systemUTC());

            Tuple2<PermissionSnapshot, PermissionSnapshot> both = Mono.zip(slow.refresh(), slow.refresh()).block();

            assertThat(loads.get()).isEqualTo(1);
            assertThat(both.getT1()).isSameAs(both.getT2());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should pick up rules periodically until stopped")
        void shouldRefreshPeriodically() throws InterruptedException {
            cache.start(Duration.ofMillis(50));
            assertThat(cache.isRunning()).isTrue();

            store.setRule("dev", AclRule.of("age", Permission.READ, Permission.WRITE)).block();

            long deadline = System.currentTimeMillis() + 5000;
            while (cache.lookup("dev", "age") == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertThat(cache.lookup("dev", "age")).isEqualTo(6);

            cache.stop();

            assertThat(cache.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should run independent instances side by side")
        void shouldRunIndependentInstances() {
            PermissionCache other = new PermissionCache(new RuleStoreAccessor(store), metrics, aclProperties(), Clock.systemUTC());
            store.setRule("dev", AclRule.of("name", Permission.READ)).block();

            cache.refresh().block();

            assertThat(cache.lookup("dev", "name")).isEqualTo(Permission.READ.code());
            assertThat(other.lookup("dev", "name")).isZero();
        }
    }
}
