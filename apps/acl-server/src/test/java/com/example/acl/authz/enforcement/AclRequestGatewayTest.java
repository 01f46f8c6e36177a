package com.example.acl.authz.enforcement;

import com.example.acl.authz.audit.AclAuditService;
import com.example.acl.authz.cache.PermissionCache;
import com.example.acl.authz.guard.ReservedPredicateGuard;
import com.example.acl.authz.model.AclRule;
import com.example.acl.authz.model.Permission;
import com.example.acl.authz.store.InMemoryAclStore;
import com.example.acl.authz.store.RuleStoreAccessor;
import com.example.acl.engine.memory.InMemoryGraphEngine;
import com.example.acl.observability.AclMetrics;
import com.example.acl.request.model.AlterRequest;
import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.PredicateSchema;
import com.example.acl.request.model.QueryBlock;
import com.example.acl.request.model.QueryRequest;
import com.example.acl.request.model.RootFunction;
import com.example.acl.request.parser.NQuadParser;
import com.example.acl.security.exception.AuthorizationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.List;

import static com.example.acl.util.AclFixtures.aclProperties;
import static com.example.acl.util.AclFixtures.guardian;
import static com.example.acl.util.AclFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AclRequestGateway")
class AclRequestGatewayTest {

    private InMemoryAclStore store;
    private PermissionCache cache;
    private InMemoryGraphEngine engine;
    private AclRequestGateway gateway;

    @BeforeEach
    void setUp() {
        AclMetrics metrics = new AclMetrics(new SimpleMeterRegistry());
        store = new InMemoryAclStore();
        cache = new PermissionCache(new RuleStoreAccessor(store), metrics, aclProperties(), Clock.systemUTC());
        engine = new InMemoryGraphEngine(new ObjectMapper());
        AclEnforcer enforcer = new AclEnforcer(cache, new ReservedPredicateGuard(aclProperties()),
                new AclAuditService(new ObjectMapper(), metrics, Clock.systemUTC()));
        gateway = new AclRequestGateway(enforcer, engine, engine);

        store.createGroup("dev").block();
        store.setRule("dev", AclRule.of("name", Permission.READ, Permission.WRITE)).block();
        cache.refresh().block();
    }

    @Test
    @DisplayName("should not reach the engine when a mutation is denied")
    void shouldNotApplyDeniedMutation() {
        MutationRequest mutation = MutationRequest.ofSet(NQuadParser.parse("_:a <name> \"A\" .\n_:a <age> \"3\" ."));

        StepVerifier.create(gateway.mutate(user("alice", "dev"), mutation))
                .expectError(AuthorizationException.class)
                .verify();

        assertThat(engine.getSchema("name").blockOptional()).isEmpty();
    }

    @Test
    @DisplayName("should write and read back permitted predicates")
    void shouldRoundTripPermittedData() {
        StepVerifier.create(gateway.mutate(user("alice", "dev"), MutationRequest.ofSet(NQuadParser.parse("_:a <name> \"A\" ."))))
                .assertNext(result -> assertThat(result.uids()).containsKey("a"))
                .verifyComplete();

        QueryRequest query = QueryRequest.of(QueryBlock.builder("q", RootFunction.has("name")).field("name").build());
        StepVerifier.create(gateway.query(user("alice", "dev"), query))
                .assertNext(data -> assertThat(data.at("/q/0/name").asText()).isEqualTo("A"))
                .verifyComplete();
    }

    @Test
    @DisplayName("should reject an empty mutation")
    void shouldRejectEmptyMutation() {
        StepVerifier.create(gateway.mutate(guardian("groot"), new MutationRequest(List.of(), List.of())))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    @DisplayName("should apply a guardian alter and drop")
    void shouldApplyAlter() {
        gateway.alter(guardian("groot"), AlterRequest.schema(List.of(new PredicateSchema("age", "int")))).block();
        assertThat(engine.getSchema("age").block()).isEqualTo("int");

        gateway.alter(guardian("groot"), AlterRequest.drop("age")).block();
        assertThat(engine.getSchema("age").blockOptional()).isEmpty();
    }

    @Test
    @DisplayName("should list the schema to logged-in users")
    void shouldListSchema() {
        engine.applySchemaAlter("name", "string").block();

        StepVerifier.create(gateway.schema(user("alice", "dev")))
                .expectNext(new PredicateSchema("name", "string"))
                .verifyComplete();
    }
}
