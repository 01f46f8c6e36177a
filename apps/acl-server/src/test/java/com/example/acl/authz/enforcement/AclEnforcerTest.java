package com.example.acl.authz.enforcement;

import com.example.acl.auth.model.Identity;
import com.example.acl.authz.audit.AclAuditService;
import com.example.acl.authz.cache.PermissionCache;
import com.example.acl.authz.guard.ReservedPredicateGuard;
import com.example.acl.authz.model.AclRule;
import com.example.acl.authz.model.Permission;
import com.example.acl.authz.store.InMemoryAclStore;
import com.example.acl.authz.store.RuleStoreAccessor;
import com.example.acl.observability.AclMetrics;
import com.example.acl.request.model.AlterRequest;
import com.example.acl.request.model.Field;
import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.NQuad;
import com.example.acl.request.model.PredicateSchema;
import com.example.acl.request.model.QueryBlock;
import com.example.acl.request.model.QueryRequest;
import com.example.acl.request.model.RootFunction;
import com.example.acl.security.exception.AclErrorKind;
import com.example.acl.security.exception.AuthenticationException;
import com.example.acl.security.exception.AuthorizationException;
import com.example.acl.security.exception.ReservedPredicateException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static com.example.acl.util.AclFixtures.aclProperties;
import static com.example.acl.util.AclFixtures.anonymous;
import static com.example.acl.util.AclFixtures.guardian;
import static com.example.acl.util.AclFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AclEnforcer")
class AclEnforcerTest {

    private static final String XID_SCHEMA = "string @index(exact) @upsert";

    private SimpleMeterRegistry registry;
    private InMemoryAclStore store;
    private PermissionCache cache;
    private AclEnforcer enforcer;

    private final Identity alice = user("alice", "dev");
    private final Identity loner = user("bob");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        AclMetrics metrics = new AclMetrics(registry);
        store = new InMemoryAclStore();
        cache = new PermissionCache(new RuleStoreAccessor(store), metrics, aclProperties(), Clock.systemUTC());
        AclAuditService audit = new AclAuditService(new ObjectMapper(), metrics, Clock.systemUTC());
        enforcer = new AclEnforcer(cache, new ReservedPredicateGuard(aclProperties()), audit);

        store.createGroup("dev").block();
        store.createUser("alice", "hash").block();
        store.addUserToGroup("alice", "dev").block();
        cache.refresh().block();
    }

    private void grant(String predicate, Permission... permissions) {
        store.setRule("dev", AclRule.of(predicate, permissions)).block();
        cache.refresh().block();
    }

    private static QueryRequest nameAndAgeQuery() {
        return QueryRequest.of(QueryBlock.builder("me", RootFunction.has("name"))
                .field("name")
                .field("age")
                .build());
    }

    private double decisions(String request, String outcome) {
        return registry.get("acl.decision").tag("request", request).tag("outcome", outcome).counter().count();
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("should remove every clause for a user with no rules")
        void shouldEmptyQueryWithoutRules() {
            QueryRequest rewritten = enforcer.authorizeQuery(loner, nameAndAgeQuery());

            assertThat(rewritten.blocks()).isEmpty();
            assertThat(decisions("query", "elided")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep readable fields and elide the rest")
        void shouldElideUnreadableField() {
            grant("name", Permission.READ);

            QueryRequest rewritten = enforcer.authorizeQuery(alice, nameAndAgeQuery());

            assertThat(rewritten.blocks()).hasSize(1);
            assertThat(rewritten.blocks().get(0).fields()).extracting(Field::predicate).containsExactly("name");
        }

        @Test
        @DisplayName("should drop a block rooted on an unreadable predicate")
        void shouldDropBlockWithUnreadableRoot() {
            grant("name", Permission.READ);
            QueryRequest query = QueryRequest.of(QueryBlock.builder("me", RootFunction.has("age"))
                    .field("name")
                    .build());

            assertThat(enforcer.authorizeQuery(alice, query).blocks()).isEmpty();
        }

        @Test
        @DisplayName("should pass a guardian query through untouched")
        void shouldNotRewriteForGuardian() {
            QueryRequest query = nameAndAgeQuery();

            assertThat(enforcer.authorizeQuery(guardian("groot"), query)).isSameAs(query);
            assertThat(decisions("query", "allow")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should deny an anonymous caller whose root is unreadable")
        void shouldDenyAnonymousRoot() {
            assertThatThrownBy(() -> enforcer.authorizeQuery(anonymous(), nameAndAgeQuery()))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessageContaining("PermissionDenied")
                    .hasMessageContaining("read the predicate name");
        }

        @Test
        @DisplayName("should never let a non-guardian read ACL predicates")
        void shouldHideAclPredicates() {
            grant("dgraph.password", Permission.READ);

            assertThat(enforcer.canRead(alice, "dgraph.password")).isFalse();
            assertThat(enforcer.canRead(guardian("groot"), "dgraph.password")).isTrue();
        }
    }

    @Nested
    @DisplayName("mutations")
    class Mutations {

        @Test
        @DisplayName("should reject a write without WRITE permission")
        void shouldRejectMissingWrite() {
            grant("name", Permission.READ);
            MutationRequest mutation = MutationRequest.ofSet(List.of(NQuad.literal("_:a", "name", "Alice")));

            assertThatThrownBy(() -> enforcer.authorizeMutation(alice, mutation))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessageContaining("unauthorized to mutate the predicate name")
                    .satisfies(e -> assertThat(((AuthorizationException) e).getPredicate()).isEqualTo("name"));
        }

        @Test
        @DisplayName("should accept a write on writable predicates")
        void shouldAcceptWrite() {
            grant("name", Permission.WRITE);
            MutationRequest mutation = MutationRequest.ofSet(List.of(NQuad.literal("_:a", "name", "Alice")));

            assertThatCode(() -> enforcer.authorizeMutation(alice, mutation)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject the whole mutation when one predicate is not writable")
        void shouldRejectPartiallyWritable() {
            grant("name", Permission.WRITE);
            MutationRequest mutation = MutationRequest.ofSet(List.of(
                    NQuad.literal("_:a", "name", "Alice"),
                    NQuad.literal("_:a", "age", "30")));

            assertThatThrownBy(() -> enforcer.authorizeMutation(alice, mutation))
                    .hasMessageContaining("the predicate age");
        }

        @Test
        @DisplayName("should reserve wildcard deletes for guardians")
        void shouldRejectWildcardDelete() {
            grant("name", Permission.READ, Permission.WRITE, Permission.MODIFY);
            MutationRequest mutation = MutationRequest.ofDelete(List.of(NQuad.wildcard("0x1", NQuad.WILDCARD)));

            assertThatThrownBy(() -> enforcer.authorizeMutation(alice, mutation))
                    .isInstanceOf(AuthorizationException.class);
            assertThatCode(() -> enforcer.authorizeMutation(guardian("groot"), mutation))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject anonymous writes")
        void shouldRejectAnonymous() {
            MutationRequest mutation = MutationRequest.ofSet(List.of(NQuad.literal("_:a", "name", "Alice")));

            assertThatThrownBy(() -> enforcer.authorizeMutation(anonymous(), mutation))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Nested
    @DisplayName("alters")
    class Alters {

        @Test
        @DisplayName("should require MODIFY on each altered predicate")
        void shouldRequireModify() {
            grant("name", Permission.READ, Permission.WRITE);
            AlterRequest alter = AlterRequest.schema(List.of(new PredicateSchema("name", "string")));

            assertThatThrownBy(() -> enforcer.authorizeAlter(alice, alter, Map.of()))
                    .isInstanceOf(AuthorizationException.class)
                    .hasMessageContaining("unauthorized to alter the predicate name");

            grant("name", Permission.MODIFY);

            assertThatCode(() -> enforcer.authorizeAlter(alice, alter, Map.of())).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject dropping a reserved predicate even for guardians")
        void shouldGuardReservedDrop() {
            AlterRequest alter = AlterRequest.drop("dgraph.xid");

            assertThatThrownBy(() -> enforcer.authorizeAlter(guardian("groot"), alter, Map.of("dgraph.xid", XID_SCHEMA)))
                    .isInstanceOf(ReservedPredicateException.class)
                    .hasMessageContaining("ReservedPredicateViolation")
                    .hasMessageContaining("predicate dgraph.xid is reserved and is not allowed to be dropped");
        }

        @Test
        @DisplayName("should reject modifying a reserved predicate whatever its case")
        void shouldGuardReservedModify() {
            AlterRequest alter = AlterRequest.schema(List.of(new PredicateSchema("dgraph.XID", "int")));

            assertThatThrownBy(() -> enforcer.authorizeAlter(guardian("groot"), alter, Map.of()))
                    .isInstanceOf(ReservedPredicateException.class)
                    .hasMessageContaining("is not allowed to be modified");
        }

        @Test
        @DisplayName("should allow re-asserting a reserved definition unchanged")
        void shouldAllowIdenticalReserved() {
            AlterRequest alter = AlterRequest.schema(List.of(new PredicateSchema("dgraph.xid", XID_SCHEMA)));

            assertThatCode(() -> enforcer.authorizeAlter(guardian("groot"), alter, Map.of("dgraph.xid", XID_SCHEMA)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reserve drop-all for guardians")
        void shouldRejectDropAll() {
            grant("name", Permission.READ, Permission.WRITE, Permission.MODIFY);

            assertThatThrownBy(() -> enforcer.authorizeAlter(alice, AlterRequest.dropEverything(), Map.of()))
                    .isInstanceOf(AuthorizationException.class);
            assertThatCode(() -> enforcer.authorizeAlter(guardian("groot"), AlterRequest.dropEverything(), Map.of()))
                    .doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("schema reads")
    class SchemaReads {

        @Test
        @DisplayName("should require a logged-in caller")
        void shouldRequireLogin() {
            assertThatThrownBy(() -> enforcer.authorizeSchemaRead(anonymous()))
                    .isInstanceOf(AuthenticationException.class)
                    .satisfies(e -> assertThat(((AuthenticationException) e).getKind())
                            .isEqualTo(AclErrorKind.UNAUTHENTICATED));

            assertThatCode(() -> enforcer.authorizeSchemaRead(loner)).doesNotThrowAnyException();
        }
    }
}
