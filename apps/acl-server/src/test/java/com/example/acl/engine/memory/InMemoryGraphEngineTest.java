package com.example.acl.engine.memory;

import com.example.acl.engine.MutationResult;
import com.example.acl.request.model.Filter;
import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.NQuad;
import com.example.acl.request.model.PredicateSchema;
import com.example.acl.request.model.QueryBlock;
import com.example.acl.request.model.QueryRequest;
import com.example.acl.request.model.RootFunction;
import com.example.acl.request.parser.NQuadParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryGraphEngine")
class InMemoryGraphEngineTest {

    private InMemoryGraphEngine engine;

    @BeforeEach
    void setUp() {
        engine = new InMemoryGraphEngine(new ObjectMapper());
        engine.applySchemaAlter("age", "int").block();
        engine.mutate(MutationRequest.ofSet(NQuadParser.parse("""
                _:alice <name> "Alice" .
                _:alice <age> "30" .
                _:alice <city> "Paris" .
                _:bob <name> "Bob" .
                _:bob <age> "25" .
                _:bob <city> "Paris" .
                _:carol <name> "Carol" .
                _:carol <city> "Rome" .
                _:alice <friend> _:bob .
                """))).block();
    }

    private ObjectNode run(QueryBlock... blocks) {
        return engine.query(QueryRequest.of(blocks)).block();
    }

    @Nested
    @DisplayName("mutate")
    class Mutate {

        @Test
        @DisplayName("should assign a new id to each blank node")
        void shouldAssignUids() {
            MutationResult result = engine.mutate(MutationRequest.ofSet(
                    List.of(NQuad.literal("_:dave", "name", "Dave")))).block();

            assertThat(result.uids()).containsOnlyKeys("dave");
            assertThat(result.uids().get("dave")).isEqualTo("0x4");
        }

        @Test
        @DisplayName("should replace the value of a scalar predicate")
        void shouldReplaceScalar() {
            engine.mutate(MutationRequest.ofSet(List.of(NQuad.literal("0x1", "city", "Lyon")))).block();

            ObjectNode result = run(QueryBlock.builder("q", RootFunction.uid("0x1")).field("city").build());

            assertThat(result.at("/q/0/city").asText()).isEqualTo("Lyon");
        }

        @Test
        @DisplayName("should delete every edge of a predicate with a wildcard object")
        void shouldDeletePredicate() {
            engine.mutate(MutationRequest.ofDelete(List.of(NQuad.wildcard("0x1", "age")))).block();

            ObjectNode result = run(QueryBlock.builder("q", RootFunction.has("age")).field("name").build());

            assertThat(result.at("/q").size()).isEqualTo(1);
            assertThat(result.at("/q/0/name").asText()).isEqualTo("Bob");
        }

        @Test
        @DisplayName("should reject wildcards in set triples and leave data untouched")
        void shouldRejectWildcardSet() {
            MutationRequest bad = new MutationRequest(
                    List.of(NQuad.literal("_:x", "name", "X"), NQuad.wildcard("0x1", "age")), List.of());

            StepVerifier.create(engine.mutate(bad))
                    .expectError(IllegalArgumentException.class)
                    .verify();

            ObjectNode result = run(QueryBlock.builder("q", RootFunction.eq("name", "X")).field("name").build());
            assertThat(result.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("query")
    class Query {

        @Test
        @DisplayName("should render values using the predicate type")
        void shouldRenderTypedValues() {
            ObjectNode result = run(QueryBlock.builder("q", RootFunction.eq("name", "Alice"))
                    .field("uid")
                    .field("age")
                    .field("friend")
                    .build());

            JsonNode row = result.at("/q/0");
            assertThat(row.get("uid").asText()).isEqualTo("0x1");
            assertThat(row.get("age").isNumber()).isTrue();
            assertThat(row.get("age").asInt()).isEqualTo(30);
            assertThat(row.at("/friend/0/uid").asText()).isEqualTo("0x2");
        }

        @Test
        @DisplayName("should filter and order results")
        void shouldFilterAndOrder() {
            ObjectNode result = run(QueryBlock.builder("q", RootFunction.has("name"))
                    .field("name")
                    .filter(Filter.eq("city", "Paris"))
                    .orderAsc("age")
                    .build());

            assertThat(result.at("/q/0/name").asText()).isEqualTo("Bob");
            assertThat(result.at("/q/1/name").asText()).isEqualTo("Alice");
            assertThat(result.at("/q").size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should sort missing values last")
        void shouldSortMissingLast() {
            ObjectNode result = run(QueryBlock.builder("q", RootFunction.has("name"))
                    .field("name")
                    .orderDesc("age")
                    .build());

            assertThat(result.at("/q/2/name").asText()).isEqualTo("Carol");
        }

        @Test
        @DisplayName("should count members of each group")
        void shouldGroupBy() {
            ObjectNode result = run(QueryBlock.builder("q", RootFunction.has("name"))
                    .groupBy("city")
                    .build());

            JsonNode buckets = result.at("/q/0/@groupby");
            assertThat(buckets.size()).isEqualTo(2);
            assertThat(buckets.get(0).get("city").asText()).isEqualTo("Paris");
            assertThat(buckets.get(0).get("count").asInt()).isEqualTo(2);
            assertThat(buckets.get(1).get("count").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("should omit blocks with no projected values")
        void shouldOmitEmptyBlocks() {
            ObjectNode result = run(
                    QueryBlock.builder("none", RootFunction.has("salary")).field("name").build(),
                    QueryBlock.builder("bare", RootFunction.has("name")).build());

            assertThat(result.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("schema")
    class Schema {

        @Test
        @DisplayName("should add a default schema for new predicates")
        void shouldAutoCreateSchema() {
            assertThat(engine.getSchema("name").block()).isEqualTo("default");
            assertThat(engine.getSchema("friend").block()).isEqualTo("[uid]");
            assertThat(engine.getSchema("age").block()).isEqualTo("int");
        }

        @Test
        @DisplayName("should remove data and schema on drop")
        void shouldDropPredicate() {
            engine.drop("city").block();

            assertThat(engine.getSchema("city").blockOptional()).isEmpty();
            assertThat(run(QueryBlock.builder("q", RootFunction.has("city")).field("name").build()).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should keep system predicates on drop all")
        void shouldKeepBootstrappedOnDropAll() {
            engine.bootstrapReserved(List.of(new PredicateSchema("dgraph.xid", "string @index(exact) @upsert"))).block();

            engine.dropAll().block();

            StepVerifier.create(engine.listSchema())
                    .expectNext(new PredicateSchema("dgraph.xid", "string @index(exact) @upsert"))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("should parse hex node ids and reject zero")
    void shouldParseUids() {
        assertThat(InMemoryGraphEngine.parseUid("0x1f")).isEqualTo(31L);
        assertThat(InMemoryGraphEngine.formatUid(31L)).isEqualTo("0x1f");
        assertThatThrownBy(() -> InMemoryGraphEngine.parseUid("0x0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InMemoryGraphEngine.parseUid("42")).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("value ordering")
    class ValueOrdering {

        @Test
        @DisplayName("should put numbers before text so mixed values order consistently")
        void shouldOrderMixedValuesConsistently() {
            Comparator<String> order = InMemoryGraphEngine.compareValues();

            assertThat(order.compare("9", "10")).isNegative();
            assertThat(order.compare("10", "9a")).isNegative();
            assertThat(order.compare("9", "9a")).isNegative();
            assertThat(order.compare("9a", "abc")).isNegative();
        }

        @Test
        @DisplayName("should sort a large shuffled mix of numbers and text")
        void shouldSortLargeMixedList() {
            List<String> values = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                values.add(Integer.toString(i));
                values.add(i + "a");
            }
            Collections.shuffle(values, new Random(42));

            values.sort(InMemoryGraphEngine.compareValues());

            assertThat(values.subList(0, 3)).containsExactly("0", "1", "2");
            assertThat(values.get(499)).isEqualTo("499");
            assertThat(values.get(500)).isEqualTo("0a");
        }
    }
}
