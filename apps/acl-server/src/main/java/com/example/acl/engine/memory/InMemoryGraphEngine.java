package com.example.acl.engine.memory;

import com.example.acl.engine.ExecutionEngine;
import com.example.acl.engine.MutationResult;
import com.example.acl.engine.SchemaOperations;
import com.example.acl.request.model.Field;
import com.example.acl.request.model.Filter;
import com.example.acl.request.model.MutationRequest;
import com.example.acl.request.model.NQuad;
import com.example.acl.request.model.OrderBy;
import com.example.acl.request.model.PredicateSchema;
import com.example.acl.request.model.QueryBlock;
import com.example.acl.request.model.QueryRequest;
import com.example.acl.request.model.RootFunction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single-node graph store holding triples in memory.
 *
 * <p>Supports the selection, filtering, ordering and grouping used by the query model; it is the
 * engine behind the HTTP surface and end-to-end tests, not a query language implementation.
 * Predicates seen for the first time in a mutation get a default schema entry.
 */
@Slf4j
@Component
public class InMemoryGraphEngine implements ExecutionEngine, SchemaOperations {

    static final String TYPE_PREDICATE = "dgraph.type";

    private static final String DEFAULT_LITERAL_TYPE = "default";
    private static final String DEFAULT_NODE_TYPE = "[uid]";

    private final ObjectMapper objectMapper;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Long, Map<String, List<Value>>> nodes = new HashMap<>();
    private final Map<String, String> schema = new TreeMap<>();
    private final Set<String> bootstrapped = new HashSet<>();
    private final AtomicLong nextUid = new AtomicLong(1);

    public InMemoryGraphEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // A stored object: a literal or a reference to another node.
    private record Value(String literal, Long ref) {

        static Value of(String literal) {
            return new Value(literal, null);
        }

        static Value node(long ref) {
            return new Value(null, ref);
        }

        boolean isRef() {
            return ref != null;
        }
    }

    // ---------------------------------------------------------------- mutation

    @Override
    @NonNull
    public Mono<MutationResult> mutate(@NonNull MutationRequest request) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                return applyMutation(request);
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    private MutationResult applyMutation(MutationRequest request) {
        // Resolve every id before touching state so a bad triple leaves the store unchanged.
        Map<String, Long> blankNodes = new LinkedHashMap<>();
        List<Long> deleteSubjects = new ArrayList<>();
        for (NQuad quad : request.delete()) {
            if (quad.isBlankSubject()) {
                throw new IllegalArgumentException("cannot delete from blank node " + quad.subject());
            }
            deleteSubjects.add(parseUid(quad.subject()));
        }
        List<Long> setSubjects = new ArrayList<>();
        List<Value> setObjects = new ArrayList<>();
        for (NQuad quad : request.set()) {
            if (quad.isWildcardPredicate() || quad.kind() == NQuad.ObjectKind.WILDCARD) {
                throw new IllegalArgumentException("wildcards are only allowed in deletes");
            }
            setSubjects.add(resolve(quad.subject(), blankNodes));
            setObjects.add(quad.kind() == NQuad.ObjectKind.NODE
                    ? Value.node(resolve(quad.object(), blankNodes))
                    : Value.of(quad.object()));
        }

        for (int i = 0; i < request.delete().size(); i++) {
            applyDelete(deleteSubjects.get(i), request.delete().get(i));
        }
        for (int i = 0; i < request.set().size(); i++) {
            applySet(setSubjects.get(i), request.set().get(i).predicate(), setObjects.get(i));
        }

        Map<String, String> uids = new LinkedHashMap<>();
        blankNodes.forEach((label, uid) -> uids.put(label.substring(2), formatUid(uid)));
        log.debug("Applied mutation: {} set, {} delete, {} new nodes",
                request.set().size(), request.delete().size(), uids.size());
        return new MutationResult(uids);
    }

    private long resolve(String id, Map<String, Long> blankNodes) {
        if (id.startsWith("_:")) {
            return blankNodes.computeIfAbsent(id, label -> nextUid.getAndIncrement());
        }
        long uid = parseUid(id);
        nextUid.accumulateAndGet(uid + 1, Math::max);
        return uid;
    }

    private void applySet(long subject, String predicate, Value value) {
        String definition = schema.computeIfAbsent(predicate,
                p -> value.isRef() ? DEFAULT_NODE_TYPE : DEFAULT_LITERAL_TYPE);
        List<Value> values = nodes.computeIfAbsent(subject, s -> new HashMap<>())
                .computeIfAbsent(predicate, p -> new ArrayList<>());
        if (!isList(definition)) {
            values.clear();
        }
        if (!values.contains(value)) {
            values.add(value);
        }
    }

    private void applyDelete(long subject, NQuad quad) {
        Map<String, List<Value>> node = nodes.get(subject);
        if (node == null) {
            return;
        }
        if (quad.isWildcardPredicate()) {
            nodes.remove(subject);
            return;
        }
        if (quad.kind() == NQuad.ObjectKind.WILDCARD) {
            node.remove(quad.predicate());
        } else {
            List<Value> values = node.get(quad.predicate());
            if (values != null) {
                values.remove(quad.kind() == NQuad.ObjectKind.NODE
                        ? Value.node(parseUid(quad.object()))
                        : Value.of(quad.object()));
                if (values.isEmpty()) {
                    node.remove(quad.predicate());
                }
            }
        }
        if (node.isEmpty()) {
            nodes.remove(subject);
        }
    }

    // ---------------------------------------------------------------- query

    @Override
    @NonNull
    public Mono<ObjectNode> query(@NonNull QueryRequest request) {
        return Mono.fromCallable(() -> {
            lock.readLock().lock();
            try {
                ObjectNode result = objectMapper.createObjectNode();
                for (QueryBlock block : request.blocks()) {
                    ArrayNode rows = evaluate(block);
                    if (!rows.isEmpty()) {
                        result.set(block.alias(), rows);
                    }
                }
                return result;
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    private ArrayNode evaluate(QueryBlock block) {
        List<Long> selected = select(block.root()).stream()
                .filter(uid -> block.filters().stream().allMatch(f -> matches(uid, f)))
                .sorted(ordering(block.orderBy()))
                .toList();

        if (!block.groupBy().isEmpty()) {
            return groupBy(selected, block);
        }

        ArrayNode rows = objectMapper.createArrayNode();
        for (Long uid : selected) {
            ObjectNode row = project(uid, block.fields());
            if (!row.isEmpty()) {
                rows.add(row);
            }
        }
        return rows;
    }

    private List<Long> select(RootFunction root) {
        return switch (root.function()) {
            case HAS -> nodes.keySet().stream()
                    .filter(uid -> !valuesOf(uid, root.predicate()).isEmpty())
                    .sorted()
                    .toList();
            case EQ -> nodes.keySet().stream()
                    .filter(uid -> valuesOf(uid, root.predicate()).contains(Value.of(root.args().get(0))))
                    .sorted()
                    .toList();
            case TYPE -> nodes.keySet().stream()
                    .filter(uid -> valuesOf(uid, TYPE_PREDICATE).contains(Value.of(root.args().get(0))))
                    .sorted()
                    .toList();
            case UID -> root.args().stream()
                    .map(InMemoryGraphEngine::parseUid)
                    .filter(nodes::containsKey)
                    .distinct()
                    .toList();
        };
    }

    private boolean matches(long uid, Filter filter) {
        List<Value> values = valuesOf(uid, filter.predicate());
        return switch (filter.function()) {
            case HAS -> !values.isEmpty();
            case EQ -> values.contains(Value.of(filter.value()));
        };
    }

    private Comparator<Long> ordering(List<OrderBy> orderBy) {
        Comparator<Long> comparator = (a, b) -> 0;
        for (OrderBy order : orderBy) {
            Comparator<Optional<String>> byValue = Comparator.comparing(
                    (Optional<String> v) -> v.orElse(null),
                    Comparator.nullsLast(order.descending()
                            ? InMemoryGraphEngine.compareValues().reversed()
                            : InMemoryGraphEngine.compareValues()));
            comparator = comparator.thenComparing(uid -> firstLiteral(uid, order.predicate()), byValue);
        }
        return comparator;
    }

    // Numbers sort before everything else and compare numerically; the rest compare lexically.
    static Comparator<String> compareValues() {
        return (a, b) -> {
            Double left = parseNumber(a);
            Double right = parseNumber(b);
            if (left != null && right != null) {
                return Double.compare(left, right);
            }
            if (left != null) {
                return -1;
            }
            if (right != null) {
                return 1;
            }
            return a.compareTo(b);
        };
    }

    private static Double parseNumber(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private ObjectNode project(long uid, List<Field> fields) {
        ObjectNode row = objectMapper.createObjectNode();
        for (Field field : fields) {
            if (field.isUid()) {
                row.put(Field.UID, formatUid(uid));
                continue;
            }
            List<Value> values = valuesOf(uid, field.predicate());
            if (field.count()) {
                row.put(field.outputKey(), values.size());
            } else if (values.size() == 1 && !isList(schema.get(field.predicate()))) {
                row.set(field.predicate(), render(field.predicate(), values.get(0)));
            } else if (!values.isEmpty()) {
                ArrayNode array = row.putArray(field.predicate());
                values.forEach(v -> array.add(render(field.predicate(), v)));
            }
        }
        return row;
    }

    private ArrayNode groupBy(List<Long> selected, QueryBlock block) {
        Map<List<String>, List<Long>> groups = new TreeMap<>(Comparator.comparing(Object::toString));
        for (Long uid : selected) {
            List<String> key = new ArrayList<>();
            for (String predicate : block.groupBy()) {
                firstLiteral(uid, predicate).ifPresent(key::add);
            }
            if (key.size() == block.groupBy().size()) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(uid);
            }
        }

        ArrayNode buckets = objectMapper.createArrayNode();
        groups.forEach((key, members) -> {
            ObjectNode bucket = buckets.addObject();
            for (int i = 0; i < key.size(); i++) {
                String predicate = block.groupBy().get(i);
                bucket.set(predicate, render(predicate, Value.of(key.get(i))));
            }
            boolean counted = false;
            for (Field field : block.fields()) {
                if (!field.count()) {
                    continue;
                }
                counted = true;
                if (field.isUid()) {
                    bucket.put("count", members.size());
                } else {
                    bucket.put(field.outputKey(),
                            members.stream().mapToInt(uid -> valuesOf(uid, field.predicate()).size()).sum());
                }
            }
            if (!counted) {
                bucket.put("count", members.size());
            }
        });

        ArrayNode rows = objectMapper.createArrayNode();
        if (!buckets.isEmpty()) {
            rows.addObject().set("@groupby", buckets);
        }
        return rows;
    }

    private List<Value> valuesOf(long uid, String predicate) {
        Map<String, List<Value>> node = nodes.get(uid);
        if (node == null) {
            return List.of();
        }
        return node.getOrDefault(predicate, List.of());
    }

    private Optional<String> firstLiteral(long uid, String predicate) {
        return valuesOf(uid, predicate).stream()
                .filter(v -> !v.isRef())
                .map(Value::literal)
                .findFirst();
    }

    private JsonNode render(String predicate, Value value) {
        if (value.isRef()) {
            ObjectNode ref = objectMapper.createObjectNode();
            ref.put(Field.UID, formatUid(value.ref()));
            return ref;
        }
        String type = typeOf(schema.get(predicate));
        String literal = value.literal();
        try {
            return switch (type) {
                case "int" -> objectMapper.getNodeFactory().numberNode(Long.parseLong(literal));
                case "float" -> objectMapper.getNodeFactory().numberNode(Double.parseDouble(literal));
                case "bool" -> objectMapper.getNodeFactory().booleanNode(Boolean.parseBoolean(literal));
                default -> objectMapper.getNodeFactory().textNode(literal);
            };
        } catch (NumberFormatException e) {
            return objectMapper.getNodeFactory().textNode(literal);
        }
    }

    // ---------------------------------------------------------------- schema

    @Override
    @NonNull
    public Mono<String> getSchema(@NonNull String predicate) {
        return Mono.fromCallable(() -> {
            lock.readLock().lock();
            try {
                return schema.get(predicate);
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    @NonNull
    public Mono<Void> applySchemaAlter(@NonNull String predicate, @NonNull String definition) {
        return Mono.fromRunnable(() -> {
            lock.writeLock().lock();
            try {
                schema.put(predicate, definition);
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    @NonNull
    public Mono<Void> drop(@NonNull String predicate) {
        return Mono.fromRunnable(() -> {
            lock.writeLock().lock();
            try {
                schema.remove(predicate);
                bootstrapped.remove(predicate);
                nodes.values().forEach(node -> node.remove(predicate));
                nodes.values().removeIf(Map::isEmpty);
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    @NonNull
    public Mono<Void> dropAll() {
        return Mono.fromRunnable(() -> {
            lock.writeLock().lock();
            try {
                nodes.clear();
                schema.keySet().retainAll(bootstrapped);
                log.info("Dropped all data, kept {} system predicates", bootstrapped.size());
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    @NonNull
    public Flux<PredicateSchema> listSchema() {
        return Mono.fromCallable(() -> {
            lock.readLock().lock();
            try {
                return schema.entrySet().stream()
                        .map(e -> new PredicateSchema(e.getKey(), e.getValue()))
                        .toList();
            } finally {
                lock.readLock().unlock();
            }
        }).flatMapIterable(list -> list);
    }

    @Override
    @NonNull
    public Mono<Void> bootstrapReserved(@NonNull List<PredicateSchema> reserved) {
        return Mono.fromRunnable(() -> {
            lock.writeLock().lock();
            try {
                for (PredicateSchema entry : reserved) {
                    schema.put(entry.predicate(), entry.definition());
                    bootstrapped.add(entry.predicate());
                }
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    // ---------------------------------------------------------------- helpers

    private static boolean isList(String definition) {
        return definition != null && definition.trim().startsWith("[");
    }

    private static String typeOf(String definition) {
        if (definition == null) {
            return DEFAULT_LITERAL_TYPE;
        }
        String type = new PredicateSchema("_", definition).type();
        if (type.startsWith("[") && type.endsWith("]")) {
            type = type.substring(1, type.length() - 1);
        }
        return type;
    }

    static long parseUid(String id) {
        Objects.requireNonNull(id, "id");
        String hex = id.startsWith("0x") || id.startsWith("0X") ? id.substring(2) : null;
        if (hex == null || hex.isEmpty()) {
            throw new IllegalArgumentException("invalid node id " + id);
        }
        try {
            long uid = Long.parseUnsignedLong(hex, 16);
            if (uid == 0) {
                throw new IllegalArgumentException("invalid node id " + id);
            }
            return uid;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid node id " + id, e);
        }
    }

    static String formatUid(long uid) {
        return "0x" + Long.toHexString(uid);
    }
}
