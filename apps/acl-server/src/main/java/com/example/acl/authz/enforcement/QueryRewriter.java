package com.example.acl.authz.enforcement;

import com.example.acl.request.model.Field;
import com.example.acl.request.model.Filter;
import com.example.acl.request.model.OrderBy;
import com.example.acl.request.model.QueryBlock;
import com.example.acl.request.model.QueryRequest;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Strips unreadable predicates from a query before it reaches the engine.
 *
 * <p>A block whose root function reads an unreadable predicate is removed as a whole. Inside the
 * remaining blocks, fields, filters, orderings and groupings on unreadable predicates are dropped
 * one by one and everything else is kept.
 */
public final class QueryRewriter {

    private QueryRewriter() {
    }

    /**
     * @param deniedRoots aliases of blocks removed because their root was unreadable
     * @param elided      predicates removed from the surviving blocks
     */
    public record Result(QueryRequest query, List<String> deniedRoots, Set<String> elided) {

        public boolean isUnchanged() {
            return deniedRoots.isEmpty() && elided.isEmpty();
        }
    }

    @NonNull
    public static Result rewrite(@NonNull QueryRequest query, @NonNull Predicate<String> canRead) {
        List<QueryBlock> kept = new ArrayList<>();
        List<String> deniedRoots = new ArrayList<>();
        Set<String> elided = new LinkedHashSet<>();

        for (QueryBlock block : query.blocks()) {
            if (block.root().isGated() && !canRead.test(block.root().predicate())) {
                deniedRoots.add(block.alias());
                continue;
            }
            kept.add(rewriteBlock(block, canRead, elided));
        }

        return new Result(new QueryRequest(kept), List.copyOf(deniedRoots), Set.copyOf(elided));
    }

    private static QueryBlock rewriteBlock(QueryBlock block, Predicate<String> canRead, Set<String> elided) {
        List<Field> fields = new ArrayList<>();
        for (Field field : block.fields()) {
            if (!field.isGated() || canRead.test(field.predicate())) {
                fields.add(field);
            } else {
                elided.add(field.predicate());
            }
        }

        List<Filter> filters = new ArrayList<>();
        for (Filter filter : block.filters()) {
            if (canRead.test(filter.predicate())) {
                filters.add(filter);
            } else {
                elided.add(filter.predicate());
            }
        }

        List<OrderBy> orderBy = new ArrayList<>();
        for (OrderBy order : block.orderBy()) {
            if (canRead.test(order.predicate())) {
                orderBy.add(order);
            } else {
                elided.add(order.predicate());
            }
        }

        List<String> groupBy = new ArrayList<>();
        for (String predicate : block.groupBy()) {
            if (canRead.test(predicate)) {
                groupBy.add(predicate);
            } else {
                elided.add(predicate);
            }
        }

        return block.withFields(fields)
                .withFilters(filters)
                .withOrderBy(orderBy)
                .withGroupBy(groupBy);
    }
}
