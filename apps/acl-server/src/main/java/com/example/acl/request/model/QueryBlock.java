package com.example.acl.request.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One named block of a query: a root selection, optional filters, ordering and grouping,
 * and the projected fields.
 */
public record QueryBlock(
        String alias,
        RootFunction root,
        List<Field> fields,
        List<Filter> filters,
        List<OrderBy> orderBy,
        List<String> groupBy
) {
    public QueryBlock {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(root, "root");
        fields = fields == null ? List.of() : List.copyOf(fields);
        filters = filters == null ? List.of() : List.copyOf(filters);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    }

    public static Builder builder(String alias, RootFunction root) {
        return new Builder(alias, root);
    }

    public QueryBlock withFields(List<Field> fields) {
        return new QueryBlock(alias, root, fields, filters, orderBy, groupBy);
    }

    public QueryBlock withFilters(List<Filter> filters) {
        return new QueryBlock(alias, root, fields, filters, orderBy, groupBy);
    }

    public QueryBlock withOrderBy(List<OrderBy> orderBy) {
        return new QueryBlock(alias, root, fields, filters, orderBy, groupBy);
    }

    public QueryBlock withGroupBy(List<String> groupBy) {
        return new QueryBlock(alias, root, fields, filters, orderBy, groupBy);
    }

    /**
     * Every predicate this block reads, in order of first appearance.
     */
    public Set<String> referencedPredicates() {
        Set<String> predicates = new LinkedHashSet<>();
        if (root.isGated()) {
            predicates.add(root.predicate());
        }
        filters.forEach(f -> predicates.add(f.predicate()));
        orderBy.forEach(o -> predicates.add(o.predicate()));
        predicates.addAll(groupBy);
        fields.stream().filter(Field::isGated).forEach(f -> predicates.add(f.predicate()));
        return predicates;
    }

    public static final class Builder {
        private final String alias;
        private final RootFunction root;
        private final List<Field> fields = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();
        private final List<OrderBy> orderBy = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();

        private Builder(String alias, RootFunction root) {
            this.alias = alias;
            this.root = root;
        }

        public Builder field(String predicate) {
            fields.add(Field.of(predicate));
            return this;
        }

        public Builder count(String predicate) {
            fields.add(Field.count(predicate));
            return this;
        }

        public Builder filter(Filter filter) {
            filters.add(filter);
            return this;
        }

        public Builder orderAsc(String predicate) {
            orderBy.add(OrderBy.asc(predicate));
            return this;
        }

        public Builder orderDesc(String predicate) {
            orderBy.add(OrderBy.desc(predicate));
            return this;
        }

        public Builder groupBy(String predicate) {
            groupBy.add(predicate);
            return this;
        }

        public QueryBlock build() {
            return new QueryBlock(alias, root, fields, filters, orderBy, groupBy);
        }
    }
}
