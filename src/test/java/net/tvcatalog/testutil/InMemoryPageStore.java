package net.tvcatalog.testutil;

import net.tvcatalog.support.pagination.PageQueryExecutor;
import net.tvcatalog.support.pagination.PaginatedQuery;
import net.tvcatalog.support.pagination.SortDirection;
import net.tvcatalog.support.pagination.SqlPredicate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Test double for the relational store: evaluates {@link SqlPredicate} trees and ordering
 * against an in-memory row list, resolving each SQL expression through a registered accessor.
 */
public final class InMemoryPageStore<R> implements PageQueryExecutor<R> {

    private final List<R> rows;
    private final Map<String, Function<R, Object>> expressions;
    private final List<PaginatedQuery> executedQueries = new ArrayList<>();

    private InMemoryPageStore(List<R> rows, Map<String, Function<R, Object>> expressions) {
        this.rows = List.copyOf(rows);
        this.expressions = Map.copyOf(expressions);
    }

    public static <R> Builder<R> over(List<R> rows) {
        return new Builder<>(rows);
    }

    public List<PaginatedQuery> executedQueries() {
        return List.copyOf(executedQueries);
    }

    @Override
    public List<R> execute(PaginatedQuery query) {
        executedQueries.add(query);
        List<R> matching = new ArrayList<>();
        for (R row : rows) {
            if (matches(row, query.predicate())) {
                matching.add(row);
            }
        }
        matching.sort(comparatorFor(query.orderBy()));

        int from = Math.min(query.offset(), matching.size());
        int to = query.fetchLimit() == null ? matching.size() : (int) Math.min((long) from + query.fetchLimit(), matching.size());
        return new ArrayList<>(matching.subList(from, to));
    }

    private boolean matches(R row, SqlPredicate predicate) {
        if (predicate instanceof SqlPredicate.Comparison comparison) {
            int cmp = compareValues(resolve(row, comparison.expression()), comparison.value());
            switch (comparison.operator()) {
                case EQ: return cmp == 0;
                case GT: return cmp > 0;
                case GE: return cmp >= 0;
                case LT: return cmp < 0;
                case LE: return cmp <= 0;
                default: throw new IllegalStateException("Unsupported operator " + comparison.operator());
            }
        }
        SqlPredicate.LogicalGroup group = (SqlPredicate.LogicalGroup) predicate;
        if (group.clause() == SqlPredicate.Clause.AND) {
            return group.elements().stream().allMatch(element -> matches(row, element));
        }
        return group.elements().stream().anyMatch(element -> matches(row, element));
    }

    private Comparator<R> comparatorFor(List<PaginatedQuery.OrderTerm> orderBy) {
        Comparator<R> comparator = (a, b) -> 0;
        for (PaginatedQuery.OrderTerm term : orderBy) {
            Comparator<R> byTerm = (a, b) -> compareValues(resolve(a, term.expression()), resolve(b, term.expression()));
            comparator = comparator.thenComparing(term.direction() == SortDirection.DESC ? byTerm.reversed() : byTerm);
        }
        return comparator;
    }

    private Object resolve(R row, String expression) {
        Function<R, Object> accessor = expressions.get(expression);
        if (accessor == null) {
            throw new IllegalArgumentException("No accessor registered for expression: " + expression);
        }
        return accessor.apply(row);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Long.compare(l.longValue(), r.longValue());
        }
        return ((Comparable) left).compareTo(right);
    }

    public static final class Builder<R> {
        private final List<R> rows;
        private final Map<String, Function<R, Object>> expressions = new LinkedHashMap<>();

        private Builder(List<R> rows) {
            this.rows = rows;
        }

        public Builder<R> expression(String expression, Function<R, Object> accessor) {
            expressions.put(expression, accessor);
            return this;
        }

        public InMemoryPageStore<R> build() {
            return new InMemoryPageStore<>(rows, expressions);
        }
    }
}
