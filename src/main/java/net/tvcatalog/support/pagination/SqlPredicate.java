package net.tvcatalog.support.pagination;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Store-neutral filter tree handed to the store collaborator. Rendered to SQL by
 * {@link SqlPredicateRenderer}; kept structural so planners can compose it without string surgery.
 */
public sealed interface SqlPredicate permits SqlPredicate.Comparison, SqlPredicate.LogicalGroup {

    /**
     * Predicate that matches every row (an empty conjunction).
     */
    static SqlPredicate always() {
        return new LogicalGroup(Clause.AND, List.of());
    }

    static Comparison compare(String expression, ComparisonOperator operator, Object value) {
        return new Comparison(expression, operator, value);
    }

    static Comparison eq(String expression, Object value) {
        return new Comparison(expression, ComparisonOperator.EQ, value);
    }

    static SqlPredicate and(List<? extends SqlPredicate> elements) {
        return group(Clause.AND, elements);
    }

    static SqlPredicate and(SqlPredicate... elements) {
        return and(List.of(elements));
    }

    static SqlPredicate or(List<? extends SqlPredicate> elements) {
        return group(Clause.OR, elements);
    }

    private static SqlPredicate group(Clause clause, List<? extends SqlPredicate> elements) {
        List<SqlPredicate> flattened = new ArrayList<>();
        for (SqlPredicate element : elements) {
            if (element.isAlways()) {
                if (clause == Clause.AND) {
                    continue;
                }
                return element;
            }
            flattened.add(element);
        }
        if (flattened.size() == 1) {
            return flattened.get(0);
        }
        return new LogicalGroup(clause, flattened);
    }

    default boolean isAlways() {
        return this instanceof LogicalGroup group && group.clause() == Clause.AND && group.elements().isEmpty();
    }

    enum Clause { AND, OR }

    enum ComparisonOperator {
        EQ("="),
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<=");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * {@code expression <op> ?} with {@code value} bound as a parameter.
     */
    record Comparison(String expression, ComparisonOperator operator, Object value) implements SqlPredicate {
        public Comparison {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(operator, "operator");
        }
    }

    record LogicalGroup(Clause clause, List<SqlPredicate> elements) implements SqlPredicate {
        public LogicalGroup {
            Objects.requireNonNull(clause, "clause");
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }
}
