package net.tvcatalog.support.pagination;

import java.util.List;
import java.util.Objects;

/**
 * Store-ready page query: filter, effective ordering and row cap.
 *
 * @param predicate base filters AND the cursor predicate, if any
 * @param orderBy ordering to apply, already flipped for backward traversal
 * @param fetchLimit {@code limit + 1} (one look-ahead row), or {@code null} for an unbounded listing
 * @param offset rows to skip; always {@code 0} in cursor mode
 */
public record PaginatedQuery(SqlPredicate predicate,
                             List<OrderTerm> orderBy,
                             Integer fetchLimit,
                             int offset) {

    public PaginatedQuery {
        Objects.requireNonNull(predicate, "predicate");
        orderBy = List.copyOf(orderBy);
    }

    public record OrderTerm(String expression, SortDirection direction) {
        public OrderTerm {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(direction, "direction");
        }
    }
}
