package net.tvcatalog.support.pagination;

import lombok.extern.slf4j.Slf4j;
import net.tvcatalog.exception.InvalidCursorException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns base filters, an {@link OrderSpec} and a {@link PageRequest} into a {@link PaginatedQuery}.
 * Issues no I/O.
 *
 * <p>The cursor predicate is the keyset tie-break expansion
 * {@code (k0 op v0) OR (k0 = v0 AND k1 op v1) OR ...}; as long as the last key is unique per row
 * no row is skipped or repeated across pages.</p>
 */
@Slf4j
public final class PaginatedQueryPlanner {

    public <R> PaginatedQuery plan(SqlPredicate basePredicate, OrderSpec<R> orderSpec, PageRequest request) {
        SqlPredicate base = basePredicate == null ? SqlPredicate.always() : basePredicate;
        boolean backward = request.isBackward();

        SqlPredicate predicate = base;
        if (request.hasCursor()) {
            SqlPredicate cursorPredicate = cursorPredicate(orderSpec, request.cursorValues(), backward);
            predicate = SqlPredicate.and(base, cursorPredicate);
        }

        List<PaginatedQuery.OrderTerm> orderBy = new ArrayList<>(orderSpec.keys().size());
        for (OrderKey<R> key : orderSpec.keys()) {
            SortDirection direction = backward ? key.direction().flip() : key.direction();
            orderBy.add(new PaginatedQuery.OrderTerm(key.expression(), direction));
        }

        Integer fetchLimit = request.limit() == null ? null : lookAheadLimit(request.limit());
        int offset = request.usingPageInfo() ? 0 : request.offset();

        log.debug("Planned page query for {}: cursor={}, backward={}, fetchLimit={}, offset={}",
            orderSpec, request.hasCursor(), backward, fetchLimit, offset);
        return new PaginatedQuery(predicate, orderBy, fetchLimit, offset);
    }

    private static <R> SqlPredicate cursorPredicate(OrderSpec<R> orderSpec,
                                                    Map<String, Object> cursorValues,
                                                    boolean backward) {
        if (!cursorValues.keySet().equals(orderSpec.keyNames())) {
            log.debug("Rejected cursor keys {} for {}", cursorValues.keySet(), orderSpec);
            throw new InvalidCursorException();
        }

        List<OrderKey<R>> keys = orderSpec.keys();
        List<Object> storeValues = new ArrayList<>(keys.size());
        for (OrderKey<R> key : keys) {
            storeValues.add(toStoreValue(key, cursorValues.get(key.name())));
        }

        List<SqlPredicate> disjuncts = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            List<SqlPredicate> conjuncts = new ArrayList<>(i + 1);
            for (int j = 0; j < i; j++) {
                conjuncts.add(SqlPredicate.eq(keys.get(j).expression(), storeValues.get(j)));
            }
            OrderKey<R> key = keys.get(i);
            conjuncts.add(SqlPredicate.compare(key.expression(), strictOperator(key.direction(), backward),
                storeValues.get(i)));
            disjuncts.add(SqlPredicate.and(conjuncts));
        }
        return SqlPredicate.or(disjuncts);
    }

    /**
     * {@code limit + 1}, saturating at {@link Integer#MAX_VALUE}.
     */
    static int lookAheadLimit(int limit) {
        return (int) Math.min((long) limit + 1, Integer.MAX_VALUE);
    }

    /**
     * Forward uses {@code >} for ascending keys and {@code <} for descending; backward inverts both.
     */
    static SqlPredicate.ComparisonOperator strictOperator(SortDirection keyDirection, boolean backward) {
        boolean ascendingWalk = (keyDirection == SortDirection.ASC) != backward;
        return ascendingWalk ? SqlPredicate.ComparisonOperator.GT : SqlPredicate.ComparisonOperator.LT;
    }

    private static <R> Object toStoreValue(OrderKey<R> key, Object sortValue) {
        if (sortValue == null) {
            throw new InvalidCursorException();
        }
        try {
            Object storeValue = key.toStoreValue(sortValue);
            if (storeValue == null) {
                throw new InvalidCursorException();
            }
            return storeValue;
        } catch (InvalidCursorException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.debug("Rejected cursor value '{}' for key '{}': {}", sortValue, key.name(), ex.getMessage());
            throw new InvalidCursorException();
        }
    }
}
