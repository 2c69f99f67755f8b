package net.tvcatalog.support.pagination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trims the look-ahead row from an over-fetched result, restores presentation order after a
 * backward walk and works out whether neighbouring pages exist.
 */
public final class ResultWindower {

    public <R> PageResult<R> apply(List<R> rows, PageRequest request) {
        List<R> fetched = rows == null ? List.of() : rows;
        Integer limit = request.limit();

        boolean hasMore = limit != null && fetched.size() > limit;
        List<R> items = new ArrayList<>(hasMore ? fetched.subList(0, limit) : fetched);
        if (request.isBackward()) {
            Collections.reverse(items);
        }

        if (!request.hasCursor()) {
            return new PageResult<>(items, request.offset() > 0, hasMore);
        }
        if (request.isBackward()) {
            return new PageResult<>(items, hasMore, true);
        }
        return new PageResult<>(items, true, hasMore);
    }
}
