package net.tvcatalog.support.pagination;

import java.util.List;

/**
 * Store read capability: run the planned query and return rows in the requested order,
 * at most {@link PaginatedQuery#fetchLimit()} of them.
 */
@FunctionalInterface
public interface PageQueryExecutor<R> {

    List<R> execute(PaginatedQuery query);
}
