package net.tvcatalog.support.pagination;

import java.util.List;
import java.util.Optional;

/**
 * Result of a paginated listing: the window plus the {@code Link} header value, if any.
 */
public record PaginatedResponse<R>(PageResult<R> page, Optional<String> linkHeader) {

    public List<R> items() {
        return page.items();
    }

    public boolean hasPrevious() {
        return page.hasPrevious();
    }

    public boolean hasNext() {
        return page.hasNext();
    }
}
