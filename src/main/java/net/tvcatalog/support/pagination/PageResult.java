package net.tvcatalog.support.pagination;

import java.util.List;

/**
 * One window of rows in natural presentation order plus neighbour flags.
 */
public record PageResult<R>(List<R> items, boolean hasPrevious, boolean hasNext) {
    public PageResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public R first() {
        return items.get(0);
    }

    public R last() {
        return items.get(items.size() - 1);
    }
}
