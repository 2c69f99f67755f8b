package net.tvcatalog.support.pagination;

import java.util.List;

/**
 * SQL text with positional {@code ?} parameters in bind order.
 */
public record RenderedSql(String sql, List<Object> params) {
    public RenderedSql {
        params = params == null ? List.of() : List.copyOf(params);
    }
}
