package net.tvcatalog.support.pagination;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link SqlPredicate} trees and {@link PaginatedQuery} tails to positional SQL.
 */
public final class SqlPredicateRenderer {

    private SqlPredicateRenderer() {
        // Utility class
    }

    /**
     * Renders a predicate; {@link SqlPredicate#always()} renders as {@code TRUE}.
     */
    public static RenderedSql render(SqlPredicate predicate) {
        List<Object> params = new ArrayList<>();
        String sql = renderInto(predicate, params);
        return new RenderedSql(sql, params);
    }

    /**
     * Renders {@code WHERE ... ORDER BY ... [LIMIT ?] [OFFSET ?]} for a planned page query.
     */
    public static RenderedSql renderTail(PaginatedQuery query) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(" WHERE ").append(renderInto(query.predicate(), params));

        sql.append(" ORDER BY ");
        for (int i = 0; i < query.orderBy().size(); i++) {
            PaginatedQuery.OrderTerm term = query.orderBy().get(i);
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(term.expression()).append(' ').append(term.direction().sql());
        }

        if (query.fetchLimit() != null) {
            sql.append(" LIMIT ?");
            params.add(query.fetchLimit());
        }
        if (query.offset() > 0) {
            sql.append(" OFFSET ?");
            params.add(query.offset());
        }
        return new RenderedSql(sql.toString(), params);
    }

    private static String renderInto(SqlPredicate predicate, List<Object> params) {
        if (predicate instanceof SqlPredicate.Comparison comparison) {
            params.add(comparison.value());
            return comparison.expression() + " " + comparison.operator().symbol() + " ?";
        }
        SqlPredicate.LogicalGroup group = (SqlPredicate.LogicalGroup) predicate;
        if (group.elements().isEmpty()) {
            return group.clause() == SqlPredicate.Clause.AND ? "TRUE" : "FALSE";
        }
        List<String> parts = new ArrayList<>(group.elements().size());
        for (SqlPredicate element : group.elements()) {
            parts.add(renderInto(element, params));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return "(" + String.join(" " + group.clause().name() + " ", parts) + ")";
    }
}
