package net.tvcatalog.testutil;

import net.tvcatalog.support.pagination.CursorCodec;
import net.tvcatalog.support.pagination.OrderKey;
import net.tvcatalog.support.pagination.OrderSpec;
import net.tvcatalog.support.pagination.SortDirection;
import net.tvcatalog.support.pagination.SortValues;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Shared rows, order specs and stores for pagination tests.
 */
public final class PaginationTestData {

    public static final String YEAR_EXPR = "COALESCE(year, 2147483647)";
    public static final String TITLE_EXPR = "title";
    public static final String ID_EXPR = "id";

    private PaginationTestData() {
    }

    /**
     * Minimal catalog row: nullable year, title and a unique id.
     */
    public record Row(long id, Integer year, String title) {
        public static Row ofId(long id) {
            return new Row(id, null, "row-" + id);
        }
    }

    public static CursorCodec codec() {
        return new CursorCodec(new ObjectMapper());
    }

    public static OrderSpec<Row> idAscending() {
        return OrderSpec.of(OrderKey.of("id", ID_EXPR, SortDirection.ASC, Row::id, SortValues::toLong));
    }

    public static OrderSpec<Row> yearTitleId() {
        return OrderSpec.of(
            OrderKey.<Row>of("year", YEAR_EXPR, SortDirection.ASC,
                row -> SortValues.intOrSentinel(row.year()), SortValues::toInteger),
            OrderKey.of("title", TITLE_EXPR, SortDirection.ASC, Row::title, SortValues::toText),
            OrderKey.of("id", ID_EXPR, SortDirection.ASC, Row::id, SortValues::toLong)
        );
    }

    public static OrderSpec<Row> yearDescIdAsc() {
        return OrderSpec.of(
            OrderKey.<Row>of("year", YEAR_EXPR, SortDirection.DESC,
                row -> SortValues.intOrSentinel(row.year()), SortValues::toInteger),
            OrderKey.of("id", ID_EXPR, SortDirection.ASC, Row::id, SortValues::toLong)
        );
    }

    public static List<Row> idsOneThrough(int count) {
        List<Row> rows = new ArrayList<>();
        LongStream.rangeClosed(1, count).forEach(id -> rows.add(Row.ofId(id)));
        return rows;
    }

    public static InMemoryPageStore<Row> storeOver(List<Row> rows) {
        return InMemoryPageStore.over(rows)
            .expression(YEAR_EXPR, row -> SortValues.intOrSentinel(row.year()))
            .expression(TITLE_EXPR, Row::title)
            .expression(ID_EXPR, Row::id)
            .build();
    }
}
