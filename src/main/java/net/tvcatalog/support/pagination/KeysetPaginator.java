package net.tvcatalog.support.pagination;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the whole pagination pipeline for one listing request:
 * parse, plan, read through the injected executor, window, link.
 *
 * <p>Holds no per-request state; safe to share across concurrent requests.</p>
 */
@Component
@Slf4j
public class KeysetPaginator {

    private final PageRequestParser pageRequestParser;
    private final PaginatedQueryPlanner queryPlanner;
    private final ResultWindower resultWindower;
    private final LinkHeaderBuilder linkHeaderBuilder;

    public KeysetPaginator(CursorCodec cursorCodec) {
        this(new PageRequestParser(cursorCodec), cursorCodec);
    }

    @Autowired
    public KeysetPaginator(PageRequestParser pageRequestParser, CursorCodec cursorCodec) {
        this.pageRequestParser = Objects.requireNonNull(pageRequestParser, "pageRequestParser");
        this.queryPlanner = new PaginatedQueryPlanner();
        this.resultWindower = new ResultWindower();
        this.linkHeaderBuilder = new LinkHeaderBuilder(cursorCodec);
    }

    /**
     * Validates the raw pagination parameters and serves one page.
     */
    public <R> PaginatedResponse<R> paginate(ListingQuery<R> listing, PaginationParams params) {
        PageRequest request = pageRequestParser.parse(params.limit(), params.offset(), params.pageInfo());
        return paginate(listing, request);
    }

    public <R> PaginatedResponse<R> paginate(ListingQuery<R> listing, PageRequest request) {
        PaginatedQuery query = queryPlanner.plan(listing.basePredicate(), listing.orderSpec(), request);
        List<R> rows = listing.executor().execute(query);
        PageResult<R> page = resultWindower.apply(rows, request);
        Optional<String> linkHeader = linkHeaderBuilder.build(page, listing.orderSpec(), request, listing.linkTarget());
        log.debug("Served {} item(s) for {} (hasPrevious={}, hasNext={})",
            page.items().size(), listing.orderSpec(), page.hasPrevious(), page.hasNext());
        return new PaginatedResponse<>(page, linkHeader);
    }

    /**
     * Raw {@code limit}, {@code offset} and {@code page_info} query values; any may be {@code null}.
     */
    public record PaginationParams(String limit, String offset, String pageInfo) {
        public static PaginationParams none() {
            return new PaginationParams(null, null, null);
        }
    }

    /**
     * Everything one endpoint contributes: filters, ordering, store access and link target.
     */
    public record ListingQuery<R>(SqlPredicate basePredicate,
                                  OrderSpec<R> orderSpec,
                                  PageQueryExecutor<R> executor,
                                  LinkTarget linkTarget) {
        public ListingQuery {
            basePredicate = basePredicate == null ? SqlPredicate.always() : basePredicate;
            Objects.requireNonNull(orderSpec, "orderSpec");
            Objects.requireNonNull(executor, "executor");
            Objects.requireNonNull(linkTarget, "linkTarget");
        }
    }
}
