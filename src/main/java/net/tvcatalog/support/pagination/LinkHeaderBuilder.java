package net.tvcatalog.support.pagination;

import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the RFC 5988 {@code Link} header value for a page:
 * {@code <url>; rel="previous", <url>; rel="next"}.
 *
 * <p>The previous link anchors a {@code prev} token on the first item and the next link a
 * {@code next} token on the last item. Each URL keeps the request's other query parameters and
 * replaces {@code limit}, {@code offset} and {@code page_info}.</p>
 */
public final class LinkHeaderBuilder {

    public static final String PARAM_LIMIT = "limit";
    public static final String PARAM_OFFSET = "offset";
    public static final String PARAM_PAGE_INFO = "page_info";

    static final String REL_PREVIOUS = "previous";
    static final String REL_NEXT = "next";

    private static final String PAGE_INFO_VARIABLE = "pageInfo";

    private static final Set<String> PAGINATION_PARAMS = Set.of(PARAM_LIMIT, PARAM_OFFSET, PARAM_PAGE_INFO);

    private final CursorCodec cursorCodec;

    public LinkHeaderBuilder(CursorCodec cursorCodec) {
        this.cursorCodec = Objects.requireNonNull(cursorCodec, "cursorCodec");
    }

    /**
     * @return header value, or empty when the page is empty, unbounded, or has no neighbours
     */
    public <R> Optional<String> build(PageResult<R> page, OrderSpec<R> orderSpec,
                                      PageRequest request, LinkTarget target) {
        Integer limit = request.limit();
        if (page.isEmpty() || limit == null) {
            return Optional.empty();
        }

        List<String> links = new ArrayList<>(2);
        if (page.hasPrevious()) {
            String token = cursorCodec.encode(CursorDirection.PREV, limit, orderSpec.valuesOf(page.first()));
            links.add(link(target, limit, token, REL_PREVIOUS));
        }
        if (page.hasNext()) {
            String token = cursorCodec.encode(CursorDirection.NEXT, limit, orderSpec.valuesOf(page.last()));
            links.add(link(target, limit, token, REL_NEXT));
        }
        return links.isEmpty() ? Optional.empty() : Optional.of(String.join(", ", links));
    }

    private static String link(LinkTarget target, int limit, String token, String rel) {
        return "<" + url(target, limit, token) + ">; rel=\"" + rel + "\"";
    }

    static String url(LinkTarget target, int limit, String token) {
        // The base comes from the request URI and is already encoded; only the query is built here
        String base = target.baseUrl();
        int queryStart = base.indexOf('?');
        if (queryStart >= 0) {
            base = base.substring(0, queryStart);
        }

        // Values go through URI variables so encode() escapes every reserved character, '+' included
        UriComponentsBuilder builder = UriComponentsBuilder.newInstance();
        Map<String, Object> variables = new HashMap<>();
        target.queryParams().forEach((name, values) -> {
            if (PAGINATION_PARAMS.contains(name) || values == null) {
                return;
            }
            for (String value : values) {
                if (value == null) {
                    builder.queryParam(name);
                    continue;
                }
                String variable = "p" + variables.size();
                variables.put(variable, value);
                builder.queryParam(name, "{" + variable + "}");
            }
        });
        variables.put(PAGE_INFO_VARIABLE, token);
        String query = builder
            .queryParam(PARAM_LIMIT, limit)
            .queryParam(PARAM_PAGE_INFO, "{" + PAGE_INFO_VARIABLE + "}")
            .encode()
            .buildAndExpand(variables)
            .getQuery();
        return base + "?" + query;
    }
}
