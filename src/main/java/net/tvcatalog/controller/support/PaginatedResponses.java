package net.tvcatalog.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import net.tvcatalog.support.pagination.LinkTarget;
import net.tvcatalog.support.pagination.PaginatedResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Bridges servlet requests and paginated results: derives the link target from the current
 * request and writes the {@code Link} header when the page has neighbours.
 */
public final class PaginatedResponses {

    private PaginatedResponses() {
        // Utility class
    }

    /**
     * @param request current request
     * @param linkBaseUrl optional absolute prefix (scheme + host); blank keeps links path-relative
     */
    public static LinkTarget linkTarget(HttpServletRequest request, String linkBaseUrl) {
        String path = request.getRequestURI();
        String baseUrl = StringUtils.hasText(linkBaseUrl)
            ? trimTrailingSlash(linkBaseUrl.trim()) + path
            : path;

        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        for (Map.Entry<String, String[]> entry : request.getParameterMap().entrySet()) {
            params.put(entry.getKey(), Arrays.asList(entry.getValue()));
        }
        return new LinkTarget(baseUrl, params);
    }

    public static <R> ResponseEntity<List<R>> toResponse(PaginatedResponse<R> response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        response.linkHeader().ifPresent(link -> builder.header(HttpHeaders.LINK, link));
        return builder.body(response.items());
    }

    private static String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
