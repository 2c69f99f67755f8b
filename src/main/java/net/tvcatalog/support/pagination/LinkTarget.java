package net.tvcatalog.support.pagination;

import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Objects;

/**
 * Where continuation links point: the request URL without its query string and the
 * request's query parameters.
 *
 * @param baseUrl absolute or path-relative URL of the listing
 * @param queryParams all query parameters of the current request; pagination ones are replaced
 */
public record LinkTarget(String baseUrl, MultiValueMap<String, String> queryParams) {
    public LinkTarget {
        Objects.requireNonNull(baseUrl, "baseUrl");
        queryParams = queryParams == null ? new LinkedMultiValueMap<>() : new LinkedMultiValueMap<>(queryParams);
    }

    public static LinkTarget of(String baseUrl) {
        return new LinkTarget(baseUrl, null);
    }
}
