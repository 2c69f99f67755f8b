package net.tvcatalog.support.pagination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded continuation token payload: {@code {"v":1,"dir":"next","values":{...},"limit":2}}.
 * Lives only in its serialized form on the client; nothing is stored server-side.
 *
 * @param version payload version, currently {@link #CURRENT_VERSION}
 * @param direction traversal direction from the anchor row
 * @param values anchor row's sort values keyed by order key name
 * @param limit page size the token was minted for, or {@code null}
 */
@JsonPropertyOrder({"v", "dir", "values", "limit"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record CursorToken(
    @JsonProperty("v") Integer version,
    @JsonProperty("dir") CursorDirection direction,
    @JsonProperty("values") Map<String, Object> values,
    @JsonProperty("limit") @JsonInclude(JsonInclude.Include.NON_NULL) Integer limit
) {

    public static final int CURRENT_VERSION = 1;

    public CursorToken {
        values = values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static CursorToken of(CursorDirection direction, Integer limit, Map<String, Object> values) {
        return new CursorToken(CURRENT_VERSION, direction, values, limit);
    }
}
