package net.tvcatalog.support.pagination;

import lombok.extern.slf4j.Slf4j;
import net.tvcatalog.exception.InvalidCursorException;
import net.tvcatalog.exception.InvalidPaginationParamsException;
import net.tvcatalog.util.SafeNumberParser;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * Validates raw {@code limit}, {@code offset} and {@code page_info} query values into a {@link PageRequest}.
 * Blank values count as absent.
 */
@Component
@Slf4j
public class PageRequestParser {

    static final String LIMIT_NOT_POSITIVE = "limit must be a positive integer";
    static final String OFFSET_NOT_NON_NEGATIVE = "offset must be a non-negative integer";
    static final String OFFSET_WITHOUT_LIMIT = "limit is required when using offset";
    static final String OFFSET_WITH_PAGE_INFO = "offset cannot be combined with page_info";
    static final String LIMIT_MISMATCH = "limit must match the value embedded in page_info";
    static final String LIMIT_REQUIRED_FOR_PAGE_INFO = "limit is required when using page_info";

    private final CursorCodec cursorCodec;

    public PageRequestParser(CursorCodec cursorCodec) {
        this.cursorCodec = Objects.requireNonNull(cursorCodec, "cursorCodec");
    }

    /**
     * @param rawLimit raw {@code limit} value, may be {@code null}
     * @param rawOffset raw {@code offset} value, may be {@code null}
     * @param rawPageInfo raw {@code page_info} value, may be {@code null}
     * @return request in OFFSET or CURSOR mode
     * @throws InvalidPaginationParamsException for bad or conflicting parameters
     * @throws InvalidCursorException when {@code page_info} cannot be decoded
     */
    public PageRequest parse(String rawLimit, String rawOffset, String rawPageInfo) {
        boolean hasLimit = StringUtils.hasText(rawLimit);
        boolean hasOffset = StringUtils.hasText(rawOffset);
        boolean hasPageInfo = StringUtils.hasText(rawPageInfo);

        Integer limit = null;
        if (hasLimit) {
            limit = SafeNumberParser.parseIntOrNull(rawLimit);
            if (limit == null || limit <= 0) {
                throw new InvalidPaginationParamsException(LIMIT_NOT_POSITIVE);
            }
        }

        if (hasPageInfo) {
            if (hasOffset) {
                throw new InvalidPaginationParamsException(OFFSET_WITH_PAGE_INFO);
            }
            return parseCursorRequest(limit, rawPageInfo);
        }

        int offset = 0;
        if (hasOffset) {
            Integer parsedOffset = SafeNumberParser.parseIntOrNull(rawOffset);
            if (parsedOffset == null || parsedOffset < 0) {
                throw new InvalidPaginationParamsException(OFFSET_NOT_NON_NEGATIVE);
            }
            if (limit == null) {
                throw new InvalidPaginationParamsException(OFFSET_WITHOUT_LIMIT);
            }
            offset = parsedOffset;
        }
        return PageRequest.offset(limit, offset);
    }

    private PageRequest parseCursorRequest(Integer explicitLimit, String rawPageInfo) {
        CursorToken token = cursorCodec.decode(rawPageInfo)
            .orElseThrow(InvalidCursorException::new);

        Integer embeddedLimit = token.limit();
        if (embeddedLimit != null && embeddedLimit <= 0) {
            log.debug("Rejected page_info with non-positive embedded limit {}", embeddedLimit);
            throw new InvalidCursorException();
        }
        if (explicitLimit != null && embeddedLimit != null && !explicitLimit.equals(embeddedLimit)) {
            throw new InvalidPaginationParamsException(LIMIT_MISMATCH);
        }
        Integer limit = explicitLimit != null ? explicitLimit : embeddedLimit;
        if (limit == null) {
            throw new InvalidPaginationParamsException(LIMIT_REQUIRED_FOR_PAGE_INFO);
        }
        return PageRequest.cursor(limit, token.direction(), token.values());
    }
}
