package net.tvcatalog.support.pagination;

import java.util.Map;

/**
 * Validated pagination request in exactly one of two modes.
 *
 * <ul>
 *   <li>OFFSET mode: {@code cursorValues == null}, optional {@code limit} and {@code offset}.</li>
 *   <li>CURSOR mode: {@code cursorValues != null}, {@code offset == 0}, {@code usingPageInfo == true},
 *       {@code limit} always set.</li>
 * </ul>
 *
 * @param limit requested page size, or {@code null} for an unbounded listing
 * @param offset rows to skip in OFFSET mode
 * @param cursorValues anchor sort values from {@code page_info}
 * @param cursorDirection traversal direction from {@code page_info}
 * @param usingPageInfo whether the request carried {@code page_info}
 */
public record PageRequest(Integer limit,
                          int offset,
                          Map<String, Object> cursorValues,
                          CursorDirection cursorDirection,
                          boolean usingPageInfo) {

    public PageRequest {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (offset > 0 && limit == null) {
            throw new IllegalArgumentException("offset requires limit");
        }
        if (cursorValues != null) {
            if (offset != 0 || !usingPageInfo || cursorDirection == null) {
                throw new IllegalArgumentException("cursor requests cannot carry an offset");
            }
            cursorValues = Map.copyOf(cursorValues);
        }
    }

    public static PageRequest unbounded() {
        return new PageRequest(null, 0, null, null, false);
    }

    public static PageRequest offset(Integer limit, int offset) {
        return new PageRequest(limit, offset, null, null, false);
    }

    public static PageRequest cursor(int limit, CursorDirection direction, Map<String, Object> values) {
        return new PageRequest(limit, 0, values, direction, true);
    }

    public boolean hasCursor() {
        return cursorValues != null;
    }

    public boolean isBackward() {
        return hasCursor() && cursorDirection.isBackward();
    }
}
