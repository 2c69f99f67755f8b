package net.tvcatalog.util;

import lombok.extern.slf4j.Slf4j;

/**
 * Null-safe number parsing for raw query-string values.
 *
 * <p>Returns {@code null} instead of throwing so callers can decide which
 * validation error names the offending parameter.</p>
 */
@Slf4j
public final class SafeNumberParser {

    private SafeNumberParser() {
        // Utility class
    }

    /**
     * Parses a base-10 integer, rejecting blanks, decimals and overflow.
     *
     * <pre>{@code
     * SafeNumberParser.parseIntOrNull(" 12 ")  // 12
     * SafeNumberParser.parseIntOrNull("1.5")   // null
     * SafeNumberParser.parseIntOrNull(null)    // null
     * }</pre>
     */
    public static Integer parseIntOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Failed to parse integer '{}': {}", value, e.getMessage());
            return null;
        }
    }
}
