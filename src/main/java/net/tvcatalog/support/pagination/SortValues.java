package net.tvcatalog.support.pagination;

import java.time.LocalDate;

/**
 * Store-value transforms for {@link OrderKey#storeValueMapper()}, turning JSON-decoded cursor
 * values back into the types bound against the sort expression. Anything unexpected throws,
 * which the planner reports as an invalid cursor.
 */
public final class SortValues {

    /** Sentinel for NULL integer sort keys; keeps NULLs last in ascending order. */
    public static final int NULL_INT_SENTINEL = Integer.MAX_VALUE;

    /** Sentinel for NULL date sort keys. */
    public static final LocalDate NULL_DATE_SENTINEL = LocalDate.of(9999, 12, 31);

    private SortValues() {
        // Utility class
    }

    public static Object toLong(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("Expected an integral value but got " + describe(value));
    }

    public static Object toInteger(Object value) {
        if (value instanceof Integer || value instanceof Short) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long longValue
            && longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
            return longValue.intValue();
        }
        throw new IllegalArgumentException("Expected an int value but got " + describe(value));
    }

    public static Object toText(Object value) {
        if (value instanceof String) {
            return value;
        }
        throw new IllegalArgumentException("Expected a string value but got " + describe(value));
    }

    /**
     * Parses an ISO-8601 calendar date ({@code 2004-06-11}).
     */
    public static Object toLocalDate(Object value) {
        if (value instanceof String text) {
            return LocalDate.parse(text);
        }
        throw new IllegalArgumentException("Expected an ISO date string but got " + describe(value));
    }

    public static int intOrSentinel(Integer value) {
        return value == null ? NULL_INT_SENTINEL : value;
    }

    public static String dateOrSentinel(LocalDate value) {
        return (value == null ? NULL_DATE_SENTINEL : value).toString();
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }
}
