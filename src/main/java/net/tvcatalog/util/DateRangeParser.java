package net.tvcatalog.util;

import net.tvcatalog.exception.InvalidDateRangeException;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses the {@code start}/{@code end} creation-time filters shared by all list endpoints.
 *
 * <p>Values must be ISO-8601 date-times with an explicit offset
 * ({@code 2024-01-31T10:15:00+02:00}); they are normalized to UTC.</p>
 */
public final class DateRangeParser {

    private static final Pattern DATE_TIME_WITH_OFFSET =
        Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:[+-]\\d{2}:?\\d{2})$");

    private DateRangeParser() {
        // Utility class
    }

    public static DateRange parse(String rawStart, String rawEnd) {
        return new DateRange(
            parseBound(rawStart, "invalid start date"),
            parseBound(rawEnd, "invalid end date")
        );
    }

    private static LocalDateTime parseBound(String raw, String errorMessage) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String candidate = raw.trim();
        if (!DATE_TIME_WITH_OFFSET.matcher(candidate).matches()) {
            throw new InvalidDateRangeException(errorMessage);
        }
        try {
            return OffsetDateTime.parse(normalizeOffset(candidate))
                .withOffsetSameInstant(ZoneOffset.UTC)
                .toLocalDateTime();
        } catch (DateTimeParseException ex) {
            throw new InvalidDateRangeException(errorMessage);
        }
    }

    /**
     * {@code +0200} is accepted by the pattern but not by {@link OffsetDateTime#parse}; insert the colon.
     */
    private static String normalizeOffset(String value) {
        int length = value.length();
        char sign = value.charAt(length - 5);
        if ((sign == '+' || sign == '-') && value.charAt(length - 3) != ':') {
            return value.substring(0, length - 2) + ":" + value.substring(length - 2);
        }
        return value;
    }

    /**
     * Inclusive UTC creation-time bounds; a {@code null} side is open.
     */
    public record DateRange(LocalDateTime start, LocalDateTime end) {
        public static DateRange unbounded() {
            return new DateRange(null, null);
        }
    }
}
