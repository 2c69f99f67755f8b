package net.tvcatalog.util;

import net.tvcatalog.exception.InvalidDateRangeException;
import net.tvcatalog.util.DateRangeParser.DateRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateRangeParserTest {

    @Test
    @DisplayName("absent or blank bounds leave the range open")
    void openRange() {
        assertThat(DateRangeParser.parse(null, " ")).isEqualTo(DateRange.unbounded());
    }

    @Test
    @DisplayName("a missing side stays null while the other is parsed")
    void oneSidedRange() {
        DateRange range = DateRangeParser.parse(null, "2024-01-31T10:15:00+00:00");

        assertThat(range.start()).isNull();
        assertThat(range.end()).isEqualTo(LocalDateTime.of(2024, 1, 31, 10, 15));
    }

    @ParameterizedTest
    @CsvSource({
        "2024-01-31T10:15:00+02:00, 2024-01-31T08:15",
        "2024-01-31T10:15:00+0200, 2024-01-31T08:15",
        "2024-01-31T10:15:00-05:30, 2024-01-31T15:45",
        "2024-01-31T10:15:00.250+00:00, 2024-01-31T10:15:00.250"
    })
    @DisplayName("bounds are normalized to UTC")
    void normalizesToUtc(String raw, LocalDateTime expected) {
        DateRange range = DateRangeParser.parse(raw, raw);

        assertThat(range.start()).isEqualTo(expected);
        assertThat(range.end()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-31", "2024-01-31T10:15:00", "2024-01-31T10:15:00Z", "yesterday", "2024-13-45T10:15:00+02:00"})
    @DisplayName("values without an explicit offset or with impossible fields are rejected")
    void rejectsInvalidStart(String raw) {
        assertThatThrownBy(() -> DateRangeParser.parse(raw, null))
            .isInstanceOf(InvalidDateRangeException.class)
            .hasMessage("invalid start date");
    }

    @Test
    void reportsWhichBoundIsInvalid() {
        assertThatThrownBy(() -> DateRangeParser.parse("2024-01-31T10:15:00+02:00", "soon"))
            .isInstanceOf(InvalidDateRangeException.class)
            .hasMessage("invalid end date");
    }
}
