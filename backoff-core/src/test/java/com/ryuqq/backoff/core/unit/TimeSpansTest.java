package com.ryuqq.backoff.core.unit;

import com.ryuqq.backoff.core.exception.BackoffInitializationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * TimeSpans / UnitType 테스트.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
class TimeSpansTest {

    // ============================================================
    // convert
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "1,       seconds,      seconds,      1",
        "1,       seconds,      milliseconds, 1000",
        "1,       seconds,      microseconds, 1000000",
        "1500,    milliseconds, seconds,      1.5",
        "1,       milliseconds, microseconds, 1000",
        "250,     microseconds, milliseconds, 0.25",
        "2500000, microseconds, seconds,      2.5"
    })
    void convertTimespan_KnownUnits_ConvertsValue(double value, String from, String to, double expected) {
        // When
        Double converted = TimeSpans.convertTimespan(value, from, to);

        // Then
        assertThat(converted).isCloseTo(expected, within(1e-9));
    }

    @Test
    void convertTimespan_NullValue_ReturnsNull() {
        assertThat(TimeSpans.convertTimespan(null, "seconds", "milliseconds")).isNull();
    }

    @Test
    void convertTimespan_UnknownUnit_ReturnsNull() {
        assertThat(TimeSpans.convertTimespan(1.0, "seconds", "minutes")).isNull();
        assertThat(TimeSpans.convertTimespan(1.0, "hours", "seconds")).isNull();
        assertThat(TimeSpans.convertTimespan(1.0, null, "seconds")).isNull();
    }

    @Test
    void convert_NullUnit_ThrowsException() {
        assertThatThrownBy(() -> TimeSpans.convert(1.0, null, UnitType.SECONDS))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Units cannot be null");
    }

    @Test
    void convert_RoundTrip_KeepsValue() {
        // Given
        double seconds = 1.234567;

        // When
        Double us = TimeSpans.convert(seconds, UnitType.SECONDS, UnitType.MICROSECONDS);
        Double back = TimeSpans.convert(us, UnitType.MICROSECONDS, UnitType.SECONDS);

        // Then
        assertThat(back).isCloseTo(seconds, within(1e-12));
    }

    @Test
    void convertAsNumber_NullValue_ReturnsZero() {
        assertThat(TimeSpans.convertAsNumber(null, UnitType.SECONDS, UnitType.MILLISECONDS)).isEqualTo(0.0);
        assertThat(TimeSpans.convertAsNumber(2.0, UnitType.SECONDS, UnitType.MILLISECONDS)).isEqualTo(2000.0);
    }

    // ============================================================
    // toNanos / between
    // ============================================================

    @Test
    void toNanos_PositiveDelay_ConvertsToNanoseconds() {
        assertThat(TimeSpans.toNanos(1.0, UnitType.SECONDS)).isEqualTo(1_000_000_000L);
        assertThat(TimeSpans.toNanos(5.0, UnitType.MILLISECONDS)).isEqualTo(5_000_000L);
        assertThat(TimeSpans.toNanos(7.0, UnitType.MICROSECONDS)).isEqualTo(7_000L);
    }

    @Test
    void toNanos_NullNegativeOrNaN_ReturnsZero() {
        assertThat(TimeSpans.toNanos(null, UnitType.SECONDS)).isZero();
        assertThat(TimeSpans.toNanos(-1.0, UnitType.SECONDS)).isZero();
        assertThat(TimeSpans.toNanos(Double.NaN, UnitType.SECONDS)).isZero();
    }

    @Test
    void between_TwoInstants_ReturnsFractionalSeconds() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = start.plusMillis(1500);

        assertThat(TimeSpans.between(start, end)).isCloseTo(1.5, within(1e-9));
    }

    // ============================================================
    // UnitType
    // ============================================================

    @Test
    void fromName_KnownName_ReturnsUnit() {
        assertThat(UnitType.fromName("seconds")).isEqualTo(UnitType.SECONDS);
        assertThat(UnitType.fromName("milliseconds")).isEqualTo(UnitType.MILLISECONDS);
        assertThat(UnitType.fromName("microseconds")).isEqualTo(UnitType.MICROSECONDS);
    }

    @Test
    void fromName_UnknownName_ThrowsInitializationException() {
        assertThatThrownBy(() -> UnitType.fromName("minutes"))
            .isInstanceOf(BackoffInitializationException.class)
            .hasMessage("Invalid unit type \"minutes\" was given");
    }

    @Test
    void find_UnknownName_ReturnsEmpty() {
        assertThat(UnitType.find("days")).isEmpty();
        assertThat(UnitType.find(null)).isEmpty();
    }
}
