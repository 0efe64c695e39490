package org.Aayush.core.time;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class AstroTimeTest {

    // ========== Angle Tests ==========

    @ParameterizedTest
    @CsvSource({
            "0.0, 0.0",
            "359.5, 359.5",
            "360.0, 0.0",
            "725.0, 5.0",
            "-30.0, 330.0",
            "-720.0, 0.0"
    })
    void testNormalizeDegrees(double input, double expected) {
        assertEquals(expected, AstroTime.normalizeDegrees(input), 1e-9);
    }

    @Test
    void testModulo_TinyNegativeStaysBelowDivisor() {
        // 360 - 1e-15 rounds to 360 in double precision
        double reduced = AstroTime.modulo(-1e-15, 360.0d);
        assertTrue(reduced >= 0.0d && reduced < 360.0d);
    }

    @ParameterizedTest
    @CsvSource({
            "39.08333, 39.08",
            "0.125, 0.13",
            "100.0, 100.0",
            "0.004, 0.0"
    })
    void testRound2_HalfUp(double input, double expected) {
        assertEquals(expected, AstroTime.round2(input), 1e-12);
    }

    // ========== Julian Day Conversion Tests ==========

    @Test
    void testUnixEpochRoundTrip() {
        assertEquals(Instant.EPOCH, AstroTime.toInstant(AstroTime.JULIAN_DAY_UNIX_EPOCH));
        assertEquals(AstroTime.JULIAN_DAY_UNIX_EPOCH, AstroTime.toJulianDay(Instant.EPOCH), 0.0d);
    }

    @Test
    void testToInstant_KnownSunrise() {
        // 2024-01-15T00:45:00Z
        assertEquals(Instant.parse("2024-01-15T00:45:00Z"), AstroTime.toInstant(2_460_324.53125d));
    }

    @ParameterizedTest
    @CsvSource({
            "2024-01-15, 0.0, 2460324.5",
            "2024-01-15, 5.5, 2460324.2708333333",
            "2024-01-15, -8.0, 2460324.8333333333",
            "1970-01-01, 0.0, 2440587.5"
    })
    void testLocalMidnightJulianDay(String date, double offset, double expected) {
        assertEquals(expected, AstroTime.localMidnightJulianDay(LocalDate.parse(date), offset), 1e-9);
    }

    @Test
    void testToLocalDateTime_AppliesOffset() {
        assertEquals(
                LocalDate.parse("2024-01-15").atTime(6, 15),
                AstroTime.toLocalDateTime(2_460_324.53125d, 5.5d)
        );
    }

    @ParameterizedTest
    @CsvSource({
            "5.5, +05:30",
            "-3.75, -03:45",
            "0.0, Z",
            "14.0, +14:00"
    })
    void testToZoneOffset(double hours, String expected) {
        assertEquals(ZoneOffset.of(expected), AstroTime.toZoneOffset(hours));
    }

    // ========== Weekday Tests ==========

    @ParameterizedTest
    @CsvSource({
            "2024-01-14, 0",  // Sunday
            "2024-01-15, 1",  // Monday
            "1970-01-01, 4",  // Thursday
            "2024-02-29, 4",  // leap day, Thursday
            "2100-01-02, 6"   // Saturday
    })
    void testWeekdaySundayFirst(String date, int expected) {
        assertEquals(expected, AstroTime.weekdaySundayFirst(LocalDate.parse(date)));
    }
}
