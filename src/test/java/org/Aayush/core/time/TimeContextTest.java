package org.Aayush.core.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TimeContext Tests")
class TimeContextTest {
    private static final double SUNRISE = 2_460_324.53125d;
    private final TimeContext ist = new TimeContext(LocalDate.parse("2024-01-15"), 5.5d);

    @Test
    @DisplayName("Same-date instant is labelled with time of day only")
    void testLabelOnCivilDate() {
        assertEquals("06:15:00", ist.label(JulianInstant.of(SUNRISE)));
        assertEquals("00:00:00", ist.label(ist.localMidnight()));
    }

    @Test
    @DisplayName("Instant past local midnight carries its calendar date")
    void testLabelAfterRollover() {
        assertEquals("06:15:00 (2024-01-16)", ist.label(JulianInstant.of(SUNRISE + 1.0d)));
        assertEquals("00:00:00 (2024-01-16)", ist.label(ist.nextLocalMidnight()));
    }

    @Test
    @DisplayName("Instant before the civil date carries the previous date")
    void testLabelBeforeCivilDate() {
        assertEquals("23:00:00 (2024-01-14)", ist.label(ist.localMidnight().plusDays(-1.0d / 24.0d)));
    }

    @Test
    @DisplayName("Local midnights are one day apart and ordered")
    void testMidnights() {
        assertEquals(1.0d, ist.localMidnight().daysUntil(ist.nextLocalMidnight()), 1e-9);
        assertTrue(ist.localMidnight().isBefore(JulianInstant.of(SUNRISE)));
    }

    @Test
    void testWeekday() {
        assertEquals(1, ist.weekday());
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(NullPointerException.class, () -> new TimeContext(null, 5.5d));
        assertThrows(IllegalArgumentException.class, () -> new TimeContext(LocalDate.parse("2024-01-15"), Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> JulianInstant.of(Double.POSITIVE_INFINITY));
    }
}
