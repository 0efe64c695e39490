package org.Aayush.core.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Shared deterministic time and angle helpers for panchang runtime logic.
 *
 * <p>Time is carried as a Julian day number (fractional days, UT). Civil values are only produced
 * at the edges through a fixed UTC offset; no timezone database is consulted.</p>
 */
public final class AstroTime {

    /** Julian day of the Unix epoch, 1970-01-01T00:00:00Z. */
    public static final double JULIAN_DAY_UNIX_EPOCH = 2_440_587.5d;
    public static final double MINUTES_PER_DAY = 1440.0d;
    public static final double SECONDS_PER_DAY = 86_400.0d;

    private static final double MILLIS_PER_DAY = 86_400_000.0d;
    private static final int SECONDS_PER_HOUR = 3600;
    private static final int DAYS_PER_WEEK = 7;

    /**
     * Prevents instantiation of this utility class.
     */
    private AstroTime() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Floor modulo for doubles: the sign of the result follows the divisor.
     *
     * @param dividend value to reduce.
     * @param divisor positive modulus.
     * @return value in {@code [0, divisor)}.
     */
    public static double modulo(double dividend, double divisor) {
        double reduced = dividend - divisor * Math.floor(dividend / divisor);
        // Tiny negative inputs can round up to the divisor itself.
        if (reduced >= divisor) {
            return 0.0d;
        }
        return reduced;
    }

    /**
     * Normalizes an angle into {@code [0, 360)} degrees.
     */
    public static double normalizeDegrees(double degrees) {
        return modulo(degrees, 360.0d);
    }

    /**
     * Rounds half-up to two decimals, the precision used for percentages and longitudes in reports.
     */
    public static double round2(double value) {
        return Math.round(value * 100.0d) / 100.0d;
    }

    /**
     * Converts a Julian day number to a UTC instant at millisecond resolution.
     */
    public static Instant toInstant(double julianDay) {
        long epochMillis = Math.round((julianDay - JULIAN_DAY_UNIX_EPOCH) * MILLIS_PER_DAY);
        return Instant.ofEpochMilli(epochMillis);
    }

    /**
     * Converts a UTC instant to a Julian day number.
     */
    public static double toJulianDay(Instant instant) {
        return JULIAN_DAY_UNIX_EPOCH + instant.toEpochMilli() / MILLIS_PER_DAY;
    }

    /**
     * Returns the Julian day of local midnight that starts {@code date} at the given offset.
     *
     * @param date proleptic Gregorian civil date.
     * @param utcOffsetHours fixed UTC offset in hours (for example {@code 5.5} for IST).
     */
    public static double localMidnightJulianDay(LocalDate date, double utcOffsetHours) {
        return JULIAN_DAY_UNIX_EPOCH + date.toEpochDay() - utcOffsetHours / 24.0d;
    }

    /**
     * Resolves the civil date-time of a Julian day at a fixed offset.
     */
    public static LocalDateTime toLocalDateTime(double julianDay, double utcOffsetHours) {
        return LocalDateTime.ofInstant(toInstant(julianDay), toZoneOffset(utcOffsetHours));
    }

    /**
     * Converts fractional offset hours to a {@link ZoneOffset}, rounded to the whole second.
     *
     * @throws java.time.DateTimeException when the offset is outside {@code [-18h, +18h]}.
     */
    public static ZoneOffset toZoneOffset(double utcOffsetHours) {
        return ZoneOffset.ofTotalSeconds((int) Math.round(utcOffsetHours * SECONDS_PER_HOUR));
    }

    /**
     * Returns the weekday of a civil date with Sunday as 0.
     *
     * @return day of week: 0=Sunday, 1=Monday, ..., 6=Saturday.
     */
    public static int weekdaySundayFirst(LocalDate date) {
        // ISO numbers Monday=1 .. Sunday=7.
        return date.getDayOfWeek().getValue() % DAYS_PER_WEEK;
    }
}
