package org.Aayush.core.time;

import lombok.Value;

/**
 * Immutable continuous time coordinate expressed as a fractional Julian day (UT).
 */
@Value
public class JulianInstant {
    /** Fractional day count. */
    double julianDay;

    private JulianInstant(double julianDay) {
        if (!Double.isFinite(julianDay)) {
            throw new IllegalArgumentException("julianDay must be finite: " + julianDay);
        }
        this.julianDay = julianDay;
    }

    /**
     * Creates an instant from a Julian day number.
     */
    public static JulianInstant of(double julianDay) {
        return new JulianInstant(julianDay);
    }

    /**
     * Returns a new instant shifted by a (possibly negative) fraction of days.
     */
    public JulianInstant plusDays(double days) {
        return new JulianInstant(julianDay + days);
    }

    /**
     * Returns signed elapsed days from this instant to {@code other}.
     */
    public double daysUntil(JulianInstant other) {
        return other.julianDay - julianDay;
    }

    public boolean isBefore(JulianInstant other) {
        return julianDay < other.julianDay;
    }

    public boolean isAfter(JulianInstant other) {
        return julianDay > other.julianDay;
    }
}
