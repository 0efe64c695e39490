package org.Aayush.core.time;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Caller-supplied civil reference for one report: the civil date and a fixed UTC offset.
 *
 * <p>Used to turn engine instants into local time-of-day labels. A label gets the calendar date
 * appended when its local date differs from {@link #civilDate}, which marks rollover past
 * midnight.</p>
 */
@Value
public class TimeContext {
    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm:ss");

    /** Reference civil date of the report. */
    LocalDate civilDate;
    /** Fixed UTC offset in hours. */
    double utcOffsetHours;

    public TimeContext(LocalDate civilDate, double utcOffsetHours) {
        this.civilDate = Objects.requireNonNull(civilDate, "civilDate");
        if (!Double.isFinite(utcOffsetHours)) {
            throw new IllegalArgumentException("utcOffsetHours must be finite");
        }
        this.utcOffsetHours = utcOffsetHours;
    }

    /**
     * Returns local midnight at the start of the civil date.
     */
    public JulianInstant localMidnight() {
        return JulianInstant.of(AstroTime.localMidnightJulianDay(civilDate, utcOffsetHours));
    }

    /**
     * Returns local midnight at the start of the following civil date.
     */
    public JulianInstant nextLocalMidnight() {
        return JulianInstant.of(AstroTime.localMidnightJulianDay(civilDate.plusDays(1), utcOffsetHours));
    }

    /**
     * Returns the weekday of the civil date, Sunday = 0.
     */
    public int weekday() {
        return AstroTime.weekdaySundayFirst(civilDate);
    }

    /**
     * Returns local date-time of an instant at this context's offset.
     */
    public LocalDateTime localDateTime(JulianInstant instant) {
        return AstroTime.toLocalDateTime(instant.getJulianDay(), utcOffsetHours);
    }

    /**
     * Formats an instant as {@code HH:mm:ss}, or {@code HH:mm:ss (yyyy-MM-dd)} when it falls on
     * another local date than {@link #civilDate}.
     */
    public String label(JulianInstant instant) {
        LocalDateTime local = localDateTime(instant);
        String time = local.format(TIME_OF_DAY);
        if (local.toLocalDate().equals(civilDate)) {
            return time;
        }
        return time + " (" + local.toLocalDate() + ")";
    }
}
