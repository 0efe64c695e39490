package org.Aayush.panchang.division;

import lombok.Builder;
import lombok.Value;
import org.Aayush.core.time.AstroTime;
import org.Aayush.core.time.JulianInstant;

/**
 * Immutable time window produced by the day-division engine.
 */
@Value
@Builder
public class Window {
    JulianInstant start;
    JulianInstant end;
    /** {@code true} when {@code end} is at or past one full day after the governing sunrise. */
    boolean crossesIntoNextDay;
    /** Local time-of-day of {@code start}, date-annotated on rollover. */
    String startTime;
    /** Local time-of-day of {@code end}, date-annotated on rollover. */
    String endTime;

    /**
     * Window length in minutes.
     */
    public double durationMinutes() {
        return start.daysUntil(end) * AstroTime.MINUTES_PER_DAY;
    }
}
