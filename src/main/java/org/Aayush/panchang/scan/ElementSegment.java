package org.Aayush.panchang.scan;

import lombok.Builder;
import lombok.Value;
import org.Aayush.core.time.JulianInstant;
import org.Aayush.panchang.element.PanchangElement;

/**
 * One element unit observed inside a scanned interval.
 */
@Value
@Builder
public class ElementSegment {
    /** Element as evaluated at the segment start. */
    PanchangElement element;
    JulianInstant start;
    JulianInstant end;
    /** Local time-of-day of {@code start}, date-annotated on rollover. */
    String startTime;
    /** Local time-of-day of {@code end}, date-annotated on rollover. */
    String endTime;

    /**
     * Segment length in days.
     */
    public double durationDays() {
        return start.daysUntil(end);
    }
}
