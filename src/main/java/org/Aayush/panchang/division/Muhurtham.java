package org.Aayush.panchang.division;

import lombok.Value;

/**
 * One muhurta slot of the daylight partition.
 */
@Value
public class Muhurtham {
    /** 1-based muhurta index within daylight. */
    int index;
    /** Slot length in minutes, rounded to two decimals. */
    double durationMinutes;
    Window window;
}
