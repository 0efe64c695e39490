package org.Aayush.panchang.classify;

import lombok.Value;
import org.Aayush.panchang.division.AuspiciousClass;

/**
 * Weekday + nakshatra yoga from the 27-entry Amirthathi cycle.
 */
@Value
public class AmirthathiYoga {
    /** 0-based position in the Amirthathi table. */
    int index;
    String name;
    AuspiciousClass auspiciousClass;
}
