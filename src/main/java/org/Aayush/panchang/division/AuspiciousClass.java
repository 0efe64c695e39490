package org.Aayush.panchang.division;

/**
 * Auspiciousness label attached to named sub-day periods and yogas.
 */
public enum AuspiciousClass {
    AUSPICIOUS,
    INAUSPICIOUS,
    NEUTRAL
}
