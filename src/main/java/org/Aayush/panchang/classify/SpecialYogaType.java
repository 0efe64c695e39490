package org.Aayush.panchang.classify;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Day-level special yoga with its display metadata.
 */
@Getter
@RequiredArgsConstructor
public enum SpecialYogaType {
    AMRITA(
            "Amirtha Yogam",
            "Highly Auspicious",
            "Nectar combination of weekday and nakshatra; suited to every auspicious beginning.",
            "#2E7D32"
    ),
    SIDDHA(
            "Siddha Yogam",
            "Auspicious",
            "Accomplishing combination; undertakings begun today tend to succeed.",
            "#1565C0"
    ),
    MARANA(
            "Marana Yogam",
            "Inauspicious",
            "Adverse combination; avoid new ventures, ceremonies and long journeys.",
            "#C62828"
    );

    private final String localName;
    private final String severity;
    private final String description;
    private final String color;
}
