package org.Aayush.panchang.classify;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Nokku Naal groups: which way the day's nakshatra "looks".
 */
@Getter
@RequiredArgsConstructor
public enum NokkuDirection {
    UPWARD(
            "Mel Nokku Naal",
            "Upward-looking day: favourable for raising structures, flag hoisting, planting trees and starting tall constructions."
    ),
    DOWNWARD(
            "Keezh Nokku Naal",
            "Downward-looking day: favourable for digging wells, foundations, mining and storing grain."
    ),
    FORWARD(
            "Sama Nokku Naal",
            "Forward-looking day: favourable for travel, vehicles, ploughing, trade and road work."
    ),
    UNCLASSIFIED(
            "Unclassified",
            "The nakshatra is not part of any Nokku Naal group."
    );

    private final String label;
    private final String guidance;
}
