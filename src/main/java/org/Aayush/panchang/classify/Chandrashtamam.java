package org.Aayush.panchang.classify;

import lombok.Builder;
import lombok.Value;

/**
 * Moon's current rasi/nakshatra and the positions eight places ahead of them.
 */
@Value
@Builder
public class Chandrashtamam {
    int currentRasiIndex;
    String currentRasi;
    int currentNakshatraIndex;
    String currentNakshatra;
    int rasiIndex;
    String rasi;
    int nakshatraIndex;
    String nakshatra;
    String description;
}
