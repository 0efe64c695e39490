package org.Aayush.panchang.classify;

import lombok.Value;

/**
 * Nokku Naal result for one nakshatra.
 */
@Value
public class NokkuNaal {
    String nakshatra;
    NokkuDirection direction;
    String label;
    String guidance;
}
