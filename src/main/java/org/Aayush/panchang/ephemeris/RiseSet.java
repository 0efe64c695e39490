package org.Aayush.panchang.ephemeris;

import lombok.Value;
import org.Aayush.core.time.JulianInstant;

/**
 * Sunrise and the first sunset at or after it for one location.
 */
@Value
public class RiseSet {
    JulianInstant sunrise;
    JulianInstant sunset;
}
