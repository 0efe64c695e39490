package org.Aayush.panchang.ephemeris;

import org.Aayush.core.geo.Location;
import org.Aayush.core.time.JulianInstant;

/**
 * Rise/set query consumed by the panchang facade to resolve the sunrise-bounded day.
 */
@FunctionalInterface
public interface RiseSetQuery {

    /**
     * Returns the first sunrise at or after {@code approximateInstant} and the first sunset at or
     * after that sunrise.
     *
     * @param approximateInstant search start, typically local midnight of the civil date.
     * @param location observer location.
     * @throws EphemerisException when the Sun does not rise or set, or the ephemeris is unavailable.
     */
    RiseSet sunRiseSet(JulianInstant approximateInstant, Location location);
}
