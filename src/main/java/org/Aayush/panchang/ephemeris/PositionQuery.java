package org.Aayush.panchang.ephemeris;

import org.Aayush.core.time.JulianInstant;

/**
 * Position query consumed by the element calculators and the transition scanner.
 */
@FunctionalInterface
public interface PositionQuery {

    /**
     * Returns sidereal Sun and Moon longitudes at {@code instant}.
     *
     * @throws EphemerisException when the ephemeris cannot evaluate the instant.
     */
    SiderealPositions positionsAt(JulianInstant instant);
}
