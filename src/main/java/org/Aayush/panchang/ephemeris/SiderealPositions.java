package org.Aayush.panchang.ephemeris;

import lombok.Value;
import org.Aayush.core.time.AstroTime;

/**
 * Sidereal (ayanamsa-adjusted) ecliptic longitudes of the Sun and the Moon at one instant.
 *
 * <p>Both values are normalized into {@code [0, 360)} on construction. Every element
 * calculator consumes sidereal longitudes only; tropical values must be corrected by the
 * ephemeris adapter before they reach the engine.</p>
 */
@Value
public class SiderealPositions {
    /** Sun sidereal longitude in degrees. */
    double sunLongitude;
    /** Moon sidereal longitude in degrees. */
    double moonLongitude;

    private SiderealPositions(double sunLongitude, double moonLongitude) {
        if (!Double.isFinite(sunLongitude) || !Double.isFinite(moonLongitude)) {
            throw new IllegalArgumentException(
                    "longitudes must be finite: sun=" + sunLongitude + ", moon=" + moonLongitude);
        }
        this.sunLongitude = AstroTime.normalizeDegrees(sunLongitude);
        this.moonLongitude = AstroTime.normalizeDegrees(moonLongitude);
    }

    /**
     * Creates normalized positions.
     *
     * @param sunLongitude sidereal Sun longitude in degrees, any finite value.
     * @param moonLongitude sidereal Moon longitude in degrees, any finite value.
     */
    public static SiderealPositions of(double sunLongitude, double moonLongitude) {
        return new SiderealPositions(sunLongitude, moonLongitude);
    }
}
