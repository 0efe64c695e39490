package org.Aayush.panchang.ephemeris;

import org.Aayush.core.geo.Location;
import org.Aayush.core.time.JulianInstant;

import java.util.Objects;

/**
 * Complete ephemeris collaborator: positions plus rise/set.
 *
 * <p>Implementations are expected to be synchronous and side-effect free from the engine's point of
 * view. The engine never retries a failed call.</p>
 */
public interface EphemerisPort extends PositionQuery, RiseSetQuery {

    /**
     * Composes a port from two independent queries.
     */
    static EphemerisPort of(PositionQuery positions, RiseSetQuery riseSet) {
        Objects.requireNonNull(positions, "positions");
        Objects.requireNonNull(riseSet, "riseSet");
        return new EphemerisPort() {
            @Override
            public SiderealPositions positionsAt(JulianInstant instant) {
                return positions.positionsAt(instant);
            }

            @Override
            public RiseSet sunRiseSet(JulianInstant approximateInstant, Location location) {
                return riseSet.sunRiseSet(approximateInstant, location);
            }
        };
    }
}
