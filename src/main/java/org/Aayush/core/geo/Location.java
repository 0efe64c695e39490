package org.Aayush.core.geo;

import lombok.Value;

/**
 * Geographic observer location in decimal degrees.
 *
 * <p>Construction accepts any value; the panchang facade rejects locations failing
 * {@link #hasValidLatitude()} or {@link #hasValidLongitude()} with a reason code. Non-finite
 * coordinates fail both checks.</p>
 */
@Value
public class Location {
    /** Latitude in {@code [-90, 90]}, north positive. */
    double latitude;
    /** Longitude in {@code [-180, 180]}, east positive. */
    double longitude;

    public static Location of(double latitude, double longitude) {
        return new Location(latitude, longitude);
    }

    public boolean hasValidLatitude() {
        return latitude >= -90.0d && latitude <= 90.0d;
    }

    public boolean hasValidLongitude() {
        return longitude >= -180.0d && longitude <= 180.0d;
    }
}
