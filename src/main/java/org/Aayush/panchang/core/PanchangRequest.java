package org.Aayush.panchang.core;

import lombok.Builder;
import lombok.Value;

/**
 * Client-facing panchang request.
 */
@Value
@Builder
public class PanchangRequest {
    /** Civil date in {@code yyyy-MM-dd}. */
    String date;
    /** Latitude in decimal degrees, {@code [-90, 90]}; required. */
    Double latitude;
    /** Longitude in decimal degrees, {@code [-180, 180]}; required. */
    Double longitude;
    /** UTC offset in hours; {@code null} selects the configured default. */
    Double utcOffsetHours;
}
