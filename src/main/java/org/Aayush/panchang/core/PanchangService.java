package org.Aayush.panchang.core;

import org.Aayush.core.geo.Location;

import java.time.LocalDate;

/**
 * Service contract for panchang report generation.
 */
public interface PanchangService {

    /**
     * Computes the report for a client request.
     */
    PanchangReport compute(PanchangRequest request);

    /**
     * Computes the report for a civil date, location and fixed UTC offset.
     */
    PanchangReport compute(LocalDate civilDate, Location location, double utcOffsetHours);

    /**
     * Computes the report for the current civil date at the given offset.
     *
     * @param utcOffsetHours offset in hours, or {@code null} for the configured default.
     */
    PanchangReport today(Location location, Double utcOffsetHours);
}
