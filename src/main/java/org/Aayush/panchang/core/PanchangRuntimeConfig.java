package org.Aayush.panchang.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.panchang.scan.BoundaryRefinement;

/**
 * Runtime configuration bound once when the panchang facade is built.
 */
@Value
@Builder
public class PanchangRuntimeConfig {

    /**
     * Offset applied when a request omits one. Defaults to India Standard Time.
     */
    @Builder.Default
    double defaultUtcOffsetHours = 5.5d;

    @Builder.Default
    double minUtcOffsetHours = -12.0d;

    @Builder.Default
    double maxUtcOffsetHours = 14.0d;

    /**
     * Earliest accepted civil year (inclusive).
     */
    @Builder.Default
    int minSupportedYear = 1900;

    /**
     * Latest accepted civil year (inclusive).
     */
    @Builder.Default
    int maxSupportedYear = 2100;

    /**
     * Boundary placement for element transitions.
     *
     * <p>{@code NONE} keeps minute resolution; {@code BISECTION} refines each boundary to a second.</p>
     */
    @Builder.Default
    BoundaryRefinement boundaryRefinement = BoundaryRefinement.NONE;

    /**
     * Returns the default configuration (IST default offset, 1900-2100, minute resolution).
     */
    public static PanchangRuntimeConfig defaults() {
        return PanchangRuntimeConfig.builder().build();
    }

    /**
     * Returns {@code true} when the offset lies in the accepted range.
     */
    public boolean acceptsUtcOffset(double utcOffsetHours) {
        return Double.isFinite(utcOffsetHours)
                && utcOffsetHours >= minUtcOffsetHours
                && utcOffsetHours <= maxUtcOffsetHours;
    }

    /**
     * Returns {@code true} when the year lies in the accepted range.
     */
    public boolean acceptsYear(int year) {
        return year >= minSupportedYear && year <= maxSupportedYear;
    }

    /**
     * Checks internal consistency of the bounds.
     *
     * @throws IllegalArgumentException when a bound is inverted or the default offset is out of range.
     */
    public PanchangRuntimeConfig validate() {
        if (minSupportedYear > maxSupportedYear) {
            throw new IllegalArgumentException("minSupportedYear must not exceed maxSupportedYear");
        }
        if (!(minUtcOffsetHours <= maxUtcOffsetHours)) {
            throw new IllegalArgumentException("minUtcOffsetHours must not exceed maxUtcOffsetHours");
        }
        if (minUtcOffsetHours < -18.0d || maxUtcOffsetHours > 18.0d) {
            throw new IllegalArgumentException("UTC offset bounds must stay within [-18, 18] hours");
        }
        if (!acceptsUtcOffset(defaultUtcOffsetHours)) {
            throw new IllegalArgumentException("defaultUtcOffsetHours outside the accepted range");
        }
        if (boundaryRefinement == null) {
            throw new IllegalArgumentException("boundaryRefinement must be set");
        }
        return this;
    }
}
