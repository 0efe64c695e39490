package org.Aayush.panchang.ephemeris;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure raised by ephemeris adapters.
 */
@Getter
public class EphemerisException extends RuntimeException {

    /**
     * Failure categories an adapter can report.
     */
    public enum Kind {
        /** The Sun stays below the horizon for the whole search window. */
        NEVER_RISES,
        /** The Sun stays above the horizon for the whole search window. */
        NEVER_SETS,
        /** The backing ephemeris could not be evaluated (missing data files, range, I/O). */
        UNAVAILABLE
    }

    private final Kind kind;

    public EphemerisException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public EphemerisException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }
}
