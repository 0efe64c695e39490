package org.Aayush.panchang.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;

/**
 * Panchang facade failure with a deterministic reason code.
 *
 * <p>Reason codes are grouped by prefix: {@code P01_} rejected input, {@code P02_} ephemeris
 * failure, {@code P03_} report rendering. The group is exposed as {@link #getCategory()} so transport
 * layers can map failures without parsing codes.</p>
 */
@Getter
public final class PanchangCoreException extends RuntimeException {
    private final String reasonCode;
    private final Category category;

    /**
     * Failure group derived from the reason-code prefix.
     */
    @Getter
    @RequiredArgsConstructor
    public enum Category {
        /** Request rejected before any ephemeris call. */
        INVALID_INPUT("P01_"),
        /** Ephemeris threw or returned an unusable result; no report was built. */
        EPHEMERIS("P02_"),
        /** Report was built but could not be rendered. */
        RENDERING("P03_"),
        /** Code outside the known prefixes. */
        UNCLASSIFIED("");

        private final String prefix;

        /**
         * Resolves the group of a reason code.
         */
        public static Category of(String reasonCode) {
            for (Category category : values()) {
                if (!category.prefix.isEmpty() && reasonCode.startsWith(category.prefix)) {
                    return category;
                }
            }
            return UNCLASSIFIED;
        }
    }

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PanchangCoreException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
        this.category = Category.of(this.reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause, usually an {@code EphemerisException} or a Jackson failure.
     */
    public PanchangCoreException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
        this.category = Category.of(this.reasonCode);
    }

    /**
     * Returns {@code true} when the caller's input was rejected, as opposed to a runtime failure.
     */
    public boolean isInvalidInput() {
        return category == Category.INVALID_INPUT;
    }

    /**
     * Prefixes the message with the bracketed reason code, e.g. {@code [P01_DATE_MALFORMED] ...}.
     */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Validates reason-code contract: non-null and non-blank.
     */
    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
