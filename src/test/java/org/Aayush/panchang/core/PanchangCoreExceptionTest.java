package org.Aayush.panchang.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("PanchangCoreException Tests")
class PanchangCoreExceptionTest {

    @ParameterizedTest
    @CsvSource({
            "P01_DATE_MALFORMED, INVALID_INPUT",
            "P01_LOCATION_REQUIRED, INVALID_INPUT",
            "P02_EPHEMERIS_FAILURE, EPHEMERIS",
            "P03_RENDER_FAILURE, RENDERING",
            "X99_UNKNOWN, UNCLASSIFIED"
    })
    @DisplayName("Category follows the reason-code prefix")
    void testCategoryByPrefix(String reasonCode, PanchangCoreException.Category category) {
        PanchangCoreException ex = new PanchangCoreException(reasonCode, "failed");
        assertEquals(category, ex.getCategory());
        assertEquals(category == PanchangCoreException.Category.INVALID_INPUT, ex.isInvalidInput());
    }

    @Test
    @DisplayName("Message carries the bracketed reason code and the cause is kept")
    void testMessageAndCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        PanchangCoreException ex = new PanchangCoreException(PanchangCore.REASON_EPHEMERIS_FAILURE, "sunrise", cause);

        assertEquals("[" + PanchangCore.REASON_EPHEMERIS_FAILURE + "] sunrise", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertFalse(ex.isInvalidInput());
    }

    @Test
    @DisplayName("Reason code must be present and non-blank")
    void testReasonCodeRequired() {
        assertThrows(NullPointerException.class, () -> new PanchangCoreException(null, "failed"));
        assertThrows(IllegalArgumentException.class, () -> new PanchangCoreException("  ", "failed"));
    }

    @Test
    void testCategoryOfUnknownPrefix() {
        assertEquals(PanchangCoreException.Category.UNCLASSIFIED, PanchangCoreException.Category.of("P04_LATER"));
        assertEquals(PanchangCoreException.Category.INVALID_INPUT,
                PanchangCoreException.Category.of(PanchangCore.REASON_DATE_REQUIRED));
    }
}
