package org.Aayush.panchang.core;

import org.Aayush.panchang.scan.BoundaryRefinement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Panchang Runtime Config Tests")
class PanchangRuntimeConfigTest {

    @Test
    void testDefaults() {
        PanchangRuntimeConfig config = PanchangRuntimeConfig.defaults();
        assertEquals(5.5d, config.getDefaultUtcOffsetHours(), 0.0d);
        assertEquals(1900, config.getMinSupportedYear());
        assertEquals(2100, config.getMaxSupportedYear());
        assertEquals(BoundaryRefinement.NONE, config.getBoundaryRefinement());
        assertSame(config, config.validate());
    }

    @ParameterizedTest
    @CsvSource({
            "-12.0, true",
            "14.0, true",
            "5.75, true",
            "-12.25, false",
            "14.01, false",
            "Infinity, false"
    })
    void testAcceptsUtcOffset(double offset, boolean accepted) {
        assertEquals(accepted, PanchangRuntimeConfig.defaults().acceptsUtcOffset(offset));
    }

    @Test
    void testAcceptsYear() {
        PanchangRuntimeConfig config = PanchangRuntimeConfig.builder().minSupportedYear(2000).maxSupportedYear(2030).build();
        assertTrue(config.acceptsYear(2000));
        assertTrue(config.acceptsYear(2030));
        assertFalse(config.acceptsYear(1999));
        assertFalse(config.acceptsYear(2031));
    }

    @Test
    @DisplayName("Inconsistent bounds are rejected")
    void testValidateRejectsInconsistentBounds() {
        assertThrows(IllegalArgumentException.class, () -> PanchangRuntimeConfig.builder()
                .minUtcOffsetHours(3.0d).maxUtcOffsetHours(1.0d).defaultUtcOffsetHours(2.0d).build().validate());
        assertThrows(IllegalArgumentException.class, () -> PanchangRuntimeConfig.builder()
                .minUtcOffsetHours(-20.0d).build().validate());
        assertThrows(IllegalArgumentException.class, () -> PanchangRuntimeConfig.builder()
                .defaultUtcOffsetHours(15.0d).build().validate());
        assertThrows(IllegalArgumentException.class, () -> PanchangRuntimeConfig.builder()
                .boundaryRefinement(null).build().validate());
    }
}
