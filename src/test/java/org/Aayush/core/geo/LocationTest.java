package org.Aayush.core.geo;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LocationTest {

    @ParameterizedTest
    @CsvSource({
            "13.0827, 80.2707, true, true",
            "90.0, 180.0, true, true",
            "-90.0, -180.0, true, true",
            "90.5, 80.0, false, true",
            "13.0, -180.5, true, false",
            "NaN, 80.0, false, true",
            "13.0, Infinity, true, false"
    })
    void testRangeChecks(double latitude, double longitude, boolean validLatitude, boolean validLongitude) {
        Location location = Location.of(latitude, longitude);
        assertEquals(validLatitude, location.hasValidLatitude());
        assertEquals(validLongitude, location.hasValidLongitude());
    }
}
