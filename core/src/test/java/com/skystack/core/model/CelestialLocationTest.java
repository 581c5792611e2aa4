package com.skystack.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CelestialLocationTest {
    @Test
    void roundsToThreeDecimals() {
        CelestialLocation location = CelestialLocation.rounded(123.45678, -45.00049);

        assertEquals(123.457, location.rightAscension());
        assertEquals(-45.0, location.declination());
    }

    @Test
    void roundedRightAscensionWrapsToZero() {
        assertEquals(0.0, CelestialLocation.rounded(359.9996, 12.0).rightAscension());
    }

    @Test
    void equalityIsExactAndIgnoresNegativeZero() {
        assertEquals(new CelestialLocation(0.0, 0.0), new CelestialLocation(-0.0, -0.0));
        assertEquals(new CelestialLocation(10.5, 20.25), new CelestialLocation(10.5, 20.25));
        assertNotEquals(new CelestialLocation(10.5, 20.25), new CelestialLocation(10.5, 20.2500001));
    }

    @Test
    void rejectsOutOfRangeCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> new CelestialLocation(360.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new CelestialLocation(-0.1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new CelestialLocation(10.0, 90.5));
        assertThrows(IllegalArgumentException.class, () -> new CelestialLocation(Double.NaN, 0.0));
    }

    @Test
    void fileKeyUsesPlainRoundedDecimals() {
        assertEquals("RA_10.0__DEC_-5.25", new CelestialLocation(10.0, -5.25).fileKey());
        assertEquals("RA_201.365__DEC_0.001", new CelestialLocation(201.36512, 0.0009).fileKey());
    }
}
