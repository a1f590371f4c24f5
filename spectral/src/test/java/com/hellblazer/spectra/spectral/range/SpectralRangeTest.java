package com.hellblazer.spectra.spectral.range;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpectralRange Tests")
class SpectralRangeTest {

    @Test
    @DisplayName("Unit constructors")
    void testUnits() {
        assertEquals(new SpectralRange(450e-9, 495e-9), SpectralRange.ofNanometres(450, 495));
        assertEquals(1.4e-6, SpectralRange.ofMicrometres(1.4, 3).start(), 1e-18);
    }

    @Test
    @DisplayName("Invalid bounds are rejected")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new SpectralRange(0.0, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> new SpectralRange(-1e-6, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> new SpectralRange(2e-6, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> new SpectralRange(Double.NaN, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> new SpectralRange(1e-6, Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Closed interval containment")
    void testContains() {
        var range = SpectralRange.ofNanometres(500, 600);

        assertTrue(range.contains(500e-9));
        assertTrue(range.contains(600e-9));
        assertFalse(range.contains(601e-9));
        assertTrue(range.contains(SpectralRange.ofNanometres(520, 580)));
        assertTrue(range.contains(range));
        assertFalse(range.contains(SpectralRange.ofNanometres(450, 580)));
    }

    @Test
    @DisplayName("Overlap includes touching ranges")
    void testOverlaps() {
        var range = SpectralRange.ofNanometres(500, 600);

        assertTrue(range.overlaps(SpectralRange.ofNanometres(600, 700)));
        assertTrue(range.overlaps(SpectralRange.ofNanometres(400, 900)));
        assertFalse(range.overlaps(SpectralRange.ofNanometres(601, 700)));
    }

    @Test
    @DisplayName("Width, center and frequencies")
    void testDerived() {
        var range = new SpectralRange(1e-6, 3e-6);

        assertEquals(2e-6, range.width(), 1e-18);
        assertEquals(2e-6, range.center(), 1e-18);
        assertEquals(SpectralRange.SPEED_OF_LIGHT / 3e-6, range.frequencyMinimum(), 1.0);
        assertEquals(SpectralRange.SPEED_OF_LIGHT / 1e-6, range.frequencyMaximum(), 1.0);
        assertTrue(range.frequencyMinimum() < range.frequencyMaximum());
    }
}
