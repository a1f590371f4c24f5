package com.hellblazer.spectra.spectral.raster;

import com.hellblazer.spectra.spectral.exceptions.BandResolutionMismatchException;
import com.hellblazer.spectra.spectral.exceptions.InvalidBandCountException;
import com.hellblazer.spectra.spectral.exceptions.InvalidDimensionException;
import com.hellblazer.spectra.spectral.exceptions.InvalidRadiometricResolutionException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.exceptions.SpectralConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RasterSpecification Tests")
class RasterSpecificationTest {

    @Test
    @DisplayName("Uniform resolution specification")
    void testUniformResolution() {
        var spec = RasterSpecification.validate(3, 100, 200, 12);

        assertEquals(RasterFormat.ANY, spec.format());
        assertEquals(3, spec.numberOfBands());
        assertEquals(100, spec.numberOfRows());
        assertEquals(200, spec.numberOfColumns());
        assertEquals(List.of(12, 12, 12), spec.radiometricResolutions());
        assertTrue(spec.isUniform());
        assertEquals(12, spec.maxRadiometricResolution());
    }

    @Test
    @DisplayName("Default resolution depends on the format")
    void testDefaultResolution() {
        assertEquals(List.of(16, 16), RasterSpecification.validate(2, 1, 1).radiometricResolutions());
        assertEquals(List.of(16), RasterSpecification.validate(RasterFormat.INTEGER, 1, 1, 1).radiometricResolutions());
        assertEquals(List.of(32), RasterSpecification.validate(RasterFormat.FLOATING, 1, 1, 1).radiometricResolutions());
    }

    @Test
    @DisplayName("Per band resolutions are kept in order")
    void testPerBandResolutions() {
        var spec = RasterSpecification.validate(RasterFormat.INTEGER, 3, 4, 5, List.of(8, 16, 1));

        assertEquals(8, spec.radiometricResolution(0));
        assertEquals(16, spec.radiometricResolution(1));
        assertEquals(1, spec.radiometricResolution(2));
        assertFalse(spec.isUniform());
        assertEquals(16, spec.maxRadiometricResolution());
    }

    @Test
    @DisplayName("Zero rows and columns are allowed")
    void testEmptyGrid() {
        var spec = RasterSpecification.validate(1, 0, 0, 8);

        assertEquals(0, spec.numberOfRows());
        assertEquals(0, spec.numberOfColumns());
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1, Integer.MIN_VALUE })
    @DisplayName("Band count below one is rejected")
    void testInvalidBandCount(int bands) {
        var e = assertThrows(InvalidBandCountException.class, () -> RasterSpecification.validate(bands, 10, 10, 8));
        assertEquals(bands, e.getValue());
    }

    @Test
    @DisplayName("Negative dimensions are rejected")
    void testInvalidDimensions() {
        var rows = assertThrows(InvalidDimensionException.class, () -> RasterSpecification.validate(1, -1, 10, 8));
        assertEquals("numberOfRows", rows.getField());
        assertEquals(-1, rows.getValue());

        var columns = assertThrows(InvalidDimensionException.class,
                                   () -> RasterSpecification.validate(1, 10, -5, 8));
        assertEquals("numberOfColumns", columns.getField());
        assertEquals(-5, columns.getValue());
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -3, 65, 128 })
    @DisplayName("Resolution outside 1..64 is rejected")
    void testInvalidResolution(int resolution) {
        var e = assertThrows(InvalidRadiometricResolutionException.class,
                             () -> RasterSpecification.validate(1, 10, 10, resolution));
        assertEquals(resolution, e.getValue());

        assertThrows(InvalidRadiometricResolutionException.class,
                     () -> RasterSpecification.validate(2, 10, 10, List.of(8, resolution)));
    }

    @Test
    @DisplayName("Resolution list length must match band count")
    void testResolutionMismatch() {
        var e = assertThrows(BandResolutionMismatchException.class,
                             () -> RasterSpecification.validate(3, 10, 10, List.of(8, 8)));
        assertEquals(3, e.getExpected());
        assertEquals(2, e.getActual());
    }

    @Test
    @DisplayName("Null arguments are rejected")
    void testNullArguments() {
        assertThrows(NullArgumentException.class, () -> RasterSpecification.validate(null, 1, 1, 1, 8));
        assertThrows(NullArgumentException.class, () -> RasterSpecification.validate(1, 1, 1, (List<Integer>) null));
        assertThrows(NullArgumentException.class, () -> RasterSpecification.validate(2, 1, 1, Arrays.asList(8, null)));
    }

    @Test
    @DisplayName("Band count is checked before resolutions")
    void testValidationOrder() {
        assertThrows(InvalidBandCountException.class, () -> RasterSpecification.validate(0, -1, 10, 99));
        assertThrows(InvalidDimensionException.class, () -> RasterSpecification.validate(1, -1, 10, 99));
    }

    @Test
    @DisplayName("Configuration errors are illegal arguments")
    void testExceptionHierarchy() {
        var e = assertThrows(SpectralConfigurationException.class, () -> RasterSpecification.validate(0, 1, 1, 8));
        assertInstanceOf(IllegalArgumentException.class, e);
    }

    @Test
    @DisplayName("Resolution list is copied")
    void testResolutionsCopied() {
        var resolutions = new java.util.ArrayList<>(List.of(8, 8));
        var spec = RasterSpecification.validate(2, 1, 1, resolutions);
        resolutions.set(0, 64);

        assertEquals(List.of(8, 8), spec.radiometricResolutions());
        assertThrows(UnsupportedOperationException.class, () -> spec.radiometricResolutions().set(0, 1));
    }
}
