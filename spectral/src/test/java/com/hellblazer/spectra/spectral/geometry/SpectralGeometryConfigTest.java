package com.hellblazer.spectra.spectral.geometry;

import com.hellblazer.spectra.spectral.exceptions.InvalidRadiometricResolutionException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.presentation.RasterPresentation;
import com.hellblazer.spectra.spectral.raster.RasterFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpectralGeometryConfig Tests")
class SpectralGeometryConfigTest {

    @Test
    @DisplayName("Default configuration")
    void testDefaults() {
        var config = SpectralGeometryConfig.defaults();

        assertEquals(RasterPresentation.grayscale(), config.getDefaultPresentation());
        assertEquals(16, config.getDefaultIntegerResolution());
        assertEquals(32, config.getDefaultFloatResolution());
        assertEquals(16, config.getDefaultResolution(RasterFormat.ANY));
        assertEquals(32, config.getDefaultResolution(RasterFormat.FLOATING));
        assertFalse(config.isCopySuppliedRaster());
    }

    @Test
    @DisplayName("Isolated preset copies supplied rasters")
    void testIsolated() {
        assertTrue(SpectralGeometryConfig.isolated().isCopySuppliedRaster());
    }

    @Test
    @DisplayName("Fluent setters validate")
    void testValidation() {
        var config = SpectralGeometryConfig.defaults();

        assertThrows(InvalidRadiometricResolutionException.class, () -> config.withDefaultIntegerResolution(0));
        assertThrows(InvalidRadiometricResolutionException.class, () -> config.withDefaultFloatResolution(65));
        assertThrows(NullArgumentException.class, () -> config.withDefaultPresentation(null));
        assertEquals(16, config.getDefaultIntegerResolution());
    }

    @Test
    @DisplayName("Copy is independent")
    void testCopy() {
        var config = SpectralGeometryConfig.defaults().withDefaultFloatResolution(64);
        var copy = config.copy();
        config.withDefaultFloatResolution(8).withCopySuppliedRaster(true);

        assertEquals(64, copy.getDefaultFloatResolution());
        assertFalse(copy.isCopySuppliedRaster());
    }
}
