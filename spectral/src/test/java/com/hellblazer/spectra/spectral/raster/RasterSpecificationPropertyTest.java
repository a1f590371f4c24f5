package com.hellblazer.spectra.spectral.raster;

import com.hellblazer.spectra.spectral.exceptions.BandResolutionMismatchException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RasterSpecification Property-Based Tests")
class RasterSpecificationPropertyTest {

    private final ArrayRasterFactory factory = new ArrayRasterFactory();

    @Property
    @Label("Valid shapes build and report their shape")
    void validShapesBuild(@ForAll @IntRange(min = 1, max = 16) int bands, @ForAll @IntRange(min = 0, max = 64) int rows,
                          @ForAll @IntRange(min = 0, max = 64) int columns,
                          @ForAll @IntRange(min = 1, max = 64) int resolution) {
        var spec = RasterSpecification.validate(bands, rows, columns, resolution);
        var raster = factory.createRaster(spec, null);

        assertEquals(bands, raster.numberOfBands());
        assertEquals(rows, raster.numberOfRows());
        assertEquals(columns, raster.numberOfColumns());
        for (int band = 0; band < bands; band++) {
            assertEquals(resolution, raster.radiometricResolution(band));
        }
    }

    @Property
    @Label("Resolution list of the wrong length is a mismatch")
    void mismatchedResolutionsFail(@ForAll @IntRange(min = 1, max = 16) int bands,
                                   @ForAll("resolutionLists") List<Integer> resolutions) {
        Assume.that(resolutions.size() != bands);

        var e = assertThrows(BandResolutionMismatchException.class,
                             () -> RasterSpecification.validate(bands, 4, 4, resolutions));
        assertEquals(bands, e.getExpected());
        assertEquals(resolutions.size(), e.getActual());
    }

    @Property
    @Label("Samples are limited to the band resolution")
    void samplesFitResolution(@ForAll @IntRange(min = 1, max = 63) int resolution, @ForAll long value) {
        var raster = factory.createRaster(RasterSpecification.validate(RasterFormat.INTEGER, 1, 1, 1, resolution),
                                          null);
        raster.setValue(0, 0, 0, value);

        var stored = raster.getValue(0, 0, 0);
        assertTrue(Long.compareUnsigned(stored, -1L >>> (Long.SIZE - resolution)) <= 0);
        assertEquals(value & ((1L << resolution) - 1), stored);
    }

    @Provide
    Arbitrary<List<Integer>> resolutionLists() {
        return Arbitraries.integers().between(1, 64).list().ofMinSize(0).ofMaxSize(20);
    }
}
