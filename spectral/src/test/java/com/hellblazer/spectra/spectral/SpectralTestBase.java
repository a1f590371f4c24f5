package com.hellblazer.spectra.spectral;

import com.hellblazer.spectra.geometry.Coordinate;
import com.hellblazer.spectra.geometry.GeometryFactory;
import com.hellblazer.spectra.geometry.Polygon;
import com.hellblazer.spectra.spectral.raster.ArrayRasterFactory;
import com.hellblazer.spectra.spectral.raster.Raster;
import com.hellblazer.spectra.spectral.raster.RasterFormat;
import com.hellblazer.spectra.spectral.raster.RasterMapMode;
import com.hellblazer.spectra.spectral.raster.RasterMapper;
import com.hellblazer.spectra.spectral.raster.RasterSpecification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Base class for spectral tests providing common fixtures.
 */
public abstract class SpectralTestBase {

    protected static final Logger log         = LoggerFactory.getLogger(SpectralTestBase.class);
    protected static final long   RANDOM_SEED = 42L;

    protected GeometryFactory    geometryFactory;
    protected ArrayRasterFactory rasterFactory;
    protected Random             random;

    @BeforeEach
    void setUp(TestInfo testInfo) {
        log.debug("Starting test: {}.{}", testInfo.getTestClass().map(Class::getSimpleName).orElse("Unknown"),
                  testInfo.getDisplayName());

        random = new Random(RANDOM_SEED);
        geometryFactory = new GeometryFactory();
        rasterFactory = new ArrayRasterFactory();
    }

    /**
     * Mapper with unit cells, origin at (x, y)
     */
    protected RasterMapper unitMapper(double x, double y) {
        return RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(x, y), 1.0, 1.0);
    }

    protected RasterMapper mapper(double x, double y, double columnSize, double rowSize) {
        return RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(x, y), columnSize, rowSize);
    }

    protected List<Coordinate> square(double x, double y, double size) {
        return List.of(Coordinate.of(x, y), Coordinate.of(x, y + size), Coordinate.of(x + size, y + size),
                       Coordinate.of(x + size, y));
    }

    protected Polygon squarePolygon(double x, double y, double size) {
        return geometryFactory.createPolygon(square(x, y, size));
    }

    protected Raster integerRaster(int bands, int rows, int columns, int resolution) {
        return rasterFactory.createRaster(
        RasterSpecification.validate(RasterFormat.INTEGER, bands, rows, columns, resolution), unitMapper(0.0, 0.0));
    }

    /**
     * Fill every band of a raster with random samples that fit its resolution
     */
    protected Raster fillRandom(Raster raster) {
        for (int band = 0; band < raster.numberOfBands(); band++) {
            var resolution = raster.radiometricResolution(band);
            for (int row = 0; row < raster.numberOfRows(); row++) {
                for (int column = 0; column < raster.numberOfColumns(); column++) {
                    raster.setValue(row, column, band, random.nextLong() >>> (Long.SIZE - resolution));
                }
            }
        }
        return raster;
    }

    /**
     * Single band raster whose every sample equals the given value
     */
    protected Raster constantRaster(int rows, int columns, long value) {
        var raster = integerRaster(1, rows, columns, 8);
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                raster.setValue(row, column, 0, value);
            }
        }
        return raster;
    }
}
