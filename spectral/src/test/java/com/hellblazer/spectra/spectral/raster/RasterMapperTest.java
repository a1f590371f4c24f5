package com.hellblazer.spectra.spectral.raster;

import com.hellblazer.spectra.geometry.Coordinate;
import com.hellblazer.spectra.spectral.exceptions.InvalidDimensionException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Matrix4d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RasterMapper Tests")
class RasterMapperTest {

    private static final double EPSILON = 1e-9;

    private static void assertCoordinate(double x, double y, Coordinate actual) {
        assertEquals(x, actual.x(), EPSILON);
        assertEquals(y, actual.y(), EPSILON);
    }

    private static Matrix4d identity() {
        var matrix = new Matrix4d();
        matrix.setIdentity();
        return matrix;
    }

    @Test
    @DisplayName("Translation and scale mapper")
    void testFromTransformation() {
        var mapper = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(500.0, 1000.0), 30.0,
                                                     -30.0);

        assertEquals(RasterMapMode.VALUE_IS_AREA, mapper.mode());
        assertEquals(30.0, mapper.columnSize(), EPSILON);
        assertEquals(30.0, mapper.rowSize(), EPSILON);
        assertEquals(Coordinate.of(500.0, 1000.0, 0.0), mapper.translation());
        assertCoordinate(500.0, 1000.0, mapper.mapCoordinate(0, 0));
        assertCoordinate(560.0, 970.0, mapper.mapCoordinate(1, 2));
        assertCoordinate(515.0, 985.0, mapper.mapCoordinate(0.5, 0.5));
    }

    @Test
    @DisplayName("Inverse mapping returns the cell")
    void testMapRaster() {
        var mapper = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_COORDINATE, Coordinate.of(10.0, 20.0), 2.0,
                                                     4.0);

        var cell = mapper.mapRaster(Coordinate.of(16.0, 32.0));
        assertEquals(3, cell.rowIndex());
        assertEquals(3, cell.columnIndex());

        var indices = mapper.mapRasterIndices(Coordinate.of(11.0, 22.0));
        assertEquals(0.5, indices[0], EPSILON);
        assertEquals(0.5, indices[1], EPSILON);
    }

    @Test
    @DisplayName("Coordinates before the first cell do not map")
    void testMapRasterOutside() {
        var mapper = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(0.0, 0.0), 1.0, 1.0);

        assertThrows(InvalidDimensionException.class, () -> mapper.mapRaster(Coordinate.of(-5.0, 0.0)));
    }

    @Test
    @DisplayName("Map mode conversion shifts by half a cell")
    void testModeShift() {
        var mapper = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(0.0, 0.0), 10.0, 10.0);

        assertCoordinate(0.0, 0.0, mapper.mapCoordinate(0.0, 0.0, RasterMapMode.VALUE_IS_AREA));
        assertCoordinate(5.0, 5.0, mapper.mapCoordinate(0.0, 0.0, RasterMapMode.VALUE_IS_COORDINATE));

        var indices = mapper.mapRasterIndices(Coordinate.of(5.0, 5.0), RasterMapMode.VALUE_IS_COORDINATE);
        assertEquals(0.0, indices[0], EPSILON);
        assertEquals(0.0, indices[1], EPSILON);
    }

    @Test
    @DisplayName("Least squares fit recovers an affine transform")
    void testFromCoordinates() {
        var expected = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(100.0, 50.0), 2.0,
                                                       3.0);
        var controls = List.of(expected.rasterCoordinate(0, 0), expected.rasterCoordinate(0, 10),
                               expected.rasterCoordinate(10, 0), expected.rasterCoordinate(10, 10),
                               expected.rasterCoordinate(5, 7));

        var mapper = RasterMapper.fromCoordinates(RasterMapMode.VALUE_IS_AREA, controls);

        for (var control : controls) {
            assertCoordinate(control.coordinate().x(), control.coordinate().y(),
                             mapper.mapCoordinate(control.rowIndex(), control.columnIndex()));
        }
        assertEquals(2.0, mapper.columnSize(), EPSILON);
        assertEquals(3.0, mapper.rowSize(), EPSILON);
    }

    @Test
    @DisplayName("Least squares fit needs two distinct rows and columns")
    void testFromCoordinatesInsufficient() {
        assertThrows(IllegalArgumentException.class,
                     () -> RasterMapper.fromCoordinates(RasterMapMode.VALUE_IS_AREA, RasterCoordinate.of(0, 0, 0, 0),
                                                        RasterCoordinate.of(0, 1, 1, 0)));
        assertThrows(IllegalArgumentException.class,
                     () -> RasterMapper.fromCoordinates(RasterMapMode.VALUE_IS_AREA, RasterCoordinate.of(0, 0, 0, 0),
                                                        RasterCoordinate.of(1, 0, 0, 1)));
        assertThrows(NullArgumentException.class,
                     () -> RasterMapper.fromCoordinates(RasterMapMode.VALUE_IS_AREA, (List<RasterCoordinate>) null));
    }

    @Test
    @DisplayName("Invalid transformations are rejected")
    void testInvalidTransformation() {
        var nan = identity();
        nan.m03 = Double.NaN;
        assertThrows(IllegalArgumentException.class, () -> new RasterMapper(RasterMapMode.VALUE_IS_AREA, nan));

        var lastRow = identity();
        lastRow.m31 = 1.0;
        assertThrows(IllegalArgumentException.class, () -> new RasterMapper(RasterMapMode.VALUE_IS_AREA, lastRow));

        var zeroScale = identity();
        zeroScale.m00 = 0.0;
        assertThrows(UnsupportedOperationException.class,
                     () -> new RasterMapper(RasterMapMode.VALUE_IS_AREA, zeroScale));

        var shear = identity();
        shear.m20 = 0.5;
        assertThrows(UnsupportedOperationException.class, () -> new RasterMapper(RasterMapMode.VALUE_IS_AREA, shear));

        assertThrows(NullArgumentException.class, () -> new RasterMapper(null, identity()));
        assertThrows(NullArgumentException.class, () -> new RasterMapper(RasterMapMode.VALUE_IS_AREA, null));
    }

    @Test
    @DisplayName("Singular planar transform is rejected")
    void testSingular() {
        var singular = identity();
        singular.m00 = 1.0;
        singular.m01 = 2.0;
        singular.m10 = 2.0;
        singular.m11 = 4.0;

        assertThrows(UnsupportedOperationException.class,
                     () -> new RasterMapper(RasterMapMode.VALUE_IS_AREA, singular));
    }

    @Test
    @DisplayName("Transformation is defensively copied")
    void testDefensiveCopy() {
        var matrix = identity();
        var mapper = new RasterMapper(RasterMapMode.VALUE_IS_AREA, matrix);
        matrix.m03 = 99.0;
        mapper.geometryTransformation().m03 = 42.0;

        assertCoordinate(0.0, 0.0, mapper.mapCoordinate(0, 0));
    }

    @Test
    @DisplayName("Mappers are equal by value")
    void testEquality() {
        var a = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(1.0, 2.0), 3.0, 4.0);
        var b = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_AREA, Coordinate.of(1.0, 2.0), 3.0, 4.0);
        var c = RasterMapper.fromTransformation(RasterMapMode.VALUE_IS_COORDINATE, Coordinate.of(1.0, 2.0), 3.0, 4.0);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    @DisplayName("Raster coordinate validation")
    void testRasterCoordinate() {
        assertThrows(InvalidDimensionException.class, () -> RasterCoordinate.of(-1, 0, 0.0, 0.0));
        assertThrows(InvalidDimensionException.class, () -> RasterCoordinate.of(0, -1, 0.0, 0.0));
        assertThrows(NullArgumentException.class, () -> new RasterCoordinate(0, 0, null));
        assertThrows(InvalidDimensionException.class, () -> new RasterCoordinate(0, 0, Coordinate.of(1.0)));
    }
}
