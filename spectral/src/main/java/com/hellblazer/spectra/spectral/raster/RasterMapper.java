/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Spectra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.spectra.spectral.raster;

import com.hellblazer.spectra.geometry.Coordinate;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.SingularMatrixException;
import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Maps between raster grid indices and model space coordinates.
 * <p>
 * The mapping is a homogeneous 4x4 transformation applied to the column vector {@code (column, row, 0, 1)}. Only
 * transforms that keep the raster plane parallel to the xy plane are supported: the z row and column may not couple
 * with x or y, and neither axis scale may be zero. The inverse mapping uses the 2D affine part of the transform.
 *
 * @author hal.hildebrand
 */
public final class RasterMapper {

    private final Matrix4d      geometryTransformation;
    private final RasterMapMode mode;
    private final Matrix3d      rasterTransformation;

    public RasterMapper(RasterMapMode mode, Matrix4d transformation) {
        if (mode == null) {
            throw new NullArgumentException("mode");
        }
        if (transformation == null) {
            throw new NullArgumentException("transformation");
        }
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 4; column++) {
                if (!Double.isFinite(transformation.getElement(row, column))) {
                    throw new IllegalArgumentException("The transformation contains invalid values");
                }
            }
        }
        if (transformation.m30 != 0 || transformation.m31 != 0 || transformation.m32 != 0
        || transformation.m33 != 1) {
            throw new IllegalArgumentException("The last row of the transformation must be (0, 0, 0, 1)");
        }
        if (transformation.m00 == 0 || transformation.m11 == 0 || transformation.m20 != 0 || transformation.m21 != 0
        || transformation.m02 != 0 || transformation.m12 != 0) {
            throw new UnsupportedOperationException("The specified transformation is not supported");
        }

        this.mode = mode;
        this.geometryTransformation = new Matrix4d(transformation);

        var planar = new Matrix3d(transformation.m00, transformation.m01, transformation.m03, transformation.m10,
                                  transformation.m11, transformation.m13, 0, 0, 1);
        try {
            planar.invert();
        } catch (SingularMatrixException e) {
            throw new UnsupportedOperationException("The specified transformation is not invertible", e);
        }
        this.rasterTransformation = planar;
    }

    /**
     * Axis aligned mapper: column index scales along x, row index along y.
     *
     * @param translation model coordinate of cell (0, 0), two or three components
     * @param columnSize  model units per column, non zero
     * @param rowSize     model units per row, non zero (negative for north up imagery)
     */
    public static RasterMapper fromTransformation(RasterMapMode mode, Coordinate translation, double columnSize,
                                                  double rowSize) {
        if (translation == null) {
            throw new NullArgumentException("translation");
        }
        var matrix = new Matrix4d();
        matrix.setIdentity();
        matrix.m00 = columnSize;
        matrix.m11 = rowSize;
        matrix.m03 = translation.x();
        matrix.m13 = translation.y();
        matrix.m23 = translation.z();
        return new RasterMapper(mode, matrix);
    }

    public static RasterMapper fromCoordinates(RasterMapMode mode, RasterCoordinate... coordinates) {
        if (coordinates == null) {
            throw new NullArgumentException("coordinates");
        }
        return fromCoordinates(mode, Arrays.asList(coordinates));
    }

    /**
     * Fit an affine mapper to control points using least squares. The control points must span at least two distinct
     * rows and two distinct columns.
     */
    public static RasterMapper fromCoordinates(RasterMapMode mode, List<RasterCoordinate> coordinates) {
        if (coordinates == null) {
            throw new NullArgumentException("coordinates");
        }
        if (coordinates.stream().map(RasterCoordinate::columnIndex).distinct().count() < 2) {
            throw new IllegalArgumentException("The number of coordinates with distinct column index is less than 2");
        }
        if (coordinates.stream().map(RasterCoordinate::rowIndex).distinct().count() < 2) {
            throw new IllegalArgumentException("The number of coordinates with distinct row index is less than 2");
        }

        // normal equations of [column row 1] * a = x (resp. y)
        var normal = new Matrix3d();
        var rightX = new Vector3d();
        var rightY = new Vector3d();
        for (var coordinate : coordinates) {
            double[] a = { coordinate.columnIndex(), coordinate.rowIndex(), 1 };
            for (int i = 0; i < 3; i++) {
                for (int j = 0; j < 3; j++) {
                    normal.setElement(i, j, normal.getElement(i, j) + a[i] * a[j]);
                }
            }
            var x = coordinate.coordinate().x();
            var y = coordinate.coordinate().y();
            rightX.x += a[0] * x;
            rightX.y += a[1] * x;
            rightX.z += a[2] * x;
            rightY.x += a[0] * y;
            rightY.y += a[1] * y;
            rightY.z += a[2] * y;
        }
        try {
            normal.invert();
        } catch (SingularMatrixException e) {
            throw new IllegalArgumentException("The control points do not determine an affine transformation", e);
        }
        normal.transform(rightX);
        normal.transform(rightY);

        var matrix = new Matrix4d();
        matrix.setIdentity();
        matrix.m00 = rightX.x;
        matrix.m01 = rightX.y;
        matrix.m03 = rightX.z;
        matrix.m10 = rightY.x;
        matrix.m11 = rightY.y;
        matrix.m13 = rightY.z;
        return new RasterMapper(mode, matrix);
    }

    public RasterMapMode mode() {
        return mode;
    }

    /**
     * A copy of the raster to model transformation
     */
    public Matrix4d geometryTransformation() {
        return new Matrix4d(geometryTransformation);
    }

    public Coordinate translation() {
        return Coordinate.of(geometryTransformation.m03, geometryTransformation.m13, geometryTransformation.m23);
    }

    public double columnSize() {
        return mapCoordinate(0, 1).distance(mapCoordinate(0, 0));
    }

    public double rowSize() {
        return mapCoordinate(1, 0).distance(mapCoordinate(0, 0));
    }

    public Coordinate mapCoordinate(int rowIndex, int columnIndex) {
        return mapCoordinate((double) rowIndex, (double) columnIndex);
    }

    public Coordinate mapCoordinate(double rowIndex, double columnIndex) {
        var point = new Point3d(columnIndex, rowIndex, 0);
        geometryTransformation.transform(point);
        return Coordinate.of(point.x, point.y, point.z);
    }

    /**
     * Map a raster position interpreted under the given mode, shifting by half a cell when it differs from the mode
     * of this mapper
     */
    public Coordinate mapCoordinate(double rowIndex, double columnIndex, RasterMapMode mode) {
        if (mode == this.mode) {
            return mapCoordinate(rowIndex, columnIndex);
        }
        return switch (mode) {
            case VALUE_IS_AREA -> mapCoordinate(rowIndex - 0.5, columnIndex - 0.5);
            case VALUE_IS_COORDINATE -> mapCoordinate(rowIndex + 0.5, columnIndex + 0.5);
        };
    }

    /**
     * Fractional raster position of a model coordinate
     *
     * @return {@code {rowIndex, columnIndex}}
     */
    public double[] mapRasterIndices(Coordinate coordinate) {
        if (coordinate == null) {
            throw new NullArgumentException("coordinate");
        }
        var point = new Vector3d(coordinate.x(), coordinate.y(), 1);
        rasterTransformation.transform(point);
        return new double[] { point.y, point.x };
    }

    public double[] mapRasterIndices(Coordinate coordinate, RasterMapMode mode) {
        var indices = mapRasterIndices(coordinate);
        if (mode != this.mode) {
            var shift = mode == RasterMapMode.VALUE_IS_AREA ? 0.5 : -0.5;
            indices[0] += shift;
            indices[1] += shift;
        }
        return indices;
    }

    /**
     * The raster cell containing the model coordinate, rounded to the nearest index
     *
     * @throws com.hellblazer.spectra.spectral.exceptions.InvalidDimensionException if the coordinate maps before the
     *                                                                               first row or column
     */
    public RasterCoordinate mapRaster(Coordinate coordinate) {
        var indices = mapRasterIndices(coordinate);
        return new RasterCoordinate(Math.toIntExact(Math.round(indices[0])),
                                    Math.toIntExact(Math.round(indices[1])), coordinate);
    }

    /**
     * Pair a cell address with its model coordinate
     */
    public RasterCoordinate rasterCoordinate(int rowIndex, int columnIndex) {
        return new RasterCoordinate(rowIndex, columnIndex, mapCoordinate(rowIndex, columnIndex));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RasterMapper other)) return false;
        return mode == other.mode && geometryTransformation.equals(other.geometryTransformation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, geometryTransformation);
    }

    @Override
    public String toString() {
        return "RasterMapper{mode=" + mode + ", translation=" + translation() + ", columnSize=" + columnSize()
        + ", rowSize=" + rowSize() + "}";
    }
}
