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

import java.util.List;
import java.util.Optional;

/**
 * A logical grid of rows x columns x bands. Every band carries its own radiometric resolution. Integer samples are
 * unsigned and limited to the radiometric resolution of their band; floating samples are stored as is.
 * <p>
 * Indices are zero based. Access outside the grid throws {@link IndexOutOfBoundsException}.
 *
 * @author hal.hildebrand
 */
public interface Raster {

    RasterFormat format();

    int numberOfBands();

    int numberOfRows();

    int numberOfColumns();

    List<Integer> radiometricResolutions();

    default int radiometricResolution(int bandIndex) {
        return radiometricResolutions().get(bandIndex);
    }

    /**
     * The mapper co-registering the grid with model space, if any
     */
    Optional<RasterMapper> mapper();

    default boolean isMapped() {
        return mapper().isPresent();
    }

    /**
     * The four corners of the raster in model space, in ring order: (0, 0), (0, columns), (rows, columns), (rows, 0).
     * Empty when the raster is not mapped.
     */
    List<Coordinate> coordinates();

    long getValue(int rowIndex, int columnIndex, int bandIndex);

    void setValue(int rowIndex, int columnIndex, int bandIndex, long value);

    double getFloatValue(int rowIndex, int columnIndex, int bandIndex);

    void setFloatValue(int rowIndex, int columnIndex, int bandIndex, double value);

    /**
     * All band samples of one cell
     */
    default long[] getValues(int rowIndex, int columnIndex) {
        var values = new long[numberOfBands()];
        for (int band = 0; band < values.length; band++) {
            values[band] = getValue(rowIndex, columnIndex, band);
        }
        return values;
    }

    default void setValues(int rowIndex, int columnIndex, long... values) {
        if (values.length != numberOfBands()) {
            throw new IllegalArgumentException(
            String.format("Expected %d band values, got %d", numberOfBands(), values.length));
        }
        for (int band = 0; band < values.length; band++) {
            setValue(rowIndex, columnIndex, band, values[band]);
        }
    }

    default double[] getFloatValues(int rowIndex, int columnIndex) {
        var values = new double[numberOfBands()];
        for (int band = 0; band < values.length; band++) {
            values[band] = getFloatValue(rowIndex, columnIndex, band);
        }
        return values;
    }

    /**
     * Sample at the cell containing a model coordinate
     *
     * @throws IllegalStateException if the raster is not mapped
     */
    default long getValue(Coordinate coordinate, int bandIndex) {
        var mapper = mapper().orElseThrow(() -> new IllegalStateException("The raster is not mapped"));
        var cell = mapper.mapRaster(coordinate);
        return getValue(cell.rowIndex(), cell.columnIndex(), bandIndex);
    }

    /**
     * Occurrence count of every value of an integer band
     *
     * @throws UnsupportedOperationException for floating rasters or bands wider than 16 bits
     */
    int[] histogram(int bandIndex);
}
