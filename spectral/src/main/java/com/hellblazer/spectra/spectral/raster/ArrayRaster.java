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
import com.hellblazer.spectra.spectral.exceptions.InvalidDimensionException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In memory raster backed by one primitive array per band. Integer rasters store {@code long} samples masked to the
 * radiometric resolution of the band; floating rasters store {@code double} samples.
 * <p>
 * Sample storage is mutable and not synchronized. The shape, resolutions and mapper are fixed at construction.
 *
 * @author hal.hildebrand
 */
public final class ArrayRaster implements Raster {

    private static final int MAX_HISTOGRAM_RESOLUTION = 16;

    private final List<Coordinate>  coordinates;
    private final double[][]        floatBands;
    private final RasterFormat      format;
    private final long[][]          integerBands;
    private final RasterMapper      mapper;
    private final int               numberOfColumns;
    private final int               numberOfRows;
    private final List<Integer>     radiometricResolutions;

    ArrayRaster(RasterSpecification specification, RasterMapper mapper) {
        Objects.requireNonNull(specification, "specification cannot be null");
        this.format = specification.format().resolve();
        this.numberOfRows = specification.numberOfRows();
        this.numberOfColumns = specification.numberOfColumns();
        this.radiometricResolutions = specification.radiometricResolutions();
        this.mapper = mapper;

        var cells = (long) numberOfRows * numberOfColumns;
        if (cells > Integer.MAX_VALUE) {
            throw new InvalidDimensionException("numberOfCells", cells);
        }
        var bands = specification.numberOfBands();
        if (format == RasterFormat.FLOATING) {
            floatBands = new double[bands][(int) cells];
            integerBands = null;
        } else {
            integerBands = new long[bands][(int) cells];
            floatBands = null;
        }
        coordinates = computeCoordinates();
    }

    private ArrayRaster(ArrayRaster other) {
        this.format = other.format;
        this.numberOfRows = other.numberOfRows;
        this.numberOfColumns = other.numberOfColumns;
        this.radiometricResolutions = other.radiometricResolutions;
        this.mapper = other.mapper;
        this.coordinates = other.coordinates;
        this.integerBands = other.integerBands == null ? null : deepCopy(other.integerBands);
        this.floatBands = other.floatBands == null ? null : deepCopy(other.floatBands);
    }

    private static long[][] deepCopy(long[][] bands) {
        var copy = new long[bands.length][];
        for (int i = 0; i < bands.length; i++) {
            copy[i] = bands[i].clone();
        }
        return copy;
    }

    private static double[][] deepCopy(double[][] bands) {
        var copy = new double[bands.length][];
        for (int i = 0; i < bands.length; i++) {
            copy[i] = bands[i].clone();
        }
        return copy;
    }

    private static long mask(int radiometricResolution) {
        return radiometricResolution >= Long.SIZE ? -1L : (1L << radiometricResolution) - 1;
    }

    private static double unsignedToDouble(long value) {
        if (value >= 0) {
            return value;
        }
        return ((value >>> 1) | (value & 1)) * 2.0;
    }

    @Override
    public RasterFormat format() {
        return format;
    }

    @Override
    public int numberOfBands() {
        return radiometricResolutions.size();
    }

    @Override
    public int numberOfRows() {
        return numberOfRows;
    }

    @Override
    public int numberOfColumns() {
        return numberOfColumns;
    }

    @Override
    public List<Integer> radiometricResolutions() {
        return radiometricResolutions;
    }

    @Override
    public Optional<RasterMapper> mapper() {
        return Optional.ofNullable(mapper);
    }

    @Override
    public List<Coordinate> coordinates() {
        return coordinates;
    }

    @Override
    public long getValue(int rowIndex, int columnIndex, int bandIndex) {
        var cell = cellIndex(rowIndex, columnIndex, bandIndex);
        if (integerBands != null) {
            return integerBands[bandIndex][cell];
        }
        return Math.max(0L, Math.round(floatBands[bandIndex][cell]));
    }

    @Override
    public void setValue(int rowIndex, int columnIndex, int bandIndex, long value) {
        var cell = cellIndex(rowIndex, columnIndex, bandIndex);
        if (integerBands != null) {
            integerBands[bandIndex][cell] = value & mask(radiometricResolutions.get(bandIndex));
        } else {
            floatBands[bandIndex][cell] = value;
        }
    }

    @Override
    public double getFloatValue(int rowIndex, int columnIndex, int bandIndex) {
        var cell = cellIndex(rowIndex, columnIndex, bandIndex);
        if (floatBands != null) {
            return floatBands[bandIndex][cell];
        }
        return unsignedToDouble(integerBands[bandIndex][cell]);
    }

    @Override
    public void setFloatValue(int rowIndex, int columnIndex, int bandIndex, double value) {
        var cell = cellIndex(rowIndex, columnIndex, bandIndex);
        if (floatBands != null) {
            floatBands[bandIndex][cell] = value;
            return;
        }
        var resolution = radiometricResolutions.get(bandIndex);
        var rounded = Math.max(0L, Math.round(value));
        if (resolution < Long.SIZE - 1) {
            rounded = Math.min(rounded, mask(resolution));
        }
        integerBands[bandIndex][cell] = rounded;
    }

    @Override
    public int[] histogram(int bandIndex) {
        Objects.checkIndex(bandIndex, numberOfBands());
        var resolution = radiometricResolutions.get(bandIndex);
        if (integerBands == null || resolution > MAX_HISTOGRAM_RESOLUTION) {
            throw new UnsupportedOperationException(
            "Histograms are only computed for integer bands of at most " + MAX_HISTOGRAM_RESOLUTION + " bits");
        }
        var histogram = new int[1 << resolution];
        for (var value : integerBands[bandIndex]) {
            histogram[(int) value]++;
        }
        return histogram;
    }

    /**
     * Deep copy of this raster; the copy shares no sample storage with the original
     */
    ArrayRaster copy() {
        return new ArrayRaster(this);
    }

    private int cellIndex(int rowIndex, int columnIndex, int bandIndex) {
        Objects.checkIndex(bandIndex, radiometricResolutions.size());
        Objects.checkIndex(rowIndex, numberOfRows);
        Objects.checkIndex(columnIndex, numberOfColumns);
        return rowIndex * numberOfColumns + columnIndex;
    }

    private List<Coordinate> computeCoordinates() {
        if (mapper == null) {
            return List.of();
        }
        return List.of(mapper.mapCoordinate(0, 0), mapper.mapCoordinate(0, numberOfColumns),
                       mapper.mapCoordinate(numberOfRows, numberOfColumns), mapper.mapCoordinate(numberOfRows, 0));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayRaster other)) return false;
        return format == other.format && numberOfRows == other.numberOfRows
        && numberOfColumns == other.numberOfColumns && radiometricResolutions.equals(other.radiometricResolutions)
        && Objects.equals(mapper, other.mapper) && Arrays.deepEquals(integerBands, other.integerBands)
        && Arrays.deepEquals(floatBands, other.floatBands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, numberOfRows, numberOfColumns, radiometricResolutions, mapper,
                            Arrays.deepHashCode(integerBands), Arrays.deepHashCode(floatBands));
    }

    @Override
    public String toString() {
        return String.format("ArrayRaster{format=%s, bands=%d, rows=%d, columns=%d, resolutions=%s, mapped=%s}",
                             format, numberOfBands(), numberOfRows, numberOfColumns, radiometricResolutions,
                             mapper != null);
    }
}
