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
package com.hellblazer.spectra.geometry;

import java.util.Arrays;

/**
 * Immutable record representing a point in model space.
 * <p>
 * Spectral geometries work with two dimensional (x, y) or three dimensional (x, y, z) coordinates, but the record
 * itself accepts any positive number of dimensions.
 *
 * @author hal.hildebrand
 */
public record Coordinate(double[] values) {

    /**
     * Compact constructor with validation and defensive copying.
     */
    public Coordinate {
        if (values == null) {
            throw new IllegalArgumentException("Coordinate values cannot be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("Coordinate must have at least one dimension");
        }

        values = values.clone();
    }

    public static Coordinate of(double... values) {
        return new Coordinate(values);
    }

    public static Coordinate of(double x, double y) {
        return new Coordinate(new double[] { x, y });
    }

    public static Coordinate of(double x, double y, double z) {
        return new Coordinate(new double[] { x, y, z });
    }

    /**
     * Returns the number of dimensions.
     */
    public int dimensions() {
        return values.length;
    }

    public double x() {
        return values[0];
    }

    public double y() {
        return get(1);
    }

    /**
     * Returns the z component, or 0 for a two dimensional coordinate.
     */
    public double z() {
        return values.length > 2 ? values[2] : 0.0;
    }

    /**
     * Returns the coordinate value for the specified dimension.
     */
    public double get(int dimension) {
        checkDimension(dimension);
        return values[dimension];
    }

    /**
     * Returns the sum of this coordinate and the other coordinate.
     */
    public Coordinate add(Coordinate other) {
        checkSameDimensions(other);
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] + other.values[i];
        }
        return new Coordinate(result);
    }

    /**
     * Returns the difference of this coordinate and the other coordinate.
     */
    public Coordinate subtract(Coordinate other) {
        checkSameDimensions(other);
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] - other.values[i];
        }
        return new Coordinate(result);
    }

    /**
     * Returns the Euclidean distance between this coordinate and the other coordinate.
     */
    public double distance(Coordinate other) {
        checkSameDimensions(other);
        double sumSquares = 0.0;
        for (int i = 0; i < values.length; i++) {
            double diff = values[i] - other.values[i];
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares);
    }

    /**
     * Returns the magnitude (Euclidean norm) of this coordinate.
     */
    public double magnitude() {
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        return Math.sqrt(sumSquares);
    }

    /**
     * Returns true if every component is finite.
     */
    public boolean isValid() {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if this coordinate is approximately equal to the other coordinate within the specified tolerance.
     */
    public boolean isApproximatelyEqual(Coordinate other, double tolerance) {
        if (tolerance < 0.0) {
            throw new IllegalArgumentException("Tolerance must be non-negative: " + tolerance);
        }
        checkSameDimensions(other);

        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i] - other.values[i]) > tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy of the coordinate values array.
     */
    @Override
    public double[] values() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "Coordinate" + Arrays.toString(values);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Coordinate other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    private void checkDimension(int dimension) {
        if (dimension < 0 || dimension >= values.length) {
            throw new IllegalArgumentException(
            String.format("Dimension %d out of range [0, %d)", dimension, values.length));
        }
    }

    private void checkSameDimensions(Coordinate other) {
        if (values.length != other.values.length) {
            throw new IllegalArgumentException(
            String.format("Coordinates must have same dimensions: %d vs %d", values.length, other.values.length));
        }
    }
}
