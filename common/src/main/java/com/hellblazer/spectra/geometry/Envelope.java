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
import java.util.Collection;
import java.util.Objects;

/**
 * Axis aligned minimum bounding box of a geometry in model space. Degenerate envelopes (where the minimum equals the
 * maximum in some dimension) are allowed, since a raster with no rows or columns still has a well defined extent.
 *
 * @author hal.hildebrand
 */
public record Envelope(double[] min, double[] max) {

    public Envelope {
        Objects.requireNonNull(min, "min bounds cannot be null");
        Objects.requireNonNull(max, "max bounds cannot be null");

        if (min.length != max.length) {
            throw new IllegalArgumentException("min and max bounds must have same dimensions");
        }
        if (min.length == 0) {
            throw new IllegalArgumentException("envelope must have at least one dimension");
        }
        for (int i = 0; i < min.length; i++) {
            if (min[i] > max[i]) {
                throw new IllegalArgumentException("min bounds must not exceed max bounds in any dimension");
            }
        }

        min = min.clone();
        max = max.clone();
    }

    /**
     * Computes the envelope of the given coordinates
     */
    public static Envelope from(Collection<Coordinate> coordinates) {
        Objects.requireNonNull(coordinates, "coordinates cannot be null");
        if (coordinates.isEmpty()) {
            throw new IllegalArgumentException("cannot compute the envelope of no coordinates");
        }

        double[] min = null;
        double[] max = null;
        for (var coordinate : coordinates) {
            var values = coordinate.values();
            if (min == null) {
                min = values.clone();
                max = values.clone();
                continue;
            }
            if (values.length != min.length) {
                throw new IllegalArgumentException("coordinates must have same dimensions");
            }
            for (int i = 0; i < values.length; i++) {
                min[i] = Math.min(min[i], values[i]);
                max[i] = Math.max(max[i], values[i]);
            }
        }
        return new Envelope(min, max);
    }

    public int dimensions() {
        return min.length;
    }

    /**
     * Returns the extent (size) in the specified dimension
     */
    public double extent(int dimension) {
        if (dimension < 0 || dimension >= min.length) {
            throw new IndexOutOfBoundsException("dimension " + dimension + " out of bounds");
        }
        return max[dimension] - min[dimension];
    }

    /**
     * Checks if a coordinate is within this envelope (inclusive)
     */
    public boolean contains(Coordinate point) {
        Objects.requireNonNull(point, "point cannot be null");

        if (point.dimensions() != dimensions()) {
            return false;
        }
        var coords = point.values();
        for (int i = 0; i < min.length; i++) {
            if (coords[i] < min[i] || coords[i] > max[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Creates the smallest envelope containing both envelopes
     */
    public Envelope union(Envelope other) {
        Objects.requireNonNull(other, "other envelope cannot be null");
        if (dimensions() != other.dimensions()) {
            throw new IllegalArgumentException("envelopes must have same dimensions");
        }

        var newMin = new double[min.length];
        var newMax = new double[max.length];
        for (int i = 0; i < min.length; i++) {
            newMin[i] = Math.min(min[i], other.min[i]);
            newMax[i] = Math.max(max[i], other.max[i]);
        }
        return new Envelope(newMin, newMax);
    }

    @Override
    public double[] min() {
        return min.clone();
    }

    @Override
    public double[] max() {
        return max.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Envelope other)) return false;
        return Arrays.equals(min, other.min) && Arrays.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(min), Arrays.hashCode(max));
    }

    @Override
    public String toString() {
        return String.format("Envelope{min=%s, max=%s}", Arrays.toString(min), Arrays.toString(max));
    }
}
