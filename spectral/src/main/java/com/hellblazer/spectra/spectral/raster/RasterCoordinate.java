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
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;

/**
 * Pairs a raster cell address with the model space coordinate it maps to.
 *
 * @param rowIndex    the row of the cell, non negative
 * @param columnIndex the column of the cell, non negative
 * @param coordinate  the model space coordinate, two or three components
 * @author hal.hildebrand
 */
public record RasterCoordinate(int rowIndex, int columnIndex, Coordinate coordinate) {

    public RasterCoordinate {
        if (rowIndex < 0) {
            throw new InvalidDimensionException("rowIndex", rowIndex);
        }
        if (columnIndex < 0) {
            throw new InvalidDimensionException("columnIndex", columnIndex);
        }
        if (coordinate == null) {
            throw new NullArgumentException("coordinate");
        }
        if (coordinate.dimensions() < 2 || coordinate.dimensions() > 3) {
            throw new InvalidDimensionException("coordinate dimensions", coordinate.dimensions());
        }
    }

    public static RasterCoordinate of(int rowIndex, int columnIndex, double x, double y) {
        return new RasterCoordinate(rowIndex, columnIndex, Coordinate.of(x, y));
    }
}
