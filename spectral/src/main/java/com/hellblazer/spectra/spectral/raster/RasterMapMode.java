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

/**
 * Interpretation of a raster cell value relative to its mapped model coordinate.
 *
 * @author hal.hildebrand
 */
public enum RasterMapMode {
    /** The value covers the whole cell; the mapped coordinate is the upper left corner of the cell */
    VALUE_IS_AREA,
    /** The value is sampled at the mapped coordinate itself */
    VALUE_IS_COORDINATE
}
