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
 * Sample representation of a raster.
 *
 * @author hal.hildebrand
 */
public enum RasterFormat {
    /** No preference; realised as {@link #INTEGER} */
    ANY,
    /** Unsigned integer samples, masked to the radiometric resolution of their band */
    INTEGER,
    /** Floating point samples */
    FLOATING;

    /**
     * The concrete format a raster of this format is stored in
     */
    public RasterFormat resolve() {
        return this == ANY ? INTEGER : this;
    }
}
