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
package com.hellblazer.spectra.spectral.presentation;

/**
 * Rules mapping raster band values to displayable color
 *
 * @author hal.hildebrand
 */
public enum RasterPresentationModel {
    TRUE_COLOR, FALSE_COLOR, GRAYSCALE, INVERTED_GRAYSCALE, TRANSPARENCY,
    /** Every value is looked up exactly in a color map */
    PSEUDO_COLOR,
    /** Every value takes the color of the greatest color map entry not above it */
    DENSITY_SLICING;

    public boolean usesColorMap() {
        return this == PSEUDO_COLOR || this == DENSITY_SLICING;
    }
}
