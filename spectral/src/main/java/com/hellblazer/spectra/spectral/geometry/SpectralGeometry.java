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
package com.hellblazer.spectra.spectral.geometry;

import com.hellblazer.spectra.geometry.Geometry;
import com.hellblazer.spectra.spectral.imaging.RasterImaging;
import com.hellblazer.spectra.spectral.presentation.RasterPresentation;
import com.hellblazer.spectra.spectral.raster.Raster;

import java.util.Optional;

/**
 * A vector boundary paired with co-registered, multi-band raster data. The raster is exclusively owned by the
 * geometry that created it; presentation, imaging and metadata are fixed at construction.
 *
 * @author hal.hildebrand
 */
public sealed interface SpectralGeometry extends Geometry permits SpectralPolygon {

    Raster raster();

    RasterPresentation presentation();

    Optional<RasterImaging> imaging();
}
