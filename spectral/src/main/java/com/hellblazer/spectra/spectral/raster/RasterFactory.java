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

import java.util.List;

/**
 * Realizes rasters. Every raster returned is a fresh value exclusively owned by the caller.
 *
 * @author hal.hildebrand
 */
public interface RasterFactory {

    /**
     * Create an empty raster of the given shape
     *
     * @param specification the validated shape
     * @param mapper        the mapper to model space, may be null
     */
    Raster createRaster(RasterSpecification specification, RasterMapper mapper);

    /**
     * Create a raster holding every sample the service provides
     *
     * @param service the sample source
     * @param mapper  the mapper to model space, may be null
     */
    Raster createRaster(RasterService service, RasterMapper mapper);

    /**
     * Deep copy of a raster, sharing no sample storage with the source
     */
    Raster copyRaster(Raster raster);

    /**
     * Concatenate the bands of the given rasters, in order, into a new raster
     */
    Raster mergeRasters(List<? extends Raster> rasters);
}
