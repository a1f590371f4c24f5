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
 * Read only source of raster samples, such as a remote service or a file driver. A raster realized from a service
 * reads every sample once, at creation.
 *
 * @author hal.hildebrand
 */
public interface RasterService {

    RasterFormat format();

    int numberOfBands();

    int numberOfRows();

    int numberOfColumns();

    List<Integer> radiometricResolutions();

    long readValue(int rowIndex, int columnIndex, int bandIndex);

    double readFloatValue(int rowIndex, int columnIndex, int bandIndex);
}
