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
package com.hellblazer.spectra.spectral.imaging;

import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.range.SpectralDomain;
import com.hellblazer.spectra.spectral.range.SpectralRange;
import com.hellblazer.spectra.spectral.raster.RasterSpecification;

/**
 * One band of an imaging sensor. Resolutions and swath are in metres.
 *
 * @author hal.hildebrand
 */
public record ImagingDeviceBand(int number, String description, double rangeResolution, double azimuthResolution,
                                double swath, int radiometricResolution, SpectralDomain spectralDomain,
                                SpectralRange spectralRange) {

    public ImagingDeviceBand {
        if (!(rangeResolution > 0.0)) {
            throw new IllegalArgumentException("Range resolution must be positive: " + rangeResolution);
        }
        if (!(azimuthResolution > 0.0)) {
            throw new IllegalArgumentException("Azimuth resolution must be positive: " + azimuthResolution);
        }
        if (swath < rangeResolution) {
            throw new IllegalArgumentException("Swath " + swath + " is less than the range resolution " + rangeResolution);
        }
        RasterSpecification.checkResolution(radiometricResolution);
        if (spectralRange == null) {
            throw new NullArgumentException("spectralRange");
        }
        if (spectralDomain == null) {
            spectralDomain = SpectralDomain.UNDEFINED;
        }
    }

    /**
     * Band with the same range and azimuth resolution
     */
    public ImagingDeviceBand(int number, String description, double spatialResolution, double swath,
                             int radiometricResolution, SpectralDomain spectralDomain,
                             SpectralRange spectralRange) {
        this(number, description, spatialResolution, spatialResolution, swath, radiometricResolution, spectralDomain,
             spectralRange);
    }
}
