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
import com.hellblazer.spectra.spectral.range.SpectralRangeCatalog;

/**
 * Acquisition data of one raster band. Gain and bias convert digital numbers to radiance; solar irradiance is the
 * exoatmospheric irradiance of the band.
 *
 * @author hal.hildebrand
 */
public record RasterImagingBand(String description, double physicalGain, double physicalBias,
                                double solarIrradiance, SpectralDomain spectralDomain, SpectralRange spectralRange) {

    public RasterImagingBand {
        if (spectralRange == null) {
            throw new NullArgumentException("spectralRange");
        }
        if (spectralDomain == null) {
            spectralDomain = SpectralDomain.UNDEFINED;
        }
    }

    /**
     * Band covering a whole catalog range, with unit gain and no bias
     */
    public static RasterImagingBand of(String description, SpectralDomain spectralDomain) {
        return new RasterImagingBand(description, 1.0, 0.0, 0.0, spectralDomain,
                                     SpectralRangeCatalog.rangeOf(spectralDomain));
    }

    /**
     * Radiance of a digital number
     */
    public double toRadiance(double digitalNumber) {
        return physicalGain * digitalNumber + physicalBias;
    }
}
