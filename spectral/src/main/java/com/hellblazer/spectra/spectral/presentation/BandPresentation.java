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

import com.hellblazer.spectra.spectral.exceptions.IncompatiblePresentationException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;

import java.util.List;
import java.util.Optional;

/**
 * Presentation assigning a color channel to every raster band position
 *
 * @author hal.hildebrand
 */
public record BandPresentation(RasterPresentationModel model, RasterColorSpace colorSpace,
                               List<RasterColorSpaceBand> bands) implements RasterPresentation {

    public BandPresentation {
        if (model == null) {
            throw new NullArgumentException("model");
        }
        if (model.usesColorMap()) {
            throw new IncompatiblePresentationException(model, "color map models cannot take a band list");
        }
        if (colorSpace == null) {
            throw new NullArgumentException("colorSpace");
        }
        if (bands == null) {
            throw new NullArgumentException("bands");
        }
        for (int i = 0; i < bands.size(); i++) {
            if (bands.get(i) == null) {
                throw new NullArgumentException("bands[" + i + "]");
            }
        }
        bands = List.copyOf(bands);
    }

    @Override
    public Optional<ColorMap> colorMap() {
        return Optional.empty();
    }

    @Override
    public Optional<int[]> colorOf(int value) {
        return Optional.empty();
    }
}
