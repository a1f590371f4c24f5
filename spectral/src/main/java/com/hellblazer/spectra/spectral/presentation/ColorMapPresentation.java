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
import com.hellblazer.spectra.spectral.exceptions.NullColorMapException;

import java.util.List;
import java.util.Optional;

/**
 * Pseudo-color or density slicing presentation of a single value band
 *
 * @author hal.hildebrand
 */
public record ColorMapPresentation(RasterPresentationModel model, ColorMap palette) implements RasterPresentation {

    private static final List<RasterColorSpaceBand> VALUE_BAND = List.of(RasterColorSpaceBand.VALUE);

    public ColorMapPresentation {
        if (model == null) {
            throw new NullArgumentException("model");
        }
        if (!model.usesColorMap()) {
            throw new IncompatiblePresentationException(model, "only pseudo-color and density slicing take a color map");
        }
        if (palette == null) {
            throw new NullColorMapException();
        }
    }

    @Override
    public RasterColorSpace colorSpace() {
        return RasterColorSpace.NONE;
    }

    @Override
    public List<RasterColorSpaceBand> bands() {
        return VALUE_BAND;
    }

    @Override
    public Optional<ColorMap> colorMap() {
        return Optional.of(palette);
    }

    @Override
    public Optional<int[]> colorOf(int value) {
        return model == RasterPresentationModel.PSEUDO_COLOR ? palette.get(value) : palette.floor(value);
    }
}
