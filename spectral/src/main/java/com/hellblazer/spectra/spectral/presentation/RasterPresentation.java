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

import com.hellblazer.spectra.spectral.exceptions.DuplicateBandIndexException;
import com.hellblazer.spectra.spectral.exceptions.IncompatiblePresentationException;
import com.hellblazer.spectra.spectral.exceptions.InvalidDimensionException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Describes how the bands of a raster are turned into displayable color. A presentation is either a band list, where
 * every raster band position is tagged with the color channel it feeds, or a color map, where a single value band is
 * looked up in a palette. The two shapes are distinct types, so a band list can never be attached to a color map
 * model.
 *
 * @author hal.hildebrand
 */
public sealed interface RasterPresentation permits BandPresentation, ColorMapPresentation {

    static RasterPresentation of(RasterPresentationModel model, RasterColorSpace colorSpace,
                                 RasterColorSpaceBand... bands) {
        if (bands == null) {
            throw new NullArgumentException("bands");
        }
        return new BandPresentation(model, colorSpace, Arrays.asList(bands));
    }

    static RasterPresentation of(RasterPresentationModel model, ColorMap colorMap) {
        return new ColorMapPresentation(model, colorMap);
    }

    /**
     * Red, green and blue read from the first three raster bands
     */
    static RasterPresentation trueColor() {
        return trueColor(RasterColorSpace.RGB);
    }

    /**
     * Red, green and blue read from the given raster bands
     */
    static RasterPresentation trueColor(int indexOfRedBand, int indexOfGreenBand, int indexOfBlueBand) {
        return trueColor(RasterColorSpace.RGB, indexOfRedBand, indexOfGreenBand, indexOfBlueBand);
    }

    /**
     * The channels of the color space, in canonical order, read from the leading raster bands
     */
    static RasterPresentation trueColor(RasterColorSpace colorSpace) {
        checkCanonical(colorSpace);
        return new BandPresentation(RasterPresentationModel.TRUE_COLOR, colorSpace, colorSpace.canonicalBands());
    }

    /**
     * The channels of the color space, in canonical order, read from the given raster bands
     */
    static RasterPresentation trueColor(RasterColorSpace colorSpace, int... bandIndices) {
        checkCanonical(colorSpace);
        return new BandPresentation(RasterPresentationModel.TRUE_COLOR, colorSpace,
                                    arrange(RasterPresentationModel.TRUE_COLOR, colorSpace.canonicalBands(),
                                            bandIndices));
    }

    static RasterPresentation falseColor(int indexOfRedBand, int indexOfGreenBand, int indexOfBlueBand) {
        return new BandPresentation(RasterPresentationModel.FALSE_COLOR, RasterColorSpace.RGB,
                                    arrange(RasterPresentationModel.FALSE_COLOR,
                                            RasterColorSpace.RGB.canonicalBands(),
                                            new int[] { indexOfRedBand, indexOfGreenBand, indexOfBlueBand }));
    }

    static RasterPresentation grayscale() {
        return new BandPresentation(RasterPresentationModel.GRAYSCALE, RasterColorSpace.NONE, List.of());
    }

    static RasterPresentation invertedGrayscale() {
        return new BandPresentation(RasterPresentationModel.INVERTED_GRAYSCALE, RasterColorSpace.NONE, List.of());
    }

    static RasterPresentation transparency() {
        return new BandPresentation(RasterPresentationModel.TRANSPARENCY, RasterColorSpace.NONE, List.of());
    }

    static RasterPresentation pseudoColor(ColorMap colorMap) {
        return new ColorMapPresentation(RasterPresentationModel.PSEUDO_COLOR, colorMap);
    }

    static RasterPresentation densitySlicing(ColorMap colorMap) {
        return new ColorMapPresentation(RasterPresentationModel.DENSITY_SLICING, colorMap);
    }

    private static void checkCanonical(RasterColorSpace colorSpace) {
        if (colorSpace == null) {
            throw new NullArgumentException("colorSpace");
        }
        if (colorSpace.canonicalBands().isEmpty()) {
            throw new IncompatiblePresentationException(colorSpace, "no canonical band order");
        }
    }

    /**
     * Place each channel at its raster band index; positions no channel claims are marked unused
     */
    private static List<RasterColorSpaceBand> arrange(RasterPresentationModel model,
                                                      List<RasterColorSpaceBand> channels, int[] bandIndices) {
        if (bandIndices == null) {
            throw new NullArgumentException("bandIndices");
        }
        if (bandIndices.length != channels.size()) {
            throw new IncompatiblePresentationException(model,
                                                        "expected " + channels.size() + " band indices, got "
                                                        + bandIndices.length);
        }
        var max = -1;
        for (int i = 0; i < bandIndices.length; i++) {
            if (bandIndices[i] < 0 || bandIndices[i] == Integer.MAX_VALUE) {
                throw new InvalidDimensionException("index of " + channels.get(i) + " band", bandIndices[i]);
            }
            for (int j = 0; j < i; j++) {
                if (bandIndices[i] == bandIndices[j]) {
                    throw new DuplicateBandIndexException(bandIndices);
                }
            }
            max = Math.max(max, bandIndices[i]);
        }
        var bands = new ArrayList<>(Collections.nCopies(max + 1, RasterColorSpaceBand.UNUSED));
        for (int i = 0; i < bandIndices.length; i++) {
            bands.set(bandIndices[i], channels.get(i));
        }
        return bands;
    }

    RasterPresentationModel model();

    RasterColorSpace colorSpace();

    /**
     * One color channel per raster band position
     */
    List<RasterColorSpaceBand> bands();

    /**
     * The palette of a color map presentation
     */
    Optional<ColorMap> colorMap();

    /**
     * The palette color of a raster value under this presentation's lookup rule. Band list presentations have no
     * palette and yield nothing.
     */
    Optional<int[]> colorOf(int value);

    /**
     * Raster band index feeding the channel, or -1 if no band does
     */
    default int indexOf(RasterColorSpaceBand channel) {
        return bands().indexOf(channel);
    }
}
