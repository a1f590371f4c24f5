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

import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.presentation.RasterPresentation;
import com.hellblazer.spectra.spectral.raster.RasterFormat;
import com.hellblazer.spectra.spectral.raster.RasterSpecification;

/**
 * Defaults applied by {@link SpectralGeometryBuilder} when a request leaves a choice open.
 *
 * @author hal.hildebrand
 */
public class SpectralGeometryConfig {

    private boolean            copySuppliedRaster       = false;
    private int                defaultFloatResolution   = RasterSpecification.DEFAULT_FLOAT_RADIOMETRIC_RESOLUTION;
    private int                defaultIntegerResolution = RasterSpecification.DEFAULT_RADIOMETRIC_RESOLUTION;
    private RasterPresentation defaultPresentation      = RasterPresentation.grayscale();

    /**
     * Create the default configuration: grayscale presentation, 16 bit integer and 32 bit floating samples, supplied
     * rasters adopted as is.
     */
    public static SpectralGeometryConfig defaults() {
        return new SpectralGeometryConfig();
    }

    /**
     * Create a configuration that deep copies every supplied raster, so built geometries never share pixels with the
     * caller.
     */
    public static SpectralGeometryConfig isolated() {
        return new SpectralGeometryConfig().withCopySuppliedRaster(true);
    }

    /**
     * Presentation attached when neither the request nor a source geometry provides one
     */
    public RasterPresentation getDefaultPresentation() {
        return defaultPresentation;
    }

    /**
     * Bits per sample of integer rasters built from a shape without resolutions
     */
    public int getDefaultIntegerResolution() {
        return defaultIntegerResolution;
    }

    /**
     * Bits per sample of floating rasters built from a shape without resolutions
     */
    public int getDefaultFloatResolution() {
        return defaultFloatResolution;
    }

    public int getDefaultResolution(RasterFormat format) {
        return format == RasterFormat.FLOATING ? defaultFloatResolution : defaultIntegerResolution;
    }

    /**
     * Whether a supplied raster is deep copied rather than adopted
     */
    public boolean isCopySuppliedRaster() {
        return copySuppliedRaster;
    }

    // Fluent API for configuration

    public SpectralGeometryConfig withDefaultPresentation(RasterPresentation presentation) {
        if (presentation == null) {
            throw new NullArgumentException("defaultPresentation");
        }
        this.defaultPresentation = presentation;
        return this;
    }

    public SpectralGeometryConfig withDefaultIntegerResolution(int resolution) {
        RasterSpecification.checkResolution(resolution);
        this.defaultIntegerResolution = resolution;
        return this;
    }

    public SpectralGeometryConfig withDefaultFloatResolution(int resolution) {
        RasterSpecification.checkResolution(resolution);
        this.defaultFloatResolution = resolution;
        return this;
    }

    public SpectralGeometryConfig withCopySuppliedRaster(boolean copy) {
        this.copySuppliedRaster = copy;
        return this;
    }

    public SpectralGeometryConfig copy() {
        return new SpectralGeometryConfig().withDefaultPresentation(defaultPresentation)
                                           .withDefaultIntegerResolution(defaultIntegerResolution)
                                           .withDefaultFloatResolution(defaultFloatResolution)
                                           .withCopySuppliedRaster(copySuppliedRaster);
    }

    @Override
    public String toString() {
        return String.format(
        "SpectralGeometryConfig{presentation=%s, integerResolution=%d, floatResolution=%d, copySuppliedRaster=%s}",
        defaultPresentation.model(), defaultIntegerResolution, defaultFloatResolution, copySuppliedRaster);
    }
}
