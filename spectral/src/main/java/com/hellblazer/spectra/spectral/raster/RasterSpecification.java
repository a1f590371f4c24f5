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

import com.hellblazer.spectra.spectral.exceptions.BandResolutionMismatchException;
import com.hellblazer.spectra.spectral.exceptions.InvalidBandCountException;
import com.hellblazer.spectra.spectral.exceptions.InvalidDimensionException;
import com.hellblazer.spectra.spectral.exceptions.InvalidRadiometricResolutionException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;

import java.util.Collections;
import java.util.List;

/**
 * Validated shape of a raster prior to its realisation by a {@link RasterFactory}: the number of bands, rows and
 * columns, and the radiometric resolution (bits per sample) of every band.
 * <p>
 * Validation order is fixed: band count, rows, columns, then resolutions. A resolution list whose length differs from
 * the band count is reported before any out of range element.
 *
 * @author hal.hildebrand
 */
public record RasterSpecification(RasterFormat format, int numberOfBands, int numberOfRows, int numberOfColumns,
                                  List<Integer> radiometricResolutions) {

    public static final int DEFAULT_RADIOMETRIC_RESOLUTION       = 16;
    public static final int DEFAULT_FLOAT_RADIOMETRIC_RESOLUTION = 32;
    public static final int MAX_RADIOMETRIC_RESOLUTION           = 64;
    public static final int MIN_RADIOMETRIC_RESOLUTION           = 1;

    public RasterSpecification {
        if (format == null) {
            throw new NullArgumentException("format");
        }
        checkShape(numberOfBands, numberOfRows, numberOfColumns);
        if (radiometricResolutions == null) {
            throw new NullArgumentException("radiometricResolutions");
        }
        if (radiometricResolutions.size() != numberOfBands) {
            throw new BandResolutionMismatchException(numberOfBands, radiometricResolutions.size());
        }
        for (var resolution : radiometricResolutions) {
            if (resolution == null) {
                throw new NullArgumentException("radiometric resolution");
            }
            checkResolution(resolution);
        }
        radiometricResolutions = List.copyOf(radiometricResolutions);
    }

    public static RasterSpecification validate(int numberOfBands, int numberOfRows, int numberOfColumns) {
        return validate(RasterFormat.ANY, numberOfBands, numberOfRows, numberOfColumns);
    }

    public static RasterSpecification validate(int numberOfBands, int numberOfRows, int numberOfColumns,
                                               int radiometricResolution) {
        return validate(RasterFormat.ANY, numberOfBands, numberOfRows, numberOfColumns, radiometricResolution);
    }

    public static RasterSpecification validate(int numberOfBands, int numberOfRows, int numberOfColumns,
                                               List<Integer> radiometricResolutions) {
        return validate(RasterFormat.ANY, numberOfBands, numberOfRows, numberOfColumns, radiometricResolutions);
    }

    /**
     * Validate a specification using the default resolution of the format
     */
    public static RasterSpecification validate(RasterFormat format, int numberOfBands, int numberOfRows,
                                               int numberOfColumns) {
        return validate(format, numberOfBands, numberOfRows, numberOfColumns, defaultResolution(format));
    }

    /**
     * Validate a specification whose bands all share one radiometric resolution
     */
    public static RasterSpecification validate(RasterFormat format, int numberOfBands, int numberOfRows,
                                               int numberOfColumns, int radiometricResolution) {
        checkShape(numberOfBands, numberOfRows, numberOfColumns);
        checkResolution(radiometricResolution);
        return new RasterSpecification(format, numberOfBands, numberOfRows, numberOfColumns,
                                       Collections.nCopies(numberOfBands, radiometricResolution));
    }

    public static RasterSpecification validate(RasterFormat format, int numberOfBands, int numberOfRows,
                                               int numberOfColumns, List<Integer> radiometricResolutions) {
        return new RasterSpecification(format, numberOfBands, numberOfRows, numberOfColumns, radiometricResolutions);
    }

    /**
     * Specification describing an existing raster
     */
    public static RasterSpecification of(Raster raster) {
        if (raster == null) {
            throw new NullArgumentException("raster");
        }
        return new RasterSpecification(raster.format(), raster.numberOfBands(), raster.numberOfRows(),
                                       raster.numberOfColumns(), raster.radiometricResolutions());
    }

    public static int defaultResolution(RasterFormat format) {
        return format == RasterFormat.FLOATING ? DEFAULT_FLOAT_RADIOMETRIC_RESOLUTION : DEFAULT_RADIOMETRIC_RESOLUTION;
    }

    /**
     * @throws InvalidRadiometricResolutionException if the resolution is outside [1, 64]
     */
    public static void checkResolution(int radiometricResolution) {
        if (radiometricResolution < MIN_RADIOMETRIC_RESOLUTION || radiometricResolution > MAX_RADIOMETRIC_RESOLUTION) {
            throw new InvalidRadiometricResolutionException(radiometricResolution);
        }
    }

    private static void checkShape(int numberOfBands, int numberOfRows, int numberOfColumns) {
        if (numberOfBands < 1) {
            throw new InvalidBandCountException(numberOfBands);
        }
        if (numberOfRows < 0) {
            throw new InvalidDimensionException("numberOfRows", numberOfRows);
        }
        if (numberOfColumns < 0) {
            throw new InvalidDimensionException("numberOfColumns", numberOfColumns);
        }
    }

    public int radiometricResolution(int bandIndex) {
        return radiometricResolutions.get(bandIndex);
    }

    public int maxRadiometricResolution() {
        return radiometricResolutions.stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * True when every band shares the same radiometric resolution
     */
    public boolean isUniform() {
        return radiometricResolutions.stream().distinct().count() <= 1;
    }
}
