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
package com.hellblazer.spectra.spectral.range;

/**
 * Closed wavelength interval, in metres
 *
 * @author hal.hildebrand
 */
public record SpectralRange(double start, double end) {

    /** Speed of light in vacuum, metres per second */
    public static final double SPEED_OF_LIGHT = 299_792_458.0;

    public SpectralRange {
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            throw new IllegalArgumentException("Wavelengths must be finite: [" + start + ", " + end + "]");
        }
        if (start <= 0.0) {
            throw new IllegalArgumentException("Wavelengths must be positive: " + start);
        }
        if (start > end) {
            throw new IllegalArgumentException("Start wavelength exceeds end wavelength: " + start + " > " + end);
        }
    }

    public static SpectralRange ofNanometres(double start, double end) {
        return new SpectralRange(start / 1e9, end / 1e9);
    }

    public static SpectralRange ofMicrometres(double start, double end) {
        return new SpectralRange(start / 1e6, end / 1e6);
    }

    public boolean contains(double wavelength) {
        return wavelength >= start && wavelength <= end;
    }

    public boolean contains(SpectralRange other) {
        return other.start >= start && other.end <= end;
    }

    public boolean overlaps(SpectralRange other) {
        return other.start <= end && other.end >= start;
    }

    public double width() {
        return end - start;
    }

    public double center() {
        return (start + end) / 2.0;
    }

    /**
     * Frequency of the longest wavelength, in hertz
     */
    public double frequencyMinimum() {
        return SPEED_OF_LIGHT / end;
    }

    /**
     * Frequency of the shortest wavelength, in hertz
     */
    public double frequencyMaximum() {
        return SPEED_OF_LIGHT / start;
    }
}
