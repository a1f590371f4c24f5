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
package com.hellblazer.spectra.spectral.exceptions;

/**
 * The number of per band radiometric resolutions does not match the number of bands.
 */
public final class BandResolutionMismatchException extends SpectralConfigurationException {

    private final int actual;
    private final int expected;

    public BandResolutionMismatchException(int expected, int actual) {
        super(String.format("Expected %d radiometric resolutions, got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getActual() {
        return actual;
    }

    public int getExpected() {
        return expected;
    }
}
