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
 * The presentation model does not accept the supplied construction shape: color map models given a band list, band
 * list models given a color map, or a color space with no canonical band order.
 */
public final class IncompatiblePresentationException extends SpectralConfigurationException {

    private final String model;

    public IncompatiblePresentationException(Object model, String reason) {
        super("Incompatible presentation configuration for " + model + ": " + reason);
        this.model = String.valueOf(model);
    }

    public String getModel() {
        return model;
    }
}
