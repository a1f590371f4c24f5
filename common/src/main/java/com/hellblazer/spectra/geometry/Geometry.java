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
package com.hellblazer.spectra.geometry;

import java.util.Map;
import java.util.Optional;

/**
 * A vector geometry in model space.
 *
 * @author hal.hildebrand
 */
public interface Geometry {

    /**
     * The factory that produced this geometry
     */
    GeometryFactory factory();

    /**
     * Opaque, read only metadata attached to the geometry at construction
     */
    Map<String, Object> metadata();

    /**
     * The minimum bounding box, empty when the geometry has no coordinates
     */
    Optional<Envelope> envelope();

    boolean isEmpty();

    /**
     * Look up a single metadata value, null when absent
     */
    default Object metadata(String key) {
        return key == null ? null : metadata().get(key);
    }
}
