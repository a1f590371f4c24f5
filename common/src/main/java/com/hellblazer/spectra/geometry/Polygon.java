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

import java.util.List;
import java.util.Optional;

/**
 * A planar surface bounded by one exterior ring (the shell) and any number of interior rings (the holes). Rings are
 * ordered coordinate sequences; closing the ring is implicit.
 *
 * @author hal.hildebrand
 */
public interface Polygon extends Geometry {

    List<Coordinate> shell();

    List<List<Coordinate>> holes();

    default int holeCount() {
        return holes().size();
    }

    default List<Coordinate> hole(int index) {
        return holes().get(index);
    }

    @Override
    default Optional<Envelope> envelope() {
        var shell = shell();
        return shell.isEmpty() ? Optional.empty() : Optional.of(Envelope.from(shell));
    }

    @Override
    default boolean isEmpty() {
        return shell().isEmpty();
    }
}
