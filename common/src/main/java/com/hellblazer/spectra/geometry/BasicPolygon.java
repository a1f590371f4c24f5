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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable polygon produced by {@link GeometryFactory#createPolygon}. Rings and metadata are copied on construction;
 * metadata values may be null.
 *
 * @author hal.hildebrand
 */
public final class BasicPolygon implements Polygon {

    private final GeometryFactory           factory;
    private final List<List<Coordinate>>    holes;
    private final Map<String, Object>       metadata;
    private final List<Coordinate>          shell;

    BasicPolygon(GeometryFactory factory, List<Coordinate> shell, List<? extends List<Coordinate>> holes,
                 Map<String, ?> metadata) {
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        this.shell = List.copyOf(Objects.requireNonNull(shell, "shell cannot be null"));
        var copiedHoles = new ArrayList<List<Coordinate>>();
        if (holes != null) {
            for (var hole : holes) {
                copiedHoles.add(List.copyOf(Objects.requireNonNull(hole, "hole cannot be null")));
            }
        }
        this.holes = Collections.unmodifiableList(copiedHoles);
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public GeometryFactory factory() {
        return factory;
    }

    @Override
    public List<Coordinate> shell() {
        return shell;
    }

    @Override
    public List<List<Coordinate>> holes() {
        return holes;
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BasicPolygon other)) return false;
        return shell.equals(other.shell) && holes.equals(other.holes) && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shell, holes, metadata);
    }

    @Override
    public String toString() {
        return "Polygon{shell=" + shell.size() + " coordinates, holes=" + holes.size() + "}";
    }
}
