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

import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.exceptions.NullColorMapException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable palette mapping raster values to color components, sorted by value. Entries are copied in and out, so a
 * color map never shares state with its callers.
 *
 * @author hal.hildebrand
 */
public final class ColorMap {

    private final NavigableMap<Integer, int[]> entries;

    private ColorMap(NavigableMap<Integer, int[]> entries) {
        this.entries = entries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws NullColorMapException if the map is null or empty
     */
    public static ColorMap of(Map<Integer, int[]> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new NullColorMapException();
        }
        var builder = builder();
        entries.forEach(builder::put);
        return builder.build();
    }

    /**
     * The color of exactly this value
     */
    public Optional<int[]> get(int value) {
        return Optional.ofNullable(entries.get(value)).map(int[]::clone);
    }

    /**
     * The color of the greatest value less than or equal to this value
     */
    public Optional<int[]> floor(int value) {
        return Optional.ofNullable(entries.floorEntry(value)).map(e -> e.getValue().clone());
    }

    public boolean containsValue(int value) {
        return entries.containsKey(value);
    }

    public int size() {
        return entries.size();
    }

    public NavigableMap<Integer, int[]> asMap() {
        var copy = new TreeMap<Integer, int[]>();
        entries.forEach((k, v) -> copy.put(k, v.clone()));
        return Collections.unmodifiableNavigableMap(copy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColorMap other)) return false;
        if (entries.size() != other.entries.size()) return false;
        for (var entry : entries.entrySet()) {
            if (!Arrays.equals(entry.getValue(), other.entries.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (var entry : entries.entrySet()) {
            hash = 31 * hash + entry.getKey();
            hash = 31 * hash + Arrays.hashCode(entry.getValue());
        }
        return hash;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("ColorMap{");
        var first = true;
        for (var entry : entries.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(Arrays.toString(entry.getValue()));
            first = false;
        }
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final TreeMap<Integer, int[]> entries = new TreeMap<>();

        private Builder() {
        }

        public Builder put(Integer value, int... color) {
            if (value == null) {
                throw new NullArgumentException("value");
            }
            if (color == null) {
                throw new NullArgumentException("color");
            }
            entries.put(value, color.clone());
            return this;
        }

        /**
         * @throws NullColorMapException if no entry was added
         */
        public ColorMap build() {
            if (entries.isEmpty()) {
                throw new NullColorMapException();
            }
            var copy = new TreeMap<Integer, int[]>();
            entries.forEach((k, v) -> copy.put(k, v.clone()));
            return new ColorMap(copy);
        }
    }
}
