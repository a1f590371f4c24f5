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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Creates vector geometries and hosts type keyed extensions. Domain specific factories (spectral geometries, for
 * instance) register themselves here so callers holding only a geometry factory can reach them.
 *
 * @author hal.hildebrand
 */
public class GeometryFactory {

    private static final Logger          log             = LoggerFactory.getLogger(GeometryFactory.class);
    private static final GeometryFactory DEFAULT_INSTANCE = new GeometryFactory();

    private final ConcurrentHashMap<Class<?>, Object> extensions = new ConcurrentHashMap<>();

    /**
     * The process wide default factory
     */
    public static GeometryFactory defaultInstance() {
        return DEFAULT_INSTANCE;
    }

    public Polygon createPolygon(List<Coordinate> shell) {
        return createPolygon(shell, null, null);
    }

    public Polygon createPolygon(List<Coordinate> shell, List<? extends List<Coordinate>> holes) {
        return createPolygon(shell, holes, null);
    }

    /**
     * Create an immutable polygon. Null holes and null metadata are treated as empty.
     */
    public Polygon createPolygon(List<Coordinate> shell, List<? extends List<Coordinate>> holes,
                                 Map<String, ?> metadata) {
        return new BasicPolygon(this, shell, holes, metadata);
    }

    /**
     * Register an extension under the given type, replacing any previous registration
     *
     * @return the previously registered extension, if any
     */
    public <T> Optional<T> registerExtension(Class<T> type, T extension) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(extension, "extension cannot be null");
        var previous = extensions.put(type, extension);
        log.debug("Registered {} extension: {}", type.getSimpleName(), extension);
        return Optional.ofNullable(previous).map(type::cast);
    }

    public <T> Optional<T> getExtension(Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return Optional.ofNullable(extensions.get(type)).map(type::cast);
    }

    /**
     * Return the extension registered under the type, creating and registering it atomically if absent
     */
    public <T> T computeExtensionIfAbsent(Class<T> type, Function<GeometryFactory, ? extends T> creator) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(creator, "creator cannot be null");
        return type.cast(extensions.computeIfAbsent(type, t -> {
            var extension = Objects.requireNonNull(creator.apply(this), "creator returned null");
            log.debug("Created {} extension: {}", type.getSimpleName(), extension);
            return extension;
        }));
    }

    public boolean removeExtension(Class<?> type) {
        return extensions.remove(type) != null;
    }
}
