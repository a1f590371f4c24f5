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

import com.hellblazer.spectra.geometry.GeometryFactory;
import com.hellblazer.spectra.geometry.Polygon;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.raster.Raster;

/**
 * Exposes {@link SpectralGeometryBuilder} as an extension of a {@link GeometryFactory}, so code holding only a
 * geometry factory can create spectral geometries through it.
 *
 * @author hal.hildebrand
 */
public final class SpectralGeometryFactories {

    private SpectralGeometryFactories() {
    }

    /**
     * The builder registered on the factory, registering a default one bound to the factory if there is none
     */
    public static SpectralGeometryBuilder builder(GeometryFactory factory) {
        if (factory == null) {
            throw new NullArgumentException("factory");
        }
        return factory.computeExtensionIfAbsent(SpectralGeometryBuilder.class, SpectralGeometryBuilder::new);
    }

    /**
     * Register a builder on the factory it is bound to, replacing any builder registered before
     */
    public static SpectralGeometryBuilder install(SpectralGeometryBuilder builder) {
        if (builder == null) {
            throw new NullArgumentException("builder");
        }
        builder.geometryFactory().registerExtension(SpectralGeometryBuilder.class, builder);
        return builder;
    }

    public static boolean isInstalled(GeometryFactory factory) {
        if (factory == null) {
            throw new NullArgumentException("factory");
        }
        return factory.getExtension(SpectralGeometryBuilder.class).isPresent();
    }

    public static SpectralPolygon createSpectralPolygon(GeometryFactory factory, SpectralGeometryRequest request) {
        return builder(factory).build(request);
    }

    /**
     * Spectral polygon bounded by the envelope of the raster
     */
    public static SpectralPolygon createSpectralPolygon(GeometryFactory factory, Raster raster) {
        return builder(factory).create(raster);
    }

    public static SpectralPolygon createSpectralPolygon(GeometryFactory factory, SpectralPolygon other) {
        return builder(factory).copy(other);
    }

    /**
     * Spectral geometry bounded by a polygon
     */
    public static SpectralGeometry createSpectralGeometry(GeometryFactory factory, Raster raster, Polygon polygon) {
        return builder(factory).create(raster, polygon);
    }
}
