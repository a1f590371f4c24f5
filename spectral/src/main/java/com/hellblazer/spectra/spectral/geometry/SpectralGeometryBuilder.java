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

import com.hellblazer.spectra.geometry.Coordinate;
import com.hellblazer.spectra.geometry.GeometryFactory;
import com.hellblazer.spectra.geometry.Polygon;
import com.hellblazer.spectra.spectral.exceptions.EmptyOthersCollectionException;
import com.hellblazer.spectra.spectral.exceptions.EmptyShellException;
import com.hellblazer.spectra.spectral.exceptions.InvalidBandCountException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.geometry.SpectralGeometryRequest.RasterSource;
import com.hellblazer.spectra.spectral.imaging.RasterImaging;
import com.hellblazer.spectra.spectral.presentation.RasterPresentation;
import com.hellblazer.spectra.spectral.raster.ArrayRasterFactory;
import com.hellblazer.spectra.spectral.raster.Raster;
import com.hellblazer.spectra.spectral.raster.RasterFactory;
import com.hellblazer.spectra.spectral.raster.RasterSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link SpectralPolygon} instances from a {@link SpectralGeometryRequest}. Every way of creating a spectral
 * geometry (from a raster, a specification, a service, a clone source or a list of geometries to merge) goes through
 * {@link #build(SpectralGeometryRequest)}.
 * <p>
 * A build either returns a complete polygon or throws; validation of the boundary and the raster source runs before
 * any raster is realized. The builder keeps no mutable state and may be shared between threads.
 *
 * @author hal.hildebrand
 */
public class SpectralGeometryBuilder {

    private static final Logger log = LoggerFactory.getLogger(SpectralGeometryBuilder.class);

    private final SpectralGeometryConfig config;
    private final GeometryFactory        geometryFactory;
    private final RasterFactory          rasterFactory;

    public SpectralGeometryBuilder() {
        this(GeometryFactory.defaultInstance());
    }

    public SpectralGeometryBuilder(GeometryFactory geometryFactory) {
        this(geometryFactory, ArrayRasterFactory.defaultInstance(), SpectralGeometryConfig.defaults());
    }

    public SpectralGeometryBuilder(GeometryFactory geometryFactory, RasterFactory rasterFactory,
                                   SpectralGeometryConfig config) {
        this.geometryFactory = Objects.requireNonNull(geometryFactory, "geometryFactory cannot be null");
        this.rasterFactory = Objects.requireNonNull(rasterFactory, "rasterFactory cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null").copy();
    }

    public GeometryFactory geometryFactory() {
        return geometryFactory;
    }

    public RasterFactory rasterFactory() {
        return rasterFactory;
    }

    /**
     * A copy of the configuration in effect; changing it does not affect this builder
     */
    public SpectralGeometryConfig config() {
        return config.copy();
    }

    /**
     * Build a spectral polygon
     *
     * @throws com.hellblazer.spectra.spectral.exceptions.SpectralConfigurationException when the request is
     *                                                                                   incomplete or inconsistent
     */
    public SpectralPolygon build(SpectralGeometryRequest request) {
        if (request == null) {
            throw new NullArgumentException("request");
        }
        var origin = origin(request);
        var specification = specificationOf(request);
        var boundary = explicitBoundary(request, origin);

        var raster = realizeRaster(request, specification);
        if (raster.numberOfBands() < 1) {
            throw new InvalidBandCountException(raster.numberOfBands());
        }
        if (boundary.shell() == null) {
            var shell = raster.coordinates();
            checkRing(shell, "shell");
            boundary = new Boundary(shell, boundary.holes());
        }

        var presentation = request.presentation();
        if (presentation == null) {
            presentation = origin != null ? origin.presentation() : config.getDefaultPresentation();
        }
        var imaging = request.imaging();
        if (imaging == null && origin != null) {
            imaging = origin.imaging().orElse(null);
        }
        var polygon = geometryFactory.createPolygon(boundary.shell(), boundary.holes(), metadataOf(request, origin));
        var result = new SpectralPolygon(polygon, raster, presentation, imaging);
        log.debug("Built {} from {} raster source", result, request.rasterSource());
        return result;
    }

    /**
     * Wrap a raster, bounded by its own envelope
     */
    public SpectralPolygon create(Raster raster) {
        return build(SpectralGeometryRequest.request().withRaster(raster));
    }

    /**
     * Wrap a raster, bounded by a polygon
     */
    public SpectralPolygon create(Raster raster, Polygon polygon) {
        return build(SpectralGeometryRequest.request().withRaster(raster).withGeometry(polygon));
    }

    /**
     * Deep copy another spectral polygon; the copy shares no pixels with the original
     */
    public SpectralPolygon copy(SpectralPolygon other) {
        return build(SpectralGeometryRequest.request().withSource(other));
    }

    /**
     * Merge the bands of the given polygons, in order, keeping the boundary, presentation, imaging and metadata of
     * the first
     */
    public SpectralPolygon merge(Collection<? extends SpectralPolygon> others) {
        return build(SpectralGeometryRequest.request().withMergeSources(others));
    }

    /**
     * Merge the bands of the given polygons, in order, with the given imaging
     */
    public SpectralPolygon merge(Collection<? extends SpectralPolygon> others, RasterImaging imaging) {
        return build(SpectralGeometryRequest.request().withMergeSources(others).withImaging(imaging));
    }

    private void checkRing(List<Coordinate> ring, String name) {
        if (ring.isEmpty()) {
            throw new EmptyShellException(name);
        }
        for (int i = 0; i < ring.size(); i++) {
            if (ring.get(i) == null) {
                throw new NullArgumentException(name + "[" + i + "]");
            }
        }
    }

    /**
     * The boundary given by the request or a source geometry. The shell is null when it is to come from the raster;
     * explicit holes are kept either way.
     */
    private Boundary explicitBoundary(SpectralGeometryRequest request, SpectralPolygon origin) {
        Polygon supplier = request.polygon() != null ? request.polygon() : origin;
        List<Coordinate> shell = request.shell();
        List<List<Coordinate>> holes = request.holes();
        if (shell == null && supplier != null) {
            shell = supplier.shell();
            if (holes == null) {
                holes = supplier.holes();
            }
        }
        if (holes == null) {
            holes = List.of();
        }
        if (shell != null) {
            checkRing(shell, "shell");
        }
        for (int i = 0; i < holes.size(); i++) {
            checkRing(holes.get(i), "holes[" + i + "]");
        }
        return new Boundary(shell, holes);
    }

    private Map<String, Object> metadataOf(SpectralGeometryRequest request, SpectralPolygon origin) {
        if (request.isMetadataSet()) {
            return request.metadata();
        }
        if (request.polygon() != null) {
            return request.polygon().metadata();
        }
        if (origin != null) {
            return origin.metadata();
        }
        return Map.of();
    }

    /**
     * The geometry a clone or merge inherits from, after validating the merge sources
     */
    private SpectralPolygon origin(SpectralGeometryRequest request) {
        switch (request.rasterSource()) {
            case NONE:
                throw new NullArgumentException("raster");
            case CLONE:
                return request.source();
            case MERGE:
                var others = request.mergeSources();
                if (others.isEmpty()) {
                    throw new EmptyOthersCollectionException();
                }
                for (int i = 0; i < others.size(); i++) {
                    if (others.get(i) == null) {
                        throw new NullArgumentException("others[" + i + "]");
                    }
                }
                return others.get(0);
            default:
                return null;
        }
    }

    private Raster realizeRaster(SpectralGeometryRequest request, RasterSpecification specification) {
        switch (request.rasterSource()) {
            case RASTER:
                return config.isCopySuppliedRaster() ? rasterFactory.copyRaster(request.raster()) : request.raster();
            case SPECIFICATION:
            case SHAPE:
                return rasterFactory.createRaster(specification, request.mapper());
            case SERVICE:
                return rasterFactory.createRaster(request.rasterService(), request.mapper());
            case CLONE:
                return rasterFactory.copyRaster(request.source().raster());
            case MERGE:
                var rasters = new ArrayList<Raster>();
                for (var other : request.mergeSources()) {
                    rasters.add(other.raster());
                }
                return rasterFactory.mergeRasters(rasters);
            default:
                throw new NullArgumentException("raster");
        }
    }

    /**
     * The validated specification of a raster to realize, or null when the raster comes from elsewhere
     */
    private RasterSpecification specificationOf(SpectralGeometryRequest request) {
        if (request.rasterSource() == RasterSource.SPECIFICATION) {
            return request.specification();
        }
        if (request.rasterSource() != RasterSource.SHAPE) {
            return null;
        }
        var shape = request.rasterShape();
        if (shape.format() == null) {
            throw new NullArgumentException("format");
        }
        if (shape.radiometricResolutions() != null) {
            return RasterSpecification.validate(shape.format(), shape.numberOfBands(), shape.numberOfRows(),
                                                shape.numberOfColumns(), shape.radiometricResolutions());
        }
        var resolution = config.getDefaultResolution(shape.format());
        return RasterSpecification.validate(shape.format(), shape.numberOfBands(), shape.numberOfRows(),
                                            shape.numberOfColumns(), resolution);
    }

    private record Boundary(List<Coordinate> shell, List<List<Coordinate>> holes) {
    }
}
