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
import com.hellblazer.spectra.geometry.Polygon;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.imaging.RasterImaging;
import com.hellblazer.spectra.spectral.presentation.RasterPresentation;
import com.hellblazer.spectra.spectral.raster.Raster;
import com.hellblazer.spectra.spectral.raster.RasterFormat;
import com.hellblazer.spectra.spectral.raster.RasterMapper;
import com.hellblazer.spectra.spectral.raster.RasterService;
import com.hellblazer.spectra.spectral.raster.RasterSpecification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a spectral geometry can be built from. Every field is optional; {@link SpectralGeometryBuilder} fills
 * the gaps from the source geometries and its configuration.
 * <p>
 * The raster can come from exactly one place: a supplied raster, a specification, a bare shape, a raster service, a
 * geometry to clone or a list of geometries to merge. Setting one of them discards whichever was set before.
 *
 * @author hal.hildebrand
 */
public class SpectralGeometryRequest {

    private List<List<Coordinate>>  holes;
    private RasterImaging           imaging;
    private RasterMapper            mapper;
    private List<SpectralPolygon>   mergeSources;
    private Map<String, Object>     metadata;
    private boolean                 metadataSet;
    private Polygon                 polygon;
    private RasterPresentation      presentation;
    private Raster                  raster;
    private RasterService           rasterService;
    private RasterShape             rasterShape;
    private RasterSource            rasterSource = RasterSource.NONE;
    private RasterSpecification     specification;
    private List<Coordinate>        shell;
    private SpectralPolygon         source;

    public static SpectralGeometryRequest request() {
        return new SpectralGeometryRequest();
    }

    /**
     * Take the boundary and metadata of a plain polygon
     */
    public SpectralGeometryRequest withGeometry(Polygon polygon) {
        if (polygon == null) {
            throw new NullArgumentException("polygon");
        }
        this.polygon = polygon;
        return this;
    }

    public SpectralGeometryRequest withShell(List<Coordinate> shell) {
        if (shell == null) {
            throw new NullArgumentException("shell");
        }
        this.shell = new ArrayList<>(shell);
        return this;
    }

    public SpectralGeometryRequest withHoles(List<? extends List<Coordinate>> holes) {
        if (holes == null) {
            throw new NullArgumentException("holes");
        }
        var copy = new ArrayList<List<Coordinate>>(holes.size());
        for (int i = 0; i < holes.size(); i++) {
            if (holes.get(i) == null) {
                throw new NullArgumentException("holes[" + i + "]");
            }
            copy.add(new ArrayList<>(holes.get(i)));
        }
        this.holes = copy;
        return this;
    }

    public SpectralGeometryRequest withRaster(Raster raster) {
        if (raster == null) {
            throw new NullArgumentException("raster");
        }
        clearRasterSource(RasterSource.RASTER);
        this.raster = raster;
        return this;
    }

    /**
     * Realize a new raster from a validated specification
     *
     * @param mapper the mapper to model space, may be null
     */
    public SpectralGeometryRequest withRasterSpecification(RasterSpecification specification, RasterMapper mapper) {
        if (specification == null) {
            throw new NullArgumentException("specification");
        }
        clearRasterSource(RasterSource.SPECIFICATION);
        this.specification = specification;
        this.mapper = mapper;
        return this;
    }

    /**
     * Realize a new raster of the given shape with the configured default resolution
     */
    public SpectralGeometryRequest withRasterShape(RasterFormat format, int numberOfBands, int numberOfRows,
                                                   int numberOfColumns, RasterMapper mapper) {
        clearRasterSource(RasterSource.SHAPE);
        this.rasterShape = new RasterShape(format, numberOfBands, numberOfRows, numberOfColumns, null);
        this.mapper = mapper;
        return this;
    }

    /**
     * Realize a new raster of the given shape, one resolution per band
     */
    public SpectralGeometryRequest withRasterShape(RasterFormat format, int numberOfBands, int numberOfRows,
                                                   int numberOfColumns, List<Integer> radiometricResolutions,
                                                   RasterMapper mapper) {
        if (radiometricResolutions == null) {
            throw new NullArgumentException("radiometricResolutions");
        }
        clearRasterSource(RasterSource.SHAPE);
        this.rasterShape = new RasterShape(format, numberOfBands, numberOfRows, numberOfColumns,
                                           new ArrayList<>(radiometricResolutions));
        this.mapper = mapper;
        return this;
    }

    /**
     * Realize a new raster holding every sample of the service
     */
    public SpectralGeometryRequest withRasterService(RasterService service, RasterMapper mapper) {
        if (service == null) {
            throw new NullArgumentException("service");
        }
        clearRasterSource(RasterSource.SERVICE);
        this.rasterService = service;
        this.mapper = mapper;
        return this;
    }

    /**
     * Deep copy the raster of another spectral polygon and inherit whatever else this request leaves open
     */
    public SpectralGeometryRequest withSource(SpectralPolygon source) {
        if (source == null) {
            throw new NullArgumentException("source");
        }
        clearRasterSource(RasterSource.CLONE);
        this.source = source;
        return this;
    }

    /**
     * Concatenate the bands of the given polygons and inherit whatever else this request leaves open from the first
     */
    public SpectralGeometryRequest withMergeSources(Collection<? extends SpectralPolygon> others) {
        if (others == null) {
            throw new NullArgumentException("others");
        }
        clearRasterSource(RasterSource.MERGE);
        this.mergeSources = new ArrayList<>(others);
        return this;
    }

    public SpectralGeometryRequest withPresentation(RasterPresentation presentation) {
        if (presentation == null) {
            throw new NullArgumentException("presentation");
        }
        this.presentation = presentation;
        return this;
    }

    public SpectralGeometryRequest withImaging(RasterImaging imaging) {
        if (imaging == null) {
            throw new NullArgumentException("imaging");
        }
        this.imaging = imaging;
        return this;
    }

    /**
     * Attach metadata, replacing whatever a source geometry carries. A null map attaches no metadata.
     */
    public SpectralGeometryRequest withMetadata(Map<String, ?> metadata) {
        this.metadata = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
        this.metadataSet = true;
        return this;
    }

    RasterSource rasterSource() {
        return rasterSource;
    }

    Polygon polygon() {
        return polygon;
    }

    List<Coordinate> shell() {
        return shell;
    }

    List<List<Coordinate>> holes() {
        return holes;
    }

    Raster raster() {
        return raster;
    }

    RasterSpecification specification() {
        return specification;
    }

    RasterShape rasterShape() {
        return rasterShape;
    }

    RasterService rasterService() {
        return rasterService;
    }

    RasterMapper mapper() {
        return mapper;
    }

    SpectralPolygon source() {
        return source;
    }

    List<SpectralPolygon> mergeSources() {
        return mergeSources;
    }

    RasterPresentation presentation() {
        return presentation;
    }

    RasterImaging imaging() {
        return imaging;
    }

    boolean isMetadataSet() {
        return metadataSet;
    }

    Map<String, Object> metadata() {
        return metadata;
    }

    private void clearRasterSource(RasterSource next) {
        raster = null;
        specification = null;
        rasterShape = null;
        rasterService = null;
        mapper = null;
        source = null;
        mergeSources = null;
        rasterSource = next;
    }

    enum RasterSource {
        NONE, RASTER, SPECIFICATION, SHAPE, SERVICE, CLONE, MERGE
    }

    record RasterShape(RasterFormat format, int numberOfBands, int numberOfRows, int numberOfColumns,
                       List<Integer> radiometricResolutions) {
    }
}
