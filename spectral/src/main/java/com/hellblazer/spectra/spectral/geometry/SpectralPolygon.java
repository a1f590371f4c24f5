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
import com.hellblazer.spectra.geometry.Envelope;
import com.hellblazer.spectra.geometry.GeometryFactory;
import com.hellblazer.spectra.geometry.Polygon;
import com.hellblazer.spectra.spectral.imaging.RasterImaging;
import com.hellblazer.spectra.spectral.presentation.RasterPresentation;
import com.hellblazer.spectra.spectral.raster.Raster;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Polygonal spectral geometry. Boundary and metadata come from a plain polygon created by the bound geometry
 * factory; instances are only produced by {@link SpectralGeometryBuilder}, after every argument has been validated.
 *
 * @author hal.hildebrand
 */
public final class SpectralPolygon implements SpectralGeometry, Polygon {

    private final Polygon            boundary;
    private final RasterImaging      imaging;
    private final RasterPresentation presentation;
    private final Raster             raster;

    SpectralPolygon(Polygon boundary, Raster raster, RasterPresentation presentation, RasterImaging imaging) {
        this.boundary = Objects.requireNonNull(boundary, "boundary cannot be null");
        this.raster = Objects.requireNonNull(raster, "raster cannot be null");
        this.presentation = Objects.requireNonNull(presentation, "presentation cannot be null");
        this.imaging = imaging;
    }

    @Override
    public GeometryFactory factory() {
        return boundary.factory();
    }

    @Override
    public List<Coordinate> shell() {
        return boundary.shell();
    }

    @Override
    public List<List<Coordinate>> holes() {
        return boundary.holes();
    }

    @Override
    public Map<String, Object> metadata() {
        return boundary.metadata();
    }

    @Override
    public Optional<Envelope> envelope() {
        return boundary.envelope();
    }

    @Override
    public boolean isEmpty() {
        return boundary.isEmpty();
    }

    @Override
    public Raster raster() {
        return raster;
    }

    @Override
    public RasterPresentation presentation() {
        return presentation;
    }

    @Override
    public Optional<RasterImaging> imaging() {
        return Optional.ofNullable(imaging);
    }

    /**
     * The plain polygon carrying the boundary and metadata
     */
    public Polygon boundary() {
        return boundary;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SpectralPolygon other)) return false;
        return boundary.equals(other.boundary) && raster.equals(other.raster)
        && presentation.equals(other.presentation) && Objects.equals(imaging, other.imaging);
    }

    @Override
    public int hashCode() {
        return Objects.hash(boundary, raster, presentation, imaging);
    }

    @Override
    public String toString() {
        return String.format("SpectralPolygon{shell=%d coordinates, holes=%d, raster=%s, presentation=%s, imaged=%s}",
                             shell().size(), holeCount(), raster, presentation.model(), imaging != null);
    }
}
