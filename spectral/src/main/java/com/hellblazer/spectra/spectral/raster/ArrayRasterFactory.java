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
package com.hellblazer.spectra.spectral.raster;

import com.hellblazer.spectra.spectral.exceptions.EmptyOthersCollectionException;
import com.hellblazer.spectra.spectral.exceptions.InvalidDimensionException;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Raster factory producing {@link ArrayRaster} instances
 *
 * @author hal.hildebrand
 */
public class ArrayRasterFactory implements RasterFactory {

    private static final Logger log = LoggerFactory.getLogger(ArrayRasterFactory.class);

    private static final ArrayRasterFactory DEFAULT = new ArrayRasterFactory();

    public static ArrayRasterFactory defaultInstance() {
        return DEFAULT;
    }

    @Override
    public Raster createRaster(RasterSpecification specification, RasterMapper mapper) {
        if (specification == null) {
            throw new NullArgumentException("specification");
        }
        var raster = new ArrayRaster(specification, mapper);
        log.debug("Created raster: {}", raster);
        return raster;
    }

    @Override
    public Raster createRaster(RasterService service, RasterMapper mapper) {
        if (service == null) {
            throw new NullArgumentException("service");
        }
        var specification = new RasterSpecification(service.format(), service.numberOfBands(),
                                                     service.numberOfRows(), service.numberOfColumns(),
                                                     service.radiometricResolutions());
        var raster = new ArrayRaster(specification, mapper);
        var floating = raster.format() == RasterFormat.FLOATING;
        for (int row = 0; row < raster.numberOfRows(); row++) {
            for (int column = 0; column < raster.numberOfColumns(); column++) {
                for (int band = 0; band < raster.numberOfBands(); band++) {
                    if (floating) {
                        raster.setFloatValue(row, column, band, service.readFloatValue(row, column, band));
                    } else {
                        raster.setValue(row, column, band, service.readValue(row, column, band));
                    }
                }
            }
        }
        log.debug("Read raster from service: {}", raster);
        return raster;
    }

    @Override
    public Raster copyRaster(Raster raster) {
        if (raster == null) {
            throw new NullArgumentException("raster");
        }
        if (raster instanceof ArrayRaster arrayRaster) {
            var copy = arrayRaster.copy();
            log.debug("Copied raster: {}", copy);
            return copy;
        }
        var copy = new ArrayRaster(RasterSpecification.of(raster), raster.mapper().orElse(null));
        transferBands(raster, copy, 0);
        log.debug("Copied raster: {}", copy);
        return copy;
    }

    @Override
    public Raster mergeRasters(List<? extends Raster> rasters) {
        if (rasters == null) {
            throw new NullArgumentException("rasters");
        }
        if (rasters.isEmpty()) {
            throw new EmptyOthersCollectionException();
        }
        var first = rasters.get(0);
        if (first == null) {
            throw new NullArgumentException("rasters[0]");
        }
        var format = first.format();
        var resolutions = new ArrayList<Integer>();
        for (int i = 0; i < rasters.size(); i++) {
            var raster = rasters.get(i);
            if (raster == null) {
                throw new NullArgumentException("rasters[" + i + "]");
            }
            if (raster.numberOfRows() != first.numberOfRows()) {
                throw new InvalidDimensionException("rasters[" + i + "].numberOfRows", raster.numberOfRows());
            }
            if (raster.numberOfColumns() != first.numberOfColumns()) {
                throw new InvalidDimensionException("rasters[" + i + "].numberOfColumns",
                                                    raster.numberOfColumns());
            }
            if (raster.format() != format) {
                format = RasterFormat.FLOATING;
            }
            resolutions.addAll(raster.radiometricResolutions());
        }

        var specification = new RasterSpecification(format, resolutions.size(), first.numberOfRows(),
                                                     first.numberOfColumns(), resolutions);
        var merged = new ArrayRaster(specification, first.mapper().orElse(null));
        var bandOffset = 0;
        for (var raster : rasters) {
            transferBands(raster, merged, bandOffset);
            bandOffset += raster.numberOfBands();
        }
        log.debug("Merged {} rasters into: {}", rasters.size(), merged);
        return merged;
    }

    private void transferBands(Raster source, ArrayRaster target, int bandOffset) {
        var floating = target.format() == RasterFormat.FLOATING;
        for (int band = 0; band < source.numberOfBands(); band++) {
            for (int row = 0; row < source.numberOfRows(); row++) {
                for (int column = 0; column < source.numberOfColumns(); column++) {
                    if (floating) {
                        target.setFloatValue(row, column, bandOffset + band,
                                             source.getFloatValue(row, column, band));
                    } else {
                        target.setValue(row, column, bandOffset + band, source.getValue(row, column, band));
                    }
                }
            }
        }
    }
}
