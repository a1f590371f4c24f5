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
package com.hellblazer.spectra.spectral.imaging;

import com.hellblazer.spectra.geometry.Coordinate;
import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.range.SpectralDomain;
import com.hellblazer.spectra.spectral.range.SpectralRange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of how a raster was acquired: the sensor, the time and geometry of the acquisition, and one
 * {@link RasterImagingBand} per raster band. Angles are in radians.
 *
 * @author hal.hildebrand
 */
public final class RasterImaging {

    public static final int IMAGE_LOCATION_CORNERS = 4;

    private final Map<String, Object>     additionalParameters;
    private final List<RasterImagingBand> bands;
    private final ImagingDevice           device;
    private final Coordinate              deviceLocation;
    private final List<Coordinate>        imageLocation;
    private final double                  incidenceAngle;
    private final double                  sunAzimuth;
    private final double                  sunElevation;
    private final Instant                 time;
    private final double                  viewingAngle;

    private RasterImaging(Builder builder) {
        this.device = builder.device;
        this.time = builder.time;
        this.deviceLocation = builder.deviceLocation;
        this.imageLocation = List.copyOf(builder.imageLocation);
        this.incidenceAngle = builder.incidenceAngle;
        this.viewingAngle = builder.viewingAngle;
        this.sunAzimuth = builder.sunAzimuth;
        this.sunElevation = builder.sunElevation;
        this.bands = List.copyOf(builder.bands);
        this.additionalParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.additionalParameters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RasterImaging of(RasterImagingBand... bands) {
        return builder().withBands(List.of(bands)).build();
    }

    public Optional<ImagingDevice> device() {
        return Optional.ofNullable(device);
    }

    public Optional<Instant> time() {
        return Optional.ofNullable(time);
    }

    public Optional<Coordinate> deviceLocation() {
        return Optional.ofNullable(deviceLocation);
    }

    /**
     * The four corners of the imaged area, or empty when unknown
     */
    public List<Coordinate> imageLocation() {
        return imageLocation;
    }

    public double incidenceAngle() {
        return incidenceAngle;
    }

    public double viewingAngle() {
        return viewingAngle;
    }

    public double sunAzimuth() {
        return sunAzimuth;
    }

    public double sunElevation() {
        return sunElevation;
    }

    public List<RasterImagingBand> bands() {
        return bands;
    }

    public int numberOfBands() {
        return bands.size();
    }

    public List<SpectralDomain> spectralDomains() {
        return bands.stream().map(RasterImagingBand::spectralDomain).toList();
    }

    public List<SpectralRange> spectralRanges() {
        return bands.stream().map(RasterImagingBand::spectralRange).toList();
    }

    public Map<String, Object> additionalParameters() {
        return additionalParameters;
    }

    /**
     * An additional acquisition parameter, empty when absent or null
     */
    public Optional<Object> parameter(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(additionalParameters.get(key));
    }

    /**
     * New imaging keeping only the selected bands, in the given order
     *
     * @throws IndexOutOfBoundsException if an index does not name a band
     */
    public RasterImaging filter(int... bandIndices) {
        if (bandIndices == null) {
            throw new NullArgumentException("bandIndices");
        }
        if (bandIndices.length == 0) {
            throw new IllegalArgumentException("No bands selected");
        }
        var selected = new ArrayList<RasterImagingBand>(bandIndices.length);
        for (var index : bandIndices) {
            selected.add(bands.get(Objects.checkIndex(index, bands.size())));
        }
        return toBuilder().withBands(selected).build();
    }

    /**
     * New imaging with the bands of this imaging followed by the bands of the other
     */
    public RasterImaging concat(RasterImaging other) {
        if (other == null) {
            throw new NullArgumentException("other");
        }
        var combined = new ArrayList<>(bands);
        combined.addAll(other.bands);
        return toBuilder().withBands(combined).build();
    }

    public Builder toBuilder() {
        var builder = new Builder().withDevice(device)
                                   .withTime(time)
                                   .withDeviceLocation(deviceLocation)
                                   .withImageLocation(imageLocation)
                                   .withIncidenceAngle(incidenceAngle)
                                   .withViewingAngle(viewingAngle)
                                   .withSunAzimuth(sunAzimuth)
                                   .withSunElevation(sunElevation)
                                   .withBands(bands);
        additionalParameters.forEach(builder::withParameter);
        return builder;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RasterImaging other)) return false;
        return Double.compare(incidenceAngle, other.incidenceAngle) == 0
        && Double.compare(viewingAngle, other.viewingAngle) == 0 && Double.compare(sunAzimuth, other.sunAzimuth) == 0
        && Double.compare(sunElevation, other.sunElevation) == 0 && Objects.equals(device, other.device)
        && Objects.equals(time, other.time) && Objects.equals(deviceLocation, other.deviceLocation)
        && imageLocation.equals(other.imageLocation) && bands.equals(other.bands)
        && additionalParameters.equals(other.additionalParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(device, time, deviceLocation, imageLocation, incidenceAngle, viewingAngle, sunAzimuth,
                            sunElevation, bands, additionalParameters);
    }

    @Override
    public String toString() {
        return String.format("RasterImaging{device=%s, time=%s, bands=%d}",
                             device == null ? "unknown" : device.name(), time, bands.size());
    }

    public static final class Builder {
        private final Map<String, Object>     additionalParameters = new LinkedHashMap<>();
        private       List<RasterImagingBand> bands                = List.of();
        private       ImagingDevice           device;
        private       Coordinate              deviceLocation;
        private       List<Coordinate>        imageLocation        = List.of();
        private       double                  incidenceAngle;
        private       double                  sunAzimuth;
        private       double                  sunElevation;
        private       Instant                 time;
        private       double                  viewingAngle;

        private Builder() {
        }

        public Builder withDevice(ImagingDevice device) {
            this.device = device;
            return this;
        }

        public Builder withTime(Instant time) {
            this.time = time;
            return this;
        }

        public Builder withDeviceLocation(Coordinate deviceLocation) {
            this.deviceLocation = deviceLocation;
            return this;
        }

        /**
         * @param imageLocation exactly four corners, or null or empty when unknown
         */
        public Builder withImageLocation(List<Coordinate> imageLocation) {
            if (imageLocation == null || imageLocation.isEmpty()) {
                this.imageLocation = List.of();
                return this;
            }
            if (imageLocation.size() != IMAGE_LOCATION_CORNERS) {
                throw new IllegalArgumentException(
                String.format("Image location must have %d corners, got %d", IMAGE_LOCATION_CORNERS,
                              imageLocation.size()));
            }
            for (int i = 0; i < imageLocation.size(); i++) {
                if (imageLocation.get(i) == null) {
                    throw new NullArgumentException("imageLocation[" + i + "]");
                }
            }
            this.imageLocation = List.copyOf(imageLocation);
            return this;
        }

        public Builder withIncidenceAngle(double incidenceAngle) {
            this.incidenceAngle = incidenceAngle;
            return this;
        }

        public Builder withViewingAngle(double viewingAngle) {
            this.viewingAngle = viewingAngle;
            return this;
        }

        public Builder withSunAzimuth(double sunAzimuth) {
            this.sunAzimuth = sunAzimuth;
            return this;
        }

        public Builder withSunElevation(double sunElevation) {
            this.sunElevation = sunElevation;
            return this;
        }

        public Builder withBands(List<RasterImagingBand> bands) {
            if (bands == null) {
                throw new NullArgumentException("bands");
            }
            for (int i = 0; i < bands.size(); i++) {
                if (bands.get(i) == null) {
                    throw new NullArgumentException("bands[" + i + "]");
                }
            }
            this.bands = List.copyOf(bands);
            return this;
        }

        public Builder withParameter(String key, Object value) {
            if (key == null) {
                throw new NullArgumentException("key");
            }
            additionalParameters.put(key, value);
            return this;
        }

        public RasterImaging build() {
            return new RasterImaging(this);
        }
    }
}
