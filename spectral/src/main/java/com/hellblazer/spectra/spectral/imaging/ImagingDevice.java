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

import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;
import com.hellblazer.spectra.spectral.range.SpectralRange;

import java.time.Duration;
import java.util.List;

/**
 * An imaging sensor carried by a mission, such as a satellite instrument. Altitude and swath are in metres.
 *
 * @author hal.hildebrand
 */
public record ImagingDevice(String identifier, String mission, int missionNumber, String instrument, String orbit,
                            double altitude, Duration temporalResolution, List<ImagingDeviceBand> bands) {

    public ImagingDevice {
        if (mission == null) {
            throw new NullArgumentException("mission");
        }
        if (instrument == null) {
            throw new NullArgumentException("instrument");
        }
        if (mission.isBlank()) {
            throw new IllegalArgumentException("The mission is blank");
        }
        if (instrument.isBlank()) {
            throw new IllegalArgumentException("The instrument is blank");
        }
        if (bands == null) {
            throw new NullArgumentException("bands");
        }
        bands = List.copyOf(bands);
    }

    public String name() {
        return missionNumber > 0 ? mission + missionNumber + " " + instrument : mission + " " + instrument;
    }

    public int numberOfBands() {
        return bands.size();
    }

    public List<Integer> radiometricResolutions() {
        return bands.stream().map(ImagingDeviceBand::radiometricResolution).toList();
    }

    public List<SpectralRange> spectralRanges() {
        return bands.stream().map(ImagingDeviceBand::spectralRange).toList();
    }
}
