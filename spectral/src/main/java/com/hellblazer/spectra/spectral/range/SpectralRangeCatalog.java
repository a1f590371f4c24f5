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
package com.hellblazer.spectra.spectral.range;

import com.hellblazer.spectra.spectral.exceptions.NullArgumentException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.hellblazer.spectra.spectral.range.SpectralDomain.*;

/**
 * Read only table of the named spectral ranges. Ranges overlap: {@link SpectralDomain#VISIBLE} spans violet through
 * red and {@link SpectralDomain#INFRARED} spans near through far infrared.
 * <p>
 * Ranges are built on first use and cached for the life of the process. Every lookup of a name returns the same
 * instance, from any thread.
 *
 * @author hal.hildebrand
 */
public final class SpectralRangeCatalog {

    private static final Map<SpectralDomain, double[]>                    BOUNDS;
    private static final ConcurrentHashMap<SpectralDomain, SpectralRange> CACHE = new ConcurrentHashMap<>();

    static {
        var bounds = new EnumMap<SpectralDomain, double[]>(SpectralDomain.class);
        bounds.put(ULTRAVIOLET, new double[] { 10e-9, 400e-9 });
        bounds.put(VIOLET, new double[] { 380e-9, 450e-9 });
        bounds.put(BLUE, new double[] { 450e-9, 495e-9 });
        bounds.put(GREEN, new double[] { 495e-9, 570e-9 });
        bounds.put(YELLOW, new double[] { 570e-9, 590e-9 });
        bounds.put(ORANGE, new double[] { 590e-9, 620e-9 });
        bounds.put(RED, new double[] { 620e-9, 750e-9 });
        bounds.put(VISIBLE, new double[] { 380e-9, 750e-9 });
        bounds.put(NEAR_INFRARED, new double[] { 750e-9, 1.4e-6 });
        bounds.put(SHORT_WAVELENGTH_INFRARED, new double[] { 1.4e-6, 3e-6 });
        bounds.put(MIDDLE_WAVELENGTH_INFRARED, new double[] { 3e-6, 8e-6 });
        bounds.put(LONG_WAVELENGTH_INFRARED, new double[] { 8e-6, 15e-6 });
        bounds.put(FAR_INFRARED, new double[] { 15e-6, 1e-3 });
        bounds.put(INFRARED, new double[] { 750e-9, 1e-3 });
        BOUNDS = Collections.unmodifiableMap(bounds);
    }

    private SpectralRangeCatalog() {
    }

    /**
     * The range of a named spectral domain
     *
     * @throws IllegalArgumentException for {@link SpectralDomain#UNDEFINED}
     */
    public static SpectralRange rangeOf(SpectralDomain domain) {
        if (domain == null) {
            throw new NullArgumentException("domain");
        }
        var bounds = BOUNDS.get(domain);
        if (bounds == null) {
            throw new IllegalArgumentException("No spectral range is defined for " + domain);
        }
        return CACHE.computeIfAbsent(domain, d -> new SpectralRange(bounds[0], bounds[1]));
    }

    /**
     * The range of a domain given by name. Case, underscores, hyphens and spaces are ignored, so "NearInfrared",
     * "near-infrared" and "NEAR_INFRARED" all name the same range.
     */
    public static SpectralRange rangeOf(String name) {
        return rangeOf(domainOf(name));
    }

    public static SpectralDomain domainOf(String name) {
        if (name == null) {
            throw new NullArgumentException("name");
        }
        var key = normalize(name);
        for (var domain : BOUNDS.keySet()) {
            if (normalize(domain.name()).equals(key)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown spectral range: " + name);
    }

    /**
     * Every domain whose range contains the wavelength; empty when none does
     */
    public static EnumSet<SpectralDomain> classify(double wavelength) {
        var domains = EnumSet.noneOf(SpectralDomain.class);
        for (var domain : BOUNDS.keySet()) {
            if (rangeOf(domain).contains(wavelength)) {
                domains.add(domain);
            }
        }
        return domains;
    }

    /**
     * The domains with a catalog range
     */
    public static EnumSet<SpectralDomain> domains() {
        return EnumSet.copyOf(BOUNDS.keySet());
    }

    public static SpectralRange ultraviolet() {
        return rangeOf(ULTRAVIOLET);
    }

    public static SpectralRange violet() {
        return rangeOf(VIOLET);
    }

    public static SpectralRange blue() {
        return rangeOf(BLUE);
    }

    public static SpectralRange green() {
        return rangeOf(GREEN);
    }

    public static SpectralRange yellow() {
        return rangeOf(YELLOW);
    }

    public static SpectralRange orange() {
        return rangeOf(ORANGE);
    }

    public static SpectralRange red() {
        return rangeOf(RED);
    }

    public static SpectralRange visible() {
        return rangeOf(VISIBLE);
    }

    public static SpectralRange nearInfrared() {
        return rangeOf(NEAR_INFRARED);
    }

    public static SpectralRange shortWavelengthInfrared() {
        return rangeOf(SHORT_WAVELENGTH_INFRARED);
    }

    public static SpectralRange middleWavelengthInfrared() {
        return rangeOf(MIDDLE_WAVELENGTH_INFRARED);
    }

    public static SpectralRange longWavelengthInfrared() {
        return rangeOf(LONG_WAVELENGTH_INFRARED);
    }

    public static SpectralRange farInfrared() {
        return rangeOf(FAR_INFRARED);
    }

    public static SpectralRange infrared() {
        return rangeOf(INFRARED);
    }

    private static String normalize(String name) {
        return name.replaceAll("[_\\-\\s]", "").toLowerCase(Locale.ROOT);
    }
}
