package com.hellblazer.spectra.spectral.range;

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpectralRangeCatalog Property-Based Tests")
class SpectralRangeCatalogPropertyTest {

    @Property
    @Label("Repeated lookups are value equal")
    void lookupIsIdempotent(@ForAll("domains") SpectralDomain domain) {
        var first = SpectralRangeCatalog.rangeOf(domain);
        var second = SpectralRangeCatalog.rangeOf(domain);

        assertEquals(first, second);
        assertEquals(first, SpectralRangeCatalog.rangeOf(domain.name().toLowerCase()));
    }

    @Property
    @Label("Classification agrees with containment")
    void classificationAgreesWithContainment(@ForAll @DoubleRange(min = 1e-9, max = 2e-3) double wavelength) {
        var classes = SpectralRangeCatalog.classify(wavelength);

        for (var domain : SpectralRangeCatalog.domains()) {
            assertEquals(SpectralRangeCatalog.rangeOf(domain).contains(wavelength), classes.contains(domain));
        }
    }

    @Property
    @Label("Visible wavelengths classify as visible and one color")
    void visibleWavelengthsHaveAColor(@ForAll @DoubleRange(min = 380e-9, max = 750e-9) double wavelength) {
        var classes = SpectralRangeCatalog.classify(wavelength);

        assertTrue(classes.contains(SpectralDomain.VISIBLE));
        assertTrue(classes.stream()
                          .anyMatch(d -> d == SpectralDomain.VIOLET || d == SpectralDomain.BLUE
                                         || d == SpectralDomain.GREEN || d == SpectralDomain.YELLOW
                                         || d == SpectralDomain.ORANGE || d == SpectralDomain.RED));
    }

    @Provide
    Arbitrary<SpectralDomain> domains() {
        return Arbitraries.of(SpectralRangeCatalog.domains());
    }
}
