package com.sedmap.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.sedmap.model.Measurement;
import org.junit.jupiter.api.Test;

class PhotometricConversionsTest {

    @Test
    void magnitudeOfZeropointFlux() {
        Measurement m = PhotometricConversions.fluxToMagnitude(1, 0.1, 25);
        assertThat(m.value).isEqualTo(25);
        assertThat(m.sigma).isCloseTo(0.108, within(1e-12));

        m = PhotometricConversions.fluxToMagnitude(100, 10, 25);
        assertThat(m.value).isCloseTo(20, within(1e-12));
        assertThat(m.sigma).isCloseTo(0.108, within(1e-12));
    }

    @Test
    void magnitudeNeedsPositiveFlux() {
        assertThatThrownBy(() -> PhotometricConversions.fluxToMagnitude(0, 1, 25))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PhotometricConversions.fluxToMagnitude(-3, 1, 25))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void magnitudeAndFluxAreInverse() {
        Measurement m = PhotometricConversions.fluxToMagnitude(37.5, 2.5, 23.9);
        Measurement f = PhotometricConversions.magnitudeToFlux(m.value, m.sigma, 23.9);
        assertThat(f.value).isCloseTo(37.5, within(1e-9));
        assertThat(f.sigma).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void microJanskyZeropoint() {
        // zpt 23.9 means one count is one micro Jansky
        Measurement f = PhotometricConversions.countToPhysicalFluxDensity(1000, 10, 23.9);
        assertThat(PhotometricConversions.cgsToMilliJansky(f.value)).isCloseTo(1, within(1e-9));
        assertThat(PhotometricConversions.cgsToMilliJansky(f.sigma)).isCloseTo(0.01, within(1e-12));

        Measurement back = PhotometricConversions.physicalFluxDensityToCount(f.value, f.sigma, 23.9);
        assertThat(back.value).isCloseTo(1000, within(1e-9));
        assertThat(PhotometricConversions.milliJanskyToCgs(1)).isEqualTo(1e-26);
    }

    @Test
    void arrayVersionsMatchScalarOnes() {
        double[] v = {1, 10, 1000};
        double[] s = {0.5, 1, 3};
        PhotometricConversions.fluxToMagnitude(v, s, 30);
        Measurement m = PhotometricConversions.fluxToMagnitude(10, 1, 30);
        assertThat(v[1]).isEqualTo(m.value);
        assertThat(s[1]).isEqualTo(m.sigma);

        double[] w = {2, 4};
        double[] e = {1, 1};
        PhotometricConversions.countToPhysicalFluxDensity(w, e, 25);
        assertThat(w[1]).isEqualTo(PhotometricConversions.countToPhysicalFluxDensity(4, 1, 25).value);
    }
}
