package com.rcasentinel.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AdfTest}.
 */
class AdfTestTest {

    @Test
    @DisplayName("Should reject a stationary white-noise series")
    void shouldRejectUnitRootForWhiteNoise() {
        Random random = new Random(5);
        double[] noise = new double[200];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = random.nextGaussian();
        }

        AdfTest test = AdfTest.run(noise);

        assertThat(test.getStatistic()).isLessThan(-5.0);
        assertThat(test.getPValue()).isLessThan(0.01);
        assertThat(test.getObservations()).isLessThanOrEqualTo(199);
    }

    @Test
    @DisplayName("Should not reject a unit root for a random walk")
    void shouldKeepUnitRootForRandomWalk() {
        Random random = new Random(5);
        double[] walk = new double[200];
        for (int i = 1; i < walk.length; i++) {
            walk[i] = walk[i - 1] + random.nextGaussian();
        }

        AdfTest test = AdfTest.run(walk);

        assertThat(test.getPValue()).isGreaterThan(0.5);
        assertThat(test.getUsedLag()).isBetween(0, 14);
    }

    @Test
    @DisplayName("Should match MacKinnon critical values for the constant-only model")
    void shouldApproximateCriticalValues() {
        assertThat(AdfTest.mackinnonPValue(-3.43)).isCloseTo(0.01, within(0.001));
        assertThat(AdfTest.mackinnonPValue(-2.86)).isCloseTo(0.05, within(0.001));
        assertThat(AdfTest.mackinnonPValue(-2.57)).isCloseTo(0.10, within(0.002));
        assertThat(AdfTest.mackinnonPValue(3.0)).isEqualTo(1.0);
        assertThat(AdfTest.mackinnonPValue(-20.0)).isZero();
    }

    @Test
    @DisplayName("Should be continuous where the two polynomial regimes meet")
    void shouldBeContinuousAtRegimeBoundary() {
        assertThat(AdfTest.mackinnonPValue(-1.6100001))
                .isCloseTo(AdfTest.mackinnonPValue(-1.6099999), within(1e-3));
    }

    @Test
    @DisplayName("Should require a minimum number of observations")
    void shouldRejectShortSeries() {
        assertThatThrownBy(() -> AdfTest.run(new double[] {1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 10");
    }
}
