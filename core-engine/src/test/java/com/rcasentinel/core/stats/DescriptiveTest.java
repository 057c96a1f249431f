package com.rcasentinel.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Descriptive}.
 */
class DescriptiveTest {

    private static final double[] SAMPLE = {2, 4, 4, 4, 5, 5, 7, 9};

    @Test
    @DisplayName("Should compute population and sample standard deviation")
    void shouldComputeStandardDeviations() {
        assertThat(Descriptive.mean(SAMPLE)).isEqualTo(5.0);
        assertThat(Descriptive.populationStd(SAMPLE)).isCloseTo(2.0, within(1e-12));
        assertThat(Descriptive.sampleStd(SAMPLE)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
    }

    @Test
    @DisplayName("Should interpolate percentiles linearly between order statistics")
    void shouldInterpolatePercentiles() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        assertThat(Descriptive.percentile(values, 25)).isCloseTo(3.25, within(1e-12));
        assertThat(Descriptive.percentile(values, 50)).isCloseTo(5.5, within(1e-12));
        assertThat(Descriptive.percentile(values, 75)).isCloseTo(7.75, within(1e-12));
    }

    @Test
    @DisplayName("Should ignore a single outlier when estimating robust scale")
    void shouldComputeRobustScale() {
        double[] values = {1, 2, 3, 4, 1000};

        // median 3, absolute deviations {2, 1, 0, 1, 997}, their median 1
        assertThat(Descriptive.robustScale(values)).isCloseTo(1.4826, within(1e-12));
    }

    @Test
    @DisplayName("Should standardize to zero mean and unit spread")
    void shouldStandardize() {
        double[] z = Descriptive.standardize(SAMPLE);

        assertThat(Descriptive.mean(z)).isCloseTo(0.0, within(1e-12));
        assertThat(Descriptive.populationStd(z)).isCloseTo(1.0, within(1e-12));
        assertThat(z[0]).isCloseTo(-1.5, within(1e-12));
    }

    @Test
    @DisplayName("Should refuse to standardize a constant sample")
    void shouldRejectConstantSample() {
        assertThat(Descriptive.isConstant(new double[] {3, 3, 3})).isTrue();
        assertThat(Descriptive.isConstant(new double[] {3, 3, 4})).isFalse();

        assertThatThrownBy(() -> Descriptive.standardize(new double[] {3, 3, 3}))
                .isInstanceOf(ArithmeticException.class);
    }
}
