package com.rcasentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MovingAverageDetector}.
 */
class MovingAverageDetectorTest {

    private final MovingAverageDetector detector = new MovingAverageDetector();

    @Test
    @DisplayName("Should NOT evaluate the first value")
    void shouldNotFlagFirstValue() {
        double[] scores = detector.score(new double[] {1000, 10, 11, 10, 11});

        assertThat(scores[0]).isZero();
    }

    @Test
    @DisplayName("Should flag the spike and keep it out of the baseline")
    void shouldFlagSpike() {
        assertThat(detector.score(DetectorFixtures.spikeSeries()))
                .containsExactly(DetectorFixtures.flagsAt(30, DetectorFixtures.SPIKE_INDEX));
    }

    @Test
    @DisplayName("Should fall back to the global spread when the baseline is constant")
    void shouldUseGlobalSpreadForConstantBaseline() {
        double[] values = {10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10.5};

        assertThat(detector.score(values)).containsExactly(DetectorFixtures.flagsAt(11, 10));
    }

    @Test
    @DisplayName("Should adopt a new level after a full window of same-side deviations")
    void shouldAdoptLevelShift() {
        Random random = new Random(3);
        double[] values = new double[60];
        for (int i = 0; i < 30; i++) {
            values[i] = 50 + random.nextGaussian();
        }
        for (int i = 30; i < 60; i++) {
            values[i] = 80 + random.nextGaussian();
        }

        double[] scores = detector.score(values);

        int[] flagged = IntStream.range(0, scores.length).filter(i -> scores[i] > 0).toArray();
        assertThat(flagged).containsExactly(30, 31, 32, 33, 34, 35, 36, 37, 38, 39);
    }

    @Test
    @DisplayName("Should NOT flag anything in a constant series")
    void shouldSkipConstantSeries() {
        assertThat(detector.score(new double[] {7, 7, 7, 7, 7, 7})).containsOnly(0.0);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new MovingAverageDetector(1, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MovingAverageDetector(10, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
