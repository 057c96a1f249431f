package com.rcasentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StationarityDetector}.
 */
class StationarityDetectorTest {

    private final StationarityDetector detector = new StationarityDetector();

    @Test
    @DisplayName("Should give a random walk the maximum score on every sample")
    void shouldScoreRandomWalkHigh() {
        Random random = new Random(5);
        double[] walk = new double[200];
        for (int i = 1; i < walk.length; i++) {
            walk[i] = walk[i - 1] + random.nextGaussian();
        }

        double[] scores = detector.score(walk);

        assertThat(scores).hasSize(200).containsOnly(1.0);
    }

    @Test
    @DisplayName("Should give white noise a near-zero score")
    void shouldScoreWhiteNoiseLow() {
        Random random = new Random(5);
        double[] noise = new double[200];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = random.nextGaussian();
        }

        double[] scores = detector.score(noise);

        assertThat(scores[0]).isLessThan(0.02);
        assertThat(scores).containsOnly(scores[0]);
    }

    @Test
    @DisplayName("Should score short and constant series as zero")
    void shouldSkipDegenerateSeries() {
        assertThat(detector.score(new double[] {1, 2, 3, 4, 5})).containsOnly(0.0);
        assertThat(detector.score(new double[] {3, 3, 3, 3, 3, 3, 3, 3, 3, 3, 3, 3})).containsOnly(0.0);
    }
}
