package com.rcasentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfig} and {@link Thresholds}.
 */
class AnalysisConfigTest {

    @Test
    @DisplayName("Should start from the default thresholds")
    void shouldStartWithDefaults() {
        AnalysisConfig config = new AnalysisConfig();

        assertThat(config.getAnomalyThreshold()).isEqualTo(0.65);
        assertThat(config.getCorrelationThreshold()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Should seed thresholds from settings")
    void shouldSeedFromSettings() {
        RcaSettings settings = new RcaSettings();
        settings.setAnomalyThreshold(0.4);
        settings.setCorrelationThreshold(0.9);

        AnalysisConfig config = AnalysisConfig.from(settings);

        assertThat(config.snapshot()).isEqualTo(new Thresholds(0.4, 0.9));
    }

    @Test
    @DisplayName("Should accept the upper bound of the unit interval")
    void shouldAcceptOne() {
        AnalysisConfig config = new AnalysisConfig();

        config.setAnomalyThreshold(1.0);
        config.setCorrelationThreshold(1.0);

        assertThat(config.snapshot()).isEqualTo(new Thresholds(1.0, 1.0));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.1, 1.01, Double.NaN})
    @DisplayName("Should reject out-of-range thresholds and keep the active value")
    void shouldRejectOutOfRange(double value) {
        AnalysisConfig config = new AnalysisConfig();

        assertThatThrownBy(() -> config.setAnomalyThreshold(value))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("anomaly_threshold must be in (0, 1]");
        assertThatThrownBy(() -> config.setCorrelationThreshold(value))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("correlation_threshold");

        assertThat(config.snapshot()).isEqualTo(Thresholds.defaults());
    }

    @Test
    @DisplayName("Should not let later updates change an earlier snapshot")
    void shouldKeepSnapshotsImmutable() {
        AnalysisConfig config = new AnalysisConfig();
        Thresholds before = config.snapshot();

        config.setAnomalyThreshold(0.9);

        assertThat(before.getAnomalyThreshold()).isEqualTo(0.65);
        assertThat(config.snapshot().getAnomalyThreshold()).isEqualTo(0.9);
        assertThat(config.snapshot().getCorrelationThreshold()).isEqualTo(0.7);
    }

    @Test
    @Timeout(30)
    @DisplayName("Should keep both concurrent writers' updates and never move a threshold backwards")
    void shouldNotTearUnderConcurrentUpdates() throws Exception {
        AnalysisConfig config = new AnalysisConfig(new Thresholds(0.001, 0.001));
        int updates = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        List<Thresholds> observed = new ArrayList<>();
        try {
            Future<?> anomalyWriter = pool.submit(() -> {
                start.await();
                for (int i = 1; i <= updates; i++) {
                    config.setAnomalyThreshold(i / (double) updates);
                }
                return null;
            });
            Future<?> correlationWriter = pool.submit(() -> {
                start.await();
                for (int i = 1; i <= updates; i++) {
                    config.setCorrelationThreshold(i / (double) updates);
                }
                return null;
            });
            Future<?> reader = pool.submit(() -> {
                start.await();
                while (!anomalyWriter.isDone() || !correlationWriter.isDone()) {
                    observed.add(config.snapshot());
                }
                return null;
            });

            start.countDown();
            anomalyWriter.get(20, TimeUnit.SECONDS);
            correlationWriter.get(20, TimeUnit.SECONDS);
            reader.get(20, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        for (int i = 1; i < observed.size(); i++) {
            Thresholds previous = observed.get(i - 1);
            Thresholds current = observed.get(i);
            assertThat(current.getAnomalyThreshold()).isGreaterThanOrEqualTo(previous.getAnomalyThreshold());
            assertThat(current.getCorrelationThreshold()).isGreaterThanOrEqualTo(previous.getCorrelationThreshold());
        }
        assertThat(config.snapshot()).isEqualTo(new Thresholds(1.0, 1.0));
    }
}
