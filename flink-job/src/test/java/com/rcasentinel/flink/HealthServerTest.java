package com.rcasentinel.flink;

import com.rcasentinel.core.config.AnalysisConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    @Test
    @DisplayName("Should report the current thresholds")
    void shouldReportThresholds() {
        AnalysisConfig config = new AnalysisConfig();
        HealthServer server = new HealthServer(config);

        assertThat(server.thresholdsBody())
                .isEqualTo("{\"anomaly_threshold\":0.65,\"correlation_threshold\":0.7}");

        config.setAnomalyThreshold(0.8);
        assertThat(server.thresholdsBody()).contains("\"anomaly_threshold\":0.8");
    }

    @Test
    @DisplayName("Should reject out-of-range ports without starting")
    void shouldRejectInvalidPort() {
        HealthServer server = new HealthServer(new AnalysisConfig());

        assertThatThrownBy(() -> server.start(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should tolerate stop before start")
    void shouldStopWhenNotStarted() {
        HealthServer server = new HealthServer(new AnalysisConfig());
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }
}
