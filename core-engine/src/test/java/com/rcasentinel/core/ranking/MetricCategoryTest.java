package com.rcasentinel.core.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricCategory}.
 */
class MetricCategoryTest {

    @ParameterizedTest
    @CsvSource({
            "container_cpu_usage_seconds_total, CPU",
            "node_cpu_seconds_total, CPU",
            "container_memory_working_set_bytes, MEMORY",
            "kube_pod_container_status_restarts_total, RESTART",
            "kubelet_http_requests_duration_seconds_sum, NETWORK",
            "Network_IO, NETWORK",
            "disk_io, DISK",
            "node_load1, NODE",
            "pod_phase, POD",
            "queue_depth, GENERIC"
    })
    @DisplayName("Should infer the category from the first matching keyword")
    void shouldInferCategory(String metric, MetricCategory expected) {
        assertThat(MetricCategory.of(metric)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should describe uncategorized metrics by name")
    void shouldDescribeGenericMetric() {
        assertThat(MetricCategory.GENERIC.describe("queue_depth", 3, 0.912, 0.7))
                .isEqualTo("Metric queue_depth anomaly: 3 anomalous points detected, "
                        + "max anomaly score 0.91, average anomaly score 0.70");
    }

    @Test
    @DisplayName("Should offer recommendations only for actionable categories")
    void shouldExposeRecommendations() {
        assertThat(MetricCategory.CPU.recommendation()).hasValueSatisfying(
                text -> assertThat(text).startsWith("Check CPU usage"));
        assertThat(MetricCategory.NETWORK.recommendation()).isPresent();
        assertThat(MetricCategory.DISK.recommendation()).isEmpty();
        assertThat(MetricCategory.GENERIC.recommendation()).isEmpty();
    }
}
