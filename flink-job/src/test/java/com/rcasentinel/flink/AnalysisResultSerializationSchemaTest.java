package com.rcasentinel.flink;

import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.AnalysisStatistics;
import com.rcasentinel.core.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalysisResultSerializationSchema}.
 */
class AnalysisResultSerializationSchemaTest {

    @Test
    @DisplayName("Should write snake_case fields and ISO-8601 instants")
    void shouldWriteJson() {
        AnalysisResult result = AnalysisResult.builder()
                .summary("No significant anomaly pattern detected.")
                .statistics(new AnalysisStatistics(1, 0, 0, 0.25))
                .timeRange(TimeRange.of(Instant.parse("2024-01-01T00:00:00Z"),
                        Instant.parse("2024-01-01T00:30:00Z")))
                .metricsAnalyzed(List.of("cpu_usage"))
                .analysisTime(Instant.parse("2024-01-01T00:31:00Z"))
                .build();

        String json = new String(new AnalysisResultSerializationSchema().serialize(result), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"root_cause_candidates\":[]")
                .contains("\"metrics_analyzed\":[\"cpu_usage\"]")
                .contains("\"total_metrics\":1")
                .contains("\"start\":\"2024-01-01T00:00:00Z\"")
                .contains("\"end\":\"2024-01-01T00:30:00Z\"");
    }
}
