package com.rcasentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the JSON shape of {@link AnalysisResult}.
 */
class AnalysisResultJsonTest {

    private static final Instant T0 = Instant.parse("2023-11-14T22:13:20Z");

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    @DisplayName("Should serialize with snake_case keys and lowercase enums")
    void shouldSerializeSnakeCase() throws Exception {
        JsonNode json = mapper.valueToTree(sampleResult(null));

        assertThat(json.fieldNames()).toIterable().containsExactly(
                "anomalies", "correlations", "causal_relationships", "root_cause_candidates",
                "summary", "statistics", "time_range", "metrics_analyzed", "analysis_time");

        JsonNode report = json.get("anomalies").get("cpu");
        assertThat(report.get("severity").asText()).isEqualTo("high");
        assertThat(report.get("first_occurrence").asText()).isEqualTo("2023-11-14T22:13:20Z");
        assertThat(report.get("detection_methods").get("zscore").asInt()).isEqualTo(1);
        assertThat(report.get("detection_methods").get("stationarity").asDouble()).isEqualTo(0.25);

        JsonNode edge = json.get("correlations").get("cpu").get(0);
        assertThat(edge.get("related_metric").asText()).isEqualTo("mem");
        assertThat(edge.get("coefficient").asDouble()).isEqualTo(0.95);
        assertThat(edge.get("method").asText()).isEqualTo("pearson");
        assertThat(edge.has("metric_a")).isFalse();

        assertThat(json.get("root_cause_candidates").get(0).get("anomaly_count").asInt()).isEqualTo(1);
        assertThat(json.get("statistics").get("correlation_pairs").asInt()).isEqualTo(1);
        assertThat(json.get("time_range").get("start").asText()).isEqualTo("2023-11-14T22:13:20Z");
    }

    @Test
    @DisplayName("Should include the incident section only when present")
    void shouldIncludeIncidentSection() {
        IncidentAnalysis incident = new IncidentAnalysis(List.of("checkout"), List.of("slow responses"),
                List.of("cpu"), "Scale out");

        JsonNode json = mapper.valueToTree(sampleResult(incident));

        assertThat(json.get("incident_analysis").get("affected_services").get(0).asText())
                .isEqualTo("checkout");
        assertThat(json.get("incident_analysis").get("recommendation").asText()).isEqualTo("Scale out");
    }

    @Test
    @DisplayName("Should round-trip equality through toBuilder")
    void shouldCopyThroughToBuilder() {
        AnalysisResult result = sampleResult(null);

        assertThat(result.toBuilder().build()).isEqualTo(result);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnalysisResult sampleResult(IncidentAnalysis incident) {
        AnomalyReport report = AnomalyReport.builder("cpu")
                .flaggedPoint(T0, 0.9)
                .methodCount(DetectionMethod.ZSCORE, 1)
                .stationarityScore(0.25)
                .build();
        CorrelationEdge edge = CorrelationEdge.pearson("cpu", "mem", 0.95);
        RootCauseCandidate candidate = RootCauseCandidate.builder()
                .metric("cpu")
                .confidence(0.9)
                .anomalyCount(1)
                .firstOccurrence(T0)
                .relatedMetrics(List.of(edge))
                .description("cpu spike")
                .build();
        return AnalysisResult.builder()
                .anomalies(Map.of("cpu", report))
                .correlations(Map.of("cpu", List.of(edge),
                        "mem", List.of(CorrelationEdge.pearson("mem", "cpu", 0.95))))
                .candidates(List.of(candidate))
                .summary("cpu spike")
                .statistics(new AnalysisStatistics(2, 1, 1, 0.01))
                .timeRange(TimeRange.of(T0, T0.plusSeconds(60)))
                .metricsAnalyzed(List.of("cpu", "mem"))
                .analysisTime(T0.plusSeconds(120))
                .incidentAnalysis(incident)
                .build();
    }
}
