package com.rcasentinel.core.analysis;

import com.rcasentinel.core.SyntheticMetrics;
import com.rcasentinel.core.config.AnalysisConfig;
import com.rcasentinel.core.config.RcaSettings;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.RootCauseCandidate;
import com.rcasentinel.core.model.TimeRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RcaCoordinator}, end to end over synthetic metrics.
 */
class RcaCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private RcaCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    // ---------------------------------------------------------------
    // Analysis
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should reject an empty metric map")
    void shouldRejectEmptyInput() {
        coordinator = newCoordinator(null);

        assertThatThrownBy(() -> coordinator.analyze(Map.of()))
                .isInstanceOf(NoDataException.class)
                .hasMessageContaining("No metric data");
    }

    @Test
    @DisplayName("Should reject a metric key that differs from its series name")
    void shouldRejectMismatchedMetricKey() {
        coordinator = newCoordinator(null);
        Map<String, MetricSeries> metrics = Map.of(
                "cpu", SyntheticMetrics.series("x", SyntheticMetrics.injectedAnomalies(42)));

        assertThatThrownBy(() -> coordinator.analyze(metrics))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'cpu'")
                .hasMessageContaining("'x'");
    }

    @Test
    @DisplayName("Should rank correlated anomalous metrics and fill every section")
    void shouldAnalyzeCorrelatedMetrics() {
        coordinator = newCoordinator(null);

        AnalysisResult result = coordinator.analyze(correlatedMetrics());

        assertThat(result.getAnomalies()).containsOnlyKeys("cpu_usage", "memory_usage");
        assertThat(result.getAnomalies().get("cpu_usage").getCount()).isEqualTo(7);
        assertThat(result.getCorrelations()).containsOnlyKeys("cpu_usage", "memory_usage");
        assertThat(result.getCandidates()).extracting(RootCauseCandidate::getMetric)
                .containsExactly("cpu_usage", "memory_usage");
        RootCauseCandidate top = result.getCandidates().get(0);
        assertThat(top.getConfidence()).isEqualTo(1.0);
        assertThat(top.getRelatedMetrics()).singleElement()
                .satisfies(e -> assertThat(e.getMetricB()).isEqualTo("memory_usage"));

        assertThat(result.getStatistics().getTotalMetrics()).isEqualTo(2);
        assertThat(result.getStatistics().getAnomalousMetrics()).isEqualTo(2);
        assertThat(result.getStatistics().getCorrelationPairs()).isEqualTo(1);
        assertThat(result.getStatistics().getAnalysisDurationSeconds()).isNotNegative();
        assertThat(result.getMetricsAnalyzed()).containsExactly("cpu_usage", "memory_usage");
        assertThat(result.getAnalysisTime()).isEqualTo(NOW);
        assertThat(result.getTimeRange().getStart()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(result.getTimeRange().getEnd()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L + 99 * 60));
        assertThat(result.getSummary()).startsWith("Detected anomalies in 2 candidate metric(s)")
                .contains("Most likely root cause: cpu_usage");
        assertThat(result.getIncidentAnalysis()).isNull();
    }

    @Test
    @DisplayName("Should rank the spiking metric first and ignore a flat disk metric")
    void shouldRankCpuFirstWithFlatDisk() {
        coordinator = newCoordinator(null);
        // fixed seed: on some noise draws mem also caps at 1.0 with one more flag and ranks first
        double[] cpu = SyntheticMetrics.injectedAnomalies(42);

        AnalysisResult result = coordinator.analyze(Map.of(
                "cpu", SyntheticMetrics.series("cpu", cpu),
                "mem", SyntheticMetrics.series("mem", SyntheticMetrics.scaledWithNoise(cpu, 1042, 2.0)),
                "disk", SyntheticMetrics.series("disk", SyntheticMetrics.constant(100, 40.0))));

        assertThat(result.getAnomalies()).containsKey("cpu").doesNotContainKey("disk");
        assertThat(result.getCorrelations().get("cpu"))
                .anySatisfy(e -> {
                    assertThat(e.getMetricB()).isEqualTo("mem");
                    assertThat(e.getCoefficient()).isGreaterThanOrEqualTo(0.7);
                });
        assertThat(result.getCorrelations()).doesNotContainKey("disk");
        assertThat(result.getCandidates().get(0).getMetric()).isEqualTo("cpu");
        assertThat(result.getCandidates()).allSatisfy(c -> assertThat(c.getConfidence()).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("Should produce the same findings for the same input")
    void shouldBeDeterministic() {
        coordinator = newCoordinator(null);
        Map<String, MetricSeries> metrics = correlatedMetrics();

        AnalysisResult first = coordinator.analyze(metrics);
        AnalysisResult second = coordinator.analyze(metrics);

        assertThat(second.getAnomalies()).isEqualTo(first.getAnomalies());
        assertThat(second.getCorrelations()).isEqualTo(first.getCorrelations());
        assertThat(second.getCausalRelationships()).isEqualTo(first.getCausalRelationships());
        assertThat(second.getCandidates()).isEqualTo(first.getCandidates());
        assertThat(second.getSummary()).isEqualTo(first.getSummary());
    }

    @Test
    @DisplayName("Should report the requested time range when one is given")
    void shouldKeepRequestedTimeRange() {
        coordinator = newCoordinator(null);
        TimeRange requested = TimeRange.of(NOW.minusSeconds(3600), NOW);

        AnalysisResult result = coordinator.analyze(correlatedMetrics(), requested);

        assertThat(result.getTimeRange()).isEqualTo(requested);
    }

    @Test
    @DisplayName("Should report no anomalies with the threshold at one")
    void shouldFindNothingAtMaximumThreshold() {
        AnalysisConfig config = new AnalysisConfig();
        config.setAnomalyThreshold(1.0);
        coordinator = RcaCoordinator.builder().config(config).clock(Clock.fixed(NOW, ZoneOffset.UTC)).build();

        AnalysisResult result = coordinator.analyze(correlatedMetrics());

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getCandidates()).isEmpty();
        assertThat(result.getSummary()).isEqualTo(FallbackSummary.NO_ANOMALY_PATTERN);
        assertThat(result.getStatistics().getAnomalousMetrics()).isZero();
    }

    @Test
    @DisplayName("Should apply threshold updates to later runs")
    void shouldPickUpThresholdUpdates() {
        coordinator = newCoordinator(null);
        Map<String, MetricSeries> metrics = correlatedMetrics();
        assertThat(coordinator.analyze(metrics).getAnomalies()).isNotEmpty();

        coordinator.getConfig().setAnomalyThreshold(1.0);

        assertThat(coordinator.analyze(metrics).getAnomalies()).isEmpty();
    }

    @Test
    @DisplayName("Should skip metrics that are too short without failing the run")
    void shouldToleratePoorMetrics() {
        coordinator = newCoordinator(null);

        AnalysisResult result = coordinator.analyze(Map.of(
                "short", SyntheticMetrics.series("short", new double[] {1, 2, 3}),
                "flat", SyntheticMetrics.series("flat", SyntheticMetrics.constant(50, 2.0))));

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getCorrelations()).isEmpty();
        assertThat(result.getMetricsAnalyzed()).containsExactly("flat", "short");
        assertThat(result.getStatistics().getTotalMetrics()).isEqualTo(2);
    }

    // ---------------------------------------------------------------
    // Summarizer
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should use the summarizer's text when it answers in time")
    void shouldUseSummarizerText() {
        coordinator = newCoordinator((anomalies, correlations, candidates) ->
                "CPU saturation on " + candidates.get(0).getMetric());

        assertThat(coordinator.analyze(correlatedMetrics()).getSummary())
                .isEqualTo("CPU saturation on cpu_usage");
    }

    @Test
    @DisplayName("Should fall back when the summarizer throws")
    void shouldFallBackOnFailure() {
        coordinator = newCoordinator((anomalies, correlations, candidates) -> {
            throw new IllegalStateException("model unavailable");
        });

        assertThat(coordinator.analyze(correlatedMetrics()).getSummary())
                .startsWith("Detected anomalies in 2 candidate metric(s)");
    }

    @Test
    @DisplayName("Should fall back when the summarizer times out")
    void shouldFallBackOnTimeout() {
        coordinator = newCoordinator((anomalies, correlations, candidates) -> {
            Thread.sleep(10_000);
            return "too late";
        });

        assertThat(coordinator.analyze(correlatedMetrics()).getSummary())
                .startsWith("Detected anomalies in 2 candidate metric(s)");
    }

    @Test
    @DisplayName("Should fall back when the summarizer returns blank text")
    void shouldFallBackOnBlankText() {
        coordinator = newCoordinator((anomalies, correlations, candidates) -> "   ");

        assertThat(coordinator.analyze(correlatedMetrics()).getSummary())
                .startsWith("Detected anomalies in 2 candidate metric(s)");
    }

    @Test
    @DisplayName("Should NOT call the summarizer when there are no candidates")
    void shouldNotSummarizeWithoutCandidates() {
        AtomicBoolean called = new AtomicBoolean();
        coordinator = newCoordinator((anomalies, correlations, candidates) -> {
            called.set(true);
            return "unexpected";
        });

        AnalysisResult result = coordinator.analyze(Map.of(
                "flat", SyntheticMetrics.series("flat", SyntheticMetrics.constant(50, 2.0))));

        assertThat(called).isFalse();
        assertThat(result.getSummary()).isEqualTo(FallbackSummary.NO_ANOMALY_PATTERN);
    }

    // ---------------------------------------------------------------
    // Incidents
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should attach an incident section for reported symptoms")
    void shouldAnalyzeIncident() {
        coordinator = newCoordinator(null);

        AnalysisResult result = coordinator.analyzeIncident(correlatedMetrics(),
                List.of("checkout"), List.of("High CPU on checkout pods"));

        assertThat(result.getIncidentAnalysis()).isNotNull();
        assertThat(result.getIncidentAnalysis().getAffectedServices()).containsExactly("checkout");
        assertThat(result.getIncidentAnalysis().getRelevantMetrics())
                .contains("cpu_usage", "container_cpu_usage_seconds_total", "node_cpu_seconds_total");
        assertThat(result.getIncidentAnalysis().getRecommendation())
                .startsWith("Check CPU usage")
                .contains("Root-cause confidence is high (1.00)");
        assertThat(result.getCandidates()).isNotEmpty();
    }

    @Test
    @DisplayName("Should require services and symptoms for an incident")
    void shouldValidateIncidentInput() {
        coordinator = newCoordinator(null);
        Map<String, MetricSeries> metrics = correlatedMetrics();

        assertThatThrownBy(() -> coordinator.analyzeIncident(metrics, List.of(), List.of("slow")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("affected service");
        assertThatThrownBy(() -> coordinator.analyzeIncident(metrics, List.of("checkout"), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("symptom");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RcaCoordinator newCoordinator(Summarizer summarizer) {
        RcaSettings settings = new RcaSettings();
        settings.setWorkerThreads(2);
        settings.setSummaryTimeoutMillis(300);
        settings.setDefaultMetrics(List.of("cpu_usage", "memory_usage"));
        return RcaCoordinator.builder()
                .settings(settings)
                .summarizer(summarizer)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private static Map<String, MetricSeries> correlatedMetrics() {
        double[] cpu = SyntheticMetrics.injectedAnomalies(42);
        double[] memory = SyntheticMetrics.scaledWithNoise(cpu, 1042, 2.0);
        return Map.of(
                "cpu_usage", SyntheticMetrics.series("cpu_usage", cpu),
                "memory_usage", SyntheticMetrics.series("memory_usage", memory));
    }
}
