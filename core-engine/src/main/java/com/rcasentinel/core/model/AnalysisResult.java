package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Complete outcome of one root-cause analysis run.
 *
 * <p>
 * Maps are sorted by metric name so that two runs over identical input
 * produce identical output. Candidates keep the ranker's order.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code summary}, {@code statistics} and
 * {@code analysisTime} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"anomalies", "correlations", "causal_relationships", "root_cause_candidates",
        "summary", "statistics", "time_range", "metrics_analyzed", "analysis_time", "incident_analysis"})
public final class AnalysisResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, AnomalyReport> anomalies;
    private final Map<String, List<CorrelationEdge>> correlations;
    private final Map<String, List<String>> causalRelationships;
    private final List<RootCauseCandidate> candidates;
    private final String summary;
    private final AnalysisStatistics statistics;
    private final TimeRange timeRange;
    private final List<String> metricsAnalyzed;
    private final Instant analysisTime;
    private final IncidentAnalysis incidentAnalysis;

    private AnalysisResult(Builder b) {
        this.anomalies = Collections.unmodifiableMap(new TreeMap<>(b.anomalies));
        this.correlations = Collections.unmodifiableMap(new TreeMap<>(b.correlations));
        this.causalRelationships = Collections.unmodifiableMap(new TreeMap<>(b.causalRelationships));
        this.candidates = Collections.unmodifiableList(new ArrayList<>(b.candidates));
        this.summary = Objects.requireNonNull(b.summary, "summary must not be null");
        this.statistics = Objects.requireNonNull(b.statistics, "statistics must not be null");
        this.timeRange = b.timeRange;
        this.metricsAnalyzed = Collections.unmodifiableList(new ArrayList<>(b.metricsAnalyzed));
        this.analysisTime = Objects.requireNonNull(b.analysisTime, "analysisTime must not be null");
        this.incidentAnalysis = b.incidentAnalysis;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this result
     */
    public Builder toBuilder() {
        return new Builder()
                .anomalies(anomalies)
                .correlations(correlations)
                .causalRelationships(causalRelationships)
                .candidates(candidates)
                .summary(summary)
                .statistics(statistics)
                .timeRange(timeRange)
                .metricsAnalyzed(metricsAnalyzed)
                .analysisTime(analysisTime)
                .incidentAnalysis(incidentAnalysis);
    }

    /**
     * Fluent builder for {@link AnalysisResult} instances.
     */
    public static final class Builder {
        private Map<String, AnomalyReport> anomalies = Map.of();
        private Map<String, List<CorrelationEdge>> correlations = Map.of();
        private Map<String, List<String>> causalRelationships = Map.of();
        private List<RootCauseCandidate> candidates = List.of();
        private String summary;
        private AnalysisStatistics statistics;
        private TimeRange timeRange;
        private List<String> metricsAnalyzed = List.of();
        private Instant analysisTime;
        private IncidentAnalysis incidentAnalysis;

        public Builder anomalies(Map<String, AnomalyReport> anomalies) {
            this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
            return this;
        }

        public Builder correlations(Map<String, List<CorrelationEdge>> correlations) {
            this.correlations = Objects.requireNonNull(correlations, "correlations must not be null");
            return this;
        }

        public Builder causalRelationships(Map<String, List<String>> causalRelationships) {
            this.causalRelationships = Objects.requireNonNull(causalRelationships,
                    "causalRelationships must not be null");
            return this;
        }

        public Builder candidates(List<RootCauseCandidate> candidates) {
            this.candidates = Objects.requireNonNull(candidates, "candidates must not be null");
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder statistics(AnalysisStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder metricsAnalyzed(List<String> metricsAnalyzed) {
            this.metricsAnalyzed = Objects.requireNonNull(metricsAnalyzed, "metricsAnalyzed must not be null");
            return this;
        }

        public Builder analysisTime(Instant analysisTime) {
            this.analysisTime = analysisTime;
            return this;
        }

        public Builder incidentAnalysis(IncidentAnalysis incidentAnalysis) {
            this.incidentAnalysis = incidentAnalysis;
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("anomalies")
    public Map<String, AnomalyReport> getAnomalies() {
        return anomalies;
    }

    @JsonProperty("correlations")
    public Map<String, List<CorrelationEdge>> getCorrelations() {
        return correlations;
    }

    /**
     * @return target metric to the metrics whose lagged values track it
     */
    @JsonProperty("causal_relationships")
    public Map<String, List<String>> getCausalRelationships() {
        return causalRelationships;
    }

    @JsonProperty("root_cause_candidates")
    public List<RootCauseCandidate> getCandidates() {
        return candidates;
    }

    @JsonProperty("summary")
    public String getSummary() {
        return summary;
    }

    @JsonProperty("statistics")
    public AnalysisStatistics getStatistics() {
        return statistics;
    }

    @JsonProperty("time_range")
    public TimeRange getTimeRange() {
        return timeRange;
    }

    @JsonProperty("metrics_analyzed")
    public List<String> getMetricsAnalyzed() {
        return metricsAnalyzed;
    }

    @JsonProperty("analysis_time")
    public Instant getAnalysisTime() {
        return analysisTime;
    }

    @JsonProperty("incident_analysis")
    public IncidentAnalysis getIncidentAnalysis() {
        return incidentAnalysis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisResult that))
            return false;
        return anomalies.equals(that.anomalies)
                && correlations.equals(that.correlations)
                && causalRelationships.equals(that.causalRelationships)
                && candidates.equals(that.candidates)
                && summary.equals(that.summary)
                && statistics.equals(that.statistics)
                && Objects.equals(timeRange, that.timeRange)
                && metricsAnalyzed.equals(that.metricsAnalyzed)
                && analysisTime.equals(that.analysisTime)
                && Objects.equals(incidentAnalysis, that.incidentAnalysis);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalies, correlations, causalRelationships, candidates, summary,
                statistics, timeRange, metricsAnalyzed, analysisTime, incidentAnalysis);
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
                "anomalies=" + anomalies.keySet() +
                ", candidates=" + candidates.size() +
                ", statistics=" + statistics +
                ", timeRange=" + timeRange +
                '}';
    }
}
