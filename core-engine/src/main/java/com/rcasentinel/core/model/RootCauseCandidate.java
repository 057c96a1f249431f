package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A metric hypothesised to explain the observed anomalies.
 *
 * <p>
 * Use the {@link Builder}; {@code metric}, {@code firstOccurrence} and
 * {@code description} are required. Confidence must lie in [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"metric", "confidence", "first_occurrence", "anomaly_count", "related_metrics",
        "potential_causes", "description"})
public final class RootCauseCandidate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final double confidence;
    private final int anomalyCount;
    private final Instant firstOccurrence;
    private final List<CorrelationEdge> relatedMetrics;
    private final List<String> potentialCauses;
    private final String description;

    private RootCauseCandidate(Builder b) {
        this.metric = Objects.requireNonNull(b.metric, "metric must not be null");
        this.firstOccurrence = Objects.requireNonNull(b.firstOccurrence, "firstOccurrence must not be null");
        this.description = Objects.requireNonNull(b.description, "description must not be null");
        if (!(b.confidence >= 0.0 && b.confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0, 1] for '" + metric
                    + "', got: " + b.confidence);
        }
        this.confidence = b.confidence;
        this.anomalyCount = b.anomalyCount;
        this.relatedMetrics = Collections.unmodifiableList(new ArrayList<>(b.relatedMetrics));
        this.potentialCauses = Collections.unmodifiableList(new ArrayList<>(b.potentialCauses));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link RootCauseCandidate} instances.
     */
    public static final class Builder {
        private String metric;
        private double confidence;
        private int anomalyCount;
        private Instant firstOccurrence;
        private List<CorrelationEdge> relatedMetrics = List.of();
        private List<String> potentialCauses = List.of();
        private String description;

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder anomalyCount(int anomalyCount) {
            this.anomalyCount = anomalyCount;
            return this;
        }

        public Builder firstOccurrence(Instant firstOccurrence) {
            this.firstOccurrence = firstOccurrence;
            return this;
        }

        public Builder relatedMetrics(List<CorrelationEdge> relatedMetrics) {
            this.relatedMetrics = relatedMetrics != null ? relatedMetrics : List.of();
            return this;
        }

        public Builder potentialCauses(List<String> potentialCauses) {
            this.potentialCauses = potentialCauses != null ? potentialCauses : List.of();
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public RootCauseCandidate build() {
            return new RootCauseCandidate(this);
        }
    }

    @JsonProperty("metric")
    public String getMetric() {
        return metric;
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("anomaly_count")
    public int getAnomalyCount() {
        return anomalyCount;
    }

    @JsonProperty("first_occurrence")
    public Instant getFirstOccurrence() {
        return firstOccurrence;
    }

    @JsonProperty("related_metrics")
    public List<CorrelationEdge> getRelatedMetrics() {
        return relatedMetrics;
    }

    /**
     * @return metrics whose lagged values significantly track this one
     */
    @JsonProperty("potential_causes")
    public List<String> getPotentialCauses() {
        return potentialCauses;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootCauseCandidate that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && anomalyCount == that.anomalyCount
                && metric.equals(that.metric)
                && firstOccurrence.equals(that.firstOccurrence)
                && relatedMetrics.equals(that.relatedMetrics)
                && potentialCauses.equals(that.potentialCauses)
                && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, confidence, anomalyCount, firstOccurrence, relatedMetrics,
                potentialCauses, description);
    }

    @Override
    public String toString() {
        return "RootCauseCandidate{" +
                "metric='" + metric + '\'' +
                ", confidence=" + confidence +
                ", anomalyCount=" + anomalyCount +
                ", firstOccurrence=" + firstOccurrence +
                ", related=" + relatedMetrics.size() +
                '}';
    }
}
