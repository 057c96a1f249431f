package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Anomalies found in one metric by the detection ensemble.
 *
 * <p>
 * Only metrics with at least one flagged sample get a report. Scores are
 * composite scores of the flagged samples; per-method counts tell how many of
 * those flagged samples each flagging method voted for.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metric} and at least one flagged point are
 * required; {@code maxScore}, {@code avgScore} and {@code severity} are
 * derived from the flagged scores at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"metric", "count", "first_occurrence", "last_occurrence", "max_score",
        "avg_score", "severity", "detection_methods", "flagged_points"})
public final class AnomalyReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final List<Instant> flaggedPoints;
    private final List<Double> flaggedScores;
    private final EnumMap<DetectionMethod, Integer> methodCounts;
    private final double stationarityScore;
    private final double maxScore;
    private final double avgScore;
    private final Severity severity;

    private AnomalyReport(Builder b) {
        this.metric = Objects.requireNonNull(b.metric, "metric must not be null");
        if (b.flaggedPoints.isEmpty()) {
            throw new IllegalArgumentException("Anomaly report for '" + metric
                    + "' requires at least one flagged point");
        }
        if (b.flaggedPoints.size() != b.flaggedScores.size()) {
            throw new IllegalArgumentException("Flagged points and scores differ in length for '"
                    + metric + "'");
        }
        this.flaggedPoints = Collections.unmodifiableList(new ArrayList<>(b.flaggedPoints));
        this.flaggedScores = Collections.unmodifiableList(new ArrayList<>(b.flaggedScores));
        this.methodCounts = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : DetectionMethod.values()) {
            if (method.isFlagging()) {
                methodCounts.put(method, b.methodCounts.getOrDefault(method, 0));
            }
        }
        this.stationarityScore = b.stationarityScore;

        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (double score : flaggedScores) {
            max = Math.max(max, score);
            sum += score;
        }
        this.maxScore = max;
        this.avgScore = sum / flaggedScores.size();
        this.severity = Severity.fromMaxScore(max);
    }

    public static Builder builder(String metric) {
        return new Builder(metric);
    }

    /**
     * Fluent builder for {@link AnomalyReport} instances.
     */
    public static final class Builder {
        private final String metric;
        private final List<Instant> flaggedPoints = new ArrayList<>();
        private final List<Double> flaggedScores = new ArrayList<>();
        private final Map<DetectionMethod, Integer> methodCounts = new EnumMap<>(DetectionMethod.class);
        private double stationarityScore;

        private Builder(String metric) {
            this.metric = metric;
        }

        public Builder flaggedPoint(Instant timestamp, double score) {
            flaggedPoints.add(Objects.requireNonNull(timestamp, "timestamp must not be null"));
            flaggedScores.add(score);
            return this;
        }

        public Builder methodCount(DetectionMethod method, int count) {
            if (!method.isFlagging()) {
                throw new IllegalArgumentException(method + " does not produce per-sample flags");
            }
            methodCounts.put(method, count);
            return this;
        }

        public Builder stationarityScore(double stationarityScore) {
            this.stationarityScore = stationarityScore;
            return this;
        }

        public AnomalyReport build() {
            return new AnomalyReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * Number of ensemble members that contributed to this report: flagging
     * methods with a non-zero count, plus stationarity when its score is
     * positive.
     *
     * @return agreeing method count, in [0, 6]
     */
    @JsonIgnore
    public int agreeingMethodCount() {
        int agreeing = 0;
        for (int count : methodCounts.values()) {
            if (count > 0) {
                agreeing++;
            }
        }
        if (stationarityScore > 0) {
            agreeing++;
        }
        return agreeing;
    }

    /**
     * Per-method view used by the output boundary: one integer count per
     * flagging method followed by the stationarity score.
     *
     * @return ordered map from method key to count or score
     */
    @JsonProperty("detection_methods")
    public Map<String, Number> getDetectionMethods() {
        Map<String, Number> view = new LinkedHashMap<>();
        methodCounts.forEach((method, count) -> view.put(method.key(), count));
        view.put(DetectionMethod.STATIONARITY.key(), stationarityScore);
        return Collections.unmodifiableMap(view);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("metric")
    public String getMetric() {
        return metric;
    }

    @JsonProperty("count")
    public int getCount() {
        return flaggedPoints.size();
    }

    @JsonProperty("first_occurrence")
    public Instant getFirstOccurrence() {
        return flaggedPoints.get(0);
    }

    @JsonProperty("last_occurrence")
    public Instant getLastOccurrence() {
        return flaggedPoints.get(flaggedPoints.size() - 1);
    }

    @JsonProperty("flagged_points")
    public List<Instant> getFlaggedPoints() {
        return flaggedPoints;
    }

    @JsonIgnore
    public List<Double> getFlaggedScores() {
        return flaggedScores;
    }

    /**
     * @param method a flagging method
     * @return how many flagged samples the method voted for
     */
    public int getMethodCount(DetectionMethod method) {
        return methodCounts.getOrDefault(method, 0);
    }

    @JsonIgnore
    public Map<DetectionMethod, Integer> getMethodCounts() {
        return Collections.unmodifiableMap(methodCounts);
    }

    @JsonIgnore
    public double getStationarityScore() {
        return stationarityScore;
    }

    @JsonProperty("max_score")
    public double getMaxScore() {
        return maxScore;
    }

    @JsonProperty("avg_score")
    public double getAvgScore() {
        return avgScore;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyReport that))
            return false;
        return metric.equals(that.metric)
                && flaggedPoints.equals(that.flaggedPoints)
                && flaggedScores.equals(that.flaggedScores)
                && methodCounts.equals(that.methodCounts)
                && Double.compare(stationarityScore, that.stationarityScore) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, flaggedPoints, flaggedScores, methodCounts, stationarityScore);
    }

    @Override
    public String toString() {
        return "AnomalyReport{" +
                "metric='" + metric + '\'' +
                ", count=" + flaggedPoints.size() +
                ", maxScore=" + maxScore +
                ", avgScore=" + avgScore +
                ", severity=" + severity +
                ", methods=" + methodCounts +
                '}';
    }
}
