package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * Summary counters of one analysis run.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"total_metrics", "anomalous_metrics", "correlation_pairs", "analysis_duration_seconds"})
public final class AnalysisStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int totalMetrics;
    private final int anomalousMetrics;
    private final int correlationPairs;
    private final double analysisDurationSeconds;

    public AnalysisStatistics(int totalMetrics, int anomalousMetrics, int correlationPairs,
            double analysisDurationSeconds) {
        this.totalMetrics = totalMetrics;
        this.anomalousMetrics = anomalousMetrics;
        this.correlationPairs = correlationPairs;
        this.analysisDurationSeconds = analysisDurationSeconds;
    }

    @JsonProperty("total_metrics")
    public int getTotalMetrics() {
        return totalMetrics;
    }

    @JsonProperty("anomalous_metrics")
    public int getAnomalousMetrics() {
        return anomalousMetrics;
    }

    /**
     * @return number of correlation edges over all metrics (each pair is
     *         counted once per direction it appears in)
     */
    @JsonProperty("correlation_pairs")
    public int getCorrelationPairs() {
        return correlationPairs;
    }

    @JsonProperty("analysis_duration_seconds")
    public double getAnalysisDurationSeconds() {
        return analysisDurationSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisStatistics that))
            return false;
        return totalMetrics == that.totalMetrics
                && anomalousMetrics == that.anomalousMetrics
                && correlationPairs == that.correlationPairs
                && Double.compare(analysisDurationSeconds, that.analysisDurationSeconds) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalMetrics, anomalousMetrics, correlationPairs, analysisDurationSeconds);
    }

    @Override
    public String toString() {
        return "AnalysisStatistics{" +
                "totalMetrics=" + totalMetrics +
                ", anomalousMetrics=" + anomalousMetrics +
                ", correlationPairs=" + correlationPairs +
                ", analysisDurationSeconds=" + analysisDurationSeconds +
                '}';
    }
}
