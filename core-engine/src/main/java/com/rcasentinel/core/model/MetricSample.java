package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single observation of a named metric, as delivered by the metric
 * collector.
 *
 * <p>
 * Timestamps are Unix epoch seconds (fractional seconds allowed). A missing
 * or unparsable value is represented as {@link Double#NaN}.
 * </p>
 *
 * <p>
 * The optional {@code scope} groups samples that belong to the same analysis
 * (e.g. a cluster or namespace). Samples without a scope share the
 * {@value #DEFAULT_SCOPE} scope.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Scope assigned to samples that do not carry one. */
    public static final String DEFAULT_SCOPE = "default";

    private String metric;
    private double timestamp;
    private double value = Double.NaN;
    private String scope;

    /** No-arg constructor required by Jackson and Flink's POJO serializer. */
    public MetricSample() {
    }

    public MetricSample(String metric, double timestamp, double value) {
        this.metric = metric;
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * @return {@code true} if the sample names a metric and carries a finite
     *         timestamp
     */
    public boolean isUsable() {
        return metric != null && !metric.isBlank() && Double.isFinite(timestamp);
    }

    /**
     * @return the sample scope, or {@value #DEFAULT_SCOPE} if none was set
     */
    public String resolvedScope() {
        return scope == null || scope.isBlank() ? DEFAULT_SCOPE : scope;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(double timestamp) {
        this.timestamp = timestamp;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(timestamp, that.timestamp) == 0
                && Double.compare(value, that.value) == 0
                && Objects.equals(metric, that.metric)
                && Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, timestamp, value, scope);
    }

    @Override
    public String toString() {
        return "MetricSample{" +
                "metric='" + metric + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", scope='" + scope + '\'' +
                '}';
    }
}
