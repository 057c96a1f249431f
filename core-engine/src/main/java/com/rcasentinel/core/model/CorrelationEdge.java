package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * A significant correlation between two metrics, seen from {@code metricA}.
 *
 * <p>
 * The coefficient is rounded to three decimals and lies in [-1, 1].
 * Serialized as {@code {related_metric, coefficient, method}} because the
 * edge always appears under {@code metricA}'s key in the correlation graph.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"related_metric", "coefficient", "method"})
public final class CorrelationEdge implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Correlation statistic used to compute an edge. */
    public enum Method {
        PEARSON;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String metricA;
    private final String metricB;
    private final double coefficient;
    private final Method method;

    /**
     * @throws IllegalArgumentException if the coefficient is outside [-1, 1]
     *                                  or both ends name the same metric
     */
    public CorrelationEdge(String metricA, String metricB, double coefficient, Method method) {
        this.metricA = Objects.requireNonNull(metricA, "metricA must not be null");
        this.metricB = Objects.requireNonNull(metricB, "metricB must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
        if (metricA.equals(metricB)) {
            throw new IllegalArgumentException("Correlation edge must join two distinct metrics: " + metricA);
        }
        if (!(coefficient >= -1.0 && coefficient <= 1.0)) {
            throw new IllegalArgumentException("Correlation coefficient must be in [-1, 1], got: " + coefficient);
        }
        this.coefficient = coefficient;
    }

    public static CorrelationEdge pearson(String metricA, String metricB, double coefficient) {
        return new CorrelationEdge(metricA, metricB, coefficient, Method.PEARSON);
    }

    @JsonIgnore
    public String getMetricA() {
        return metricA;
    }

    @JsonProperty("related_metric")
    public String getMetricB() {
        return metricB;
    }

    @JsonProperty("coefficient")
    public double getCoefficient() {
        return coefficient;
    }

    @JsonIgnore
    public double strength() {
        return Math.abs(coefficient);
    }

    @JsonProperty("method")
    public Method getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationEdge that))
            return false;
        return Double.compare(coefficient, that.coefficient) == 0
                && metricA.equals(that.metricA)
                && metricB.equals(that.metricB)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricA, metricB, coefficient, method);
    }

    @Override
    public String toString() {
        return metricA + " ~ " + metricB + " (" + method.label() + "=" + coefficient + ')';
    }
}
