package com.rcasentinel.core.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable pair of analysis thresholds, both in {@code (0, 1]}.
 *
 * <p>
 * An analysis run reads one {@code Thresholds} snapshot from
 * {@link AnalysisConfig} and uses it for the whole run.
 * </p>
 *
 * @since 1.0.0
 */
public final class Thresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_ANOMALY_THRESHOLD = 0.65;
    public static final double DEFAULT_CORRELATION_THRESHOLD = 0.7;

    private final double anomalyThreshold;
    private final double correlationThreshold;

    /**
     * @throws ConfigValidationException if either threshold is outside (0, 1]
     */
    public Thresholds(double anomalyThreshold, double correlationThreshold) {
        this.anomalyThreshold = requireUnitInterval("anomaly_threshold", anomalyThreshold);
        this.correlationThreshold = requireUnitInterval("correlation_threshold", correlationThreshold);
    }

    public static Thresholds defaults() {
        return new Thresholds(DEFAULT_ANOMALY_THRESHOLD, DEFAULT_CORRELATION_THRESHOLD);
    }

    public Thresholds withAnomalyThreshold(double value) {
        return new Thresholds(value, correlationThreshold);
    }

    public Thresholds withCorrelationThreshold(double value) {
        return new Thresholds(anomalyThreshold, value);
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    static double requireUnitInterval(String name, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new ConfigValidationException(
                    name + " must be in (0, 1], got: " + value);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Thresholds that))
            return false;
        return Double.compare(anomalyThreshold, that.anomalyThreshold) == 0
                && Double.compare(correlationThreshold, that.correlationThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyThreshold, correlationThreshold);
    }

    @Override
    public String toString() {
        return "Thresholds{anomaly=" + anomalyThreshold + ", correlation=" + correlationThreshold + '}';
    }
}
