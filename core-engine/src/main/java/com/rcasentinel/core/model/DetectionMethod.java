package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The six members of the anomaly-detection ensemble and their weights in the
 * composite score.
 *
 * <p>
 * Weights sum to 1.0, so the composite score of a sample is in [0, 1].
 * {@link #STATIONARITY} is the only continuous member: it yields one score
 * per series which is broadcast to every sample.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    ZSCORE("zscore", 0.20),
    IQR("iqr", 0.20),
    DENSITY_OUTLIER("density_outlier", 0.25),
    CLUSTER_OUTLIER("cluster_outlier", 0.15),
    MOVING_AVERAGE("moving_average", 0.15),
    STATIONARITY("stationarity", 0.05);

    private final String key;
    private final double weight;

    DetectionMethod(String key, double weight) {
        this.key = key;
        this.weight = weight;
    }

    /**
     * @return stable identifier used in reports and configuration
     */
    @JsonValue
    public String key() {
        return key;
    }

    public double weight() {
        return weight;
    }

    /**
     * @return {@code true} if the method produces a per-sample 0/1 flag
     */
    public boolean isFlagging() {
        return this != STATIONARITY;
    }
}
