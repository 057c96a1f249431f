package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.stats.Descriptive;

/**
 * Flags values more than {@code threshold} population standard deviations
 * away from the mean. A series with zero spread yields no flags.
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements SeriesDetector {

    public static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public ZScoreDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public ZScoreDetector(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public double[] score(double[] values) {
        double[] flags = new double[values.length];
        if (values.length == 0) {
            return flags;
        }
        double mean = Descriptive.mean(values);
        double std = Descriptive.populationStd(values);
        if (!(std > 0.0)) {
            return flags;
        }
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(values[i] - mean) / std > threshold) {
                flags[i] = 1.0;
            }
        }
        return flags;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ZSCORE;
    }
}
