package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.stats.Descriptive;

/**
 * Tukey fences: flags values below {@code Q1 - k * IQR} or above
 * {@code Q3 + k * IQR}, with linearly interpolated quartiles.
 *
 * <p>
 * When the interquartile range is zero nothing is flagged; a mostly constant
 * series would otherwise flag every value that differs from the mode.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector implements SeriesDetector {

    public static final double DEFAULT_MULTIPLIER = 1.5;

    private final double multiplier;

    public IqrDetector() {
        this(DEFAULT_MULTIPLIER);
    }

    public IqrDetector(double multiplier) {
        if (!(multiplier > 0)) {
            throw new IllegalArgumentException("multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    @Override
    public double[] score(double[] values) {
        double[] flags = new double[values.length];
        if (values.length == 0) {
            return flags;
        }
        double q1 = Descriptive.percentile(values, 25);
        double q3 = Descriptive.percentile(values, 75);
        double iqr = q3 - q1;
        if (!(iqr > 0.0)) {
            return flags;
        }
        double lower = q1 - multiplier * iqr;
        double upper = q3 + multiplier * iqr;
        for (int i = 0; i < values.length; i++) {
            if (values[i] < lower || values[i] > upper) {
                flags[i] = 1.0;
            }
        }
        return flags;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.IQR;
    }
}
