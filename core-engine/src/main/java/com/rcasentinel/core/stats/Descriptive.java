package com.rcasentinel.core.stats;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Descriptive statistics over plain {@code double[]} samples.
 *
 * <p>
 * Thin wrappers around Commons Math so that every detector uses the same
 * conventions: population standard deviation for standardizing, sample
 * standard deviation for rolling baselines, and linearly interpolated
 * percentiles (R-7, the "type 7" estimator).
 * </p>
 *
 * @since 1.0.0
 */
public final class Descriptive {

    private static final double MAD_TO_STD = 1.4826;

    private Descriptive() {
    }

    /**
     * @return arithmetic mean, or {@code NaN} for an empty array
     */
    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    /**
     * @return standard deviation with divisor {@code n}; 0 for one value
     */
    public static double populationStd(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * @return standard deviation with divisor {@code n - 1}; 0 for one value
     */
    public static double sampleStd(double[] values) {
        return new StandardDeviation(true).evaluate(values);
    }

    /**
     * @param values  non-empty sample
     * @param percent in (0, 100]
     * @return linearly interpolated percentile
     */
    public static double percentile(double[] values, double percent) {
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percent);
    }

    /**
     * Median absolute deviation scaled to estimate the standard deviation of
     * normally distributed data; insensitive to a minority of outliers.
     *
     * @return {@code 1.4826 * median(|v - median(v)|)}
     */
    public static double robustScale(double[] values) {
        double median = percentile(values, 50);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return MAD_TO_STD * percentile(deviations, 50);
    }

    /**
     * Standardize to zero mean and unit population standard deviation.
     *
     * @throws ArithmeticException if the sample has zero spread
     */
    public static double[] standardize(double[] values) {
        double mean = mean(values);
        double std = populationStd(values);
        if (!(std > 0.0)) {
            throw new ArithmeticException("Cannot standardize a sample with zero spread");
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (values[i] - mean) / std;
        }
        return out;
    }

    /**
     * @return {@code true} when all values are equal (or there are fewer than two)
     */
    public static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (Double.compare(values[i], values[0]) != 0) {
                return false;
            }
        }
        return true;
    }
}
