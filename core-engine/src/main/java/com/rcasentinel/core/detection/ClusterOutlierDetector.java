package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.stats.Descriptive;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Density clustering (DBSCAN) on the standardized values; points that end up
 * in no cluster are flagged.
 *
 * <p>
 * A value is a <i>core</i> point when at least {@code minSamples} values,
 * itself included, lie within {@code eps}. A value that is not core and has no
 * core point within {@code eps} is noise. In one dimension this is decided on
 * the sorted values without building the clusters themselves.
 * </p>
 *
 * <p>
 * {@code minSamples} is {@code max(3, n / 4)}. Series shorter than
 * {@code 2 * minSamples}, or with zero spread, are not scored.
 * </p>
 *
 * @since 1.0.0
 */
public class ClusterOutlierDetector implements SeriesDetector {

    public static final double DEFAULT_EPS = 0.5;
    static final double MIN_EPS = 0.1;
    static final double MAX_EPS = 2.0;

    private final double eps;

    public ClusterOutlierDetector() {
        this(DEFAULT_EPS);
    }

    /**
     * @param eps neighbourhood radius in standard deviations, clamped to
     *            [0.1, 2.0]
     */
    public ClusterOutlierDetector(double eps) {
        if (Double.isNaN(eps)) {
            throw new IllegalArgumentException("eps must be a number");
        }
        this.eps = Math.max(MIN_EPS, Math.min(MAX_EPS, eps));
    }

    static int minSamples(int n) {
        return Math.max(3, n / 4);
    }

    @Override
    public double[] score(double[] values) {
        int n = values.length;
        double[] flags = new double[n];
        int minSamples = minSamples(n);
        if (n < 2 * minSamples || !(Descriptive.populationStd(values) > 0.0)) {
            return flags;
        }

        double[] z = Descriptive.standardize(values);
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> z[i]));
        double[] sorted = new double[n];
        for (int i = 0; i < n; i++) {
            sorted[i] = z[order[i]];
        }

        // sliding window [lo, hi] of values within eps of sorted[pos]
        boolean[] core = new boolean[n];
        int lo = 0;
        int hi = 0;
        for (int pos = 0; pos < n; pos++) {
            while (sorted[pos] - sorted[lo] > eps) {
                lo++;
            }
            while (hi + 1 < n && sorted[hi + 1] - sorted[pos] <= eps) {
                hi++;
            }
            core[pos] = hi - lo + 1 >= minSamples;
        }

        double[] previousCore = new double[n];
        double last = Double.NEGATIVE_INFINITY;
        for (int pos = 0; pos < n; pos++) {
            if (core[pos]) {
                last = sorted[pos];
            }
            previousCore[pos] = last;
        }
        double next = Double.POSITIVE_INFINITY;
        for (int pos = n - 1; pos >= 0; pos--) {
            if (core[pos]) {
                next = sorted[pos];
            }
            boolean reachable = sorted[pos] - previousCore[pos] <= eps || next - sorted[pos] <= eps;
            if (!core[pos] && !reachable) {
                flags[order[pos]] = 1.0;
            }
        }
        return flags;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.CLUSTER_OUTLIER;
    }
}
