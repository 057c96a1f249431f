package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.stats.Descriptive;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Isolation-style outlier detector based on k-nearest-neighbour distances.
 *
 * <p>
 * Each value is scored by its mean distance to its {@code k} nearest
 * neighbours; isolated values score high. The {@code contamination} fraction
 * sets the cut: values whose score lies strictly above the
 * {@code (1 - contamination)} percentile of all scores are flagged. The result
 * is deterministic and needs no random seed.
 * </p>
 *
 * <h3>Minimum size</h3>
 * <p>
 * Series shorter than {@value #MIN_SAMPLES} values are not scored.
 * </p>
 *
 * @since 1.0.0
 */
public class DensityOutlierDetector implements SeriesDetector {

    static final int MIN_SAMPLES = 10;

    public static final int DEFAULT_NEIGHBOURS = 5;
    public static final double DEFAULT_CONTAMINATION = 0.1;

    private final int neighbours;
    private final double contamination;

    public DensityOutlierDetector() {
        this(DEFAULT_NEIGHBOURS, DEFAULT_CONTAMINATION);
    }

    /**
     * @param neighbours    number of neighbours per value, at least 1
     * @param contamination expected outlier fraction in (0, 0.5]
     */
    public DensityOutlierDetector(int neighbours, double contamination) {
        if (neighbours < 1) {
            throw new IllegalArgumentException("neighbours must be >= 1, got: " + neighbours);
        }
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        this.neighbours = neighbours;
        this.contamination = contamination;
    }

    @Override
    public double[] score(double[] values) {
        int n = values.length;
        double[] flags = new double[n];
        if (n < MIN_SAMPLES) {
            return flags;
        }

        double[] isolation = isolationScores(values);
        double cut = Descriptive.percentile(isolation, 100.0 * (1.0 - contamination));
        for (int i = 0; i < n; i++) {
            if (isolation[i] > cut) {
                flags[i] = 1.0;
            }
        }
        return flags;
    }

    /**
     * Mean distance of each value to its nearest neighbours, in input order.
     */
    double[] isolationScores(double[] values) {
        int n = values.length;
        int k = Math.min(neighbours, n - 1);
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));
        double[] sorted = new double[n];
        for (int i = 0; i < n; i++) {
            sorted[i] = values[order[i]];
        }

        double[] scores = new double[n];
        for (int pos = 0; pos < n; pos++) {
            int left = pos - 1;
            int right = pos + 1;
            double sum = 0.0;
            for (int taken = 0; taken < k; taken++) {
                double dl = left >= 0 ? sorted[pos] - sorted[left] : Double.POSITIVE_INFINITY;
                double dr = right < n ? sorted[right] - sorted[pos] : Double.POSITIVE_INFINITY;
                if (dl <= dr) {
                    sum += dl;
                    left--;
                } else {
                    sum += dr;
                    right++;
                }
            }
            scores[order[pos]] = sum / k;
        }
        return scores;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.DENSITY_OUTLIER;
    }
}
