package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.stats.Descriptive;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Moving-average deviation detector.
 *
 * <p>
 * Keeps a trailing baseline of the last {@code windowSize} accepted values.
 * Each new value is compared with the baseline <i>before</i> it is added, and
 * flagged when it deviates from the baseline mean by more than
 * {@code deviationFactor} baseline standard deviations.
 * </p>
 *
 * <h3>Baseline spread</h3>
 * <p>
 * When the baseline standard deviation is zero or undefined (one value) the
 * series' global standard deviation is used instead. The spread is never
 * taken below half the series' robust scale (scaled MAD): ten values can
 * happen to sit unusually close together, and ordinary noise must not be
 * flagged against them.
 * </p>
 *
 * <h3>Baseline updates</h3>
 * <p>
 * Flagged values are not added to the baseline, so a burst of outliers does
 * not mask its own tail. If {@code windowSize} values in a row are flagged on
 * the same side of the baseline mean, the series is taken to have moved to a
 * new level and those values become the baseline.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDetector implements SeriesDetector {

    public static final int DEFAULT_WINDOW_SIZE = 10;
    public static final double DEFAULT_DEVIATION_FACTOR = 2.0;

    static final double ROBUST_FLOOR_FACTOR = 0.5;

    private final int windowSize;
    private final double deviationFactor;

    public MovingAverageDetector() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_DEVIATION_FACTOR);
    }

    public MovingAverageDetector(int windowSize, double deviationFactor) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got: " + windowSize);
        }
        if (!(deviationFactor > 0)) {
            throw new IllegalArgumentException("deviationFactor must be > 0, got: " + deviationFactor);
        }
        this.windowSize = windowSize;
        this.deviationFactor = deviationFactor;
    }

    @Override
    public double[] score(double[] values) {
        double[] flags = new double[values.length];
        if (values.length < 2) {
            return flags;
        }
        double globalStd = Descriptive.sampleStd(values);
        if (!(globalStd > 0.0)) {
            return flags;
        }
        double floor = ROBUST_FLOOR_FACTOR * Descriptive.robustScale(values);

        Deque<Double> baseline = new ArrayDeque<>(windowSize);
        Deque<Double> run = new ArrayDeque<>(windowSize);
        int runSide = 0;

        for (int i = 0; i < values.length; i++) {
            double value = values[i];

            if (baseline.isEmpty()) {
                baseline.addLast(value);
                continue;
            }

            double[] window = toArray(baseline);
            double mean = Descriptive.mean(window);
            double std = Descriptive.sampleStd(window);
            if (!(std > 0.0)) {
                std = globalStd;
            }
            std = Math.max(std, floor);

            if (Math.abs(value - mean) / std <= deviationFactor) {
                run.clear();
                runSide = 0;
                baseline.addLast(value);
                if (baseline.size() > windowSize) {
                    baseline.pollFirst();
                }
                continue;
            }

            flags[i] = 1.0;
            int side = value > mean ? 1 : -1;
            if (side != runSide) {
                run.clear();
                runSide = side;
            }
            run.addLast(value);
            if (run.size() >= windowSize) {
                // level shift
                baseline.clear();
                baseline.addAll(run);
                run.clear();
                runSide = 0;
            }
        }
        return flags;
    }

    private static double[] toArray(Deque<Double> window) {
        double[] out = new double[window.size()];
        int i = 0;
        for (double v : window) {
            out[i++] = v;
        }
        return out;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.MOVING_AVERAGE;
    }
}
