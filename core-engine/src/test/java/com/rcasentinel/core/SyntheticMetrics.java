package com.rcasentinel.core;

import com.rcasentinel.core.model.MetricSeries;

import java.util.Arrays;
import java.util.Random;
import java.util.Set;

/**
 * Seeded metric fixtures shared by the engine tests. Samples are one minute
 * apart so every sample lands in its own alignment bucket.
 */
public final class SyntheticMetrics {

    public static final double START_EPOCH_SECONDS = 1_700_000_000d;
    public static final double STEP_SECONDS = 60d;

    /** Indices replaced by injected anomalies in {@link #injectedAnomalies(long)}. */
    public static final Set<Integer> INJECTED = Set.of(80, 81, 82, 83, 84, 90, 91);

    private SyntheticMetrics() {
    }

    /**
     * 100 points from N(50, 10), indices 80-84 replaced by N(150, 5) and
     * 90-91 by N(10, 2).
     */
    public static double[] injectedAnomalies(long seed) {
        Random random = new Random(seed);
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = 50 + 10 * random.nextGaussian();
        }
        for (int i = 80; i <= 84; i++) {
            values[i] = 150 + 5 * random.nextGaussian();
        }
        for (int i = 90; i <= 91; i++) {
            values[i] = 10 + 2 * random.nextGaussian();
        }
        return values;
    }

    /**
     * @return {@code 0.8 * source + N(0, noise)}
     */
    public static double[] scaledWithNoise(double[] source, long seed, double noise) {
        Random random = new Random(seed);
        double[] values = new double[source.length];
        for (int i = 0; i < source.length; i++) {
            values[i] = 0.8 * source[i] + noise * random.nextGaussian();
        }
        return values;
    }

    public static double[] gaussian(long seed, int n, double mean, double std) {
        Random random = new Random(seed);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + std * random.nextGaussian();
        }
        return values;
    }

    public static double[] constant(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    public static double[] timestamps(int n) {
        double[] ts = new double[n];
        for (int i = 0; i < n; i++) {
            ts[i] = START_EPOCH_SECONDS + i * STEP_SECONDS;
        }
        return ts;
    }

    public static MetricSeries series(String name, double[] values) {
        return MetricSeries.of(name, timestamps(values.length), values);
    }
}
