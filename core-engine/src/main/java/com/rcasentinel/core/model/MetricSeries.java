package com.rcasentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable, time-ordered series of samples for one named metric.
 *
 * <p>
 * Timestamps are strictly increasing Unix epoch seconds. The {@link Builder}
 * sorts samples by timestamp and resolves duplicate timestamps with
 * <strong>last write wins</strong>.
 * </p>
 *
 * <p>
 * Non-finite values ({@code NaN}, infinities) are kept as "missing" samples:
 * they occupy a slot in the series but are excluded from
 * {@link #cleanValues()} and {@link #cleanTimestamps()}, which are what the
 * analysis components operate on.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double[] timestamps;
    private final double[] values;

    private MetricSeries(String name, double[] timestamps, double[] values) {
        this.name = name;
        this.timestamps = timestamps;
        this.values = values;
    }

    /**
     * Create a new {@link Builder} for the named metric.
     *
     * @param name metric name; must not be {@code null} or blank
     * @return builder instance
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Build a series from parallel timestamp / value arrays.
     *
     * @param name       metric name
     * @param timestamps epoch seconds
     * @param values     sample values
     * @return the series
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static MetricSeries of(String name, double[] timestamps, double[] values) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("timestamps and values differ in length for metric '"
                    + name + "': " + timestamps.length + " vs " + values.length);
        }
        Builder builder = builder(name);
        for (int i = 0; i < timestamps.length; i++) {
            builder.add(timestamps[i], values[i]);
        }
        return builder.build();
    }

    /**
     * Group raw samples by metric name into series.
     *
     * <p>
     * Unusable samples (no metric name, non-finite timestamp) are dropped.
     * The returned map is sorted by metric name.
     * </p>
     *
     * @param samples collector output
     * @return unmodifiable map of metric name to series
     */
    public static Map<String, MetricSeries> fromSamples(Collection<MetricSample> samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        Map<String, Builder> builders = new TreeMap<>();
        for (MetricSample sample : samples) {
            if (sample == null || !sample.isUsable()) {
                continue;
            }
            builders.computeIfAbsent(sample.getMetric(), Builder::new)
                    .add(sample.getTimestamp(), sample.getValue());
        }
        Map<String, MetricSeries> series = new TreeMap<>();
        builders.forEach((metric, builder) -> series.put(metric, builder.build()));
        return Collections.unmodifiableMap(series);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    /**
     * @return total number of samples, missing ones included
     */
    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public double timestampAt(int index) {
        return timestamps[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    /**
     * @return a copy of every timestamp
     */
    public double[] timestamps() {
        return timestamps.clone();
    }

    /**
     * @return a copy of every value, missing ones included
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * @return number of samples with a finite value
     */
    public int cleanSize() {
        int count = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return values of the samples with a finite value, in time order
     */
    public double[] cleanValues() {
        return Arrays.stream(values).filter(Double::isFinite).toArray();
    }

    /**
     * @return timestamps of the samples with a finite value, in time order
     */
    public double[] cleanTimestamps() {
        double[] clean = new double[cleanSize()];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                clean[j++] = timestamps[i];
            }
        }
        return clean;
    }

    /**
     * Convert an epoch-seconds timestamp to an {@link Instant}, keeping
     * millisecond precision.
     *
     * @param epochSeconds Unix timestamp in seconds
     * @return the instant
     */
    public static Instant toInstant(double epochSeconds) {
        return Instant.ofEpochMilli(Math.round(epochSeconds * 1_000d));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Accumulates samples in timestamp order. Adding a timestamp that is
     * already present replaces the earlier value.
     */
    public static final class Builder {
        private final String name;
        private final NavigableMap<Double, Double> points = new TreeMap<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Metric name must not be null or blank");
            }
            this.name = name;
        }

        /**
         * Add a sample.
         *
         * @param timestamp epoch seconds; must be finite
         * @param value     sample value; non-finite values are kept as missing
         * @return this builder
         * @throws IllegalArgumentException if {@code timestamp} is not finite
         */
        public Builder add(double timestamp, double value) {
            if (!Double.isFinite(timestamp)) {
                throw new IllegalArgumentException(
                        "Timestamp must be finite for metric '" + name + "', got: " + timestamp);
            }
            points.put(timestamp, value);
            return this;
        }

        public Builder add(MetricSample sample) {
            Objects.requireNonNull(sample, "sample must not be null");
            return add(sample.getTimestamp(), sample.getValue());
        }

        public MetricSeries build() {
            double[] ts = new double[points.size()];
            double[] vs = new double[points.size()];
            int i = 0;
            for (Map.Entry<Double, Double> point : points.entrySet()) {
                ts[i] = point.getKey();
                vs[i] = point.getValue();
                i++;
            }
            return new MetricSeries(name, ts, vs);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSeries that))
            return false;
        return name.equals(that.name)
                && Arrays.equals(timestamps, that.timestamps)
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + Arrays.hashCode(timestamps)) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "MetricSeries{name='" + name + "', size=" + timestamps.length
                + ", clean=" + cleanSize() + '}';
    }
}
