package com.rcasentinel.core.correlation;

import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.stats.Descriptive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Metrics aligned on a common time grid, one column per metric.
 *
 * <p>
 * Built in explicit passes:
 * </p>
 * <ol>
 * <li>bucket every clean sample into fixed-width time buckets, averaging
 * samples that share a bucket; the rows are the buckets occupied by at least
 * one metric</li>
 * <li>fill interior gaps of each column by linear interpolation in time;
 * leading and trailing gaps stay missing</li>
 * <li>drop rows with fewer than {@code min(columns, max(3, columns / 2))}
 * values</li>
 * <li>drop columns with fewer than two values or zero variance</li>
 * </ol>
 *
 * <p>
 * Missing cells are {@code NaN}. Columns are ordered by metric name.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlignedFrame {

    private static final Logger LOG = LoggerFactory.getLogger(AlignedFrame.class);

    private final double[] rowTimes;
    private final Map<String, double[]> columns;

    private AlignedFrame(double[] rowTimes, Map<String, double[]> columns) {
        this.rowTimes = rowTimes;
        this.columns = columns;
    }

    /**
     * @param series        metrics to align; all of them are used
     * @param bucketSeconds grid width in seconds, positive
     * @return the aligned frame, possibly with no rows or columns
     */
    public static AlignedFrame build(Map<String, MetricSeries> series, int bucketSeconds) {
        Objects.requireNonNull(series, "series must not be null");
        if (bucketSeconds <= 0) {
            throw new IllegalArgumentException("bucketSeconds must be > 0, got: " + bucketSeconds);
        }

        // Pass 1: bucket means
        Map<String, TreeMap<Long, double[]>> buckets = new TreeMap<>();
        TreeSet<Long> occupied = new TreeSet<>();
        for (MetricSeries s : series.values()) {
            double[] ts = s.cleanTimestamps();
            double[] vs = s.cleanValues();
            TreeMap<Long, double[]> sums = new TreeMap<>();
            for (int i = 0; i < ts.length; i++) {
                long bucket = (long) Math.floor(ts[i] / bucketSeconds);
                double[] acc = sums.computeIfAbsent(bucket, k -> new double[2]);
                acc[0] += vs[i];
                acc[1] += 1;
            }
            buckets.put(s.getName(), sums);
            occupied.addAll(sums.keySet());
        }

        Long[] rows = occupied.toArray(new Long[0]);
        double[] times = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            times[r] = (double) rows[r] * bucketSeconds;
        }

        Map<String, double[]> cols = new LinkedHashMap<>();
        for (Map.Entry<String, TreeMap<Long, double[]>> e : buckets.entrySet()) {
            double[] col = new double[rows.length];
            for (int r = 0; r < rows.length; r++) {
                double[] acc = e.getValue().get(rows[r]);
                col[r] = acc == null ? Double.NaN : acc[0] / acc[1];
            }
            // Pass 2: interior gaps
            interpolate(times, col);
            cols.put(e.getKey(), col);
        }

        // Pass 3: sparse rows
        int minValues = Math.min(cols.size(), Math.max(3, cols.size() / 2));
        boolean[] keep = new boolean[rows.length];
        int kept = 0;
        for (int r = 0; r < rows.length; r++) {
            int present = 0;
            for (double[] col : cols.values()) {
                if (!Double.isNaN(col[r])) {
                    present++;
                }
            }
            keep[r] = present >= minValues;
            if (keep[r]) {
                kept++;
            }
        }
        double[] keptTimes = select(times, keep, kept);
        Map<String, double[]> keptCols = new LinkedHashMap<>();
        cols.forEach((name, col) -> keptCols.put(name, select(col, keep, keptTimes.length)));

        // Pass 4: unusable columns
        Map<String, double[]> usable = new LinkedHashMap<>();
        keptCols.forEach((name, col) -> {
            double[] present = presentValues(col);
            if (present.length < 2) {
                LOG.warn("Dropping metric '{}' from correlation: {} aligned value(s)", name, present.length);
            } else if (Descriptive.isConstant(present)) {
                LOG.warn("Dropping metric '{}' from correlation: zero variance", name);
            } else {
                usable.put(name, col);
            }
        });

        LOG.debug("Aligned {} of {} metric(s) over {} row(s)", usable.size(), series.size(), kept);
        return new AlignedFrame(keptTimes, usable);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return column names in name order
     */
    public List<String> columns() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rowTimes.length;
    }

    /**
     * @return bucket start times, epoch seconds
     */
    public double[] rowTimes() {
        return rowTimes.clone();
    }

    /**
     * @return copy of the column, {@code NaN} where missing
     * @throws IllegalArgumentException if the column does not exist
     */
    public double[] column(String name) {
        double[] col = columns.get(name);
        if (col == null) {
            throw new IllegalArgumentException("No aligned column named '" + name + "'");
        }
        return col.clone();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static void interpolate(double[] x, double[] y) {
        int previous = -1;
        for (int i = 0; i < y.length; i++) {
            if (Double.isNaN(y[i])) {
                continue;
            }
            if (previous >= 0 && i - previous > 1) {
                double slope = (y[i] - y[previous]) / (x[i] - x[previous]);
                for (int j = previous + 1; j < i; j++) {
                    y[j] = y[previous] + slope * (x[j] - x[previous]);
                }
            }
            previous = i;
        }
    }

    static double[] presentValues(double[] col) {
        return Arrays.stream(col).filter(v -> !Double.isNaN(v)).toArray();
    }

    private static double[] select(double[] values, boolean[] keep, int count) {
        double[] out = new double[count];
        int k = 0;
        for (int i = 0; i < values.length; i++) {
            if (keep[i]) {
                out[k++] = values[i];
            }
        }
        return out;
    }
}
