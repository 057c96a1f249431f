package com.rcasentinel.core.correlation;

import com.rcasentinel.core.config.RcaSettings;
import com.rcasentinel.core.model.CorrelationEdge;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.stats.PearsonTest;
import com.rcasentinel.core.stats.Residuals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Finds statistical relationships between metrics.
 *
 * <h3>Operations</h3>
 * <ul>
 * <li>{@link #correlate}: Pearson correlation graph over the aligned metrics,
 * at most {@value #MAX_EDGES_PER_METRIC} strongest edges per metric</li>
 * <li>{@link #detectCausalRelationships}: lagged-correlation test naming the
 * metrics whose past values track another metric</li>
 * <li>{@link #crossCorrelation}: significant lagged coefficients of two raw
 * series</li>
 * <li>{@link #partialCorrelations}: pairwise correlation with the remaining
 * metrics regressed out</li>
 * </ul>
 *
 * <p>
 * A metric with too few samples or zero variance is left out of the
 * computation it cannot take part in; it never fails the whole pass.
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationAnalyzer.class);

    public static final int MIN_CLEAN_SAMPLES = 5;
    public static final int MAX_EDGES_PER_METRIC = 5;

    public static final int CAUSALITY_MAX_LAG = 5;
    static final double LAG_MIN_STRENGTH = 0.3;
    static final double SIGNIFICANCE = 0.05;
    static final int LAG_MIN_PAIRS = 11;
    static final int CAUSALITY_MIN_SIGNIFICANT_LAGS = 2;

    static final double PARTIAL_MIN_STRENGTH = 0.3;
    static final int PARTIAL_MIN_ROWS = 10;

    private final int bucketSeconds;

    public CorrelationAnalyzer() {
        this(RcaSettings.DEFAULT_RESAMPLE_SECONDS);
    }

    /**
     * @param bucketSeconds width of the alignment grid, positive
     */
    public CorrelationAnalyzer(int bucketSeconds) {
        if (bucketSeconds <= 0) {
            throw new IllegalArgumentException("bucketSeconds must be > 0, got: " + bucketSeconds);
        }
        this.bucketSeconds = bucketSeconds;
    }

    // ---------------------------------------------------------------
    // Correlation graph
    // ---------------------------------------------------------------

    /**
     * Build the correlation graph.
     *
     * @param series    metric name to series
     * @param threshold minimum absolute coefficient for an edge, in (0, 1]
     * @return metric to its strongest edges, strongest first; metrics without
     *         an edge are absent. Empty when fewer than two metrics have
     *         {@value #MIN_CLEAN_SAMPLES} clean samples.
     */
    public Map<String, List<CorrelationEdge>> correlate(Map<String, MetricSeries> series, double threshold) {
        AlignedFrame frame = align(series);
        if (frame == null) {
            return Map.of();
        }

        List<String> names = frame.columns();
        Map<String, List<CorrelationEdge>> candidates = new TreeMap<>();
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                String a = names.get(i);
                String b = names.get(j);
                double r = pairwiseCoefficient(frame.column(a), frame.column(b));
                if (Math.abs(r) >= threshold) {
                    double rounded = round3(r);
                    candidates.computeIfAbsent(a, k -> new ArrayList<>()).add(CorrelationEdge.pearson(a, b, rounded));
                    candidates.computeIfAbsent(b, k -> new ArrayList<>()).add(CorrelationEdge.pearson(b, a, rounded));
                }
            }
        }

        Map<String, List<CorrelationEdge>> graph = new TreeMap<>();
        candidates.forEach((metric, edges) -> {
            edges.sort(Comparator.comparingDouble(CorrelationEdge::strength).reversed()
                    .thenComparing(CorrelationEdge::getMetricB));
            graph.put(metric, List.copyOf(edges.subList(0, Math.min(MAX_EDGES_PER_METRIC, edges.size()))));
        });
        LOG.info("Found significant correlations for {} metric(s)", graph.size());
        return Collections.unmodifiableMap(graph);
    }

    /**
     * Number of distinct metric pairs joined by an edge in {@code graph}.
     */
    public static int countPairs(Map<String, List<CorrelationEdge>> graph) {
        int pairs = 0;
        for (List<CorrelationEdge> edges : graph.values()) {
            for (CorrelationEdge edge : edges) {
                if (edge.getMetricA().compareTo(edge.getMetricB()) < 0) {
                    pairs++;
                } else if (!containsEdge(graph, edge.getMetricB(), edge.getMetricA())) {
                    // reverse edge fell outside the other metric's top list
                    pairs++;
                }
            }
        }
        return pairs;
    }

    private static boolean containsEdge(Map<String, List<CorrelationEdge>> graph, String from, String to) {
        return graph.getOrDefault(from, List.of()).stream().anyMatch(e -> e.getMetricB().equals(to));
    }

    // ---------------------------------------------------------------
    // Causality
    // ---------------------------------------------------------------

    /**
     * Lagged-correlation causality screen.
     *
     * <p>
     * For each ordered pair, the target at {@code t} is correlated with the
     * predictor at {@code t - lag} for lags 1 to {@value #CAUSALITY_MAX_LAG}.
     * A lag counts when it has more than ten pairs, {@code |r| > 0.3} and
     * {@code p < 0.05}; two counting lags make the predictor a potential cause.
     * Pairs with fewer than {@code 3 * maxLag} common rows are not tested.
     * </p>
     *
     * @return target metric to its potential causes, in name order
     */
    public Map<String, List<String>> detectCausalRelationships(Map<String, MetricSeries> series) {
        AlignedFrame frame = align(series);
        if (frame == null) {
            return Map.of();
        }
        List<String> names = frame.columns();
        Map<String, List<String>> causes = new TreeMap<>();
        for (String target : names) {
            for (String predictor : names) {
                if (!target.equals(predictor)
                        && leads(frame.column(target), frame.column(predictor), CAUSALITY_MAX_LAG)) {
                    causes.computeIfAbsent(target, k -> new ArrayList<>()).add(predictor);
                }
            }
        }
        causes.replaceAll((k, v) -> List.copyOf(v));
        LOG.info("Found potential causes for {} metric(s)", causes.size());
        return Collections.unmodifiableMap(causes);
    }

    static boolean leads(double[] target, double[] predictor, int maxLag) {
        double[][] rows = completeRows(target, predictor);
        double[] t = rows[0];
        double[] p = rows[1];
        int n = t.length;
        if (n < maxLag * 3) {
            return false;
        }
        int significant = 0;
        for (int lag = 1; lag <= maxLag; lag++) {
            int pairs = n - lag;
            if (pairs < LAG_MIN_PAIRS) {
                continue;
            }
            double[] current = new double[pairs];
            double[] lagged = new double[pairs];
            for (int i = 0; i < pairs; i++) {
                current[i] = t[i + lag];
                lagged[i] = p[i];
            }
            PearsonTest test = PearsonTest.of(current, lagged);
            if (Math.abs(test.getCoefficient()) > LAG_MIN_STRENGTH && test.getPValue() < SIGNIFICANCE) {
                significant++;
            }
        }
        return significant >= CAUSALITY_MIN_SIGNIFICANT_LAGS;
    }

    // ---------------------------------------------------------------
    // Cross-correlation
    // ---------------------------------------------------------------

    /**
     * Significant lagged correlations between two raw value sequences.
     *
     * <p>
     * The longer input is trimmed to its most recent values. A positive lag
     * pairs {@code a[t]} with {@code b[t + lag]}; a negative lag pairs
     * {@code a[t - lag]} with {@code b[t]}. When there are fewer than
     * {@code 2 * maxLags} values, {@code maxLags} is reduced to half the
     * length. Only lags with more than three pairs and {@code p < 0.05} are
     * reported.
     * </p>
     *
     * @param a       first sequence, oldest first
     * @param b       second sequence, oldest first
     * @param maxLags largest lag magnitude, non-negative
     * @return lag to coefficient rounded to three decimals, in lag order
     */
    public SortedMap<Integer, Double> crossCorrelation(double[] a, double[] b, int maxLags) {
        if (maxLags < 0) {
            throw new IllegalArgumentException("maxLags must be >= 0, got: " + maxLags);
        }
        int n = Math.min(a.length, b.length);
        if (n < maxLags * 2) {
            maxLags = n / 2;
        }
        double[] x = tail(a, n);
        double[] y = tail(b, n);

        SortedMap<Integer, Double> result = new TreeMap<>();
        for (int lag = -maxLags; lag <= maxLags; lag++) {
            int shift = Math.abs(lag);
            int pairs = n - shift;
            if (pairs <= 3) {
                continue;
            }
            double[] s1 = new double[pairs];
            double[] s2 = new double[pairs];
            for (int i = 0; i < pairs; i++) {
                s1[i] = lag < 0 ? x[i + shift] : x[i];
                s2[i] = lag > 0 ? y[i + shift] : y[i];
            }
            PearsonTest test = PearsonTest.of(s1, s2);
            if (test.getPValue() < SIGNIFICANCE) {
                result.put(lag, round3(test.getCoefficient()));
            }
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Partial correlation
    // ---------------------------------------------------------------

    /**
     * Partial correlation of every metric pair, controlling for all other
     * aligned metrics.
     *
     * <p>
     * Needs at least three aligned metrics and {@value #PARTIAL_MIN_ROWS}
     * complete rows per pair. Coefficients with {@code |r| <= 0.3} are
     * omitted, as are pairs whose regression is degenerate.
     * </p>
     *
     * @return metric to (other metric to coefficient rounded to three decimals)
     */
    public Map<String, Map<String, Double>> partialCorrelations(Map<String, MetricSeries> series) {
        AlignedFrame frame = align(series);
        if (frame == null || frame.columnCount() < 3) {
            return Map.of();
        }
        List<String> names = frame.columns();
        Map<String, Map<String, Double>> result = new TreeMap<>();
        for (String first : names) {
            for (String second : names) {
                if (first.equals(second)) {
                    continue;
                }
                List<String> controls = new ArrayList<>(names);
                controls.remove(first);
                controls.remove(second);
                try {
                    double r = partialCoefficient(frame, first, second, controls);
                    if (!Double.isNaN(r) && Math.abs(r) > PARTIAL_MIN_STRENGTH) {
                        result.computeIfAbsent(first, k -> new TreeMap<>()).put(second, round3(r));
                    }
                } catch (RuntimeException e) {
                    LOG.debug("Partial correlation {} ~ {} skipped: {}", first, second, e.toString());
                }
            }
        }
        result.replaceAll((k, v) -> Collections.unmodifiableMap(v));
        return Collections.unmodifiableMap(result);
    }

    private static double partialCoefficient(AlignedFrame frame, String first, String second,
            List<String> controls) {
        double[][] source = new double[controls.size() + 2][];
        source[0] = frame.column(first);
        source[1] = frame.column(second);
        for (int c = 0; c < controls.size(); c++) {
            source[c + 2] = frame.column(controls.get(c));
        }
        double[][] rows = completeRows(source);
        int n = rows[0].length;
        if (n < PARTIAL_MIN_ROWS) {
            return Double.NaN;
        }
        double[][] design = new double[n][controls.size()];
        for (int i = 0; i < n; i++) {
            for (int c = 0; c < controls.size(); c++) {
                design[i][c] = rows[c + 2][i];
            }
        }
        double[] r1 = Residuals.of(rows[0], design);
        double[] r2 = Residuals.of(rows[1], design);
        return PearsonTest.of(r1, r2).getCoefficient();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * @return the aligned frame of eligible metrics, or {@code null} when
     *         fewer than two metrics can take part
     */
    private AlignedFrame align(Map<String, MetricSeries> series) {
        Objects.requireNonNull(series, "series must not be null");
        Map<String, MetricSeries> eligible = new LinkedHashMap<>();
        for (MetricSeries s : new TreeMap<>(series).values()) {
            if (s.cleanSize() >= MIN_CLEAN_SAMPLES) {
                eligible.put(s.getName(), s);
            } else {
                LOG.debug("Metric '{}' has {} clean sample(s), excluded from correlation",
                        s.getName(), s.cleanSize());
            }
        }
        if (eligible.size() < 2) {
            LOG.info("Correlation skipped: {} eligible metric(s), at least 2 required", eligible.size());
            return null;
        }
        AlignedFrame frame = AlignedFrame.build(eligible, bucketSeconds);
        return frame.columnCount() < 2 ? null : frame;
    }

    /**
     * Pearson over rows where both columns have a value; 0 when fewer than
     * three such rows exist or the coefficient is undefined.
     */
    static double pairwiseCoefficient(double[] a, double[] b) {
        double[][] rows = completeRows(a, b);
        if (rows[0].length < PearsonTest.MIN_PAIRS) {
            return 0.0;
        }
        return PearsonTest.of(rows[0], rows[1]).getCoefficient();
    }

    /**
     * Keep only the row positions at which every column has a value.
     */
    static double[][] completeRows(double[]... columns) {
        int n = columns[0].length;
        boolean[] complete = new boolean[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            boolean ok = true;
            for (double[] col : columns) {
                if (Double.isNaN(col[i])) {
                    ok = false;
                    break;
                }
            }
            complete[i] = ok;
            if (ok) {
                count++;
            }
        }
        double[][] out = new double[columns.length][count];
        int k = 0;
        for (int i = 0; i < n; i++) {
            if (complete[i]) {
                for (int c = 0; c < columns.length; c++) {
                    out[c][k] = columns[c][i];
                }
                k++;
            }
        }
        return out;
    }

    private static double[] tail(double[] values, int n) {
        double[] out = new double[n];
        System.arraycopy(values, values.length - n, out, 0, n);
        return out;
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
