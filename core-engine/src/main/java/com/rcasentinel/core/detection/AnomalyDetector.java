package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.AnomalyReport;
import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the six-member detection ensemble over a set of metrics.
 *
 * <p>
 * Each metric is scored independently. A detector that throws contributes
 * zeros for that metric; a metric whose scoring fails as a whole is left out
 * of the result. Neither stops the other metrics.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * When constructed with an {@link ExecutorService}, metrics are scored in
 * parallel on it and the caller blocks until all are done. The executor is
 * owned by the caller. Without one, metrics are scored on the calling thread.
 * The result is a name-sorted map either way.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    /** Metrics with fewer clean samples are not analysed. */
    public static final int MIN_CLEAN_SAMPLES = 5;

    private final List<SeriesDetector> detectors;
    private final ExecutorService executor;

    public AnomalyDetector() {
        this(DetectorFactory.createAll(), null);
    }

    public AnomalyDetector(ExecutorService executor) {
        this(DetectorFactory.createAll(), Objects.requireNonNull(executor, "executor must not be null"));
    }

    AnomalyDetector(List<SeriesDetector> detectors, ExecutorService executor) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.executor = executor;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Detect anomalies in every metric.
     *
     * @param series    metric name to series
     * @param threshold composite score cut-off, exclusive
     * @return metric name to report, only for metrics with flagged samples
     */
    public Map<String, AnomalyReport> detect(Map<String, MetricSeries> series, double threshold) {
        Objects.requireNonNull(series, "series must not be null");
        Map<String, AnomalyReport> reports = new TreeMap<>();

        if (executor == null) {
            for (MetricSeries s : new TreeMap<>(series).values()) {
                try {
                    detectOne(s, threshold).ifPresent(r -> reports.put(r.getMetric(), r));
                } catch (RuntimeException e) {
                    LOG.warn("Anomaly detection failed for metric '{}', excluding it", s.getName(), e);
                }
            }
            return reports;
        }

        Map<String, Future<Optional<AnomalyReport>>> pending = new LinkedHashMap<>();
        for (MetricSeries s : new TreeMap<>(series).values()) {
            pending.put(s.getName(), executor.submit(() -> detectOne(s, threshold)));
        }
        for (Map.Entry<String, Future<Optional<AnomalyReport>>> e : pending.entrySet()) {
            try {
                e.getValue().get().ifPresent(r -> reports.put(r.getMetric(), r));
            } catch (ExecutionException ex) {
                LOG.warn("Anomaly detection failed for metric '{}', excluding it", e.getKey(), ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while detecting anomalies", ex);
            }
        }
        return reports;
    }

    /**
     * Detect anomalies in a single metric.
     *
     * @return the report, or empty when the metric is too short or nothing is
     *         flagged
     */
    public Optional<AnomalyReport> detectOne(MetricSeries series, double threshold) {
        if (series.cleanSize() < MIN_CLEAN_SAMPLES) {
            LOG.warn("Skipping metric '{}': {} usable sample(s), at least {} required",
                    series.getName(), series.cleanSize(), MIN_CLEAN_SAMPLES);
            return Optional.empty();
        }
        Optional<AnomalyReport> report = scoreSeries(series).toReport(threshold);
        report.ifPresent(r -> LOG.debug("Metric '{}': {} anomalous sample(s), max score {}",
                r.getMetric(), r.getCount(), r.getMaxScore()));
        return report;
    }

    /**
     * Run every ensemble member over the clean samples of {@code series}.
     *
     * @param series metric to score
     * @return per-method and composite scores
     */
    public EnsembleScores scoreSeries(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.cleanValues();
        Map<DetectionMethod, double[]> scores = new EnumMap<>(DetectionMethod.class);

        for (SeriesDetector detector : detectors) {
            try {
                scores.put(detector.method(), clamp(detector.score(values), values.length));
            } catch (RuntimeException e) {
                // Degenerate input for this detector only; it votes zero.
                LOG.warn("Detector {} failed for metric '{}': {}",
                        detector.method().key(), series.getName(), e.toString());
                scores.put(detector.method(), new double[values.length]);
            }
        }
        return new EnsembleScores(series.getName(), series.cleanTimestamps(), scores);
    }

    private static double[] clamp(double[] scores, int expected) {
        if (scores.length != expected) {
            throw new IllegalStateException("Expected " + expected + " scores, got " + scores.length);
        }
        for (int i = 0; i < scores.length; i++) {
            double s = scores[i];
            scores[i] = Double.isNaN(s) ? 0.0 : Math.max(0.0, Math.min(1.0, s));
        }
        return scores;
    }
}
