package com.rcasentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the {@code rca.yml} configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * anomalyThreshold: 0.65
 * correlationThreshold: 0.7
 * workerThreads: 4
 * summaryTimeoutMillis: 30000
 * resampleSeconds: 60
 * defaultMetrics:
 *   - cpu_usage
 *   - memory_usage
 * </pre>
 *
 * <p>
 * Every property is optional; missing ones keep the defaults below. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class RcaSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final long DEFAULT_SUMMARY_TIMEOUT_MILLIS = 30_000L;
    public static final int DEFAULT_RESAMPLE_SECONDS = 60;

    private double anomalyThreshold = Thresholds.DEFAULT_ANOMALY_THRESHOLD;
    private double correlationThreshold = Thresholds.DEFAULT_CORRELATION_THRESHOLD;
    private int workerThreads = DEFAULT_WORKER_THREADS;
    private long summaryTimeoutMillis = DEFAULT_SUMMARY_TIMEOUT_MILLIS;
    private int resampleSeconds = DEFAULT_RESAMPLE_SECONDS;
    private List<String> defaultMetrics = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check every property and report all problems at once.
     *
     * @throws IllegalStateException if one or more properties are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(anomalyThreshold > 0.0 && anomalyThreshold <= 1.0)) {
            errors.add("anomalyThreshold must be in (0, 1], got: " + anomalyThreshold);
        }
        if (!(correlationThreshold > 0.0 && correlationThreshold <= 1.0)) {
            errors.add("correlationThreshold must be in (0, 1], got: " + correlationThreshold);
        }
        if (workerThreads <= 0) {
            errors.add("workerThreads must be > 0, got: " + workerThreads);
        }
        if (summaryTimeoutMillis <= 0) {
            errors.add("summaryTimeoutMillis must be > 0, got: " + summaryTimeoutMillis);
        }
        if (resampleSeconds <= 0) {
            errors.add("resampleSeconds must be > 0, got: " + resampleSeconds);
        }
        for (int i = 0; i < defaultMetrics.size(); i++) {
            String metric = defaultMetrics.get(i);
            if (metric == null || metric.isBlank()) {
                errors.add("defaultMetrics[" + i + "] must not be blank");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "RCA configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML needs setters)
    // ---------------------------------------------------------------

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public void setAnomalyThreshold(double anomalyThreshold) {
        this.anomalyThreshold = anomalyThreshold;
    }

    public double getCorrelationThreshold() {
        return correlationThreshold;
    }

    public void setCorrelationThreshold(double correlationThreshold) {
        this.correlationThreshold = correlationThreshold;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public long getSummaryTimeoutMillis() {
        return summaryTimeoutMillis;
    }

    public void setSummaryTimeoutMillis(long summaryTimeoutMillis) {
        this.summaryTimeoutMillis = summaryTimeoutMillis;
    }

    public int getResampleSeconds() {
        return resampleSeconds;
    }

    public void setResampleSeconds(int resampleSeconds) {
        this.resampleSeconds = resampleSeconds;
    }

    /**
     * Metrics an operator expects to query by default. Informational only; the
     * engine analyses whatever series it is given.
     *
     * @return unmodifiable list of metric names
     */
    public List<String> getDefaultMetrics() {
        return Collections.unmodifiableList(defaultMetrics);
    }

    public void setDefaultMetrics(List<String> defaultMetrics) {
        this.defaultMetrics = defaultMetrics != null ? new ArrayList<>(defaultMetrics) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "RcaSettings{" +
                "anomalyThreshold=" + anomalyThreshold +
                ", correlationThreshold=" + correlationThreshold +
                ", workerThreads=" + workerThreads +
                ", summaryTimeoutMillis=" + summaryTimeoutMillis +
                ", resampleSeconds=" + resampleSeconds +
                ", defaultMetrics=" + defaultMetrics +
                '}';
    }
}
