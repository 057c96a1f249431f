package com.rcasentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide, mutable analysis thresholds.
 *
 * <p>
 * Holds an immutable {@link Thresholds} value in an {@link AtomicReference}.
 * Every update validates the new value first and then swaps the whole
 * snapshot in a single write, so a concurrent reader sees either the old or
 * the new pair, never a mix of both.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is thread-safe. Analyses call {@link #snapshot()} once at the
 * start of a run and use that snapshot throughout.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfig {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfig.class);

    private final AtomicReference<Thresholds> current;

    public AnalysisConfig() {
        this(Thresholds.defaults());
    }

    public AnalysisConfig(Thresholds initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial thresholds must not be null"));
    }

    /**
     * @param settings validated settings
     * @return a config seeded with the thresholds from {@code settings}
     * @throws ConfigValidationException if a threshold is out of range
     */
    public static AnalysisConfig from(RcaSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new AnalysisConfig(new Thresholds(settings.getAnomalyThreshold(),
                settings.getCorrelationThreshold()));
    }

    /**
     * @return the thresholds in effect right now
     */
    public Thresholds snapshot() {
        return current.get();
    }

    public double getAnomalyThreshold() {
        return current.get().getAnomalyThreshold();
    }

    public double getCorrelationThreshold() {
        return current.get().getCorrelationThreshold();
    }

    /**
     * Replace the anomaly threshold.
     *
     * @param threshold new value in (0, 1]
     * @throws ConfigValidationException if {@code threshold} is out of range;
     *                                   the active value is unchanged
     */
    public void setAnomalyThreshold(double threshold) {
        Thresholds.requireUnitInterval("anomaly_threshold", threshold);
        Thresholds updated = current.updateAndGet(t -> t.withAnomalyThreshold(threshold));
        LOG.info("Anomaly threshold updated to {}", updated.getAnomalyThreshold());
    }

    /**
     * Replace the correlation threshold.
     *
     * @param threshold new value in (0, 1]
     * @throws ConfigValidationException if {@code threshold} is out of range;
     *                                   the active value is unchanged
     */
    public void setCorrelationThreshold(double threshold) {
        Thresholds.requireUnitInterval("correlation_threshold", threshold);
        Thresholds updated = current.updateAndGet(t -> t.withCorrelationThreshold(threshold));
        LOG.info("Correlation threshold updated to {}", updated.getCorrelationThreshold());
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" + current.get() + '}';
    }
}
