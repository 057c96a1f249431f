package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.AnomalyReport;
import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.model.MetricSeries;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-sample output of the detection ensemble for one metric.
 *
 * <p>
 * Holds the score vector of every {@link DetectionMethod} and the composite
 * score, the weighted sum of those vectors. Values refer to the metric's clean
 * samples, in time order.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleScores {

    private final String metric;
    private final double[] timestamps;
    private final EnumMap<DetectionMethod, double[]> methodScores;
    private final double[] composite;

    EnsembleScores(String metric, double[] timestamps, Map<DetectionMethod, double[]> methodScores) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.timestamps = timestamps.clone();
        this.methodScores = new EnumMap<>(DetectionMethod.class);
        this.composite = new double[timestamps.length];

        for (DetectionMethod method : DetectionMethod.values()) {
            double[] scores = methodScores.get(method);
            if (scores == null) {
                scores = new double[timestamps.length];
            } else if (scores.length != timestamps.length) {
                throw new IllegalArgumentException(method + " produced " + scores.length
                        + " scores for " + timestamps.length + " samples of '" + metric + "'");
            }
            this.methodScores.put(method, scores.clone());
            for (int i = 0; i < composite.length; i++) {
                composite[i] += method.weight() * scores[i];
            }
        }
    }

    public String getMetric() {
        return metric;
    }

    public int size() {
        return composite.length;
    }

    /**
     * @return weighted composite score per sample
     */
    public double[] composite() {
        return composite.clone();
    }

    /**
     * @return the raw scores of one ensemble member
     */
    public double[] scores(DetectionMethod method) {
        return methodScores.get(method).clone();
    }

    public double stationarityScore() {
        double[] scores = methodScores.get(DetectionMethod.STATIONARITY);
        return scores.length == 0 ? 0.0 : scores[0];
    }

    /**
     * @param threshold composite cut-off
     * @return {@code true} for each sample whose composite exceeds the cut-off
     */
    public boolean[] flagged(double threshold) {
        boolean[] flagged = new boolean[composite.length];
        for (int i = 0; i < composite.length; i++) {
            flagged[i] = composite[i] > threshold;
        }
        return flagged;
    }

    /**
     * Summarize the flagged samples as an {@link AnomalyReport}.
     *
     * @param threshold composite cut-off
     * @return the report, or empty if no sample exceeds the cut-off
     */
    public Optional<AnomalyReport> toReport(double threshold) {
        boolean[] flagged = flagged(threshold);
        AnomalyReport.Builder builder = AnomalyReport.builder(metric)
                .stationarityScore(stationarityScore());
        Map<DetectionMethod, Integer> counts = new EnumMap<>(DetectionMethod.class);
        boolean any = false;

        for (int i = 0; i < flagged.length; i++) {
            if (!flagged[i]) {
                continue;
            }
            any = true;
            builder.flaggedPoint(MetricSeries.toInstant(timestamps[i]), composite[i]);
            for (Map.Entry<DetectionMethod, double[]> e : methodScores.entrySet()) {
                if (e.getKey().isFlagging() && e.getValue()[i] > 0.0) {
                    counts.merge(e.getKey(), 1, Integer::sum);
                }
            }
        }
        if (!any) {
            return Optional.empty();
        }
        counts.forEach(builder::methodCount);
        return Optional.of(builder.build());
    }
}
