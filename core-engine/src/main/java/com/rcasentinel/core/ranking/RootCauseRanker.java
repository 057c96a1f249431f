package com.rcasentinel.core.ranking;

import com.rcasentinel.core.model.AnomalyReport;
import com.rcasentinel.core.model.CorrelationEdge;
import com.rcasentinel.core.model.RootCauseCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns anomaly reports and the correlation graph into ranked root-cause
 * candidates.
 *
 * <h3>Confidence</h3>
 *
 * <pre>
 * confidence  = min(1, base + count + correlation + consistency)
 * base        = min(max_score, 1)
 * count       = min(anomaly_count / 20, 0.3)
 * correlation = min(related_metrics * 0.05, 0.2)
 * consistency = min(agreeing_methods * 0.05, 0.15)
 * </pre>
 *
 * <p>
 * Candidates are ordered by confidence, then anomaly count, both descending,
 * then by metric name. At most {@value #MAX_CANDIDATES} are returned.
 * </p>
 *
 * @since 1.0.0
 */
public class RootCauseRanker {

    private static final Logger LOG = LoggerFactory.getLogger(RootCauseRanker.class);

    public static final int MAX_CANDIDATES = 5;

    static final Comparator<RootCauseCandidate> ORDER = Comparator
            .comparingDouble(RootCauseCandidate::getConfidence).reversed()
            .thenComparing(Comparator.comparingInt(RootCauseCandidate::getAnomalyCount).reversed())
            .thenComparing(RootCauseCandidate::getMetric);

    /**
     * Rank without causality information.
     */
    public List<RootCauseCandidate> rank(Map<String, AnomalyReport> anomalies,
            Map<String, List<CorrelationEdge>> correlations) {
        return rank(anomalies, correlations, Map.of());
    }

    /**
     * @param anomalies    metric to anomaly report
     * @param correlations metric to correlation edges
     * @param causes       metric to metrics that lead it; attached to the
     *                     candidates, does not change confidence
     * @return at most {@value #MAX_CANDIDATES} candidates, best first
     */
    public List<RootCauseCandidate> rank(Map<String, AnomalyReport> anomalies,
            Map<String, List<CorrelationEdge>> correlations,
            Map<String, List<String>> causes) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Objects.requireNonNull(correlations, "correlations must not be null");
        Objects.requireNonNull(causes, "causes must not be null");

        List<RootCauseCandidate> candidates = new ArrayList<>();
        for (AnomalyReport report : anomalies.values()) {
            if (report.getCount() == 0) {
                continue;
            }
            List<CorrelationEdge> related = correlations.getOrDefault(report.getMetric(), List.of());
            candidates.add(RootCauseCandidate.builder()
                    .metric(report.getMetric())
                    .confidence(confidence(report, related.size()))
                    .anomalyCount(report.getCount())
                    .firstOccurrence(report.getFirstOccurrence())
                    .relatedMetrics(related)
                    .potentialCauses(causes.getOrDefault(report.getMetric(), List.of()))
                    .description(MetricCategory.of(report.getMetric()).describe(report.getMetric(),
                            report.getCount(), report.getMaxScore(), report.getAvgScore()))
                    .build());
        }

        candidates.sort(ORDER);
        List<RootCauseCandidate> top = List.copyOf(candidates.subList(0, Math.min(MAX_CANDIDATES, candidates.size())));
        LOG.debug("Ranked {} candidate(s), kept {}", candidates.size(), top.size());
        return top;
    }

    static double confidence(AnomalyReport report, int relatedMetrics) {
        double base = Math.min(report.getMaxScore(), 1.0);
        double count = Math.min(report.getCount() / 20.0, 0.3);
        double correlation = Math.min(relatedMetrics * 0.05, 0.2);
        double consistency = Math.min(report.agreeingMethodCount() * 0.05, 0.15);
        return Math.max(0.0, Math.min(1.0, base + count + correlation + consistency));
    }
}
