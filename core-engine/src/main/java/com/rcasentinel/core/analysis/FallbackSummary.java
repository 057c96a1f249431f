package com.rcasentinel.core.analysis;

import com.rcasentinel.core.model.RootCauseCandidate;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Summaries that need no external collaborator.
 *
 * @since 1.0.0
 */
public final class FallbackSummary {

    public static final String NO_ANOMALY_PATTERN =
            "No obvious anomaly pattern was found; the system appears to be operating normally.";

    private FallbackSummary() {
    }

    /**
     * Template summary built only from the ranked candidates.
     *
     * @param candidates ranked candidates, best first
     * @return summary text
     */
    public static String fromCandidates(List<RootCauseCandidate> candidates) {
        if (candidates.isEmpty()) {
            return NO_ANOMALY_PATTERN;
        }
        RootCauseCandidate top = candidates.get(0);
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT,
                "Detected anomalies in %d candidate metric(s). Most likely root cause: %s (confidence %.2f). %s",
                candidates.size(), top.getMetric(), top.getConfidence(), top.getDescription()));
        if (!top.getRelatedMetrics().isEmpty()) {
            sb.append(". Correlated with: ")
                    .append(top.getRelatedMetrics().stream()
                            .map(e -> String.format(Locale.ROOT, "%s (%.3f)", e.getMetricB(), e.getCoefficient()))
                            .collect(Collectors.joining(", ")));
        }
        if (candidates.size() > 1) {
            sb.append(". Other candidates: ")
                    .append(candidates.subList(1, candidates.size()).stream()
                            .map(c -> String.format(Locale.ROOT, "%s (%.2f)", c.getMetric(), c.getConfidence()))
                            .collect(Collectors.joining(", ")));
        }
        return sb.append('.').toString();
    }
}
