package com.rcasentinel.core.analysis;

import com.rcasentinel.core.model.IncidentAnalysis;
import com.rcasentinel.core.model.RootCauseCandidate;
import com.rcasentinel.core.ranking.MetricCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Incident-oriented helpers: which metrics matter for the reported symptoms,
 * and what to do about the top candidate.
 *
 * <h3>Symptom keywords</h3>
 * <p>
 * Each symptom adds the metrics of its first matching group:
 * </p>
 * <ul>
 * <li>{@code slow}, {@code latency}: kubelet HTTP request duration</li>
 * <li>{@code error}, {@code fail}: container restarts</li>
 * <li>{@code cpu}: container and node CPU</li>
 * <li>{@code memory}: container working set and node free memory</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class IncidentAdvisor {

    static final String NO_CANDIDATE_ADVICE =
            "Review service configuration and resource allocation, and monitor changes in system load.";
    static final String GENERAL_ADVICE = "Perform a detailed system check and log analysis.";

    private final List<String> defaultMetrics;

    public IncidentAdvisor(List<String> defaultMetrics) {
        this.defaultMetrics = List.copyOf(Objects.requireNonNull(defaultMetrics, "defaultMetrics must not be null"));
    }

    /**
     * @param symptoms free-text symptoms
     * @return default metrics plus the symptom-specific ones, in name order
     */
    public List<String> relevantMetrics(List<String> symptoms) {
        TreeSet<String> metrics = new TreeSet<>(defaultMetrics);
        for (String symptom : symptoms) {
            String lower = symptom.toLowerCase(Locale.ROOT);
            if (lower.contains("slow") || lower.contains("latency")) {
                metrics.add("kubelet_http_requests_duration_seconds_sum");
                metrics.add("kubelet_http_requests_duration_seconds_count");
            } else if (lower.contains("error") || lower.contains("fail")) {
                metrics.add("kube_pod_container_status_restarts_total");
            } else if (lower.contains("cpu")) {
                metrics.add("container_cpu_usage_seconds_total");
                metrics.add("node_cpu_seconds_total");
            } else if (lower.contains("memory")) {
                metrics.add("container_memory_working_set_bytes");
                metrics.add("node_memory_MemFree_bytes");
            }
        }
        return List.copyOf(metrics);
    }

    /**
     * @param candidates ranked candidates, best first
     * @return remediation advice for the top candidate
     */
    public String recommend(List<RootCauseCandidate> candidates) {
        if (candidates.isEmpty()) {
            return NO_CANDIDATE_ADVICE;
        }
        RootCauseCandidate top = candidates.get(0);
        List<String> advice = new ArrayList<>();
        MetricCategory.of(top.getMetric()).recommendation().ifPresent(advice::add);

        if (top.getConfidence() > 0.8) {
            advice.add(String.format(Locale.ROOT,
                    "Root-cause confidence is high (%.2f); address this issue first", top.getConfidence()));
        } else if (top.getConfidence() < 0.5) {
            advice.add("Root-cause confidence is low; investigate further before acting");
        }
        return advice.isEmpty() ? GENERAL_ADVICE : String.join("; ", advice);
    }

    public IncidentAnalysis assess(List<String> affectedServices, List<String> symptoms,
            List<RootCauseCandidate> candidates) {
        return new IncidentAnalysis(affectedServices, symptoms, relevantMetrics(symptoms), recommend(candidates));
    }
}
