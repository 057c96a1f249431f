package com.rcasentinel.core.ranking;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Infrastructure area a metric belongs to, inferred from keywords in its
 * name. Categories are matched in declaration order, so a metric named
 * {@code node_cpu_seconds_total} is {@link #CPU}, not {@link #NODE}.
 *
 * @since 1.0.0
 */
public enum MetricCategory {

    CPU("CPU usage anomaly",
            "Check CPU usage and consider scaling out or optimizing application performance",
            "cpu"),
    MEMORY("Memory usage anomaly",
            "Check memory usage; the memory limit may need raising or memory use optimizing",
            "memory"),
    RESTART("Container restart anomaly",
            "Check why containers restart and review related logs and health-check configuration",
            "restart"),
    NETWORK("Network/HTTP request anomaly",
            "Check network connectivity and inter-service communication, and review load-balancer configuration",
            "network", "http", "request"),
    DISK("Disk/storage anomaly", null, "disk", "storage"),
    NODE("Node metric anomaly", null, "node"),
    POD("Pod status anomaly", null, "pod"),
    GENERIC(null, null);

    private final String headline;
    private final String recommendation;
    private final String[] keywords;

    MetricCategory(String headline, String recommendation, String... keywords) {
        this.headline = headline;
        this.recommendation = recommendation;
        this.keywords = keywords;
    }

    /**
     * @param metric metric name; must not be {@code null}
     * @return first category with a keyword contained in the name, or
     *         {@link #GENERIC}
     */
    public static MetricCategory of(String metric) {
        Objects.requireNonNull(metric, "metric must not be null");
        String lower = metric.toLowerCase(Locale.ROOT);
        for (MetricCategory category : values()) {
            for (String keyword : category.keywords) {
                if (lower.contains(keyword)) {
                    return category;
                }
            }
        }
        return GENERIC;
    }

    /**
     * Human-readable description of an anomalous metric in this category.
     */
    public String describe(String metric, int count, double maxScore, double avgScore) {
        String prefix = headline != null ? headline : "Metric " + metric + " anomaly";
        return String.format(Locale.ROOT,
                "%s: %d anomalous points detected, max anomaly score %.2f, average anomaly score %.2f",
                prefix, count, maxScore, avgScore);
    }

    /**
     * @return remediation hint for incidents rooted in this category, if any
     */
    public Optional<String> recommendation() {
        return Optional.ofNullable(recommendation);
    }
}
