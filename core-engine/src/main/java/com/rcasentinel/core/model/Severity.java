package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a metric's anomalies, derived from its maximum composite score.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * @param maxScore maximum composite score among flagged samples
     * @return {@code HIGH} above 0.8, {@code MEDIUM} above 0.6, else {@code LOW}
     */
    public static Severity fromMaxScore(double maxScore) {
        if (maxScore > 0.8) {
            return HIGH;
        }
        if (maxScore > 0.6) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
