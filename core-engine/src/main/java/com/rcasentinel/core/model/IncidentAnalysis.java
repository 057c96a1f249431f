package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Incident-specific section attached to an {@link AnalysisResult} when the
 * caller reports affected services and symptoms.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"affected_services", "reported_symptoms", "relevant_metrics", "recommendation"})
public final class IncidentAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> affectedServices;
    private final List<String> reportedSymptoms;
    private final List<String> relevantMetrics;
    private final String recommendation;

    public IncidentAnalysis(List<String> affectedServices, List<String> reportedSymptoms,
            List<String> relevantMetrics, String recommendation) {
        this.affectedServices = Collections.unmodifiableList(new ArrayList<>(affectedServices));
        this.reportedSymptoms = Collections.unmodifiableList(new ArrayList<>(reportedSymptoms));
        this.relevantMetrics = Collections.unmodifiableList(new ArrayList<>(relevantMetrics));
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation must not be null");
    }

    @JsonProperty("affected_services")
    public List<String> getAffectedServices() {
        return affectedServices;
    }

    @JsonProperty("reported_symptoms")
    public List<String> getReportedSymptoms() {
        return reportedSymptoms;
    }

    @JsonProperty("relevant_metrics")
    public List<String> getRelevantMetrics() {
        return relevantMetrics;
    }

    @JsonProperty("recommendation")
    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IncidentAnalysis that))
            return false;
        return affectedServices.equals(that.affectedServices)
                && reportedSymptoms.equals(that.reportedSymptoms)
                && relevantMetrics.equals(that.relevantMetrics)
                && recommendation.equals(that.recommendation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(affectedServices, reportedSymptoms, relevantMetrics, recommendation);
    }

    @Override
    public String toString() {
        return "IncidentAnalysis{" +
                "affectedServices=" + affectedServices +
                ", reportedSymptoms=" + reportedSymptoms +
                ", recommendation='" + recommendation + '\'' +
                '}';
    }
}
