package com.rcasentinel.core.analysis;

import com.rcasentinel.core.model.AnomalyReport;
import com.rcasentinel.core.model.CorrelationEdge;
import com.rcasentinel.core.model.RootCauseCandidate;

import java.util.List;
import java.util.Map;

/**
 * External collaborator that writes a free-text summary of an analysis,
 * typically backed by a language model.
 *
 * <p>
 * Implementations may be slow, may throw, and may return blank text; the
 * coordinator bounds each call with a timeout and falls back to
 * {@link FallbackSummary} in every one of those cases.
 * </p>
 */
@FunctionalInterface
public interface Summarizer {

    /**
     * @param anomalies    metric to anomaly report
     * @param correlations metric to correlation edges
     * @param candidates   ranked root-cause candidates, never empty
     * @return summary text
     * @throws Exception on any failure
     */
    String summarize(Map<String, AnomalyReport> anomalies,
            Map<String, List<CorrelationEdge>> correlations,
            List<RootCauseCandidate> candidates) throws Exception;
}
