package com.rcasentinel.flink;

import com.rcasentinel.core.analysis.RcaCoordinator;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.MetricSample;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one root-cause analysis over the samples of a closed event-time
 * window. Kept free of Flink runtime types so it can be exercised directly.
 */
public class WindowAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(WindowAnalyzer.class);

    private final RcaCoordinator coordinator;

    public WindowAnalyzer(RcaCoordinator coordinator) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
    }

    /**
     * @param scope       window key, used for logging only
     * @param samples     samples assigned to the window
     * @param startMillis window start, inclusive
     * @param endMillis   window end, exclusive
     * @return the result, or empty when the window holds no usable sample
     */
    public Optional<AnalysisResult> analyze(String scope, Iterable<MetricSample> samples,
            long startMillis, long endMillis) {
        List<MetricSample> collected = new ArrayList<>();
        for (MetricSample sample : samples) {
            collected.add(sample);
        }
        Map<String, MetricSeries> series = MetricSeries.fromSamples(collected);
        if (series.isEmpty()) {
            LOG.debug("Window [{}, {}) of scope '{}' holds no usable sample - skipping",
                    startMillis, endMillis, scope);
            return Optional.empty();
        }

        TimeRange range = TimeRange.of(Instant.ofEpochMilli(startMillis), Instant.ofEpochMilli(endMillis));
        LOG.info("Analysing scope '{}': {} sample(s) across {} metric(s) in {}",
                scope, collected.size(), series.size(), range);
        return Optional.of(coordinator.analyze(series, range));
    }
}
