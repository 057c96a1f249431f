package com.rcasentinel.core.analysis;

import com.rcasentinel.core.config.AnalysisConfig;
import com.rcasentinel.core.config.RcaSettings;
import com.rcasentinel.core.config.Thresholds;
import com.rcasentinel.core.correlation.CorrelationAnalyzer;
import com.rcasentinel.core.detection.AnomalyDetector;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.AnalysisStatistics;
import com.rcasentinel.core.model.AnomalyReport;
import com.rcasentinel.core.model.CorrelationEdge;
import com.rcasentinel.core.model.MetricSeries;
import com.rcasentinel.core.model.RootCauseCandidate;
import com.rcasentinel.core.model.TimeRange;
import com.rcasentinel.core.ranking.RootCauseRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a complete root-cause analysis.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>reject an empty metric map with {@link NoDataException}</li>
 * <li>take one {@link Thresholds} snapshot for the whole run</li>
 * <li>detect anomalies, one metric per worker</li>
 * <li>once detection is complete, build the correlation graph and the
 * causality screen</li>
 * <li>rank candidates</li>
 * <li>summarize, falling back to a template when the summarizer fails, times
 * out or returns nothing</li>
 * </ol>
 *
 * <p>
 * Apart from the shared {@link AnalysisConfig} the coordinator holds no
 * mutable state, so concurrent {@code analyze} calls are independent. It
 * owns two thread pools and must be {@linkplain #close() closed}.
 * </p>
 *
 * @since 1.0.0
 */
public class RcaCoordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RcaCoordinator.class);

    private final AnalysisConfig config;
    private final Summarizer summarizer;
    private final long summaryTimeoutMillis;
    private final Clock clock;

    private final ExecutorService detectionPool;
    private final ExecutorService summaryPool;
    private final AnomalyDetector detector;
    private final CorrelationAnalyzer correlator;
    private final RootCauseRanker ranker;
    private final IncidentAdvisor advisor;

    private RcaCoordinator(Builder b) {
        this.config = b.config != null ? b.config : AnalysisConfig.from(b.settings);
        this.summarizer = b.summarizer;
        this.summaryTimeoutMillis = b.settings.getSummaryTimeoutMillis();
        this.clock = b.clock;

        this.detectionPool = Executors.newFixedThreadPool(b.settings.getWorkerThreads(),
                daemonThreads("rca-detect"));
        this.summaryPool = Executors.newCachedThreadPool(daemonThreads("rca-summary"));
        this.detector = new AnomalyDetector(detectionPool);
        this.correlator = new CorrelationAnalyzer(b.settings.getResampleSeconds());
        this.ranker = new RootCauseRanker();
        this.advisor = new IncidentAdvisor(b.settings.getDefaultMetrics());

        LOG.info("RCA coordinator started: workers={}, summaryTimeout={}ms, summarizer={}, {}",
                b.settings.getWorkerThreads(), summaryTimeoutMillis, summarizer != null, config);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RcaCoordinator}. Every property is optional.
     */
    public static final class Builder {
        private RcaSettings settings = new RcaSettings();
        private AnalysisConfig config;
        private Summarizer summarizer;
        private Clock clock = Clock.systemUTC();

        /**
         * Worker count, summary timeout, grid width, default metrics, and the
         * initial thresholds when no {@link #config(AnalysisConfig)} is given.
         */
        public Builder settings(RcaSettings settings) {
            Objects.requireNonNull(settings, "settings must not be null").validate();
            this.settings = settings;
            return this;
        }

        /**
         * Share an existing threshold cell, e.g. one updated by an admin API.
         */
        public Builder config(AnalysisConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder summarizer(Summarizer summarizer) {
            this.summarizer = summarizer;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public RcaCoordinator build() {
            return new RcaCoordinator(this);
        }
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Analyse {@code metrics}; the reported time range is the span of their
     * samples.
     *
     * @throws NoDataException if {@code metrics} is empty
     */
    public AnalysisResult analyze(Map<String, MetricSeries> metrics) {
        return analyze(metrics, null);
    }

    /**
     * @param metrics   metric name to series; must not be empty
     * @param timeRange requested window, or {@code null} to derive it from the
     *                  samples
     * @return the analysis result
     * @throws NoDataException       if {@code metrics} is empty
     * @throws IllegalArgumentException if a key differs from its series name
     */
    public AnalysisResult analyze(Map<String, MetricSeries> metrics, TimeRange timeRange) {
        Objects.requireNonNull(metrics, "metrics must not be null");
        if (metrics.isEmpty()) {
            throw new NoDataException("No metric data supplied for analysis");
        }
        requireKeysMatchNames(metrics);
        long started = System.nanoTime();
        Thresholds thresholds = config.snapshot();
        LOG.info("Starting root-cause analysis of {} metric(s) with {}", metrics.size(), thresholds);

        Map<String, AnomalyReport> anomalies = detector.detect(metrics, thresholds.getAnomalyThreshold());
        LOG.info("Detected anomalies in {} metric(s)", anomalies.size());

        Map<String, List<CorrelationEdge>> correlations =
                correlator.correlate(metrics, thresholds.getCorrelationThreshold());
        Map<String, List<String>> causes = correlator.detectCausalRelationships(metrics);

        List<RootCauseCandidate> candidates = ranker.rank(anomalies, correlations, causes);
        String summary = summarize(anomalies, correlations, candidates);

        double duration = (System.nanoTime() - started) / 1_000_000_000.0;
        AnalysisResult result = AnalysisResult.builder()
                .anomalies(anomalies)
                .correlations(correlations)
                .causalRelationships(causes)
                .candidates(candidates)
                .summary(summary)
                .statistics(new AnalysisStatistics(metrics.size(), anomalies.size(),
                        CorrelationAnalyzer.countPairs(correlations), duration))
                .timeRange(timeRange != null ? timeRange : TimeRange.covering(metrics.values()).orElse(null))
                .metricsAnalyzed(List.copyOf(new TreeMap<>(metrics).keySet()))
                .analysisTime(clock.instant())
                .build();

        LOG.info("Root-cause analysis finished in {}s: {} candidate(s){}", duration, candidates.size(),
                candidates.isEmpty() ? "" : ", top=" + candidates.get(0).getMetric());
        return result;
    }

    /**
     * Analyse an incident reported against specific services.
     *
     * @param metrics          metric name to series; must not be empty
     * @param affectedServices services reported as affected; must not be empty
     * @param symptoms         reported symptoms; must not be empty
     * @param timeRange        requested window, or {@code null}
     * @return the analysis result with an incident section
     * @throws IllegalArgumentException if services or symptoms are empty
     * @throws NoDataException          if {@code metrics} is empty
     */
    public AnalysisResult analyzeIncident(Map<String, MetricSeries> metrics, List<String> affectedServices,
            List<String> symptoms, TimeRange timeRange) {
        Objects.requireNonNull(affectedServices, "affectedServices must not be null");
        Objects.requireNonNull(symptoms, "symptoms must not be null");
        if (affectedServices.isEmpty()) {
            throw new IllegalArgumentException("At least one affected service is required");
        }
        if (symptoms.isEmpty()) {
            throw new IllegalArgumentException("At least one symptom is required");
        }
        LOG.info("Analysing incident: services={}, symptoms={}", affectedServices, symptoms);

        AnalysisResult result = analyze(metrics, timeRange);
        return result.toBuilder()
                .incidentAnalysis(advisor.assess(affectedServices, symptoms, result.getCandidates()))
                .build();
    }

    public AnalysisResult analyzeIncident(Map<String, MetricSeries> metrics, List<String> affectedServices,
            List<String> symptoms) {
        return analyzeIncident(metrics, affectedServices, symptoms, null);
    }

    /**
     * @return metrics worth collecting for the given symptoms
     */
    public List<String> relevantMetrics(List<String> symptoms) {
        return advisor.relevantMetrics(symptoms);
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        detectionPool.shutdownNow();
        summaryPool.shutdownNow();
        LOG.info("RCA coordinator stopped");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String summarize(Map<String, AnomalyReport> anomalies,
            Map<String, List<CorrelationEdge>> correlations,
            List<RootCauseCandidate> candidates) {
        if (candidates.isEmpty()) {
            return FallbackSummary.NO_ANOMALY_PATTERN;
        }
        if (summarizer == null) {
            return FallbackSummary.fromCandidates(candidates);
        }

        Future<String> call = summaryPool.submit(() -> summarizer.summarize(anomalies, correlations, candidates));
        try {
            String text = call.get(summaryTimeoutMillis, TimeUnit.MILLISECONDS);
            if (text != null && !text.isBlank()) {
                return text;
            }
            LOG.warn("Summarizer returned no text, using fallback summary");
        } catch (TimeoutException e) {
            call.cancel(true);
            LOG.warn("Summarizer did not answer within {}ms, using fallback summary", summaryTimeoutMillis);
        } catch (ExecutionException e) {
            LOG.warn("Summarizer failed, using fallback summary", e.getCause());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for summarizer, using fallback summary");
        }
        return FallbackSummary.fromCandidates(candidates);
    }

    // every section of the result is keyed by series name
    private static void requireKeysMatchNames(Map<String, MetricSeries> metrics) {
        metrics.forEach((key, series) -> {
            Objects.requireNonNull(series, "series for metric '" + key + "' must not be null");
            if (!key.equals(series.getName())) {
                throw new IllegalArgumentException("Metric key '" + key
                        + "' does not match series name '" + series.getName() + "'");
            }
        });
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
