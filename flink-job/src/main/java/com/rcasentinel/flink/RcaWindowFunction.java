package com.rcasentinel.flink;

import com.rcasentinel.core.analysis.RcaCoordinator;
import com.rcasentinel.core.config.RcaSettings;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.MetricSample;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.windowing.ProcessWindowFunction;
import org.apache.flink.streaming.api.windowing.windows.TimeWindow;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Flink {@link ProcessWindowFunction} that analyses every closed window of
 * metric samples for one scope and emits an {@link AnalysisResult}.
 *
 * <h3>Lifecycle</h3>
 * <ul>
 * <li>{@link #open(Configuration)} - builds the {@link RcaCoordinator} from
 * the serialized settings and registers metrics</li>
 * <li>{@link #process} - groups samples into series and runs the
 * analysis</li>
 * <li>{@link #close()} - shuts down the coordinator's worker pools</li>
 * </ul>
 *
 * <p>
 * A failing analysis is logged and counted; the window emits nothing and
 * the pipeline keeps running.
 * </p>
 */
public class RcaWindowFunction
        extends ProcessWindowFunction<MetricSample, AnalysisResult, String, TimeWindow> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RcaWindowFunction.class);

    private final RcaSettings settings;

    private transient RcaCoordinator coordinator;
    private transient WindowAnalyzer analyzer;
    private transient RcaMetrics metrics;

    public RcaWindowFunction(RcaSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);
        coordinator = RcaCoordinator.builder().settings(settings).build();
        analyzer = new WindowAnalyzer(coordinator);
        metrics = new RcaMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("RcaWindowFunction opened with {}", coordinator.getConfig());
    }

    @Override
    public void process(String scope, Context context, Iterable<MetricSample> samples,
            Collector<AnalysisResult> out) {
        TimeWindow window = context.window();
        long start = System.nanoTime();
        try {
            Optional<AnalysisResult> result = analyzer.analyze(scope, samples, window.getStart(), window.getEnd());
            if (result.isEmpty()) {
                return;
            }
            AnalysisResult analysis = result.get();
            metrics.incrementSamplesProcessed(countSamples(samples));
            metrics.incrementWindowsAnalyzed();
            metrics.incrementAnomalousMetrics(analysis.getAnomalies().size());
            out.collect(analysis);
        } catch (Exception e) {
            metrics.incrementWindowsFailed();
            LOG.error("Analysis of window [{}, {}) for scope '{}' failed: {}",
                    window.getStart(), window.getEnd(), scope, e.getMessage(), e);
        } finally {
            metrics.recordLatency((System.nanoTime() - start) / 1_000_000);
        }
    }

    @Override
    public void close() throws Exception {
        if (coordinator != null) {
            coordinator.close();
        }
        super.close();
    }

    private static long countSamples(Iterable<MetricSample> samples) {
        long count = 0;
        for (MetricSample ignored : samples) {
            count++;
        }
        return count;
    }
}
