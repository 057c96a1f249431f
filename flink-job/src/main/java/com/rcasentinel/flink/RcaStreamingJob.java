package com.rcasentinel.flink;

import com.rcasentinel.core.config.AnalysisConfig;
import com.rcasentinel.core.config.RcaSettings;
import com.rcasentinel.core.config.RcaSettingsLoader;
import com.rcasentinel.core.model.AnalysisResult;
import com.rcasentinel.core.model.MetricSample;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point for the RCA Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (metrics topic)
 *     -&gt; Deserialize JSON -&gt; MetricSample
 *     -&gt; Key by scope
 *     -&gt; Tumbling event-time window
 *     -&gt; RcaWindowFunction (detection, correlation, ranking)
 *     -&gt; Serialize AnalysisResult -&gt; JSON
 *     -&gt; Kafka (results topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring is resolved from environment variables via {@link JobConfig};
 * analysis settings come from the YAML file it names, or the bundled
 * {@code rca.yml}.
 * </p>
 *
 * <h3>Object reuse</h3>
 * <p>
 * Object reuse is enabled so the window operator hands its results to the
 * chained Kafka sink without a serializer copy. Results are immutable once
 * built.
 * </p>
 *
 * @since 1.0.0
 */
public final class RcaStreamingJob {

    private static final Logger LOG = LoggerFactory.getLogger(RcaStreamingJob.class);

    private RcaStreamingJob() {
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting RCA Sentinel with config: {}", config);

        // 2. Load analysis settings
        RcaSettings settings = loadSettings(config);

        // 3. Start health server (for K8s probes) with shutdown hook
        HealthServer healthServer = new HealthServer(AnalysisConfig.from(settings));
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        // 4. Set up Flink execution environment
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        env.getConfig().enableObjectReuse();
        configureCheckpointing(env, config);

        // 5. Build pipeline
        buildPipeline(env, config, settings);

        // 6. Execute
        env.execute("RCA Sentinel - Root Cause Analysis");
    }

    // ---------------------------------------------------------------
    // Pipeline assembly
    // ---------------------------------------------------------------

    /**
     * Build the full Kafka -&gt; Flink -&gt; Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config, RcaSettings settings) {
        KafkaSource<MetricSample> kafkaSource = KafkaSource.<MetricSample>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaInputTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new MetricSampleDeserializationSchema())
                .build();

        DataStream<MetricSample> samples = env.fromSource(
                kafkaSource,
                watermarkStrategy(config),
                "kafka-metrics-source");

        DataStream<AnalysisResult> results = samples
                .filter(Objects::nonNull) // drop deserialization failures
                .keyBy(MetricSample::resolvedScope)
                .window(TumblingEventTimeWindows.of(Time.minutes(config.getWindowMinutes())))
                .process(new RcaWindowFunction(settings))
                .returns(TypeInformation.of(AnalysisResult.class))
                .name("root-cause-analysis");

        KafkaSink<AnalysisResult> kafkaSink = KafkaSink.<AnalysisResult>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaResultTopic())
                                .setValueSerializationSchema(new AnalysisResultSerializationSchema())
                                .build())
                .build();

        results.sinkTo(kafkaSink).name("kafka-results-sink");
    }

    /**
     * Event time is the sample timestamp (epoch seconds) in milliseconds.
     */
    static WatermarkStrategy<MetricSample> watermarkStrategy(JobConfig config) {
        return WatermarkStrategy
                .<MetricSample>forBoundedOutOfOrderness(Duration.ofSeconds(config.getMaxOutOfOrdernessSeconds()))
                .withTimestampAssigner((sample, recordTimestamp) -> eventTimeMillis(sample, recordTimestamp))
                .withIdleness(Duration.ofMinutes(1));
    }

    static long eventTimeMillis(MetricSample sample, long recordTimestamp) {
        if (sample == null || !Double.isFinite(sample.getTimestamp())) {
            return recordTimestamp;
        }
        return Math.round(sample.getTimestamp() * 1000.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RcaSettings loadSettings(JobConfig config) {
        String path = config.getRcaConfigPath();
        if (path != null && !path.isBlank()) {
            return RcaSettingsLoader.fromFile(path);
        }
        return RcaSettingsLoader.load();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        // Retain checkpoints on cancellation so state can be restored
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
