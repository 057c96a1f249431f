package com.rcasentinel.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the RCA Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configured through Kubernetes Deployment env vars, Docker
 * {@code -e} flags or a shell environment. Analysis settings (thresholds,
 * worker threads, default metrics) live in the YAML file named by
 * {@code RCA_CONFIG_PATH}; this class only carries its path.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaResultTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final int windowMinutes;
    private final int maxOutOfOrdernessSeconds;

    // ---------------------------------------------------------------
    // Analysis settings / health
    // ---------------------------------------------------------------
    private final String rcaConfigPath;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaResultTopic = b.kafkaResultTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.windowMinutes = b.windowMinutes;
        this.maxOutOfOrdernessSeconds = b.maxOutOfOrdernessSeconds;
        this.rcaConfigPath = b.rcaConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "metrics"))
                    .kafkaResultTopic(env("KAFKA_RESULT_TOPIC", "rca-results"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "rca-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .windowMinutes(parseIntEnv("RCA_WINDOW_MINUTES", "30"))
                    .maxOutOfOrdernessSeconds(parseIntEnv("RCA_MAX_OUT_OF_ORDERNESS_SECONDS", "30"))
                    .rcaConfigPath(env("RCA_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaResultTopic() {
        return kafkaResultTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return width of the tumbling analysis window
     */
    public int getWindowMinutes() {
        return windowMinutes;
    }

    public int getMaxOutOfOrdernessSeconds() {
        return maxOutOfOrdernessSeconds;
    }

    /**
     * @return path of the RCA settings file, or an empty string for the
     *         bundled defaults
     */
    public String getRcaConfigPath() {
        return rcaConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, window &gt; 0,
     * out-of-orderness &ge; 0, port in [1, 65535], non-blank topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "metrics";
        private String kafkaResultTopic = "rca-results";
        private String kafkaGroupId = "rca-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private int windowMinutes = 30;
        private int maxOutOfOrdernessSeconds = 30;
        private String rcaConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaResultTopic(String v) {
            this.kafkaResultTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder windowMinutes(int v) {
            this.windowMinutes = v;
            return this;
        }

        public Builder maxOutOfOrdernessSeconds(int v) {
            this.maxOutOfOrdernessSeconds = v;
            return this;
        }

        public Builder rcaConfigPath(String v) {
            this.rcaConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaResultTopic, "kafkaResultTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (windowMinutes < 1) {
                throw new IllegalArgumentException("windowMinutes must be >= 1, got: " + windowMinutes);
            }
            if (maxOutOfOrdernessSeconds < 0) {
                throw new IllegalArgumentException(
                        "maxOutOfOrdernessSeconds must be >= 0, got: " + maxOutOfOrdernessSeconds);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (rcaConfigPath == null) {
                rcaConfigPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaResultTopic='" + kafkaResultTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", windowMinutes=" + windowMinutes +
                ", maxOutOfOrdernessSeconds=" + maxOutOfOrdernessSeconds +
                ", rcaConfigPath='" + rcaConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
