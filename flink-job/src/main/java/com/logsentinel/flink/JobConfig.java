package com.logsentinel.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Typed, immutable deployment configuration for the Log Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * is configured the same way under Kubernetes, Docker or a plain shell.
 * Pipeline tunables (threshold, window, alert classes, retries) live in the
 * YAML settings file named by {@code PIPELINE_CONFIG_PATH} instead.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * tests. The builder validates inputs at {@link Builder#build()} time.
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
    private final String kafkaAlertTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final String settingsPath;
    private final String modelEndpoint;
    private final long modelTimeoutMs;
    private final String collectorUrl;
    private final String collectorApiKey;

    // ---------------------------------------------------------------
    // Control server
    // ---------------------------------------------------------------
    private final int controlPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.settingsPath = b.settingsPath;
        this.modelEndpoint = b.modelEndpoint;
        this.modelTimeoutMs = b.modelTimeoutMs;
        this.collectorUrl = b.collectorUrl;
        this.collectorApiKey = b.collectorApiKey;
        this.controlPort = b.controlPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static JobConfig fromEnvironment(Function<String, String> lookup) {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env(lookup, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env(lookup, "KAFKA_INPUT_TOPIC", "raw-logs"))
                    .kafkaAlertTopic(env(lookup, "KAFKA_ALERT_TOPIC", "log-alerts"))
                    .kafkaGroupId(env(lookup, "KAFKA_GROUP_ID", "log-sentinel"))
                    .checkpointIntervalMs(Long.parseLong(env(lookup, "FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .settingsPath(env(lookup, "PIPELINE_CONFIG_PATH", ""))
                    .modelEndpoint(env(lookup, "MODEL_ENDPOINT", "http://localhost:8000"))
                    .modelTimeoutMs(Long.parseLong(env(lookup, "MODEL_TIMEOUT_MS", "10000")))
                    .collectorUrl(env(lookup, "COLLECTOR_URL", ""))
                    .collectorApiKey(env(lookup, "COLLECTOR_API_KEY", ""))
                    .controlPort(Integer.parseInt(env(lookup, "CONTROL_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    /**
     * @return {@code true} when classified records are forwarded to a collector
     */
    public boolean isDeliveryEnabled() {
        return !collectorUrl.isBlank();
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

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getSettingsPath() {
        return settingsPath;
    }

    public String getModelEndpoint() {
        return modelEndpoint;
    }

    public long getModelTimeoutMs() {
        return modelTimeoutMs;
    }

    public String getCollectorUrl() {
        return collectorUrl;
    }

    public String getCollectorApiKey() {
        return collectorApiKey;
    }

    public int getControlPort() {
        return controlPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks that topics and endpoints are non-blank, the
     * checkpoint interval and model timeout are positive, and the control
     * port is in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "raw-logs";
        private String kafkaAlertTopic = "log-alerts";
        private String kafkaGroupId = "log-sentinel";
        private long checkpointIntervalMs = 60_000;
        private String settingsPath = "";
        private String modelEndpoint = "http://localhost:8000";
        private long modelTimeoutMs = 10_000;
        private String collectorUrl = "";
        private String collectorApiKey = "";
        private int controlPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder settingsPath(String v) {
            this.settingsPath = v;
            return this;
        }

        public Builder modelEndpoint(String v) {
            this.modelEndpoint = v;
            return this;
        }

        public Builder modelTimeoutMs(long v) {
            this.modelTimeoutMs = v;
            return this;
        }

        public Builder collectorUrl(String v) {
            this.collectorUrl = v;
            return this;
        }

        public Builder collectorApiKey(String v) {
            this.collectorApiKey = v;
            return this;
        }

        public Builder controlPort(int v) {
            this.controlPort = v;
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
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(modelEndpoint, "modelEndpoint");
            settingsPath = settingsPath != null ? settingsPath : "";
            collectorUrl = collectorUrl != null ? collectorUrl : "";
            collectorApiKey = collectorApiKey != null ? collectorApiKey : "";

            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (modelTimeoutMs < 1) {
                throw new IllegalArgumentException("modelTimeoutMs must be >= 1, got: " + modelTimeoutMs);
            }
            if (controlPort < 1 || controlPort > 65_535) {
                throw new IllegalArgumentException(
                        "controlPort must be in [1, 65535], got: " + controlPort);
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

    private static String env(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", settingsPath='" + settingsPath + '\'' +
                ", modelEndpoint='" + modelEndpoint + '\'' +
                ", collectorUrl='" + collectorUrl + '\'' +
                ", collectorApiKey=" + (collectorApiKey.isBlank() ? "<none>" : "****") +
                ", controlPort=" + controlPort +
                '}';
    }
}
