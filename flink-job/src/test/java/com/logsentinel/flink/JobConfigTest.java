package com.logsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults when the environment is empty")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromEnvironment(name -> null);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("raw-logs");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("log-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("log-sentinel");
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000);
        assertThat(config.getModelEndpoint()).isEqualTo("http://localhost:8000");
        assertThat(config.getControlPort()).isEqualTo(8080);
        assertThat(config.getSettingsPath()).isEmpty();
        assertThat(config.isDeliveryEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should read values from the environment")
    void shouldReadEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("KAFKA_BOOTSTRAP_SERVERS", "kafka:29092");
        env.put("KAFKA_INPUT_TOPIC", "syslog");
        env.put("CONTROL_PORT", "9090");
        env.put("COLLECTOR_URL", "http://collector:8000/api/v1/logs/");
        env.put("COLLECTOR_API_KEY", "s3cret");
        env.put("MODEL_TIMEOUT_MS", "2500");

        JobConfig config = JobConfig.fromEnvironment(env::get);

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("kafka:29092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("syslog");
        assertThat(config.getControlPort()).isEqualTo(9090);
        assertThat(config.getModelTimeoutMs()).isEqualTo(2500);
        assertThat(config.isDeliveryEnabled()).isTrue();
        assertThat(config.toString()).doesNotContain("s3cret");
    }

    @Test
    @DisplayName("Should fail on a non-numeric value")
    void shouldFailOnBadNumber() {
        Map<String, String> env = Map.of("CONTROL_PORT", "eighty");

        assertThatThrownBy(() -> JobConfig.fromEnvironment(env::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Should validate ranges and required values")
    void shouldValidate() {
        assertThatThrownBy(() -> new JobConfig.Builder().controlPort(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaInputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic");
        assertThatThrownBy(() -> new JobConfig.Builder().modelEndpoint(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should build Kafka client properties")
    void shouldBuildKafkaProperties() {
        JobConfig config = new JobConfig.Builder().kafkaBootstrapServers("k:1").kafkaGroupId("g").build();

        Properties consumer = config.kafkaConsumerProperties();
        Properties producer = config.kafkaProducerProperties();

        assertThat(consumer.getProperty("bootstrap.servers")).isEqualTo("k:1");
        assertThat(consumer.getProperty("group.id")).isEqualTo("g");
        assertThat(producer.getProperty("transaction.timeout.ms")).isEqualTo("900000");
    }
}
