package com.logsentinel.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.ParsedRecord;
import com.logsentinel.core.model.Severity;
import com.logsentinel.core.model.SourceFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertRecordSerializationSchema}.
 */
class AlertRecordSerializationSchemaTest {

    @Test
    @DisplayName("Should serialize an alert with its log entry and ISO timestamps")
    void shouldSerializeAlert() throws Exception {
        ParsedRecord record = ParsedRecord.builder()
                .timestamp(Instant.parse("2024-06-14T15:16:01Z"))
                .originAddress("218.188.2.4")
                .sourceFormat(SourceFormat.SYSLOG)
                .categoryTag("auth")
                .messageBody("sshd(pam_unix)[19939]: authentication failure")
                .build();
        ClassificationResult result = ClassificationResult.reported(1, "Security Anomaly", 0.93, Severity.CRITICAL);
        Instant detected = Instant.parse("2024-06-14T15:16:02Z");
        LogEntry entry = LogEntry.of(7, record, result, detected);
        AlertRecord alert = AlertRecord.of(3, entry, result, 0.45, detected);

        byte[] bytes = new AlertRecordSerializationSchema().serialize(alert);

        JsonNode json = new ObjectMapper().readTree(bytes);
        assertThat(json.path("id").asLong()).isEqualTo(3);
        assertThat(json.path("classification_class").asInt()).isEqualTo(1);
        assertThat(json.path("severity").asText()).isEqualTo("critical");
        assertThat(json.path("threshold").asDouble()).isEqualTo(0.45);
        assertThat(json.path("acknowledged").asBoolean()).isFalse();
        assertThat(json.path("log_entry").path("id").asLong()).isEqualTo(7);
        assertThat(json.path("log_entry").path("host_ip").asText()).isEqualTo("218.188.2.4");
        assertThat(json.path("log_entry").path("source").asText()).isEqualTo("linux");
        assertThat(json.path("log_entry").path("timestamp").asText()).isEqualTo("2024-06-14T15:16:01Z");
        assertThat(json.path("log_entry").has("sourceFormat")).isFalse();
        assertThat(json.path("detected_at").asText()).isEqualTo("2024-06-14T15:16:02Z");
        assertThat(json.path("log_entry").path("created_at").asText()).isEqualTo("2024-06-14T15:16:02Z");
        assertThat(json.path("log_entry").path("classification_class").asInt()).isEqualTo(1);
    }
}
