package com.logsentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logsentinel.core.model.AlertRecord;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@link AlertRecord}s to the alerts topic as JSON.
 *
 * <p>
 * One message per alert, shaped like the collector's anomaly resource:
 * </p>
 *
 * <pre>
 * {"id": 3,
 *  "log_entry": {"id": 7, "timestamp": "2024-06-14T15:16:01Z", "host_ip": "218.188.2.4",
 *                "source": "linux", "log_type": "auth", "log_message": "...", ...},
 *  "classification_class": 1, "classification_name": "Security Anomaly",
 *  "anomaly_score": 0.93, "threshold": 0.45, "severity": "critical",
 *  "detected_at": "2024-06-14T15:16:02Z", "acknowledged": false, ...}
 * </pre>
 *
 * <p>
 * Instants are ISO-8601 strings. The embedded log entry is the stored record,
 * so consumers can correlate the alert with the log-only row by
 * {@code log_entry.id}.
 * </p>
 */
public class AlertRecordSerializationSchema implements SerializationSchema<AlertRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertRecordSerializationSchema.class);

    private static final byte[] EMPTY = new byte[0];

    // not serializable; rebuilt on each task manager
    private transient ObjectMapper mapper;

    /**
     * @return the JSON document, or an empty value when the alert cannot be
     *         written; the alert itself stays in the log store
     */
    @Override
    public byte[] serialize(AlertRecord alert) {
        try {
            return objectMapper().writeValueAsBytes(alert);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to write alert {} (log entry {}, class {}) to JSON: {}",
                    alert.getId(), alert.getLogEntry().getId(), alert.getClassId(), e.getOriginalMessage(), e);
            return EMPTY;
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
        return mapper;
    }
}
