package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * Log-only record persisted for every ingested line.
 *
 * <p>
 * Classification fields are {@code null} when the model was unavailable or
 * failed for this line; the parsed fields and message body are always
 * present.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({ "id", "timestamp", "host_ip", "source", "log_type", "log_message" })
public final class LogEntry {

    private final long id;
    private final Instant timestamp;
    private final String hostIp;
    private final SourceFormat sourceFormat;
    private final String logType;
    private final String message;
    private final Integer classId;
    private final String className;
    private final Double anomalyScore;
    private final Severity severity;
    private final Boolean anomaly;
    private final Instant createdAt;

    private LogEntry(long id, ParsedRecord record, ClassificationResult result, Instant createdAt) {
        this.id = id;
        this.timestamp = record.getTimestamp();
        this.hostIp = record.getOriginAddress();
        this.sourceFormat = record.getSourceFormat();
        this.logType = record.getCategoryTag();
        this.message = record.getMessageBody();
        this.classId = result != null ? result.getClassId() : null;
        this.className = result != null ? result.getClassName() : null;
        this.anomalyScore = result != null ? result.getAnomalyScore() : null;
        this.severity = result != null ? result.getSeverity() : null;
        this.anomaly = result != null ? result.isAnomaly() : null;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /**
     * @param id        store-assigned identifier
     * @param record    parsed line; must not be {@code null}
     * @param result    classification, or {@code null} for an unclassified line
     * @param createdAt persistence time
     * @return a new entry
     */
    public static LogEntry of(long id, ParsedRecord record, ClassificationResult result, Instant createdAt) {
        Objects.requireNonNull(record, "record must not be null");
        return new LogEntry(id, record, result, createdAt);
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("host_ip")
    public String getHostIp() {
        return hostIp;
    }

    @JsonProperty("source")
    public String getSource() {
        return sourceFormat.sourceName();
    }

    @JsonIgnore
    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    @JsonProperty("log_type")
    public String getLogType() {
        return logType;
    }

    @JsonProperty("log_message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("classification_class")
    public Integer getClassId() {
        return classId;
    }

    @JsonProperty("classification_name")
    public String getClassName() {
        return className;
    }

    @JsonProperty("anomaly_score")
    public Double getAnomalyScore() {
        return anomalyScore;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("is_anomaly")
    public Boolean getAnomaly() {
        return anomaly;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return {@code true} when the line carries classification fields
     */
    @JsonIgnore
    public boolean isClassified() {
        return classId != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LogEntry that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "LogEntry{" +
                "id=" + id +
                ", hostIp='" + hostIp + '\'' +
                ", classId=" + classId +
                ", anomalyScore=" + anomalyScore +
                '}';
    }
}
