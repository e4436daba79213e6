package com.logsentinel.core.delivery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.logsentinel.core.model.LogEntry;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * JSON body posted to the remote collector for one classified record.
 *
 * <pre>
 * {
 *   "log_message": "Failed password for admin from 10.0.0.5 port 22 ssh2",
 *   "timestamp": "2024-05-01 10:15:30",
 *   "host_ip": "10.0.0.5",
 *   "source": "linux",
 *   "log_type": "auth",
 *   "classification_class": 1,
 *   "classification_name": "Security Anomaly",
 *   "anomaly_score": 0.91,
 *   "severity": "critical",
 *   "is_anomaly": true
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "log_message", "timestamp", "host_ip", "source", "log_type", "classification_class",
        "classification_name", "anomaly_score", "severity", "is_anomaly" })
public class DeliveryPayload {

    /** Wire format of {@code timestamp}. */
    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN);

    @JsonProperty("log_message")
    private String logMessage;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("host_ip")
    private String hostIp;

    @JsonProperty("source")
    private String source;

    @JsonProperty("log_type")
    private String logType;

    @JsonProperty("classification_class")
    private Integer classificationClass;

    @JsonProperty("classification_name")
    private String classificationName;

    @JsonProperty("anomaly_score")
    private Double anomalyScore;

    @JsonProperty("severity")
    private String severity;

    @JsonProperty("is_anomaly")
    private Boolean anomaly;

    public DeliveryPayload() {
    }

    /**
     * Build the payload for a classified entry.
     *
     * @param entry classified log entry
     * @param zone  zone in which the timestamp is rendered
     * @return the payload
     * @throws IllegalArgumentException if the entry carries no classification
     */
    public static DeliveryPayload from(LogEntry entry, ZoneId zone) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (!entry.isClassified()) {
            throw new IllegalArgumentException("Entry " + entry.getId() + " has no classification");
        }
        DeliveryPayload p = new DeliveryPayload();
        p.logMessage = entry.getMessage();
        p.timestamp = formatTimestamp(entry.getTimestamp(), zone);
        p.hostIp = entry.getHostIp();
        p.source = entry.getSource();
        p.logType = entry.getLogType();
        p.classificationClass = entry.getClassId();
        p.classificationName = entry.getClassName();
        p.anomalyScore = entry.getAnomalyScore();
        p.severity = entry.getSeverity().label();
        p.anomaly = entry.getAnomaly();
        return p;
    }

    public static DeliveryPayload from(LogEntry entry) {
        return from(entry, ZoneOffset.UTC);
    }

    public static String formatTimestamp(Instant instant, ZoneId zone) {
        return TIMESTAMP_FORMAT.format(instant.atZone(zone));
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getLogMessage() {
        return logMessage;
    }

    public void setLogMessage(String logMessage) {
        this.logMessage = logMessage;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getHostIp() {
        return hostIp;
    }

    public void setHostIp(String hostIp) {
        this.hostIp = hostIp;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getLogType() {
        return logType;
    }

    public void setLogType(String logType) {
        this.logType = logType;
    }

    public Integer getClassificationClass() {
        return classificationClass;
    }

    public void setClassificationClass(Integer classificationClass) {
        this.classificationClass = classificationClass;
    }

    public String getClassificationName() {
        return classificationName;
    }

    public void setClassificationName(String classificationName) {
        this.classificationName = classificationName;
    }

    public Double getAnomalyScore() {
        return anomalyScore;
    }

    public void setAnomalyScore(Double anomalyScore) {
        this.anomalyScore = anomalyScore;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public Boolean getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(Boolean anomaly) {
        this.anomaly = anomaly;
    }

    @Override
    public String toString() {
        return "DeliveryPayload{" +
                "timestamp='" + timestamp + '\'' +
                ", hostIp='" + hostIp + '\'' +
                ", classificationClass=" + classificationClass +
                ", anomalyScore=" + anomalyScore +
                '}';
    }
}
