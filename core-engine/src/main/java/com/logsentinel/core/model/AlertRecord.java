package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable alert created for a record whose class is in the alerting set.
 *
 * <p>
 * Every field is fixed at creation except {@code acknowledged}, which only
 * moves from {@code false} to {@code true}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Acknowledgement may race with readers on other threads; access to the
 * acknowledgement state is synchronized on the instance.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "id", "log_entry", "classification_class", "classification_name" })
public final class AlertRecord {

    private final long id;
    private final LogEntry logEntry;
    private final double anomalyScore;
    private final double thresholdAtDetection;
    private final boolean anomaly;
    private final int classId;
    private final String className;
    private final Severity severity;
    private final Instant detectedAt;

    private boolean acknowledged;
    private Instant acknowledgedAt;

    private AlertRecord(long id, LogEntry logEntry, ClassificationResult result,
            double thresholdAtDetection, Instant detectedAt) {
        this.id = id;
        this.logEntry = logEntry;
        this.anomalyScore = result.getAnomalyScore();
        this.thresholdAtDetection = thresholdAtDetection;
        this.anomaly = result.isAnomaly();
        this.classId = result.getClassId();
        this.className = result.getClassName();
        this.severity = result.getSeverity();
        this.detectedAt = detectedAt;
    }

    /**
     * @param id                   store-assigned identifier
     * @param logEntry             the log-only record this alert belongs to
     * @param result               classification that triggered the alert
     * @param thresholdAtDetection operating threshold when the record was classified
     * @param detectedAt           creation time
     * @return a new, unacknowledged alert
     */
    public static AlertRecord of(long id, LogEntry logEntry, ClassificationResult result,
            double thresholdAtDetection, Instant detectedAt) {
        Objects.requireNonNull(logEntry, "logEntry must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        return new AlertRecord(id, logEntry, result, thresholdAtDetection, detectedAt);
    }

    /**
     * Mark this alert as acknowledged.
     *
     * @param at acknowledgement time
     * @return {@code true} if the state changed, {@code false} if the alert was
     *         already acknowledged
     */
    public synchronized boolean acknowledge(Instant at) {
        if (acknowledged) {
            return false;
        }
        acknowledged = true;
        acknowledgedAt = at;
        return true;
    }

    @JsonProperty("acknowledged")
    public synchronized boolean isAcknowledged() {
        return acknowledged;
    }

    @JsonProperty("acknowledged_at")
    public synchronized Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("log_entry")
    public LogEntry getLogEntry() {
        return logEntry;
    }

    @JsonProperty("anomaly_score")
    public double getAnomalyScore() {
        return anomalyScore;
    }

    @JsonProperty("threshold")
    public double getThresholdAtDetection() {
        return thresholdAtDetection;
    }

    @JsonProperty("is_anomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    @JsonProperty("classification_class")
    public int getClassId() {
        return classId;
    }

    @JsonProperty("classification_name")
    public String getClassName() {
        return className;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("detected_at")
    public Instant getDetectedAt() {
        return detectedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRecord that))
            return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "AlertRecord{" +
                "id=" + id +
                ", classId=" + classId +
                ", className='" + className + '\'' +
                ", anomalyScore=" + anomalyScore +
                ", severity=" + severity +
                '}';
    }
}
