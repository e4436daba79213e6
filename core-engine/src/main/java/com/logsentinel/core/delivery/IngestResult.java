package com.logsentinel.core.delivery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of {@link CollectorIngestService#ingest}.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IngestResult {

    public enum Status {
        ACCEPTED,
        REJECTED,
        FAILED
    }

    private final Status status;
    private final String message;
    private final List<String> missingFields;
    private final List<String> errors;
    private final Long logEntryId;
    private final Long alertId;

    private IngestResult(Status status, String message, List<String> missingFields, List<String> errors,
            Long logEntryId, Long alertId) {
        this.status = status;
        this.message = message;
        this.missingFields = missingFields;
        this.errors = errors;
        this.logEntryId = logEntryId;
        this.alertId = alertId;
    }

    static IngestResult accepted(long logEntryId, Long alertId) {
        return new IngestResult(Status.ACCEPTED, "Log stored", null, null, logEntryId, alertId);
    }

    static IngestResult missing(List<String> missingFields) {
        return new IngestResult(Status.REJECTED, "Missing required fields", List.copyOf(missingFields), null,
                null, null);
    }

    static IngestResult invalid(List<String> errors) {
        return new IngestResult(Status.REJECTED, "Invalid field values", null, List.copyOf(errors), null, null);
    }

    static IngestResult failed(String message) {
        return new IngestResult(Status.FAILED, message, null, null, null, null);
    }

    @JsonProperty("status")
    public Status getStatus() {
        return status;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("missing_fields")
    public List<String> getMissingFields() {
        return missingFields;
    }

    @JsonProperty("errors")
    public List<String> getErrors() {
        return errors;
    }

    @JsonProperty("log_entry_id")
    public Long getLogEntryId() {
        return logEntryId;
    }

    @JsonProperty("alert_id")
    public Long getAlertId() {
        return alertId;
    }

    /**
     * @return HTTP status the ingest endpoint answers with
     */
    public int httpStatus() {
        return switch (status) {
            case ACCEPTED -> 201;
            case REJECTED -> 400;
            case FAILED -> 500;
        };
    }
}
