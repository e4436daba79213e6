package com.logsentinel.core.delivery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.logsentinel.core.model.LogEntry;

import java.util.Objects;

/**
 * Live-feed message for one classified record.
 *
 * @since 1.0.0
 */
public final class FeedUpdate {

    private final LogEntry entry;
    private final Long alertId;
    private final double threshold;

    public FeedUpdate(LogEntry entry, Long alertId, double threshold) {
        this.entry = Objects.requireNonNull(entry, "entry must not be null");
        this.alertId = alertId;
        this.threshold = threshold;
    }

    @JsonUnwrapped
    public LogEntry getEntry() {
        return entry;
    }

    @JsonProperty("alert_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Long getAlertId() {
        return alertId;
    }

    @JsonProperty("threshold")
    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return "FeedUpdate{entry=" + entry.getId() + ", alertId=" + alertId + '}';
    }
}
