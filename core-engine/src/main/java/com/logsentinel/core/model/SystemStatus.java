package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Last reported operational status of a named service.
 *
 * @since 1.0.0
 */
public final class SystemStatus {

    private final String serviceName;
    private final ServiceState state;
    private final Instant lastCheck;
    private final String details;

    public SystemStatus(String serviceName, ServiceState state, Instant lastCheck, String details) {
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.lastCheck = Objects.requireNonNull(lastCheck, "lastCheck must not be null");
        this.details = details != null ? details : "";
    }

    @JsonProperty("service_name")
    public String getServiceName() {
        return serviceName;
    }

    @JsonProperty("status")
    public ServiceState getState() {
        return state;
    }

    @JsonProperty("last_check")
    public Instant getLastCheck() {
        return lastCheck;
    }

    @JsonProperty("details")
    public String getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "SystemStatus{" + serviceName + '=' + state + '}';
    }
}
