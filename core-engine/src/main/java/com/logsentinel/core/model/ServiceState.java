package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Operational state reported through the {@code update_system_status} command.
 *
 * @since 1.0.0
 */
public enum ServiceState {
    RUNNING,
    STOPPED,
    ERROR,
    DEGRADED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param label case-insensitive state name
     * @return the state, or empty when unknown
     */
    public static Optional<ServiceState> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
