package com.logsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity attached to a classification result.
 *
 * @since 1.0.0
 */
public enum Severity {
    INFO,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @return lowercase wire label
     */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire label. {@code low} is folded into {@link #INFO}.
     *
     * @param label label reported by the model or a collector payload
     * @return the severity, or empty when the label is unknown
     */
    public static Optional<Severity> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalised = label.trim().toLowerCase(Locale.ROOT);
        return switch (normalised) {
            case "info", "low" -> Optional.of(INFO);
            case "medium" -> Optional.of(MEDIUM);
            case "high" -> Optional.of(HIGH);
            case "critical" -> Optional.of(CRITICAL);
            default -> Optional.empty();
        };
    }
}
