package com.logsentinel.core.model;

import java.util.Optional;

/**
 * The seven categories produced by the log classification model.
 *
 * <p>
 * Class {@code 0} is the only non-anomalous category. Each class carries a
 * default severity used when the model does not report one.
 * </p>
 *
 * @since 1.0.0
 */
public enum LogClass {

    NORMAL(0, "Normal", Severity.INFO),
    SECURITY(1, "Security Anomaly", Severity.CRITICAL),
    SYSTEM_FAILURE(2, "System Failure", Severity.CRITICAL),
    PERFORMANCE(3, "Performance Issue", Severity.MEDIUM),
    NETWORK(4, "Network Anomaly", Severity.MEDIUM),
    CONFIGURATION(5, "Configuration Issue", Severity.MEDIUM),
    HARDWARE(6, "Hardware Issue", Severity.MEDIUM);

    /** Number of classes the model distinguishes. */
    public static final int COUNT = 7;

    private final int id;
    private final String label;
    private final Severity defaultSeverity;

    LogClass(int id, String label, Severity defaultSeverity) {
        this.id = id;
        this.label = label;
        this.defaultSeverity = defaultSeverity;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * @param id class id reported by the model
     * @return the class, or empty when {@code id} is outside {@code [0, 6]}
     */
    public static Optional<LogClass> fromId(int id) {
        if (id < 0 || id >= COUNT) {
            return Optional.empty();
        }
        return Optional.of(values()[id]);
    }
}
