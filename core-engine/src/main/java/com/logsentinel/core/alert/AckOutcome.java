package com.logsentinel.core.alert;

/**
 * Result of acknowledging an alert.
 *
 * @since 1.0.0
 */
public enum AckOutcome {
    /** The alert moved from unacknowledged to acknowledged. */
    ACKNOWLEDGED,
    /** The alert was already acknowledged; nothing changed. */
    ALREADY_ACKNOWLEDGED,
    /** No alert with that id exists. */
    NOT_FOUND
}
