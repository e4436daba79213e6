package com.logsentinel.core.calibration;

/**
 * Thrown when a manual threshold override is outside {@code [0, 1]}.
 *
 * @since 1.0.0
 */
public class InvalidOverrideException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final double rejectedValue;

    public InvalidOverrideException(double rejectedValue) {
        super("Threshold must be between 0 and 1, got: " + rejectedValue);
        this.rejectedValue = rejectedValue;
    }

    public double getRejectedValue() {
        return rejectedValue;
    }
}
