package com.logsentinel.core.calibration;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable operating threshold and its recalibration schedule.
 *
 * <p>
 * Not thread safe on its own; every read and write happens under the
 * {@link ThresholdCalibrator} lock.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdState {

    /** Threshold used until the first recalibration or override. */
    public static final double DEFAULT_THRESHOLD = 0.5;

    /** Default minimum spacing between recalibrations. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(300);

    private double currentThreshold;
    private Instant lastRecalibratedAt;
    private final Duration recalibrationInterval;

    /**
     * @param initialThreshold      starting threshold in {@code [0, 1]}
     * @param createdAt             initial value of {@code lastRecalibratedAt}
     * @param recalibrationInterval minimum spacing between recalibrations;
     *                              must not be negative
     */
    public ThresholdState(double initialThreshold, Instant createdAt, Duration recalibrationInterval) {
        if (!ThresholdCalibrator.inUnitRange(initialThreshold)) {
            throw new IllegalArgumentException("initialThreshold must be in [0, 1], got: " + initialThreshold);
        }
        Objects.requireNonNull(recalibrationInterval, "recalibrationInterval must not be null");
        if (recalibrationInterval.isNegative()) {
            throw new IllegalArgumentException("recalibrationInterval must not be negative");
        }
        this.currentThreshold = initialThreshold;
        this.lastRecalibratedAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.recalibrationInterval = recalibrationInterval;
    }

    /**
     * @param now current time
     * @return {@code true} once at least one interval has passed since the
     *         last recalibration or override
     */
    public boolean isDue(Instant now) {
        return Duration.between(lastRecalibratedAt, now).compareTo(recalibrationInterval) >= 0;
    }

    public double getCurrentThreshold() {
        return currentThreshold;
    }

    void setCurrentThreshold(double currentThreshold) {
        this.currentThreshold = currentThreshold;
    }

    public Instant getLastRecalibratedAt() {
        return lastRecalibratedAt;
    }

    void setLastRecalibratedAt(Instant lastRecalibratedAt) {
        this.lastRecalibratedAt = lastRecalibratedAt;
    }

    public Duration getRecalibrationInterval() {
        return recalibrationInterval;
    }

    @Override
    public String toString() {
        return "ThresholdState{threshold=" + currentThreshold
                + ", lastRecalibratedAt=" + lastRecalibratedAt
                + ", interval=" + recalibrationInterval + '}';
    }
}
