package com.logsentinel.core.calibration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the operating threshold and the score window, and periodically
 * re-tunes the threshold to maximise F1 over the recent scores.
 *
 * <h3>Recalibration</h3>
 * <p>
 * When at least one interval has elapsed, {@link #maybeRecalibrate(Instant)}
 * evaluates the candidates {@code current - 2*step .. current + 2*step}
 * (rounded to four decimals, restricted to {@code [0, 1]}) in ascending
 * order. For a candidate {@code t}:
 * </p>
 * <ul>
 * <li>{@code FP} = normal-pool scores {@code > t}, {@code TP} = abnormal-pool
 * scores {@code > t}</li>
 * <li>{@code TN} and {@code FN} are the remainders of each pool</li>
 * </ul>
 * <p>
 * Candidates with {@code TP == 0} are skipped. The first candidate with a
 * strictly greater F1 wins, so the lowest threshold is kept on ties. With no
 * valid candidate the threshold is left as is. The recalibration timestamp is
 * updated either way.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * One {@link ReentrantLock} guards the threshold state and the score window.
 * The state file is written under the same lock, so it always holds the last
 * threshold set in memory. The ingestion worker records scores and recalibrates; control threads may
 * override the threshold or read metrics concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdCalibrator {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdCalibrator.class);

    /** Default distance between neighbouring candidates. */
    public static final double DEFAULT_CANDIDATE_STEP = 0.1;

    private static final int NEIGHBOURHOOD = 2;

    private final ReentrantLock lock = new ReentrantLock();
    private final ThresholdState state;
    private final ScoreWindow window;
    private final double candidateStep;
    private final ThresholdFileStore store;

    private ThresholdCalibrator(Builder b) {
        Instant createdAt = b.clock.instant();
        double initial = b.initialThreshold;
        if (b.store != null) {
            OptionalDouble stored = b.store.load();
            if (stored.isPresent()) {
                initial = stored.getAsDouble();
            }
        }
        this.state = new ThresholdState(initial, createdAt, b.recalibrationInterval);
        this.window = new ScoreWindow(b.windowCapacity);
        this.candidateStep = b.candidateStep;
        this.store = b.store;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ThresholdCalibrator}.
     */
    public static class Builder {
        private double initialThreshold = ThresholdState.DEFAULT_THRESHOLD;
        private Duration recalibrationInterval = ThresholdState.DEFAULT_INTERVAL;
        private int windowCapacity = ScoreWindow.DEFAULT_CAPACITY;
        private double candidateStep = DEFAULT_CANDIDATE_STEP;
        private Clock clock = Clock.systemUTC();
        private ThresholdFileStore store;

        public Builder initialThreshold(double initialThreshold) {
            this.initialThreshold = initialThreshold;
            return this;
        }

        public Builder recalibrationInterval(Duration recalibrationInterval) {
            this.recalibrationInterval = recalibrationInterval;
            return this;
        }

        public Builder windowCapacity(int windowCapacity) {
            this.windowCapacity = windowCapacity;
            return this;
        }

        public Builder candidateStep(double candidateStep) {
            this.candidateStep = candidateStep;
            return this;
        }

        /** Clock whose current instant becomes the initial recalibration time. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Optional store; a stored threshold replaces the initial one. */
        public Builder store(ThresholdFileStore store) {
            this.store = store;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any setting is out of range
         */
        public ThresholdCalibrator build() {
            Objects.requireNonNull(clock, "clock must not be null");
            if (!(candidateStep > 0 && candidateStep <= 1)) {
                throw new IllegalArgumentException("candidateStep must be in (0, 1], got: " + candidateStep);
            }
            return new ThresholdCalibrator(this);
        }
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Record a score, partitioned by the threshold in force right now.
     *
     * @param score anomaly score of a classified record
     * @return the threshold the score was compared against
     */
    public double recordScore(double score) {
        lock.lock();
        try {
            double threshold = state.getCurrentThreshold();
            window.record(score, threshold);
            return threshold;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Recalibrate if at least one interval has passed since the last
     * recalibration or override.
     *
     * @param now current time
     * @return {@code true} if a calibration pass ran
     */
    public boolean maybeRecalibrate(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        double before;
        double after;
        lock.lock();
        try {
            if (!state.isDue(now)) {
                return false;
            }
            before = state.getCurrentThreshold();
            after = bestCandidate(before).orElse(before);
            state.setCurrentThreshold(after);
            state.setLastRecalibratedAt(now);
            if (after != before) {
                persist(after, now);
            }
        } finally {
            lock.unlock();
        }

        if (after != before) {
            LOG.info("Threshold recalibrated {} -> {}", before, after);
        } else {
            LOG.debug("Recalibration kept threshold at {}", before);
        }
        return true;
    }

    /**
     * Set the threshold directly, bypassing the grid search.
     *
     * @param value new threshold in {@code [0, 1]}
     * @param now   current time; becomes the last recalibration time
     * @throws InvalidOverrideException if {@code value} is outside {@code [0, 1]}
     *                                  or not a number; the threshold is left
     *                                  untouched
     */
    public void overrideThreshold(double value, Instant now) {
        if (!inUnitRange(value)) {
            throw new InvalidOverrideException(value);
        }
        Objects.requireNonNull(now, "now must not be null");
        double before;
        lock.lock();
        try {
            before = state.getCurrentThreshold();
            state.setCurrentThreshold(value);
            state.setLastRecalibratedAt(now);
            persist(value, now);
        } finally {
            lock.unlock();
        }
        LOG.info("Threshold overridden {} -> {}", before, value);
    }

    public double currentThreshold() {
        lock.lock();
        try {
            return state.getCurrentThreshold();
        } finally {
            lock.unlock();
        }
    }

    public Instant lastRecalibratedAt() {
        lock.lock();
        try {
            return state.getLastRecalibratedAt();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return a consistent snapshot evaluated at the current threshold
     */
    public CalibrationMetrics metrics() {
        lock.lock();
        try {
            return new CalibrationMetrics(state.getCurrentThreshold(), window, state.getLastRecalibratedAt());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param current threshold around which to search
     * @return the ascending candidate grid, rounded and clipped to {@code [0, 1]}
     */
    public List<Double> candidates(double current) {
        List<Double> out = new ArrayList<>();
        for (int k = -NEIGHBOURHOOD; k <= NEIGHBOURHOOD; k++) {
            double c = round4(current + k * candidateStep);
            if (inUnitRange(c) && !out.contains(c)) {
                out.add(c);
            }
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** Caller holds the lock. */
    private OptionalDouble bestCandidate(double current) {
        BoundedScoreBuffer normal = window.normalPool();
        BoundedScoreBuffer abnormal = window.abnormalPool();
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }

        double bestF1 = -1;
        OptionalDouble best = OptionalDouble.empty();
        for (double t : candidates(current)) {
            int fp = normal.countAbove(t);
            int tp = abnormal.countAbove(t);
            int fn = abnormal.size() - tp;
            if (tp == 0) {
                continue;
            }
            double precision = (double) tp / (tp + fp);
            double recall = (double) tp / (tp + fn);
            if (precision + recall == 0) {
                continue;
            }
            double f1 = 2 * precision * recall / (precision + recall);
            LOG.debug("Candidate {}: TP={} FP={} FN={} F1={}", t, tp, fp, fn, f1);
            if (f1 > bestF1) {
                bestF1 = f1;
                best = OptionalDouble.of(t);
            }
        }
        return best;
    }

    private void persist(double threshold, Instant at) {
        if (store != null) {
            store.save(threshold, at);
        }
    }

    static boolean inUnitRange(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
