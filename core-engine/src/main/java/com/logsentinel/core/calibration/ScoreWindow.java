package com.logsentinel.core.calibration;

/**
 * Recent anomaly scores partitioned by the threshold in force when each score
 * was recorded.
 *
 * <p>
 * A score below the threshold goes to the normal pool, a score at or above it
 * to the abnormal pool. Scores are never re-partitioned after a threshold
 * change. Not thread safe; guarded by the owning {@link ThresholdCalibrator}.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoreWindow {

    /** Default per-pool capacity. */
    public static final int DEFAULT_CAPACITY = 1000;

    private final BoundedScoreBuffer normal;
    private final BoundedScoreBuffer abnormal;

    public ScoreWindow() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity per-pool capacity; must be positive
     */
    public ScoreWindow(int capacity) {
        this.normal = new BoundedScoreBuffer(capacity);
        this.abnormal = new BoundedScoreBuffer(capacity);
    }

    /**
     * @param score     anomaly score of a classified record
     * @param threshold the threshold in force at call time
     * @return {@code true} if the score went to the abnormal pool
     */
    public boolean record(double score, double threshold) {
        if (score < threshold) {
            normal.add(score);
            return false;
        }
        abnormal.add(score);
        return true;
    }

    public BoundedScoreBuffer normalPool() {
        return normal;
    }

    public BoundedScoreBuffer abnormalPool() {
        return abnormal;
    }

    public boolean isEmpty() {
        return normal.isEmpty() && abnormal.isEmpty();
    }
}
