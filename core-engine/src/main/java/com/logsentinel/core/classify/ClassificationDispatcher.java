package com.logsentinel.core.classify;

import com.logsentinel.core.calibration.ThresholdCalibrator;
import com.logsentinel.core.model.ClassificationResult;

import java.time.Instant;
import java.util.Objects;

/**
 * Invokes the classifier for one message body and applies the success side
 * effects.
 *
 * <p>
 * On success the per-class counter is incremented, the calibrator gets a
 * chance to recalibrate, and the score is appended to the score window
 * against the threshold in force at that moment. On failure none of this
 * happens.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassificationDispatcher {

    private final LogClassifier classifier;
    private final ThresholdCalibrator calibrator;
    private final ClassificationStats stats;

    public ClassificationDispatcher(LogClassifier classifier, ThresholdCalibrator calibrator,
            ClassificationStats stats) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.calibrator = Objects.requireNonNull(calibrator, "calibrator must not be null");
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
    }

    /**
     * @param body message body to classify
     * @param now  processing time, used for recalibration gating
     * @return the result and the threshold used to partition its score
     * @throws ModelUnavailableException if the classifier is not ready
     * @throws InferenceFailureException if the call fails or the result is
     *                                   unusable
     */
    public DispatchOutcome dispatch(String body, Instant now) throws ClassificationException {
        if (!classifier.isReady()) {
            throw new ModelUnavailableException("Classification model is not loaded");
        }

        ClassificationResult result;
        try {
            result = classifier.classify(body != null ? body : "");
        } catch (RuntimeException e) {
            throw new InferenceFailureException("Classifier failed: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new InferenceFailureException("Classifier returned no result");
        }

        stats.increment(result.getClassId());
        calibrator.maybeRecalibrate(now);
        double threshold = calibrator.recordScore(result.getAnomalyScore());
        return new DispatchOutcome(result, threshold);
    }

    public ClassificationStats getStats() {
        return stats;
    }

    public boolean isModelReady() {
        return classifier.isReady();
    }
}
