package com.logsentinel.core.classify;

import com.logsentinel.core.model.ClassificationResult;

import java.util.Objects;

/**
 * Successful classification together with the threshold its score was
 * partitioned against.
 *
 * @since 1.0.0
 */
public final class DispatchOutcome {

    private final ClassificationResult result;
    private final double threshold;

    DispatchOutcome(ClassificationResult result, double threshold) {
        this.result = Objects.requireNonNull(result, "result must not be null");
        this.threshold = threshold;
    }

    public ClassificationResult getResult() {
        return result;
    }

    public double getThreshold() {
        return threshold;
    }
}
