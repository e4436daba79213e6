package com.logsentinel.core.classify;

import com.logsentinel.core.model.ClassificationResult;

/**
 * External classification model, consumed only through this interface.
 *
 * <p>
 * Implementations are constructed once by the composition root and shared by
 * reference. {@link #classify(String)} must be idempotent and free of side
 * effects visible to the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public interface LogClassifier {

    /**
     * @return {@code true} once the model has finished initialising
     */
    boolean isReady();

    /**
     * Classify one message body.
     *
     * @param text message body
     * @return the model's result
     * @throws InferenceFailureException if the model call fails
     */
    ClassificationResult classify(String text) throws InferenceFailureException;
}
