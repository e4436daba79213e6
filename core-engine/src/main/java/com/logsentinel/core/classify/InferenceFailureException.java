package com.logsentinel.core.classify;

/**
 * The model call failed or returned an unusable result.
 *
 * @since 1.0.0
 */
public class InferenceFailureException extends ClassificationException {

    private static final long serialVersionUID = 1L;

    public InferenceFailureException(String message) {
        super(message);
    }

    public InferenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
