package com.logsentinel.core.classify;

/**
 * Base class for failures of the classification stage.
 *
 * @since 1.0.0
 */
public abstract class ClassificationException extends Exception {

    private static final long serialVersionUID = 1L;

    protected ClassificationException(String message) {
        super(message);
    }

    protected ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
