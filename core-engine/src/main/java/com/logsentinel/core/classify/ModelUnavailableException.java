package com.logsentinel.core.classify;

/**
 * The classification model has not finished initialising.
 *
 * @since 1.0.0
 */
public class ModelUnavailableException extends ClassificationException {

    private static final long serialVersionUID = 1L;

    public ModelUnavailableException(String message) {
        super(message);
    }
}
