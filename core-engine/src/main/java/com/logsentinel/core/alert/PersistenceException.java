package com.logsentinel.core.alert;

/**
 * A log entry and its alert could not be stored. Neither was written.
 *
 * @since 1.0.0
 */
public class PersistenceException extends Exception {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
