package com.logsentinel.core.delivery;

import java.io.IOException;

/**
 * The collector answered with a server error. Treated like a network failure
 * and retried.
 *
 * @since 1.0.0
 */
public class DeliveryTransientException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public DeliveryTransientException(int statusCode, String message) {
        super("Collector unavailable (status=" + statusCode + "): " + message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
