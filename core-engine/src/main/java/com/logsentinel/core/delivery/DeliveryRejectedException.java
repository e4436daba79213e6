package com.logsentinel.core.delivery;

/**
 * The collector refused the payload. Retrying would not help.
 *
 * @since 1.0.0
 */
public class DeliveryRejectedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public DeliveryRejectedException(int statusCode, String message) {
        super("Collector rejected payload (status=" + statusCode + "): " + message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
