package com.logsentinel.core.delivery;

/**
 * Status and body returned by the collector.
 *
 * @since 1.0.0
 */
public final class CollectorResponse {

    private final int statusCode;
    private final String body;

    public CollectorResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body = body != null ? body : "";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccess() {
        return statusCode / 100 == 2;
    }
}
