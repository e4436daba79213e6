package com.logsentinel.core.delivery;

import java.util.concurrent.CompletableFuture;

/**
 * Pushes classification results to a remote collector.
 *
 * @since 1.0.0
 */
public interface DeliveryChannel extends AutoCloseable {

    /**
     * Deliver one payload on the calling thread, retrying as configured.
     *
     * @param payload payload to deliver
     * @return {@code true} if the collector accepted it
     */
    boolean deliver(DeliveryPayload payload);

    /**
     * Deliver in the background. The caller is not expected to wait.
     *
     * @param payload payload to deliver
     * @return completes with the result of {@link #deliver}
     */
    CompletableFuture<Boolean> submit(DeliveryPayload payload);

    /**
     * Stop accepting payloads and let in-flight deliveries finish within a
     * bounded wait.
     */
    @Override
    void close();
}
