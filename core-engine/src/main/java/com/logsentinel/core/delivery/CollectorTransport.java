package com.logsentinel.core.delivery;

import java.io.IOException;

/**
 * Sends one serialized payload to the collector.
 *
 * @since 1.0.0
 */
public interface CollectorTransport {

    /**
     * @param json UTF-8 JSON body
     * @return the collector's response
     * @throws IOException          on network-level failure
     * @throws InterruptedException if interrupted while waiting
     */
    CollectorResponse post(byte[] json) throws IOException, InterruptedException;
}
