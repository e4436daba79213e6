package com.logsentinel.flink;

import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;

import java.nio.charset.StandardCharsets;

/**
 * Flink {@link DeserializationSchema} that turns raw Kafka bytes into one
 * log line.
 * <p>
 * Bytes are decoded as UTF-8 with malformed sequences replaced, and trailing
 * line terminators are removed. Empty and whitespace-only messages become
 * {@code null} and are filtered out by the job.
 * </p>
 */
public class LogLineDeserializationSchema implements DeserializationSchema<String> {

    private static final long serialVersionUID = 1L;

    @Override
    public String deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        String line = new String(message, StandardCharsets.UTF_8);
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        line = line.substring(0, end);
        return line.isBlank() ? null : line;
    }

    @Override
    public boolean isEndOfStream(String nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<String> getProducedType() {
        return Types.STRING;
    }
}
