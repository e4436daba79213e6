package com.logsentinel.core.delivery;

import com.logsentinel.core.model.LogClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks an inbound collector payload before it is stored.
 *
 * @since 1.0.0
 */
public final class PayloadValidator {

    /** Fields every payload must carry, in wire order. */
    public static final List<String> REQUIRED_FIELDS = List.of(
            "log_message", "timestamp", "host_ip", "source", "log_type",
            "classification_class", "classification_name", "anomaly_score", "severity", "is_anomaly");

    private PayloadValidator() {
        // utility class
    }

    /**
     * @param body decoded JSON object
     * @return names of required fields that are absent or {@code null}, in
     *         wire order; empty when all are present
     */
    public static List<String> missingFields(Map<String, ?> body) {
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (body == null || body.get(field) == null) {
                missing.add(field);
            }
        }
        return missing;
    }

    /**
     * Type and range checks for fields that are present.
     *
     * @param body decoded JSON object
     * @return one message per invalid field; empty when valid
     */
    public static List<String> fieldErrors(Map<String, ?> body) {
        List<String> errors = new ArrayList<>();
        if (body == null) {
            return errors;
        }
        Object cls = body.get("classification_class");
        if (cls != null && !(cls instanceof Integer id && LogClass.fromId(id).isPresent())) {
            errors.add("classification_class must be an integer between 0 and " + (LogClass.COUNT - 1));
        }
        Object score = body.get("anomaly_score");
        if (score != null && !(score instanceof Number n && n.doubleValue() >= 0 && n.doubleValue() <= 1)) {
            errors.add("anomaly_score must be a number between 0 and 1");
        }
        Object anomaly = body.get("is_anomaly");
        if (anomaly != null && !(anomaly instanceof Boolean)) {
            errors.add("is_anomaly must be a boolean");
        }
        Object message = body.get("log_message");
        if (message != null && !(message instanceof String)) {
            errors.add("log_message must be a string");
        }
        return errors;
    }
}
