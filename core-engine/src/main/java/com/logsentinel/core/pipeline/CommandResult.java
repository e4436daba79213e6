package com.logsentinel.core.pipeline;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured answer to a control command.
 *
 * <pre>
 * {"status": "success", "message": "Threshold updated.", "current_threshold": 0.42}
 * {"status": "error", "message": "Invalid threshold value.", "errors": ["value must be between 0 and 1"]}
 * </pre>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "status", "message", "errors" })
public final class CommandResult {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private final String status;
    private final String message;
    private final List<String> errors;
    private final Map<String, Object> data;

    private CommandResult(String status, String message, List<String> errors, Map<String, Object> data) {
        this.status = status;
        this.message = message;
        this.errors = errors;
        this.data = data;
    }

    public static CommandResult success(String message) {
        return new CommandResult(SUCCESS, message, List.of(), Map.of());
    }

    /**
     * @param message human-readable message
     * @param key     name of the single data field
     * @param value   data value
     */
    public static CommandResult success(String message, String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        return new CommandResult(SUCCESS, message, List.of(), Collections.unmodifiableMap(data));
    }

    public static CommandResult error(String message, String... errors) {
        return new CommandResult(ERROR, message, List.of(errors), Map.of());
    }

    @JsonProperty("status")
    public String getStatus() {
        return status;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("errors")
    public List<String> getErrors() {
        return errors;
    }

    @JsonAnyGetter
    public Map<String, Object> getData() {
        return data;
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    @Override
    public String toString() {
        return "CommandResult{status='" + status + "', message='" + message + "', errors=" + errors + '}';
    }
}
