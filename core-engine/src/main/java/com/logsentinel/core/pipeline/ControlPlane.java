package com.logsentinel.core.pipeline;

import com.logsentinel.core.alert.AckOutcome;
import com.logsentinel.core.alert.AlertPolicy;
import com.logsentinel.core.calibration.CalibrationMetrics;
import com.logsentinel.core.calibration.InvalidOverrideException;
import com.logsentinel.core.calibration.ThresholdCalibrator;
import com.logsentinel.core.model.ServiceState;
import com.logsentinel.core.model.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Administrative commands that run concurrently with the ingestion worker.
 *
 * <p>
 * Every command returns a {@link CommandResult}; validation problems are
 * reported in the result rather than thrown.
 * </p>
 *
 * <h3>Command Messages</h3>
 * <p>
 * {@link #execute(Map)} accepts the message form used by the control
 * channel, selected by its {@code command} field:
 * </p>
 * <ul>
 * <li>{@code override_threshold} with {@code value}</li>
 * <li>{@code acknowledge_anomaly} (or {@code acknowledge_alert}) with
 * {@code anomaly_id}</li>
 * <li>{@code update_system_status} with {@code status} and optional
 * {@code service_name}, {@code details}</li>
 * <li>{@code get_metrics}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ControlPlane {

    private static final Logger LOG = LoggerFactory.getLogger(ControlPlane.class);

    /** Service name used when a status update does not name one. */
    public static final String DEFAULT_SERVICE = "log-sentinel";

    private final ThresholdCalibrator calibrator;
    private final AlertPolicy alertPolicy;
    private final Clock clock;

    public ControlPlane(ThresholdCalibrator calibrator, AlertPolicy alertPolicy, Clock clock) {
        this.calibrator = Objects.requireNonNull(calibrator, "calibrator must not be null");
        this.alertPolicy = Objects.requireNonNull(alertPolicy, "alertPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------

    public CommandResult overrideThreshold(double value) {
        try {
            calibrator.overrideThreshold(value, clock.instant());
        } catch (InvalidOverrideException e) {
            LOG.warn("Rejected threshold override: {}", e.getMessage());
            return CommandResult.error("Invalid threshold value.", "value must be between 0 and 1, got " + value);
        }
        return CommandResult.success("Threshold updated.", "current_threshold", calibrator.currentThreshold());
    }

    public CommandResult acknowledgeAlert(long alertId) {
        AckOutcome outcome = alertPolicy.acknowledge(alertId);
        return switch (outcome) {
            case ACKNOWLEDGED -> CommandResult.success("Anomaly acknowledged.", "anomaly_id", alertId);
            case ALREADY_ACKNOWLEDGED -> CommandResult.success("Anomaly already acknowledged.", "anomaly_id", alertId);
            case NOT_FOUND -> CommandResult.error("Anomaly not found.", "no alert with id " + alertId);
        };
    }

    public CommandResult getMetrics() {
        CalibrationMetrics metrics = calibrator.metrics();
        return CommandResult.success("Metrics computed.", "metrics", metrics);
    }

    /**
     * @param serviceName service to update; {@link #DEFAULT_SERVICE} when blank
     * @param status      state label ({@code running}, {@code stopped},
     *                    {@code error}, {@code degraded})
     * @param details     free text, may be {@code null}
     */
    public CommandResult updateSystemStatus(String serviceName, String status, String details) {
        Optional<ServiceState> state = ServiceState.fromLabel(status);
        if (state.isEmpty()) {
            return CommandResult.error("Invalid system status.",
                    "status must be one of running, stopped, error, degraded; got " + status);
        }
        String name = serviceName == null || serviceName.isBlank() ? DEFAULT_SERVICE : serviceName.trim();
        SystemStatus updated = new SystemStatus(name, state.get(), clock.instant(), details);
        alertPolicy.getStore().updateSystemStatus(updated);
        LOG.info("System status of {} set to {}", name, state.get().label());
        return CommandResult.success("System status updated.", "system_status", updated);
    }

    /**
     * Run a command message.
     *
     * @param message decoded command message
     * @return the command's result, or an error for unknown or malformed
     *         commands
     */
    public CommandResult execute(Map<String, Object> message) {
        if (message == null) {
            return CommandResult.error("Unknown command.", "command is required");
        }
        Object command = message.get("command");
        if (command == null) {
            return CommandResult.error("Unknown command.", "command is required");
        }
        switch (command.toString()) {
            case "override_threshold": {
                Object value = message.get("value");
                if (!(value instanceof Number n)) {
                    return CommandResult.error("Invalid threshold value.", "value must be a number");
                }
                return overrideThreshold(n.doubleValue());
            }
            case "acknowledge_anomaly":
            case "acknowledge_alert": {
                Object id = message.containsKey("anomaly_id") ? message.get("anomaly_id") : message.get("id");
                if (!(id instanceof Number n)) {
                    return CommandResult.error("Invalid anomaly id.", "anomaly_id must be an integer");
                }
                return acknowledgeAlert(n.longValue());
            }
            case "update_system_status":
                return updateSystemStatus(asString(message.get("service_name")), asString(message.get("status")),
                        asString(message.get("details")));
            case "get_metrics":
                return getMetrics();
            default:
                return CommandResult.error("Unknown command.", "unsupported command " + command);
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
