package com.logsentinel.core.delivery;

import com.logsentinel.core.alert.AlertPolicy;
import com.logsentinel.core.alert.PersistedRecord;
import com.logsentinel.core.alert.PersistenceException;
import com.logsentinel.core.calibration.ThresholdCalibrator;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.ParsedRecord;
import com.logsentinel.core.model.Severity;
import com.logsentinel.core.model.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Receiving side of the delivery channel: validates a collector payload and
 * stores it through the same {@link AlertPolicy} as locally classified
 * records.
 *
 * <p>
 * A payload with missing required fields is rejected with the list of their
 * names. Such rejections are final; senders do not retry them.
 * </p>
 *
 * @since 1.0.0
 */
public class CollectorIngestService {

    private static final Logger LOG = LoggerFactory.getLogger(CollectorIngestService.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern(DeliveryPayload.TIMESTAMP_PATTERN);

    private final AlertPolicy alertPolicy;
    private final ThresholdCalibrator calibrator;
    private final LiveFeed feed;
    private final Clock clock;

    public CollectorIngestService(AlertPolicy alertPolicy, ThresholdCalibrator calibrator, LiveFeed feed,
            Clock clock) {
        this.alertPolicy = Objects.requireNonNull(alertPolicy, "alertPolicy must not be null");
        this.calibrator = Objects.requireNonNull(calibrator, "calibrator must not be null");
        this.feed = feed;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param body decoded JSON object
     * @return accepted with the stored ids, or rejected with the reasons
     */
    public IngestResult ingest(Map<String, Object> body) {
        List<String> missing = PayloadValidator.missingFields(body);
        if (!missing.isEmpty()) {
            LOG.warn("Rejected collector payload, missing fields: {}", missing);
            return IngestResult.missing(missing);
        }
        List<String> errors = PayloadValidator.fieldErrors(body);
        if (!errors.isEmpty()) {
            LOG.warn("Rejected collector payload: {}", errors);
            return IngestResult.invalid(errors);
        }

        ClassificationResult result = ClassificationResult.reported(
                ((Number) body.get("classification_class")).intValue(),
                String.valueOf(body.get("classification_name")),
                ((Number) body.get("anomaly_score")).doubleValue(),
                Severity.fromLabel(String.valueOf(body.get("severity"))).orElse(null));
        ParsedRecord record = toRecord(body);
        double threshold = calibrator.currentThreshold();

        try {
            PersistedRecord stored = alertPolicy.persist(record, result, threshold);
            Long alertId = stored.getAlert().map(a -> a.getId()).orElse(null);
            if (feed != null) {
                feed.publish(new FeedUpdate(stored.getEntry(), alertId, threshold));
            }
            return IngestResult.accepted(stored.getEntry().getId(), alertId);
        } catch (PersistenceException e) {
            LOG.error("stage=ingest kind=persistence host={}: {}", record.getOriginAddress(), e.getMessage(), e);
            return IngestResult.failed("Failed to store log: " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ParsedRecord toRecord(Map<String, Object> body) {
        String message = String.valueOf(body.get("log_message"));
        String host = String.valueOf(body.get("host_ip")).trim();
        Instant ts = null;
        try {
            ts = LocalDateTime.parse(String.valueOf(body.get("timestamp")).trim(), TIMESTAMP_FORMAT)
                    .atZone(clock.getZone()).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debug("Unparseable payload timestamp '{}'", body.get("timestamp"));
        }
        return ParsedRecord.builder()
                .rawLine(message)
                .timestamp(ts != null ? ts : clock.instant())
                .timestampDegraded(ts == null)
                .originAddress(host.isEmpty() ? "unknown" : host)
                .sourceFormat(formatOf(String.valueOf(body.get("source"))))
                .categoryTag(String.valueOf(body.get("log_type")))
                .messageBody(message)
                .build();
    }

    static SourceFormat formatOf(String source) {
        return switch (source.trim().toLowerCase(Locale.ROOT)) {
            case "apache" -> SourceFormat.APACHE;
            case "linux", "syslog" -> SourceFormat.SYSLOG;
            default -> SourceFormat.GENERIC;
        };
    }
}
