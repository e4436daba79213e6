package com.logsentinel.core.alert;

import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.LogClass;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.ParsedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides what is persisted for a classified record.
 *
 * <p>
 * A log entry is always written. An {@link AlertRecord} is added if and only
 * if the class id is in the alerting set ({@code {1, 2}} by default). Severity
 * and anomaly score play no part in the decision. Entry and alert are saved in
 * a single {@link LogStore#save} call.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(AlertPolicy.class);

    /** Security anomalies and system failures. */
    public static final Set<Integer> DEFAULT_ALERTING_CLASSES = Set.of(
            LogClass.SECURITY.id(), LogClass.SYSTEM_FAILURE.id());

    private final Set<Integer> alertingClasses;
    private final LogStore store;
    private final Clock clock;

    public AlertPolicy(LogStore store, Clock clock) {
        this(DEFAULT_ALERTING_CLASSES, store, clock);
    }

    /**
     * @param alertingClasses class ids that produce alerts
     * @param store           destination store
     * @param clock           source of creation and acknowledgement times
     * @throws IllegalArgumentException if a class id is outside {@code [0, 6]}
     */
    public AlertPolicy(Set<Integer> alertingClasses, LogStore store, Clock clock) {
        Objects.requireNonNull(alertingClasses, "alertingClasses must not be null");
        for (Integer id : alertingClasses) {
            if (id == null || LogClass.fromId(id).isEmpty()) {
                throw new IllegalArgumentException("Unknown alerting class id: " + id);
            }
        }
        this.alertingClasses = Collections.unmodifiableSet(new TreeSet<>(alertingClasses));
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param classId class id
     * @return {@code true} if records of this class produce an alert
     */
    public boolean isAlerting(int classId) {
        return alertingClasses.contains(classId);
    }

    /**
     * Persist a record.
     *
     * @param record    parsed line
     * @param result    classification, or {@code null} when classification
     *                  failed; such records are stored log-only
     * @param threshold operating threshold at classification time
     * @return what was stored
     * @throws PersistenceException if the store rejected the write; nothing
     *                              was stored
     */
    public PersistedRecord persist(ParsedRecord record, ClassificationResult result, double threshold)
            throws PersistenceException {
        Objects.requireNonNull(record, "record must not be null");
        Instant now = clock.instant();
        LogEntry entry = LogEntry.of(store.nextLogEntryId(), record, result, now);
        AlertRecord alert = null;
        if (result != null && isAlerting(result.getClassId())) {
            alert = AlertRecord.of(store.nextAlertId(), entry, result, threshold, now);
        }
        store.save(entry, alert);
        if (alert != null) {
            LOG.info("Alert {} created: class={} severity={} score={} host={}",
                    alert.getId(), alert.getClassName(), alert.getSeverity().label(),
                    alert.getAnomalyScore(), entry.getHostIp());
        }
        return new PersistedRecord(entry, alert);
    }

    /**
     * @param alertId alert identifier
     * @return outcome; re-acknowledging is not an error
     */
    public AckOutcome acknowledge(long alertId) {
        AckOutcome outcome = store.acknowledge(alertId, clock.instant());
        LOG.info("Acknowledge alert {}: {}", alertId, outcome);
        return outcome;
    }

    public Set<Integer> getAlertingClasses() {
        return alertingClasses;
    }

    public LogStore getStore() {
        return store;
    }
}
