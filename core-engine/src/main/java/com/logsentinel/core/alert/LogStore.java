package com.logsentinel.core.alert;

import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.SystemStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for log entries, alerts and service status.
 *
 * <p>
 * {@link #save(LogEntry, AlertRecord)} is atomic: either the entry and its
 * alert are both stored or neither is.
 * </p>
 *
 * @since 1.0.0
 */
public interface LogStore {

    long nextLogEntryId();

    long nextAlertId();

    /**
     * @param entry log-only record; must not be {@code null}
     * @param alert alert for the entry, or {@code null}
     * @throws PersistenceException if nothing was stored
     */
    void save(LogEntry entry, AlertRecord alert) throws PersistenceException;

    /**
     * Idempotently acknowledge an alert.
     *
     * @param alertId alert identifier
     * @param at      acknowledgement time
     * @return what happened
     */
    AckOutcome acknowledge(long alertId, Instant at);

    Optional<AlertRecord> findAlert(long alertId);

    Optional<LogEntry> findEntry(long entryId);

    /**
     * @param limit maximum number of results
     * @return newest alerts first
     */
    List<AlertRecord> recentAlerts(int limit);

    /**
     * @param limit maximum number of results
     * @return newest entries first
     */
    List<LogEntry> recentEntries(int limit);

    long entryCount();

    long alertCount();

    long unacknowledgedAlertCount();

    void updateSystemStatus(SystemStatus status);

    Optional<SystemStatus> findSystemStatus(String serviceName);

    Collection<SystemStatus> systemStatuses();
}
