package com.logsentinel.core.alert;

import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.SystemStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-guarded, process-local {@link LogStore}.
 *
 * <p>
 * Alerts are kept for the process lifetime. Log entries are retained up to a
 * fixed count, oldest dropped first; the total count keeps growing.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryLogStore implements LogStore {

    /** Default number of retained log entries. */
    public static final int DEFAULT_ENTRY_RETENTION = 10_000;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong entrySequence = new AtomicLong();
    private final AtomicLong alertSequence = new AtomicLong();

    private final int entryRetention;
    private final Deque<LogEntry> entries = new ArrayDeque<>();
    private final Map<Long, AlertRecord> alerts = new LinkedHashMap<>();
    private final Map<String, SystemStatus> statuses = new LinkedHashMap<>();
    private long entryCount;

    public InMemoryLogStore() {
        this(DEFAULT_ENTRY_RETENTION);
    }

    /**
     * @param entryRetention maximum number of log entries kept in memory
     */
    public InMemoryLogStore(int entryRetention) {
        if (entryRetention <= 0) {
            throw new IllegalArgumentException("entryRetention must be > 0, got: " + entryRetention);
        }
        this.entryRetention = entryRetention;
    }

    @Override
    public long nextLogEntryId() {
        return entrySequence.incrementAndGet();
    }

    @Override
    public long nextAlertId() {
        return alertSequence.incrementAndGet();
    }

    @Override
    public void save(LogEntry entry, AlertRecord alert) throws PersistenceException {
        if (entry == null) {
            throw new PersistenceException("Log entry must not be null");
        }
        if (alert != null && alert.getLogEntry() != entry) {
            throw new PersistenceException("Alert " + alert.getId() + " does not belong to entry " + entry.getId());
        }
        lock.lock();
        try {
            if (alert != null && alerts.containsKey(alert.getId())) {
                throw new PersistenceException("Duplicate alert id " + alert.getId());
            }
            entries.addLast(entry);
            entryCount++;
            while (entries.size() > entryRetention) {
                entries.removeFirst();
            }
            if (alert != null) {
                alerts.put(alert.getId(), alert);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AckOutcome acknowledge(long alertId, Instant at) {
        AlertRecord alert;
        lock.lock();
        try {
            alert = alerts.get(alertId);
        } finally {
            lock.unlock();
        }
        if (alert == null) {
            return AckOutcome.NOT_FOUND;
        }
        return alert.acknowledge(at) ? AckOutcome.ACKNOWLEDGED : AckOutcome.ALREADY_ACKNOWLEDGED;
    }

    @Override
    public Optional<AlertRecord> findAlert(long alertId) {
        lock.lock();
        try {
            return Optional.ofNullable(alerts.get(alertId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<LogEntry> findEntry(long entryId) {
        lock.lock();
        try {
            for (LogEntry e : entries) {
                if (e.getId() == entryId) {
                    return Optional.of(e);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AlertRecord> recentAlerts(int limit) {
        lock.lock();
        try {
            List<AlertRecord> all = new ArrayList<>(alerts.values());
            List<AlertRecord> out = new ArrayList<>();
            for (int i = all.size() - 1; i >= 0 && out.size() < limit; i--) {
                out.add(all.get(i));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<LogEntry> recentEntries(int limit) {
        lock.lock();
        try {
            List<LogEntry> out = new ArrayList<>();
            Iterator<LogEntry> it = entries.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long entryCount() {
        lock.lock();
        try {
            return entryCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long alertCount() {
        lock.lock();
        try {
            return alerts.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long unacknowledgedAlertCount() {
        lock.lock();
        try {
            return alerts.values().stream().filter(a -> !a.isAcknowledged()).count();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateSystemStatus(SystemStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        lock.lock();
        try {
            statuses.put(status.getServiceName(), status);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<SystemStatus> findSystemStatus(String serviceName) {
        lock.lock();
        try {
            return Optional.ofNullable(statuses.get(serviceName));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Collection<SystemStatus> systemStatuses() {
        lock.lock();
        try {
            return new ArrayList<>(statuses.values());
        } finally {
            lock.unlock();
        }
    }
}
