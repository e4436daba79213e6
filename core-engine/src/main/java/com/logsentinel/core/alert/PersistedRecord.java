package com.logsentinel.core.alert;

import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.LogEntry;

import java.util.Objects;
import java.util.Optional;

/**
 * What {@link AlertPolicy#persist} stored for one record.
 *
 * @since 1.0.0
 */
public final class PersistedRecord {

    private final LogEntry entry;
    private final AlertRecord alert;

    PersistedRecord(LogEntry entry, AlertRecord alert) {
        this.entry = Objects.requireNonNull(entry, "entry must not be null");
        this.alert = alert;
    }

    public LogEntry getEntry() {
        return entry;
    }

    public Optional<AlertRecord> getAlert() {
        return Optional.ofNullable(alert);
    }
}
