package com.logsentinel.core.pipeline;

import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.ParsedRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one line in {@link LogPipeline#process(String)}.
 *
 * @since 1.0.0
 */
public final class ProcessingOutcome {

    private final long sequence;
    private final ParsedRecord record;
    private final ClassificationResult result;
    private final LogEntry entry;
    private final AlertRecord alert;
    private final FailureKind failureKind;

    ProcessingOutcome(long sequence, ParsedRecord record, ClassificationResult result, LogEntry entry,
            AlertRecord alert, FailureKind failureKind) {
        this.sequence = sequence;
        this.record = Objects.requireNonNull(record, "record must not be null");
        this.result = result;
        this.entry = entry;
        this.alert = alert;
        this.failureKind = Objects.requireNonNull(failureKind, "failureKind must not be null");
    }

    /**
     * @return per-pipeline sequence number of the line, starting at 1
     */
    public long getSequence() {
        return sequence;
    }

    public ParsedRecord getRecord() {
        return record;
    }

    public Optional<ClassificationResult> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * @return the stored entry; empty only for {@link FailureKind#PERSISTENCE_FAILURE}
     */
    public Optional<LogEntry> getEntry() {
        return Optional.ofNullable(entry);
    }

    public Optional<AlertRecord> getAlert() {
        return Optional.ofNullable(alert);
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public boolean isPersisted() {
        return entry != null;
    }

    @Override
    public String toString() {
        return "ProcessingOutcome{" +
                "sequence=" + sequence +
                ", failureKind=" + failureKind +
                ", classId=" + (result != null ? result.getClassId() : null) +
                ", alert=" + (alert != null ? alert.getId() : null) +
                '}';
    }
}
