package com.logsentinel.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of parsing one raw log line.
 *
 * <p>
 * Created once per ingested line by the parser and never mutated. The
 * {@code originAddress} is always non-empty: it is either an address found in
 * the line or one synthesized by the address resolver.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp}, {@code originAddress} and
 * {@code sourceFormat} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParsedRecord {

    private final String rawLine;
    private final Instant timestamp;
    private final boolean timestampDegraded;
    private final String originAddress;
    private final String hostname;
    private final SourceFormat sourceFormat;
    private final String categoryTag;
    private final String messageBody;

    private ParsedRecord(Builder b) {
        this.rawLine = b.rawLine != null ? b.rawLine : "";
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.timestampDegraded = b.timestampDegraded;
        this.originAddress = Objects.requireNonNull(b.originAddress, "originAddress must not be null");
        if (originAddress.isBlank()) {
            throw new IllegalArgumentException("originAddress must not be blank");
        }
        this.hostname = b.hostname;
        this.sourceFormat = Objects.requireNonNull(b.sourceFormat, "sourceFormat must not be null");
        this.categoryTag = b.categoryTag != null ? b.categoryTag : "unknown";
        this.messageBody = b.messageBody != null ? b.messageBody : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ParsedRecord}.
     */
    public static class Builder {
        private String rawLine;
        private Instant timestamp;
        private boolean timestampDegraded;
        private String originAddress;
        private String hostname;
        private SourceFormat sourceFormat;
        private String categoryTag;
        private String messageBody;

        public Builder rawLine(String rawLine) {
            this.rawLine = rawLine;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder timestampDegraded(boolean timestampDegraded) {
            this.timestampDegraded = timestampDegraded;
            return this;
        }

        public Builder originAddress(String originAddress) {
            this.originAddress = originAddress;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder sourceFormat(SourceFormat sourceFormat) {
            this.sourceFormat = sourceFormat;
            return this;
        }

        public Builder categoryTag(String categoryTag) {
            this.categoryTag = categoryTag;
            return this;
        }

        public Builder messageBody(String messageBody) {
            this.messageBody = messageBody;
            return this;
        }

        public ParsedRecord build() {
            return new ParsedRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return the line exactly as received
     */
    public String getRawLine() {
        return rawLine;
    }

    /**
     * @return the event time, or the processing time when the line carried
     *         no parseable timestamp
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return {@code true} when the timestamp fell back to processing time
     */
    public boolean isTimestampDegraded() {
        return timestampDegraded;
    }

    public String getOriginAddress() {
        return originAddress;
    }

    /**
     * @return hostname token of a syslog line, if there was one
     */
    public Optional<String> getHostname() {
        return Optional.ofNullable(hostname);
    }

    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    public String getCategoryTag() {
        return categoryTag;
    }

    public String getMessageBody() {
        return messageBody;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParsedRecord that))
            return false;
        return timestampDegraded == that.timestampDegraded
                && rawLine.equals(that.rawLine)
                && timestamp.equals(that.timestamp)
                && originAddress.equals(that.originAddress)
                && Objects.equals(hostname, that.hostname)
                && sourceFormat == that.sourceFormat
                && categoryTag.equals(that.categoryTag)
                && messageBody.equals(that.messageBody);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawLine, timestamp, originAddress, sourceFormat, categoryTag, messageBody);
    }

    @Override
    public String toString() {
        return "ParsedRecord{" +
                "timestamp=" + timestamp +
                ", originAddress='" + originAddress + '\'' +
                ", sourceFormat=" + sourceFormat +
                ", categoryTag='" + categoryTag + '\'' +
                ", messageBody='" + messageBody + '\'' +
                '}';
    }
}
