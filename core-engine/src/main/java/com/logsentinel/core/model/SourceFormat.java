package com.logsentinel.core.model;

/**
 * Structural format of an ingested log line, as recognised by the parser.
 *
 * @since 1.0.0
 */
public enum SourceFormat {

    /** Apache error log ({@code [Sun Dec 04 04:47:44 2005] [error] ...}) or access log. */
    APACHE("apache", "apache"),

    /** BSD syslog ({@code Jun  9 06:06:20 host service: ...}). */
    SYSLOG("syslog", "linux"),

    /** Anything else. */
    GENERIC("generic", "generic");

    private final String label;
    private final String sourceName;

    SourceFormat(String label, String sourceName) {
        this.label = label;
        this.sourceName = sourceName;
    }

    /**
     * @return lowercase format label ({@code apache}, {@code syslog}, {@code generic})
     */
    public String label() {
        return label;
    }

    /**
     * @return the producing system as reported to the collector's {@code source} field
     */
    public String sourceName() {
        return sourceName;
    }
}
