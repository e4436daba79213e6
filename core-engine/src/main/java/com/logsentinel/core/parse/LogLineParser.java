package com.logsentinel.core.parse;

import com.logsentinel.core.model.ParsedRecord;
import com.logsentinel.core.model.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects the format of a raw log line and extracts its fields.
 *
 * <h3>Formats</h3>
 * <ul>
 * <li><b>Apache error log</b>: a leading bracketed group ending in a time of
 * day and a four-digit year, e.g. {@code [Sun Dec 04 04:47:44 2005] [error] message}. The second
 * bracketed group is the category tag.</li>
 * <li><b>Apache access log</b>:
 * {@code host ident user [dd/MMM/yyyy:HH:mm:ss Z] "request" status size}.
 * The category tag follows the status class.</li>
 * <li><b>Syslog</b>: {@code Mon dd HH:mm:ss hostname service: message}. The
 * year comes from the clock, or is the previous year when the stamp would lie
 * more than a day in the future; the category tag is derived from the service
 * name.</li>
 * <li><b>Generic</b>: anything else. A leading ISO-8601 timestamp is used when
 * present; the category tag comes from message keywords.</li>
 * </ul>
 *
 * <p>
 * {@link #parse(String)} never throws and never returns {@code null}. A
 * timestamp that cannot be read is replaced by the clock's current instant and
 * the record is flagged with {@link ParsedRecord#isTimestampDegraded()}.
 * </p>
 *
 * @since 1.0.0
 */
public class LogLineParser {

    private static final Logger LOG = LoggerFactory.getLogger(LogLineParser.class);

    /** Address used when the resolver itself fails. */
    public static final String UNKNOWN_ADDRESS = "unknown";

    /** The year must follow a time of day; kernel uptime stamps such as {@code [ 1234.5]} do not match. */
    private static final Pattern APACHE_ERROR = Pattern.compile(
            "^\\[([^\\]]*\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?\\s+\\d{4})\\]\\s*(?:\\[([^\\]]*)\\])?\\s*(.*)$",
            Pattern.DOTALL);

    private static final Pattern APACHE_ACCESS = Pattern.compile(
            "^(\\S+) \\S+ \\S+ \\[([^\\]]+)\\] \"[^\"]*\" (\\d{3})\\b.*$", Pattern.DOTALL);

    private static final Pattern SYSLOG = Pattern.compile(
            "^([A-Za-z]{3})\\s+(\\d{1,2})\\s+(\\d{2}:\\d{2}:\\d{2})\\s+(\\S+)\\s*(.*)$", Pattern.DOTALL);

    private static final Pattern ISO_PREFIX = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2})[T ](\\d{2}:\\d{2}:\\d{2})(?:[.,]\\d+)?(Z|[+-]\\d{2}:?\\d{2})?\\s*(.*)$",
            Pattern.DOTALL);

    private static final Pattern SERVICE_TOKEN = Pattern.compile("^([^\\s\\[:]+)");
    private static final Pattern FRACTION = Pattern.compile("(\\d{2}:\\d{2}:\\d{2})\\.\\d+");

    private static final DateTimeFormatter APACHE_ERROR_TIME =
            DateTimeFormatter.ofPattern("MMM d HH:mm:ss yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter APACHE_ACCESS_TIME =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);
    private static final DateTimeFormatter SYSLOG_TIME =
            DateTimeFormatter.ofPattern("MMM d HH:mm:ss yyyy", Locale.ENGLISH);

    /** A syslog stamp further ahead of the clock than this belongs to the previous year. */
    private static final Duration SYSLOG_FUTURE_TOLERANCE = Duration.ofDays(1);

    private final AddressResolver resolver;
    private final Clock clock;

    public LogLineParser() {
        this(new AddressResolver(), Clock.systemUTC());
    }

    /**
     * @param resolver origin address resolver; must not be {@code null}
     * @param clock    processing clock, used for syslog years and timestamp
     *                 fallback; must not be {@code null}
     */
    public LogLineParser(AddressResolver resolver, Clock clock) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Parse one raw line.
     *
     * @param rawLine line as received; {@code null} is treated as empty
     * @return the parsed record, never {@code null}
     */
    public ParsedRecord parse(String rawLine) {
        String raw = rawLine != null ? rawLine : "";
        String line = raw.strip();
        try {
            Matcher m = APACHE_ERROR.matcher(line);
            if (m.matches()) {
                return parseApacheError(raw, m);
            }
            m = APACHE_ACCESS.matcher(line);
            if (m.matches()) {
                return parseApacheAccess(raw, line, m);
            }
            m = SYSLOG.matcher(line);
            if (m.matches()) {
                return parseSyslog(raw, m);
            }
            return parseGeneric(raw, line);
        } catch (RuntimeException e) {
            LOG.warn("Falling back to raw record after parse error: {}", e.toString());
            return ParsedRecord.builder()
                    .rawLine(raw)
                    .timestamp(clock.instant())
                    .timestampDegraded(true)
                    .originAddress(UNKNOWN_ADDRESS)
                    .sourceFormat(SourceFormat.GENERIC)
                    .messageBody(line)
                    .build();
        }
    }

    /**
     * Map a syslog service name to a category tag. Substrings are tested in
     * the order kernel, error, warning, auth; the first match wins and
     * {@code info} is the fallback.
     *
     * @param service service token, e.g. {@code sshd} or {@code kernel}
     * @return category tag
     */
    public static String categoryForService(String service) {
        String s = service == null ? "" : service.toLowerCase(Locale.ROOT);
        if (s.contains("kernel")) {
            return "kernel";
        }
        if (s.contains("error") || s.contains("fail") || s.contains("crit")) {
            return "error";
        }
        if (s.contains("warn")) {
            return "warning";
        }
        if (s.contains("auth") || s.contains("ssh") || s.contains("sudo") || s.contains("login")
                || s.contains("pam") || s.contains("su(")) {
            return "auth";
        }
        return "info";
    }

    // ---------------------------------------------------------------
    // Formats
    // ---------------------------------------------------------------

    private ParsedRecord parseApacheError(String raw, Matcher m) {
        String timeText = m.group(1).trim();
        String tag = m.group(2);
        String body = m.group(3).trim();

        Instant ts = null;
        try {
            // weekday token is redundant and only causes resolver conflicts
            String noWeekday = timeText.replaceFirst("^[A-Za-z]{3}\\s+", "");
            String noFraction = FRACTION.matcher(noWeekday).replaceFirst("$1");
            ts = LocalDateTime.parse(noFraction, APACHE_ERROR_TIME).atZone(clock.getZone()).toInstant();
        } catch (DateTimeException e) {
            LOG.debug("Unparseable apache timestamp '{}'", timeText);
        }

        String category = "unknown";
        if (tag != null && !tag.isBlank()) {
            String t = tag.trim().toLowerCase(Locale.ROOT);
            int colon = t.lastIndexOf(':');
            category = colon >= 0 ? t.substring(colon + 1) : t;
        }
        return build(raw, ts, SourceFormat.APACHE, category, body, null);
    }

    private ParsedRecord parseApacheAccess(String raw, String line, Matcher m) {
        String host = m.group(1);
        String timeText = m.group(2);
        int status = Integer.parseInt(m.group(3));

        Instant ts = null;
        try {
            ts = OffsetDateTime.parse(timeText, APACHE_ACCESS_TIME).toInstant();
        } catch (DateTimeException e) {
            LOG.debug("Unparseable access-log timestamp '{}'", timeText);
        }

        String category;
        if (status >= 500) {
            category = "error";
        } else if (status >= 400) {
            category = "warning";
        } else {
            category = "info";
        }
        return build(raw, ts, SourceFormat.APACHE, category, line, host);
    }

    private ParsedRecord parseSyslog(String raw, Matcher m) {
        String month = m.group(1);
        String day = m.group(2);
        String time = m.group(3);
        String hostname = m.group(4);
        String rest = m.group(5).trim();

        Instant ts = null;
        try {
            int year = LocalDate.now(clock).getYear();
            String stamp = capitalize(month) + " " + day + " " + time + " ";
            ts = syslogInstant(stamp, year);
            if (ts.isAfter(clock.instant().plus(SYSLOG_FUTURE_TOLERANCE))) {
                ts = syslogInstant(stamp, year - 1);
            }
        } catch (DateTimeException e) {
            LOG.debug("Unparseable syslog timestamp '{} {} {}'", month, day, time);
        }

        Matcher s = SERVICE_TOKEN.matcher(rest);
        String service = s.find() ? s.group(1) : "";
        return build(raw, ts, SourceFormat.SYSLOG, categoryForService(service), rest, hostname);
    }

    private Instant syslogInstant(String stamp, int year) {
        return LocalDateTime.parse(stamp + year, SYSLOG_TIME).atZone(clock.getZone()).toInstant();
    }

    private ParsedRecord parseGeneric(String raw, String line) {
        Instant ts = null;
        String body = line;
        Matcher m = ISO_PREFIX.matcher(line);
        if (m.matches()) {
            try {
                LocalDateTime local = LocalDateTime.parse(m.group(1) + "T" + m.group(2));
                String offset = m.group(3);
                ts = offset == null
                        ? local.atZone(clock.getZone()).toInstant()
                        : local.toInstant(toOffset(offset));
                body = m.group(4).trim();
            } catch (DateTimeException e) {
                LOG.debug("Unparseable ISO timestamp in '{}'", line);
            }
        }
        return build(raw, ts, SourceFormat.GENERIC, categoryForText(body), body, null);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ParsedRecord build(String raw, Instant ts, SourceFormat format, String category, String body,
            String hostname) {
        return ParsedRecord.builder()
                .rawLine(raw)
                .timestamp(ts != null ? ts : clock.instant())
                .timestampDegraded(ts == null)
                .originAddress(resolveSafely(body, hostname))
                .hostname(hostname)
                .sourceFormat(format)
                .categoryTag(category)
                .messageBody(body)
                .build();
    }

    private String resolveSafely(String body, String hostname) {
        try {
            String address = resolver.resolve(body, hostname);
            return address == null || address.isBlank() ? UNKNOWN_ADDRESS : address;
        } catch (RuntimeException e) {
            LOG.warn("Address resolution failed for host '{}': {}", hostname, e.toString());
            return UNKNOWN_ADDRESS;
        }
    }

    static String categoryForText(String body) {
        String s = body.toLowerCase(Locale.ROOT);
        if (s.contains("error") || s.contains("fail") || s.contains("exception") || s.contains("fatal")
                || s.contains("critical")) {
            return "error";
        }
        if (s.contains("warn")) {
            return "warning";
        }
        if (s.contains("info") || s.contains("notice") || s.contains("debug")) {
            return "info";
        }
        return "unknown";
    }

    private static ZoneOffset toOffset(String text) {
        if ("Z".equals(text)) {
            return ZoneOffset.UTC;
        }
        if (text.length() == 5) {
            text = text.substring(0, 3) + ":" + text.substring(3);
        }
        return ZoneOffset.of(text);
    }

    private static String capitalize(String month) {
        return month.substring(0, 1).toUpperCase(Locale.ROOT) + month.substring(1).toLowerCase(Locale.ROOT);
    }
}
