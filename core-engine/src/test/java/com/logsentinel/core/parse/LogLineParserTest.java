package com.logsentinel.core.parse;

import com.logsentinel.core.model.ParsedRecord;
import com.logsentinel.core.model.SourceFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LogLineParser}.
 */
class LogLineParserTest {

    private static final Instant NOW = Instant.parse("2024-07-01T00:00:00Z");

    private AddressResolver resolver;
    private LogLineParser parser;

    @BeforeEach
    void setUp() {
        resolver = new AddressResolver();
        parser = new LogLineParser(resolver, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ---------------------------------------------------------------
    // Syslog
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should parse a syslog line with a synthesized host address")
    void shouldParseSyslogRestart() {
        ParsedRecord record = parser.parse("Jun  9 06:06:20 combo syslogd 1.4.1: restart.");

        assertThat(record.getSourceFormat()).isEqualTo(SourceFormat.SYSLOG);
        assertThat(record.getCategoryTag()).isEqualTo("info");
        assertThat(record.getHostname()).contains("combo");
        assertThat(record.getOriginAddress()).isEqualTo("192.168.198.156");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-06-09T06:06:20Z"));
        assertThat(record.isTimestampDegraded()).isFalse();
        assertThat(record.getMessageBody()).isEqualTo("syslogd 1.4.1: restart.");
    }

    @Test
    @DisplayName("Should keep the same address for a hostname across lines")
    void shouldKeepAddressStableAcrossLines() {
        String first = parser.parse("Jun  9 06:06:20 combo syslogd 1.4.1: restart.").getOriginAddress();
        String second = parser.parse("Jun  9 06:06:21 combo kernel: klogd 1.4.1, log source = /proc/kmsg started.")
                .getOriginAddress();

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should prefer an address in the syslog body over the hostname")
    void shouldPreferBodyAddress() {
        ParsedRecord record = parser.parse("Jun 14 15:16:01 combo sshd(pam_unix)[19939]: authentication failure; "
                + "logname= uid=0 euid=0 tty=NODEVssh ruser= rhost=218.188.2.4");

        assertThat(record.getCategoryTag()).isEqualTo("auth");
        assertThat(record.getOriginAddress()).isEqualTo("218.188.2.4");
    }

    @Test
    @DisplayName("Should map service names by priority kernel, error, warning, auth, info")
    void shouldMapServiceNames() {
        assertThat(LogLineParser.categoryForService("kernel")).isEqualTo("kernel");
        assertThat(LogLineParser.categoryForService("smartd-failover")).isEqualTo("error");
        assertThat(LogLineParser.categoryForService("critmon")).isEqualTo("error");
        assertThat(LogLineParser.categoryForService("warnd")).isEqualTo("warning");
        assertThat(LogLineParser.categoryForService("sshd")).isEqualTo("auth");
        assertThat(LogLineParser.categoryForService("su(pam_unix)")).isEqualTo("auth");
        assertThat(LogLineParser.categoryForService("crond")).isEqualTo("info");
        // first match wins
        assertThat(LogLineParser.categoryForService("kernel-auth")).isEqualTo("kernel");
        assertThat(LogLineParser.categoryForService("auth-error")).isEqualTo("error");
    }

    @Test
    @DisplayName("Should degrade an unreadable syslog timestamp to processing time")
    void shouldDegradeBadSyslogTimestamp() {
        ParsedRecord record = parser.parse("Foo 12 10:00:00 combo kernel: something");

        assertThat(record.getSourceFormat()).isEqualTo(SourceFormat.SYSLOG);
        assertThat(record.isTimestampDegraded()).isTrue();
        assertThat(record.getTimestamp()).isEqualTo(NOW);
        assertThat(record.getCategoryTag()).isEqualTo("kernel");
    }

    @Test
    @DisplayName("Should date a year-end syslog line read just after new year in the previous year")
    void shouldRollSyslogYearBack() {
        LogLineParser newYear = new LogLineParser(resolver,
                Clock.fixed(Instant.parse("2025-01-01T00:00:30Z"), ZoneOffset.UTC));

        ParsedRecord late = newYear.parse("Dec 31 23:59:59 combo crond[2211]: session closed");
        ParsedRecord current = newYear.parse("Jan  1 00:00:10 combo crond[2211]: session opened");

        assertThat(late.getTimestamp()).isEqualTo(Instant.parse("2024-12-31T23:59:59Z"));
        assertThat(late.isTimestampDegraded()).isFalse();
        assertThat(current.getTimestamp()).isEqualTo(Instant.parse("2025-01-01T00:00:10Z"));
    }

    // ---------------------------------------------------------------
    // Apache
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should parse an Apache error log line")
    void shouldParseApacheError() {
        ParsedRecord record = parser.parse("[Sun Dec 04 04:47:44 2005] [error] mod_jk child workerEnv in error state 6");

        assertThat(record.getSourceFormat()).isEqualTo(SourceFormat.APACHE);
        assertThat(record.getCategoryTag()).isEqualTo("error");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2005-12-04T04:47:44Z"));
        assertThat(record.isTimestampDegraded()).isFalse();
        assertThat(record.getMessageBody()).isEqualTo("mod_jk child workerEnv in error state 6");
        assertThat(record.getOriginAddress()).isNotBlank();
    }

    @Test
    @DisplayName("Should treat a kernel uptime stamp as a generic line, not an Apache year")
    void shouldNotMistakeKernelUptimeForApache() {
        ParsedRecord early = parser.parse("[    0.155678] ACPI: Core revision 20190703");
        ParsedRecord late = parser.parse("[ 1234.567890] usb 1-1: new high-speed USB device number 2 using ehci_hcd");

        assertThat(early.getSourceFormat()).isEqualTo(SourceFormat.GENERIC);
        assertThat(late.getSourceFormat()).isEqualTo(SourceFormat.GENERIC);
        assertThat(late.getMessageBody()).startsWith("[ 1234.567890] usb 1-1");
    }

    @Test
    @DisplayName("Should take the client address from an Apache error line")
    void shouldTakeApacheClientAddress() {
        ParsedRecord record = parser.parse(
                "[Sun Dec 04 07:45:45 2005] [error] [client 63.13.186.196] Directory index forbidden by rule: /var/www/html/");

        assertThat(record.getOriginAddress()).isEqualTo("63.13.186.196");
        assertThat(record.getHostname()).isEmpty();
    }

    @Test
    @DisplayName("Should parse an Apache access log line")
    void shouldParseApacheAccess() {
        ParsedRecord record = parser.parse(
                "192.168.0.7 - - [10/Oct/2000:13:55:36 -0700] \"GET /apache_pb.gif HTTP/1.0\" 503 2326");

        assertThat(record.getSourceFormat()).isEqualTo(SourceFormat.APACHE);
        assertThat(record.getCategoryTag()).isEqualTo("error");
        assertThat(record.getOriginAddress()).isEqualTo("192.168.0.7");
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2000-10-10T20:55:36Z"));
    }

    // ---------------------------------------------------------------
    // Generic
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should honour a leading ISO timestamp in generic lines")
    void shouldParseGenericIsoTimestamp() {
        ParsedRecord record = parser.parse("2024-03-01 12:00:00 ERROR Database connection lost");

        assertThat(record.getSourceFormat()).isEqualTo(SourceFormat.GENERIC);
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(record.isTimestampDegraded()).isFalse();
        assertThat(record.getCategoryTag()).isEqualTo("error");
        assertThat(record.getMessageBody()).isEqualTo("ERROR Database connection lost");
        assertThat(record.getOriginAddress()).startsWith("172.16.0.");
    }

    @Test
    @DisplayName("Should apply an explicit offset in ISO timestamps")
    void shouldApplyIsoOffset() {
        ParsedRecord record = parser.parse("2024-03-01T12:00:00+0200 WARN queue is filling up");

        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(record.getCategoryTag()).isEqualTo("warning");
    }

    @Test
    @DisplayName("Should use processing time for lines without a timestamp")
    void shouldUseProcessingTimeForGenericLines() {
        ParsedRecord record = parser.parse("something odd happened");

        assertThat(record.getSourceFormat()).isEqualTo(SourceFormat.GENERIC);
        assertThat(record.getTimestamp()).isEqualTo(NOW);
        assertThat(record.isTimestampDegraded()).isTrue();
        assertThat(record.getCategoryTag()).isEqualTo("unknown");
        assertThat(record.getOriginAddress()).isEqualTo(AddressResolver.DEFAULT_ADDRESS);
    }

    // ---------------------------------------------------------------
    // Robustness
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should never return null or an empty address")
    void shouldNeverFail() {
        List<String> lines = List.of("", "   ", "[", "[]", "[2005", "[2005] [", "\u0000\u0001\u0002",
                "Jun", "Jun 9", "Jun 99 99:99:99 host", "192.168.1.1", "- - - [", "\"\" 200",
                "x".repeat(10_000), "[Mon Feb 30 10:00:00 2005] [warn] odd date");

        for (String line : lines) {
            ParsedRecord record = parser.parse(line);
            assertThat(record).as("record for '%s'", line).isNotNull();
            assertThat(record.getOriginAddress()).as("address for '%s'", line).isNotBlank();
            assertThat(record.getTimestamp()).isNotNull();
        }
        assertThat(parser.parse(null).getMessageBody()).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to 'unknown' when the resolver fails")
    void shouldSurviveResolverFailure() {
        AddressResolver failing = new AddressResolver() {
            @Override
            public String resolve(String body, String hostname) {
                throw new IllegalStateException("boom");
            }
        };
        LogLineParser p = new LogLineParser(failing, Clock.fixed(NOW, ZoneOffset.UTC));

        ParsedRecord record = p.parse("Jun  9 06:06:20 combo syslogd 1.4.1: restart.");

        assertThat(record.getOriginAddress()).isEqualTo(LogLineParser.UNKNOWN_ADDRESS);
        assertThat(record.getSourceFormat()).isEqualTo(SourceFormat.SYSLOG);
    }
}
