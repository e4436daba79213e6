package com.logsentinel.core.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ThresholdFileStore}.
 */
class ThresholdFileStoreTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should write and read back a threshold")
    void shouldRoundTrip() throws Exception {
        Path file = dir.resolve("state/threshold.json");
        ThresholdFileStore store = new ThresholdFileStore(file);

        store.save(0.42, Instant.parse("2024-05-01T10:15:30Z"));

        assertThat(store.load()).hasValue(0.42);
        assertThat(Files.readString(file))
                .contains("\"threshold\":0.42")
                .contains("\"updated_at\":\"2024-05-01T10:15:30Z\"");
    }

    @Test
    @DisplayName("Should return empty when no file exists")
    void shouldReturnEmptyWhenMissing() {
        assertThat(new ThresholdFileStore(dir.resolve("absent.json")).load()).isEmpty();
    }

    @Test
    @DisplayName("Should ignore malformed or out-of-range content")
    void shouldIgnoreBadContent() throws Exception {
        Path garbage = dir.resolve("garbage.json");
        Files.write(garbage, "not json".getBytes(StandardCharsets.UTF_8));
        Path outOfRange = dir.resolve("range.json");
        Files.write(outOfRange, "{\"threshold\": 3.0}".getBytes(StandardCharsets.UTF_8));
        Path wrongType = dir.resolve("type.json");
        Files.write(wrongType, "{\"threshold\": \"high\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(new ThresholdFileStore(garbage).load()).isEmpty();
        assertThat(new ThresholdFileStore(outOfRange).load()).isEmpty();
        assertThat(new ThresholdFileStore(wrongType).load()).isEmpty();
    }

    @Test
    @DisplayName("Should not throw when the target cannot be written")
    void shouldSwallowWriteFailure() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.write(blocker, new byte[0]);
        ThresholdFileStore store = new ThresholdFileStore(blocker.resolve("threshold.json"));

        store.save(0.3, Instant.EPOCH);

        assertThat(store.load()).isEmpty();
    }
}
