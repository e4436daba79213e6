package com.logsentinel.core.pipeline;

import com.logsentinel.core.classify.LogClassifier;
import com.logsentinel.core.config.SentinelSettings;
import com.logsentinel.core.config.SettingsLoader;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.LogClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SentinelRuntime}.
 */
class SentinelRuntimeTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-07-01T00:00:00Z"), ZoneOffset.UTC);

    /** Reports performance issues for anything mentioning "slow", normal otherwise. */
    private static final LogClassifier CLASSIFIER = new LogClassifier() {
        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public ClassificationResult classify(String text) {
            return text.contains("slow")
                    ? ClassificationResult.reported(LogClass.PERFORMANCE.id(), null, 0.7, null)
                    : ClassificationResult.reported(LogClass.NORMAL.id(), null, 0.1, null);
        }
    };

    @Test
    @DisplayName("Should wire components from the settings")
    void shouldWireFromSettings() {
        SentinelSettings settings = SettingsLoader.fromClasspath("test-pipeline.yml");

        SentinelRuntime runtime = SentinelRuntime.create(settings, CLASSIFIER, null, CLOCK);

        assertThat(runtime.getCalibrator().currentThreshold()).isEqualTo(0.4);
        assertThat(runtime.getCalibrator().candidates(0.4)).containsExactly(0.3, 0.35, 0.4, 0.45, 0.5);
        assertThat(runtime.getAlertPolicy().getAlertingClasses()).containsExactly(1, 2, 3);

        runtime.getPipeline().start();
        ProcessingOutcome outcome = runtime.getPipeline().process("2024-07-01T00:00:00Z disk io slow on sda");
        runtime.getPipeline().stop();

        assertThat(outcome.getAlert()).isPresent();
        assertThat(runtime.getStats().count(LogClass.PERFORMANCE.id())).isEqualTo(1);
        assertThat(runtime.getStore().alertCount()).isEqualTo(1);
        assertThat(runtime.getFeed().recent(5)).hasSize(1);
    }

    @Test
    @DisplayName("Should share the calibrator between pipeline and control plane")
    void shouldShareCalibrator() {
        SentinelRuntime runtime = SentinelRuntime.create(new SentinelSettings(), CLASSIFIER, null, CLOCK);

        runtime.getControlPlane().overrideThreshold(0.9);

        assertThat(runtime.getCalibrator().currentThreshold()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Should persist overrides when a state path is configured")
    void shouldPersistThreshold(@TempDir Path dir) {
        SentinelSettings settings = new SentinelSettings();
        settings.getCalibration().setThresholdStatePath(dir.resolve("threshold.json").toString());

        SentinelRuntime.create(settings, CLASSIFIER, null, CLOCK).getControlPlane().overrideThreshold(0.2);
        SentinelRuntime restarted = SentinelRuntime.create(settings, CLASSIFIER, null, CLOCK);

        assertThat(Files.exists(dir.resolve("threshold.json"))).isTrue();
        assertThat(restarted.getCalibrator().currentThreshold()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Should refuse invalid settings")
    void shouldValidateSettings() {
        SentinelSettings settings = new SentinelSettings();
        settings.getFeed().setCapacity(0);

        assertThatThrownBy(() -> SentinelRuntime.create(settings, CLASSIFIER, null, CLOCK))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("feed.capacity");
    }
}
