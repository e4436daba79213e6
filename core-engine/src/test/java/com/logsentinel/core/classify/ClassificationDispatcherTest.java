package com.logsentinel.core.classify;

import com.logsentinel.core.calibration.CalibrationMetrics;
import com.logsentinel.core.calibration.ThresholdCalibrator;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ClassificationDispatcher}.
 */
class ClassificationDispatcherTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private StubClassifier classifier;
    private ThresholdCalibrator calibrator;
    private ClassificationStats stats;
    private ClassificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        classifier = new StubClassifier();
        calibrator = ThresholdCalibrator.builder().clock(Clock.fixed(T0, ZoneOffset.UTC)).build();
        stats = new ClassificationStats();
        dispatcher = new ClassificationDispatcher(classifier, calibrator, stats);
    }

    // ---------------------------------------------------------------
    // Failure paths
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should fail with ModelUnavailable and leave stats and pools untouched")
    void shouldRejectWhenModelNotReady() {
        classifier.ready = false;

        assertThatThrownBy(() -> dispatcher.dispatch("disk failure", T0))
                .isInstanceOf(ModelUnavailableException.class);

        assertThat(classifier.calls).isEmpty();
        assertThat(stats.total()).isZero();
        CalibrationMetrics m = calibrator.metrics();
        assertThat(m.getNormalPoolSize() + m.getAbnormalPoolSize()).isZero();
    }

    @Test
    @DisplayName("Should wrap a runtime failure of the classifier as InferenceFailure")
    void shouldWrapRuntimeFailure() {
        classifier.failure = new IllegalStateException("tensor shape mismatch");

        assertThatThrownBy(() -> dispatcher.dispatch("x", T0))
                .isInstanceOf(InferenceFailureException.class)
                .hasMessageContaining("tensor shape mismatch")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(stats.total()).isZero();
    }

    @Test
    @DisplayName("Should treat a missing result as InferenceFailure")
    void shouldRejectNullResult() {
        classifier.next = null;

        assertThatThrownBy(() -> dispatcher.dispatch("x", T0))
                .isInstanceOf(InferenceFailureException.class);
        assertThat(calibrator.metrics().getAbnormalPoolSize()).isZero();
    }

    // ---------------------------------------------------------------
    // Success path
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should count the class and record the score against the current threshold")
    void shouldApplySuccessSideEffects() throws Exception {
        classifier.next = ClassificationResult.reported(1, "Security Anomaly", 0.8, Severity.CRITICAL);

        DispatchOutcome outcome = dispatcher.dispatch("Failed password for root", T0.plusSeconds(10));

        assertThat(outcome.getResult().getClassId()).isEqualTo(1);
        assertThat(outcome.getThreshold()).isEqualTo(0.5);
        assertThat(stats.count(1)).isEqualTo(1);
        assertThat(stats.snapshot()).containsEntry("Security Anomaly", 1L).containsEntry("Normal", 0L);
        assertThat(calibrator.metrics().getAbnormalPoolSize()).isEqualTo(1);
        assertThat(classifier.calls).containsExactly("Failed password for root");
    }

    @Test
    @DisplayName("Should classify a null body as empty text")
    void shouldClassifyNullBodyAsEmpty() throws Exception {
        dispatcher.dispatch(null, T0);

        assertThat(classifier.calls).containsExactly("");
    }

    @Test
    @DisplayName("Should recalibrate once the interval has elapsed before recording the new score")
    void shouldTriggerRecalibration() throws Exception {
        classifier.next = ClassificationResult.reported(0, "Normal", 0.05, null);
        for (int i = 0; i < 100; i++) {
            dispatcher.dispatch("ok", T0.plusSeconds(1));
        }
        classifier.next = ClassificationResult.reported(2, "System Failure", 0.9, null);
        for (int i = 0; i < 10; i++) {
            dispatcher.dispatch("kernel panic", T0.plusSeconds(2));
        }
        assertThat(calibrator.currentThreshold()).isEqualTo(0.5);

        DispatchOutcome outcome = dispatcher.dispatch("kernel panic", T0.plusSeconds(301));

        assertThat(calibrator.lastRecalibratedAt()).isEqualTo(T0.plusSeconds(301));
        assertThat(calibrator.currentThreshold()).isEqualTo(0.3);
        assertThat(outcome.getThreshold()).isEqualTo(0.3);
        assertThat(stats.total()).isEqualTo(111);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static final class StubClassifier implements LogClassifier {
        boolean ready = true;
        RuntimeException failure;
        ClassificationResult next = ClassificationResult.reported(0, "Normal", 0.1, null);
        final List<String> calls = new ArrayList<>();

        @Override
        public boolean isReady() {
            return ready;
        }

        @Override
        public ClassificationResult classify(String text) {
            calls.add(text);
            if (failure != null) {
                throw failure;
            }
            return next;
        }
    }
}
