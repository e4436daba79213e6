package com.logsentinel.core.pipeline;

import com.logsentinel.core.alert.AlertPolicy;
import com.logsentinel.core.alert.InMemoryLogStore;
import com.logsentinel.core.alert.PersistenceException;
import com.logsentinel.core.calibration.ThresholdCalibrator;
import com.logsentinel.core.classify.ClassificationDispatcher;
import com.logsentinel.core.classify.ClassificationStats;
import com.logsentinel.core.classify.LogClassifier;
import com.logsentinel.core.delivery.DeliveryChannel;
import com.logsentinel.core.delivery.DeliveryPayload;
import com.logsentinel.core.delivery.LiveFeed;
import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.Severity;
import com.logsentinel.core.parse.AddressResolver;
import com.logsentinel.core.parse.LogLineParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LogPipeline}.
 */
class LogPipelineTest {

    private static final Instant NOW = Instant.parse("2024-07-01T00:00:00Z");

    private static final String SECURITY_LINE =
            "Jun 14 15:16:01 combo sshd(pam_unix)[19939]: authentication failure; rhost=218.188.2.4 user=root";
    private static final String NORMAL_LINE = "Jun  9 06:06:20 combo syslogd 1.4.1: restart.";

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private KeywordClassifier classifier;
    private ThresholdCalibrator calibrator;
    private InMemoryLogStore store;
    private LiveFeed feed;
    private RecordingDelivery delivery;
    private LogPipeline pipeline;

    @BeforeEach
    void setUp() {
        classifier = new KeywordClassifier();
        calibrator = ThresholdCalibrator.builder().clock(clock).build();
        store = new InMemoryLogStore();
        feed = new LiveFeed();
        delivery = new RecordingDelivery();
        pipeline = newPipeline(store);
        pipeline.start();
    }

    private LogPipeline newPipeline(InMemoryLogStore target) {
        return LogPipeline.builder()
                .parser(new LogLineParser(new AddressResolver(), clock))
                .dispatcher(new ClassificationDispatcher(classifier, calibrator, new ClassificationStats()))
                .calibrator(calibrator)
                .alertPolicy(new AlertPolicy(target, clock))
                .feed(feed)
                .delivery(delivery)
                .clock(clock)
                .build();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should refuse lines before start and after stop, and not restart")
    void shouldEnforceLifecycle() {
        LogPipeline fresh = newPipeline(new InMemoryLogStore());
        assertThatThrownBy(() -> fresh.process(NORMAL_LINE)).isInstanceOf(IllegalStateException.class);

        fresh.start();
        assertThat(fresh.isRunning()).isTrue();
        fresh.stop();

        assertThat(fresh.isRunning()).isFalse();
        assertThat(delivery.closed).isTrue();
        assertThatThrownBy(() -> fresh.process(NORMAL_LINE)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(fresh::start).isInstanceOf(IllegalStateException.class);
    }

    // ---------------------------------------------------------------
    // Happy path
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should alert, publish and deliver a security line")
    void shouldProcessSecurityLine() {
        ProcessingOutcome outcome = pipeline.process(SECURITY_LINE);

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.NONE);
        assertThat(outcome.isPersisted()).isTrue();
        AlertRecord alert = outcome.getAlert().orElseThrow();
        assertThat(alert.getClassName()).isEqualTo("Security Anomaly");
        assertThat(alert.getThresholdAtDetection()).isEqualTo(0.5);
        assertThat(store.alertCount()).isEqualTo(1);

        assertThat(feed.recent(1)).singleElement()
                .satisfies(u -> assertThat(u.getAlertId()).isEqualTo(alert.getId()));
        assertThat(delivery.payloads).singleElement()
                .satisfies(p -> {
                    assertThat(p.getClassificationClass()).isEqualTo(1);
                    assertThat(p.getSource()).isEqualTo("linux");
                    assertThat(p.getSeverity()).isEqualTo("critical");
                });
    }

    @Test
    @DisplayName("Should store a normal line without an alert")
    void shouldProcessNormalLine() {
        ProcessingOutcome outcome = pipeline.process(NORMAL_LINE);

        assertThat(outcome.getAlert()).isEmpty();
        assertThat(outcome.getEntry().orElseThrow().getAnomaly()).isFalse();
        assertThat(store.alertCount()).isZero();
        assertThat(delivery.payloads).hasSize(1);
    }

    // ---------------------------------------------------------------
    // Failure handling
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should store a log-only entry while the model is not loaded")
    void shouldStoreLogOnlyWhenModelUnavailable() {
        classifier.ready = false;

        ProcessingOutcome outcome = pipeline.process(SECURITY_LINE);

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.MODEL_UNAVAILABLE);
        assertThat(outcome.getResult()).isEmpty();
        assertThat(outcome.getAlert()).isEmpty();
        LogEntry entry = outcome.getEntry().orElseThrow();
        assertThat(entry.getClassId()).isNull();
        assertThat(entry.getAnomalyScore()).isNull();
        assertThat(entry.getSeverity()).isNull();
        assertThat(store.entryCount()).isEqualTo(1);
        assertThat(store.alertCount()).isZero();
        assertThat(feed.recent(10)).isEmpty();
        assertThat(delivery.payloads).isEmpty();
        assertThat(pipeline.failureCount(FailureKind.MODEL_UNAVAILABLE)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should store a log-only entry when inference fails")
    void shouldStoreLogOnlyOnInferenceFailure() {
        classifier.failure = new IllegalStateException("model crashed");

        ProcessingOutcome outcome = pipeline.process(SECURITY_LINE);

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.INFERENCE_FAILURE);
        assertThat(outcome.isPersisted()).isTrue();
        assertThat(store.alertCount()).isZero();
    }

    @Test
    @DisplayName("Should drop the line and keep running when the store fails")
    void shouldSurvivePersistenceFailure() {
        LogPipeline failing = newPipeline(new InMemoryLogStore() {
            @Override
            public void save(LogEntry entry, AlertRecord alert) throws PersistenceException {
                throw new PersistenceException("database is locked");
            }
        });
        failing.start();

        ProcessingOutcome outcome = failing.process(SECURITY_LINE);
        ProcessingOutcome next = failing.process(NORMAL_LINE);

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.PERSISTENCE_FAILURE);
        assertThat(outcome.isPersisted()).isFalse();
        assertThat(outcome.getResult()).isPresent();
        assertThat(next.getFailureKind()).isEqualTo(FailureKind.PERSISTENCE_FAILURE);
        assertThat(failing.failureCount(FailureKind.PERSISTENCE_FAILURE)).isEqualTo(2);
        assertThat(delivery.payloads).isEmpty();
    }

    @Test
    @DisplayName("Should flag a line without a timestamp as degraded")
    void shouldFlagDegradedTimestamp() {
        ProcessingOutcome outcome = pipeline.process("something happened somewhere");

        assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.PARSE_DEGRADED);
        assertThat(outcome.getEntry().orElseThrow().getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should store one entry per line whatever the outcome")
    void shouldStoreEveryLine() {
        List<String> lines = List.of(NORMAL_LINE, SECURITY_LINE, "", "garbage \u0000 line", NORMAL_LINE);
        pipeline.process(lines.get(0));
        pipeline.process(lines.get(1));
        classifier.ready = false;
        pipeline.process(lines.get(2));
        classifier.ready = true;
        classifier.failure = new IllegalStateException("boom");
        pipeline.process(lines.get(3));
        classifier.failure = null;
        pipeline.process(lines.get(4));

        assertThat(pipeline.processedCount()).isEqualTo(lines.size());
        assertThat(store.entryCount()).isEqualTo(lines.size());
        assertThat(store.alertCount()).isEqualTo(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static final class KeywordClassifier implements LogClassifier {
        boolean ready = true;
        RuntimeException failure;

        @Override
        public boolean isReady() {
            return ready;
        }

        @Override
        public ClassificationResult classify(String text) {
            if (failure != null) {
                throw failure;
            }
            if (text.contains("authentication failure")) {
                return ClassificationResult.reported(1, "Security Anomaly", 0.92, Severity.CRITICAL);
            }
            return ClassificationResult.reported(0, "Normal", 0.08, Severity.INFO);
        }
    }

    private static final class RecordingDelivery implements DeliveryChannel {
        final List<DeliveryPayload> payloads = new ArrayList<>();
        boolean closed;

        @Override
        public boolean deliver(DeliveryPayload payload) {
            payloads.add(payload);
            return true;
        }

        @Override
        public CompletableFuture<Boolean> submit(DeliveryPayload payload) {
            return CompletableFuture.completedFuture(deliver(payload));
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
