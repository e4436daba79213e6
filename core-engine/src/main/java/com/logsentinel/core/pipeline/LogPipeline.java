package com.logsentinel.core.pipeline;

import com.logsentinel.core.alert.AlertPolicy;
import com.logsentinel.core.alert.PersistedRecord;
import com.logsentinel.core.alert.PersistenceException;
import com.logsentinel.core.calibration.ThresholdCalibrator;
import com.logsentinel.core.classify.ClassificationDispatcher;
import com.logsentinel.core.classify.ClassificationException;
import com.logsentinel.core.classify.DispatchOutcome;
import com.logsentinel.core.classify.ModelUnavailableException;
import com.logsentinel.core.delivery.DeliveryChannel;
import com.logsentinel.core.delivery.DeliveryPayload;
import com.logsentinel.core.delivery.FeedUpdate;
import com.logsentinel.core.delivery.LiveFeed;
import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.LogEntry;
import com.logsentinel.core.model.ParsedRecord;
import com.logsentinel.core.parse.LogLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one raw line through parse, classify, persist, feed and delivery.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * A pipeline is created stopped, accepts lines between {@link #start()} and
 * {@link #stop()}, and cannot be restarted. {@link #stop()} closes the
 * delivery channel, which waits a bounded time for in-flight deliveries.
 * </p>
 *
 * <h3>Error Handling</h3>
 * <p>
 * Stage failures never escape {@link #process(String)}; they are reported as
 * a {@link FailureKind} on the returned {@link ProcessingOutcome} and logged
 * with the line's sequence number, stage and kind. A line whose
 * classification fails is still stored log-only.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #process(String)} is meant to be called from a single worker thread.
 * </p>
 *
 * @since 1.0.0
 */
public class LogPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(LogPipeline.class);

    private enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    private final LogLineParser parser;
    private final ClassificationDispatcher dispatcher;
    private final ThresholdCalibrator calibrator;
    private final AlertPolicy alertPolicy;
    private final LiveFeed feed;
    private final DeliveryChannel delivery;
    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();
    private final Map<FailureKind, AtomicLong> failures = new EnumMap<>(FailureKind.class);
    private volatile State state = State.NEW;

    private LogPipeline(Builder b) {
        this.parser = Objects.requireNonNull(b.parser, "parser must not be null");
        this.dispatcher = Objects.requireNonNull(b.dispatcher, "dispatcher must not be null");
        this.calibrator = Objects.requireNonNull(b.calibrator, "calibrator must not be null");
        this.alertPolicy = Objects.requireNonNull(b.alertPolicy, "alertPolicy must not be null");
        this.feed = b.feed;
        this.delivery = b.delivery;
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        for (FailureKind kind : FailureKind.values()) {
            failures.put(kind, new AtomicLong());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link LogPipeline}. Feed and delivery are optional.
     */
    public static class Builder {
        private LogLineParser parser;
        private ClassificationDispatcher dispatcher;
        private ThresholdCalibrator calibrator;
        private AlertPolicy alertPolicy;
        private LiveFeed feed;
        private DeliveryChannel delivery;
        private Clock clock = Clock.systemUTC();

        public Builder parser(LogLineParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder dispatcher(ClassificationDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder calibrator(ThresholdCalibrator calibrator) {
            this.calibrator = calibrator;
            return this;
        }

        public Builder alertPolicy(AlertPolicy alertPolicy) {
            this.alertPolicy = alertPolicy;
            return this;
        }

        public Builder feed(LiveFeed feed) {
            this.feed = feed;
            return this;
        }

        public Builder delivery(DeliveryChannel delivery) {
            this.delivery = delivery;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LogPipeline build() {
            return new LogPipeline(this);
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the pipeline was already stopped
     */
    public synchronized void start() {
        if (state == State.STOPPED) {
            throw new IllegalStateException("Pipeline was stopped and cannot be restarted");
        }
        if (state == State.NEW) {
            state = State.RUNNING;
            LOG.info("Pipeline started (threshold={}, modelReady={})",
                    calibrator.currentThreshold(), dispatcher.isModelReady());
        }
    }

    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        if (delivery != null) {
            delivery.close();
        }
        LOG.info("Pipeline stopped after {} line(s)", sequence.get());
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Process one raw line.
     *
     * @param line raw line as received
     * @return what happened to the line
     * @throws IllegalStateException if the pipeline is not running
     */
    public ProcessingOutcome process(String line) {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Pipeline is not running");
        }
        long seq = sequence.incrementAndGet();
        ParsedRecord record = parser.parse(line);
        Instant now = clock.instant();

        ClassificationResult result = null;
        double threshold;
        FailureKind failure = FailureKind.NONE;
        try {
            DispatchOutcome dispatched = dispatcher.dispatch(record.getMessageBody(), now);
            result = dispatched.getResult();
            threshold = dispatched.getThreshold();
        } catch (ModelUnavailableException e) {
            failure = FailureKind.MODEL_UNAVAILABLE;
            threshold = calibrator.currentThreshold();
            LOG.warn("record={} stage=classify kind={} host={}: {}",
                    seq, failure, record.getOriginAddress(), e.getMessage());
        } catch (ClassificationException e) {
            failure = FailureKind.INFERENCE_FAILURE;
            threshold = calibrator.currentThreshold();
            LOG.warn("record={} stage=classify kind={} host={}: {}",
                    seq, failure, record.getOriginAddress(), e.getMessage());
        } catch (RuntimeException e) {
            failure = FailureKind.INFERENCE_FAILURE;
            threshold = calibrator.currentThreshold();
            LOG.error("record={} stage=classify kind={} host={}", seq, failure, record.getOriginAddress(), e);
        }

        PersistedRecord stored;
        try {
            stored = alertPolicy.persist(record, result, threshold);
        } catch (PersistenceException | RuntimeException e) {
            failures.get(FailureKind.PERSISTENCE_FAILURE).incrementAndGet();
            LOG.error("record={} stage=persist kind={} dropped line: {}",
                    seq, FailureKind.PERSISTENCE_FAILURE, e.getMessage(), e);
            return new ProcessingOutcome(seq, record, result, null, null, FailureKind.PERSISTENCE_FAILURE);
        }

        LogEntry entry = stored.getEntry();
        AlertRecord alert = stored.getAlert().orElse(null);
        if (result != null) {
            publish(seq, entry, alert, threshold);
        }

        if (failure == FailureKind.NONE && record.isTimestampDegraded()) {
            failure = FailureKind.PARSE_DEGRADED;
            LOG.debug("record={} stage=parse kind={}", seq, failure);
        }
        failures.get(failure).incrementAndGet();
        return new ProcessingOutcome(seq, record, result, entry, alert, failure);
    }

    /**
     * @return number of lines accepted so far
     */
    public long processedCount() {
        return sequence.get();
    }

    /**
     * @param kind failure kind
     * @return number of lines that ended with that kind
     */
    public long failureCount(FailureKind kind) {
        return failures.get(kind).get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void publish(long seq, LogEntry entry, AlertRecord alert, double threshold) {
        if (feed != null) {
            feed.publish(new FeedUpdate(entry, alert != null ? alert.getId() : null, threshold));
        }
        if (delivery != null) {
            DeliveryPayload payload = DeliveryPayload.from(entry, clock.getZone());
            delivery.submit(payload).thenAccept(ok -> {
                if (!ok) {
                    LOG.warn("record={} stage=deliver kind=delivery_failed entry={}", seq, entry.getId());
                }
            });
        }
    }
}
