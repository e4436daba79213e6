package com.logsentinel.core.pipeline;

import com.logsentinel.core.alert.AlertPolicy;
import com.logsentinel.core.alert.InMemoryLogStore;
import com.logsentinel.core.alert.LogStore;
import com.logsentinel.core.calibration.ThresholdCalibrator;
import com.logsentinel.core.calibration.ThresholdFileStore;
import com.logsentinel.core.classify.ClassificationDispatcher;
import com.logsentinel.core.classify.ClassificationStats;
import com.logsentinel.core.classify.LogClassifier;
import com.logsentinel.core.config.SentinelSettings;
import com.logsentinel.core.delivery.CollectorIngestService;
import com.logsentinel.core.delivery.DeliveryChannel;
import com.logsentinel.core.delivery.LiveFeed;
import com.logsentinel.core.parse.AddressResolver;
import com.logsentinel.core.parse.LogLineParser;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;

/**
 * Composition root: builds every component once from the settings and wires
 * them together.
 *
 * @since 1.0.0
 */
public final class SentinelRuntime {

    private final ThresholdCalibrator calibrator;
    private final ClassificationStats stats;
    private final ClassificationDispatcher dispatcher;
    private final LogStore store;
    private final AlertPolicy alertPolicy;
    private final LiveFeed feed;
    private final LogPipeline pipeline;
    private final ControlPlane controlPlane;
    private final CollectorIngestService ingestService;

    private SentinelRuntime(SentinelSettings settings, LogClassifier classifier, DeliveryChannel delivery,
            Clock clock) {
        SentinelSettings.Calibration c = settings.getCalibration();
        ThresholdCalibrator.Builder calibratorBuilder = ThresholdCalibrator.builder()
                .initialThreshold(c.getInitialThreshold())
                .recalibrationInterval(Duration.ofSeconds(c.getRecalibrationIntervalSeconds()))
                .windowCapacity(c.getWindowCapacity())
                .candidateStep(c.getCandidateStep())
                .clock(clock);
        if (!c.getThresholdStatePath().isBlank()) {
            calibratorBuilder.store(new ThresholdFileStore(Path.of(c.getThresholdStatePath())));
        }
        this.calibrator = calibratorBuilder.build();
        this.stats = new ClassificationStats();
        this.dispatcher = new ClassificationDispatcher(classifier, calibrator, stats);
        this.store = new InMemoryLogStore(settings.getStore().getEntryRetention());
        this.alertPolicy = new AlertPolicy(new HashSet<>(settings.getAlerting().getAlertClasses()), store, clock);
        this.feed = new LiveFeed(settings.getFeed().getCapacity());
        this.pipeline = LogPipeline.builder()
                .parser(new LogLineParser(new AddressResolver(), clock))
                .dispatcher(dispatcher)
                .calibrator(calibrator)
                .alertPolicy(alertPolicy)
                .feed(feed)
                .delivery(delivery)
                .clock(clock)
                .build();
        this.controlPlane = new ControlPlane(calibrator, alertPolicy, clock);
        this.ingestService = new CollectorIngestService(alertPolicy, calibrator, feed, clock);
    }

    /**
     * @param settings   validated settings
     * @param classifier classification model
     * @param delivery   collector channel, or {@code null} to disable delivery
     * @param clock      processing clock
     * @return a wired runtime whose pipeline is not yet started
     */
    public static SentinelRuntime create(SentinelSettings settings, LogClassifier classifier,
            DeliveryChannel delivery, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        settings.validate();
        return new SentinelRuntime(settings, classifier, delivery, clock);
    }

    public ThresholdCalibrator getCalibrator() {
        return calibrator;
    }

    public ClassificationStats getStats() {
        return stats;
    }

    /**
     * @return {@code true} once the classification model reports ready
     */
    public boolean isModelReady() {
        return dispatcher.isModelReady();
    }

    public LogStore getStore() {
        return store;
    }

    public AlertPolicy getAlertPolicy() {
        return alertPolicy;
    }

    public LiveFeed getFeed() {
        return feed;
    }

    public LogPipeline getPipeline() {
        return pipeline;
    }

    public ControlPlane getControlPlane() {
        return controlPlane;
    }

    public CollectorIngestService getIngestService() {
        return ingestService;
    }
}
