package com.logsentinel.flink;

import com.logsentinel.core.classify.HttpModelClassifier;
import com.logsentinel.core.config.SentinelSettings;
import com.logsentinel.core.config.SettingsLoader;
import com.logsentinel.core.delivery.DeliveryChannel;
import com.logsentinel.core.delivery.HttpCollectorTransport;
import com.logsentinel.core.delivery.HttpDeliveryChannel;
import com.logsentinel.core.model.AlertRecord;
import com.logsentinel.core.pipeline.FailureKind;
import com.logsentinel.core.pipeline.ProcessingOutcome;
import com.logsentinel.core.pipeline.SentinelRuntime;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Flink {@link ProcessFunction} hosting the whole classification pipeline.
 *
 * <p>
 * The threshold calibrator, score window and log store are process-local, so
 * the operator must run with parallelism 1. Every line yields one stored log
 * entry; alert records are emitted downstream.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #open(Configuration)} loads the pipeline settings, wires a
 * {@link SentinelRuntime}, starts the pipeline and the {@link ControlServer}.
 * {@link #close()} stops the control server, then the pipeline, which drains
 * pending collector deliveries.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassificationProcessFunction extends ProcessFunction<String, AlertRecord> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ClassificationProcessFunction.class);

    private final JobConfig config;

    private transient SentinelRuntime runtime;
    private transient ControlServer controlServer;
    private transient SentinelMetrics metrics;

    /**
     * @param config deployment configuration
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public ClassificationProcessFunction(JobConfig config) {
        this.config = Objects.requireNonNull(config, "JobConfig must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        SentinelSettings settings = SettingsLoader.load(config.getSettingsPath());

        HttpModelClassifier classifier = new HttpModelClassifier(
                URI.create(config.getModelEndpoint()), Duration.ofMillis(config.getModelTimeoutMs()));
        runtime = SentinelRuntime.create(settings, classifier, deliveryChannel(settings), Clock.systemDefaultZone());
        runtime.getPipeline().start();

        metrics = new SentinelMetrics(getRuntimeContext().getMetricGroup(),
                runtime.getCalibrator()::currentThreshold);

        controlServer = new ControlServer(runtime, config.getCollectorApiKey());
        controlServer.start(config.getControlPort());
        LOG.info("ClassificationProcessFunction opened (delivery={}, alertClasses={})",
                config.isDeliveryEnabled(), runtime.getAlertPolicy().getAlertingClasses());
    }

    @Override
    public void close() {
        LOG.info("ClassificationProcessFunction closing");
        if (controlServer != null) {
            controlServer.stop();
        }
        if (runtime != null) {
            runtime.getPipeline().stop();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(String line, ProcessFunction<String, AlertRecord>.Context ctx,
            Collector<AlertRecord> out) {
        long startNanos = System.nanoTime();

        ProcessingOutcome outcome = runtime.getPipeline().process(line);
        FailureKind kind = outcome.getFailureKind();
        if (kind == FailureKind.MODEL_UNAVAILABLE || kind == FailureKind.INFERENCE_FAILURE) {
            metrics.incrementClassificationFailures();
        }
        outcome.getAlert().ifPresent(alert -> {
            out.collect(alert);
            metrics.incrementAlertsCreated();
        });

        metrics.incrementLinesProcessed();
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private DeliveryChannel deliveryChannel(SentinelSettings settings) {
        if (!config.isDeliveryEnabled()) {
            LOG.info("No collector URL configured; delivery disabled");
            return null;
        }
        SentinelSettings.Delivery d = settings.getDelivery();
        HttpCollectorTransport transport = new HttpCollectorTransport(URI.create(config.getCollectorUrl()),
                config.getCollectorApiKey(), Duration.ofMillis(d.getRequestTimeoutMillis()));
        return new HttpDeliveryChannel(transport, d.getMaxRetries(), Duration.ofMillis(d.getRetryDelayMillis()),
                Duration.ofMillis(d.getCloseTimeoutMillis()), d.getBacklog());
    }
}
