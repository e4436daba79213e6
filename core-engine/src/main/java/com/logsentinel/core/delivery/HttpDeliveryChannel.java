package com.logsentinel.core.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link DeliveryChannel} that posts JSON payloads through a
 * {@link CollectorTransport} with bounded retries.
 *
 * <h3>Retry Policy</h3>
 * <ul>
 * <li>Network failures ({@link IOException}, including 5xx answers surfaced as
 * {@link DeliveryTransientException}) are retried after a fixed delay, up to
 * {@code maxRetries} times after the first attempt.</li>
 * <li>4xx answers raise {@link DeliveryRejectedException}, which is never
 * retried and is logged as a permanent failure.</li>
 * </ul>
 *
 * <h3>Threading</h3>
 * <p>
 * {@link #submit} hands the payload to a dedicated single-thread executor so
 * the ingestion worker never waits on the network. At most {@code backlog}
 * payloads wait behind the one in flight; further submissions are dropped and
 * complete with {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpDeliveryChannel implements DeliveryChannel {

    private static final Logger LOG = LoggerFactory.getLogger(HttpDeliveryChannel.class);

    public static final int DEFAULT_MAX_RETRIES = 4;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_BACKLOG = 10_000;

    private final CollectorTransport transport;
    private final Retry retry;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ThreadPoolExecutor executor;
    private final Duration closeTimeout;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public HttpDeliveryChannel(CollectorTransport transport) {
        this(transport, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY, DEFAULT_CLOSE_TIMEOUT);
    }

    /**
     * @param transport    collector transport
     * @param maxRetries   retries after the first attempt; {@code >= 0}
     * @param retryDelay   fixed wait between attempts
     * @param closeTimeout how long {@link #close()} waits for in-flight deliveries
     */
    public HttpDeliveryChannel(CollectorTransport transport, int maxRetries, Duration retryDelay,
            Duration closeTimeout) {
        this(transport, maxRetries, retryDelay, closeTimeout, DEFAULT_BACKLOG);
    }

    /**
     * @param transport    collector transport
     * @param maxRetries   retries after the first attempt; {@code >= 0}
     * @param retryDelay   fixed wait between attempts
     * @param closeTimeout how long {@link #close()} waits for in-flight deliveries
     * @param backlog      payloads that may queue behind the one in flight; {@code >= 1}
     */
    public HttpDeliveryChannel(CollectorTransport transport, int maxRetries, Duration retryDelay,
            Duration closeTimeout, int backlog) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("backlog must be >= 1, got: " + backlog);
        }
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout must not be null");
        this.retry = Retry.of("collector-delivery", RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .waitDuration(retryDelay)
                .retryExceptions(IOException.class)
                .ignoreExceptions(DeliveryRejectedException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event -> LOG.warn(
                "Delivery attempt {}/{} failed: {}. Retrying in {} ms",
                event.getNumberOfRetryAttempts(), maxRetries + 1,
                String.valueOf(event.getLastThrowable()), event.getWaitInterval().toMillis()));
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(backlog), r -> {
                    Thread t = new Thread(r, "collector-delivery");
                    t.setDaemon(true);
                    return t;
                });
    }

    @Override
    public boolean deliver(DeliveryPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize delivery payload {}: {}", payload, e.getMessage());
            failed.incrementAndGet();
            return false;
        }

        try {
            retry.executeCheckedSupplier(() -> send(json));
            delivered.incrementAndGet();
            return true;
        } catch (DeliveryRejectedException e) {
            LOG.error("Permanent delivery failure for {}: {}", payload, e.getMessage());
        } catch (IOException e) {
            LOG.error("Delivery failed after {} attempt(s) for {}: {}",
                    retry.getRetryConfig().getMaxAttempts(), payload, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Delivery interrupted for {}", payload);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            LOG.error("Unexpected delivery failure for {}", payload, t);
        }
        failed.incrementAndGet();
        return false;
    }

    @Override
    public CompletableFuture<Boolean> submit(DeliveryPayload payload) {
        try {
            return CompletableFuture.supplyAsync(() -> deliver(payload), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Delivery {}; dropping {}",
                    executor.isShutdown() ? "channel closed" : "backlog full", payload);
            failed.incrementAndGet();
            return CompletableFuture.completedFuture(false);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("In-flight deliveries did not finish within {}; abandoning", closeTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Delivery channel closed: delivered={} failed={}", delivered.get(), failed.get());
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /**
     * @return payloads waiting behind the one in flight
     */
    public int pendingCount() {
        return executor.getQueue().size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Boolean send(byte[] json) throws IOException, InterruptedException, DeliveryRejectedException {
        CollectorResponse response = transport.post(json);
        int status = response.getStatusCode();
        if (response.isSuccess()) {
            return Boolean.TRUE;
        }
        if (status >= 500) {
            throw new DeliveryTransientException(status, response.getBody());
        }
        throw new DeliveryRejectedException(status, response.getBody());
    }
}
