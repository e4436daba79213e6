package com.logsentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logsentinel.core.delivery.HttpCollectorTransport;
import com.logsentinel.core.delivery.IngestResult;
import com.logsentinel.core.pipeline.CommandResult;
import com.logsentinel.core.pipeline.SentinelRuntime;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight HTTP server for probes, statistics and control commands.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: always {@code 200} with {@code {"status":"UP"}}
 * and the model readiness</li>
 * <li>{@code GET /readiness}: {@code 200} once the pipeline runs and the model
 * is loaded, {@code 503} before</li>
 * <li>{@code GET /metrics}: calibration metrics</li>
 * <li>{@code GET /stats}: counts of logs and alerts, per-class counts and
 * system statuses</li>
 * <li>{@code GET /feed?limit=n}: the most recent feed updates</li>
 * <li>{@code POST /threshold} with {@code {"value": 0.4}}</li>
 * <li>{@code POST /alerts/{id}/acknowledge}</li>
 * <li>{@code POST /status} with {@code {"status": "degraded", ...}}</li>
 * <li>{@code POST /command} with a control message</li>
 * <li>{@code POST /api/v1/logs/}: collector ingestion, guarded by the
 * {@code X-API-Key} header when a key is configured</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}; requests are served by one
 * daemon thread and run concurrently with the ingestion worker.
 * </p>
 *
 * @since 1.0.0
 */
public class ControlServer {

    private static final Logger LOG = LoggerFactory.getLogger(ControlServer.class);

    private static final Pattern ACK_PATH = Pattern.compile("^/alerts/(\\d+)/acknowledge/?$");
    private static final int DEFAULT_FEED_LIMIT = 50;

    private final SentinelRuntime runtime;
    private final String apiKey;
    private final ObjectMapper mapper;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param runtime wired components to expose
     * @param apiKey  key required on collector ingestion; blank disables the
     *                check
     */
    public ControlServer(SentinelRuntime runtime, String apiKey) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.apiKey = apiKey != null ? apiKey : "";
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Control port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", get(this::handleHealth));
            server.createContext("/readiness", get(this::handleReadiness));
            server.createContext("/metrics", get(ex -> respond(ex, runtime.getControlPlane().getMetrics())));
            server.createContext("/stats", get(this::handleStats));
            server.createContext("/feed", get(this::handleFeed));
            server.createContext("/threshold", post(this::handleThreshold));
            server.createContext("/alerts/", post(this::handleAcknowledge));
            server.createContext("/status", post(this::handleStatus));
            server.createContext("/command", post(ex -> respond(ex,
                    runtime.getControlPlane().execute(readBody(ex)))));
            server.createContext("/api/v1/logs/", post(this::handleIngest));

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "control-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Control server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start control server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Control server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, or {@code -1} when not running
     */
    public int getPort() {
        return running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("model_ready", runtime.isModelReady());
        writeJson(exchange, 200, body);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        boolean ready = runtime.getPipeline().isRunning() && runtime.isModelReady();
        writeJson(exchange, ready ? 200 : 503, Map.of("status", ready ? "READY" : "NOT_READY"));
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total_logs", runtime.getStore().entryCount());
        body.put("total_alerts", runtime.getStore().alertCount());
        body.put("unacknowledged_alerts", runtime.getStore().unacknowledgedAlertCount());
        body.put("current_threshold", runtime.getCalibrator().currentThreshold());
        body.put("class_counts", runtime.getStats().snapshot());
        body.put("system_statuses", runtime.getStore().systemStatuses());
        writeJson(exchange, 200, body);
    }

    private void handleFeed(HttpExchange exchange) throws IOException {
        int limit = DEFAULT_FEED_LIMIT;
        String query = exchange.getRequestURI().getQuery();
        if (query != null) {
            for (String part : query.split("&")) {
                if (part.startsWith("limit=")) {
                    try {
                        limit = Math.max(0, Integer.parseInt(part.substring("limit=".length())));
                    } catch (NumberFormatException e) {
                        writeJson(exchange, 400, CommandResult.error("Invalid limit.", "limit must be an integer"));
                        return;
                    }
                }
            }
        }
        writeJson(exchange, 200, runtime.getFeed().recent(limit));
    }

    private void handleThreshold(HttpExchange exchange) throws IOException {
        Map<String, Object> body = readBody(exchange);
        Object value = body.get("value");
        if (!(value instanceof Number n)) {
            respond(exchange, CommandResult.error("Invalid threshold value.", "value must be a number"));
            return;
        }
        respond(exchange, runtime.getControlPlane().overrideThreshold(n.doubleValue()));
    }

    private void handleAcknowledge(HttpExchange exchange) throws IOException {
        Matcher m = ACK_PATH.matcher(exchange.getRequestURI().getPath());
        if (!m.matches()) {
            writeJson(exchange, 404, CommandResult.error("Not found."));
            return;
        }
        long id;
        try {
            id = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            writeJson(exchange, 404, CommandResult.error("Anomaly not found."));
            return;
        }
        CommandResult result = runtime.getControlPlane().acknowledgeAlert(id);
        writeJson(exchange, result.isSuccess() ? 200 : 404, result);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        Map<String, Object> body = readBody(exchange);
        respond(exchange, runtime.getControlPlane().updateSystemStatus(
                asString(body.get("service_name")), asString(body.get("status")), asString(body.get("details"))));
    }

    private void handleIngest(HttpExchange exchange) throws IOException {
        if (!apiKey.isEmpty()) {
            String presented = exchange.getRequestHeaders().getFirst(HttpCollectorTransport.API_KEY_HEADER);
            if (presented == null || !MessageDigest.isEqual(
                    presented.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8))) {
                LOG.warn("Rejected ingestion from {}: bad API key", exchange.getRemoteAddress());
                writeJson(exchange, 401, CommandResult.error("Unauthorized."));
                return;
            }
        }
        IngestResult result = runtime.getIngestService().ingest(readBody(exchange));
        writeJson(exchange, result.httpStatus(), result);
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }

    /** Malformed JSON bodies are answered with 400. */
    private static final class BadRequestException extends IOException {
        private static final long serialVersionUID = 1L;

        BadRequestException(String message) {
            super(message);
        }
    }

    private HttpHandler get(Handler handler) {
        return method("GET", handler);
    }

    private HttpHandler post(Handler handler) {
        return method("POST", handler);
    }

    private HttpHandler method(String method, Handler handler) {
        return exchange -> {
            try {
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, 405, CommandResult.error("Method not allowed.",
                            exchange.getRequestMethod() + " is not supported, use " + method));
                    return;
                }
                handler.handle(exchange);
            } catch (BadRequestException e) {
                writeJson(exchange, 400, CommandResult.error("Invalid JSON body.", e.getMessage()));
            } catch (RuntimeException e) {
                LOG.error("Control request {} {} failed", exchange.getRequestMethod(),
                        exchange.getRequestURI(), e);
                writeJson(exchange, 500, CommandResult.error("Internal error."));
            } finally {
                exchange.close();
            }
        };
    }

    private Map<String, Object> readBody(HttpExchange exchange) throws IOException {
        byte[] bytes;
        try (InputStream is = exchange.getRequestBody()) {
            bytes = is.readAllBytes();
        }
        if (bytes.length == 0) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> body = mapper.readValue(bytes, new TypeReference<Map<String, Object>>() {
            });
            return body != null ? body : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new BadRequestException(e.getOriginalMessage());
        }
    }

    private void respond(HttpExchange exchange, CommandResult result) throws IOException {
        writeJson(exchange, result.isSuccess() ? 200 : 400, result);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
