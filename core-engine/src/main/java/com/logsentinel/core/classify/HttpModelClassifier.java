package com.logsentinel.core.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LogClassifier} backed by a model server over HTTP.
 *
 * <h3>Protocol</h3>
 * <ul>
 * <li>{@code GET {base}/health}: any 2xx response means the model is loaded,
 * unless the body carries {@code "model_loaded": false}.</li>
 * <li>{@code POST {base}/predict} with {@code {"text": "..."}}, answered by
 * {@code {"class", "class_name", "probabilities", "anomaly_score", "severity"}}.</li>
 * </ul>
 *
 * <p>
 * Readiness is sticky once observed. While the model is not ready the health
 * endpoint is probed at most once per {@link #PROBE_INTERVAL}.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpModelClassifier implements LogClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(HttpModelClassifier.class);

    /** Minimum spacing between readiness probes while the model is down. */
    public static final Duration PROBE_INTERVAL = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final URI healthUri;
    private final URI predictUri;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    private volatile boolean ready;
    private volatile long lastProbeNanos;
    private volatile boolean probedOnce;

    /**
     * @param baseUri model server base URI, e.g. {@code http://model:8000}
     * @param timeout per-request timeout
     */
    public HttpModelClassifier(URI baseUri, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUri, timeout);
    }

    public HttpModelClassifier(HttpClient httpClient, URI baseUri, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        Objects.requireNonNull(baseUri, "baseUri must not be null");
        String base = baseUri.toString().replaceAll("/+$", "");
        this.healthUri = URI.create(base + "/health");
        this.predictUri = URI.create(base + "/predict");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public boolean isReady() {
        if (ready) {
            return true;
        }
        long now = System.nanoTime();
        if (probedOnce && now - lastProbeNanos < PROBE_INTERVAL.toNanos()) {
            return false;
        }
        probedOnce = true;
        lastProbeNanos = now;
        ready = probe();
        if (ready) {
            LOG.info("Classification model at {} is ready", healthUri);
        }
        return ready;
    }

    @Override
    public ClassificationResult classify(String text) throws InferenceFailureException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder(predictUri)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(
                            mapper.writeValueAsBytes(Map.of("text", text))))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new InferenceFailureException("Model request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceFailureException("Interrupted while waiting for the model", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new InferenceFailureException("Model returned status " + response.statusCode());
        }
        return toResult(response.body());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean probe() {
        try {
            HttpRequest request = HttpRequest.newBuilder(healthUri).timeout(timeout).GET().build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOG.debug("Model health returned status {}", response.statusCode());
                return false;
            }
            String body = response.body();
            if (body == null || body.isBlank()) {
                return true;
            }
            JsonNode loaded = mapper.readTree(body).path("model_loaded");
            return loaded.isMissingNode() || loaded.asBoolean(true);
        } catch (JsonProcessingException e) {
            // non-JSON 2xx body still means the server is up
            return true;
        } catch (IOException e) {
            LOG.debug("Model health probe failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    ClassificationResult toResult(String body) throws InferenceFailureException {
        try {
            JsonNode node = mapper.readTree(body);
            JsonNode classNode = node.path("class");
            JsonNode scoreNode = node.path("anomaly_score");
            if (!classNode.isInt() || !scoreNode.isNumber()) {
                throw new InferenceFailureException("Model response lacks class or anomaly_score: " + body);
            }
            List<Double> probabilities = new ArrayList<>();
            for (JsonNode p : node.path("probabilities")) {
                probabilities.add(p.asDouble());
            }
            Severity severity = Severity.fromLabel(node.path("severity").asText(null)).orElse(null);
            if (probabilities.isEmpty()) {
                return ClassificationResult.reported(classNode.asInt(), node.path("class_name").asText(null),
                        scoreNode.asDouble(), severity);
            }
            return ClassificationResult.of(classNode.asInt(), node.path("class_name").asText(null),
                    probabilities, scoreNode.asDouble(), severity);
        } catch (JsonProcessingException e) {
            throw new InferenceFailureException("Model response is not JSON", e);
        } catch (IllegalArgumentException e) {
            throw new InferenceFailureException("Model response is invalid: " + e.getMessage(), e);
        }
    }
}
