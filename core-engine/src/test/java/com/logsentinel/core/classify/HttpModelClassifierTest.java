package com.logsentinel.core.classify;

import com.logsentinel.core.model.ClassificationResult;
import com.logsentinel.core.model.Severity;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HttpModelClassifier}.
 */
class HttpModelClassifierTest {

    private HttpServer server;
    private HttpModelClassifier classifier;

    private final AtomicReference<String> healthBody = new AtomicReference<>("{\"model_loaded\": true}");
    private final AtomicInteger healthStatus = new AtomicInteger(200);
    private final AtomicInteger healthCalls = new AtomicInteger();
    private final AtomicReference<String> predictBody = new AtomicReference<>();
    private final AtomicInteger predictStatus = new AtomicInteger(200);
    private final AtomicReference<String> lastRequest = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> {
            healthCalls.incrementAndGet();
            respond(exchange, healthStatus.get(), healthBody.get());
        });
        server.createContext("/predict", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, predictStatus.get(), predictBody.get());
        });
        server.start();
        URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        classifier = new HttpModelClassifier(base, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    // ---------------------------------------------------------------
    // Readiness
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should be ready when the health endpoint reports a loaded model")
    void shouldBeReady() {
        assertThat(classifier.isReady()).isTrue();
        assertThat(classifier.isReady()).isTrue();
        assertThat(healthCalls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not be ready while the model is still loading, and throttle probes")
    void shouldNotBeReadyWhileLoading() {
        healthBody.set("{\"model_loaded\": false}");

        assertThat(classifier.isReady()).isFalse();
        assertThat(classifier.isReady()).isFalse();
        assertThat(healthCalls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not be ready when the health endpoint fails")
    void shouldNotBeReadyOnServerError() {
        healthStatus.set(503);
        healthBody.set("unavailable");

        assertThat(classifier.isReady()).isFalse();
    }

    // ---------------------------------------------------------------
    // Prediction
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should post the text and map a full prediction")
    void shouldClassify() throws Exception {
        predictBody.set("{\"class\": 4, \"class_name\": \"Network Anomaly\","
                + " \"probabilities\": [0.05, 0.05, 0.05, 0.05, 0.7, 0.05, 0.05],"
                + " \"anomaly_score\": 0.7, \"severity\": \"high\"}");

        ClassificationResult result = classifier.classify("connection reset by peer");

        assertThat(lastRequest.get()).isEqualTo("{\"text\":\"connection reset by peer\"}");
        assertThat(result.getClassId()).isEqualTo(4);
        assertThat(result.getClassName()).isEqualTo("Network Anomaly");
        assertThat(result.getAnomalyScore()).isEqualTo(0.7);
        assertThat(result.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(result.getProbabilities()).hasSize(7);
    }

    @Test
    @DisplayName("Should fall back to class defaults when the model omits optional fields")
    void shouldApplyDefaults() throws Exception {
        predictBody.set("{\"class\": 2, \"anomaly_score\": 0.95}");

        ClassificationResult result = classifier.classify("kernel panic");

        assertThat(result.getClassName()).isEqualTo("System Failure");
        assertThat(result.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.getProbabilities().get(2)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fail on a non-2xx status")
    void shouldFailOnErrorStatus() {
        predictStatus.set(500);
        predictBody.set("{\"detail\": \"boom\"}");

        assertThatThrownBy(() -> classifier.classify("x"))
                .isInstanceOf(InferenceFailureException.class)
                .hasMessageContaining("500");
    }

    @Test
    @DisplayName("Should fail on malformed or out-of-range responses")
    void shouldFailOnBadResponse() {
        assertThatThrownBy(() -> classifier.toResult("not json"))
                .isInstanceOf(InferenceFailureException.class);
        assertThatThrownBy(() -> classifier.toResult("{\"class\": 9, \"anomaly_score\": 0.5}"))
                .isInstanceOf(InferenceFailureException.class);
        assertThatThrownBy(() -> classifier.toResult("{\"class\": 1, \"anomaly_score\": 1.4}"))
                .isInstanceOf(InferenceFailureException.class);
        assertThatThrownBy(() -> classifier.toResult("{\"anomaly_score\": 0.4}"))
                .isInstanceOf(InferenceFailureException.class);
    }

    @Test
    @DisplayName("Should fail when the server is unreachable")
    void shouldFailWhenUnreachable() {
        server.stop(0);

        assertThatThrownBy(() -> classifier.classify("x"))
                .isInstanceOf(InferenceFailureException.class);
    }
}
