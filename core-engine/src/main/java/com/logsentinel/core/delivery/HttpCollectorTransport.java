package com.logsentinel.core.delivery;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link CollectorTransport} over the JDK {@link HttpClient}. Authenticates
 * with an {@code X-API-Key} header when a key is configured.
 *
 * @since 1.0.0
 */
public class HttpCollectorTransport implements CollectorTransport {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;

    public HttpCollectorTransport(URI endpoint, String apiKey, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), endpoint, apiKey, timeout);
    }

    public HttpCollectorTransport(HttpClient httpClient, URI endpoint, String apiKey, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.apiKey = apiKey;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public CollectorResponse post(byte[] json) throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header(API_KEY_HEADER, apiKey);
        }
        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        return new CollectorResponse(response.statusCode(), response.body());
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
