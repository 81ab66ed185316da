package net.spookly.gsdk.heartbeat;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

import lombok.NonNull;

/**
 * {@code PATCH http://{endpoint}/v1/sessionHosts/{instanceId}} over the JDK HTTP client.
 */
public final class HttpHeartbeatTransport implements HeartbeatTransport {
    private final URI heartbeatUri;
    private final Duration requestTimeout;
    private volatile HttpClient client;

    public HttpHeartbeatTransport(@NonNull String heartbeatEndpoint, @NonNull String instanceId, Duration requestTimeout) {
        this.heartbeatUri = heartbeatUri(heartbeatEndpoint, instanceId);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    static URI heartbeatUri(String heartbeatEndpoint, String instanceId) {
        try {
            return URI.create("http://" + heartbeatEndpoint.trim() + "/v1/sessionHosts/" + instanceId.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid heartbeat endpoint: " + heartbeatEndpoint, e);
        }
    }

    public URI heartbeatUri() {
        return heartbeatUri;
    }

    @Override
    public TransportResponse send(String requestBody) throws IOException, InterruptedException {
        HttpClient current = client;
        if (current == null) {
            throw new IOException("heartbeat transport is closed");
        }
        HttpRequest request = HttpRequest.newBuilder(heartbeatUri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json; charset=utf-8")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(requestBody, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = current.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new TransportResponse(response.statusCode(), response.body());
    }

    @Override
    public void close() {
        // The JDK 17 client has no close; dropping the reference releases its pool once idle.
        client = null;
    }
}
