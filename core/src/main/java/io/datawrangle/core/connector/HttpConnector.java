package io.datawrangle.core.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.error.ConnectorIOError;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import io.datawrangle.core.spi.InvocableConnector;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON over HTTP: REST collections and model inference endpoints.
 *
 * <p>Read GETs {@code url} and expects a JSON array of objects; write POSTs the rows as a JSON
 * array; {@link #invoke} POSTs one payload and returns the parsed answer. Settings: {@code url}
 * (required), {@code headers}, {@code timeout_ms}. A credentials key {@code token} is sent as a
 * bearer token.
 */
public final class HttpConnector implements InvocableConnector {

    public static final String ID = "http";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long DEFAULT_TIMEOUT_MS = 30_000;

    private final HttpClient client;

    public HttpConnector() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public HttpConnector(HttpClient client) {
        this.client = client;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ObjectNode settingsSchema() {
        ObjectNode headers = Schemas.map();
        headers.set("additionalProperties", Schemas.string());
        return Schemas.object()
                .property("url", Schemas.string())
                .property("headers", headers)
                .property("timeout_ms", Schemas.integer(1))
                .build();
    }

    @Override
    public List<String> requiredSettings() {
        return List.of("url");
    }

    @Override
    public ConnectorHandle open(ObjectNode settings, Credentials credentials) {
        String url = settings.path("url").asText();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConnectionError("Invalid URL '" + url + "': " + e.getMessage(), e, url, 1);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        settings.path("headers").fields().forEachRemaining(h -> headers.put(h.getKey(), h.getValue().asText()));
        credentials.get("token").ifPresent(token -> headers.put("Authorization", "Bearer " + token));
        Duration timeout = Duration.ofMillis(settings.path("timeout_ms").asLong(DEFAULT_TIMEOUT_MS));
        return new HttpHandle(uri, Map.copyOf(headers), timeout);
    }

    @Override
    public Dataset read(ConnectorHandle handle) {
        HttpHandle http = (HttpHandle) handle;
        JsonNode body = send(http, request(http).GET().build());
        try {
            return DatasetCodec.fromJson(body);
        } catch (IOException e) {
            throw new ConnectorIOError(e.getMessage(), e, http.location());
        }
    }

    @Override
    public WriteAcknowledgement write(ConnectorHandle handle, Dataset dataset) {
        HttpHandle http = (HttpHandle) handle;
        send(http, post(http, dataset.toArrayNode()));
        return new WriteAcknowledgement(ID, http.location(), dataset.rowCount());
    }

    @Override
    public JsonNode invoke(ConnectorHandle handle, JsonNode payload) {
        HttpHandle http = (HttpHandle) handle;
        return send(http, post(http, payload));
    }

    @Override
    public void close(ConnectorHandle handle) {
        // the shared client owns the connections
    }

    private HttpRequest post(HttpHandle http, JsonNode payload) {
        try {
            return request(http)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(payload)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new ConnectorIOError("Cannot serialize payload: " + e.getOriginalMessage(), e, http.location());
        }
    }

    private static HttpRequest.Builder request(HttpHandle http) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(http.uri()).timeout(http.timeout());
        builder.header("Accept", "application/json");
        http.headers().forEach(builder::header);
        return builder;
    }

    private JsonNode send(HttpHandle http, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ConnectorIOError(
                    request.method() + " " + http.location() + " failed: " + e.getMessage(), e, http.location());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorIOError(request.method() + " " + http.location() + " interrupted", e, http.location());
        }
        if (response.statusCode() / 100 != 2) {
            throw new ConnectorIOError(
                    request.method() + " " + http.location() + " returned HTTP " + response.statusCode(),
                    null,
                    http.location());
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return MAPPER.nullNode();
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ConnectorIOError(
                    "Response from " + http.location() + " is not JSON: " + e.getOriginalMessage(),
                    e,
                    http.location());
        }
    }

    private record HttpHandle(URI uri, Map<String, String> headers, Duration timeout) implements ConnectorHandle {

        @Override
        public String location() {
            return uri.getScheme() + "://" + uri.getAuthority() + uri.getPath();
        }
    }
}
