package io.datawrangle.core.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.error.ConnectorIOError;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** JSON over HTTP with a mocked {@link HttpClient}. */
class HttpConnectorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client = mock(HttpClient.class);
    @SuppressWarnings("unchecked")
    private final HttpResponse<String> response = mock(HttpResponse.class);
    private HttpConnector connector;

    @BeforeEach
    void setUp() throws Exception {
        connector = new HttpConnector(client);
        when(client.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
    }

    private void respond(int status, String body) {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(captor.capture(), any());
        return captor.getValue();
    }

    private ConnectorHandle open(String url, Credentials credentials) {
        return connector.open(MAPPER.createObjectNode().put("url", url), credentials);
    }

    @Test
    @DisplayName("read GETs the URL and parses an array of objects")
    void readParsesArray() throws Exception {
        respond(200, "[{\"id\": 1, \"name\": \"ada\"}, {\"id\": 2, \"name\": \"grace\"}]");

        Dataset dataset = connector.read(open("https://api.example.com/people", Credentials.none()));

        assertThat(dataset.rowCount()).isEqualTo(2);
        assertThat(dataset.value(1, "name").asText()).isEqualTo("grace");
        HttpRequest request = sentRequest();
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.headers().firstValue("Accept")).hasValue("application/json");
    }

    @Test
    @DisplayName("invoke POSTs the payload with configured headers and bearer token")
    void invokePostsPayload() throws Exception {
        respond(200, "{\"label\": \"positive\"}");
        ObjectNode settings = MAPPER.createObjectNode().put("url", "https://models.example.com/v1/classify");
        settings.putObject("headers").put("X-Tenant", "acme");
        ConnectorHandle handle = connector.open(settings, Credentials.of(Map.of("token", "t0k3n")));

        JsonNode answer = connector.invoke(handle, MAPPER.createObjectNode().put("text", "great"));

        assertThat(answer.path("label").asText()).isEqualTo("positive");
        HttpRequest request = sentRequest();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.headers().firstValue("Authorization")).hasValue("Bearer t0k3n");
        assertThat(request.headers().firstValue("X-Tenant")).hasValue("acme");
        assertThat(request.headers().firstValue("Content-Type")).hasValue("application/json");
    }

    @Test
    @DisplayName("Non-2xx → ConnectorIOError with the status")
    void errorStatus() {
        respond(503, "unavailable");
        ConnectorHandle handle = open("https://api.example.com/people", Credentials.none());

        assertThatThrownBy(() -> connector.read(handle))
                .isInstanceOf(ConnectorIOError.class)
                .hasMessage("GET https://api.example.com/people returned HTTP 503");
    }

    @Test
    void transportFailure() throws Exception {
        when(client.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("Connection refused"));
        ConnectorHandle handle = open("https://api.example.com/people", Credentials.none());

        assertThatThrownBy(() -> connector.invoke(handle, MAPPER.createObjectNode()))
                .isInstanceOf(ConnectorIOError.class)
                .hasMessageContaining("POST")
                .hasMessageContaining("Connection refused");
    }

    @Test
    void blankBodyIsNull() {
        respond(204, "");

        JsonNode answer = connector.invoke(open("https://api.example.com/hook", Credentials.none()), MAPPER.nullNode());

        assertThat(answer.isNull()).isTrue();
    }

    @Test
    void nonJsonBodyRejected() {
        respond(200, "<html>oops</html>");
        ConnectorHandle handle = open("https://api.example.com/people", Credentials.none());

        assertThatThrownBy(() -> connector.read(handle))
                .isInstanceOf(ConnectorIOError.class)
                .hasMessageContaining("is not JSON");
    }

    @Test
    @DisplayName("Location drops the query string")
    void locationWithoutQuery() {
        ConnectorHandle handle = open("https://api.example.com/v1/items?api_key=secret", Credentials.none());

        assertThat(handle.location()).isEqualTo("https://api.example.com/v1/items");
    }

    @Test
    void invalidUrlRejectedAtOpen() {
        assertThatThrownBy(() -> open("https://bad host/", Credentials.none()))
                .isInstanceOf(ConnectionError.class)
                .hasMessageStartingWith("Invalid URL");
    }
}
