package io.datawrangle.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A connector that also answers single request/response calls, such as a model inference
 * endpoint. {@link #invoke} may be called concurrently on one handle.
 */
public interface InvocableConnector extends Connector {

    /**
     * Sends one payload and returns the endpoint's answer.
     *
     * @throws io.datawrangle.core.error.ConnectorIOError if the call fails
     */
    JsonNode invoke(ConnectorHandle handle, JsonNode payload);
}
