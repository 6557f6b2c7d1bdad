package io.datawrangle.core.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.error.ConnectorIOError;
import io.datawrangle.core.error.WrangleExecutionException;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.StepPosition;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import io.datawrangle.core.spi.InvocableConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped ownership of one open connector handle, for use in try-with-resources. {@link #close()}
 * releases the handle exactly once whatever happened in between; connector errors are attributed
 * to the owning step on the way out.
 */
public final class ConnectorSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectorSession.class);

    private final Connector connector;
    private final ConnectorHandle handle;
    private final StepPosition position;
    private final String kind;
    private boolean closed;

    private ConnectorSession(Connector connector, ConnectorHandle handle, StepPosition position, String kind) {
        this.connector = connector;
        this.handle = handle;
        this.position = position;
        this.kind = kind;
    }

    /**
     * Opens a connector on behalf of a step. Any failure becomes a {@link ConnectionError} naming
     * the step; no handle is left open.
     */
    public static ConnectorSession open(
            Connector connector, ObjectNode settings, Credentials credentials, StepPosition position, String kind) {
        ConnectorHandle handle;
        try {
            handle = connector.open(settings, credentials);
        } catch (ConnectionError e) {
            throw e.atStep(position, kind);
        } catch (RuntimeException e) {
            throw new ConnectionError(
                            "Failed to open " + connector.id() + " connector: " + e.getMessage(),
                            e,
                            connector.id(),
                            1)
                    .atStep(position, kind);
        }
        LOG.debug("Connector opened: connector={}, location={}, step={}", connector.id(), handle.location(), position);
        return new ConnectorSession(connector, handle, position, kind);
    }

    public String location() {
        return handle.location();
    }

    public Dataset read() {
        try {
            return connector.read(handle);
        } catch (RuntimeException e) {
            throw attribute(e, "read");
        }
    }

    public WriteAcknowledgement write(Dataset dataset) {
        try {
            return connector.write(handle, dataset);
        } catch (RuntimeException e) {
            throw attribute(e, "write");
        }
    }

    /**
     * Sends one request through an invocable connector.
     *
     * @throws IllegalStateException if the connector is not invocable
     */
    public JsonNode invoke(JsonNode payload) {
        if (!(connector instanceof InvocableConnector invocable)) {
            throw new IllegalStateException("Connector '" + connector.id() + "' does not support invoke");
        }
        try {
            return invocable.invoke(handle, payload);
        } catch (RuntimeException e) {
            throw attribute(e, "invoke");
        }
    }

    private WrangleExecutionException attribute(RuntimeException e, String operation) {
        if (e instanceof ConnectorIOError io) {
            return io.position() == null ? io.atStep(position, kind) : io;
        }
        if (e instanceof ConnectionError connection) {
            return connection.position() == null ? connection.atStep(position, kind) : connection;
        }
        if (e instanceof WrangleExecutionException wrangle) {
            return wrangle;
        }
        return new ConnectorIOError(
                        connector.id() + " " + operation + " failed at " + handle.location() + ": " + e.getMessage(),
                        e,
                        handle.location())
                .atStep(position, kind);
    }

    /** Closes the handle once; later calls are no-ops. Close failures are logged, not thrown. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connector.close(handle);
            LOG.debug("Connector closed: connector={}, location={}", connector.id(), handle.location());
        } catch (RuntimeException e) {
            LOG.warn("Connector close failed: connector={}, location={}", connector.id(), handle.location(), e);
        }
    }
}
