package io.datawrangle.core.spi;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;
import java.util.List;

/**
 * Uniform read/write capability over one kind of external system (files, databases, object
 * stores, inference endpoints). The executor depends only on this interface.
 *
 * <p>Error contract:
 * <ul>
 * <li>{@link #open} throws {@link io.datawrangle.core.error.ConnectionError} once its own retry
 * budget (see {@link io.datawrangle.core.connector.Retrying}) is exhausted</li>
 * <li>{@link #read} and {@link #write} throw {@link io.datawrangle.core.error.ConnectorIOError}</li>
 * <li>{@link #close} is called exactly once per successful {@code open}, on every exit path</li>
 * </ul>
 *
 * <p>Implementations MUST be thread-safe; handles are not shared between steps.
 */
public interface Connector {

    /** Connector identifier, also the step kind name in recipes, e.g. {@code "file"}. */
    String id();

    /** Whether recipes may use this connector in the {@code read} section. */
    default boolean supportsRead() {
        return true;
    }

    /** Whether recipes may use this connector in the {@code write} section. */
    default boolean supportsWrite() {
        return true;
    }

    /**
     * JSON Schema (an object schema) of the connector's location settings. Its properties become
     * the keys of the connector's read and write kinds.
     */
    ObjectNode settingsSchema();

    /** Names of the settings that must be present. */
    List<String> requiredSettings();

    /**
     * Opens the endpoint described by {@code settings}.
     *
     * @param settings    the step's location settings (common step keys already removed)
     * @param credentials the run-scoped credential bundle for this step
     * @return an open handle
     */
    ConnectorHandle open(ObjectNode settings, Credentials credentials);

    Dataset read(ConnectorHandle handle);

    WriteAcknowledgement write(ConnectorHandle handle, Dataset dataset);

    void close(ConnectorHandle handle);
}
