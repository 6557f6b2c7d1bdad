package io.datawrangle.core.connector;

import io.datawrangle.core.spi.Connector;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Connectors known to an engine, by id. Ids double as read/write step kind names. Registration
 * happens while the engine is built; lookups afterwards are read-only.
 */
public final class ConnectorRegistry {

    private final Map<String, Connector> connectors = new LinkedHashMap<>();

    /**
     * Adds a connector.
     *
     * @throws IllegalArgumentException if a connector with the same id is registered
     */
    public ConnectorRegistry register(Connector connector) {
        String id = connector.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("connector id must not be null or empty");
        }
        if (connectors.putIfAbsent(id, connector) != null) {
            throw new IllegalArgumentException("Connector '" + id + "' is already registered");
        }
        return this;
    }

    /** Adds or replaces a connector. */
    public ConnectorRegistry replace(Connector connector) {
        connectors.put(connector.id(), connector);
        return this;
    }

    public Optional<Connector> get(String id) {
        return Optional.ofNullable(connectors.get(id));
    }

    /**
     * @throws IllegalArgumentException if no connector has that id
     */
    public Connector require(String id) {
        return get(id).orElseThrow(() -> new IllegalArgumentException("No connector registered for id: '" + id + "'"));
    }

    /** All connectors, in registration order. */
    public Collection<Connector> all() {
        return Collections.unmodifiableCollection(connectors.values());
    }
}
