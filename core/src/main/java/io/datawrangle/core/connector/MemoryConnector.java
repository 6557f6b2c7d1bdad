package io.datawrangle.core.connector;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import java.util.List;

/** Reads and writes named datasets in a {@link MemoryStore}. Settings: {@code name}. */
public final class MemoryConnector implements Connector {

    public static final String ID = "memory";

    private final MemoryStore store;

    public MemoryConnector(MemoryStore store) {
        this.store = store;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ObjectNode settingsSchema() {
        return Schemas.object().property("name", Schemas.string()).build();
    }

    @Override
    public List<String> requiredSettings() {
        return List.of("name");
    }

    @Override
    public ConnectorHandle open(ObjectNode settings, Credentials credentials) {
        return new MemoryHandle(settings.path("name").asText());
    }

    @Override
    public Dataset read(ConnectorHandle handle) {
        String name = ((MemoryHandle) handle).name();
        return store.get(name)
                .orElseThrow(() -> new ConnectionError("No dataset named '" + name + "' in memory", null, name, 1));
    }

    @Override
    public WriteAcknowledgement write(ConnectorHandle handle, Dataset dataset) {
        String name = ((MemoryHandle) handle).name();
        store.put(name, dataset);
        return new WriteAcknowledgement(ID, handle.location(), dataset.rowCount());
    }

    @Override
    public void close(ConnectorHandle handle) {
        // nothing held
    }

    private record MemoryHandle(String name) implements ConnectorHandle {

        @Override
        public String location() {
            return "memory:" + name;
        }
    }
}
