package io.datawrangle.core.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Generates a dataset of {@code rows} identical rows from a {@code values} mapping of column to
 * value. Read only; used to try recipes without external data.
 */
public final class TestDataConnector implements Connector {

    public static final String ID = "test";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean supportsWrite() {
        return false;
    }

    @Override
    public ObjectNode settingsSchema() {
        return Schemas.object()
                .property("rows", Schemas.integer(0))
                .property("values", Schemas.map())
                .build();
    }

    @Override
    public List<String> requiredSettings() {
        return List.of("values");
    }

    @Override
    public ConnectorHandle open(ObjectNode settings, Credentials credentials) {
        return new TestDataHandle(settings.path("rows").asInt(1), (ObjectNode) settings.get("values"));
    }

    @Override
    public Dataset read(ConnectorHandle handle) {
        TestDataHandle test = (TestDataHandle) handle;
        List<String> columns = new ArrayList<>();
        List<JsonNode> values = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = test.values().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            columns.add(field.getKey());
            values.add(field.getValue());
        }
        Dataset.Builder builder = Dataset.builder(columns);
        for (int r = 0; r < test.rows(); r++) {
            builder.addRow(values);
        }
        return builder.build();
    }

    @Override
    public WriteAcknowledgement write(ConnectorHandle handle, Dataset dataset) {
        throw new UnsupportedOperationException("The test connector is read only");
    }

    @Override
    public void close(ConnectorHandle handle) {
        // nothing held
    }

    private record TestDataHandle(int rows, ObjectNode values) implements ConnectorHandle {

        @Override
        public String location() {
            return "test:" + rows + " rows";
        }
    }
}
