package io.datawrangle.core.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.error.ConnectorIOError;
import io.datawrangle.core.error.TransientConnectorException;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relational databases over JDBC.
 *
 * <p>Settings: {@code url} (required), {@code table} or {@code query} for reads, {@code table} for
 * writes, {@code create} to create the table before inserting, {@code batch_size}. Credentials
 * keys {@code user} and {@code password} are passed to the driver. Each write runs in one
 * transaction and is rolled back on failure.
 */
public final class DatabaseConnector implements Connector {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseConnector.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final String ID = "database";

    private static final int DEFAULT_BATCH_SIZE = 500;

    private final RetryPolicy retryPolicy;

    public DatabaseConnector() {
        this(RetryPolicy.defaults());
    }

    public DatabaseConnector(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ObjectNode settingsSchema() {
        return Schemas.object()
                .property("url", Schemas.string())
                .property("table", Schemas.string())
                .property("query", Schemas.string())
                .property("create", Schemas.bool())
                .property("batch_size", Schemas.integer(1))
                .build();
    }

    @Override
    public List<String> requiredSettings() {
        return List.of("url");
    }

    @Override
    public ConnectorHandle open(ObjectNode settings, Credentials credentials) {
        String url = settings.path("url").asText();
        String location = redact(url);
        Connection connection = Retrying.open(retryPolicy, location, () -> connect(url, credentials, location));
        return new DatabaseHandle(
                connection,
                location,
                settings.hasNonNull("table") ? settings.get("table").asText() : null,
                settings.hasNonNull("query") ? settings.get("query").asText() : null,
                settings.path("create").asBoolean(false),
                settings.path("batch_size").asInt(DEFAULT_BATCH_SIZE));
    }

    private static Connection connect(String url, Credentials credentials, String location) {
        try {
            return DriverManager.getConnection(
                    url, credentials.get("user").orElse(null), credentials.get("password").orElse(null));
        } catch (SQLTransientException e) {
            throw new TransientConnectorException(scrub(e.getMessage(), url, location), e);
        } catch (SQLException e) {
            throw new ConnectionError(
                    "Cannot connect to " + location + ": " + scrub(e.getMessage(), url, location), e, location, 1);
        }
    }

    /** Drivers echo the URL in their messages. */
    private static String scrub(String message, String url, String location) {
        return message == null ? null : message.replace(url, location);
    }

    @Override
    public Dataset read(ConnectorHandle handle) {
        DatabaseHandle db = (DatabaseHandle) handle;
        String sql = db.query() != null ? db.query() : "SELECT * FROM " + quote(requireTable(db));
        try (Statement statement = db.connection().createStatement();
                ResultSet rs = statement.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            List<String> columns = new ArrayList<>(meta.getColumnCount());
            for (int c = 1; c <= meta.getColumnCount(); c++) {
                columns.add(meta.getColumnLabel(c));
            }
            Dataset.Builder builder = Dataset.builder(columns);
            while (rs.next()) {
                List<JsonNode> row = new ArrayList<>(columns.size());
                for (int c = 1; c <= columns.size(); c++) {
                    row.add(toNode(rs.getObject(c)));
                }
                builder.addRow(row);
            }
            return builder.build();
        } catch (SQLException e) {
            throw new ConnectorIOError("Query failed at " + db.location() + ": " + e.getMessage(), e, db.location());
        }
    }

    @Override
    public WriteAcknowledgement write(ConnectorHandle handle, Dataset dataset) {
        DatabaseHandle db = (DatabaseHandle) handle;
        String table = requireTable(db);
        Connection connection = db.connection();
        int written = 0;
        try {
            connection.setAutoCommit(false);
            if (db.create()) {
                try (Statement statement = connection.createStatement()) {
                    statement.execute(createTableSql(table, dataset));
                }
            }
            try (PreparedStatement insert = connection.prepareStatement(insertSql(table, dataset))) {
                for (int r = 0; r < dataset.rowCount(); r++) {
                    List<JsonNode> row = dataset.row(r);
                    for (int c = 0; c < row.size(); c++) {
                        insert.setObject(c + 1, toJdbc(row.get(c)));
                    }
                    insert.addBatch();
                    if ((r + 1) % db.batchSize() == 0) {
                        insert.executeBatch();
                        written = r + 1;
                    }
                }
                insert.executeBatch();
            }
            connection.commit();
            written = dataset.rowCount();
        } catch (SQLException e) {
            rollback(connection, db.location());
            throw new ConnectorIOError(
                    "Insert into " + table + " failed: " + e.getMessage(),
                    e,
                    db.location(),
                    new ConnectorIOError.RowRange(written, dataset.rowCount()));
        }
        LOG.debug("Rows inserted: location={}, table={}, rows={}", db.location(), table, written);
        return new WriteAcknowledgement(ID, db.location() + "/" + table, written);
    }

    @Override
    public void close(ConnectorHandle handle) {
        DatabaseHandle db = (DatabaseHandle) handle;
        try {
            db.connection().close();
        } catch (SQLException e) {
            throw new ConnectorIOError("Failed to close " + db.location() + ": " + e.getMessage(), e, db.location());
        }
    }

    private static String requireTable(DatabaseHandle db) {
        if (db.table() == null) {
            throw new ConnectorIOError("Setting 'table' is required here", null, db.location());
        }
        return db.table();
    }

    private static void rollback(Connection connection, String location) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed: location={}", location, e);
        }
    }

    static String createTableSql(String table, Dataset dataset) {
        StringJoiner columns = new StringJoiner(", ", "CREATE TABLE IF NOT EXISTS " + quote(table) + " (", ")");
        for (String column : dataset.columns()) {
            columns.add(quote(column) + " " + sqlType(dataset.column(column)));
        }
        return columns.toString();
    }

    private static String insertSql(String table, Dataset dataset) {
        StringJoiner names = new StringJoiner(", ");
        StringJoiner marks = new StringJoiner(", ");
        for (String column : dataset.columns()) {
            names.add(quote(column));
            marks.add("?");
        }
        return "INSERT INTO " + quote(table) + " (" + names + ") VALUES (" + marks + ")";
    }

    /** Picks a column type from the first non-null value. */
    private static String sqlType(List<JsonNode> values) {
        for (JsonNode value : values) {
            if (value.isNull()) {
                continue;
            }
            if (value.isIntegralNumber()) {
                return "BIGINT";
            }
            if (value.isNumber()) {
                return "DOUBLE PRECISION";
            }
            if (value.isBoolean()) {
                return "BOOLEAN";
            }
            return "VARCHAR(4000)";
        }
        return "VARCHAR(4000)";
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static Object toJdbc(JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? (Object) value.longValue() : new BigDecimal(value.bigIntegerValue());
        }
        if (value.isBigDecimal()) {
            return value.decimalValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.instance;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).longValue());
        }
        if (value instanceof BigDecimal decimal) {
            return NODES.numberNode(decimal);
        }
        if (value instanceof Number number) {
            return NODES.numberNode(number.doubleValue());
        }
        if (value instanceof Boolean bool) {
            return NODES.booleanNode(bool);
        }
        return NODES.textNode(value.toString());
    }

    /** Strips userinfo and query parameters so passwords never reach logs. */
    private static String redact(String url) {
        String noQuery = url.replaceAll("[?;].*$", "");
        return noQuery.replaceAll("//[^/@]*@", "//");
    }

    private record DatabaseHandle(
            Connection connection, String location, String table, String query, boolean create, int batchSize)
            implements ConnectorHandle {}
}
