package io.datawrangle.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Immutable table threaded between steps: unique, ordered column names and ordered rows of JSON
 * cell values. Missing cells are {@link NullNode}, never {@code null}.
 *
 * <p>Every operation returns a new dataset; the receiver is never modified, so a step that keeps a
 * reference after returning cannot observe or cause later changes. Object and array cells are
 * copied on the way in and on the way out, so mutating a cell obtained from {@link #value},
 * {@link #row} or {@link #column} never reaches the dataset.
 */
public final class Dataset {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Dataset EMPTY = new Dataset(List.of(), List.of());

    private final List<String> columns;
    private final List<List<JsonNode>> rows;
    private final Map<String, Integer> index;
    private volatile ObjectNode summary;

    private Dataset(List<String> columns, List<List<JsonNode>> rows) {
        this.columns = columns;
        this.rows = rows;
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            if (idx.put(columns.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: '" + columns.get(i) + "'");
            }
        }
        this.index = idx;
    }

    /** Returns the dataset with no columns and no rows. */
    public static Dataset empty() {
        return EMPTY;
    }

    /**
     * Creates a dataset from columns and rows. Each row must have exactly one value per column;
     * {@code null} values are normalized to {@link NullNode}.
     */
    public static Dataset of(List<String> columns, List<? extends List<? extends JsonNode>> rows) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        List<List<JsonNode>> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<? extends JsonNode> row = rows.get(r);
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row " + r + " has " + row.size() + " values but there are " + columns.size() + " columns");
            }
            copy.add(normalize(row));
        }
        return new Dataset(List.copyOf(columns), Collections.unmodifiableList(copy));
    }

    /**
     * Creates a dataset from JSON objects, one per row. Columns are the union of all field names in
     * first-seen order; absent fields become null cells.
     */
    public static Dataset fromObjects(List<? extends JsonNode> objects) {
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode object : objects) {
            if (!object.isObject()) {
                throw new IllegalArgumentException("Expected a JSON object per row, got: " + object.getNodeType());
            }
            object.fieldNames().forEachRemaining(names::add);
        }
        Builder builder = builder(new ArrayList<>(names));
        for (JsonNode object : objects) {
            List<JsonNode> row = new ArrayList<>(names.size());
            for (String name : names) {
                row.add(object.get(name));
            }
            builder.addRow(row);
        }
        return builder.build();
    }

    /** Returns a builder for a dataset with the given columns. */
    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return index.containsKey(name);
    }

    /**
     * Returns the position of a column.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public int columnIndex(String name) {
        Integer i = index.get(name);
        if (i == null) {
            throw new IllegalArgumentException("Column '" + name + "' does not exist; columns are " + columns);
        }
        return i;
    }

    /**
     * Expands column selectors (names, optional {@code name?}, {@code *} wildcards and {@code regex:}
     * patterns) against this dataset's columns.
     *
     * @see ColumnSelector
     */
    public List<String> matchColumns(List<String> selectors) {
        return ColumnSelector.expand(columns, selectors);
    }

    /** Returns the unmodifiable values of row {@code r} in column order. */
    public List<JsonNode> row(int r) {
        return detached(rows.get(r));
    }

    public JsonNode value(int r, String column) {
        return detached(rows.get(r).get(columnIndex(column)));
    }

    /** Returns row {@code r} as a fresh JSON object keyed by column name. */
    public ObjectNode rowAsObject(int r) {
        ObjectNode object = NODES.objectNode();
        List<JsonNode> row = rows.get(r);
        for (int c = 0; c < columns.size(); c++) {
            object.set(columns.get(c), row.get(c).deepCopy());
        }
        return object;
    }

    /** Returns all rows as fresh JSON objects. */
    public List<ObjectNode> toObjects() {
        List<ObjectNode> objects = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            objects.add(rowAsObject(r));
        }
        return objects;
    }

    /** Returns all rows as a JSON array of objects. */
    public ArrayNode toArrayNode() {
        ArrayNode array = NODES.arrayNode();
        toObjects().forEach(array::add);
        return array;
    }

    /** Returns the values of one column in row order. */
    public List<JsonNode> column(String name) {
        int c = columnIndex(name);
        List<JsonNode> values = new ArrayList<>(rows.size());
        for (List<JsonNode> row : rows) {
            values.add(detached(row.get(c)));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Returns a dataset with {@code name} set to {@code values}. Replaces the column in place if it
     * exists, otherwise appends it.
     */
    public Dataset withColumn(String name, List<? extends JsonNode> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException(
                    "Column '" + name + "' has " + values.size() + " values but there are " + rows.size() + " rows");
        }
        Integer existing = index.get(name);
        List<String> newColumns = new ArrayList<>(columns);
        if (existing == null) {
            newColumns.add(name);
        }
        List<List<JsonNode>> newRows = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<JsonNode> row = new ArrayList<>(rows.get(r));
            JsonNode value = values.get(r) != null ? detached(values.get(r)) : NullNode.instance;
            if (existing == null) {
                row.add(value);
            } else {
                row.set(existing, value);
            }
            newRows.add(Collections.unmodifiableList(row));
        }
        return new Dataset(List.copyOf(newColumns), Collections.unmodifiableList(newRows));
    }

    /** Returns a dataset without the named columns. Unknown names are an error. */
    public Dataset withoutColumns(Collection<String> names) {
        for (String name : names) {
            columnIndex(name);
        }
        List<String> kept = new ArrayList<>();
        for (String column : columns) {
            if (!names.contains(column)) {
                kept.add(column);
            }
        }
        return select(kept);
    }

    /** Returns a dataset with only the named columns, in the given order. */
    public Dataset select(List<String> names) {
        int[] positions = new int[names.size()];
        for (int i = 0; i < names.size(); i++) {
            positions[i] = columnIndex(names.get(i));
        }
        List<List<JsonNode>> newRows = new ArrayList<>(rows.size());
        for (List<JsonNode> row : rows) {
            List<JsonNode> projected = new ArrayList<>(positions.length);
            for (int p : positions) {
                projected.add(row.get(p));
            }
            newRows.add(Collections.unmodifiableList(projected));
        }
        return new Dataset(List.copyOf(names), Collections.unmodifiableList(newRows));
    }

    /** Returns a dataset with columns renamed according to {@code renames} (old name → new name). */
    public Dataset renameColumns(Map<String, String> renames) {
        for (String from : renames.keySet()) {
            columnIndex(from);
        }
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            renamed.add(renames.getOrDefault(column, column));
        }
        return new Dataset(List.copyOf(renamed), rows);
    }

    /** Returns a dataset with the rows whose index satisfies {@code keep}, in original order. */
    public Dataset filterRows(IntPredicate keep) {
        List<List<JsonNode>> kept = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            if (keep.test(r)) {
                kept.add(rows.get(r));
            }
        }
        return new Dataset(columns, Collections.unmodifiableList(kept));
    }

    /** Returns a dataset with the rows at the given indices, in the order given. */
    public Dataset selectRows(List<Integer> rowIndices) {
        List<List<JsonNode>> picked = new ArrayList<>(rowIndices.size());
        for (int r : rowIndices) {
            picked.add(rows.get(r));
        }
        return new Dataset(columns, Collections.unmodifiableList(picked));
    }

    /**
     * Returns this dataset followed by the rows of {@code other}. Both must have the same set of
     * columns; the result keeps this dataset's column order.
     */
    public Dataset appendRows(Dataset other) {
        if (columns.isEmpty() && rows.isEmpty()) {
            return other;
        }
        if (!new LinkedHashSet<>(columns).equals(new LinkedHashSet<>(other.columns))) {
            throw new IllegalArgumentException(
                    "Cannot append rows with columns " + other.columns + " to a dataset with columns " + columns);
        }
        Dataset aligned = other.columns.equals(columns) ? other : other.select(columns);
        List<List<JsonNode>> combined = new ArrayList<>(rows.size() + aligned.rows.size());
        combined.addAll(rows);
        combined.addAll(aligned.rows);
        return new Dataset(columns, Collections.unmodifiableList(combined));
    }

    /**
     * Summary used as the input of dataset-level predicates: {@code {"columns": [...],
     * "rowCount": n, "rows": [...]}}. Built on first use and shared by later calls on the same
     * dataset, so callers must treat it as read-only.
     */
    public ObjectNode summaryNode() {
        ObjectNode result = summary;
        if (result == null) {
            result = NODES.objectNode();
            ArrayNode names = result.putArray("columns");
            columns.forEach(names::add);
            result.put("rowCount", rows.size());
            result.set("rows", toArrayNode());
            summary = result;
        }
        return result;
    }

    private static List<JsonNode> normalize(List<? extends JsonNode> row) {
        List<JsonNode> values = new ArrayList<>(row.size());
        for (JsonNode value : row) {
            values.add(value != null && !value.isMissingNode() ? detached(value) : NullNode.instance);
        }
        return Collections.unmodifiableList(values);
    }

    // Value nodes are immutable in Jackson; only containers need a copy.
    private static JsonNode detached(JsonNode value) {
        return value.isContainerNode() ? value.deepCopy() : value;
    }

    private static List<JsonNode> detached(List<JsonNode> row) {
        List<JsonNode> values = new ArrayList<>(row.size());
        for (JsonNode value : row) {
            values.add(detached(value));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset other)) {
            return false;
        }
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset[columns=" + columns + ", rows=" + rows.size() + "]";
    }

    /** Incremental builder; not thread-safe. */
    public static final class Builder {

        private final List<String> columns;
        private final List<List<JsonNode>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = List.copyOf(columns);
        }

        /** Adds a row of values in column order. */
        public Builder addRow(List<? extends JsonNode> values) {
            if (values.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row has " + values.size() + " values but there are " + columns.size() + " columns");
            }
            rows.add(normalize(values));
            return this;
        }

        /** Adds a row from a column → value map; absent columns become null cells. */
        public Builder addRow(Map<String, ? extends JsonNode> values) {
            List<JsonNode> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(values.get(column));
            }
            rows.add(normalize(row));
            return this;
        }

        /** Adds a row of plain Java values (strings, numbers, booleans, nulls). */
        public Builder addValues(Object... values) {
            List<JsonNode> row = new ArrayList<>(values.length);
            for (Object value : values) {
                row.add(value == null ? NullNode.instance : toNode(value));
            }
            return addRow(row);
        }

        public Dataset build() {
            return new Dataset(columns, Collections.unmodifiableList(new ArrayList<>(rows)));
        }

        private static JsonNode toNode(Object value) {
            if (value instanceof JsonNode node) {
                return node;
            }
            if (value instanceof String s) {
                return NODES.textNode(s);
            }
            if (value instanceof Integer i) {
                return NODES.numberNode(i);
            }
            if (value instanceof Long l) {
                return NODES.numberNode(l);
            }
            if (value instanceof Double d) {
                return NODES.numberNode(d);
            }
            if (value instanceof Boolean b) {
                return NODES.booleanNode(b);
            }
            return NODES.textNode(String.valueOf(value));
        }
    }
}
