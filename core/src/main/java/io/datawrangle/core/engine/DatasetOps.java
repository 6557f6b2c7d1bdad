package io.datawrangle.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.CompiledExpression;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dataset operations behind the common step keys ({@code columns}, {@code not_columns},
 * {@code where}, {@code order_by}, {@code merge}) and the aggregate read kinds.
 *
 * <p>All methods throw {@link IllegalArgumentException} on bad input (unknown columns, mismatched
 * shapes); callers attribute it to the step.
 */
public final class DatasetOps {

    private DatasetOps() {}

    /** Applies {@code columns} then {@code not_columns} when present; both accept column selectors. */
    public static Dataset project(Dataset dataset, JsonNode columns, JsonNode notColumns) {
        Dataset result = dataset;
        if (columns != null && !columns.isNull()) {
            result = result.select(result.matchColumns(StepDescriptor.names(columns)));
        }
        if (notColumns != null && !notColumns.isNull()) {
            result = result.withoutColumns(result.matchColumns(StepDescriptor.names(notColumns)));
        }
        return result;
    }

    /** Keeps the rows for which {@code predicate} is truthy when evaluated against the row object. */
    public static Dataset where(Dataset dataset, CompiledExpression predicate) {
        return dataset.filterRows(r -> predicate.matches(dataset.rowAsObject(r)));
    }

    /**
     * Stable sort by one or more comma-separated columns, each optionally followed by
     * {@code asc} or {@code desc}. Nulls sort last; numbers compare numerically.
     */
    public static Dataset orderBy(Dataset dataset, String orderBy) {
        Comparator<List<JsonNode>> comparator = null;
        for (String term : orderBy.split(",")) {
            String[] parts = term.trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty() || parts.length > 2) {
                throw new IllegalArgumentException("Invalid order_by term: '" + term.trim() + "'");
            }
            int column = dataset.columnIndex(parts[0]);
            boolean descending = false;
            if (parts.length == 2) {
                String direction = parts[1].toLowerCase(Locale.ROOT);
                if (!direction.equals("asc") && !direction.equals("desc")) {
                    throw new IllegalArgumentException("Invalid sort direction: '" + parts[1] + "'");
                }
                descending = direction.equals("desc");
            }
            Comparator<List<JsonNode>> next = byColumn(column, descending);
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        List<Integer> order = new ArrayList<>(dataset.rowCount());
        for (int r = 0; r < dataset.rowCount(); r++) {
            order.add(r);
        }
        Comparator<List<JsonNode>> rows = comparator;
        order.sort((a, b) -> rows.compare(dataset.row(a), dataset.row(b)));
        return dataset.selectRows(order);
    }

    private static Comparator<List<JsonNode>> byColumn(int column, boolean descending) {
        return (a, b) -> {
            JsonNode x = a.get(column);
            JsonNode y = b.get(column);
            if (x.isNull() || y.isNull()) {
                return Boolean.compare(x.isNull(), y.isNull());
            }
            int result = compareValues(x, y);
            return descending ? -result : result;
        };
    }

    /** Orders null, booleans, numbers, text, arrays, then objects; values of one type by value. */
    static int compareValues(JsonNode x, JsonNode y) {
        int rank = Integer.compare(rank(x), rank(y));
        if (rank != 0) {
            return rank;
        }
        if (x.isBoolean()) {
            return Boolean.compare(x.booleanValue(), y.booleanValue());
        }
        if (x.isNumber()) {
            return x.decimalValue().compareTo(y.decimalValue());
        }
        if (x.isContainerNode()) {
            return x.toString().compareTo(y.toString());
        }
        return x.asText().compareTo(y.asText());
    }

    private static int rank(JsonNode value) {
        if (value.isNull() || value.isMissingNode()) {
            return 0;
        }
        if (value.isBoolean()) {
            return 1;
        }
        if (value.isNumber()) {
            return 2;
        }
        if (value.isArray()) {
            return 4;
        }
        return value.isObject() ? 5 : 3;
    }

    /**
     * Merges the dataset of a later read into the working dataset according to its {@code merge}
     * key: absent or {@code append} requires identical column sets, {@code union} allows differing
     * columns, an object selects a join.
     */
    public static Dataset merge(Dataset working, Dataset next, JsonNode merge) {
        if (merge == null || merge.isNull() || "append".equals(merge.asText())) {
            if (!new HashSet<>(working.columns()).equals(new HashSet<>(next.columns()))) {
                throw new IllegalArgumentException("Read results have different columns (" + working.columns()
                        + " vs " + next.columns() + "); set 'merge' to 'union' or a join");
            }
            return working.appendRows(next);
        }
        if ("union".equals(merge.asText())) {
            return union(List.of(working, next));
        }
        if (merge.isObject()) {
            List<String> on = StepDescriptor.names(merge.get("on"));
            List<String> leftOn = merge.has("left_on") ? StepDescriptor.names(merge.get("left_on")) : on;
            List<String> rightOn = merge.has("right_on") ? StepDescriptor.names(merge.get("right_on")) : on;
            return join(working, next, merge.path("how").asText("inner"), leftOn, rightOn);
        }
        throw new IllegalArgumentException("Unsupported merge: " + merge);
    }

    /** Appends rows of all datasets; columns are the union in first-seen order, missing cells null. */
    public static Dataset union(List<Dataset> datasets) {
        Set<String> columns = new LinkedHashSet<>();
        datasets.forEach(d -> columns.addAll(d.columns()));
        Dataset.Builder builder = Dataset.builder(new ArrayList<>(columns));
        for (Dataset dataset : datasets) {
            for (int r = 0; r < dataset.rowCount(); r++) {
                Map<String, JsonNode> row = new LinkedHashMap<>();
                for (String column : dataset.columns()) {
                    row.put(column, dataset.value(r, column));
                }
                builder.addRow(row);
            }
        }
        return builder.build();
    }

    /** Places datasets side by side; all must have the same row count and distinct column names. */
    public static Dataset concatenate(List<Dataset> datasets) {
        if (datasets.isEmpty()) {
            return Dataset.empty();
        }
        int rows = datasets.get(0).rowCount();
        List<String> columns = new ArrayList<>();
        for (Dataset dataset : datasets) {
            if (dataset.rowCount() != rows) {
                throw new IllegalArgumentException(
                        "Cannot concatenate datasets with " + rows + " and " + dataset.rowCount() + " rows");
            }
            columns.addAll(dataset.columns());
        }
        Dataset.Builder builder = Dataset.builder(columns);
        for (int r = 0; r < rows; r++) {
            List<JsonNode> row = new ArrayList<>(columns.size());
            for (Dataset dataset : datasets) {
                row.addAll(dataset.row(r));
            }
            builder.addRow(row);
        }
        return builder.build();
    }

    /**
     * Joins two datasets on key columns. {@code how} is {@code inner}, {@code left}, {@code right}
     * or {@code outer}. Right key columns with the same name as their left key are dropped; other
     * right columns that clash with a column already in the result get a {@code _right} suffix,
     * numbered from {@code _right2} when that is taken too. Output follows left
     * row order, then right order for matches; unmatched right rows come last.
     */
    public static Dataset join(Dataset left, Dataset right, String how, List<String> leftOn, List<String> rightOn) {
        if (leftOn.isEmpty() || leftOn.size() != rightOn.size()) {
            throw new IllegalArgumentException("Join needs the same non-zero number of left and right key columns");
        }
        if (!Set.of("inner", "left", "right", "outer").contains(how)) {
            throw new IllegalArgumentException("Unsupported join type: '" + how + "'");
        }
        int[] leftKeys = indices(left, leftOn);
        int[] rightKeys = indices(right, rightOn);

        List<Integer> rightColumns = new ArrayList<>();
        List<String> columns = new ArrayList<>(left.columns());
        Map<Integer, Integer> sharedKeys = new LinkedHashMap<>();
        for (int c = 0; c < right.columnCount(); c++) {
            String name = right.columns().get(c);
            int keyPosition = positionOf(rightKeys, c);
            if (keyPosition >= 0 && leftOn.get(keyPosition).equals(name)) {
                sharedKeys.put(c, leftKeys[keyPosition]);
                continue;
            }
            rightColumns.add(c);
            columns.add(unique(name, columns));
        }

        Map<List<String>, List<Integer>> rightIndex = new LinkedHashMap<>();
        for (int r = 0; r < right.rowCount(); r++) {
            List<String> key = key(right.row(r), rightKeys);
            if (key != null) {
                rightIndex.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
            }
        }

        Dataset.Builder builder = Dataset.builder(columns);
        boolean[] rightMatched = new boolean[right.rowCount()];
        for (int l = 0; l < left.rowCount(); l++) {
            List<String> key = key(left.row(l), leftKeys);
            List<Integer> matches = key == null ? List.of() : rightIndex.getOrDefault(key, List.of());
            for (int r : matches) {
                rightMatched[r] = true;
                builder.addRow(joined(left.row(l), right.row(r), rightColumns));
            }
            if (matches.isEmpty() && (how.equals("left") || how.equals("outer"))) {
                builder.addRow(joined(left.row(l), null, rightColumns));
            }
        }
        if (how.equals("right") || how.equals("outer")) {
            for (int r = 0; r < right.rowCount(); r++) {
                if (rightMatched[r]) {
                    continue;
                }
                List<JsonNode> leftPart = new ArrayList<>(left.columnCount());
                for (int c = 0; c < left.columnCount(); c++) {
                    leftPart.add(NullNode.instance);
                }
                for (Map.Entry<Integer, Integer> shared : sharedKeys.entrySet()) {
                    leftPart.set(shared.getValue(), right.row(r).get(shared.getKey()));
                }
                builder.addRow(joined(leftPart, right.row(r), rightColumns));
            }
        }
        return builder.build();
    }

    /** {@code name}, or {@code name_right}, {@code name_right2}, ... when that is taken. */
    private static String unique(String name, List<String> taken) {
        if (!taken.contains(name)) {
            return name;
        }
        String candidate = name + "_right";
        for (int n = 2; taken.contains(candidate); n++) {
            candidate = name + "_right" + n;
        }
        return candidate;
    }

    private static List<JsonNode> joined(List<JsonNode> leftRow, List<JsonNode> rightRow, List<Integer> rightColumns) {
        List<JsonNode> row = new ArrayList<>(leftRow);
        for (int c : rightColumns) {
            row.add(rightRow == null ? NullNode.instance : rightRow.get(c));
        }
        return row;
    }

    private static int[] indices(Dataset dataset, List<String> names) {
        int[] result = new int[names.size()];
        for (int i = 0; i < names.size(); i++) {
            result[i] = dataset.columnIndex(names.get(i));
        }
        return result;
    }

    private static int positionOf(int[] values, int value) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> key(List<JsonNode> row, int[] keys) {
        List<String> key = new ArrayList<>(keys.length);
        for (int k : keys) {
            String part = joinKey(row.get(k));
            if (part == null) {
                return null;
            }
            key.add(part);
        }
        return key;
    }

    /** Scalars compare by text, numbers by value, containers by JSON text; null never matches. */
    private static String joinKey(JsonNode cell) {
        if (cell == null || cell.isNull() || cell.isMissingNode()) {
            return null;
        }
        if (cell.isNumber()) {
            return cell.decimalValue().stripTrailingZeros().toPlainString();
        }
        return cell.isValueNode() ? cell.asText() : cell.toString();
    }
}
