package io.datawrangle.core.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import com.opencsv.exceptions.CsvException;
import io.datawrangle.core.model.Dataset;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts datasets to and from CSV, TSV, JSON (array of objects) and JSON Lines.
 *
 * <p>CSV cells are read as strings; empty cells become null. On write, strings are written as-is,
 * nulls as empty cells and containers as JSON text.
 */
public final class DatasetCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private DatasetCodec() {}

    /**
     * Parses a dataset.
     *
     * @throws IOException if the content cannot be read or is not valid for the format
     */
    public static Dataset read(Reader reader, DatasetFormat format) throws IOException {
        return switch (format) {
            case CSV -> readDelimited(reader, ',');
            case TSV -> readDelimited(reader, '\t');
            case JSON -> readJson(reader);
            case JSONL -> readJsonLines(reader);
        };
    }

    /** Serializes a dataset. */
    public static void write(Dataset dataset, Writer writer, DatasetFormat format) throws IOException {
        switch (format) {
            case CSV -> writeDelimited(dataset, writer, ',');
            case TSV -> writeDelimited(dataset, writer, '\t');
            case JSON -> MAPPER.writerWithDefaultPrettyPrinter().writeValue(writer, dataset.toArrayNode());
            case JSONL -> {
                for (JsonNode row : dataset.toObjects()) {
                    writer.write(MAPPER.writeValueAsString(row));
                    writer.write('\n');
                }
            }
        }
        writer.flush();
    }

    /** Converts a JSON array of objects (as returned by APIs) to a dataset. */
    public static Dataset fromJson(JsonNode array) throws IOException {
        if (!array.isArray()) {
            throw new IOException("Expected a JSON array of objects, got " + array.getNodeType());
        }
        List<JsonNode> rows = new ArrayList<>(array.size());
        array.forEach(rows::add);
        try {
            return Dataset.fromObjects(rows);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static Dataset readDelimited(Reader reader, char separator) throws IOException {
        CSVParserBuilder parser = new CSVParserBuilder().withSeparator(separator);
        try (CSVReader csv =
                new CSVReaderBuilder(reader).withCSVParser(parser.build()).build()) {
            String[] header = csv.readNext();
            if (header == null) {
                return Dataset.empty();
            }
            List<String> columns = Arrays.asList(header);
            Dataset.Builder builder = Dataset.builder(columns);
            String[] line;
            int lineNo = 1;
            while ((line = csv.readNext()) != null) {
                lineNo++;
                if (line.length == 1 && line[0].isEmpty()) {
                    continue;
                }
                if (line.length != columns.size()) {
                    throw new IOException("Line " + lineNo + " has " + line.length + " fields, expected "
                            + columns.size());
                }
                List<JsonNode> row = new ArrayList<>(line.length);
                for (String cell : line) {
                    row.add(cell.isEmpty() ? NullNode.instance : NODES.textNode(cell));
                }
                builder.addRow(row);
            }
            return builder.build();
        } catch (CsvException e) {
            throw new IOException("Malformed delimited data: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static void writeDelimited(Dataset dataset, Writer writer, char separator) throws IOException {
        ICSVWriter csv = new CSVWriterBuilder(writer).withSeparator(separator).build();
        csv.writeNext(dataset.columns().toArray(new String[0]), false);
        for (int r = 0; r < dataset.rowCount(); r++) {
            List<JsonNode> row = dataset.row(r);
            String[] cells = new String[row.size()];
            for (int c = 0; c < cells.length; c++) {
                cells[c] = cellText(row.get(c));
            }
            csv.writeNext(cells, false);
        }
        csv.flush();
        if (csv.checkError()) {
            throw new IOException("Failed writing delimited data");
        }
    }

    private static String cellText(JsonNode cell) {
        if (cell.isNull()) {
            return "";
        }
        return cell.isValueNode() ? cell.asText() : cell.toString();
    }

    private static Dataset readJson(Reader reader) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return Dataset.empty();
        }
        return fromJson(root);
    }

    private static Dataset readJsonLines(Reader reader) throws IOException {
        BufferedReader lines = new BufferedReader(reader);
        List<JsonNode> rows = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = lines.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                rows.add(MAPPER.readTree(line));
            } catch (JsonProcessingException e) {
                throw new IOException("Malformed JSON on line " + lineNo + ": " + e.getOriginalMessage(), e);
            }
        }
        try {
            return Dataset.fromObjects(rows);
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
