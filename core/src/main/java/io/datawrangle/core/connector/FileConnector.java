package io.datawrangle.core.connector;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.error.ConnectorIOError;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Local files in CSV, TSV, JSON or JSON Lines.
 *
 * <p>Settings: {@code path} (required), {@code format} (defaults from the extension),
 * {@code encoding} (defaults to UTF-8). Relative paths resolve against the connector's base
 * directory.
 */
public final class FileConnector implements Connector {

    public static final String ID = "file";

    private final Path baseDirectory;

    public FileConnector() {
        this(Path.of(""));
    }

    public FileConnector(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ObjectNode settingsSchema() {
        return Schemas.object()
                .property("path", Schemas.string())
                .property("format", Schemas.enumOf("csv", "tsv", "json", "jsonl"))
                .property("encoding", Schemas.string())
                .build();
    }

    @Override
    public List<String> requiredSettings() {
        return List.of("path");
    }

    @Override
    public ConnectorHandle open(ObjectNode settings, Credentials credentials) {
        String raw = settings.path("path").asText();
        Path path = baseDirectory.resolve(raw);
        DatasetFormat format;
        Charset charset;
        try {
            format = settings.hasNonNull("format")
                    ? DatasetFormat.fromKey(settings.get("format").asText())
                    : DatasetFormat.fromFileName(raw);
            charset = settings.hasNonNull("encoding")
                    ? Charset.forName(settings.get("encoding").asText())
                    : StandardCharsets.UTF_8;
        } catch (IllegalArgumentException e) {
            throw new ConnectionError(e.getMessage(), e, path.toString(), 1);
        }
        return new FileHandle(path, format, charset);
    }

    @Override
    public Dataset read(ConnectorHandle handle) {
        FileHandle file = (FileHandle) handle;
        if (!Files.isRegularFile(file.path())) {
            throw new ConnectionError("File not found: " + file.path(), null, file.location(), 1);
        }
        try (Reader reader = Files.newBufferedReader(file.path(), file.charset())) {
            return DatasetCodec.read(reader, file.format());
        } catch (IOException e) {
            throw new ConnectorIOError("Failed to read " + file.path() + ": " + e.getMessage(), e, file.location());
        }
    }

    @Override
    public WriteAcknowledgement write(ConnectorHandle handle, Dataset dataset) {
        FileHandle file = (FileHandle) handle;
        try {
            Path parent = file.path().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file.path(), file.charset())) {
                DatasetCodec.write(dataset, writer, file.format());
            }
        } catch (IOException e) {
            throw new ConnectorIOError("Failed to write " + file.path() + ": " + e.getMessage(), e, file.location());
        }
        return new WriteAcknowledgement(ID, file.location(), dataset.rowCount());
    }

    @Override
    public void close(ConnectorHandle handle) {
        // files are opened and closed per operation
    }

    private record FileHandle(Path path, DatasetFormat format, Charset charset) implements ConnectorHandle {

        @Override
        public String location() {
            return path.toString();
        }
    }
}
