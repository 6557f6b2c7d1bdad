package io.datawrangle.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.datawrangle.core.error.CustomFunctionError;
import io.datawrangle.core.function.CustomFunctionReference;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads {@link RunConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * logging:
 *   format: text            # DATAWRANGLE_LOG_FORMAT
 *   level: INFO             # DATAWRANGLE_LOG_LEVEL
 * data:
 *   base-dir: .             # DATAWRANGLE_BASE_DIR
 * functions:
 *   libraries: [lib/x.jar]  # DATAWRANGLE_FUNCTIONS (path-separator list)
 *   declared:
 *     slugify: {function: com.acme.Text#slugify, type: row}
 * variables:
 *   region: eu
 * credentials:
 *   warehouse: {user: etl, password: secret}
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values. A variable counts as set only when it
 * is defined and not blank; otherwise the YAML value stands.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** File read from the working directory when no {@code --config} is given. */
    public static final String DEFAULT_CONFIG_FILE = "datawrangle.yaml";

    static final String ENV_PREFIX = "DATAWRANGLE_";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration from {@code configPath}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RunConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Loads {@code configPath} when given; otherwise {@value #DEFAULT_CONFIG_FILE} from
     * {@code workingDirectory} if it exists, or the defaults. The overlay applies in every case.
     */
    public static RunConfig loadOrDefault(Path configPath, Path workingDirectory, Function<String, String> envLookup) {
        if (configPath != null) {
            return load(configPath, envLookup);
        }
        Path fallback = workingDirectory.resolve(DEFAULT_CONFIG_FILE);
        if (Files.exists(fallback)) {
            return load(fallback, envLookup);
        }
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static RunConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration must be a mapping, got " + root.getNodeType());
        }
        RunConfig.Builder builder = RunConfig.builder();

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode data = root.path("data");
        if (data.has("base-dir")) builder.baseDirectory(data.get("base-dir").asText());

        JsonNode functions = root.path("functions");
        functions.path("libraries").forEach(library -> builder.functionLibrary(library.asText()));
        forEachField(functions.path("declared"), (name, reference) -> {
            try {
                builder.function(name, CustomFunctionReference.fromConfig(reference));
            } catch (CustomFunctionError e) {
                throw new ConfigLoadException("Invalid function '" + name + "': " + e.getMessage(), e);
            }
        });

        forEachField(root.path("variables"), (name, value) -> builder.variable(name, value.asText()));
        forEachField(root.path("credentials"), (name, bundle) -> {
            if (!bundle.isObject()) {
                throw new ConfigLoadException("Credentials '" + name + "' must be a mapping");
            }
            Map<String, String> values = new LinkedHashMap<>();
            bundle.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
            builder.credentials(name, values);
        });

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(RunConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "BASE_DIR", builder::baseDirectory);
        envString(envLookup, "FUNCTIONS", value -> builder.functionLibraries(splitPaths(value)));
    }

    private static List<String> splitPaths(String value) {
        return Arrays.stream(value.split(File.pathSeparator))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String key, Consumer<String> setter) {
        String envVar = ENV_PREFIX + key;
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    // --- YAML helpers ---

    private interface FieldConsumer {
        void accept(String name, JsonNode value);
    }

    private static void forEachField(JsonNode node, FieldConsumer consumer) {
        if (node.isMissingNode() || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new ConfigLoadException("Expected a mapping, got " + node.getNodeType() + ": " + node);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            consumer.accept(field.getKey(), field.getValue());
        }
    }
}
