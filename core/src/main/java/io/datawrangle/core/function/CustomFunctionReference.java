package io.datawrangle.core.function;

import com.fasterxml.jackson.databind.JsonNode;
import io.datawrangle.core.error.CustomFunctionError;
import java.util.Objects;

/**
 * Points at user-supplied code: an optional JAR or classes directory, a symbol and its calling
 * convention.
 *
 * <p>The symbol is a fully-qualified class name, optionally followed by {@code #method} to select
 * a public static method instead of a class implementing one of the function interfaces.
 *
 * @param file     JAR or directory holding the code, or {@code null} to use the run's libraries
 * @param function the symbol, e.g. {@code com.acme.Slugify} or {@code com.acme.Text#slugify}
 * @param type     the calling convention
 */
public record CustomFunctionReference(String file, String function, FunctionType type) {

    public CustomFunctionReference {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Reads a reference from step configuration keys {@code file}, {@code function} and
     * {@code type}. Types default to {@code row}.
     *
     * @throws CustomFunctionError if {@code function} is missing or {@code type} is unknown
     */
    public static CustomFunctionReference fromConfig(JsonNode config) {
        JsonNode function = config.get("function");
        if (function == null || !function.isTextual() || function.asText().isBlank()) {
            throw new CustomFunctionError("Custom function reference has no 'function'", String.valueOf(config));
        }
        JsonNode typeNode = config.get("type");
        FunctionType type = typeNode == null ? FunctionType.ROW : FunctionType.fromKey(typeNode.asText());
        if (type == null) {
            throw new CustomFunctionError(
                    "Unknown custom function type '" + typeNode.asText() + "'", function.asText());
        }
        JsonNode file = config.get("file");
        return new CustomFunctionReference(
                file != null && !file.isNull() ? file.asText() : null, function.asText(), type);
    }

    /** The class part of the symbol. */
    public String className() {
        int hash = function.indexOf('#');
        return hash < 0 ? function : function.substring(0, hash);
    }

    /** The method part of the symbol, or {@code null} for class symbols. */
    public String methodName() {
        int hash = function.indexOf('#');
        return hash < 0 ? null : function.substring(hash + 1);
    }

    @Override
    public String toString() {
        return (file != null ? file + ":" : "") + function + " (" + type.key() + ")";
    }
}
