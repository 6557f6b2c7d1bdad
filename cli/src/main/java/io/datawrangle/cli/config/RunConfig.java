package io.datawrangle.cli.config;

import io.datawrangle.core.function.CustomFunctionReference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line run configuration, read from {@code datawrangle.yaml}.
 *
 * @param loggingFormat    {@code text} or {@code json}
 * @param loggingLevel     root log level
 * @param baseDirectory    directory that relative {@code file} paths and function libraries resolve
 *                         against
 * @param functionLibraries JARs or class directories holding custom functions
 * @param functions        functions exposed as {@code custom.<name>} steps
 * @param variables        template variables; command line {@code --var} values win
 * @param credentials      credential bundles by name, each a map of opaque key/value pairs
 */
public record RunConfig(
        String loggingFormat,
        String loggingLevel,
        String baseDirectory,
        List<String> functionLibraries,
        Map<String, CustomFunctionReference> functions,
        Map<String, String> variables,
        Map<String, Map<String, String>> credentials) {

    public RunConfig {
        functionLibraries = List.copyOf(functionLibraries);
        functions = Map.copyOf(functions);
        variables = Map.copyOf(variables);
        credentials = Map.copyOf(credentials);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the documented defaults: text logging at INFO, working directory as base. */
    public static final class Builder {

        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private String baseDirectory = ".";
        private final List<String> functionLibraries = new ArrayList<>();
        private final Map<String, CustomFunctionReference> functions = new LinkedHashMap<>();
        private final Map<String, String> variables = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> credentials = new LinkedHashMap<>();

        private Builder() {}

        public Builder loggingFormat(String loggingFormat) {
            if (!"text".equalsIgnoreCase(loggingFormat) && !"json".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'text' or 'json', got '" + loggingFormat + "'");
            }
            this.loggingFormat = loggingFormat.toLowerCase(Locale.ROOT);
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder baseDirectory(String baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public Builder functionLibrary(String library) {
            functionLibraries.add(library);
            return this;
        }

        /** Replaces the configured libraries. */
        public Builder functionLibraries(List<String> libraries) {
            functionLibraries.clear();
            functionLibraries.addAll(libraries);
            return this;
        }

        public Builder function(String name, CustomFunctionReference reference) {
            functions.put(name, reference);
            return this;
        }

        public Builder variable(String name, String value) {
            variables.put(name, value);
            return this;
        }

        public Builder credentials(String name, Map<String, String> values) {
            credentials.put(name, values);
            return this;
        }

        public RunConfig build() {
            return new RunConfig(
                    loggingFormat, loggingLevel, baseDirectory, functionLibraries, functions, variables, credentials);
        }
    }
}
