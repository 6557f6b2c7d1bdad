package io.datawrangle.core.engine;

import io.datawrangle.core.function.CustomFunctionLoader;
import io.datawrangle.core.function.CustomFunctionReference;
import io.datawrangle.core.spi.Credentials;
import io.datawrangle.core.spi.RunListener;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Everything a single run needs besides the recipe: template variables, credentials, custom code
 * settings, listeners and the cancellation token.
 *
 * <p>Custom code is opt-in. It is enabled by {@link Builder#enableCustomFunctions()}, by giving
 * libraries, or by passing a pre-built loader (which the caller then owns and closes).
 */
public final class RunOptions {

    private final Map<String, String> variables;
    private final Function<String, String> envLookup;
    private final Map<String, Credentials> credentials;
    private final boolean customFunctionsEnabled;
    private final List<Path> functionLibraries;
    private final Map<String, CustomFunctionReference> functions;
    private final CustomFunctionLoader customFunctionLoader;
    private final List<RunListener> listeners;
    private final CancellationToken cancellationToken;

    private RunOptions(Builder builder) {
        this.variables = Map.copyOf(builder.variables);
        this.envLookup = builder.envLookup;
        this.credentials = Map.copyOf(builder.credentials);
        this.functionLibraries = List.copyOf(builder.functionLibraries);
        this.functions = new LinkedHashMap<>(builder.functions);
        this.customFunctionLoader = builder.customFunctionLoader;
        this.customFunctionsEnabled = builder.customFunctionsEnabled
                || !functionLibraries.isEmpty()
                || !functions.isEmpty()
                || customFunctionLoader != null;
        this.listeners = List.copyOf(builder.listeners);
        this.cancellationToken = builder.cancellationToken;
    }

    /** Options with no variables, no credentials, custom code disabled and the process environment. */
    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> variables() {
        return variables;
    }

    /** Fallback lookup for template variables, normally {@link System#getenv(String)}. */
    public Function<String, String> envLookup() {
        return envLookup;
    }

    public Map<String, Credentials> credentials() {
        return credentials;
    }

    public boolean customFunctionsEnabled() {
        return customFunctionsEnabled;
    }

    public List<Path> functionLibraries() {
        return functionLibraries;
    }

    /** Functions exposed as {@code custom.<name>} wrangle kinds for this run. */
    public Map<String, CustomFunctionReference> functions() {
        return functions;
    }

    /** Caller-owned loader, or {@code null} when the executor should create one per run. */
    public CustomFunctionLoader customFunctionLoader() {
        return customFunctionLoader;
    }

    public List<RunListener> listeners() {
        return listeners;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }


    /** Builder for {@link RunOptions}. */
    public static final class Builder {

        private final Map<String, String> variables = new LinkedHashMap<>();
        private Function<String, String> envLookup = System::getenv;
        private final Map<String, Credentials> credentials = new LinkedHashMap<>();
        private boolean customFunctionsEnabled;
        private final List<Path> functionLibraries = new ArrayList<>();
        private final Map<String, CustomFunctionReference> functions = new LinkedHashMap<>();
        private CustomFunctionLoader customFunctionLoader;
        private final List<RunListener> listeners = new ArrayList<>();
        private CancellationToken cancellationToken = new CancellationToken();

        private Builder() {}

        public Builder variable(String name, String value) {
            variables.put(name, value);
            return this;
        }

        public Builder variables(Map<String, String> values) {
            variables.putAll(values);
            return this;
        }

        public Builder envLookup(Function<String, String> envLookup) {
            this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
            return this;
        }

        public Builder credentials(String name, Credentials bundle) {
            credentials.put(name, bundle);
            return this;
        }

        public Builder enableCustomFunctions() {
            this.customFunctionsEnabled = true;
            return this;
        }

        public Builder functionLibrary(Path library) {
            functionLibraries.add(library);
            return this;
        }

        public Builder function(String name, CustomFunctionReference reference) {
            functions.put(name, reference);
            return this;
        }

        public Builder customFunctionLoader(CustomFunctionLoader loader) {
            this.customFunctionLoader = loader;
            return this;
        }

        public Builder listener(RunListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        public Builder cancellationToken(CancellationToken token) {
            this.cancellationToken = Objects.requireNonNull(token, "token must not be null");
            return this;
        }

        public RunOptions build() {
            return new RunOptions(this);
        }
    }
}
