package io.datawrangle.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.connector.ConnectorRegistry;
import io.datawrangle.core.connector.DatabaseConnector;
import io.datawrangle.core.connector.FileConnector;
import io.datawrangle.core.connector.HttpConnector;
import io.datawrangle.core.connector.MemoryConnector;
import io.datawrangle.core.connector.MemoryStore;
import io.datawrangle.core.connector.ObjectStoreConnector;
import io.datawrangle.core.connector.TestDataConnector;
import io.datawrangle.core.engine.EngineRegistry;
import io.datawrangle.core.engine.PipelineExecutor;
import io.datawrangle.core.engine.RunOptions;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.engine.builtin.BuiltinSteps;
import io.datawrangle.core.error.WrangleException;
import io.datawrangle.core.model.Recipe;
import io.datawrangle.core.model.RunSummary;
import io.datawrangle.core.model.SchemaViolation;
import io.datawrangle.core.spec.RecipeLoader;
import io.datawrangle.core.spec.RecipeParser;
import io.datawrangle.core.spec.RecipeSchemaGenerator;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ExpressionEngine;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for embedding: loads recipe documents (templating and includes), validates them
 * against the registered step kinds and runs them.
 *
 * <p>An engine is immutable once built and may run any number of recipes, concurrently. Run
 * failures, load failures included, are reported through the returned {@link RunSummary}; only
 * programming errors such as {@code null} arguments throw.
 *
 * <pre>{@code
 * RecipeEngine engine = RecipeEngine.builder().build();
 * RunSummary summary = engine.run(Path.of("recipe.yaml"), RunOptions.defaults());
 * }</pre>
 */
public final class RecipeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeEngine.class);

    private final StepRegistry registry;
    private final ConnectorRegistry connectors;
    private final MemoryStore memoryStore;
    private final Path baseDirectory;
    private final PipelineExecutor executor;
    private final RecipeParser parser = new RecipeParser();

    private RecipeEngine(Builder builder) {
        this.memoryStore = builder.memoryStore;
        this.baseDirectory = builder.baseDirectory;
        this.connectors = new ConnectorRegistry()
                .register(new FileConnector(baseDirectory))
                .register(new DatabaseConnector())
                .register(new ObjectStoreConnector())
                .register(new HttpConnector())
                .register(new MemoryConnector(memoryStore))
                .register(new TestDataConnector());
        builder.connectors.forEach(connectors::replace);

        StepRegistry.Builder steps = BuiltinSteps.registerAll(StepRegistry.builder(), connectors);
        builder.stepKinds.forEach(steps::register);
        builder.overrides.forEach(steps::override);
        this.registry = steps.build();

        EngineRegistry engines = EngineRegistry.withDefaults();
        builder.expressionEngines.forEach(engines::register);
        this.executor = new PipelineExecutor(registry, engines, connectors, baseDirectory);
        LOG.info("Recipe engine ready: step_kinds={}, connectors={}", registry.size(), connectors.all().size());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads and parses a recipe file. Placeholders resolve from the options' variables, then its
     * environment lookup; includes resolve relative to the including file.
     *
     * @throws io.datawrangle.core.error.WrangleLoadException if the file cannot be read, parsed or
     *     templated
     */
    public Recipe load(Path recipe, RunOptions options) {
        Objects.requireNonNull(recipe, "recipe must not be null");
        JsonNode document = loader(options).load(recipe);
        return parser.parse(document, recipe.toString());
    }

    /** Loads a recipe given as YAML text; includes resolve against the engine's base directory. */
    public Recipe load(String yaml, RunOptions options) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode document = loader(options).load(yaml, baseDirectory, RecipeParser.INLINE_SOURCE);
        return parser.parse(document, RecipeParser.INLINE_SOURCE);
    }

    /**
     * Loads and validates a recipe without running it.
     *
     * @return every violation, in document order; empty when the recipe is valid
     * @throws io.datawrangle.core.error.WrangleLoadException if the recipe cannot be loaded
     */
    public List<SchemaViolation> validate(Path recipe, RunOptions options) {
        return executor.validate(load(recipe, options), options);
    }

    public List<SchemaViolation> validate(Recipe recipe, RunOptions options) {
        return executor.validate(recipe, options);
    }

    /** Loads and runs a recipe file. Never throws for load or run failures. */
    public RunSummary run(Path recipe, RunOptions options) {
        Recipe parsed;
        try {
            parsed = load(recipe, options);
        } catch (WrangleException e) {
            return executor.failedToLoad(e, options);
        }
        return executor.execute(parsed, options);
    }

    /** Loads and runs a recipe given as YAML text. Never throws for load or run failures. */
    public RunSummary run(String yaml, RunOptions options) {
        Recipe parsed;
        try {
            parsed = load(yaml, options);
        } catch (WrangleException e) {
            return executor.failedToLoad(e, options);
        }
        return executor.execute(parsed, options);
    }

    public RunSummary run(Recipe recipe, RunOptions options) {
        return executor.execute(Objects.requireNonNull(recipe, "recipe must not be null"), options);
    }

    /** The JSON Schema of every recipe this engine accepts. */
    public ObjectNode schema() {
        return RecipeSchemaGenerator.generate(registry);
    }

    public void writeSchema(Path file) {
        RecipeSchemaGenerator.write(registry, file);
    }

    public StepRegistry stepRegistry() {
        return registry;
    }

    /** The store behind the {@code memory} connector. */
    public MemoryStore memoryStore() {
        return memoryStore;
    }

    private static RecipeLoader loader(RunOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return new RecipeLoader(options.variables(), options.envLookup());
    }

    /** Builder for {@link RecipeEngine}. */
    public static final class Builder {

        private MemoryStore memoryStore = new MemoryStore();
        private Path baseDirectory = Path.of("");
        private final List<Connector> connectors = new ArrayList<>();
        private final List<StepKind> stepKinds = new ArrayList<>();
        private final List<StepKind> overrides = new ArrayList<>();
        private final List<ExpressionEngine> expressionEngines = new ArrayList<>();

        private Builder() {}

        /** Store backing the {@code memory} connector; a fresh one by default. */
        public Builder memoryStore(MemoryStore store) {
            this.memoryStore = Objects.requireNonNull(store, "store must not be null");
            return this;
        }

        /**
         * Directory that relative {@code file} paths, includes of inline recipes and custom function
         * files resolve against; the working directory by default.
         */
        public Builder baseDirectory(Path directory) {
            this.baseDirectory = Objects.requireNonNull(directory, "directory must not be null");
            return this;
        }

        /** Adds a connector, or replaces the built-in one with the same id. */
        public Builder connector(Connector connector) {
            connectors.add(Objects.requireNonNull(connector, "connector must not be null"));
            return this;
        }

        /** Registers an additional step kind; clashing with a built-in fails {@link #build()}. */
        public Builder stepKind(StepKind kind) {
            stepKinds.add(Objects.requireNonNull(kind, "kind must not be null"));
            return this;
        }

        /** Replaces a built-in step kind. */
        public Builder overrideStepKind(StepKind kind) {
            overrides.add(Objects.requireNonNull(kind, "kind must not be null"));
            return this;
        }

        /** Registers an expression engine; one with the default id replaces JSLT. */
        public Builder expressionEngine(ExpressionEngine engine) {
            expressionEngines.add(Objects.requireNonNull(engine, "engine must not be null"));
            return this;
        }

        /**
         * @throws io.datawrangle.core.error.StepRegistrationException if two kinds share a name in
         *     one section
         */
        public RecipeEngine build() {
            return new RecipeEngine(this);
        }
    }
}
