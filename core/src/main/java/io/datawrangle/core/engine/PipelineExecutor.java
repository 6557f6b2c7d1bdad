package io.datawrangle.core.engine;

import io.datawrangle.core.connector.ConnectorRegistry;
import io.datawrangle.core.engine.builtin.CustomSteps;
import io.datawrangle.core.error.SchemaViolationException;
import io.datawrangle.core.error.StepExecutionError;
import io.datawrangle.core.error.WrangleException;
import io.datawrangle.core.function.CustomFunctionLoader;
import io.datawrangle.core.function.CustomFunctionReference;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.Recipe;
import io.datawrangle.core.model.RunState;
import io.datawrangle.core.model.RunSummary;
import io.datawrangle.core.model.SchemaViolation;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spec.RecipeValidator;
import io.datawrangle.core.spec.Shorthands;
import io.datawrangle.core.spi.SinkStep;
import io.datawrangle.core.spi.SourceStep;
import io.datawrangle.core.spi.WrangleStep;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one recipe through {@code LOADED → VALIDATED → READING → TRANSFORMING → WRITING →
 * COMPLETED}, with {@code FAILED} reachable from every non-terminal state.
 *
 * <p>Every step is resolved after validation and before the first read, so an unloadable custom
 * function aborts the run before any connector is opened. Steps run sequentially in declaration
 * order; the dataset is immutable, so each step sees exactly its predecessor's output.
 *
 * <p>Run failures never escape {@link #execute}: they are returned as a {@link RunSummary} with
 * outcome {@code FAILED}. Thread-safe: the executor keeps no per-run state in fields, so
 * independent runs may execute concurrently.
 */
public final class PipelineExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineExecutor.class);

    /** MDC key holding the run id for the duration of a run. */
    public static final String MDC_RUN_ID = "runId";

    private final StepRegistry registry;
    private final EngineRegistry engines;
    private final ConnectorRegistry connectors;
    private final RecipeValidator validator;
    private final Path baseDirectory;

    public PipelineExecutor(StepRegistry registry, EngineRegistry engines, ConnectorRegistry connectors) {
        this(registry, engines, connectors, Path.of(""));
    }

    /** @param baseDirectory directory that relative custom function files resolve against */
    public PipelineExecutor(
            StepRegistry registry, EngineRegistry engines, ConnectorRegistry connectors, Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engines = Objects.requireNonNull(engines, "engines must not be null");
        this.connectors = Objects.requireNonNull(connectors, "connectors must not be null");
        this.validator = new RecipeValidator(engines);
    }

    /** The registry extended with the run's {@code custom.<name>} kinds. */
    public StepRegistry registryFor(RunOptions options) {
        List<StepKind> runScoped = new ArrayList<>();
        for (Map.Entry<String, CustomFunctionReference> function : options.functions().entrySet()) {
            runScoped.add(CustomSteps.declared(function.getKey(), function.getValue()));
        }
        return registry.withRunScoped(runScoped);
    }

    /** Validates without running. */
    public List<SchemaViolation> validate(Recipe recipe, RunOptions options) {
        StepRegistry runRegistry = registryFor(options);
        return validator.validate(Shorthands.expand(recipe, runRegistry), runRegistry);
    }

    /** Runs a parsed recipe. */
    public RunSummary execute(Recipe declared, RunOptions options) {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        RunReporter reporter = new RunReporter(runId);
        RunContext run = new RunContext(runId, reporter, options);
        CustomFunctionLoader ownedLoader = null;
        RunState state = RunState.LOADED;
        LOG.info("Run started: run_id={}, recipe={}", runId, declared.source());
        try {
            StepRegistry runRegistry = registryFor(options);
            Recipe recipe = Shorthands.expand(declared, runRegistry);
            List<SchemaViolation> violations = validator.validate(recipe, runRegistry);
            if (!violations.isEmpty()) {
                LOG.warn("Recipe rejected: run_id={}, violations={}", runId, violations.size());
                return fail(run, state, violations, new SchemaViolationException(violations, recipe.source()));
            }
            state = transition(run, state, RunState.VALIDATED);

            CustomFunctionLoader loader = options.customFunctionLoader();
            if (loader == null && options.customFunctionsEnabled()) {
                ownedLoader = CustomFunctionLoader.create(options.functionLibraries(), baseDirectory);
                loader = ownedLoader;
            }
            ResolutionContext resolver = new ResolutionContext(runRegistry, engines, connectors, loader, run);
            List<SourceStep> sources = new ArrayList<>();
            recipe.read().forEach(d -> sources.add(resolver.resolveSource(d)));
            List<WrangleStep> wrangles = new ArrayList<>();
            recipe.wrangles().forEach(d -> wrangles.add(resolver.resolveWrangle(d)));
            List<SinkStep> sinks = new ArrayList<>();
            recipe.write().forEach(d -> sinks.add(resolver.resolveSink(d)));

            state = transition(run, state, RunState.READING);
            Dataset working = read(recipe.read(), sources);

            state = transition(run, state, RunState.TRANSFORMING);
            for (WrangleStep wrangle : wrangles) {
                working = wrangle.apply(working, null);
            }

            state = transition(run, state, RunState.WRITING);
            for (SinkStep sink : sinks) {
                sink.write(working, null);
            }

            transition(run, state, RunState.COMPLETED);
            RunSummary summary = reporter.completed(working);
            LOG.info(
                    "Run completed: run_id={}, steps={}, rows={}, duration_ms={}",
                    runId,
                    summary.records().size(),
                    working.rowCount(),
                    summary.totalDuration().toMillis());
            return summary;
        } catch (WrangleException e) {
            LOG.warn("Run failed: run_id={}, state={}, error={}", runId, state, e.getMessage());
            return fail(run, state, List.of(), e);
        } finally {
            if (ownedLoader != null) {
                ownedLoader.close();
            }
            MDC.remove(MDC_RUN_ID);
        }
    }

    /**
     * Reports a run that failed before its recipe could be parsed (unreadable YAML, template
     * errors).
     */
    public RunSummary failedToLoad(WrangleException error, RunOptions options) {
        String runId = UUID.randomUUID().toString();
        RunContext run = new RunContext(runId, new RunReporter(runId), options);
        LOG.warn("Recipe could not be loaded: run_id={}, error={}", runId, error.getMessage());
        return fail(run, RunState.LOADED, List.of(), error);
    }

    private static Dataset read(List<StepDescriptor> descriptors, List<SourceStep> sources) {
        Dataset working = null;
        for (int i = 0; i < sources.size(); i++) {
            Dataset next = sources.get(i).read(null);
            if (next == null) {
                continue;
            }
            if (working == null) {
                working = next;
                continue;
            }
            StepDescriptor descriptor = descriptors.get(i);
            try {
                working = DatasetOps.merge(working, next, descriptor.config().get(CommonKeys.MERGE));
            } catch (IllegalArgumentException e) {
                throw new StepExecutionError(
                        "Cannot merge read results: " + e.getMessage(),
                        e,
                        descriptor.position(),
                        descriptor.kind(),
                        null);
            }
        }
        return working != null ? working : Dataset.empty();
    }

    private static RunState transition(RunContext run, RunState from, RunState to) {
        run.stateChanged(from, to);
        return to;
    }

    private static RunSummary fail(
            RunContext run, RunState state, List<SchemaViolation> violations, WrangleException error) {
        run.stateChanged(state, RunState.FAILED);
        return run.reporter().failed(state, violations, error);
    }
}
