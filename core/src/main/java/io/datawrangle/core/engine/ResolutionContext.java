package io.datawrangle.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.datawrangle.core.connector.ConnectorRegistry;
import io.datawrangle.core.error.CustomFunctionError;
import io.datawrangle.core.error.StepExecutionError;
import io.datawrangle.core.error.WrangleException;
import io.datawrangle.core.function.CustomFunctionLoader;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.CompiledExpression;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ExecutableStep;
import io.datawrangle.core.spi.SinkStep;
import io.datawrangle.core.spi.SourceStep;
import io.datawrangle.core.spi.StepResolver;
import io.datawrangle.core.spi.WrangleStep;

/**
 * Resolves validated descriptors into guarded executable steps for one run. Every step, nested or
 * not, goes through here so that it gets its condition, error policy and record.
 */
final class ResolutionContext implements StepResolver {

    private final StepRegistry registry;
    private final EngineRegistry engines;
    private final ConnectorRegistry connectors;
    private final CustomFunctionLoader customFunctions;
    private final RunContext run;

    ResolutionContext(
            StepRegistry registry,
            EngineRegistry engines,
            ConnectorRegistry connectors,
            CustomFunctionLoader customFunctions,
            RunContext run) {
        this.registry = registry;
        this.engines = engines;
        this.connectors = connectors;
        this.customFunctions = customFunctions;
        this.run = run;
    }

    @Override
    public CompiledExpression compile(String expression) {
        return engines.defaultEngine().compile(expression);
    }

    @Override
    public SourceStep resolveSource(StepDescriptor descriptor) {
        SourceStep step = create(descriptor, Section.READ, SourceStep.class);
        return new GuardedSource(descriptor, step, condition(descriptor), expression(descriptor, CommonKeys.WHERE), run);
    }

    @Override
    public WrangleStep resolveWrangle(StepDescriptor descriptor) {
        WrangleStep step = create(descriptor, Section.WRANGLE, WrangleStep.class);
        return new GuardedWrangle(descriptor, step, condition(descriptor), run);
    }

    /** Resolves a top-level write step. */
    SinkStep resolveSink(StepDescriptor descriptor) {
        SinkStep step = create(descriptor, Section.WRITE, SinkStep.class);
        return new GuardedSink(descriptor, step, condition(descriptor), expression(descriptor, CommonKeys.WHERE), run);
    }

    @Override
    public Connector connector(String id) {
        return connectors.require(id);
    }

    @Override
    public CustomFunctionLoader customFunctions() {
        if (customFunctions == null) {
            throw new CustomFunctionError(
                    "Custom functions are not enabled for this run; enable them in the run options", null);
        }
        return customFunctions;
    }

    private <T extends ExecutableStep> T create(StepDescriptor descriptor, Section section, Class<T> type) {
        StepKind kind = registry.require(section, descriptor.kind());
        ExecutableStep step;
        try {
            step = kind.factory().create(descriptor, this);
        } catch (WrangleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StepExecutionError(
                    "Cannot resolve step: " + e.getMessage(), e, descriptor.position(), descriptor.kind(), null);
        }
        if (!type.isInstance(step)) {
            throw new IllegalStateException("Factory of '" + kind.name() + "' returned "
                    + step.getClass().getName() + ", expected a " + type.getSimpleName());
        }
        return type.cast(step);
    }

    private CompiledExpression condition(StepDescriptor descriptor) {
        return expression(descriptor, CommonKeys.IF);
    }

    private CompiledExpression expression(StepDescriptor descriptor, String key) {
        JsonNode value = descriptor.config().get(key);
        return value != null && value.isTextual() ? compile(value.asText()) : null;
    }
}
