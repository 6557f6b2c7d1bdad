package io.datawrangle.core.engine.builtin;

import io.datawrangle.core.connector.ConnectorRegistry;
import io.datawrangle.core.engine.StepRegistry;

/** Registers every built-in step kind. */
public final class BuiltinSteps {

    private BuiltinSteps() {}

    /**
     * Adds the built-in kinds to {@code registry}: a read and/or write kind per connector in
     * {@code connectors}, the aggregate reads, and the text, column, expression, group, inference
     * and custom-function wrangles.
     *
     * @throws io.datawrangle.core.error.StepRegistrationException if a kind is already registered
     */
    public static StepRegistry.Builder registerAll(StepRegistry.Builder registry, ConnectorRegistry connectors) {
        ConnectorSteps.register(registry, connectors);
        AggregateReads.register(registry);
        TextSteps.register(registry);
        ColumnSteps.register(registry);
        GroupSteps.register(registry);
        CustomSteps.register(registry);
        registry.register(ExpressionStep.kind());
        registry.register(InferStep.kind());
        return registry;
    }
}
