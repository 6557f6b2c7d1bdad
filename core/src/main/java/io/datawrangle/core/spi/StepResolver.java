package io.datawrangle.core.spi;

import io.datawrangle.core.function.CustomFunctionLoader;
import io.datawrangle.core.model.StepDescriptor;

/** Services available to {@link StepFactory} implementations while a run resolves its steps. */
public interface StepResolver {

    /**
     * Compiles an expression with the run's default expression engine.
     *
     * @throws io.datawrangle.core.error.ExpressionException if the expression does not compile
     */
    CompiledExpression compile(String expression);

    /** Resolves a nested read step (e.g. a {@code sources} entry). */
    SourceStep resolveSource(StepDescriptor descriptor);

    /** Resolves a nested wrangle step (e.g. a group's {@code steps} entry). */
    WrangleStep resolveWrangle(StepDescriptor descriptor);

    /**
     * Looks up a connector by id.
     *
     * @throws IllegalArgumentException if no connector has that id
     */
    Connector connector(String id);

    /**
     * The run's custom code loader.
     *
     * @throws io.datawrangle.core.error.CustomFunctionError if custom code loading was not
     *     enabled for this run
     */
    CustomFunctionLoader customFunctions();
}
