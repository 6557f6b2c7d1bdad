package io.datawrangle.core.spi;

import io.datawrangle.core.model.StepDescriptor;

/**
 * Builds an executable step from a validated descriptor. Called once per step per run, after
 * validation and before any connector is opened.
 */
@FunctionalInterface
public interface StepFactory {

    /**
     * @param descriptor the validated step
     * @param resolver   access to expressions, connectors, nested resolution and custom code
     * @return a {@link SourceStep}, {@link WrangleStep} or {@link SinkStep} matching the section
     */
    ExecutableStep create(StepDescriptor descriptor, StepResolver resolver);
}
