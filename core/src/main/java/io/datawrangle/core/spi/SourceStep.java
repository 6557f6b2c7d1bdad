package io.datawrangle.core.spi;

import io.datawrangle.core.model.Dataset;

/** A resolved {@code read} step. */
@FunctionalInterface
public interface SourceStep extends ExecutableStep {

    Dataset read(StepContext context);
}
