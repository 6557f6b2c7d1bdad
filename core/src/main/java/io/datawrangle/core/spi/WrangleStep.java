package io.datawrangle.core.spi;

import io.datawrangle.core.model.Dataset;

/**
 * A resolved transformation. Receives the current dataset and returns the next one; the input is
 * immutable, so returning it unchanged is allowed.
 */
@FunctionalInterface
public interface WrangleStep extends ExecutableStep {

    Dataset apply(Dataset input, StepContext context);
}
