package io.datawrangle.core.spi;

import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.WriteAcknowledgement;

/** A resolved {@code write} step. */
@FunctionalInterface
public interface SinkStep extends ExecutableStep {

    WriteAcknowledgement write(Dataset dataset, StepContext context);
}
