package io.datawrangle.core.spi;

import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.RunState;
import io.datawrangle.core.model.StepPosition;

/**
 * Observability hooks for pipeline runs. Adapters bridge these to metrics or progress output; the
 * core has no telemetry dependency.
 *
 * <p>Implementations MUST be non-blocking. Exceptions thrown by listeners are caught by the
 * executor and logged; they do not affect the run.
 */
public interface RunListener {

    /** Called on every state transition, terminal ones included. */
    void onStateChanged(StateChangedEvent event);

    /** Called before a step (top-level or nested) begins. */
    void onStepStarted(StepStartedEvent event);

    /** Called after a step's record has been finalized. */
    void onStepFinished(StepFinishedEvent event);

    // --- Event records ---

    record StateChangedEvent(String runId, RunState from, RunState to) {}

    record StepStartedEvent(String runId, StepPosition position, String kind) {}

    record StepFinishedEvent(String runId, ExecutionRecord record) {}
}
