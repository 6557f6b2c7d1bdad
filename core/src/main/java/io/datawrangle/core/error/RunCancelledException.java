package io.datawrangle.core.error;

import io.datawrangle.core.model.StepPosition;

/** Thrown when the run's cancellation token is raised; reported against the step that was next. */
public final class RunCancelledException extends WrangleExecutionException {

    private static final long serialVersionUID = 1L;

    public RunCancelledException(String message, StepPosition position, String kind) {
        super(message, position, kind);
    }
}
