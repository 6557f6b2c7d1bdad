package io.datawrangle.core.error;

import io.datawrangle.core.model.StepPosition;

/**
 * Thrown when a step raises while being applied. Carries the row index when the failure is tied to
 * a single row.
 */
public final class StepExecutionError extends WrangleExecutionException {

    private static final long serialVersionUID = 1L;

    private final Integer row;

    public StepExecutionError(String message, StepPosition position, String kind) {
        super(message, position, kind);
        this.row = null;
    }

    public StepExecutionError(String message, Throwable cause, StepPosition position, String kind, Integer row) {
        super(message, cause, position, kind);
        this.row = row;
    }

    /** Zero-based index of the failing row, or {@code null} if not row-specific. */
    public Integer row() {
        return row;
    }
}
