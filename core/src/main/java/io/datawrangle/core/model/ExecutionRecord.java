package io.datawrangle.core.model;

import java.time.Duration;

/**
 * Outcome of one step of a run.
 *
 * @param position    where the step is declared
 * @param kind        step kind name
 * @param status      final status
 * @param duration    wall time spent in the step
 * @param error       error description, or {@code null}; present for failed and error-skipped steps
 *                    and for steps that dropped rows
 * @param skippedRows number of rows dropped under {@code on_error: skip_row}
 */
public record ExecutionRecord(
        StepPosition position, String kind, Status status, Duration duration, String error, int skippedRows) {

    /** Per-step outcome. */
    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public Section section() {
        return position.section();
    }

    public int stepIndex() {
        return position.index();
    }

    public boolean hasError() {
        return error != null;
    }
}
