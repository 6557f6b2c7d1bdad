package io.datawrangle.core.model;

import io.datawrangle.core.error.WrangleException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one pipeline run: overall status, timing, one record per executed step and,
 * on success, the final dataset and the writes performed.
 */
public final class RunSummary {

    /** Overall run outcome. */
    public enum Outcome {
        COMPLETED,
        FAILED
    }

    private final String runId;
    private final Outcome outcome;
    private final RunState failedIn;
    private final Duration totalDuration;
    private final List<ExecutionRecord> records;
    private final List<SchemaViolation> violations;
    private final Dataset dataset;
    private final List<WriteAcknowledgement> writes;
    private final WrangleException failure;

    private RunSummary(
            String runId,
            Outcome outcome,
            RunState failedIn,
            Duration totalDuration,
            List<ExecutionRecord> records,
            List<SchemaViolation> violations,
            Dataset dataset,
            List<WriteAcknowledgement> writes,
            WrangleException failure) {
        this.runId = runId;
        this.outcome = outcome;
        this.failedIn = failedIn;
        this.totalDuration = totalDuration;
        this.records = List.copyOf(records);
        this.violations = List.copyOf(violations);
        this.dataset = dataset;
        this.writes = List.copyOf(writes);
        this.failure = failure;
    }

    /** Creates a COMPLETED summary. */
    public static RunSummary completed(
            String runId,
            Duration totalDuration,
            List<ExecutionRecord> records,
            Dataset dataset,
            List<WriteAcknowledgement> writes) {
        Objects.requireNonNull(dataset, "dataset must not be null for COMPLETED");
        return new RunSummary(
                runId, Outcome.COMPLETED, null, totalDuration, records, List.of(), dataset, writes, null);
    }

    /** Creates a FAILED summary. */
    public static RunSummary failed(
            String runId,
            RunState failedIn,
            Duration totalDuration,
            List<ExecutionRecord> records,
            List<SchemaViolation> violations,
            List<WriteAcknowledgement> writes,
            WrangleException failure) {
        Objects.requireNonNull(failure, "failure must not be null for FAILED");
        return new RunSummary(
                runId, Outcome.FAILED, failedIn, totalDuration, records, violations, null, writes, failure);
    }

    public String runId() {
        return runId;
    }

    public Outcome outcome() {
        return outcome;
    }

    /** The terminal state: {@link RunState#COMPLETED} or {@link RunState#FAILED}. */
    public RunState state() {
        return outcome == Outcome.COMPLETED ? RunState.COMPLETED : RunState.FAILED;
    }

    /** The state the run was in when it failed, or {@code null} for completed runs. */
    public RunState failedIn() {
        return failedIn;
    }

    public Duration totalDuration() {
        return totalDuration;
    }

    /** One record per executed step, in execution order. */
    public List<ExecutionRecord> records() {
        return records;
    }

    /** Schema violations; non-empty only when validation failed. */
    public List<SchemaViolation> violations() {
        return violations;
    }

    /** The final dataset; only present when the run completed. */
    public Dataset dataset() {
        return dataset;
    }

    /** Writes that succeeded, in execution order; kept on failure since writes are not rolled back. */
    public List<WriteAcknowledgement> writes() {
        return writes;
    }

    /** The terminal error, or {@code null} for completed runs. */
    public WrangleException failure() {
        return failure;
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    /** Records for one section, in execution order. */
    public List<ExecutionRecord> records(Section section) {
        return records.stream().filter(r -> r.section() == section).toList();
    }

    @Override
    public String toString() {
        return "RunSummary[" + outcome + ", steps=" + records.size() + ", duration=" + totalDuration.toMillis() + "ms"
                + (failure != null ? ", failure=" + failure.getClass().getSimpleName() : "") + "]";
    }
}
