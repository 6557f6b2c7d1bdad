package io.datawrangle.core.spi;

import io.datawrangle.core.error.StepExecutionError;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.StepPosition;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Per-execution context handed to a step: where it is declared, which error policy applies, how
 * to find credentials, and an accumulator for rows dropped under {@code on_error: skip_row}.
 *
 * <p>Row bookkeeping is thread-safe so that steps dispatching rows concurrently can report from
 * worker threads.
 */
public final class StepContext {

    private final String runId;
    private final StepPosition position;
    private final String kind;
    private final ErrorPolicy errorPolicy;
    private final Function<String, Credentials> credentialLookup;
    private final AtomicInteger skippedRows = new AtomicInteger();
    private final AtomicReference<String> firstRowError = new AtomicReference<>();

    public StepContext(
            String runId,
            StepPosition position,
            String kind,
            ErrorPolicy errorPolicy,
            Function<String, Credentials> credentialLookup) {
        this.runId = runId;
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.kind = kind;
        this.errorPolicy = Objects.requireNonNull(errorPolicy, "errorPolicy must not be null");
        this.credentialLookup = Objects.requireNonNull(credentialLookup, "credentialLookup must not be null");
    }

    /** Context for a nested step; shares the run id and credential lookup. */
    public StepContext child(StepPosition childPosition, String childKind, ErrorPolicy childPolicy) {
        return new StepContext(runId, childPosition, childKind, childPolicy, credentialLookup);
    }

    public String runId() {
        return runId;
    }

    public StepPosition position() {
        return position;
    }

    public String kind() {
        return kind;
    }

    public ErrorPolicy errorPolicy() {
        return errorPolicy;
    }

    /**
     * Resolves credentials by bundle name; when {@code name} is null the bundle named after the
     * connector is used. Unknown names yield {@link Credentials#none()}.
     */
    public Credentials credentials(String name, String connectorId) {
        Credentials credentials = credentialLookup.apply(name != null ? name : connectorId);
        return credentials != null ? credentials : Credentials.none();
    }

    /**
     * Reports that a row failed. Under {@code skip_row} the failure is counted and the caller must
     * drop the row; under any other policy a {@link StepExecutionError} naming the row is thrown.
     */
    public void rowFailed(int row, RuntimeException error) {
        if (errorPolicy != ErrorPolicy.SKIP_ROW) {
            throw failure("Step failed on row " + row + ": " + error.getMessage(), error, row);
        }
        skippedRows.incrementAndGet();
        firstRowError.compareAndSet(null, "row " + row + ": " + error.getMessage());
    }

    /** Builds a {@link StepExecutionError} attributed to this step. */
    public StepExecutionError failure(String message, Throwable cause, Integer row) {
        return new StepExecutionError(message, cause, position, kind, row);
    }

    /** Number of rows dropped so far under {@code skip_row}. */
    public int skippedRows() {
        return skippedRows.get();
    }

    /** Description of the first dropped row's error, or {@code null} if none was dropped. */
    public String firstRowError() {
        return firstRowError.get();
    }
}
