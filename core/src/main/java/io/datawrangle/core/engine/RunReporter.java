package io.datawrangle.core.engine;

import io.datawrangle.core.error.WrangleException;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.RunState;
import io.datawrangle.core.model.RunSummary;
import io.datawrangle.core.model.SchemaViolation;
import io.datawrangle.core.model.WriteAcknowledgement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates execution records and write acknowledgements during a run and produces the
 * immutable {@link RunSummary} at the end. Records may arrive from worker threads.
 */
public final class RunReporter {

    private final String runId;
    private final long startNanos;
    private final List<ExecutionRecord> records = new ArrayList<>();
    private final List<WriteAcknowledgement> writes = new ArrayList<>();

    public RunReporter(String runId) {
        this.runId = runId;
        this.startNanos = System.nanoTime();
    }

    public String runId() {
        return runId;
    }

    public synchronized void record(ExecutionRecord record) {
        records.add(record);
    }

    public synchronized void acknowledge(WriteAcknowledgement write) {
        writes.add(write);
    }

    public synchronized List<ExecutionRecord> records() {
        return List.copyOf(records);
    }

    public synchronized RunSummary completed(Dataset dataset) {
        return RunSummary.completed(runId, elapsed(), records, dataset, writes);
    }

    public synchronized RunSummary failed(
            RunState failedIn, List<SchemaViolation> violations, WrangleException failure) {
        return RunSummary.failed(runId, failedIn, elapsed(), records, violations, writes, failure);
    }

    private Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
