package io.datawrangle.core.engine;

import io.datawrangle.core.error.RunCancelledException;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.RunState;
import io.datawrangle.core.model.StepPosition;
import io.datawrangle.core.spi.Credentials;
import io.datawrangle.core.spi.RunListener;
import io.datawrangle.core.spi.StepContext;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run services shared by the executor and the guarded steps: records, listener dispatch,
 * cancellation and credentials.
 */
final class RunContext {

    private static final Logger LOG = LoggerFactory.getLogger(RunContext.class);

    private final String runId;
    private final RunReporter reporter;
    private final List<RunListener> listeners;
    private final CancellationToken cancellationToken;
    private final Map<String, Credentials> credentials;

    RunContext(String runId, RunReporter reporter, RunOptions options) {
        this.runId = runId;
        this.reporter = reporter;
        this.listeners = options.listeners();
        this.cancellationToken = options.cancellationToken();
        this.credentials = options.credentials();
    }

    String runId() {
        return runId;
    }

    RunReporter reporter() {
        return reporter;
    }

    StepContext stepContext(StepPosition position, String kind, ErrorPolicy policy) {
        return new StepContext(runId, position, kind, policy, credentials::get);
    }

    void checkCancelled(StepPosition position, String kind) {
        if (cancellationToken.isCancelled()) {
            throw new RunCancelledException("Run " + runId + " cancelled before " + position, position, kind);
        }
    }

    void stateChanged(RunState from, RunState to) {
        LOG.info("Run state changed: run_id={}, from={}, to={}", runId, from, to);
        for (RunListener listener : listeners) {
            try {
                listener.onStateChanged(new RunListener.StateChangedEvent(runId, from, to));
            } catch (Exception e) {
                LOG.warn("RunListener.onStateChanged failed", e);
            }
        }
    }

    void stepStarted(StepPosition position, String kind) {
        LOG.debug("Step started: position={}, kind={}", position, kind);
        for (RunListener listener : listeners) {
            try {
                listener.onStepStarted(new RunListener.StepStartedEvent(runId, position, kind));
            } catch (Exception e) {
                LOG.warn("RunListener.onStepStarted failed", e);
            }
        }
    }

    void stepFinished(ExecutionRecord record) {
        reporter.record(record);
        if (record.status() == ExecutionRecord.Status.FAILED) {
            LOG.warn(
                    "Step failed: position={}, kind={}, duration_ms={}, error={}",
                    record.position(),
                    record.kind(),
                    record.duration().toMillis(),
                    record.error());
        } else {
            LOG.info(
                    "Step finished: position={}, kind={}, status={}, duration_ms={}, skipped_rows={}",
                    record.position(),
                    record.kind(),
                    record.status(),
                    record.duration().toMillis(),
                    record.skippedRows());
        }
        for (RunListener listener : listeners) {
            try {
                listener.onStepFinished(new RunListener.StepFinishedEvent(runId, record));
            } catch (Exception e) {
                LOG.warn("RunListener.onStepFinished failed", e);
            }
        }
    }
}
