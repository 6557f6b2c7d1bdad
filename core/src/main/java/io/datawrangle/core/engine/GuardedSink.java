package io.datawrangle.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.error.RunCancelledException;
import io.datawrangle.core.error.WrangleExecutionException;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.model.WriteAcknowledgement;
import io.datawrangle.core.spi.CompiledExpression;
import io.datawrangle.core.spi.SinkStep;
import io.datawrangle.core.spi.StepContext;
import java.time.Duration;

/**
 * Runs a resolved write step on a projection of the final dataset. A failing write fails the run
 * unless the step sets {@code best_effort: true}, in which case it is recorded and {@code null}
 * is returned.
 */
final class GuardedSink implements SinkStep {

    private final StepDescriptor descriptor;
    private final SinkStep step;
    private final CompiledExpression condition;
    private final CompiledExpression where;
    private final RunContext run;

    GuardedSink(
            StepDescriptor descriptor,
            SinkStep step,
            CompiledExpression condition,
            CompiledExpression where,
            RunContext run) {
        this.descriptor = descriptor;
        this.step = step;
        this.condition = condition;
        this.where = where;
        this.run = run;
    }

    @Override
    public WriteAcknowledgement write(Dataset dataset, StepContext parent) {
        String kind = descriptor.kind();
        run.checkCancelled(descriptor.position(), kind);
        run.stepStarted(descriptor.position(), kind);
        long start = System.nanoTime();
        StepContext context = run.stepContext(descriptor.position(), kind, ErrorPolicy.FAIL);
        try {
            if (condition != null && !condition.matches(dataset.summaryNode())) {
                finish(ExecutionRecord.Status.SKIPPED, start, null);
                return null;
            }
            WriteAcknowledgement ack = step.write(refine(dataset), context);
            run.reporter().acknowledge(ack);
            finish(ExecutionRecord.Status.SUCCEEDED, start, null);
            return ack;
        } catch (RunCancelledException e) {
            throw e;
        } catch (WrangleExecutionException e) {
            return failed(e, start);
        } catch (RuntimeException e) {
            return failed(context.failure(kind + " failed: " + e.getMessage(), e, null), start);
        }
    }

    private WriteAcknowledgement failed(WrangleExecutionException error, long start) {
        finish(ExecutionRecord.Status.FAILED, start, error.getMessage());
        if (descriptor.config().path(CommonKeys.BEST_EFFORT).asBoolean(false)) {
            return null;
        }
        throw error;
    }

    private Dataset refine(Dataset dataset) {
        ObjectNode config = descriptor.config();
        Dataset result = dataset;
        if (where != null) {
            result = DatasetOps.where(result, where);
        }
        return DatasetOps.project(result, config.get(CommonKeys.COLUMNS), config.get(CommonKeys.NOT_COLUMNS));
    }

    private void finish(ExecutionRecord.Status status, long start, String error) {
        run.stepFinished(new ExecutionRecord(
                descriptor.position(),
                descriptor.kind(),
                status,
                Duration.ofNanos(System.nanoTime() - start),
                error,
                0));
    }
}
