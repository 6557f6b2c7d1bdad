package io.datawrangle.core.engine;

import io.datawrangle.core.error.ExpressionException;
import io.datawrangle.core.error.RunCancelledException;
import io.datawrangle.core.error.StepExecutionError;
import io.datawrangle.core.error.WrangleExecutionException;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.CompiledExpression;
import io.datawrangle.core.spi.StepContext;
import io.datawrangle.core.spi.WrangleStep;
import java.time.Duration;

/**
 * Runs a resolved wrangle under the executor's rules: cancellation check, {@code if} condition,
 * error policy, timing and one execution record. Nested steps get the same treatment because the
 * resolver hands these out for them too.
 */
final class GuardedWrangle implements WrangleStep {

    private final StepDescriptor descriptor;
    private final WrangleStep step;
    private final CompiledExpression condition;
    private final RunContext run;

    GuardedWrangle(StepDescriptor descriptor, WrangleStep step, CompiledExpression condition, RunContext run) {
        this.descriptor = descriptor;
        this.step = step;
        this.condition = condition;
        this.run = run;
    }

    @Override
    public Dataset apply(Dataset input, StepContext parent) {
        String kind = descriptor.kind();
        ErrorPolicy policy = descriptor.errorPolicy();
        run.checkCancelled(descriptor.position(), kind);
        run.stepStarted(descriptor.position(), kind);
        long start = System.nanoTime();
        StepContext context = run.stepContext(descriptor.position(), kind, policy);
        try {
            if (condition != null && !condition.matches(input.summaryNode())) {
                finish(ExecutionRecord.Status.SKIPPED, start, null, 0);
                return input;
            }
            Dataset output = step.apply(input, context);
            if (output == null) {
                throw context.failure("Step returned no dataset", null, null);
            }
            finish(ExecutionRecord.Status.SUCCEEDED, start, context.firstRowError(), context.skippedRows());
            return output;
        } catch (RunCancelledException e) {
            throw e;
        } catch (WrangleExecutionException e) {
            return handle(e, input, policy, start, context);
        } catch (ExpressionException e) {
            return handle(
                    context.failure("Condition failed: " + e.getMessage(), e, null), input, policy, start, context);
        } catch (RuntimeException e) {
            StepExecutionError error = context.failure(kind + " failed: " + e.getMessage(), e, null);
            return handle(error, input, policy, start, context);
        }
    }

    private Dataset handle(
            WrangleExecutionException error, Dataset input, ErrorPolicy policy, long start, StepContext context) {
        if (policy == ErrorPolicy.SKIP_STEP) {
            finish(ExecutionRecord.Status.SKIPPED, start, error.getMessage(), context.skippedRows());
            return input;
        }
        finish(ExecutionRecord.Status.FAILED, start, error.getMessage(), context.skippedRows());
        throw error;
    }

    private void finish(ExecutionRecord.Status status, long start, String error, int skippedRows) {
        run.stepFinished(new ExecutionRecord(
                descriptor.position(),
                descriptor.kind(),
                status,
                Duration.ofNanos(System.nanoTime() - start),
                error,
                skippedRows));
    }
}
