package io.datawrangle.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.error.RunCancelledException;
import io.datawrangle.core.error.WrangleExecutionException;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.CompiledExpression;
import io.datawrangle.core.spi.SourceStep;
import io.datawrangle.core.spi.StepContext;
import java.time.Duration;

/**
 * Runs a resolved read step and applies the common read keys ({@code where}, {@code columns},
 * {@code not_columns}, {@code order_by}). Read failures are always fatal. Returns {@code null}
 * when the step's {@code if} condition is false.
 */
final class GuardedSource implements SourceStep {

    private final StepDescriptor descriptor;
    private final SourceStep step;
    private final CompiledExpression condition;
    private final CompiledExpression where;
    private final RunContext run;

    GuardedSource(
            StepDescriptor descriptor,
            SourceStep step,
            CompiledExpression condition,
            CompiledExpression where,
            RunContext run) {
        this.descriptor = descriptor;
        this.step = step;
        this.condition = condition;
        this.where = where;
        this.run = run;
    }

    StepDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Dataset read(StepContext parent) {
        String kind = descriptor.kind();
        run.checkCancelled(descriptor.position(), kind);
        run.stepStarted(descriptor.position(), kind);
        long start = System.nanoTime();
        StepContext context = run.stepContext(descriptor.position(), kind, ErrorPolicy.FAIL);
        try {
            if (condition != null && !condition.matches(Dataset.empty().summaryNode())) {
                finish(ExecutionRecord.Status.SKIPPED, start, null);
                return null;
            }
            Dataset dataset = refine(step.read(context));
            finish(ExecutionRecord.Status.SUCCEEDED, start, null);
            return dataset;
        } catch (RunCancelledException e) {
            throw e;
        } catch (WrangleExecutionException e) {
            finish(ExecutionRecord.Status.FAILED, start, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            WrangleExecutionException error = context.failure(kind + " failed: " + e.getMessage(), e, null);
            finish(ExecutionRecord.Status.FAILED, start, error.getMessage());
            throw error;
        }
    }

    private Dataset refine(Dataset dataset) {
        ObjectNode config = descriptor.config();
        Dataset result = dataset;
        if (where != null) {
            result = DatasetOps.where(result, where);
        }
        result = DatasetOps.project(result, config.get(CommonKeys.COLUMNS), config.get(CommonKeys.NOT_COLUMNS));
        if (config.hasNonNull(CommonKeys.ORDER_BY)) {
            result = DatasetOps.orderBy(result, config.get(CommonKeys.ORDER_BY).asText());
        }
        return result;
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
