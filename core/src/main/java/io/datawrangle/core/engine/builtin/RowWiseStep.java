package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.spi.StepContext;
import io.datawrangle.core.spi.WrangleStep;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for steps that compute output columns one row at a time. A row whose computation throws is
 * reported to {@link StepContext#rowFailed}; under {@code skip_row} it is dropped from the output,
 * otherwise the step fails.
 */
abstract class RowWiseStep implements WrangleStep {

    /**
     * Columns this step reads, resolved against the input before any row is processed; failures
     * here fail the whole step. Empty when the step reads whole rows.
     */
    protected List<String> inputColumns(Dataset input) {
        return List.of();
    }

    /** Names of the columns this step writes, given its input and resolved input columns. */
    protected abstract List<String> outputColumns(Dataset input, List<String> inputs);

    /** Computes the output values of one row, in {@link #outputColumns} order. */
    protected abstract List<JsonNode> compute(Dataset input, List<String> inputs, int row);

    @Override
    public Dataset apply(Dataset input, StepContext context) {
        List<String> inputs = inputColumns(input);
        List<String> outputs = outputColumns(input, inputs);
        List<Integer> kept = new ArrayList<>(input.rowCount());
        List<List<JsonNode>> values = new ArrayList<>(outputs.size());
        for (int c = 0; c < outputs.size(); c++) {
            values.add(new ArrayList<>(input.rowCount()));
        }
        for (int r = 0; r < input.rowCount(); r++) {
            List<JsonNode> computed;
            try {
                computed = compute(input, inputs, r);
            } catch (RuntimeException e) {
                context.rowFailed(r, e);
                continue;
            }
            kept.add(r);
            for (int c = 0; c < outputs.size(); c++) {
                values.get(c).add(computed.get(c));
            }
        }
        Dataset result = kept.size() == input.rowCount() ? input : input.selectRows(kept);
        for (int c = 0; c < outputs.size(); c++) {
            result = result.withColumn(outputs.get(c), values.get(c));
        }
        return result;
    }
}
