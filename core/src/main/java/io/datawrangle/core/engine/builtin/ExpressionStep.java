package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.Granularity;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.CompiledExpression;
import java.util.List;

/**
 * {@code jslt}: evaluates an expression against each row (restricted to {@code input} columns
 * when given) and stores the result in {@code output}.
 */
final class ExpressionStep extends RowWiseStep {

    static final String KIND = "jslt";

    private final List<String> selectors;
    private final String output;
    private final CompiledExpression expression;

    private ExpressionStep(StepDescriptor descriptor, CompiledExpression expression) {
        this.selectors = descriptor.inputColumns();
        this.output = descriptor.config().get("output").asText();
        this.expression = expression;
    }

    static StepKind kind() {
        return StepKind.builder(KIND, Section.WRANGLE)
                .description("Computes a column from a JSLT expression over each row")
                .configuration(Schemas.object()
                        .property("expression", Schemas.string())
                        .property("input", Schemas.columns())
                        .property("output", Schemas.string())
                        .required("expression", "output"))
                .granularity(Granularity.ROW)
                .expressions("expression")
                .factory((d, r) -> new ExpressionStep(d, r.compile(d.config().get("expression").asText())))
                .build();
    }

    @Override
    protected List<String> inputColumns(Dataset input) {
        return input.matchColumns(selectors);
    }

    @Override
    protected List<String> outputColumns(Dataset input, List<String> inputs) {
        return List.of(output);
    }

    @Override
    protected List<JsonNode> compute(Dataset input, List<String> inputs, int row) {
        ObjectNode object = input.rowAsObject(row);
        if (!selectors.isEmpty()) {
            object.retain(inputs);
        }
        return List.of(expression.evaluate(object));
    }
}
