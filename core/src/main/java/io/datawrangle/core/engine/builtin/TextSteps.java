package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.model.ColumnSelector;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.Granularity;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;

/**
 * Row-wise text kinds: {@code uppercase}, {@code lowercase}, {@code trim}, {@code prefix},
 * {@code suffix}. Each rewrites the {@code column} values in place, or into {@code output} when
 * given. Nulls stay null; objects and arrays fail the row.
 */
final class TextSteps {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TextSteps() {}

    static void register(StepRegistry.Builder registry) {
        registry.register(kind("uppercase", "Converts text to upper case", false, (s, v) -> s.toUpperCase(Locale.ROOT)));
        registry.register(kind("lowercase", "Converts text to lower case", false, (s, v) -> s.toLowerCase(Locale.ROOT)));
        registry.register(kind("trim", "Removes leading and trailing whitespace", false, (s, v) -> s.strip()));
        registry.register(kind("prefix", "Adds text before each value", true, (s, v) -> v + s));
        registry.register(kind("suffix", "Adds text after each value", true, (s, v) -> s + v));
    }

    private static StepKind kind(
            String name, String description, boolean needsValue, BiFunction<String, String, String> operation) {
        Schemas.ObjectSchema schema = Schemas.object()
                .property("column", Schemas.columns())
                .property("output", Schemas.columns())
                .required("column");
        if (needsValue) {
            schema.property("value", Schemas.string()).required("value");
        }
        return StepKind.builder(name, Section.WRANGLE)
                .description(description)
                .configuration(schema)
                .granularity(Granularity.ROW)
                .factory((descriptor, resolver) -> new TextStep(descriptor, operation))
                .build();
    }

    private static final class TextStep extends RowWiseStep {

        private final List<String> selectors;
        private final List<String> declared;
        private final String value;
        private final BiFunction<String, String, String> operation;

        TextStep(StepDescriptor descriptor, BiFunction<String, String, String> operation) {
            this.selectors = descriptor.inputColumns();
            this.declared = descriptor.outputColumns();
            if (selectors.stream().noneMatch(ColumnSelector::isPattern)) {
                checkOutputs(selectors.size());
            }
            this.value = descriptor.config().path("value").asText("");
            this.operation = operation;
        }

        private void checkOutputs(int inputs) {
            if (!declared.isEmpty() && declared.size() != inputs) {
                throw new IllegalArgumentException("'output' must name as many columns as 'column' (" + inputs
                        + "), got " + declared.size());
            }
        }

        @Override
        protected List<String> inputColumns(Dataset input) {
            return input.matchColumns(selectors);
        }

        @Override
        protected List<String> outputColumns(Dataset input, List<String> inputs) {
            checkOutputs(inputs.size());
            return declared.isEmpty() ? inputs : declared;
        }

        @Override
        protected List<JsonNode> compute(Dataset input, List<String> inputs, int row) {
            List<JsonNode> result = new ArrayList<>(inputs.size());
            for (String column : inputs) {
                JsonNode cell = input.value(row, column);
                if (cell.isNull()) {
                    result.add(cell);
                } else if (cell.isContainerNode()) {
                    throw new IllegalArgumentException(
                            "Column '" + column + "' holds " + cell.getNodeType() + ", expected text");
                } else {
                    result.add(NODES.textNode(operation.apply(cell.asText(), value)));
                }
            }
            return result;
        }
    }
}
