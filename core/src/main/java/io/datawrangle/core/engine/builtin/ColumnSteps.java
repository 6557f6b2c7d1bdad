package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.Granularity;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.CompiledExpression;
import io.datawrangle.core.spi.WrangleStep;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Structural kinds: {@code rename}, {@code drop}, {@code copy}, {@code select}, {@code filter}, {@code split.text}. */
final class ColumnSteps {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ColumnSteps() {}

    static void register(StepRegistry.Builder registry) {
        registry.register(StepKind.builder("rename", Section.WRANGLE)
                .description("Renames columns")
                .configuration(Schemas.object()
                        .property("input", Schemas.columns())
                        .property("output", Schemas.columns())
                        .required("input", "output"))
                .factory((d, r) -> rename(d))
                .build());
        registry.register(StepKind.builder("drop", Section.WRANGLE)
                .description("Removes columns")
                .configuration(Schemas.object().property("columns", Schemas.columns()).required("columns"))
                .factory((d, r) -> {
                    List<String> columns = StepDescriptor.names(d.config().get("columns"));
                    return (WrangleStep) (input, context) -> input.withoutColumns(input.matchColumns(columns));
                })
                .build());
        registry.register(StepKind.builder("select", Section.WRANGLE)
                .description("Keeps only the given columns, in the given order")
                .configuration(Schemas.object().property("columns", Schemas.columns()).required("columns"))
                .factory((d, r) -> {
                    List<String> columns = StepDescriptor.names(d.config().get("columns"));
                    return (WrangleStep) (input, context) -> input.select(input.matchColumns(columns));
                })
                .build());
        registry.register(StepKind.builder("copy", Section.WRANGLE)
                .description("Copies columns to new names")
                .configuration(Schemas.object()
                        .property("input", Schemas.columns())
                        .property("output", Schemas.columns())
                        .required("input", "output"))
                .factory((d, r) -> copy(d))
                .build());
        registry.register(StepKind.builder("filter", Section.WRANGLE)
                .description("Keeps the rows matching an expression")
                .configuration(Schemas.object().property("where", Schemas.string()).required("where"))
                .granularity(Granularity.ROW)
                .expressions("where")
                .factory((d, r) -> filter(r.compile(d.config().get("where").asText())))
                .build());
        registry.register(StepKind.builder("split.text", Section.WRANGLE)
                .description("Splits text on a separator into a list or several columns")
                .configuration(Schemas.object()
                        .property("input", Schemas.string())
                        .property("output", Schemas.columns())
                        .property("char", Schemas.string())
                        .required("input"))
                .granularity(Granularity.ROW)
                .factory((d, r) -> new SplitText(d))
                .build());
    }

    private static WrangleStep rename(StepDescriptor descriptor) {
        List<String> from = descriptor.inputColumns();
        List<String> to = descriptor.outputColumns();
        if (from.size() != to.size()) {
            throw new IllegalArgumentException("'input' and 'output' must name the same number of columns");
        }
        Map<String, String> renames = new LinkedHashMap<>();
        for (int i = 0; i < from.size(); i++) {
            renames.put(from.get(i), to.get(i));
        }
        return (input, context) -> input.renameColumns(renames);
    }

    private static WrangleStep copy(StepDescriptor descriptor) {
        List<String> from = descriptor.inputColumns();
        List<String> to = descriptor.outputColumns();
        if (from.size() != to.size()) {
            throw new IllegalArgumentException("'input' and 'output' must name the same number of columns");
        }
        return (input, context) -> {
            Dataset result = input;
            for (int i = 0; i < from.size(); i++) {
                result = result.withColumn(to.get(i), input.column(from.get(i)));
            }
            return result;
        };
    }

    private static WrangleStep filter(CompiledExpression where) {
        return (input, context) -> {
            List<Integer> kept = new ArrayList<>();
            for (int r = 0; r < input.rowCount(); r++) {
                try {
                    if (where.matches(input.rowAsObject(r))) {
                        kept.add(r);
                    }
                } catch (RuntimeException e) {
                    context.rowFailed(r, e);
                }
            }
            return kept.size() == input.rowCount() ? input : input.selectRows(kept);
        };
    }

    /** Splits one text column; with one output the parts become a JSON array, otherwise one column each. */
    private static final class SplitText extends RowWiseStep {

        private final String input;
        private final List<String> outputs;
        private final Pattern separator;

        SplitText(StepDescriptor descriptor) {
            this.input = descriptor.config().get("input").asText();
            List<String> declared = descriptor.outputColumns();
            this.outputs = declared.isEmpty() ? List.of(input) : declared;
            this.separator = Pattern.compile(Pattern.quote(descriptor.config().path("char").asText(",")));
        }

        @Override
        protected List<String> inputColumns(Dataset dataset) {
            dataset.columnIndex(input);
            return List.of(input);
        }

        @Override
        protected List<String> outputColumns(Dataset dataset, List<String> inputs) {
            return outputs;
        }

        @Override
        protected List<JsonNode> compute(Dataset dataset, List<String> inputs, int row) {
            JsonNode cell = dataset.value(row, input);
            if (cell.isContainerNode()) {
                throw new IllegalArgumentException(
                        "Column '" + input + "' holds " + cell.getNodeType() + ", expected text");
            }
            String[] parts = cell.isNull() ? new String[0] : separator.split(cell.asText(), -1);
            if (outputs.size() == 1) {
                ArrayNode list = NODES.arrayNode();
                for (String part : parts) {
                    list.add(part);
                }
                return List.of(cell.isNull() ? NullNode.instance : list);
            }
            List<JsonNode> values = new ArrayList<>(outputs.size());
            for (int i = 0; i < outputs.size(); i++) {
                values.add(i < parts.length ? NODES.textNode(parts[i]) : NullNode.instance);
            }
            return values;
        }
    }
}
