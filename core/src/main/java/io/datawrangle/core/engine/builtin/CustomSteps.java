package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.function.CustomFunctionLoader;
import io.datawrangle.core.function.CustomFunctionReference;
import io.datawrangle.core.function.FunctionType;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.Granularity;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.ColumnFunction;
import io.datawrangle.core.spi.DatasetFunction;
import io.datawrangle.core.spi.RowFunction;
import io.datawrangle.core.spi.StepResolver;
import io.datawrangle.core.spi.WrangleStep;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Steps backed by user code. The {@code custom} kind names its function in the recipe; functions
 * declared in the run options are addressed as {@code custom.<name>}. Either way the code is loaded
 * through the run's {@link CustomFunctionLoader} while steps are resolved, before any connector is
 * opened.
 *
 * <p>Row functions receive the row's {@code input} columns (all columns when absent) with the
 * {@code parameters} fields added; a row column wins over a parameter of the same name. The result
 * goes to {@code output}, which defaults to the input column; several outputs take the fields of
 * an object result.
 */
public final class CustomSteps {

    public static final String KIND = "custom";

    private CustomSteps() {}

    static void register(StepRegistry.Builder registry) {
        registry.register(StepKind.builder(KIND, Section.WRANGLE)
                .description("Runs a user-supplied Java function")
                .configuration(Schemas.object()
                        .property("file", Schemas.string())
                        .property("function", Schemas.string())
                        .property("type", Schemas.enumOf("row", "column", "dataset"))
                        .property("input", Schemas.columns())
                        .property("output", Schemas.columns())
                        .property("parameters", Schemas.map())
                        .required("function"))
                .granularity(Granularity.ROW)
                .granularityFrom(CustomSteps::granularity)
                .factory((d, r) -> resolve(d, CustomFunctionReference.fromConfig(d.config()), r))
                .build());
    }

    // Only row functions can drop single rows; column and dataset functions fail as a whole.
    private static Granularity granularity(JsonNode config) {
        FunctionType type = FunctionType.fromKey(config.path("type").asText(FunctionType.ROW.key()));
        return type == null || type == FunctionType.ROW ? Granularity.ROW : Granularity.DATASET;
    }

    /** Builds the {@code custom.<name>} kind for a function declared in the run options. */
    public static StepKind declared(String name, CustomFunctionReference reference) {
        return StepKind.builder(StepRegistry.CUSTOM_PREFIX + name, Section.WRANGLE)
                .description("Runs " + reference.function())
                .configuration(Schemas.object()
                        .property("input", Schemas.columns())
                        .property("output", Schemas.columns())
                        .property("parameters", Schemas.map()))
                .granularity(reference.type() == FunctionType.ROW ? Granularity.ROW : Granularity.DATASET)
                .factory((d, r) -> resolve(d, reference, r))
                .build();
    }

    private static WrangleStep resolve(
            StepDescriptor descriptor, CustomFunctionReference reference, StepResolver resolver) {
        CustomFunctionLoader loader = resolver.customFunctions();
        switch (reference.type()) {
            case ROW:
                return new RowStep(descriptor, loader.rowFunction(reference));
            case COLUMN:
                return columnStep(descriptor, loader.columnFunction(reference));
            case DATASET:
                DatasetFunction function = loader.datasetFunction(reference);
                return (input, context) -> {
                    Dataset output = function.apply(input);
                    if (output == null) {
                        throw new IllegalStateException(reference.function() + " returned no dataset");
                    }
                    return output;
                };
            default:
                throw new IllegalStateException("Unhandled function type: " + reference.type());
        }
    }

    private static WrangleStep columnStep(StepDescriptor descriptor, ColumnFunction function) {
        List<String> inputs = descriptor.inputColumns();
        if (inputs.size() != 1) {
            throw new IllegalArgumentException("A column function needs exactly one 'input' column");
        }
        List<String> outputs = descriptor.outputColumns();
        String output = outputs.isEmpty() ? inputs.get(0) : outputs.get(0);
        return (input, context) -> {
            List<JsonNode> values = function.apply(input.column(inputs.get(0)));
            if (values == null || values.size() != input.rowCount()) {
                throw new IllegalStateException("Column function returned "
                        + (values == null ? "nothing" : values.size() + " values") + " for "
                        + input.rowCount() + " rows");
            }
            return input.withColumn(output, values);
        };
    }

    private static final class RowStep extends RowWiseStep {

        private final RowFunction function;
        private final List<String> selectors;
        private final List<String> declared;
        private final ObjectNode parameters;

        RowStep(StepDescriptor descriptor, RowFunction function) {
            this.function = function;
            this.selectors = descriptor.inputColumns();
            this.declared = descriptor.outputColumns();
            if (declared.isEmpty() && selectors.isEmpty()) {
                throw new IllegalArgumentException("A row function needs an 'output' column");
            }
            JsonNode params = descriptor.config().get("parameters");
            this.parameters = params != null && params.isObject() ? (ObjectNode) params : null;
        }

        @Override
        protected List<String> inputColumns(Dataset input) {
            return input.matchColumns(selectors);
        }

        @Override
        protected List<String> outputColumns(Dataset input, List<String> inputs) {
            List<String> outputs = declared.isEmpty() ? inputs : declared;
            if (outputs.isEmpty()) {
                throw new IllegalArgumentException("No input column matched " + selectors + " and no 'output' is set");
            }
            return outputs;
        }

        @Override
        protected List<JsonNode> compute(Dataset input, List<String> inputs, int row) {
            ObjectNode payload = input.rowAsObject(row);
            if (!selectors.isEmpty()) {
                payload.retain(inputs);
            }
            if (parameters != null) {
                Iterator<Map.Entry<String, JsonNode>> fields = parameters.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (!payload.has(field.getKey())) {
                        payload.set(field.getKey(), field.getValue().deepCopy());
                    }
                }
            }
            JsonNode result = function.apply(payload);
            if (result == null) {
                result = NullNode.instance;
            }
            List<String> outputs = outputColumns(input, inputs);
            if (outputs.size() == 1) {
                return List.of(result);
            }
            if (!result.isObject()) {
                throw new IllegalStateException("Expected an object with fields " + outputs + ", got "
                        + result.getNodeType());
            }
            List<JsonNode> values = new ArrayList<>(outputs.size());
            for (String output : outputs) {
                JsonNode value = result.get(output);
                values.add(value != null ? value : NullNode.instance);
            }
            return values;
        }
    }
}
