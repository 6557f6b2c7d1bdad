package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.Granularity;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.CompiledExpression;
import io.datawrangle.core.spi.StepContext;
import io.datawrangle.core.spi.StepResolver;
import io.datawrangle.core.spi.WrangleStep;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conditional groups. {@code group} runs its nested steps over the whole dataset when its
 * {@code if} holds; {@code group.rows} runs them over the rows matching {@code where} and splices
 * the results back in original row order.
 */
final class GroupSteps {

    static final String ROW_ID = "_datawrangle_row";
    static final String STEPS = "steps";

    private GroupSteps() {}

    static void register(StepRegistry.Builder registry) {
        registry.register(StepKind.builder("group", Section.WRANGLE)
                .description("Runs nested steps over the whole dataset")
                .configuration(Schemas.object().property(STEPS, Schemas.steps()).required(STEPS))
                .factory((d, r) -> new Sequence(nested(d, r)))
                .build());
        registry.register(StepKind.builder("group.rows", Section.WRANGLE)
                .description("Runs nested steps over the rows matching an expression")
                .configuration(Schemas.object()
                        .property("where", Schemas.string())
                        .property(STEPS, Schemas.steps())
                        .required("where", STEPS))
                .granularity(Granularity.ROW)
                .expressions("where")
                .factory((d, r) -> new RowGroup(r.compile(d.config().get("where").asText()), nested(d, r)))
                .build());
    }

    private static List<WrangleStep> nested(StepDescriptor descriptor, StepResolver resolver) {
        List<WrangleStep> steps = new ArrayList<>();
        for (StepDescriptor child : descriptor.children(STEPS)) {
            steps.add(resolver.resolveWrangle(child));
        }
        return steps;
    }

    private static Dataset runAll(List<WrangleStep> steps, Dataset input, StepContext context) {
        Dataset current = input;
        for (WrangleStep step : steps) {
            current = step.apply(current, context);
        }
        return current;
    }

    private static final class Sequence implements WrangleStep {

        private final List<WrangleStep> steps;

        Sequence(List<WrangleStep> steps) {
            this.steps = steps;
        }

        @Override
        public Dataset apply(Dataset input, StepContext context) {
            return runAll(steps, input, context);
        }
    }

    private static final class RowGroup implements WrangleStep {

        private final CompiledExpression where;
        private final List<WrangleStep> steps;

        RowGroup(CompiledExpression where, List<WrangleStep> steps) {
            this.where = where;
            this.steps = steps;
        }

        @Override
        public Dataset apply(Dataset input, StepContext context) {
            if (input.hasColumn(ROW_ID)) {
                throw new IllegalArgumentException("Column '" + ROW_ID + "' is reserved for row groups");
            }
            List<Integer> matching = new ArrayList<>();
            Set<Integer> failed = new LinkedHashSet<>();
            for (int r = 0; r < input.rowCount(); r++) {
                try {
                    if (where.matches(input.rowAsObject(r))) {
                        matching.add(r);
                    }
                } catch (RuntimeException e) {
                    context.rowFailed(r, e);
                    failed.add(r);
                }
            }
            if (matching.isEmpty() && failed.isEmpty()) {
                return input;
            }
            List<JsonNode> ids = new ArrayList<>(matching.size());
            matching.forEach(r -> ids.add(IntNode.valueOf(r)));
            Dataset subset = input.selectRows(matching).withColumn(ROW_ID, ids);
            Dataset processed = runAll(steps, subset, context);
            if (!processed.hasColumn(ROW_ID)) {
                throw new IllegalStateException("Nested steps removed column '" + ROW_ID + "'");
            }
            return splice(input, matching, failed, processed);
        }

        private static Dataset splice(Dataset input, List<Integer> matching, Set<Integer> failed, Dataset processed) {
            List<String> columns = new ArrayList<>(input.columns());
            for (String column : processed.columns()) {
                if (!column.equals(ROW_ID) && !input.hasColumn(column)) {
                    columns.add(column);
                }
            }
            Map<Integer, Integer> processedRow = new HashMap<>();
            for (int p = 0; p < processed.rowCount(); p++) {
                processedRow.put(processed.value(p, ROW_ID).asInt(), p);
            }
            Set<Integer> matched = new LinkedHashSet<>(matching);
            Dataset.Builder builder = Dataset.builder(columns);
            for (int r = 0; r < input.rowCount(); r++) {
                if (failed.contains(r)) {
                    continue;
                }
                Integer p = processedRow.get(r);
                if (matched.contains(r) && p == null) {
                    // dropped by a nested step
                    continue;
                }
                List<JsonNode> row = new ArrayList<>(columns.size());
                for (String column : columns) {
                    if (p != null && processed.hasColumn(column)) {
                        row.add(processed.value(p, column));
                    } else if (input.hasColumn(column)) {
                        row.add(input.value(r, column));
                    } else {
                        row.add(NullNode.instance);
                    }
                }
                builder.addRow(row);
            }
            return builder.build();
        }
    }
}
