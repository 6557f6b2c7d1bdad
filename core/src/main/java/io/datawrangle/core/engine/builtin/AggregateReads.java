package io.datawrangle.core.engine.builtin;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.engine.DatasetOps;
import io.datawrangle.core.engine.Schemas;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.spi.SourceStep;
import io.datawrangle.core.spi.StepContext;
import io.datawrangle.core.spi.StepResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Read kinds that combine nested {@code sources}: {@code union} appends rows (union of columns),
 * {@code concatenate} places datasets side by side, {@code join} joins them left to right on key
 * columns. Sources whose {@code if} is false are left out.
 */
final class AggregateReads {

    static final String SOURCES = "sources";

    private AggregateReads() {}

    static void register(StepRegistry.Builder registry) {
        registry.register(StepKind.builder("union", Section.READ)
                .description("Appends the rows of several sources; columns are the union")
                .configuration(Schemas.object().property(SOURCES, Schemas.steps()).required(SOURCES))
                .factory((d, r) -> combining(d, r, DatasetOps::union))
                .build());
        registry.register(StepKind.builder("concatenate", Section.READ)
                .description("Places several sources side by side")
                .configuration(Schemas.object().property(SOURCES, Schemas.steps()).required(SOURCES))
                .factory((d, r) -> combining(d, r, DatasetOps::concatenate))
                .build());
        registry.register(StepKind.builder("join", Section.READ)
                .description("Joins several sources on key columns")
                .configuration(Schemas.object()
                        .property(SOURCES, Schemas.steps())
                        .property("how", Schemas.enumOf("inner", "left", "right", "outer"))
                        .property("on", Schemas.columns())
                        .property("left_on", Schemas.columns())
                        .property("right_on", Schemas.columns())
                        .required(SOURCES, "how"))
                .factory((d, r) -> combining(d, r, datasets -> join(d.config(), datasets)))
                .build());
    }

    private static SourceStep combining(
            StepDescriptor descriptor, StepResolver resolver, Function<List<Dataset>, Dataset> combine) {
        List<SourceStep> sources = new ArrayList<>();
        for (StepDescriptor child : descriptor.children(SOURCES)) {
            sources.add(resolver.resolveSource(child));
        }
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("'" + SOURCES + "' must list at least one read step");
        }
        return (StepContext context) -> {
            List<Dataset> datasets = new ArrayList<>(sources.size());
            for (SourceStep source : sources) {
                Dataset dataset = source.read(context);
                if (dataset != null) {
                    datasets.add(dataset);
                }
            }
            return combine.apply(datasets);
        };
    }

    private static Dataset join(ObjectNode config, List<Dataset> datasets) {
        if (datasets.isEmpty()) {
            return Dataset.empty();
        }
        List<String> on = StepDescriptor.names(config.get("on"));
        List<String> leftOn = config.has("left_on") ? StepDescriptor.names(config.get("left_on")) : on;
        List<String> rightOn = config.has("right_on") ? StepDescriptor.names(config.get("right_on")) : on;
        String how = config.path("how").asText();
        Dataset result = datasets.get(0);
        for (int i = 1; i < datasets.size(); i++) {
            result = DatasetOps.join(result, datasets.get(i), how, leftOn, rightOn);
        }
        return result;
    }
}
