package io.datawrangle.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.Granularity;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.spi.StepFactory;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * A registered step kind: its name within a section, the JSON Schema of its configuration (common
 * keys included), the factory that resolves it, and the error policies it supports.
 *
 * @param name          kind name as written in recipes, e.g. {@code "convert.uppercase"}
 * @param section       the section the kind may appear in
 * @param description   one-line description, rendered into the generated schema
 * @param schema        full configuration schema
 * @param granularity   whether the kind works on whole datasets or row by row
 * @param granularityOf granularity of one configured step, for kinds where it depends on the
 *                      configuration; {@code null} when {@code granularity} always applies
 * @param errorPolicies the {@code on_error} values the kind supports
 * @param expressionKeys configuration keys whose values are expressions, compiled during validation
 * @param shorthand     key that a scalar configuration stands for, e.g. {@code file: data.csv}
 *                      meaning {@code file: {path: data.csv}}; {@code null} when not supported
 * @param factory       resolves a descriptor into an executable step
 */
public record StepKind(
        String name,
        Section section,
        String description,
        ObjectNode schema,
        Granularity granularity,
        Function<JsonNode, Granularity> granularityOf,
        Set<ErrorPolicy> errorPolicies,
        Set<String> expressionKeys,
        String shorthand,
        StepFactory factory) {

    public StepKind {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        errorPolicies = Set.copyOf(errorPolicies);
        expressionKeys = Set.copyOf(expressionKeys);
    }

    /** Starts a kind definition. */
    public static Builder builder(String name, Section section) {
        return new Builder(name, section);
    }

    public boolean supports(ErrorPolicy policy) {
        return errorPolicies.contains(policy);
    }

    /** Whether a step of this kind with configuration {@code config} supports {@code policy}. */
    public boolean supports(ErrorPolicy policy, JsonNode config) {
        if (!supports(policy)) {
            return false;
        }
        return policy != ErrorPolicy.SKIP_ROW || granularity(config) == Granularity.ROW;
    }

    public Granularity granularity(JsonNode config) {
        return granularityOf == null ? granularity : granularityOf.apply(config);
    }

    /** Builder that merges the section's common keys into the declared configuration schema. */
    public static final class Builder {

        private final String name;
        private final Section section;
        private String description = "";
        private Schemas.ObjectSchema configuration = Schemas.object();
        private Granularity granularity = Granularity.DATASET;
        private Function<JsonNode, Granularity> granularityOf;
        private Set<ErrorPolicy> errorPolicies;
        private final Set<String> expressionKeys = new LinkedHashSet<>();
        private String shorthand;
        private StepFactory factory;

        private Builder(String name, Section section) {
            this.name = name;
            this.section = section;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** The kind's own keys; common keys are added by {@link #build()}. */
        public Builder configuration(Schemas.ObjectSchema configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder granularity(Granularity granularity) {
            this.granularity = granularity;
            return this;
        }

        /**
         * Derives the granularity of each configured step from its configuration. {@link
         * #granularity(Granularity)} still decides the policies the kind can support at all.
         */
        public Builder granularityFrom(Function<JsonNode, Granularity> granularityOf) {
            this.granularityOf = granularityOf;
            return this;
        }

        /** Overrides the supported policies; by default FAIL and SKIP_STEP, plus SKIP_ROW for ROW kinds. */
        public Builder errorPolicies(Set<ErrorPolicy> errorPolicies) {
            this.errorPolicies = errorPolicies;
            return this;
        }

        /** Marks configuration keys holding expressions, in addition to {@code if} and {@code where}. */
        public Builder expressions(String... keys) {
            expressionKeys.addAll(List.of(keys));
            return this;
        }

        /** Accepts a scalar configuration as the value of {@code key}. */
        public Builder shorthand(String key) {
            this.shorthand = key;
            return this;
        }

        public Builder factory(StepFactory factory) {
            this.factory = factory;
            return this;
        }

        public StepKind build() {
            Set<ErrorPolicy> policies = errorPolicies;
            if (policies == null) {
                if (section != Section.WRANGLE) {
                    policies = EnumSet.of(ErrorPolicy.FAIL);
                } else if (granularity == Granularity.ROW) {
                    policies = EnumSet.allOf(ErrorPolicy.class);
                } else {
                    policies = EnumSet.of(ErrorPolicy.FAIL, ErrorPolicy.SKIP_STEP);
                }
            }
            ObjectNode common = CommonKeys.properties(section);
            ObjectNode schema = configuration.properties(common).build();
            Set<String> expressions = new LinkedHashSet<>(expressionKeys);
            expressions.add(CommonKeys.IF);
            if (common.has(CommonKeys.WHERE)) {
                expressions.add(CommonKeys.WHERE);
            }
            return new StepKind(
                    name,
                    section,
                    description,
                    schema,
                    granularity,
                    granularityOf,
                    policies,
                    expressions,
                    shorthand,
                    factory);
        }
    }
}
