package io.datawrangle.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.datawrangle.core.engine.CommonKeys;
import io.datawrangle.core.engine.EngineRegistry;
import io.datawrangle.core.engine.StepKind;
import io.datawrangle.core.engine.StepRegistry;
import io.datawrangle.core.error.ExpressionException;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.Recipe;
import io.datawrangle.core.model.SchemaViolation;
import io.datawrangle.core.model.SchemaViolation.Rule;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Checks a parsed recipe against the registry and returns every violation found.
 *
 * <p>Each step's configuration is validated against its kind's JSON Schema (draft 2020-12, with
 * the section's common keys merged in); expression keys are compiled; the {@code on_error} value
 * is checked against the kind's declared capability. Nested step lists are walked recursively.
 * Validation never stops at the first problem and has no side effects, so the same recipe always
 * yields the same ordered list.
 *
 * <p>Thread-safe: compiled schemas are cached in a concurrent map.
 */
public final class RecipeValidator {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final Comparator<ValidationMessage> MESSAGE_ORDER = Comparator.comparing(
                    (ValidationMessage m) -> m.getInstanceLocation().toString())
            .thenComparing(ValidationMessage::getType)
            .thenComparing(m -> String.valueOf(m.getProperty()))
            .thenComparing(ValidationMessage::getMessage);

    private final EngineRegistry engines;
    private final Map<StepKind, JsonSchema> schemas = new ConcurrentHashMap<>();

    public RecipeValidator(EngineRegistry engines) {
        this.engines = Objects.requireNonNull(engines, "engines must not be null");
    }

    /**
     * Validates a recipe.
     *
     * @return all violations in document order; empty when the recipe is valid
     */
    public List<SchemaViolation> validate(Recipe recipe, StepRegistry registry) {
        List<SchemaViolation> violations = new ArrayList<>();
        for (String unknown : recipe.unknownSections()) {
            violations.add(new SchemaViolation(
                    null,
                    null,
                    Rule.UNKNOWN_SECTION,
                    "unknown section '" + unknown + "'; expected read, wrangles or write"));
        }
        for (Section section : Section.values()) {
            for (StepDescriptor step : recipe.steps(section)) {
                validateStep(step, registry, violations);
            }
        }
        return List.copyOf(violations);
    }

    private void validateStep(StepDescriptor step, StepRegistry registry, List<SchemaViolation> violations) {
        if (step.isMalformed()) {
            violations.add(new SchemaViolation(step.position(), null, Rule.MALFORMED_STEP, step.malformation()));
            return;
        }
        StepKind kind = registry.resolve(step.section(), step.kind()).orElse(null);
        if (kind == null) {
            violations.add(new SchemaViolation(
                    step.position(),
                    step.kind(),
                    Rule.UNKNOWN_KIND,
                    "unknown " + step.section().key() + " step kind '" + step.kind() + "'"));
            return;
        }
        if (!step.configuration().isObject()) {
            violations.add(new SchemaViolation(
                    step.position(),
                    step.kind(),
                    Rule.WRONG_TYPE,
                    "settings must be a mapping, got " + step.configuration().getNodeType()));
            return;
        }
        checkSchema(step, kind, violations);
        checkErrorPolicy(step, kind, violations);
        checkExpressions(step, kind, violations);
        for (List<StepDescriptor> nested : step.children().values()) {
            for (StepDescriptor child : nested) {
                validateStep(child, registry, violations);
            }
        }
    }

    private void checkSchema(StepDescriptor step, StepKind kind, List<SchemaViolation> violations) {
        JsonSchema schema = schemas.computeIfAbsent(kind, k -> SCHEMA_FACTORY.getSchema(k.schema()));
        List<ValidationMessage> messages = schema.validate(step.configuration()).stream()
                .sorted(MESSAGE_ORDER)
                .collect(Collectors.toList());
        Set<String> alternatives = messages.stream()
                .filter(m -> "oneOf".equals(m.getType()))
                .map(m -> m.getInstanceLocation().toString())
                .collect(Collectors.toSet());
        for (ValidationMessage message : messages) {
            String location = message.getInstanceLocation().toString();
            if ("oneOf".equals(message.getType())) {
                violations.add(new SchemaViolation(
                        step.position(), step.kind(), alternativeRule(location, messages), describe(message)));
            } else if (!within(location, alternatives)) {
                violations.add(new SchemaViolation(step.position(), step.kind(), rule(message), describe(message)));
            }
        }
    }

    private static Rule rule(ValidationMessage message) {
        return switch (message.getType()) {
            case "required" -> Rule.MISSING_REQUIRED_KEY;
            case "additionalProperties", "unevaluatedProperties" -> Rule.UNKNOWN_KEY;
            case "type" -> Rule.WRONG_TYPE;
            default -> Rule.INVALID_VALUE;
        };
    }

    /** A failed {@code oneOf} is a type error when every alternative rejected the value's type. */
    private static Rule alternativeRule(String location, List<ValidationMessage> messages) {
        List<ValidationMessage> branches = messages.stream()
                .filter(m -> !"oneOf".equals(m.getType()) && m.getInstanceLocation().toString().equals(location))
                .toList();
        boolean allType = !branches.isEmpty() && branches.stream().allMatch(m -> "type".equals(m.getType()));
        return allType ? Rule.WRONG_TYPE : Rule.INVALID_VALUE;
    }

    private static boolean within(String location, Set<String> parents) {
        for (String parent : parents) {
            if (location.equals(parent) || location.startsWith(parent + ".") || location.startsWith(parent + "[")) {
                return true;
            }
        }
        return false;
    }

    private static String describe(ValidationMessage message) {
        String key = message.getProperty();
        switch (message.getType()) {
            case "required":
                return "missing required key '" + key + "'";
            case "additionalProperties":
            case "unevaluatedProperties":
                return "unknown key '" + key + "'";
            default:
                return message.getMessage();
        }
    }

    private static void checkErrorPolicy(StepDescriptor step, StepKind kind, List<SchemaViolation> violations) {
        JsonNode value = step.config().get(CommonKeys.ON_ERROR);
        if (value == null || !value.isTextual()) {
            return;
        }
        ErrorPolicy policy = ErrorPolicy.fromKey(value.asText());
        if (policy == null || kind.supports(policy, step.config())) {
            return;
        }
        String message = kind.supports(policy)
                ? "step kind '" + kind.name() + "' does not support on_error: " + policy.key() + " when it runs at "
                        + kind.granularity(step.config()).name().toLowerCase(Locale.ROOT) + " granularity"
                : "step kind '" + kind.name() + "' does not support on_error: " + policy.key();
        violations.add(new SchemaViolation(step.position(), step.kind(), Rule.UNSUPPORTED_ERROR_POLICY, message));
    }

    private void checkExpressions(StepDescriptor step, StepKind kind, List<SchemaViolation> violations) {
        for (String key : kind.expressionKeys().stream().sorted().toList()) {
            JsonNode value = step.config().get(key);
            if (value == null || !value.isTextual()) {
                continue;
            }
            try {
                engines.defaultEngine().compile(value.asText());
            } catch (ExpressionException e) {
                violations.add(new SchemaViolation(
                        step.position(),
                        step.kind(),
                        Rule.INVALID_VALUE,
                        "'" + key + "' is not a valid expression: " + e.getMessage()));
            }
        }
    }
}
