package io.datawrangle.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step as declared in a recipe: {@code {<kind>: {<configuration>}}}.
 *
 * <p>Nested step lists (the {@code steps} of a group, the {@code sources} of an aggregate read)
 * are parsed into {@code children} so that validation and resolution can recurse; the raw lists
 * also remain in {@code configuration}.
 *
 * @param kind          the declared kind name, or {@code null} for a malformed entry
 * @param position      where the step is declared
 * @param configuration the raw configuration value; normally an object
 * @param children      nested step lists keyed by their configuration key
 * @param malformation  description of why the entry is not a step, or {@code null}
 */
public record StepDescriptor(
        String kind,
        StepPosition position,
        JsonNode configuration,
        Map<String, List<StepDescriptor>> children,
        String malformation) {

    /** Configuration key selecting the error policy. */
    public static final String ON_ERROR = "on_error";
    /** Configuration key holding a dataset-level condition. */
    public static final String IF = "if";

    public StepDescriptor {
        Objects.requireNonNull(position, "position must not be null");
        children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    /** Creates a well-formed step descriptor. */
    public static StepDescriptor of(
            String kind, StepPosition position, JsonNode configuration, Map<String, List<StepDescriptor>> children) {
        return new StepDescriptor(kind, position, configuration, children, null);
    }

    /** Creates a placeholder for an entry that is not a single-key mapping. */
    public static StepDescriptor malformed(StepPosition position, JsonNode raw, String why) {
        return new StepDescriptor(null, position, raw, Map.of(), why);
    }

    public boolean isMalformed() {
        return malformation != null;
    }

    public Section section() {
        return position.section();
    }

    /** The configuration as an object; an empty object when the raw value is not one. */
    public ObjectNode config() {
        if (configuration != null && configuration.isObject()) {
            return (ObjectNode) configuration;
        }
        return JsonNodeFactory.instance.objectNode();
    }

    /** Returns the nested step list under {@code key}, or an empty list. */
    public List<StepDescriptor> children(String key) {
        return children.getOrDefault(key, List.of());
    }

    /** Columns named by the {@code input} key (or {@code column}), or an empty list when absent. */
    public List<String> inputColumns() {
        JsonNode input = config().get("input");
        return names(input != null ? input : config().get("column"));
    }

    /** Columns named by the {@code output} key, or an empty list when absent. */
    public List<String> outputColumns() {
        return names(config().get("output"));
    }

    /** The declared error policy; {@link ErrorPolicy#FAIL} when not set. */
    public ErrorPolicy errorPolicy() {
        JsonNode node = config().get(ON_ERROR);
        if (node == null || !node.isTextual()) {
            return ErrorPolicy.FAIL;
        }
        ErrorPolicy policy = ErrorPolicy.fromKey(node.asText());
        return policy != null ? policy : ErrorPolicy.FAIL;
    }

    /** Reads a string or list-of-strings configuration value as a list of names. */
    public static List<String> names(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> names = new ArrayList<>();
            node.forEach(n -> names.add(n.asText()));
            return List.copyOf(names);
        }
        return List.of(node.asText());
    }

    @Override
    public String toString() {
        return position + " " + (kind != null ? kind : "<malformed>");
    }
}
