package io.datawrangle.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.datawrangle.core.error.RecipeParseException;
import io.datawrangle.core.model.Recipe;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepDescriptor;
import io.datawrangle.core.model.StepPosition;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a resolved recipe document into a {@link Recipe}.
 *
 * <p>The parser is tolerant: entries that are not single-key mappings and unknown top-level keys
 * are kept in the model so that {@link RecipeValidator} can report every problem at once. Only a
 * document that is not a mapping at all is rejected here.
 */
public final class RecipeParser {

    /** Source name of recipes given as text rather than as a file. */
    public static final String INLINE_SOURCE = "<string>";

    /** Configuration keys holding nested step lists. */
    public static final List<String> NESTED_LIST_KEYS = List.of("sources", "steps");

    /**
     * @throws RecipeParseException if the document root is not a mapping
     */
    public Recipe parse(JsonNode document, String source) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return new Recipe(List.of(), List.of(), List.of(), List.of(), source);
        }
        if (!document.isObject()) {
            throw new RecipeParseException(
                    "Recipe must be a mapping with read, wrangles and write sections, got " + document.getNodeType(),
                    source);
        }
        Map<Section, List<StepDescriptor>> sections = new EnumMap<>(Section.class);
        List<String> unknown = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Section section = Section.fromKey(field.getKey());
            if (section == null) {
                unknown.add(field.getKey());
                continue;
            }
            sections.put(section, parseSection(section, field.getValue()));
        }
        return new Recipe(
                sections.getOrDefault(Section.READ, List.of()),
                sections.getOrDefault(Section.WRANGLE, List.of()),
                sections.getOrDefault(Section.WRITE, List.of()),
                unknown,
                source);
    }

    private static List<StepDescriptor> parseSection(Section section, JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            return List.of(StepDescriptor.malformed(
                    StepPosition.of(section, 0), value, "section '" + section.key() + "' must be a list of steps"));
        }
        List<StepDescriptor> steps = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            steps.add(parseStep(StepPosition.of(section, i), value.get(i)));
        }
        return steps;
    }

    private static StepDescriptor parseStep(StepPosition position, JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return StepDescriptor.malformed(position, entry, "step must be a mapping of one kind to its settings");
        }
        if (entry.size() != 1) {
            return StepDescriptor.malformed(
                    position, entry, "step must have exactly one kind key, found " + entry.size());
        }
        Map.Entry<String, JsonNode> only = entry.fields().next();
        JsonNode configuration = only.getValue();
        if (configuration == null || configuration.isNull()) {
            configuration = JsonNodeFactory.instance.objectNode();
        }
        Map<String, List<StepDescriptor>> children = new LinkedHashMap<>();
        if (configuration.isObject()) {
            for (String key : NESTED_LIST_KEYS) {
                JsonNode nested = configuration.get(key);
                if (nested != null && nested.isArray()) {
                    List<StepDescriptor> list = new ArrayList<>(nested.size());
                    for (int i = 0; i < nested.size(); i++) {
                        list.add(parseStep(position.child(key, i), nested.get(i)));
                    }
                    children.put(key, list);
                }
            }
        }
        return StepDescriptor.of(only.getKey(), position, configuration, children);
    }
}
