package io.datawrangle.core.engine;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashSet;
import java.util.Set;

/** Small builders for the JSON Schema fragments step kinds declare. */
public final class Schemas {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Schemas() {}

    public static ObjectNode string() {
        return typed("string");
    }

    public static ObjectNode integer() {
        return typed("integer");
    }

    public static ObjectNode integer(int minimum) {
        ObjectNode schema = typed("integer");
        schema.put("minimum", minimum);
        return schema;
    }

    public static ObjectNode bool() {
        return typed("boolean");
    }

    /** Accepts any JSON value. */
    public static ObjectNode any() {
        return NODES.objectNode();
    }

    /** A free-form object. */
    public static ObjectNode map() {
        return typed("object");
    }

    /** An array of arbitrary values. */
    public static ObjectNode array() {
        return typed("array");
    }

    /** A string restricted to the given values. */
    public static ObjectNode enumOf(String... values) {
        ObjectNode schema = string();
        ArrayNode allowed = schema.putArray("enum");
        for (String value : values) {
            allowed.add(value);
        }
        return schema;
    }

    /** A column name or a non-empty list of column names. */
    public static ObjectNode columns() {
        ObjectNode list = typed("array");
        list.set("items", string());
        list.put("minItems", 1);
        return oneOf(string(), list);
    }

    /** A nested list of steps, each a single-key mapping. */
    public static ObjectNode steps() {
        ObjectNode list = typed("array");
        list.set("items", typed("object"));
        return list;
    }

    public static ObjectNode oneOf(ObjectNode... alternatives) {
        ObjectNode schema = NODES.objectNode();
        ArrayNode options = schema.putArray("oneOf");
        for (ObjectNode alternative : alternatives) {
            options.add(alternative);
        }
        return schema;
    }

    /** Starts a closed object schema. */
    public static ObjectSchema object() {
        return new ObjectSchema();
    }

    private static ObjectNode typed(String type) {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", type);
        return schema;
    }

    /** Builder for an object schema; unknown keys are rejected unless {@link #open()} is called. */
    public static final class ObjectSchema {

        private final ObjectNode properties = NODES.objectNode();
        private final Set<String> required = new LinkedHashSet<>();
        private boolean open;

        private ObjectSchema() {}

        public ObjectSchema property(String name, ObjectNode schema) {
            properties.set(name, schema);
            return this;
        }

        /** Copies every property of another object schema's {@code properties}. */
        public ObjectSchema properties(ObjectNode more) {
            more.fields().forEachRemaining(e -> properties.set(e.getKey(), e.getValue().deepCopy()));
            return this;
        }

        public ObjectSchema required(String... names) {
            required.addAll(Set.of(names));
            return this;
        }

        public ObjectSchema required(Iterable<String> names) {
            names.forEach(required::add);
            return this;
        }

        public ObjectSchema open() {
            this.open = true;
            return this;
        }

        public ObjectNode build() {
            ObjectNode schema = NODES.objectNode();
            schema.put("type", "object");
            schema.set("properties", properties.deepCopy());
            if (!required.isEmpty()) {
                ArrayNode names = schema.putArray("required");
                required.stream().sorted().forEach(names::add);
            }
            schema.put("additionalProperties", open);
            return schema;
        }
    }
}
