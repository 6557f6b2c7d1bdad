package io.datawrangle.core.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.model.ErrorPolicy;
import io.datawrangle.core.model.Section;

/**
 * Configuration keys every kind of a section accepts in addition to its own. They are merged into
 * each kind's schema when the kind is built, and applied by the executor rather than by the kinds.
 */
public final class CommonKeys {

    public static final String IF = "if";
    public static final String ON_ERROR = "on_error";
    public static final String COLUMNS = "columns";
    public static final String NOT_COLUMNS = "not_columns";
    public static final String WHERE = "where";
    public static final String ORDER_BY = "order_by";
    public static final String MERGE = "merge";
    public static final String CREDENTIALS = "credentials";
    public static final String BEST_EFFORT = "best_effort";

    private CommonKeys() {}

    /** Property schemas of the common keys of {@code section}. */
    public static ObjectNode properties(Section section) {
        Schemas.ObjectSchema schema = Schemas.object().property(IF, Schemas.string());
        switch (section) {
            case READ -> schema.property(COLUMNS, Schemas.columns())
                    .property(NOT_COLUMNS, Schemas.columns())
                    .property(WHERE, Schemas.string())
                    .property(ORDER_BY, Schemas.string())
                    .property(MERGE, mergeSchema())
                    .property(CREDENTIALS, Schemas.string());
            case WRANGLE -> schema.property(ON_ERROR, Schemas.enumOf(policyKeys()));
            case WRITE -> schema.property(COLUMNS, Schemas.columns())
                    .property(NOT_COLUMNS, Schemas.columns())
                    .property(WHERE, Schemas.string())
                    .property(BEST_EFFORT, Schemas.bool())
                    .property(CREDENTIALS, Schemas.string());
        }
        return (ObjectNode) schema.build().get("properties");
    }

    /** Whether {@code key} is a common key of {@code section}. */
    public static boolean isCommon(Section section, String key) {
        return properties(section).has(key);
    }

    private static ObjectNode mergeSchema() {
        ObjectNode join = Schemas.object()
                .property("how", Schemas.enumOf("inner", "left", "right", "outer"))
                .property("on", Schemas.columns())
                .property("left_on", Schemas.columns())
                .property("right_on", Schemas.columns())
                .required("how")
                .build();
        return Schemas.oneOf(Schemas.enumOf("append", "union"), join);
    }

    private static String[] policyKeys() {
        ErrorPolicy[] policies = ErrorPolicy.values();
        String[] keys = new String[policies.length];
        for (int i = 0; i < policies.length; i++) {
            keys[i] = policies[i].key();
        }
        return keys;
    }
}
