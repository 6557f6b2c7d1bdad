package io.datawrangle.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * An expression ready to run against rows or dataset summaries. Instances are immutable and are
 * shared across rows and, for concurrent steps, across threads.
 */
public interface CompiledExpression {

    /**
     * @param input     a row object, or a dataset summary for step conditions
     * @param variables values bound to {@code $name}
     * @return the result, a {@code NullNode} when the expression yields nothing
     * @throws io.datawrangle.core.error.ExpressionException if evaluation fails
     */
    JsonNode evaluate(JsonNode input, Map<String, JsonNode> variables);

    default JsonNode evaluate(JsonNode input) {
        return evaluate(input, Map.of());
    }

    /** Whether the result for {@code input} counts as true, see {@link #truthy(JsonNode)}. */
    default boolean matches(JsonNode input) {
        return truthy(evaluate(input));
    }

    String source();

    /**
     * Condition semantics shared by {@code if} and {@code where}: null, false, zero, and empty
     * strings, arrays and objects are false; everything else is true.
     */
    static boolean truthy(JsonNode value) {
        if (value == null) {
            return false;
        }
        switch (value.getNodeType()) {
            case NULL:
            case MISSING:
                return false;
            case BOOLEAN:
                return value.booleanValue();
            case NUMBER:
                return value.doubleValue() != 0.0;
            case STRING:
                return !value.textValue().isEmpty();
            case ARRAY:
            case OBJECT:
                return value.size() > 0;
            default:
                return true;
        }
    }
}
