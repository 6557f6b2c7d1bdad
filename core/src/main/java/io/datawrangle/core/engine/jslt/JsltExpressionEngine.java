package io.datawrangle.core.engine.jslt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.datawrangle.core.error.ExpressionException;
import io.datawrangle.core.spi.CompiledExpression;
import io.datawrangle.core.spi.ExpressionEngine;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schibsted JSLT. Row expressions see the row object as {@code .}; step conditions see the dataset
 * summary {@code {"columns": [...], "rowCount": n, "rows": [...]}}.
 *
 * <p>Compiled expressions are cached by source text, so a condition repeated across steps or
 * runs of the same engine is parsed once. The cache holds at most {@value #DEFAULT_CACHE_LIMIT}
 * expressions; once full, further expressions are compiled on every call.
 */
public final class JsltExpressionEngine implements ExpressionEngine {

    public static final String ENGINE_ID = "jslt";

    static final int DEFAULT_CACHE_LIMIT = 1024;

    private final Map<String, CompiledExpression> cache = new ConcurrentHashMap<>();
    private final int cacheLimit;

    public JsltExpressionEngine() {
        this(DEFAULT_CACHE_LIMIT);
    }

    JsltExpressionEngine(int cacheLimit) {
        this.cacheLimit = cacheLimit;
    }

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        CompiledExpression cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        Expression parsed;
        try {
            parsed = Parser.compileString(expression);
        } catch (JsltException e) {
            throw new ExpressionException("Cannot compile JSLT '" + expression + "': " + e.getMessage(), e, expression);
        }
        CompiledExpression compiled = new JsltExpression(parsed, expression);
        // Size is approximate under concurrent compiles; overshoot is bounded by the thread count.
        if (cache.size() >= cacheLimit) {
            return compiled;
        }
        CompiledExpression raced = cache.putIfAbsent(expression, compiled);
        return raced != null ? raced : compiled;
    }

    int cachedCount() {
        return cache.size();
    }

    private record JsltExpression(Expression expression, String source) implements CompiledExpression {

        @Override
        public JsonNode evaluate(JsonNode input, Map<String, JsonNode> variables) {
            JsonNode result;
            try {
                result = expression.apply(variables, input);
            } catch (JsltException e) {
                throw new ExpressionException("JSLT '" + source + "' failed: " + e.getMessage(), e, source);
            }
            return result == null ? NullNode.instance : result;
        }
    }
}
