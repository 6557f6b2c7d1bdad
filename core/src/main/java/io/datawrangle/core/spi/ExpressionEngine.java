package io.datawrangle.core.spi;

/**
 * Expression language behind {@code if}, {@code where} and the {@code jslt} wrangle. Engines are
 * looked up by {@link #id()} and must be safe to call from several threads.
 */
public interface ExpressionEngine {

    /** Lowercase identifier, e.g. {@code "jslt"}. */
    String id();

    /**
     * Parses {@code expression} once so it can be evaluated per row.
     *
     * @throws io.datawrangle.core.error.ExpressionException if the expression does not parse
     */
    CompiledExpression compile(String expression);
}
