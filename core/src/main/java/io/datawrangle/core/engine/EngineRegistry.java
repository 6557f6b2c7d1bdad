package io.datawrangle.core.engine;

import io.datawrangle.core.engine.jslt.JsltExpressionEngine;
import io.datawrangle.core.spi.ExpressionEngine;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expression engines by id. Recipes currently always use {@link #DEFAULT_ENGINE}; further engines
 * can be registered by code that embeds the executor.
 */
public final class EngineRegistry {

    public static final String DEFAULT_ENGINE = JsltExpressionEngine.ENGINE_ID;

    private final Map<String, ExpressionEngine> engines = new ConcurrentHashMap<>();

    public static EngineRegistry withDefaults() {
        return new EngineRegistry().register(new JsltExpressionEngine());
    }

    /** Adds or replaces the engine registered under {@code engine.id()}. */
    public EngineRegistry register(ExpressionEngine engine) {
        Objects.requireNonNull(engine, "engine must not be null");
        String id = engine.id();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Expression engine " + engine.getClass().getName() + " has no id");
        }
        engines.put(id, engine);
        return this;
    }

    public Optional<ExpressionEngine> find(String id) {
        return Optional.ofNullable(engines.get(id));
    }

    /**
     * @throws IllegalStateException if the default engine was never registered
     */
    public ExpressionEngine defaultEngine() {
        return find(DEFAULT_ENGINE)
                .orElseThrow(() -> new IllegalStateException("Expression engine '" + DEFAULT_ENGINE + "' is not registered"));
    }

    /** Registered ids, sorted. */
    public Set<String> ids() {
        return new TreeSet<>(engines.keySet());
    }
}
