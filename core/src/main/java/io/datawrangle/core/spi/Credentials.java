package io.datawrangle.core.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Opaque credential bundle supplied by run configuration and passed unmodified to
 * {@link Connector#open}. The engine never inspects it; {@link #toString()} never prints values.
 */
public final class Credentials {

    private static final Credentials NONE = new Credentials(Map.of());

    private final Map<String, String> values;

    private Credentials(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static Credentials none() {
        return NONE;
    }

    public static Credentials of(Map<String, String> values) {
        return values.isEmpty() ? NONE : new Credentials(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "Credentials" + values.keySet();
    }
}
