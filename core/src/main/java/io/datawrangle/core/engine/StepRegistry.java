package io.datawrangle.core.engine;

import io.datawrangle.core.error.StepRegistrationException;
import io.datawrangle.core.model.Section;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable catalogue of step kinds, keyed by section and name.
 *
 * <p>Built once at startup through {@link Builder}; a duplicate name within a section is a
 * startup-fatal {@link StepRegistrationException} unless replaced through
 * {@link Builder#override(StepKind)}. Run-scoped custom kinds are layered on top with
 * {@link #withRunScoped(Collection)}, which returns a new registry and leaves this one untouched.
 *
 * <p>Thread-safe: all maps are unmodifiable after construction.
 */
public final class StepRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(StepRegistry.class);

    /** Prefix reserved for run-declared custom functions. */
    public static final String CUSTOM_PREFIX = "custom.";

    private final Map<Section, Map<String, StepKind>> kinds;

    private StepRegistry(Map<Section, Map<String, StepKind>> kinds) {
        EnumMap<Section, Map<String, StepKind>> copy = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            copy.put(section, Collections.unmodifiableMap(new TreeMap<>(kinds.getOrDefault(section, Map.of()))));
        }
        this.kinds = Collections.unmodifiableMap(copy);
    }

    /** Returns a fresh builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a registry with no kinds. */
    public static StepRegistry empty() {
        return new StepRegistry(Map.of());
    }

    /**
     * Looks up a kind.
     *
     * @return the kind, or empty if {@code name} is not registered in {@code section}
     */
    public Optional<StepKind> resolve(Section section, String name) {
        return Optional.ofNullable(kinds.get(section).get(name));
    }

    /**
     * Looks up a kind, throwing if absent.
     *
     * @throws IllegalArgumentException if the kind is not registered
     */
    public StepKind require(Section section, String name) {
        return resolve(section, name)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No step kind '" + name + "' registered in section '" + section.key() + "'"));
    }

    /** All kinds of a section, sorted by name. */
    public List<StepKind> kinds(Section section) {
        return List.copyOf(kinds.get(section).values());
    }

    /** Total number of registered kinds across sections. */
    public int size() {
        return kinds.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Returns a registry that also contains the given run-scoped kinds. Their names must start
     * with {@value #CUSTOM_PREFIX} and must not collide with existing kinds.
     *
     * @throws StepRegistrationException on an invalid or duplicate name
     */
    public StepRegistry withRunScoped(Collection<StepKind> runScoped) {
        if (runScoped.isEmpty()) {
            return this;
        }
        Map<Section, Map<String, StepKind>> merged = new EnumMap<>(Section.class);
        kinds.forEach((section, byName) -> merged.put(section, new TreeMap<>(byName)));
        for (StepKind kind : runScoped) {
            if (!kind.name().startsWith(CUSTOM_PREFIX)) {
                throw new StepRegistrationException(
                        "Run-scoped step kinds must be named '" + CUSTOM_PREFIX + "<name>'", kind.name());
            }
            if (merged.get(kind.section()).putIfAbsent(kind.name(), kind) != null) {
                throw new StepRegistrationException(
                        "Step kind '" + kind.name() + "' is already registered in section '"
                                + kind.section().key() + "'",
                        kind.name());
            }
        }
        return new StepRegistry(merged);
    }

    /** Collects kinds and rejects accidental duplicates. */
    public static final class Builder {

        private final Map<Section, Map<String, StepKind>> kinds = new EnumMap<>(Section.class);

        private Builder() {
            for (Section section : Section.values()) {
                kinds.put(section, new TreeMap<>());
            }
        }

        /**
         * Adds a kind.
         *
         * @throws StepRegistrationException if the section already has a kind with that name
         */
        public Builder register(StepKind kind) {
            Map<String, StepKind> section = kinds.get(kind.section());
            if (section.containsKey(kind.name())) {
                throw new StepRegistrationException(
                        "Step kind '" + kind.name() + "' is already registered in section '"
                                + kind.section().key() + "'",
                        kind.name());
            }
            section.put(kind.name(), kind);
            return this;
        }

        /** Adds or replaces a kind. */
        public Builder override(StepKind kind) {
            StepKind previous = kinds.get(kind.section()).put(kind.name(), kind);
            if (previous != null) {
                LOG.info("Step kind overridden: section={}, kind={}", kind.section().key(), kind.name());
            }
            return this;
        }

        public StepRegistry build() {
            StepRegistry registry = new StepRegistry(kinds);
            LOG.debug("Step registry built: kinds={}", registry.size());
            return registry;
        }
    }
}
