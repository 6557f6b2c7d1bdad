package io.datawrangle.core.connector;

import io.datawrangle.core.model.Dataset;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named datasets held in memory, shared between the {@code memory} connector and the code that
 * embeds the engine. Datasets are immutable, so no copies are made.
 */
public final class MemoryStore {

    private final Map<String, Dataset> datasets = new ConcurrentHashMap<>();

    public MemoryStore put(String name, Dataset dataset) {
        datasets.put(name, dataset);
        return this;
    }

    public Optional<Dataset> get(String name) {
        return Optional.ofNullable(datasets.get(name));
    }

    public boolean contains(String name) {
        return datasets.containsKey(name);
    }

    /** Stored names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(datasets.keySet());
    }

    public void clear() {
        datasets.clear();
    }
}
