package io.datawrangle.core.connector;

import java.util.Locale;

/** Serialized dataset formats understood by the file, object store and HTTP connectors. */
public enum DatasetFormat {
    CSV("csv"),
    TSV("tsv"),
    JSON("json"),
    JSONL("jsonl");

    private final String key;

    DatasetFormat(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /** Returns the format for a {@code format} setting, or {@code null} if unknown. */
    public static DatasetFormat fromKey(String key) {
        for (DatasetFormat format : values()) {
            if (format.key.equalsIgnoreCase(key)) {
                return format;
            }
        }
        return null;
    }

    /**
     * Picks a format from a file name's extension.
     *
     * @throws IllegalArgumentException if the extension is not recognized
     */
    public static DatasetFormat fromFileName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".csv") || lower.endsWith(".txt")) {
            return CSV;
        }
        if (lower.endsWith(".tsv")) {
            return TSV;
        }
        if (lower.endsWith(".jsonl") || lower.endsWith(".ndjson")) {
            return JSONL;
        }
        if (lower.endsWith(".json")) {
            return JSON;
        }
        throw new IllegalArgumentException(
                "Cannot infer format of '" + name + "'; set 'format' to one of csv, tsv, json, jsonl");
    }
}
