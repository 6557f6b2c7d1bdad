package io.datawrangle.core.model;

/** The three top-level sections of a recipe, in execution order. */
public enum Section {
    READ("read"),
    WRANGLE("wrangles"),
    WRITE("write");

    private final String key;

    Section(String key) {
        this.key = key;
    }

    /** The recipe document key for this section. */
    public String key() {
        return key;
    }

    /**
     * Looks up a section by its document key.
     *
     * @param key the document key, e.g. {@code "wrangles"}
     * @return the section, or {@code null} if the key is not a section key
     */
    public static Section fromKey(String key) {
        for (Section section : values()) {
            if (section.key.equals(key)) {
                return section;
            }
        }
        return null;
    }
}
