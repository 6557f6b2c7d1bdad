package io.datawrangle.core.function;

/** Calling convention of a custom function, declared by the {@code type} key. */
public enum FunctionType {
    /** Called once per row with the row's input columns. */
    ROW("row"),
    /** Called once with all values of the input column. */
    COLUMN("column"),
    /** Called once with the whole dataset. */
    DATASET("dataset");

    private final String key;

    FunctionType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /** Returns the type for a recipe value, or {@code null} if unrecognized. */
    public static FunctionType fromKey(String key) {
        for (FunctionType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        return null;
    }
}
