package io.datawrangle.core.error;

/** Thrown when a recipe document cannot be read or is not valid YAML. */
public final class RecipeParseException extends WrangleLoadException {

    private static final long serialVersionUID = 1L;

    public RecipeParseException(String message, String source) {
        super(message, source);
    }

    public RecipeParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
