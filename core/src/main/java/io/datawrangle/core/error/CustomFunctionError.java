package io.datawrangle.core.error;

/**
 * Thrown when a custom function reference cannot be resolved: the file is missing, the class or
 * method is absent, the symbol's signature does not match the declared function type, or custom
 * code loading was not enabled for the run.
 */
public final class CustomFunctionError extends WrangleLoadException {

    private static final long serialVersionUID = 1L;

    public CustomFunctionError(String message, String reference) {
        super(message, reference);
    }

    public CustomFunctionError(String message, Throwable cause, String reference) {
        super(message, cause, reference);
    }
}
