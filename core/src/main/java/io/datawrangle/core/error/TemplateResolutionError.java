package io.datawrangle.core.error;

/**
 * Thrown when a {@code {{ variable }}} placeholder has no value or a {@code $include} directive
 * references a missing, unreadable or cyclic file.
 */
public final class TemplateResolutionError extends WrangleLoadException {

    private static final long serialVersionUID = 1L;

    public TemplateResolutionError(String message, String source) {
        super(message, source);
    }

    public TemplateResolutionError(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
