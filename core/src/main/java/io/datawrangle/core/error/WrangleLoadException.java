package io.datawrangle.core.error;

/**
 * Abstract parent for errors raised before any row is read: templating, parsing, validation,
 * registration and custom code resolution. Carries a {@code source} field identifying the file or
 * reference that caused the error.
 */
public abstract class WrangleLoadException extends WrangleException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected WrangleLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected WrangleLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or reference that caused the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }
}
