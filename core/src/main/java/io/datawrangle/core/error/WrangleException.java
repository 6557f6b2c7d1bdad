package io.datawrangle.core.error;

/**
 * Abstract base for all data-wrangle exceptions. Never thrown directly; use the concrete
 * subclasses under {@link WrangleLoadException} or {@link WrangleExecutionException}.
 */
public abstract class WrangleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXECUTION
    }

    private final Phase phase;

    protected WrangleException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected WrangleException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
