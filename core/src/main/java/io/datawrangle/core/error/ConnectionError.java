package io.datawrangle.core.error;

import io.datawrangle.core.model.StepPosition;

/**
 * Terminal failure to open a connector. Raised once the connector's own retry budget is exhausted,
 * or directly for non-transient failures.
 */
public final class ConnectionError extends WrangleExecutionException {

    private static final long serialVersionUID = 1L;

    private final String location;
    private final int attempts;

    public ConnectionError(String message, Throwable cause, String location, int attempts) {
        this(message, cause, location, attempts, null, null);
    }

    private ConnectionError(
            String message, Throwable cause, String location, int attempts, StepPosition position, String kind) {
        super(message, cause, position, kind);
        this.location = location;
        this.attempts = attempts;
    }

    /** Returns a copy of this error attributed to the given step. */
    public ConnectionError atStep(StepPosition position, String kind) {
        return new ConnectionError(getMessage(), getCause(), location, attempts, position, kind);
    }

    /** The endpoint the connector tried to reach. */
    public String location() {
        return location;
    }

    /** Number of open attempts made before giving up. */
    public int attempts() {
        return attempts;
    }
}
