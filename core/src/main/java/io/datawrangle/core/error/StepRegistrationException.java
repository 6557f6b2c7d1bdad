package io.datawrangle.core.error;

/**
 * Thrown at startup when a step kind is registered twice in the same section without an explicit
 * override. The offending kind name is reported as the source.
 */
public final class StepRegistrationException extends WrangleLoadException {

    private static final long serialVersionUID = 1L;

    public StepRegistrationException(String message, String kind) {
        super(message, kind);
    }
}
