package io.datawrangle.core.error;

import io.datawrangle.core.model.StepPosition;

/**
 * Abstract parent for errors raised while a run is executing steps. Carries the position and kind
 * of the step that failed when the thrower knows them; connectors raise these without step context
 * and the executor attaches it via {@link io.datawrangle.core.connector.ConnectorSession}.
 */
public abstract class WrangleExecutionException extends WrangleException {

    private static final long serialVersionUID = 1L;

    private final StepPosition position;
    private final String kind;

    protected WrangleExecutionException(String message, StepPosition position, String kind) {
        super(message, Phase.EXECUTION);
        this.position = position;
        this.kind = kind;
    }

    protected WrangleExecutionException(String message, Throwable cause, StepPosition position, String kind) {
        super(message, cause, Phase.EXECUTION);
        this.position = position;
        this.kind = kind;
    }

    /** Position of the failing step, or {@code null} if not attached. */
    public StepPosition position() {
        return position;
    }

    /** Top-level index of the failing step within its section, or {@code null}. */
    public Integer stepIndex() {
        return position != null ? position.index() : null;
    }

    /** Kind name of the failing step, or {@code null} if not attached. */
    public String kind() {
        return kind;
    }
}
