package io.datawrangle.core.error;

/**
 * Thrown by expression engines when an expression fails to compile or evaluate. Never reaches the
 * caller of a run: validation turns compile failures into schema violations and steps turn
 * evaluation failures into {@link StepExecutionError}s or skipped rows.
 */
public final class ExpressionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public ExpressionException(String message, Throwable cause, String expression) {
        super(message, cause);
        this.expression = expression;
    }

    /** The expression source that failed. */
    public String expression() {
        return expression;
    }
}
