package io.datawrangle.core.error;

import io.datawrangle.core.model.StepPosition;

/**
 * Thrown when a read or write fails after the connection was established. Carries the location
 * and, for partial transfers, the range of rows affected.
 */
public final class ConnectorIOError extends WrangleExecutionException {

    private static final long serialVersionUID = 1L;

    /** Half-open range {@code [from, to)} of rows involved in a partial failure. */
    public record RowRange(int from, int to) {

        @Override
        public String toString() {
            return "rows " + from + ".." + (to - 1);
        }
    }

    private final String location;
    private final RowRange rowRange;

    public ConnectorIOError(String message, Throwable cause, String location) {
        this(message, cause, location, null, null, null);
    }

    public ConnectorIOError(String message, Throwable cause, String location, RowRange rowRange) {
        this(message, cause, location, rowRange, null, null);
    }

    private ConnectorIOError(
            String message,
            Throwable cause,
            String location,
            RowRange rowRange,
            StepPosition position,
            String kind) {
        super(message, cause, position, kind);
        this.location = location;
        this.rowRange = rowRange;
    }

    /** Returns a copy of this error attributed to the given step. */
    public ConnectorIOError atStep(StepPosition position, String kind) {
        return new ConnectorIOError(getMessage(), getCause(), location, rowRange, position, kind);
    }

    public String location() {
        return location;
    }

    /** The affected row range, or {@code null} when the failure is not row-specific. */
    public RowRange rowRange() {
        return rowRange;
    }
}
