package io.datawrangle.core.model;

/** States of a pipeline run. {@link #COMPLETED} and {@link #FAILED} are terminal. */
public enum RunState {
    LOADED,
    VALIDATED,
    READING,
    TRANSFORMING,
    WRITING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
