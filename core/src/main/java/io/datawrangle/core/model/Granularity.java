package io.datawrangle.core.model;

/** Unit a step kind operates on, declared by the kind and never inferred. */
public enum Granularity {
    /** The step sees the whole dataset at once. */
    DATASET,
    /** The step processes each row independently; failures can be isolated per row. */
    ROW
}
