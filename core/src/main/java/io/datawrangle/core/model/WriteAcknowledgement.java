package io.datawrangle.core.model;

/**
 * Confirmation returned by a connector after a successful write.
 *
 * @param connector   connector id, e.g. {@code "file"}
 * @param location    where the rows went
 * @param rowsWritten number of rows written
 */
public record WriteAcknowledgement(String connector, String location, int rowsWritten) {}
