package io.datawrangle.core.spi;

/**
 * Marker for resolved, ready-to-run steps. Each section has its own shape: {@link SourceStep},
 * {@link WrangleStep}, {@link SinkStep}.
 */
public interface ExecutableStep {}
