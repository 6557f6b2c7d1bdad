package io.datawrangle.core.spi;

/**
 * Opaque capability bound to one external endpoint, produced by {@link Connector#open} and owned
 * by the step that opened it until {@link Connector#close} is called.
 */
public interface ConnectorHandle {

    /** Human-readable endpoint description used in logs and errors (never contains secrets). */
    String location();
}
