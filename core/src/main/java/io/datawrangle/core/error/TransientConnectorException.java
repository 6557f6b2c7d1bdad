package io.datawrangle.core.error;

/**
 * Signals a connector open failure worth retrying (network blip, throttling, expired token).
 * Only {@link io.datawrangle.core.connector.Retrying} catches it; it never escapes a connector.
 */
public class TransientConnectorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransientConnectorException(String message) {
        super(message);
    }

    public TransientConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
