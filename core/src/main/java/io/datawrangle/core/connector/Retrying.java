package io.datawrangle.core.connector;

import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.error.TransientConnectorException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connector-level retry for {@code open}. Only {@link TransientConnectorException} is retried;
 * every other exception propagates on the first attempt. Exhaustion surfaces as one
 * {@link ConnectionError} carrying the last cause and the number of attempts.
 */
public final class Retrying {

    private static final Logger LOG = LoggerFactory.getLogger(Retrying.class);

    private Retrying() {}

    public static <T> T open(RetryPolicy policy, String location, Supplier<T> attempt) {
        TransientConnectorException last = null;
        for (int i = 1; i <= policy.maxAttempts(); i++) {
            try {
                return attempt.get();
            } catch (TransientConnectorException e) {
                last = e;
                if (i == policy.maxAttempts()) {
                    break;
                }
                Duration backoff = policy.backoffAfter(i);
                LOG.warn(
                        "Transient open failure, retrying: location={}, attempt={}/{}, backoff_ms={}, error={}",
                        location,
                        i,
                        policy.maxAttempts(),
                        backoff.toMillis(),
                        e.getMessage());
                sleep(backoff, location, i, e);
            }
        }
        throw new ConnectionError(
                "Could not connect to " + location + " after " + policy.maxAttempts() + " attempt(s): "
                        + last.getMessage(),
                last,
                location,
                policy.maxAttempts());
    }

    private static void sleep(Duration backoff, String location, int attempts, Throwable cause) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionError("Interrupted while connecting to " + location, cause, location, attempts);
        }
    }
}
