package io.datawrangle.core.connector;

import java.time.Duration;
import java.util.Objects;

/**
 * Connector open retry budget: at most {@code maxAttempts} tries, waiting
 * {@code initialBackoff * multiplier^(attempt-1)} between them.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {

    private static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(200), 2.0);
    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
    }

    /** Three attempts, 200 ms initial backoff, doubling. */
    public static RetryPolicy defaults() {
        return DEFAULT;
    }

    /** A single attempt. */
    public static RetryPolicy none() {
        return NONE;
    }

    /** Delay before attempt {@code attempt + 1}, for {@code attempt >= 1}. */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, attempt - 1);
        return Duration.ofNanos((long) (initialBackoff.toNanos() * factor));
    }
}
