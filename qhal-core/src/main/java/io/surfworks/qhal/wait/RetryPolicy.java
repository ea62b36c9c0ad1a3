package io.surfworks.qhal.wait;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for retrying operations that failed transiently.
 *
 * @param maxRetries      Retries after the first attempt (0 disables retrying)
 * @param initialInterval Backoff before the first retry
 * @param multiplier      Factor applied to the backoff after each retry
 * @param maxInterval     Upper bound on any single backoff
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialInterval,
        double multiplier,
        Duration maxInterval
) {

    public RetryPolicy {
        Objects.requireNonNull(initialInterval, "initialInterval cannot be null");
        Objects.requireNonNull(maxInterval, "maxInterval cannot be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
        if (initialInterval.isNegative() || maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("intervals must satisfy 0 <= initialInterval <= maxInterval");
        }
    }

    /**
     * 3 retries, starting at 1 second, doubling, capped at 60 seconds.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));
    }

    /**
     * Never retries.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Returns the backoff before retry number {@code retry} (1-based).
     */
    public Duration backoff(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry is 1-based, got " + retry);
        }
        double millis = initialInterval.toMillis() * Math.pow(multiplier, retry - 1);
        if (millis >= maxInterval.toMillis()) {
            return maxInterval;
        }
        return Duration.ofMillis((long) millis);
    }
}
