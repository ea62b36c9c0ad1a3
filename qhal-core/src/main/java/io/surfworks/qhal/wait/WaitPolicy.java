package io.surfworks.qhal.wait;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling policy for waiting on a job.
 *
 * @param pollInterval Time between status polls
 * @param maxPolls     Number of non-terminal polls after which waiting times out
 */
public record WaitPolicy(Duration pollInterval, int maxPolls) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_POLLS = 600;

    public WaitPolicy {
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval cannot be negative");
        }
        if (maxPolls < 1) {
            throw new IllegalArgumentException("maxPolls must be positive");
        }
    }

    /**
     * 500 ms interval, 600 polls (about five minutes).
     */
    public static WaitPolicy defaults() {
        return new WaitPolicy(DEFAULT_POLL_INTERVAL, DEFAULT_MAX_POLLS);
    }

    /**
     * Returns the total time spent sleeping before a timeout.
     */
    public Duration maxWait() {
        return pollInterval.multipliedBy(maxPolls);
    }

    public WaitPolicy withPollInterval(Duration interval) {
        return new WaitPolicy(interval, maxPolls);
    }

    public WaitPolicy withMaxPolls(int polls) {
        return new WaitPolicy(pollInterval, polls);
    }
}
