package io.surfworks.qhal.wait;

import java.time.Duration;

/**
 * Suspends the calling thread between polls.
 *
 * <p>Replaceable so tests can drive waiting with a simulated clock.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps for {@code duration}, returning early if {@code token} is cancelled.
     *
     * @throws InterruptedException if the thread is interrupted while sleeping
     */
    void sleep(Duration duration, CancellationToken token) throws InterruptedException;

    /**
     * Real-time sleeper that wakes as soon as the token is cancelled.
     */
    static Sleeper system() {
        return (duration, token) -> token.awaitCancellation(duration);
    }
}
