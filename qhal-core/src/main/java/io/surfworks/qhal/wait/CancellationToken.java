package io.surfworks.qhal.wait;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-side cancellation for waiting operations.
 *
 * <p>A token may carry a deadline and may be cancelled explicitly from any
 * thread. Cancelling a token stops the wait that observes it; it never cancels
 * the backend job itself.
 *
 * <p>Example usage:
 * <pre>{@code
 * CancellationToken token = CancellationToken.withTimeout(Duration.ofMinutes(2));
 * try {
 *     ExecutionResult result = JobWaiter.defaults().await(backend, jobId, token);
 * } catch (WaitCancelledException e) {
 *     // caller gave up; the job keeps running
 * }
 * }</pre>
 */
public final class CancellationToken {

    private final Instant deadline;
    private final Clock clock;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Creates a token with no deadline that is only cancelled explicitly.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    /**
     * Creates a token that expires at an absolute instant.
     */
    public static CancellationToken withDeadline(Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        Objects.requireNonNull(deadline, "deadline cannot be null");
        return new CancellationToken(deadline, clock);
    }

    /**
     * Creates a token that expires after {@code timeout}.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout, Clock clock) {
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    /**
     * Cancels this token. Waits observing it stop at their next check.
     */
    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Returns true if the deadline has passed.
     */
    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Returns the time until the deadline, or null if there is none.
     * May be negative once the deadline has passed.
     */
    public Duration remaining() {
        return deadline == null ? null : Duration.between(clock.instant(), deadline);
    }

    /**
     * Blocks for up to {@code duration}, or until cancelled or the deadline passes.
     *
     * @return true if the token was cancelled while waiting
     * @throws InterruptedException if the thread is interrupted
     */
    public boolean awaitCancellation(Duration duration) throws InterruptedException {
        Duration wait = duration;
        Duration left = remaining();
        if (left != null && left.compareTo(wait) < 0) {
            wait = left.isNegative() ? Duration.ZERO : left;
        }
        return cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS);
    }
}
