package io.surfworks.qhal.wait;

import io.surfworks.qhal.error.HalException;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Retries backend calls that fail with a transient error kind
 * (BACKEND_UNAVAILABLE, TIMEOUT). Every other kind propagates on the first failure.
 */
public final class Retrier {

    private static final Logger LOG = Logger.getLogger(Retrier.class.getName());

    /**
     * A backend call that may fail with a {@link HalException}.
     */
    @FunctionalInterface
    public interface HalCall<T> {
        T call() throws HalException;
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public Retrier(RetryPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    public Retrier(RetryPolicy policy) {
        this(policy, Sleeper.system());
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Runs {@code operation}, retrying transient failures with backoff.
     *
     * @return the first successful result
     * @throws HalException the last transient failure once retries are exhausted,
     *                      or the first non-transient failure
     */
    public <T> T call(HalCall<T> operation) throws HalException {
        return call(operation, CancellationToken.create());
    }

    public <T> T call(HalCall<T> operation, CancellationToken token) throws HalException {
        int retry = 0;
        while (true) {
            try {
                return operation.call();
            } catch (HalException e) {
                if (!e.isTransient() || retry >= policy.maxRetries()) {
                    throw e;
                }
                retry++;
                Duration backoff = policy.backoff(retry);
                final int attempt = retry;
                LOG.warning(() -> "Transient failure (" + e.getMessage() + "), retry "
                        + attempt + "/" + policy.maxRetries() + " in " + backoff.toMillis() + " ms");
                sleepBackoff(backoff, token, e);
            }
        }
    }

    private void sleepBackoff(Duration backoff, CancellationToken token, HalException last) {
        if (token.isCancelled()) {
            throw new WaitCancelledException("Retry cancelled after: " + last.getMessage(), last);
        }
        try {
            sleeper.sleep(backoff, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WaitCancelledException("Interrupted while backing off", e);
        }
        if (token.isCancelled()) {
            throw new WaitCancelledException("Retry cancelled after: " + last.getMessage(), last);
        }
    }
}
