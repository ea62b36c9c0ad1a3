package io.surfworks.qhal.wait;

import io.surfworks.qhal.backend.Backend;
import io.surfworks.qhal.error.HalException;
import io.surfworks.qhal.job.JobId;
import io.surfworks.qhal.job.JobStatus;
import io.surfworks.qhal.result.ExecutionResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Waits for a job to reach a terminal state by polling
 * {@link Backend#status(JobId)}, using nothing but the contract's primitives.
 *
 * <p>Algorithm, per poll:
 * <ol>
 *   <li>COMPLETED: fetch and return {@link Backend#result(JobId)}</li>
 *   <li>FAILED: throw JOB_FAILED with the backend's reason</li>
 *   <li>CANCELLED: throw JOB_CANCELLED</li>
 *   <li>QUEUED or RUNNING: sleep the poll interval and poll again</li>
 * </ol>
 * After {@link WaitPolicy#maxPolls()} non-terminal polls it throws TIMEOUT.
 *
 * <p>The {@link CancellationToken} is checked before every poll and every
 * sleep. An explicit cancel or a thread interrupt raises
 * {@link WaitCancelledException}; an expired deadline raises TIMEOUT. Neither
 * cancels the job.
 */
public final class JobWaiter {

    private static final Logger LOG = Logger.getLogger(JobWaiter.class.getName());
    private static final JobWaiter DEFAULT = new JobWaiter(WaitPolicy.defaults(), Sleeper.system());

    private final WaitPolicy policy;
    private final Sleeper sleeper;

    public JobWaiter(WaitPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    public JobWaiter(WaitPolicy policy) {
        this(policy, Sleeper.system());
    }

    /**
     * Returns the waiter with the default policy (500 ms, 600 polls) and real-time sleeping.
     */
    public static JobWaiter defaults() {
        return DEFAULT;
    }

    public WaitPolicy policy() {
        return policy;
    }

    /**
     * Blocks until the job finishes, without a caller deadline.
     */
    public <C> ExecutionResult await(Backend<C> backend, JobId jobId) throws HalException {
        return await(backend, jobId, CancellationToken.create());
    }

    /**
     * Blocks until the job finishes, the poll budget runs out, or the token stops the wait.
     *
     * @return the job's result once it is COMPLETED
     * @throws HalException            JOB_FAILED, JOB_CANCELLED, TIMEOUT, or any error
     *                                 raised by the backend's status or result calls
     * @throws WaitCancelledException  if the token is cancelled or the thread is interrupted
     */
    public <C> ExecutionResult await(Backend<C> backend, JobId jobId, CancellationToken token) throws HalException {
        Objects.requireNonNull(backend, "backend cannot be null");
        Objects.requireNonNull(jobId, "jobId cannot be null");
        Objects.requireNonNull(token, "token cannot be null");

        for (int poll = 1; poll <= policy.maxPolls(); poll++) {
            checkToken(token, jobId);
            JobStatus status = backend.status(jobId);
            ExecutionResult result = onStatus(backend, jobId, status, poll);
            if (result != null) {
                return result;
            }

            checkToken(token, jobId);
            try {
                sleeper.sleep(policy.pollInterval(), token);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WaitCancelledException("Interrupted while waiting for job " + jobId, e);
            }
        }

        LOG.warning(() -> "Job " + jobId + " on " + backend.name()
                + " still pending after " + policy.maxPolls() + " polls");
        throw HalException.timeout(jobId.value());
    }

    /**
     * Waits without blocking a thread: each poll is scheduled on
     * {@code scheduler}, one poll interval after the previous one.
     *
     * <p>Cancelling the returned future stops polling; the job keeps running.
     */
    public <C> CompletableFuture<ExecutionResult> awaitAsync(
            Backend<C> backend, JobId jobId, ScheduledExecutorService scheduler) {
        return awaitAsync(backend, jobId, scheduler, CancellationToken.create());
    }

    public <C> CompletableFuture<ExecutionResult> awaitAsync(
            Backend<C> backend, JobId jobId, ScheduledExecutorService scheduler, CancellationToken token) {
        Objects.requireNonNull(backend, "backend cannot be null");
        Objects.requireNonNull(jobId, "jobId cannot be null");
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        Objects.requireNonNull(token, "token cannot be null");

        CompletableFuture<ExecutionResult> future = new CompletableFuture<>();
        new AsyncPoll<>(backend, jobId, scheduler, token, future).schedule(0);
        return future;
    }

    private <C> ExecutionResult onStatus(Backend<C> backend, JobId jobId, JobStatus status, int poll)
            throws HalException {
        LOG.fine(() -> "Poll " + poll + "/" + policy.maxPolls() + " for job " + jobId + ": " + status);
        return switch (status.state()) {
            case COMPLETED -> backend.result(jobId);
            case FAILED -> throw HalException.jobFailed(status.message());
            case CANCELLED -> throw HalException.jobCancelled(jobId.value());
            case QUEUED, RUNNING -> null;
        };
    }

    private static void checkToken(CancellationToken token, JobId jobId) throws HalException {
        if (token.isCancelled()) {
            throw new WaitCancelledException("Wait for job " + jobId + " was cancelled");
        }
        if (token.isExpired()) {
            throw HalException.timeout(jobId.value());
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new WaitCancelledException("Interrupted while waiting for job " + jobId);
        }
    }

    /**
     * One asynchronous wait. Each run performs a single poll and either
     * completes the future or schedules the next run.
     */
    private final class AsyncPoll<C> implements Runnable {
        private final Backend<C> backend;
        private final JobId jobId;
        private final ScheduledExecutorService scheduler;
        private final CancellationToken token;
        private final CompletableFuture<ExecutionResult> future;
        private int polls;

        AsyncPoll(Backend<C> backend, JobId jobId, ScheduledExecutorService scheduler,
                  CancellationToken token, CompletableFuture<ExecutionResult> future) {
            this.backend = backend;
            this.jobId = jobId;
            this.scheduler = scheduler;
            this.token = token;
            this.future = future;
        }

        void schedule(long delayNanos) {
            try {
                scheduler.schedule(this, delayNanos, TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                future.completeExceptionally(e);
            }
        }

        @Override
        public void run() {
            if (future.isDone()) {
                return;
            }
            try {
                checkToken(token, jobId);
                polls++;
                ExecutionResult result = onStatus(backend, jobId, backend.status(jobId), polls);
                if (result != null) {
                    future.complete(result);
                } else if (polls >= policy.maxPolls()) {
                    throw HalException.timeout(jobId.value());
                } else {
                    schedule(policy.pollInterval().toNanos());
                }
            } catch (HalException | RuntimeException e) {
                LOG.log(Level.FINE, "Async wait for job " + jobId + " ended with " + e, e);
                future.completeExceptionally(e);
            }
        }
    }
}
