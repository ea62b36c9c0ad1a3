package io.surfworks.qhal.backend;

import io.surfworks.qhal.capability.Capabilities;
import io.surfworks.qhal.error.HalException;
import io.surfworks.qhal.job.JobId;
import io.surfworks.qhal.job.JobStatus;
import io.surfworks.qhal.result.ExecutionResult;
import io.surfworks.qhal.wait.JobWaiter;

/**
 * Service Provider Interface for quantum backends (hardware devices and simulators).
 *
 * <p>The lifecycle is:
 * <pre>
 *   capabilities() --> validate() --> submit() --> status() --> result()
 * </pre>
 *
 * <p>{@link #name()} and {@link #capabilities()} never block. Every other
 * operation may block on I/O and fails with a {@link HalException} carrying
 * exactly one error kind.
 *
 * <p>Implementations must be thread-safe: {@code status}, {@code result} and
 * {@code cancel} may be called concurrently for different jobs, and
 * {@code status} repeatedly and concurrently for the same job.
 *
 * @param <C> the circuit representation, opaque to callers of this interface
 */
public interface Backend<C> extends AutoCloseable {

    /**
     * Returns the stable name of this backend. Never fails.
     */
    String name();

    /**
     * Returns the capabilities of this backend.
     *
     * <p>Must be served from a value computed at construction; never performs I/O.
     */
    Capabilities capabilities();

    /**
     * Reports live availability and queue information.
     *
     * <p>A busy or offline backend is a valid {@link BackendAvailability}, not an error.
     *
     * @throws HalException for failures such as AUTHENTICATION_FAILED or CONFIGURATION
     */
    BackendAvailability availability() throws HalException;

    /**
     * Checks a circuit against this backend's constraints.
     *
     * @param circuit the circuit to check
     * @return valid, invalid with reasons, or needs-transpilation
     * @throws HalException if the check itself could not be performed
     */
    ValidationResult validate(C circuit) throws HalException;

    /**
     * Submits a circuit for execution.
     *
     * <p>When this returns, {@link #status(JobId)} already reports the job as
     * QUEUED (or a later state).
     *
     * @param circuit the circuit to run
     * @param shots   number of repetitions, in {@code 1..capabilities().maxShots()}
     * @return the identifier of the new job
     * @throws HalException INVALID_SHOTS for an out-of-range shot count;
     *                      INVALID_CIRCUIT, CIRCUIT_TOO_LARGE or UNSUPPORTED for a
     *                      circuit that fails validation
     */
    JobId submit(C circuit, int shots) throws HalException;

    /**
     * Gets the current status of a job.
     *
     * @throws HalException JOB_NOT_FOUND for an identifier this backend never issued
     */
    JobStatus status(JobId jobId) throws HalException;

    /**
     * Gets the result of a completed job.
     *
     * @throws HalException JOB_NOT_FOUND for an unknown identifier; a deterministic
     *                      error if the job is not COMPLETED
     */
    ExecutionResult result(JobId jobId) throws HalException;

    /**
     * Cancels a queued or running job. Best-effort; cancelling a job that is
     * already terminal is a no-op.
     *
     * @throws HalException JOB_NOT_FOUND for an unknown identifier
     */
    void cancel(JobId jobId) throws HalException;

    /**
     * Waits for a job to finish and returns its result.
     *
     * <p>Polls with the default {@link JobWaiter} (500 ms interval, 600 polls).
     * Backends with push-based completion may override.
     *
     * @throws HalException JOB_FAILED, JOB_CANCELLED, TIMEOUT, or any error from
     *                      {@link #status(JobId)} or {@link #result(JobId)}
     */
    default ExecutionResult awaitResult(JobId jobId) throws HalException {
        return JobWaiter.defaults().await(this, jobId);
    }

    /**
     * Releases resources held by this backend.
     */
    @Override
    default void close() {
    }
}
