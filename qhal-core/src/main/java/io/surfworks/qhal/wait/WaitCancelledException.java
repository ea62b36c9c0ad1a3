package io.surfworks.qhal.wait;

/**
 * Thrown when the caller stops waiting on a job.
 *
 * <p>This is a clean cancellation signal raised by an explicitly cancelled
 * {@link CancellationToken} or by thread interruption. It is not a backend
 * failure: the job itself keeps running unless the caller separately cancels it.
 */
public class WaitCancelledException extends RuntimeException {

    public WaitCancelledException(String message) {
        super(message);
    }

    public WaitCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
