package io.surfworks.qhal.error;

import java.util.Objects;

/**
 * Exception thrown when a backend operation fails.
 *
 * <p>Every failure carries exactly one {@link HalErrorKind}. Callers should
 * branch on {@link #kind()} rather than on the message text.
 */
public class HalException extends Exception {

    private final HalErrorKind kind;
    private final String detail;

    public HalException(HalErrorKind kind, String detail) {
        super(format(kind, detail));
        this.kind = kind;
        this.detail = detail;
    }

    public HalException(HalErrorKind kind, String detail, Throwable cause) {
        super(format(kind, detail), cause);
        this.kind = kind;
        this.detail = detail;
    }

    public static HalException backendUnavailable(String reason) {
        return new HalException(HalErrorKind.BACKEND_UNAVAILABLE, reason);
    }

    public static HalException timeout(String jobId) {
        return new HalException(HalErrorKind.TIMEOUT, jobId);
    }

    public static HalException invalidCircuit(String reason) {
        return new HalException(HalErrorKind.INVALID_CIRCUIT, reason);
    }

    public static HalException circuitTooLarge(String reason) {
        return new HalException(HalErrorKind.CIRCUIT_TOO_LARGE, reason);
    }

    public static HalException invalidShots(String reason) {
        return new HalException(HalErrorKind.INVALID_SHOTS, reason);
    }

    public static HalException unsupported(String feature) {
        return new HalException(HalErrorKind.UNSUPPORTED, feature);
    }

    public static HalException submissionFailed(String reason, Throwable cause) {
        return new HalException(HalErrorKind.SUBMISSION_FAILED, reason, cause);
    }

    public static HalException jobFailed(String reason) {
        return new HalException(HalErrorKind.JOB_FAILED, reason);
    }

    public static HalException jobCancelled(String jobId) {
        return new HalException(HalErrorKind.JOB_CANCELLED, jobId);
    }

    public static HalException jobNotFound(String jobId) {
        return new HalException(HalErrorKind.JOB_NOT_FOUND, jobId);
    }

    public static HalException authenticationFailed(String reason) {
        return new HalException(HalErrorKind.AUTHENTICATION_FAILED, reason);
    }

    public static HalException configuration(String reason) {
        return new HalException(HalErrorKind.CONFIGURATION, reason);
    }

    public static HalException backend(String reason) {
        return new HalException(HalErrorKind.BACKEND, reason);
    }

    /**
     * Returns the failure kind.
     */
    public HalErrorKind kind() {
        return kind;
    }

    /**
     * Returns the recovery class of the failure kind.
     */
    public Recovery recovery() {
        return kind.recovery();
    }

    /**
     * Returns the detail text without the kind prefix (may be null).
     */
    public String detail() {
        return detail;
    }

    /**
     * Returns true if the operation may succeed on retry.
     */
    public boolean isTransient() {
        return kind.isTransient();
    }

    /**
     * Returns true if the job will never produce a result.
     */
    public boolean isTerminal() {
        return kind.recovery() == Recovery.TERMINAL;
    }

    private static String format(HalErrorKind kind, String detail) {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (detail == null || detail.isBlank()) {
            return kind.label();
        }
        return kind.label() + ": " + detail;
    }
}
