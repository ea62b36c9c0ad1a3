package io.surfworks.qhal.error;

/**
 * Closed set of failure kinds a backend operation may report.
 */
public enum HalErrorKind {
    BACKEND_UNAVAILABLE("Backend not available", Recovery.TRANSIENT),
    TIMEOUT("Timeout waiting for job", Recovery.TRANSIENT),
    INVALID_CIRCUIT("Invalid circuit", Recovery.PERMANENT),
    CIRCUIT_TOO_LARGE("Circuit exceeds backend capabilities", Recovery.PERMANENT),
    INVALID_SHOTS("Invalid shots", Recovery.PERMANENT),
    UNSUPPORTED("Unsupported feature", Recovery.PERMANENT),
    SUBMISSION_FAILED("Job submission failed", Recovery.BACKEND_DEFINED),
    JOB_FAILED("Job failed", Recovery.TERMINAL),
    JOB_CANCELLED("Job cancelled", Recovery.TERMINAL),
    JOB_NOT_FOUND("Job not found", Recovery.PERMANENT),
    AUTHENTICATION_FAILED("Authentication failed", Recovery.PERMANENT),
    CONFIGURATION("Configuration error", Recovery.PERMANENT),
    BACKEND("Backend error", Recovery.BACKEND_DEFINED);

    private final String label;
    private final Recovery recovery;

    HalErrorKind(String label, Recovery recovery) {
        this.label = label;
        this.recovery = recovery;
    }

    /**
     * Returns the human-readable prefix used in exception messages.
     */
    public String label() {
        return label;
    }

    /**
     * Returns the recovery class of this kind.
     */
    public Recovery recovery() {
        return recovery;
    }

    /**
     * Returns true if a generic retry layer may act on this kind automatically.
     */
    public boolean isTransient() {
        return recovery == Recovery.TRANSIENT;
    }
}
