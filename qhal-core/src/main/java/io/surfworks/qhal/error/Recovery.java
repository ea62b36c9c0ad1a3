package io.surfworks.qhal.error;

/**
 * How a caller may recover from a failed backend operation.
 */
public enum Recovery {
    /** Safe to retry with backoff */
    TRANSIENT,

    /** Fix the input or configuration; retrying unchanged will fail again */
    PERMANENT,

    /** The job reached a final failed state; no further polling yields a result */
    TERMINAL,

    /** Classification depends on the concrete backend */
    BACKEND_DEFINED
}
