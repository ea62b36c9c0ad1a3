package io.surfworks.qhal.job;

/**
 * Possible states of a job during its lifecycle.
 *
 * <pre>
 *   submit() --> QUEUED --> RUNNING --> COMPLETED
 *                  |           |
 *                  |           +------> FAILED
 *                  |           |
 *                  +-----------+------> CANCELLED
 * </pre>
 *
 * Transitions never move backward and terminal states are permanent.
 */
public enum JobState {
    /** Job is waiting in the backend queue */
    QUEUED,

    /** Job is currently executing */
    RUNNING,

    /** Job finished successfully */
    COMPLETED,

    /** Job finished with an error */
    FAILED,

    /** Job was cancelled */
    CANCELLED;

    /**
     * Returns true if this is a terminal state (job will not change state again).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns true if the job is still queued or running.
     */
    public boolean isPending() {
        return this == QUEUED || this == RUNNING;
    }

    /**
     * Returns true if this state indicates successful completion.
     */
    public boolean isSuccess() {
        return this == COMPLETED;
    }

    /**
     * Returns true if a job in this state may next be observed in {@code next}.
     */
    public boolean canTransitionTo(JobState next) {
        if (next == this) {
            return true;
        }
        return switch (this) {
            case QUEUED -> next != QUEUED;
            case RUNNING -> next.isTerminal();
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
