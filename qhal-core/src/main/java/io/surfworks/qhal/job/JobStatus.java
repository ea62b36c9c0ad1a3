package io.surfworks.qhal.job;

import java.time.Instant;
import java.util.Objects;

/**
 * Observed status of a submitted job.
 *
 * @param state      Current state of the job
 * @param message    Failure reason for FAILED jobs, otherwise a short description
 * @param observedAt When the backend reported this state
 */
public record JobStatus(
        JobState state,
        String message,
        Instant observedAt
) {

    public JobStatus {
        Objects.requireNonNull(state, "state cannot be null");
        message = message == null ? state.name() : message;
        observedAt = observedAt == null ? Instant.now() : observedAt;
    }

    public static JobStatus of(JobState state) {
        return new JobStatus(state, null, null);
    }

    public static JobStatus queued() {
        return new JobStatus(JobState.QUEUED, "Waiting in queue", null);
    }

    public static JobStatus running() {
        return new JobStatus(JobState.RUNNING, "Executing", null);
    }

    public static JobStatus completed() {
        return new JobStatus(JobState.COMPLETED, "Completed successfully", null);
    }

    public static JobStatus failed(String reason) {
        return new JobStatus(JobState.FAILED, reason, null);
    }

    public static JobStatus cancelled() {
        return new JobStatus(JobState.CANCELLED, "Cancelled", null);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isPending() {
        return state.isPending();
    }

    public boolean isSuccess() {
        return state.isSuccess();
    }

    @Override
    public String toString() {
        if (state == JobState.FAILED) {
            return "FAILED: " + message;
        }
        return state.name();
    }
}
