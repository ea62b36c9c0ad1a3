package io.surfworks.qhal.backend;

import java.util.Optional;

/**
 * Live availability of a backend.
 *
 * <p>A busy or offline backend is reported with this value, not with an
 * exception, so callers can tell "alive but busy" from "unreachable".
 *
 * @param available           Whether the backend currently accepts jobs
 * @param queueDepth          Jobs currently queued (null if unknown)
 * @param estimatedWaitSecs   Estimated wait for a new job in seconds (null if unknown)
 * @param statusMessage       Human-readable status (may be null)
 */
public record BackendAvailability(
        boolean available,
        Integer queueDepth,
        Double estimatedWaitSecs,
        String statusMessage
) {

    public BackendAvailability {
        if (queueDepth != null && queueDepth < 0) {
            throw new IllegalArgumentException("queueDepth cannot be negative");
        }
        if (estimatedWaitSecs != null && estimatedWaitSecs < 0) {
            throw new IllegalArgumentException("estimatedWaitSecs cannot be negative");
        }
    }

    /**
     * Always available with an empty queue, typical for simulators.
     */
    public static BackendAvailability alwaysAvailable() {
        return new BackendAvailability(true, 0, 0.0, null);
    }

    /**
     * Offline; queue depth and wait are unknown.
     */
    public static BackendAvailability unavailable(String reason) {
        return new BackendAvailability(false, null, null, reason);
    }

    /**
     * Accepting jobs with a known queue.
     */
    public static BackendAvailability queued(int queueDepth, double estimatedWaitSecs) {
        return new BackendAvailability(true, queueDepth, estimatedWaitSecs, null);
    }

    public Optional<Integer> queueDepthIfKnown() {
        return Optional.ofNullable(queueDepth);
    }

    public Optional<Double> estimatedWaitIfKnown() {
        return Optional.ofNullable(estimatedWaitSecs);
    }

    public Optional<String> statusMessageIfPresent() {
        return Optional.ofNullable(statusMessage);
    }
}
