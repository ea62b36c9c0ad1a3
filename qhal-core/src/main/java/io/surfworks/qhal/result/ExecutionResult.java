package io.surfworks.qhal.result;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a completed circuit execution.
 *
 * @param counts        Measurement counts
 * @param shots         Number of shots requested
 * @param executionTime Wall-clock execution time (null if not reported)
 * @param metadata      Backend-specific metadata, opaque to callers (values may be null)
 */
public record ExecutionResult(
        Counts counts,
        int shots,
        Duration executionTime,
        Map<String, Object> metadata
) {

    /**
     * The most frequent bitstring and its share of all shots.
     */
    public record MostFrequent(String bitstring, double probability) {
    }

    public ExecutionResult {
        Objects.requireNonNull(counts, "counts cannot be null");
        if (shots < 0) {
            throw new IllegalArgumentException("shots cannot be negative");
        }
        counts = counts.copy();
        // null values are allowed
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ExecutionResult of(Counts counts, int shots) {
        return new ExecutionResult(counts, shots, null, Map.of());
    }

    /**
     * Returns a copy of the counts; mutating it does not affect this result.
     */
    @Override
    public Counts counts() {
        return counts.copy();
    }

    /**
     * Returns a new result with the given execution time.
     */
    public ExecutionResult withExecutionTime(Duration time) {
        return new ExecutionResult(counts, shots, time, metadata);
    }

    /**
     * Returns a new result with one additional metadata entry.
     */
    public ExecutionResult withMetadata(String key, Object value) {
        var newMetadata = new LinkedHashMap<>(metadata);
        newMetadata.put(key, value);
        return new ExecutionResult(counts, shots, executionTime, newMetadata);
    }

    /**
     * Returns a new result with the given metadata replacing the current one.
     */
    public ExecutionResult withMetadata(Map<String, Object> newMetadata) {
        return new ExecutionResult(counts, shots, executionTime, newMetadata);
    }

    public Optional<Duration> executionTimeIfKnown() {
        return Optional.ofNullable(executionTime);
    }

    public Map<String, Double> probabilities() {
        return counts.probabilities();
    }

    /**
     * Returns the most frequent bitstring with its probability, or empty when
     * no shots were recorded.
     */
    public Optional<MostFrequent> mostFrequent() {
        long total = counts.totalShots();
        if (total == 0) {
            return Optional.empty();
        }
        return counts.mostFrequent()
                .map(o -> new MostFrequent(o.bitstring(), (double) o.count() / total));
    }

    /**
     * Returns the count recorded for a bitstring.
     */
    public long count(String bitstring) {
        return counts.get(bitstring);
    }
}
