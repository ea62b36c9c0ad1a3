package io.surfworks.qhal.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Measurement counts from circuit execution.
 *
 * <p>Maps fixed-width bitstrings to occurrence counts. The rightmost character
 * is qubit 0, so {@code "01"} means qubit 0 measured 1 and qubit 1 measured 0.
 * Inserting the same bitstring again adds to its count.
 *
 * <p>Not thread-safe. A {@code Counts} returned by a backend belongs to the caller.
 */
public final class Counts {

    /**
     * A bitstring with its count.
     */
    public record Outcome(String bitstring, long count) {
    }

    // sorted so iteration, and therefore tie-breaking, is platform independent
    private final TreeMap<String, Long> counts = new TreeMap<>();

    public Counts() {
    }

    /**
     * Creates counts from a map; equivalent to inserting every entry.
     */
    public static Counts fromMap(Map<String, ? extends Number> source) {
        Counts result = new Counts();
        source.forEach((bitstring, count) -> result.insert(bitstring, count.longValue()));
        return result;
    }

    /**
     * Returns an independent copy.
     */
    public Counts copy() {
        Counts result = new Counts();
        result.counts.putAll(counts);
        return result;
    }

    /**
     * Adds {@code count} occurrences of {@code bitstring}.
     *
     * @throws IllegalArgumentException if the bitstring is not binary, its width
     *                                  differs from existing entries, or count is negative
     */
    public void insert(String bitstring, long count) {
        Objects.requireNonNull(bitstring, "bitstring cannot be null");
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
        requireBinary(bitstring);
        if (!counts.isEmpty()) {
            int width = counts.firstKey().length();
            if (bitstring.length() != width) {
                throw new IllegalArgumentException(
                        "bitstring '" + bitstring + "' has width " + bitstring.length() + ", expected " + width);
            }
        }
        counts.merge(bitstring, count, Long::sum);
    }

    /**
     * Returns the count for a bitstring (0 if never observed).
     */
    public long get(String bitstring) {
        return counts.getOrDefault(bitstring, 0L);
    }

    /**
     * Returns the sum of all counts.
     */
    public long totalShots() {
        long total = 0;
        for (long c : counts.values()) {
            total += c;
        }
        return total;
    }

    /**
     * Returns the bitstring with the highest count.
     *
     * <p>Ties go to the lexicographically smallest bitstring.
     */
    public Optional<Outcome> mostFrequent() {
        Map.Entry<String, Long> best = null;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (best == null || entry.getValue() > best.getValue()) {
                best = entry;
            }
        }
        return best == null ? Optional.empty() : Optional.of(new Outcome(best.getKey(), best.getValue()));
    }

    /**
     * Returns count / total for each bitstring, or an empty map when the total is 0.
     */
    public Map<String, Double> probabilities() {
        long total = totalShots();
        if (total == 0) {
            return Map.of();
        }
        Map<String, Double> result = new LinkedHashMap<>();
        counts.forEach((bitstring, count) -> result.put(bitstring, (double) count / total));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Returns outcomes ordered by count, highest first. Equal counts keep
     * lexicographic order.
     */
    public List<Outcome> sorted() {
        List<Outcome> outcomes = new ArrayList<>(counts.size());
        counts.forEach((bitstring, count) -> outcomes.add(new Outcome(bitstring, count)));
        outcomes.sort(Comparator.comparingLong(Outcome::count).reversed());
        return outcomes;
    }

    /**
     * Returns a read-only view of the bitstring to count mapping.
     */
    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    /**
     * Returns the bitstring width, or 0 when empty.
     */
    public int width() {
        return counts.isEmpty() ? 0 : counts.firstKey().length();
    }

    /**
     * Returns the number of distinct bitstrings.
     */
    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Counts other)) return false;
        return counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }

    private static void requireBinary(String bitstring) {
        if (bitstring.isEmpty()) {
            throw new IllegalArgumentException("bitstring cannot be empty");
        }
        for (int i = 0; i < bitstring.length(); i++) {
            char c = bitstring.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("bitstring must contain only 0 and 1: " + bitstring);
            }
        }
    }
}
