package io.surfworks.qhal.result;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CountsTest {

    @Test
    void insertAccumulates() {
        Counts counts = new Counts();
        counts.insert("101", 3);
        counts.insert("101", 2);

        assertEquals(5, counts.get("101"));
        assertEquals(5, counts.totalShots());
        assertEquals(1, counts.size());
    }

    @Test
    void unseenBitstringCountsZero() {
        Counts counts = Counts.fromMap(Map.of("00", 10));
        assertEquals(0, counts.get("11"));
    }

    @Test
    void emptyCountsHaveNoProbabilities() {
        Counts counts = new Counts();

        assertTrue(counts.probabilities().isEmpty());
        assertTrue(counts.mostFrequent().isEmpty());
        assertEquals(0, counts.totalShots());
        assertEquals(0, counts.width());
    }

    @Test
    void zeroTotalHasNoProbabilities() {
        Counts counts = new Counts();
        counts.insert("0", 0);

        assertTrue(counts.probabilities().isEmpty());
    }

    @Test
    void probabilitiesSumToOne() {
        Counts counts = Counts.fromMap(Map.of("00", 250, "11", 750));
        Map<String, Double> probs = counts.probabilities();

        assertEquals(0.25, probs.get("00"), 1e-12);
        assertEquals(0.75, probs.get("11"), 1e-12);
        assertEquals(1.0, probs.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-12);
    }

    @Test
    void mostFrequentPicksHighestCount() {
        Counts counts = Counts.fromMap(Map.of("00", 100, "11", 900));

        Counts.Outcome top = counts.mostFrequent().orElseThrow();
        assertEquals("11", top.bitstring());
        assertEquals(900, top.count());
    }

    @Test
    void mostFrequentTieGoesToSmallestBitstring() {
        Counts counts = new Counts();
        counts.insert("11", 500);
        counts.insert("00", 500);

        assertEquals("00", counts.mostFrequent().orElseThrow().bitstring());
    }

    @Test
    void sortedByCountDescending() {
        Counts counts = Counts.fromMap(Map.of("00", 5, "01", 20, "10", 5, "11", 70));
        List<Counts.Outcome> sorted = counts.sorted();

        assertEquals(List.of(
                new Counts.Outcome("11", 70),
                new Counts.Outcome("01", 20),
                new Counts.Outcome("00", 5),
                new Counts.Outcome("10", 5)), sorted);
    }

    @Test
    void rejectsNonBinaryAndMixedWidths() {
        Counts counts = new Counts();
        counts.insert("01", 1);

        assertThrows(IllegalArgumentException.class, () -> counts.insert("012", 1));
        assertThrows(IllegalArgumentException.class, () -> counts.insert("0a", 1));
        assertThrows(IllegalArgumentException.class, () -> counts.insert("011", 1));
        assertThrows(IllegalArgumentException.class, () -> counts.insert("", 1));
        assertThrows(IllegalArgumentException.class, () -> counts.insert("10", -1));
        assertEquals(2, counts.width());
    }

    @Test
    void copyIsIndependent() {
        Counts original = Counts.fromMap(Map.of("0", 1));
        Counts copy = original.copy();
        copy.insert("1", 4);

        assertEquals(1, original.totalShots());
        assertEquals(5, copy.totalShots());
        assertNotEquals(original, copy);
    }

    @Test
    void asMapIsReadOnly() {
        Counts counts = Counts.fromMap(Map.of("0", 1));
        assertThrows(UnsupportedOperationException.class, () -> counts.asMap().put("1", 1L));
    }
}
