package io.docfeed.cluster.membership.hash;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class HashingProviderTest {

    private static final List<String> NODES = List.of("A", "B", "C");

    @Test
    void emptyCandidatesHaveNoPrimary() {
        assertNull(HashingProvider.primary(1L, List.of()));
    }

    @Test
    void orderOfCandidatesDoesNotMatter() {
        for (long key = 0; key < 200; key++) {
            assertEquals(HashingProvider.primary(key, NODES), HashingProvider.primary(key, List.of("C", "A", "B")));
        }
    }

    @Test
    void keysSpreadOverAllNodes() {
        final Map<String, Integer> counts = new HashMap<>();
        for (long key = 1; key <= 3_000; key++) {
            counts.merge(HashingProvider.primary(key, NODES), 1, Integer::sum);
        }
        assertEquals(3, counts.size());
        counts.values().forEach(c -> assertTrue(c > 600, "skewed distribution " + counts));
    }

    @Test
    void removingANodeOnlyMovesItsKeys() {
        for (long key = 1; key <= 1_000; key++) {
            final String before = HashingProvider.primary(key, NODES);
            final String after = HashingProvider.primary(key, List.of("A", "C"));
            if (!before.equals("B")) {
                assertEquals(before, after, "key " + key + " moved although its node stayed");
            }
        }
    }
}
