package dev.heapqueue.core;

import dev.heapqueue.api.IsOrdered;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeapChecksTest {

    private static final IsOrdered<Integer> MIN = Orderings.minComparator();

    @Test
    void acceptsValidHeaps() {
        assertTrue(HeapChecks.isHeap(List.of(), MIN));
        assertTrue(HeapChecks.isHeap(List.of(1), MIN));
        assertTrue(HeapChecks.isHeap(List.of(1, 3, 2, 7, 4), MIN));
        assertTrue(HeapChecks.isHeap(List.of(2, 2, 2), MIN));
    }

    @Test
    void reportsFirstViolatingChild() {
        // 4 sits under 5 at index 1; 0 under 2 at index 5
        List<Integer> broken = List.of(1, 5, 2, 6, 4, 0);
        assertEquals(4, HeapChecks.firstViolation(broken, MIN));
        assertFalse(HeapChecks.isHeap(broken, MIN));
        assertEquals(1, HeapChecks.firstViolation(List.of(3, 1), MIN));
    }
}
