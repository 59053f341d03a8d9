package dev.heapqueue.config;

import dev.heapqueue.core.BinaryHeapQueue;
import dev.heapqueue.core.Orderings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeapConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("hq.initialCapacity");
        System.clearProperty("hq.verifyInvariants");
    }

    @Test
    void defaults() {
        HeapConfig cfg = new HeapConfig();
        assertEquals(16, cfg.getInitialCapacity());
        assertFalse(cfg.isVerifyInvariants());
    }

    @Test
    void chainedSetters() {
        HeapConfig cfg = new HeapConfig().setInitialCapacity(128).setVerifyInvariants(true);
        assertEquals(128, cfg.getInitialCapacity());
        assertTrue(cfg.isVerifyInvariants());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("hq.initialCapacity", "64");
        System.setProperty("hq.verifyInvariants", "true");
        HeapConfig cfg = new HeapConfig();
        assertEquals(64, cfg.getInitialCapacity());
        assertTrue(cfg.isVerifyInvariants());
    }

    @Test
    void malformedPropertyFallsBackToDefault() {
        System.setProperty("hq.initialCapacity", "lots");
        assertEquals(16, new HeapConfig().getInitialCapacity());
    }

    @Test
    void negativeCapacityPropertyFallsBackToDefault() {
        System.setProperty("hq.initialCapacity", "-5");
        HeapConfig cfg = new HeapConfig();
        assertEquals(16, cfg.getInitialCapacity());

        // queues built from the property-derived config still construct
        BinaryHeapQueue<Integer> queue = new BinaryHeapQueue<>(Orderings.<Integer>minComparator(), cfg);
        queue.push(1);
        assertEquals(1, queue.count());
    }

    @Test
    void zeroCapacityPropertyIsAccepted() {
        System.setProperty("hq.initialCapacity", "0");
        assertEquals(0, new HeapConfig().getInitialCapacity());
    }
}
