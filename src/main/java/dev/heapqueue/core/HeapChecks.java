package dev.heapqueue.core;

import dev.heapqueue.api.IsOrdered;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class HeapChecks {

    private static final Logger logger = LoggerFactory.getLogger(HeapChecks.class);

    /**
     * Finds the first position whose element is not ordered after its parent.
     *
     * @param elements  heap in array form, children of {@code i} at {@code 2i+1} and {@code 2i+2}
     * @param isOrdered the predicate the heap was built with
     * @return the offending child index, or -1 if the heap property holds everywhere
     */
    public static <T> int firstViolation(List<T> elements, IsOrdered<? super T> isOrdered) {
        for (int child = 1; child < elements.size(); child++) {
            int parent = (child - 1) >>> 1;
            if (!isOrdered.inOrder(elements.get(parent), elements.get(child))) {
                logger.trace("Heap property broken between parent {} and child {}", parent, child);
                return child;
            }
        }
        return -1;
    }

    public static <T> boolean isHeap(List<T> elements, IsOrdered<? super T> isOrdered) {
        return firstViolation(elements, isOrdered) < 0;
    }
}
