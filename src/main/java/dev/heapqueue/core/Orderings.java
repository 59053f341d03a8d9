package dev.heapqueue.core;

import dev.heapqueue.api.IsOrdered;

import java.util.Comparator;
import java.util.Objects;

/**
 * Stock {@link IsOrdered} predicates.
 */
public final class Orderings {

    private Orderings() {
    }

    /**
     * Min-value ordering: {@code a <= b}.
     */
    public static <E extends Comparable<? super E>> IsOrdered<E> minComparator() {
        return (a, b) -> a.compareTo(b) <= 0;
    }

    /**
     * Max-value ordering: {@code a >= b}.
     */
    public static <E extends Comparable<? super E>> IsOrdered<E> maxComparator() {
        return (a, b) -> a.compareTo(b) >= 0;
    }

    public static <T> IsOrdered<T> from(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator cannot be null");
        return (a, b) -> comparator.compare(a, b) <= 0;
    }

    public static <T> IsOrdered<T> reversed(IsOrdered<T> isOrdered) {
        Objects.requireNonNull(isOrdered, "isOrdered cannot be null");
        return (a, b) -> isOrdered.inOrder(b, a);
    }
}
