package dev.heapqueue.api;

/**
 * Ordering predicate for a heap queue: reports whether {@code first} should appear before {@code second}.
 *
 * Implementations are expected to be reflexive in the "less-than-or-equal" sense (a min-heap uses
 * {@code a <= b}, a max-heap {@code a >= b}). A strict predicate still produces a working queue, but
 * equal elements can never satisfy the heap property check in that case.
 */
@FunctionalInterface
public interface IsOrdered<T> {
    boolean inOrder(T first, T second);
}
