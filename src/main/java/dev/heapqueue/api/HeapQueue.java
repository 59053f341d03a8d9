package dev.heapqueue.api;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Priority queue semantics:
 * - The first element is the one the queue's {@link IsOrdered} predicate places before every other element.
 * - Absence is reported as {@code null}: peeking or popping an empty queue, or addressing an index that is
 *   out of range, returns {@code null} and leaves the queue untouched. Null elements are therefore rejected.
 * - The pop order among elements the predicate considers equal is unspecified. It is not insertion order.
 * - Instances are not thread-safe; callers that share one must synchronize externally.
 */
public interface HeapQueue<T> {

    int count();

    boolean isEmpty();

    /**
     * @return the first element without removing it, or null when empty
     */
    T peekFirst();

    void push(T item);

    /**
     * Remove the first element.
     *
     * @return the removed element, or null when empty
     */
    T pop();

    /**
     * Remove the element at the given position of the backing array.
     *
     * @param index position in internal array order, as seen in {@code toString()}
     * @return the removed element, or null if {@code index} is out of range
     */
    T removeAt(int index);

    /**
     * Remove the element at {@code index} and push {@code value} in its place.
     * Nothing is pushed when {@code index} is out of range.
     *
     * @return the removed element, or null if {@code index} is out of range
     */
    T replaceAt(int index, T value);

    default T replaceFirst(T value) {
        return replaceAt(0, value);
    }

    void removeAllElements();

    /**
     * Linear scan using {@link Object#equals(Object)}; heap order is not consulted.
     */
    boolean contains(T value);

    /**
     * Destructive iterator: every {@code next()} pops the current first element.
     */
    Iterator<T> drainingIterator();

    /**
     * Pop every element in order, handing each one to {@code visit}. The queue is empty afterwards.
     */
    default void drain(Consumer<? super T> visit) {
        Objects.requireNonNull(visit, "visit cannot be null");
        Iterator<T> it = drainingIterator();
        while (it.hasNext()) {
            visit.accept(it.next());
        }
    }
}
