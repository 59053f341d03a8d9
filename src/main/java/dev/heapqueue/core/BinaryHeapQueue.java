package dev.heapqueue.core;

import dev.heapqueue.api.HeapQueue;
import dev.heapqueue.api.IsOrdered;
import dev.heapqueue.config.HeapConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An array-backed binary heap ordered by a caller-supplied {@link IsOrdered} predicate.
 *
 * <p>This implementation provides:
 * <ul>
 *   <li>O(1) access to the first element</li>
 *   <li>O(log n) push, pop, removal and replacement at any array position</li>
 *   <li>O(n) membership test and destructive in-order traversal</li>
 * </ul>
 *
 * <p>Element {@code i} has its children at {@code 2i+1} and {@code 2i+2}. Every parent satisfies
 * {@code isOrdered.inOrder(parent, child)} for each of its children, so the element at index 0 is always
 * the first one by the predicate. Initial items are pushed one by one in the order given.
 *
 * <p>A single {@link Iterable} argument after the predicate is always read as the initial items, never as one
 * element. When {@code T} is itself iterable (a queue of lists, say), build the queue with
 * {@link #ofElements(IsOrdered, Object[])} or {@link #push(Object)} the elements individually.
 *
 * <p><strong>Thread Safety:</strong> This class is not thread-safe. Concurrent access must be guarded by
 * the caller.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * BinaryHeapQueue<Integer> queue = BinaryHeapQueue.minOrdering(5, 1, 3);
 * queue.push(2);
 * queue.pop();            // 1
 * queue.replaceFirst(9);  // returns 2, queue now holds 3, 5, 9
 * queue.drain(System.out::println);
 * }</pre>
 *
 * @param <T> the type of items stored in the queue
 * @since 1.0.0
 */
public class BinaryHeapQueue<T> implements HeapQueue<T> {
    private static final Logger logger = LoggerFactory.getLogger(BinaryHeapQueue.class);

    private final IsOrdered<T> isOrdered;
    private final HeapConfig config;
    private final ArrayList<T> elements;

    public BinaryHeapQueue(IsOrdered<T> isOrdered) {
        this(isOrdered, Collections.emptyList(), new HeapConfig());
    }

    public BinaryHeapQueue(IsOrdered<T> isOrdered, HeapConfig config) {
        this(isOrdered, Collections.emptyList(), config);
    }

    @SafeVarargs
    public BinaryHeapQueue(IsOrdered<T> isOrdered, T... items) {
        this(isOrdered, Arrays.asList(items), new HeapConfig());
    }

    public BinaryHeapQueue(IsOrdered<T> isOrdered, Iterable<? extends T> items) {
        this(isOrdered, items, new HeapConfig());
    }

    /**
     * Creates a queue and pushes each of {@code items} in iteration order.
     *
     * @param isOrdered predicate returning true when its first argument belongs before its second
     * @param items     initial contents, possibly empty
     * @param config    storage and diagnostic settings
     * @throws NullPointerException     if any argument or any item is null
     * @throws IllegalArgumentException if the configured initial capacity is negative
     */
    public BinaryHeapQueue(IsOrdered<T> isOrdered, Iterable<? extends T> items, HeapConfig config) {
        this.isOrdered = Objects.requireNonNull(isOrdered, "isOrdered cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(items, "items cannot be null");

        if (config.getInitialCapacity() < 0) {
            throw new IllegalArgumentException("initialCapacity cannot be negative, got " + config.getInitialCapacity());
        }
        this.elements = new ArrayList<>(config.getInitialCapacity());

        for (T item : items) {
            push(item);
        }

        logger.debug("Created heap queue with {} initial elements (initial capacity {}, verify invariants: {})",
                elements.size(), config.getInitialCapacity(), config.isVerifyInvariants());
    }

    /**
     * Factory that always treats each argument as one element, including when {@code T} is iterable.
     */
    @SafeVarargs
    public static <T> BinaryHeapQueue<T> ofElements(IsOrdered<T> isOrdered, T... elements) {
        return new BinaryHeapQueue<>(isOrdered, Arrays.asList(elements), new HeapConfig());
    }

    /**
     * Factory for a queue with min-value ordering.
     */
    @SafeVarargs
    public static <E extends Comparable<? super E>> BinaryHeapQueue<E> minOrdering(E... items) {
        return new BinaryHeapQueue<>(Orderings.<E>minComparator(), Arrays.asList(items));
    }

    public static <E extends Comparable<? super E>> BinaryHeapQueue<E> minOrdering(Iterable<? extends E> items) {
        return new BinaryHeapQueue<>(Orderings.<E>minComparator(), items);
    }

    /**
     * Factory for a queue with max-value ordering.
     */
    @SafeVarargs
    public static <E extends Comparable<? super E>> BinaryHeapQueue<E> maxOrdering(E... items) {
        return new BinaryHeapQueue<>(Orderings.<E>maxComparator(), Arrays.asList(items));
    }

    public static <E extends Comparable<? super E>> BinaryHeapQueue<E> maxOrdering(Iterable<? extends E> items) {
        return new BinaryHeapQueue<>(Orderings.<E>maxComparator(), items);
    }

    /**
     * Default construction from bare orderable items: min-value ordering.
     */
    @SafeVarargs
    public static <E extends Comparable<? super E>> BinaryHeapQueue<E> of(E... items) {
        return minOrdering(items);
    }

    @Override
    public int count() {
        return elements.size();
    }

    @Override
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public T peekFirst() {
        return elements.isEmpty() ? null : elements.get(0);
    }

    /**
     * Appends {@code item} and moves it toward the root until its parent is ordered before it.
     *
     * @param item the item to add (must not be null)
     */
    @Override
    public void push(T item) {
        Objects.requireNonNull(item, "item cannot be null");
        elements.add(item);
        int pos = siftUp(elements.size() - 1);
        if (logger.isTraceEnabled()) {
            logger.trace("Pushed {} to index {}, count now {}", item, pos, elements.size());
        }
        verify("push");
    }

    @Override
    public T pop() {
        switch (elements.size()) {
            case 0:
                return null;
            case 1:
                return elements.remove(0);
            default:
                T first = elements.get(0);
                elements.set(0, elements.remove(elements.size() - 1));
                siftDown(0);
                verify("pop");
                return first;
        }
    }

    /**
     * Removes the element at {@code index} of the backing array.
     *
     * <p>The last element is moved into the hole. It may belong either below or above that position, so it is
     * sifted down first and then sifted up from wherever it came to rest. At most one of the two passes moves it.
     *
     * @param index position in the backing array
     * @return the removed element, or null if {@code index} is negative or not less than {@link #count()}
     */
    @Override
    public T removeAt(int index) {
        int last = elements.size() - 1;
        if (index < 0 || index > last) {
            logger.trace("removeAt({}) out of range for count {}", index, elements.size());
            return null;
        }
        if (index == last) {
            return elements.remove(last);
        }

        T removed = elements.get(index);
        elements.set(index, elements.remove(last));
        siftUp(siftDown(index));
        verify("removeAt");
        return removed;
    }

    /**
     * Removes the element at {@code index} and pushes {@code value}.
     *
     * @return the removed element, or null (with {@code value} not added) if {@code index} is out of range
     * @throws NullPointerException if {@code value} is null
     */
    @Override
    public T replaceAt(int index, T value) {
        Objects.requireNonNull(value, "value cannot be null");
        T removed = removeAt(index);
        if (removed == null) {
            return null;
        }
        push(value);
        return removed;
    }

    /**
     * Overwrites the first element with {@code value} and sifts it down in a single pass.
     * Cheaper than {@link #replaceFirst(Object)}, which removes and then pushes.
     *
     * @return the previous first element, or null (with {@code value} not added) when empty
     */
    public T replaceRoot(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (elements.isEmpty()) {
            return null;
        }
        T root = elements.set(0, value);
        siftDown(0);
        verify("replaceRoot");
        return root;
    }

    @Override
    public void removeAllElements() {
        if (!elements.isEmpty()) {
            logger.debug("Removing all {} elements", elements.size());
        }
        elements.clear();
    }

    @Override
    public boolean contains(T value) {
        for (T element : elements) {
            if (Objects.equals(element, value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<T> drainingIterator() {
        return new DrainingIterator<>(this);
    }

    public IsOrdered<T> isOrdered() {
        return isOrdered;
    }

    /**
     * @return a copy of the backing array in internal order
     */
    public List<T> toList() {
        return new ArrayList<>(elements);
    }

    @Override
    public String toString() {
        return "BinaryHeapQueue[count=" + elements.size() + ", elements=" + elements + "]";
    }

    /**
     * Moves the element at {@code index} toward the root while its parent is not ordered before it.
     *
     * @return the index the element ends up at
     */
    private int siftUp(int index) {
        T item = elements.get(index);
        int pos = index;
        while (pos > 0) {
            int parentPos = (pos - 1) >>> 1;
            T parent = elements.get(parentPos);
            if (isOrdered.inOrder(parent, item)) {
                break;
            }
            elements.set(pos, parent); // shift parent down
            pos = parentPos;
        }
        elements.set(pos, item);
        return pos;
    }

    /**
     * Moves the element at {@code index} toward the leaves while one of its children belongs before it.
     *
     * @return the index the element ends up at
     */
    private int siftDown(int index) {
        int size = elements.size();
        T item = elements.get(index);
        int pos = index;
        int childPos = 2 * pos + 1;
        while (childPos < size) {
            int rightPos = childPos + 1;
            if (rightPos < size && !isOrdered.inOrder(elements.get(childPos), elements.get(rightPos))) {
                childPos = rightPos;
            }
            T child = elements.get(childPos);
            if (isOrdered.inOrder(item, child)) {
                break;
            }
            elements.set(pos, child); // shift child up
            pos = childPos;
            childPos = 2 * pos + 1;
        }
        elements.set(pos, item);
        return pos;
    }

    private void verify(String operation) {
        if (!config.isVerifyInvariants()) {
            return;
        }
        int bad = HeapChecks.firstViolation(elements, isOrdered);
        if (bad >= 0) {
            int parent = (bad - 1) >>> 1;
            logger.error("Heap property violated after {}: element at {} is not ordered after its parent at {}",
                    operation, bad, parent);
            throw new IllegalStateException("Heap property violated after " + operation + " at index " + bad
                    + " (parent index " + parent + ")");
        }
    }
}
