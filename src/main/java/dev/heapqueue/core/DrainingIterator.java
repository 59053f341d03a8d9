package dev.heapqueue.core;

import dev.heapqueue.api.HeapQueue;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Iterator that consumes its queue: each {@link #next()} pops the current first element.
 */
public class DrainingIterator<T> implements Iterator<T> {
    private final HeapQueue<T> queue;

    public DrainingIterator(HeapQueue<T> queue) {
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
    }

    @Override
    public boolean hasNext() {
        return !queue.isEmpty();
    }

    @Override
    public T next() {
        T item = queue.pop();
        if (item == null) {
            throw new NoSuchElementException("queue is drained");
        }
        return item;
    }
}
