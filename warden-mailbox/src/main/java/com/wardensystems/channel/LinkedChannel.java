package com.wardensystems.channel;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default channel implementation using LinkedBlockingQueue.
 *
 * Recommended for:
 * - General-purpose service inboxes
 * - Services that mostly wait on I/O or on other services
 *
 * @param <T> The type of messages
 */
public class LinkedChannel<T> implements Channel<T> {

    private final String name;
    private final LinkedBlockingQueue<T> queue;
    private final int capacity;

    /**
     * Creates a bounded channel with the specified capacity.
     *
     * @param name the channel name
     * @param capacity the maximum number of messages
     */
    public LinkedChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.capacity = capacity;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return queue.offer(message);
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public T take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        return queue.drainTo(collection, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public String toString() {
        return "LinkedChannel[" + name + ", " + size() + "/" + capacity + "]";
    }
}
