package com.wardensystems.channel;

import org.jctools.queues.MpscArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded channel backed by a JCTools MPSC (Multi-Producer Single-Consumer) array queue.
 *
 * This implementation provides:
 * - Lock-free sends from any number of producers
 * - No per-message allocation
 *
 * Trade-offs:
 * - Exactly one thread may receive; a service inbox satisfies this
 * - Capacity is rounded up to the next power of two
 * - Waiting receives use a lock and condition
 *
 * @param <T> The type of messages
 */
public class MpscChannel<T> implements Channel<T> {

    private final String name;
    private final MpscArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean consumerWaiting = false;

    /**
     * Creates a channel holding at least {@code capacity} messages.
     *
     * @param name the channel name
     * @param capacity the requested capacity, rounded up to a power of two (minimum 2)
     */
    public MpscChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.queue = new MpscArrayQueue<>(Math.max(2, capacity));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        boolean added = queue.offer(message);
        if (added) {
            signalNotEmpty();
        }
        return added;
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }

        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            // Publish the flag before the re-check so a concurrent offer either sees it or is seen by poll
            consumerWaiting = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lockInterruptibly();
        try {
            consumerWaiting = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                notEmpty.await();
            }
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        while (count < maxElements) {
            T message = queue.poll();
            if (message == null) {
                break;
            }
            collection.add(message);
            count++;
        }
        return count;
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
        return queue.capacity();
    }

    @Override
    public int remainingCapacity() {
        return Math.max(0, queue.capacity() - queue.size());
    }

    @Override
    public void clear() {
        queue.clear();
    }

    private void signalNotEmpty() {
        // Skip the lock on the hot path when the consumer is busy
        if (consumerWaiting) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public String toString() {
        return "MpscChannel[" + name + ", " + size() + "/" + capacity() + "]";
    }
}
