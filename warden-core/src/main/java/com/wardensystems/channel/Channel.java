package com.wardensystems.channel;

import com.wardensystems.QueueOverflowException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO channel used as a service inbox.
 * This interface decouples the runtime from specific queue implementations.
 *
 * <p>Messages are never duplicated or reordered within one channel. There is no ordering
 * guarantee across different channels.</p>
 *
 * @param <T> The type of messages carried by the channel
 */
public interface Channel<T> {

    /**
     * Returns the name of this channel, used in logs and overflow errors.
     *
     * @return the channel name
     */
    String name();

    /**
     * Inserts the message if capacity allows, without blocking.
     *
     * @param message the message to add
     * @return true if the message was added, false if the channel is full
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this channel, waiting up to the
     * specified wait time if necessary for a message to become available.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this channel, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this channel, waiting until a message arrives.
     *
     * @return the head of this channel
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Removes up to maxElements messages and adds them to the given collection, in FIFO order.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    int size();

    boolean isEmpty();

    /**
     * Returns the total number of messages this channel can hold.
     *
     * @return the capacity
     */
    int capacity();

    /**
     * Returns the number of additional messages this channel can accept.
     *
     * @return the remaining capacity
     */
    int remainingCapacity();

    /**
     * Removes all messages from this channel.
     */
    void clear();

    /**
     * Sends a message without blocking.
     *
     * @param message the message to send
     * @throws QueueOverflowException if the channel is at capacity
     */
    default void send(T message) {
        if (!offer(message)) {
            throw new QueueOverflowException(name(), capacity());
        }
    }

    /**
     * Blocks until a message arrives or the timeout elapses.
     *
     * @param timeout the maximum time to wait
     * @return the message, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    default Optional<T> receive(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Blocks until a message arrives.
     *
     * @return the next message
     * @throws InterruptedException if interrupted while waiting
     */
    default T receive() throws InterruptedException {
        return take();
    }

    /**
     * Removes every pending message.
     *
     * @return the removed messages in FIFO order
     */
    default List<T> drain() {
        List<T> drained = new ArrayList<>(size());
        drainTo(drained, Integer.MAX_VALUE);
        return drained;
    }
}
