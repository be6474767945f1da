package com.wardensystems;

/**
 * Signals backpressure: a bounded channel was full and the message was not enqueued.
 */
public class QueueOverflowException extends OrchestrationException {

    private final int capacity;

    public QueueOverflowException(String channelName, int capacity) {
        super("Channel " + channelName + " is full (capacity " + capacity + ")", channelName);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
