package com.wardensystems.channel;

/**
 * Selects the queue implementation behind service inboxes.
 */
public enum ChannelType {
    /** {@link LinkedChannel}: exact capacity, blocking-queue semantics. Default. */
    LINKED,
    /** {@link MpscChannel}: lock-free sends, single receiver, power-of-two capacity. */
    MPSC
}
