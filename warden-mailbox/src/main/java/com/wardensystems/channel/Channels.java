package com.wardensystems.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates channels for a configured {@link ChannelType}.
 */
public final class Channels {

    private static final Logger logger = LoggerFactory.getLogger(Channels.class);

    private Channels() {
    }

    /**
     * Creates a bounded channel.
     *
     * @param type the implementation to use, null for {@link ChannelType#LINKED}
     * @param name the channel name
     * @param capacity the channel capacity
     * @param <T> the message type
     * @return a new, empty channel
     */
    public static <T> Channel<T> create(ChannelType type, String name, int capacity) {
        ChannelType effective = type != null ? type : ChannelType.LINKED;
        logger.debug("Creating {} channel '{}' with capacity {}", effective, name, capacity);
        return switch (effective) {
            case LINKED -> new LinkedChannel<>(name, capacity);
            case MPSC -> new MpscChannel<>(name, capacity);
        };
    }
}
