package com.wardensystems.stats;

import java.time.Duration;
import java.time.Instant;

/**
 * Liveness signal of one service as last written by the service itself.
 *
 * @param serviceName the service
 * @param lastBeatAt when the service last completed a processing cycle
 * @param requestCount requests handled since the current instance started
 */
public record HeartbeatRecord(String serviceName, Instant lastBeatAt, long requestCount) {

    /**
     * Returns how long ago the last heartbeat was written.
     *
     * @param now the reference time
     * @return the heartbeat age, never negative
     */
    public Duration age(Instant now) {
        Duration age = Duration.between(lastBeatAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
