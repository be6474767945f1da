package com.wardensystems.stats;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of the statistics held for one service.
 *
 * @param serviceName the service
 * @param startedAt when the current instance initialized its statistics, null if never
 * @param lastBeatAt last heartbeat, null if none yet
 * @param requestCount requests handled by the current instance
 * @param errorCount requests answered with an ERROR by the current instance
 * @param counters any additional named counters
 */
public record ServiceStats(
        String serviceName,
        Instant startedAt,
        Instant lastBeatAt,
        long requestCount,
        long errorCount,
        Map<String, Long> counters) {

    public ServiceStats {
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }

    static ServiceStats empty(String serviceName) {
        return new ServiceStats(serviceName, null, null, 0, 0, Map.of());
    }
}
