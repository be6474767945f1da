package com.wardensystems;

import com.wardensystems.registry.ServiceDescriptor;
import com.wardensystems.registry.ServiceStatus;
import com.wardensystems.stats.ServiceStats;

import java.time.Duration;
import java.time.Instant;

/**
 * Health view of one service as reported to operators.
 *
 * @param name the service name
 * @param status the registry status
 * @param executionId id of the current execution unit
 * @param alive whether the unit is running
 * @param startedAt when the current unit was launched
 * @param restartCount restarts used by this registration
 * @param statusDetail reason attached to the last DEAD or STOPPED transition, may be null
 * @param heartbeatAge time since the last heartbeat
 * @param stats the service's statistics
 */
public record ServiceHealth(
        String name,
        ServiceStatus status,
        long executionId,
        boolean alive,
        Instant startedAt,
        int restartCount,
        String statusDetail,
        Duration heartbeatAge,
        ServiceStats stats) {

    static ServiceHealth of(ServiceDescriptor descriptor, Duration heartbeatAge, ServiceStats stats) {
        return new ServiceHealth(
                descriptor.name(),
                descriptor.status(),
                descriptor.executionHandle().id(),
                descriptor.executionHandle().isAlive(),
                descriptor.startedAt(),
                descriptor.restartCount(),
                descriptor.statusDetail(),
                heartbeatAge,
                stats);
    }
}
