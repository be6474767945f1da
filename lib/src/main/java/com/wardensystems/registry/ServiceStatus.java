package com.wardensystems.registry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a registered service.
 *
 * <pre>
 * STARTING -> RUNNING | DEAD | STOPPED
 * RUNNING  -> DEGRADED | DEAD | STOPPED
 * DEGRADED -> RUNNING | DEAD | STOPPED
 * DEAD     -> STARTING (restart) | STOPPED
 * STOPPED  (terminal for the registration)
 * </pre>
 */
public enum ServiceStatus {
    STARTING,
    RUNNING,
    DEGRADED,
    DEAD,
    STOPPED;

    /**
     * Checks whether the state machine permits moving from this status to {@code next}.
     *
     * @param next the requested status
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(ServiceStatus next) {
        return successors().contains(next);
    }

    /**
     * Returns true for statuses in which the unit is expected to be alive.
     *
     * @return true for STARTING, RUNNING and DEGRADED
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == DEGRADED;
    }

    private Set<ServiceStatus> successors() {
        return switch (this) {
            case STARTING -> EnumSet.of(RUNNING, DEAD, STOPPED);
            case RUNNING -> EnumSet.of(DEGRADED, DEAD, STOPPED);
            case DEGRADED -> EnumSet.of(RUNNING, DEAD, STOPPED);
            case DEAD -> EnumSet.of(STARTING, STOPPED);
            case STOPPED -> EnumSet.noneOf(ServiceStatus.class);
        };
    }
}
