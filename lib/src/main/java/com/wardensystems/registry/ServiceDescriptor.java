package com.wardensystems.registry;

import com.wardensystems.channel.Channel;
import com.wardensystems.protocol.Message;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity record of one registered service. Immutable: the registry stores a new descriptor for every change.
 *
 * @param name unique registry key
 * @param executionHandle the unit currently running the service
 * @param inbox the service's request channel
 * @param status lifecycle status
 * @param startedAt when the current unit was launched
 * @param restartCount restarts used by this registration
 * @param statusDetail why the service last became DEAD or STOPPED, null if not applicable
 * @param lastTransitionAt when the status last changed
 */
public record ServiceDescriptor(
        String name,
        ExecutionHandle executionHandle,
        Channel<Message> inbox,
        ServiceStatus status,
        Instant startedAt,
        int restartCount,
        String statusDetail,
        Instant lastTransitionAt) {

    public ServiceDescriptor {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(executionHandle, "executionHandle cannot be null");
        Objects.requireNonNull(inbox, "inbox cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(startedAt, "startedAt cannot be null");
        if (restartCount < 0) {
            throw new IllegalArgumentException("restartCount must not be negative");
        }
        if (lastTransitionAt == null) {
            lastTransitionAt = startedAt;
        }
    }

    /**
     * Creates the descriptor of a freshly launched service.
     *
     * @param name the service name
     * @param handle the unit running it
     * @param inbox its request channel
     * @param startedAt launch time
     * @return a STARTING descriptor with no restarts
     */
    public static ServiceDescriptor starting(String name, ExecutionHandle handle, Channel<Message> inbox, Instant startedAt) {
        return new ServiceDescriptor(name, handle, inbox, ServiceStatus.STARTING, startedAt, 0, null, startedAt);
    }

    /**
     * Returns true if this descriptor still refers to the given unit.
     *
     * @param handle the unit observed by the caller
     * @return true if the handles are the same launch
     */
    public boolean isCurrent(ExecutionHandle handle) {
        return handle != null && executionHandle.id() == handle.id();
    }

    ServiceDescriptor withStatus(ServiceStatus newStatus, String detail, Instant at) {
        return new ServiceDescriptor(name, executionHandle, inbox, newStatus, startedAt, restartCount, detail, at);
    }

    ServiceDescriptor withDetail(String detail) {
        return new ServiceDescriptor(name, executionHandle, inbox, status, startedAt, restartCount, detail, lastTransitionAt);
    }

    ServiceDescriptor relaunched(ExecutionHandle handle, Channel<Message> newInbox, Instant at) {
        return new ServiceDescriptor(name, handle, newInbox, ServiceStatus.STARTING, at, restartCount + 1, null, at);
    }
}
