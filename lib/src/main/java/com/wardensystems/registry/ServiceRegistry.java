package com.wardensystems.registry;

import com.wardensystems.DuplicateServiceException;
import com.wardensystems.InvalidTransitionException;
import com.wardensystems.ServiceNotFoundException;
import com.wardensystems.channel.Channel;
import com.wardensystems.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bookkeeping of every registered service: identity, execution handle, inbox and status.
 *
 * <p>All mutations are serialized by one lock, so a register racing a deregister always leaves a
 * consistent view. Readers receive immutable descriptors or copies of the table.</p>
 */
public class ServiceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ServiceRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ServiceDescriptor> services = new LinkedHashMap<>();
    private final Clock clock;

    public ServiceRegistry() {
        this(Clock.systemUTC());
    }

    public ServiceRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Registers a service. An existing DEAD or STOPPED registration under the same name is replaced.
     *
     * @param name the unique service name
     * @param descriptor the descriptor to store
     * @throws DuplicateServiceException if the name is held by an active registration
     * @throws IllegalArgumentException if the descriptor name differs from {@code name}
     */
    public void register(String name, ServiceDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor cannot be null");
        if (!descriptor.name().equals(name)) {
            throw new IllegalArgumentException("Descriptor name " + descriptor.name() + " does not match " + name);
        }
        withLock(() -> {
            ServiceDescriptor existing = services.get(name);
            if (existing != null && existing.status().isActive()) {
                throw new DuplicateServiceException(name);
            }
            services.put(name, descriptor);
            return null;
        });
        logger.info("Service registered: {} (unit {}, status {})",
                name, descriptor.executionHandle().id(), descriptor.status());
    }

    /**
     * Removes a registration. Idempotent.
     *
     * @param name the service name
     * @return the removed descriptor, or empty if none was registered
     */
    public Optional<ServiceDescriptor> deregister(String name) {
        ServiceDescriptor removed = withLock(() -> services.remove(name));
        if (removed != null) {
            logger.info("Service deregistered: {}", name);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Looks up a registration.
     *
     * @param name the service name
     * @return the descriptor, or empty if not registered
     */
    public Optional<ServiceDescriptor> get(String name) {
        return Optional.ofNullable(withLock(() -> services.get(name)));
    }

    /**
     * Returns a copy of all descriptors in registration order. The copy does not follow later changes.
     *
     * @return a snapshot of the registry
     */
    public List<ServiceDescriptor> list() {
        return withLock(() -> new ArrayList<>(services.values()));
    }

    public boolean isActive(String name) {
        return get(name).map(descriptor -> descriptor.status().isActive()).orElse(false);
    }

    /**
     * Moves a service to a new status.
     *
     * @param name the service name
     * @param newStatus the requested status
     * @return the updated descriptor
     * @throws ServiceNotFoundException if the name is not registered
     * @throws InvalidTransitionException if the state machine forbids the change
     */
    public ServiceDescriptor updateStatus(String name, ServiceStatus newStatus) {
        return updateStatus(name, newStatus, null);
    }

    /**
     * Moves a service to a new status, recording why.
     *
     * @param name the service name
     * @param newStatus the requested status
     * @param detail the reason, may be null
     * @return the updated descriptor
     * @throws ServiceNotFoundException if the name is not registered
     * @throws InvalidTransitionException if the state machine forbids the change
     */
    public ServiceDescriptor updateStatus(String name, ServiceStatus newStatus, String detail) {
        ServiceDescriptor updated = withLock(() -> transition(require(name), newStatus, detail));
        logStatus(updated);
        return updated;
    }

    /**
     * Moves a service to a new status only if it is still run by the given unit.
     * Callers acting on an earlier observation use this so they never touch a relaunched instance.
     *
     * @param name the service name
     * @param expected the unit the caller observed
     * @param newStatus the requested status
     * @param detail the reason, may be null
     * @return the updated descriptor, or empty if the unit was replaced or the name removed
     * @throws InvalidTransitionException if the state machine forbids the change
     */
    public Optional<ServiceDescriptor> updateStatusIfCurrent(String name, ExecutionHandle expected,
                                                             ServiceStatus newStatus, String detail) {
        ServiceDescriptor updated = withLock(() -> {
            ServiceDescriptor current = services.get(name);
            if (current == null || !current.isCurrent(expected)) {
                return null;
            }
            if (current.status() == newStatus) {
                return current;
            }
            return transition(current, newStatus, detail);
        });
        if (updated == null) {
            logger.debug("Ignoring status {} for {}: unit {} is no longer current", newStatus, name,
                    expected != null ? expected.id() : null);
            return Optional.empty();
        }
        logStatus(updated);
        return Optional.of(updated);
    }

    /**
     * Relaunches a DEAD registration with a new unit and inbox, counting one more restart.
     *
     * @param name the service name
     * @param handle the new unit
     * @param inbox the new inbox
     * @return the STARTING descriptor
     * @throws ServiceNotFoundException if the name is not registered
     * @throws InvalidTransitionException if the service is not DEAD
     */
    public ServiceDescriptor beginRestart(String name, ExecutionHandle handle, Channel<Message> inbox) {
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(inbox, "inbox cannot be null");
        ServiceDescriptor relaunched = withLock(() -> {
            ServiceDescriptor current = require(name);
            if (!current.status().canTransitionTo(ServiceStatus.STARTING)) {
                throw new InvalidTransitionException(name, current.status().name(), ServiceStatus.STARTING.name());
            }
            ServiceDescriptor next = current.relaunched(handle, inbox, clock.instant());
            services.put(name, next);
            return next;
        });
        logger.info("Service {} relaunching as unit {} (restart #{})", name, handle.id(), relaunched.restartCount());
        return relaunched;
    }

    /**
     * Attaches a detail to the current status without changing it.
     *
     * @param name the service name
     * @param detail the detail text
     * @return the updated descriptor
     * @throws ServiceNotFoundException if the name is not registered
     */
    public ServiceDescriptor annotate(String name, String detail) {
        return withLock(() -> {
            ServiceDescriptor next = require(name).withDetail(detail);
            services.put(name, next);
            return next;
        });
    }

    private ServiceDescriptor transition(ServiceDescriptor current, ServiceStatus newStatus, String detail) {
        if (!current.status().canTransitionTo(newStatus)) {
            throw new InvalidTransitionException(current.name(), current.status().name(), newStatus.name());
        }
        ServiceDescriptor next = current.withStatus(newStatus, detail, clock.instant());
        services.put(current.name(), next);
        return next;
    }

    private ServiceDescriptor require(String name) {
        ServiceDescriptor descriptor = services.get(name);
        if (descriptor == null) {
            throw new ServiceNotFoundException(name);
        }
        return descriptor;
    }

    private void logStatus(ServiceDescriptor descriptor) {
        if (descriptor.statusDetail() != null) {
            logger.info("Service {} status updated to {} ({})", descriptor.name(), descriptor.status(), descriptor.statusDetail());
        } else {
            logger.info("Service {} status updated to {}", descriptor.name(), descriptor.status());
        }
    }

    private <R> R withLock(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
