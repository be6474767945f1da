package com.wardensystems.supervisor;

import com.wardensystems.DuplicateServiceException;
import com.wardensystems.InvalidTransitionException;
import com.wardensystems.OrchestrationException;
import com.wardensystems.QueueOverflowException;
import com.wardensystems.RestartLimitExceededException;
import com.wardensystems.ServiceCallException;
import com.wardensystems.ServiceNotFoundException;
import com.wardensystems.ServiceTimeoutException;
import com.wardensystems.StartupException;
import com.wardensystems.channel.Channel;
import com.wardensystems.channel.Channels;
import com.wardensystems.config.OrchestratorConfig;
import com.wardensystems.protocol.ErrorCode;
import com.wardensystems.protocol.Message;
import com.wardensystems.protocol.MessageProtocol;
import com.wardensystems.registry.ExecutionHandle;
import com.wardensystems.registry.ServiceDescriptor;
import com.wardensystems.registry.ServiceRegistry;
import com.wardensystems.registry.ServiceStatus;
import com.wardensystems.service.ServiceEntrypoint;
import com.wardensystems.service.ServiceHandler;
import com.wardensystems.stats.StatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the lifecycle of every service unit and is the one trusted path for starting, stopping and
 * restarting them. Also provides the request/response call primitive on top of the one-way inboxes.
 *
 * <p>Lifecycle operations on the same service name are serialized; operations on different services
 * run independently. A failure inside a unit never propagates here: units report through their
 * replies, their heartbeats and their liveness. A unit that crashes reports itself, and is marked DEAD
 * (and restarted when auto-restart is on) on a separate recovery thread.</p>
 */
public class ServiceSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ServiceSupervisor.class);

    /** Source name used on messages the supervisor sends itself. */
    public static final String SUPERVISOR = "supervisor";

    private static final Duration FORCED_EXIT_WAIT = Duration.ofSeconds(1);

    private final OrchestratorConfig config;
    private final ServiceRegistry registry;
    private final StatisticsStore statistics;
    private final PendingCalls pendingCalls = new PendingCalls();
    private final Map<String, ServiceEntrypoint> entrypoints = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> lifecycleLocks = new ConcurrentHashMap<>();
    private final AtomicLong unitIds = new AtomicLong();
    private final ScheduledExecutorService timeoutScheduler;
    private final ExecutorService recoveryExecutor;

    private volatile boolean shutdown = false;

    public ServiceSupervisor(OrchestratorConfig config, ServiceRegistry registry, StatisticsStore statistics) {
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics cannot be null");
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "supervisor-call-timeouts");
            thread.setDaemon(true);
            return thread;
        });
        this.recoveryExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "supervisor-recovery");
            thread.setDaemon(true);
            return thread;
        });
        logger.debug("ServiceSupervisor created with {}", config);
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Launches a service in a new execution unit and waits for it to become ready.
     *
     * @param name the unique service name
     * @param entrypoint creates the handler for each launch
     * @return the RUNNING descriptor
     * @throws DuplicateServiceException if the name is already active
     * @throws StartupException if the unit fails or is not ready within the startup grace period
     */
    public ServiceDescriptor startService(String name, ServiceEntrypoint entrypoint) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(entrypoint, "entrypoint cannot be null");
        requireOpen();
        return withLifecycleLock(name, () -> {
            if (registry.isActive(name)) {
                throw new DuplicateServiceException(name);
            }
            ServiceUnit unit = newUnit(name, entrypoint);
            entrypoints.put(name, entrypoint);
            registry.register(name, ServiceDescriptor.starting(name, unit, unit.inbox(), config.getClock().instant()));
            logger.info("Starting service {} as unit {}", name, unit.id());
            return launch(name, unit);
        });
    }

    /**
     * Stops a service and moves it to STOPPED. Stopping an already stopped service does nothing.
     *
     * <p>A graceful stop queues a shutdown request behind pending work and waits up to the drain timeout
     * for the unit to exit; the unit is then terminated if it is still running. Requests left in the
     * inbox are answered with SERVICE_UNAVAILABLE.</p>
     *
     * @param name the service name
     * @param graceful true to let in-flight work finish first
     * @return the STOPPED descriptor
     * @throws ServiceNotFoundException if the name is not registered
     */
    public ServiceDescriptor stopService(String name, boolean graceful) {
        return withLifecycleLock(name, () -> {
            ServiceDescriptor current = registry.get(name).orElseThrow(() -> new ServiceNotFoundException(name));
            if (current.status() == ServiceStatus.STOPPED) {
                logger.debug("Service {} already stopped", name);
                return current;
            }
            logger.info("Stopping service {} ({})", name, graceful ? "graceful" : "forced");
            halt(current, graceful);
            return registry.updateStatus(name, ServiceStatus.STOPPED, graceful ? "stopped" : "stopped (forced)");
        });
    }

    /**
     * Terminates a service's unit and launches a new one under the same registration.
     *
     * <p>When the registration has already used {@code maxRestarts} restarts, the unit is terminated, the
     * service is left DEAD with a detail naming the limit, and the restart is refused.</p>
     *
     * @param name the service name
     * @return the RUNNING descriptor of the new unit
     * @throws ServiceNotFoundException if the name is not registered
     * @throws InvalidTransitionException if the service is STOPPED
     * @throws RestartLimitExceededException if the restart budget is used up
     * @throws StartupException if the new unit does not become ready
     */
    public ServiceDescriptor restartService(String name) {
        requireOpen();
        return withLifecycleLock(name, () -> {
            ServiceDescriptor current = registry.get(name).orElseThrow(() -> new ServiceNotFoundException(name));
            if (current.status() == ServiceStatus.STOPPED) {
                throw new InvalidTransitionException(name, ServiceStatus.STOPPED.name(), ServiceStatus.STARTING.name());
            }
            ServiceEntrypoint entrypoint = entrypoints.get(name);
            if (entrypoint == null) {
                throw new ServiceNotFoundException(name);
            }

            halt(current, false);
            if (current.status() != ServiceStatus.DEAD) {
                registry.updateStatusIfCurrent(name, current.executionHandle(), ServiceStatus.DEAD, "restart requested");
            }

            int maxRestarts = config.getMaxRestarts();
            if (current.restartCount() >= maxRestarts) {
                registry.annotate(name, "restart limit reached (" + current.restartCount() + "/" + maxRestarts + ")");
                logger.error("Service {} exhausted its restart budget ({}); leaving it DEAD", name, maxRestarts);
                throw new RestartLimitExceededException(name, current.restartCount(), maxRestarts);
            }

            ServiceUnit unit;
            try {
                unit = newUnit(name, entrypoint);
            } catch (StartupException e) {
                registry.annotate(name, e.getMessage());
                throw e;
            }
            registry.beginRestart(name, unit, unit.inbox());
            return launch(name, unit);
        });
    }

    /**
     * Stops every service and fails outstanding calls. The supervisor cannot be reused afterwards.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down supervisor");
        for (ServiceDescriptor descriptor : registry.list()) {
            if (descriptor.status() == ServiceStatus.STOPPED) {
                continue;
            }
            try {
                stopService(descriptor.name(), true);
            } catch (OrchestrationException e) {
                logger.warn("Error stopping service {} during shutdown: {}", descriptor.name(), e.getMessage());
            }
        }
        pendingCalls.failAll(new ServiceCallException(SUPERVISOR, ErrorCode.SERVICE_UNAVAILABLE, "Supervisor shut down"));
        timeoutScheduler.shutdownNow();
        recoveryExecutor.shutdownNow();
        logger.info("Supervisor shut down");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    // ---------------------------------------------------------------- calls

    /**
     * Calls a service using the configured default timeout.
     *
     * @see #dispatchCall(String, String, String, Map, Duration)
     */
    public Map<String, Object> dispatchCall(String source, String target, String action, Map<String, Object> payload) {
        return dispatchCall(source, target, action, payload, config.getCallTimeout());
    }

    /**
     * Sends a request to a service and blocks until its answer arrives or the timeout elapses.
     *
     * @param source the calling service or external caller
     * @param target the service to call
     * @param action the action to request
     * @param payload the request payload, may be null
     * @param timeout the maximum time to wait
     * @return the payload of the RESPONSE
     * @throws ServiceTimeoutException if no answer arrives in time; a late answer is discarded
     * @throws ServiceCallException if the target answers with an ERROR or is not available
     * @throws QueueOverflowException if the target's inbox is full
     */
    public Map<String, Object> dispatchCall(String source, String target, String action,
                                            Map<String, Object> payload, Duration timeout) {
        Message request = MessageProtocol.buildRequest(source, target, action, payload, config.getClock());
        CompletableFuture<Message> reply = send(request);
        try {
            return unwrap(reply.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            pendingCalls.retire(request.correlationId());
            logger.warn("Call {} -> {} '{}' timed out after {}ms", source, target, action, timeout.toMillis());
            throw new ServiceTimeoutException(target, action, request.correlationId(), timeout);
        } catch (InterruptedException e) {
            pendingCalls.retire(request.correlationId());
            Thread.currentThread().interrupt();
            throw new ServiceCallException(target, ErrorCode.SERVICE_UNAVAILABLE,
                    "Interrupted while waiting for " + target);
        } catch (ExecutionException e) {
            throw asCallFailure(target, e.getCause());
        }
    }

    /**
     * Sends a request without blocking. The returned future fails with {@link ServiceTimeoutException},
     * {@link ServiceCallException} or {@link QueueOverflowException} in the same cases as
     * {@link #dispatchCall(String, String, String, Map, Duration)}.
     *
     * @param source the calling service or external caller
     * @param target the service to call
     * @param action the action to request
     * @param payload the request payload, may be null
     * @param timeout the maximum time to wait
     * @return a future completed with the response payload
     */
    public CompletableFuture<Map<String, Object>> dispatchCallAsync(String source, String target, String action,
                                                                    Map<String, Object> payload, Duration timeout) {
        CompletableFuture<Map<String, Object>> result = new CompletableFuture<>();
        Message request = MessageProtocol.buildRequest(source, target, action, payload, config.getClock());
        CompletableFuture<Message> reply;
        try {
            reply = send(request);
        } catch (OrchestrationException e) {
            result.completeExceptionally(e);
            return result;
        }

        ScheduledFuture<?> timeoutTask = timeoutScheduler.schedule(() -> {
            if (pendingCalls.retire(request.correlationId())) {
                logger.warn("Call {} -> {} '{}' timed out after {}ms", source, target, action, timeout.toMillis());
                result.completeExceptionally(
                        new ServiceTimeoutException(target, action, request.correlationId(), timeout));
            }
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);

        reply.whenComplete((answer, error) -> {
            timeoutTask.cancel(false);
            if (error != null) {
                result.completeExceptionally(asCallFailure(target, error));
                return;
            }
            try {
                result.complete(unwrap(answer));
            } catch (OrchestrationException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private CompletableFuture<Message> send(Message request) {
        requireOpen();
        String target = request.targetService();
        Optional<ServiceDescriptor> descriptor = registry.get(target);
        if (descriptor.isEmpty() || !descriptor.get().status().isActive()) {
            String state = descriptor.map(d -> d.status().name()).orElse("not registered");
            throw new ServiceCallException(target, ErrorCode.SERVICE_UNAVAILABLE,
                    "Service " + target + " is not available (" + state + ")");
        }
        CompletableFuture<Message> reply = pendingCalls.register(request.correlationId());
        try {
            descriptor.get().inbox().send(request);
        } catch (QueueOverflowException e) {
            pendingCalls.retire(request.correlationId());
            logger.warn("Inbox of {} is full, rejecting '{}' from {}", target, request.action(), request.sourceService());
            throw e;
        }
        return reply;
    }

    private static Map<String, Object> unwrap(Message answer) {
        if (answer.isError()) {
            throw new ServiceCallException(answer.sourceService(), answer.errorCode(), answer.errorMessage());
        }
        return answer.payload();
    }

    private static OrchestrationException asCallFailure(String target, Throwable error) {
        if (error instanceof OrchestrationException orchestrationException) {
            return orchestrationException;
        }
        return new ServiceCallException(target, ErrorCode.INTERNAL_ERROR, String.valueOf(error.getMessage()));
    }

    // ---------------------------------------------------------------- health reports

    /**
     * Records a health verdict for the unit the caller observed. Ignored if the unit has been replaced
     * or the service is no longer RUNNING or DEGRADED.
     *
     * @param name the service name
     * @param observed the unit the verdict is about
     * @param status RUNNING or DEGRADED
     * @return true if the registry now holds the given status for that unit
     */
    public boolean reportHealth(String name, ExecutionHandle observed, ServiceStatus status) {
        if (status != ServiceStatus.RUNNING && status != ServiceStatus.DEGRADED) {
            throw new IllegalArgumentException("Health reports must be RUNNING or DEGRADED, got " + status);
        }
        return withLifecycleLock(name, () -> {
            Optional<ServiceDescriptor> current = registry.get(name);
            if (current.isEmpty() || !current.get().isCurrent(observed) || !isMonitored(current.get().status())) {
                logger.debug("Ignoring health report {} for {}", status, name);
                return false;
            }
            return registry.updateStatusIfCurrent(name, observed, status, null).isPresent();
        });
    }

    private static boolean isMonitored(ServiceStatus status) {
        return status == ServiceStatus.RUNNING || status == ServiceStatus.DEGRADED;
    }

    /**
     * Declares the observed unit dead: terminates it, marks the service DEAD and answers its queued requests.
     *
     * @param name the service name
     * @param observed the unit found dead
     * @param reason why the unit is considered dead
     * @return true if the service was marked DEAD, false if the unit had already been replaced
     */
    public boolean reportDead(String name, ExecutionHandle observed, String reason) {
        return withLifecycleLock(name, () -> {
            Optional<ServiceDescriptor> current = registry.get(name);
            if (current.isEmpty() || !current.get().isCurrent(observed) || !current.get().status().isActive()) {
                return false;
            }
            observed.terminate();
            registry.updateStatusIfCurrent(name, observed, ServiceStatus.DEAD, reason);
            releaseInbox(name, current.get().inbox());
            return true;
        });
    }

    private void onUnitCrash(ServiceUnit unit, Throwable cause) {
        try {
            recoveryExecutor.execute(() -> recover(unit, cause));
        } catch (RejectedExecutionException e) {
            logger.debug("Supervisor closed; not recovering {} unit {}", unit.serviceName(), unit.id());
        }
    }

    private void recover(ServiceUnit unit, Throwable cause) {
        String name = unit.serviceName();
        if (!reportDead(name, unit, "execution unit " + unit.id() + " crashed: " + cause)) {
            return;
        }
        if (!config.isAutoRestart() || shutdown) {
            return;
        }
        try {
            ServiceDescriptor restarted = restartService(name);
            logger.info("Service {} restarted after crash as unit {}", name, restarted.executionHandle().id());
        } catch (RestartLimitExceededException e) {
            logger.error("Service {} will not be restarted: {}", name, e.getMessage());
        } catch (StartupException e) {
            logger.error("Service {} failed to restart: {}", name, e.getMessage());
        } catch (OrchestrationException | IllegalStateException e) {
            logger.warn("Service {} restart skipped: {}", name, e.getMessage());
        }
    }

    // ---------------------------------------------------------------- accessors

    public ServiceRegistry getRegistry() {
        return registry;
    }

    public StatisticsStore getStatistics() {
        return statistics;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public List<ServiceDescriptor> listServices() {
        return registry.list();
    }

    int pendingCallCount() {
        return pendingCalls.size();
    }

    // ---------------------------------------------------------------- internals

    private ServiceUnit newUnit(String name, ServiceEntrypoint entrypoint) {
        ServiceHandler<?> handler;
        try {
            handler = entrypoint.create();
        } catch (RuntimeException e) {
            throw new StartupException(name, "Entrypoint of " + name + " failed: " + e.getMessage(), e);
        }
        if (handler == null) {
            throw new StartupException(name, "Entrypoint of " + name + " returned no handler");
        }
        long id = unitIds.incrementAndGet();
        Channel<Message> inbox = Channels.create(config.getChannelType(), name + "-inbox-" + id, config.getInboxCapacity());
        return new ServiceUnit(id, name, inbox, handler,
                new ServiceContextImpl(name, this, statistics),
                statistics, pendingCalls::complete, this::onUnitCrash, config.getClock(), config.getHeartbeatInterval());
    }

    private ServiceDescriptor launch(String name, ServiceUnit unit) {
        unit.start();
        boolean ready;
        try {
            ready = unit.awaitReady(config.getStartupGracePeriod());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ready = false;
        }
        if (ready) {
            Optional<ServiceDescriptor> running = registry.updateStatusIfCurrent(name, unit, ServiceStatus.RUNNING, null);
            if (running.isPresent()) {
                return running.get();
            }
        }

        Throwable cause = unit.getStartupFailure();
        String reason = cause != null
                ? "failed to start: " + cause.getMessage()
                : "not ready within " + config.getStartupGracePeriod().toMillis() + "ms";
        unit.terminate();
        registry.updateStatusIfCurrent(name, unit, ServiceStatus.DEAD, reason);
        releaseInbox(name, unit.inbox());
        logger.error("Service {} {}", name, reason);
        throw cause != null
                ? new StartupException(name, "Service " + name + " " + reason, cause)
                : new StartupException(name, "Service " + name + " " + reason);
    }

    private void halt(ServiceDescriptor descriptor, boolean graceful) {
        ExecutionHandle handle = descriptor.executionHandle();
        String name = descriptor.name();
        boolean exited = !handle.isAlive();

        if (graceful && !exited) {
            try {
                descriptor.inbox().send(MessageProtocol.buildShutdown(SUPERVISOR, name, config.getClock()));
            } catch (QueueOverflowException e) {
                logger.warn("Inbox of {} is full; signalling shutdown directly", name);
                if (handle instanceof ServiceUnit unit) {
                    unit.requestShutdown();
                }
            }
            exited = awaitExit(handle, config.getDrainTimeout());
            if (!exited) {
                logger.warn("Service {} did not drain within {}ms, terminating", name, config.getDrainTimeout().toMillis());
            }
        }
        if (!exited) {
            handle.terminate();
            if (!awaitExit(handle, FORCED_EXIT_WAIT)) {
                logger.warn("Service {} unit {} ignored termination; abandoning it", name, handle.id());
            }
        }
        releaseInbox(name, descriptor.inbox());
    }

    private static boolean awaitExit(ExecutionHandle handle, Duration timeout) {
        try {
            return handle.awaitTermination(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void releaseInbox(String name, Channel<Message> inbox) {
        List<Message> undelivered = inbox.drain();
        int answered = 0;
        for (Message message : undelivered) {
            if (message.isRequest() && !MessageProtocol.isShutdown(message)) {
                pendingCalls.complete(MessageProtocol.buildError(message, ErrorCode.SERVICE_UNAVAILABLE,
                        "Service " + name + " stopped before handling the request", config.getClock()));
                answered++;
            }
        }
        if (answered > 0) {
            logger.info("Answered {} undelivered request(s) to {} with SERVICE_UNAVAILABLE", answered, name);
        }
    }

    private void requireOpen() {
        if (shutdown) {
            throw new IllegalStateException("Supervisor is shut down");
        }
    }

    private <R> R withLifecycleLock(String name, Supplier<R> action) {
        ReentrantLock lock = lifecycleLocks.computeIfAbsent(name, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
