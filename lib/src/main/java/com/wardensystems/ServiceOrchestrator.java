package com.wardensystems;

import com.wardensystems.config.OrchestratorConfig;
import com.wardensystems.monitor.HealthMonitor;
import com.wardensystems.registry.ServiceDescriptor;
import com.wardensystems.registry.ServiceRegistry;
import com.wardensystems.service.ServiceEntrypoint;
import com.wardensystems.stats.StatisticsStore;
import com.wardensystems.supervisor.ServiceSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the runtime: wires the statistics store, the registry, the supervisor and the health
 * monitor together, and exposes the operations an external gateway needs.
 *
 * <pre>{@code
 * try (ServiceOrchestrator orchestrator = new ServiceOrchestrator()) {
 *     orchestrator.start();
 *     orchestrator.startService("UserService", UserService::new);
 *     Map<String, Object> user = orchestrator.call("UserService", "create_user",
 *             Map.of("username", "ada", "email", "ada@example.com"));
 * }
 * }</pre>
 */
public class ServiceOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ServiceOrchestrator.class);

    /** Source name of calls made through the orchestrator. */
    public static final String GATEWAY = "gateway";

    private final OrchestratorConfig config;
    private final StatisticsStore statistics;
    private final ServiceRegistry registry;
    private final ServiceSupervisor supervisor;
    private final HealthMonitor monitor;

    public ServiceOrchestrator() {
        this(new OrchestratorConfig());
    }

    public ServiceOrchestrator(OrchestratorConfig config) {
        this.config = config.validate();
        this.statistics = new StatisticsStore(config.getClock());
        this.registry = new ServiceRegistry(config.getClock());
        this.supervisor = new ServiceSupervisor(config, registry, statistics);
        this.monitor = new HealthMonitor(supervisor, config);
    }

    /**
     * Starts health monitoring. Services can be started before or after this call.
     */
    public void start() {
        monitor.start();
        logger.info("Orchestrator started");
    }

    /**
     * Stops monitoring, then every service. Outstanding calls fail with SERVICE_UNAVAILABLE.
     */
    public void shutdown() {
        if (supervisor.isShutdown()) {
            return;
        }
        monitor.stop();
        supervisor.shutdown();
        logger.info("Orchestrator shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public ServiceDescriptor startService(String name, ServiceEntrypoint entrypoint) {
        return supervisor.startService(name, entrypoint);
    }

    public ServiceDescriptor stopService(String name) {
        return supervisor.stopService(name, true);
    }

    public ServiceDescriptor stopService(String name, boolean graceful) {
        return supervisor.stopService(name, graceful);
    }

    public ServiceDescriptor restartService(String name) {
        return supervisor.restartService(name);
    }

    /**
     * Calls a service with the default timeout.
     *
     * @param target the service name
     * @param action the action
     * @param payload the request payload, may be null
     * @return the response payload
     * @throws ServiceCallException if the service answers with an error or is unavailable
     * @throws ServiceTimeoutException if the service does not answer in time
     * @throws QueueOverflowException if the service's inbox is full
     */
    public Map<String, Object> call(String target, String action, Map<String, Object> payload) {
        return supervisor.dispatchCall(GATEWAY, target, action, payload);
    }

    public Map<String, Object> call(String target, String action, Map<String, Object> payload, Duration timeout) {
        return supervisor.dispatchCall(GATEWAY, target, action, payload, timeout);
    }

    public CompletableFuture<Map<String, Object>> callAsync(String target, String action, Map<String, Object> payload) {
        return supervisor.dispatchCallAsync(GATEWAY, target, action, payload, config.getCallTimeout());
    }

    public List<ServiceDescriptor> listServices() {
        return registry.list();
    }

    /**
     * Builds the health view of one service.
     *
     * @param name the service name
     * @return the health view, or empty if the name is not registered
     */
    public Optional<ServiceHealth> health(String name) {
        Instant now = config.getClock().instant();
        return registry.get(name).map(descriptor ->
                ServiceHealth.of(descriptor, monitor.heartbeatAge(descriptor, now), statistics.snapshot(name)));
    }

    public List<ServiceHealth> healthAll() {
        Instant now = config.getClock().instant();
        return registry.list().stream()
                .map(descriptor -> ServiceHealth.of(descriptor, monitor.heartbeatAge(descriptor, now),
                        statistics.snapshot(descriptor.name())))
                .toList();
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public StatisticsStore getStatistics() {
        return statistics;
    }

    public ServiceRegistry getRegistry() {
        return registry;
    }

    public ServiceSupervisor getSupervisor() {
        return supervisor;
    }

    public HealthMonitor getMonitor() {
        return monitor;
    }
}
