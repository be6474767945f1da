package com.wardensystems.monitor;

import com.wardensystems.OrchestrationException;
import com.wardensystems.RestartLimitExceededException;
import com.wardensystems.StartupException;
import com.wardensystems.config.OrchestratorConfig;
import com.wardensystems.registry.ExecutionHandle;
import com.wardensystems.registry.ServiceDescriptor;
import com.wardensystems.registry.ServiceStatus;
import com.wardensystems.stats.HeartbeatRecord;
import com.wardensystems.stats.StatisticsStore;
import com.wardensystems.supervisor.ServiceSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically classifies every RUNNING or DEGRADED service by heartbeat age and unit liveness,
 * and asks the supervisor to restart services found dead.
 *
 * <p>The monitor never touches execution units directly: verdicts go through the supervisor, which
 * ignores them when the observed unit has been replaced in the meantime.</p>
 */
public class HealthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

    /**
     * Verdict for one service in one cycle.
     */
    public enum Verdict {
        HEALTHY,
        SLOW,
        DEAD
    }

    private final ServiceSupervisor supervisor;
    private final OrchestratorConfig config;
    private final AtomicLong cycles = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public HealthMonitor(ServiceSupervisor supervisor, OrchestratorConfig config) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Starts the periodic check loop. Calling start on a running monitor does nothing.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMillis = config.getCheckInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::runCycle, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        running = true;
        logger.info("Health monitor started (interval {}ms, slow {}ms, dead {}ms)", intervalMillis,
                config.getSlowThreshold().toMillis(), config.getDeadThreshold().toMillis());
    }

    /**
     * Stops the loop and waits briefly for a cycle in progress.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Health monitor stopped after {} cycles", cycles.get());
    }

    public boolean isRunning() {
        return running;
    }

    public long getCycleCount() {
        return cycles.get();
    }

    private void runCycle() {
        try {
            checkOnce();
        } catch (RuntimeException e) {
            // keep the schedule alive; a thrown exception would cancel it
            logger.error("Health check cycle failed", e);
        }
    }

    /**
     * Runs one check cycle over all RUNNING and DEGRADED services.
     */
    public void checkOnce() {
        cycles.incrementAndGet();
        Instant now = config.getClock().instant();
        for (ServiceDescriptor descriptor : supervisor.listServices()) {
            if (descriptor.status() != ServiceStatus.RUNNING && descriptor.status() != ServiceStatus.DEGRADED) {
                continue;
            }
            try {
                check(descriptor, now);
            } catch (RuntimeException e) {
                logger.error("Health check of {} failed", descriptor.name(), e);
            }
        }
    }

    /**
     * Classifies one service without acting on it.
     *
     * @param descriptor the registry entry
     * @param now the reference time
     * @return the verdict
     */
    public Verdict evaluate(ServiceDescriptor descriptor, Instant now) {
        if (!descriptor.executionHandle().isAlive()) {
            return Verdict.DEAD;
        }
        Duration age = heartbeatAge(descriptor, now);
        if (age.compareTo(config.getDeadThreshold()) > 0) {
            return Verdict.DEAD;
        }
        if (age.compareTo(config.getSlowThreshold()) > 0) {
            return Verdict.SLOW;
        }
        return Verdict.HEALTHY;
    }

    /**
     * Age of the last heartbeat, or of the start time when the unit never wrote one.
     *
     * @param descriptor the registry entry
     * @param now the reference time
     * @return the non-negative age
     */
    public Duration heartbeatAge(ServiceDescriptor descriptor, Instant now) {
        StatisticsStore statistics = supervisor.getStatistics();
        return statistics.heartbeat(descriptor.name())
                .map(record -> record.age(now))
                .orElseGet(() -> new HeartbeatRecord(descriptor.name(), descriptor.startedAt(), 0).age(now));
    }

    private void check(ServiceDescriptor descriptor, Instant now) {
        String name = descriptor.name();
        ExecutionHandle handle = descriptor.executionHandle();
        switch (evaluate(descriptor, now)) {
            case HEALTHY -> {
                if (descriptor.status() != ServiceStatus.RUNNING && supervisor.reportHealth(name, handle, ServiceStatus.RUNNING)) {
                    logger.info("Service {} recovered", name);
                }
            }
            case SLOW -> {
                if (descriptor.status() != ServiceStatus.DEGRADED && supervisor.reportHealth(name, handle, ServiceStatus.DEGRADED)) {
                    logger.warn("Service {} is slow: last heartbeat {}ms ago", name, heartbeatAge(descriptor, now).toMillis());
                }
            }
            case DEAD -> handleDead(descriptor, now);
        }
    }

    private void handleDead(ServiceDescriptor descriptor, Instant now) {
        String name = descriptor.name();
        String reason = descriptor.executionHandle().isAlive()
                ? "no heartbeat for " + heartbeatAge(descriptor, now).toMillis() + "ms"
                : "execution unit " + descriptor.executionHandle().id() + " exited";
        if (!supervisor.reportDead(name, descriptor.executionHandle(), reason)) {
            return;
        }
        logger.warn("Service {} is dead: {}", name, reason);
        if (!config.isAutoRestart()) {
            return;
        }
        try {
            ServiceDescriptor restarted = supervisor.restartService(name);
            logger.info("Service {} restarted as unit {} (restart #{})", name,
                    restarted.executionHandle().id(), restarted.restartCount());
        } catch (RestartLimitExceededException e) {
            logger.error("Service {} will not be restarted: {}", name, e.getMessage());
        } catch (StartupException e) {
            logger.error("Service {} failed to restart: {}", name, e.getMessage());
        } catch (OrchestrationException e) {
            logger.warn("Service {} restart skipped: {}", name, e.getMessage());
        }
    }
}
