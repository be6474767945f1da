package com.wardensystems.supervisor;

import com.wardensystems.DuplicateServiceException;
import com.wardensystems.InvalidTransitionException;
import com.wardensystems.ScriptedService;
import com.wardensystems.QueueOverflowException;
import com.wardensystems.RestartLimitExceededException;
import com.wardensystems.ServiceCallException;
import com.wardensystems.ServiceNotFoundException;
import com.wardensystems.ServiceTimeoutException;
import com.wardensystems.StartupException;
import com.wardensystems.channel.ChannelType;
import com.wardensystems.config.OrchestratorConfig;
import com.wardensystems.protocol.ErrorCode;
import com.wardensystems.registry.ServiceDescriptor;
import com.wardensystems.registry.ServiceRegistry;
import com.wardensystems.registry.ServiceStatus;
import com.wardensystems.stats.StatisticsStore;
import com.wardensystems.test.AsyncAssertion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class ServiceSupervisorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ServiceSupervisor supervisor;
    private ServiceRegistry registry;
    private StatisticsStore statistics;

    private OrchestratorConfig baseConfig() {
        return new OrchestratorConfig()
                .setHeartbeatInterval(Duration.ofMillis(50))
                .setStartupGracePeriod(Duration.ofSeconds(2))
                .setDrainTimeout(Duration.ofSeconds(2))
                .setCallTimeout(Duration.ofSeconds(2))
                .setMaxRestarts(2);
    }

    private void createSupervisor(OrchestratorConfig config) {
        if (supervisor != null) {
            supervisor.shutdown();
        }
        statistics = new StatisticsStore(config.getClock());
        registry = new ServiceRegistry(config.getClock());
        supervisor = new ServiceSupervisor(config, registry, statistics);
    }

    @BeforeEach
    void setUp() {
        createSupervisor(baseConfig());
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private Map<String, Object> call(String target, String action, Map<String, Object> payload) {
        return supervisor.dispatchCall("test", target, action, payload);
    }

    private CompletableFuture<Map<String, Object>> callAsync(String target, String action, Map<String, Object> payload) {
        return supervisor.dispatchCallAsync("test", target, action, payload, Duration.ofSeconds(5));
    }

    private static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return error.getCause();
    }

    @Nested
    class Starting {

        @Test
        void startedServiceIsRunningAndAnswersPing() {
            ScriptedService scripted = new ScriptedService();

            ServiceDescriptor descriptor = supervisor.startService("scripted", scripted.entrypoint());

            assertEquals(ServiceStatus.RUNNING, descriptor.status());
            assertEquals(0, descriptor.restartCount());
            assertTrue(descriptor.executionHandle().isAlive());
            assertEquals(Map.of("pong", true), call("scripted", "ping", null));
            assertEquals(1, scripted.launches.get());
            assertTrue(statistics.heartbeat("scripted").isPresent());
        }

        @Test
        void activeNameIsRejected() {
            supervisor.startService("scripted", new ScriptedService().entrypoint());

            assertThrows(DuplicateServiceException.class,
                    () -> supervisor.startService("scripted", new ScriptedService().entrypoint()));
        }

        @Test
        void failingEntrypointLeavesNoRegistration() {
            StartupException error = assertThrows(StartupException.class,
                    () -> supervisor.startService("broken", () -> {
                        throw new IllegalStateException("no config");
                    }));

            assertEquals("broken", error.getServiceName());
            assertTrue(registry.get("broken").isEmpty());
        }

        @Test
        void failingPreStartMarksServiceDead() {
            ScriptedService scripted = new ScriptedService().failOnStart(true);

            StartupException error = assertThrows(StartupException.class,
                    () -> supervisor.startService("scripted", scripted.entrypoint()));

            ServiceDescriptor descriptor = registry.get("scripted").orElseThrow();
            assertEquals(ServiceStatus.DEAD, descriptor.status());
            assertTrue(descriptor.statusDetail().contains("scripted service refused to start"), descriptor.statusDetail());
            assertInstanceOf(IllegalStateException.class, error.getCause());
            assertFalse(descriptor.executionHandle().isAlive());
        }

        @Test
        void serviceNotReadyWithinGracePeriodIsKilled() {
            createSupervisor(baseConfig().setStartupGracePeriod(Duration.ofMillis(200)));
            ScriptedService scripted = new ScriptedService().startDelay(Duration.ofSeconds(5));

            assertThrows(StartupException.class, () -> supervisor.startService("slow", scripted.entrypoint()));

            ServiceDescriptor descriptor = registry.get("slow").orElseThrow();
            assertEquals(ServiceStatus.DEAD, descriptor.status());
            assertTrue(descriptor.statusDetail().contains("not ready"), descriptor.statusDetail());
        }
    }

    @Nested
    class Calls {

        @Test
        void errorsAreReportedWithoutKillingTheService() {
            supervisor.startService("scripted", new ScriptedService().entrypoint());

            ServiceCallException unknown = assertThrows(ServiceCallException.class,
                    () -> call("scripted", "does_not_exist", null));
            assertEquals(ErrorCode.UNKNOWN_ACTION, unknown.getErrorCode());
            assertEquals("scripted", unknown.getServiceName());

            ServiceCallException crashed = assertThrows(ServiceCallException.class, () -> call("scripted", "fail", null));
            assertEquals(ErrorCode.INTERNAL_ERROR, crashed.getErrorCode());

            ServiceCallException rejected = assertThrows(ServiceCallException.class, () -> call("scripted", "reject", null));
            assertEquals(ErrorCode.CONFLICT, rejected.getErrorCode());

            assertEquals(Map.of("pong", true), call("scripted", "ping", null));
            assertEquals(ServiceStatus.RUNNING, registry.get("scripted").orElseThrow().status());
            assertEquals(4, statistics.snapshot("scripted").requestCount());
            assertEquals(3, statistics.snapshot("scripted").errorCount());
        }

        @Test
        void handlerErrorIsAnsweredAndTheUnitIsMarkedDead() throws Exception {
            createSupervisor(baseConfig().setAutoRestart(false));
            ScriptedService scripted = new ScriptedService();
            ServiceDescriptor started = supervisor.startService("scripted", scripted.entrypoint());
            callAsync("scripted", "block", null);
            assertTrue(scripted.awaitBlocked(WAIT));
            CompletableFuture<Map<String, Object>> crashed = callAsync("scripted", "crash", null);
            CompletableFuture<Map<String, Object>> queued = callAsync("scripted", "ping", null);

            long start = System.nanoTime();
            scripted.release();

            ServiceCallException crashError = assertInstanceOf(ServiceCallException.class, failureOf(crashed));
            assertEquals(ErrorCode.INTERNAL_ERROR, crashError.getErrorCode());
            assertTrue(crashError.getMessage().contains("boom"), crashError.getMessage());
            ServiceCallException queuedError = assertInstanceOf(ServiceCallException.class, failureOf(queued));
            assertEquals(ErrorCode.SERVICE_UNAVAILABLE, queuedError.getErrorCode());
            assertTrue(millisSince(start) < 2000, "answers took " + millisSince(start) + "ms");

            AsyncAssertion.eventually(() -> registry.get("scripted").orElseThrow().status() == ServiceStatus.DEAD, WAIT);
            assertTrue(registry.get("scripted").orElseThrow().statusDetail().contains("crashed"));
            assertFalse(started.executionHandle().isAlive());
            assertEquals(1, scripted.stops.get());
        }

        @Test
        void crashedServiceIsRestartedWhenAutoRestartIsOn() {
            ScriptedService scripted = new ScriptedService();
            ServiceDescriptor first = supervisor.startService("scripted", scripted.entrypoint());

            ServiceCallException error = assertThrows(ServiceCallException.class, () -> call("scripted", "crash", null));
            assertEquals(ErrorCode.INTERNAL_ERROR, error.getErrorCode());

            AsyncAssertion.eventually(() -> {
                ServiceDescriptor current = registry.get("scripted").orElseThrow();
                return current.status() == ServiceStatus.RUNNING && current.restartCount() == 1;
            }, WAIT);
            assertFalse(first.executionHandle().isAlive());
            assertEquals(2, scripted.launches.get());
            assertEquals(Map.of("pong", true), call("scripted", "ping", null));
        }

        @Test
        void unknownTargetIsUnavailable() {
            ServiceCallException error = assertThrows(ServiceCallException.class, () -> call("ghost", "ping", null));
            assertEquals(ErrorCode.SERVICE_UNAVAILABLE, error.getErrorCode());
        }

        @Test
        void stoppedTargetIsUnavailable() {
            supervisor.startService("scripted", new ScriptedService().entrypoint());
            supervisor.stopService("scripted", true);

            ServiceCallException error = assertThrows(ServiceCallException.class, () -> call("scripted", "ping", null));
            assertEquals(ErrorCode.SERVICE_UNAVAILABLE, error.getErrorCode());
        }

        @Test
        void timeoutRetiresTheCallAndDiscardsTheLateReply() {
            supervisor.startService("scripted", new ScriptedService().entrypoint());

            long start = System.nanoTime();
            ServiceTimeoutException timeout = assertThrows(ServiceTimeoutException.class,
                    () -> supervisor.dispatchCall("test", "scripted", "sleep", Map.of("millis", 1500), Duration.ofMillis(300)));
            long elapsed = millisSince(start);

            assertTrue(elapsed >= 300, "timed out early after " + elapsed + "ms");
            assertTrue(elapsed < 1300, "timed out late after " + elapsed + "ms");
            assertEquals("sleep", timeout.getAction());
            assertEquals(0, supervisor.pendingCallCount());
            assertEquals(Map.of("pong", true), call("scripted", "ping", null));
        }

        @Test
        void asyncCallTimesOut() {
            supervisor.startService("scripted", new ScriptedService().entrypoint());

            long start = System.nanoTime();
            CompletableFuture<Map<String, Object>> reply = supervisor.dispatchCallAsync(
                    "test", "scripted", "sleep", Map.of("millis", 1500), Duration.ofMillis(300));

            assertInstanceOf(ServiceTimeoutException.class, failureOf(reply));
            long elapsed = millisSince(start);
            assertTrue(elapsed >= 300, "timed out early after " + elapsed + "ms");
            assertTrue(elapsed < 1300, "timed out late after " + elapsed + "ms");
            AsyncAssertion.eventually(() -> supervisor.pendingCallCount() == 0, WAIT);
        }

        @Test
        void concurrentCallsAreMatchedToTheirCallers() throws Exception {
            supervisor.startService("scripted", new ScriptedService().entrypoint());

            List<CompletableFuture<Map<String, Object>>> replies = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                replies.add(callAsync("scripted", "echo", Map.of("n", i)));
            }

            for (int i = 0; i < 50; i++) {
                assertEquals(i, replies.get(i).get(5, TimeUnit.SECONDS).get("n"));
            }
        }

        @Test
        void servicesCanCallEachOther() {
            supervisor.startService("front", new ScriptedService().entrypoint());
            supervisor.startService("back", new ScriptedService().entrypoint());

            Map<String, Object> result = call("front", "forward", Map.of("target", "back", "forward_action", "ping"));

            assertEquals(true, result.get("pong"));
        }

        @Test
        void fullInboxRejectsNewRequests() throws Exception {
            createSupervisor(baseConfig().setInboxCapacity(2).setChannelType(ChannelType.LINKED));
            ScriptedService scripted = new ScriptedService();
            supervisor.startService("scripted", scripted.entrypoint());

            CompletableFuture<Map<String, Object>> blocked = callAsync("scripted", "block", null);
            assertTrue(scripted.awaitBlocked(WAIT));
            CompletableFuture<Map<String, Object>> first = callAsync("scripted", "ping", null);
            CompletableFuture<Map<String, Object>> second = callAsync("scripted", "ping", null);

            assertThrows(QueueOverflowException.class, () -> call("scripted", "ping", null));
            assertInstanceOf(QueueOverflowException.class, failureOf(callAsync("scripted", "ping", null)));

            scripted.release();
            assertEquals(true, blocked.get(5, TimeUnit.SECONDS).get("released"));
            assertEquals(true, first.get(5, TimeUnit.SECONDS).get("pong"));
            assertEquals(true, second.get(5, TimeUnit.SECONDS).get("pong"));
        }
    }

    @Nested
    class Stopping {

        @Test
        void gracefulStopFinishesQueuedWork() throws Exception {
            ScriptedService scripted = new ScriptedService();
            supervisor.startService("scripted", scripted.entrypoint());

            List<CompletableFuture<Map<String, Object>>> replies = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                replies.add(callAsync("scripted", "sleep", Map.of("millis", 100)));
            }
            ServiceDescriptor stopped = supervisor.stopService("scripted", true);

            assertEquals(ServiceStatus.STOPPED, stopped.status());
            for (CompletableFuture<Map<String, Object>> reply : replies) {
                assertEquals(100L, reply.get(5, TimeUnit.SECONDS).get("slept"));
            }
            assertEquals(1, scripted.stops.get());
            assertFalse(stopped.executionHandle().isAlive());
        }

        @Test
        void forcedStopAnswersQueuedRequestsAsUnavailable() throws Exception {
            ScriptedService scripted = new ScriptedService();
            supervisor.startService("scripted", scripted.entrypoint());
            callAsync("scripted", "block", null);
            assertTrue(scripted.awaitBlocked(WAIT));
            CompletableFuture<Map<String, Object>> queued = callAsync("scripted", "ping", null);

            supervisor.stopService("scripted", false);

            ServiceCallException error = assertInstanceOf(ServiceCallException.class, failureOf(queued));
            assertEquals(ErrorCode.SERVICE_UNAVAILABLE, error.getErrorCode());
            assertEquals(ServiceStatus.STOPPED, registry.get("scripted").orElseThrow().status());
            AsyncAssertion.eventually(() -> scripted.stops.get() == 1, WAIT);
        }

        @Test
        void gracefulStopFallsBackToTerminationAfterDrainTimeout() throws Exception {
            createSupervisor(baseConfig().setDrainTimeout(Duration.ofMillis(200)));
            ScriptedService scripted = new ScriptedService();
            supervisor.startService("scripted", scripted.entrypoint());
            callAsync("scripted", "block", null);
            assertTrue(scripted.awaitBlocked(WAIT));

            ServiceDescriptor stopped = supervisor.stopService("scripted", true);

            assertEquals(ServiceStatus.STOPPED, stopped.status());
            assertTrue(stopped.executionHandle().awaitTermination(WAIT));
        }

        @Test
        void stopIsIdempotentAndUnknownNamesAreReported() {
            supervisor.startService("scripted", new ScriptedService().entrypoint());

            supervisor.stopService("scripted", true);
            assertEquals(ServiceStatus.STOPPED, supervisor.stopService("scripted", true).status());
            assertThrows(ServiceNotFoundException.class, () -> supervisor.stopService("ghost", true));
        }

        @Test
        void healthReportAfterStopIsIgnored() {
            ServiceDescriptor running = supervisor.startService("scripted", new ScriptedService().entrypoint());
            supervisor.stopService("scripted", true);

            assertFalse(supervisor.reportHealth("scripted", running.executionHandle(), ServiceStatus.DEGRADED));
            assertEquals(ServiceStatus.STOPPED, registry.get("scripted").orElseThrow().status());
        }

        @Test
        void stoppedNameCanBeStartedAgainWithFreshCounter() {
            ScriptedService scripted = new ScriptedService();
            supervisor.startService("scripted", scripted.entrypoint());
            supervisor.restartService("scripted");
            supervisor.stopService("scripted", true);

            ServiceDescriptor again = supervisor.startService("scripted", scripted.entrypoint());

            assertEquals(ServiceStatus.RUNNING, again.status());
            assertEquals(0, again.restartCount());
            assertEquals(3, scripted.launches.get());
        }

        @Test
        void shutdownStopsEverythingAndRejectsNewWork() {
            supervisor.startService("a", new ScriptedService().entrypoint());
            supervisor.startService("b", new ScriptedService().entrypoint());

            supervisor.shutdown();

            assertTrue(registry.list().stream().allMatch(d -> d.status() == ServiceStatus.STOPPED));
            assertThrows(IllegalStateException.class, () -> supervisor.startService("c", new ScriptedService().entrypoint()));
            assertThrows(IllegalStateException.class, () -> call("a", "ping", null));
        }
    }

    @Nested
    class Restarting {

        @Test
        void restartLaunchesFreshUnit() {
            ScriptedService scripted = new ScriptedService();
            ServiceDescriptor first = supervisor.startService("scripted", scripted.entrypoint());

            ServiceDescriptor second = supervisor.restartService("scripted");

            assertEquals(ServiceStatus.RUNNING, second.status());
            assertEquals(1, second.restartCount());
            assertNotEquals(first.executionHandle().id(), second.executionHandle().id());
            assertFalse(first.executionHandle().isAlive());
            assertEquals(2, scripted.launches.get());
            assertEquals(Map.of("pong", true), call("scripted", "ping", null));
        }

        @Test
        void restartLimitLeavesServiceDead() {
            ScriptedService scripted = new ScriptedService();
            supervisor.startService("scripted", scripted.entrypoint());
            supervisor.restartService("scripted");
            supervisor.restartService("scripted");

            RestartLimitExceededException error = assertThrows(RestartLimitExceededException.class,
                    () -> supervisor.restartService("scripted"));

            assertEquals(2, error.getRestartCount());
            assertEquals(2, error.getMaxRestarts());
            ServiceDescriptor descriptor = registry.get("scripted").orElseThrow();
            assertEquals(ServiceStatus.DEAD, descriptor.status());
            assertEquals("restart limit reached (2/2)", descriptor.statusDetail());
            assertFalse(descriptor.executionHandle().isAlive());
            assertEquals(3, scripted.launches.get());
        }

        @Test
        void zeroRestartsAllowedRefusesFirstRestart() {
            createSupervisor(baseConfig().setMaxRestarts(0));
            supervisor.startService("scripted", new ScriptedService().entrypoint());

            assertThrows(RestartLimitExceededException.class, () -> supervisor.restartService("scripted"));
            assertEquals(ServiceStatus.DEAD, registry.get("scripted").orElseThrow().status());
        }

        @Test
        void stoppedServiceCannotBeRestarted() {
            supervisor.startService("scripted", new ScriptedService().entrypoint());
            supervisor.stopService("scripted", true);

            assertThrows(InvalidTransitionException.class, () -> supervisor.restartService("scripted"));
            assertThrows(ServiceNotFoundException.class, () -> supervisor.restartService("ghost"));
        }

        @Test
        void staleDeathReportIsIgnored() {
            ServiceDescriptor first = supervisor.startService("scripted", new ScriptedService().entrypoint());
            supervisor.restartService("scripted");

            assertFalse(supervisor.reportDead("scripted", first.executionHandle(), "late report"));
            assertEquals(ServiceStatus.RUNNING, registry.get("scripted").orElseThrow().status());
        }
    }
}
