package com.wardensystems.supervisor;

import com.wardensystems.ServiceCallException;
import com.wardensystems.ServiceTimeoutException;
import com.wardensystems.channel.Channel;
import com.wardensystems.protocol.ErrorCode;
import com.wardensystems.protocol.Message;
import com.wardensystems.protocol.MessageProtocol;
import com.wardensystems.registry.ExecutionHandle;
import com.wardensystems.service.ServiceContext;
import com.wardensystems.service.ServiceException;
import com.wardensystems.service.ServiceHandler;
import com.wardensystems.stats.StatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Execution unit of one service instance: a dedicated thread that owns the handler, polls the inbox,
 * answers every request exactly once and writes a heartbeat on each cycle.
 *
 * <p>The loop checks its shutdown flag on every iteration, so a graceful stop is observed even when the
 * shutdown message cannot be queued. Forced termination sets a flag and interrupts the thread; a
 * terminated unit stops writing heartbeats and reports itself dead immediately.</p>
 *
 * <p>An {@link Error} thrown by the handler is answered with INTERNAL_ERROR and then ends the unit.
 * A unit whose loop ends that way, without being stopped or terminated, hands the cause to its crash
 * listener.</p>
 */
final class ServiceUnit implements ExecutionHandle {

    private static final Logger logger = LoggerFactory.getLogger(ServiceUnit.class);

    private static final Map<String, Object> PONG = Map.of("pong", true);

    private final long id;
    private final String serviceName;
    private final Channel<Message> inbox;
    private final ServiceHandler<Object> handler;
    private final ServiceContext context;
    private final StatisticsStore statistics;
    private final Consumer<Message> replySink;
    private final BiConsumer<ServiceUnit, Throwable> crashListener;
    private final Clock clock;
    private final long heartbeatNanos;

    private final CountDownLatch readyLatch = new CountDownLatch(1);
    private final CountDownLatch exitLatch = new CountDownLatch(1);

    private volatile boolean running = false;
    private volatile boolean terminated = false;
    private volatile Throwable startupFailure;
    private volatile Thread thread;

    @SuppressWarnings("unchecked")
    ServiceUnit(long id,
                String serviceName,
                Channel<Message> inbox,
                ServiceHandler<?> handler,
                ServiceContext context,
                StatisticsStore statistics,
                Consumer<Message> replySink,
                BiConsumer<ServiceUnit, Throwable> crashListener,
                Clock clock,
                Duration heartbeatInterval) {
        this.id = id;
        this.serviceName = serviceName;
        this.inbox = inbox;
        this.handler = (ServiceHandler<Object>) handler;
        this.context = context;
        this.statistics = statistics;
        this.replySink = replySink;
        this.crashListener = crashListener;
        this.clock = clock;
        this.heartbeatNanos = heartbeatInterval.toNanos();
    }

    /**
     * Launches the unit's thread. Readiness is signalled by the first heartbeat.
     */
    void start() {
        running = true;
        Thread unitThread = new Thread(this::run, "service-" + serviceName + "-" + id);
        unitThread.setDaemon(true);
        unitThread.setUncaughtExceptionHandler((t, e) ->
                logger.error("Service {} unit {} crashed", serviceName, id, e));
        thread = unitThread;
        unitThread.start();
    }

    /**
     * Waits for the first heartbeat.
     *
     * @param timeout the grace period
     * @return true if the unit became ready in time
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitReady(Duration timeout) throws InterruptedException {
        return readyLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS)
                && startupFailure == null
                && isAlive();
    }

    Throwable getStartupFailure() {
        return startupFailure;
    }

    /**
     * Asks the loop to exit after the message in hand, without interrupting it.
     */
    void requestShutdown() {
        running = false;
    }

    Channel<Message> inbox() {
        return inbox;
    }

    String serviceName() {
        return serviceName;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public boolean isAlive() {
        Thread current = thread;
        return current != null && current.isAlive() && !terminated;
    }

    @Override
    public void terminate() {
        if (terminated) {
            return;
        }
        terminated = true;
        running = false;
        Thread current = thread;
        if (current != null && current != Thread.currentThread()) {
            current.interrupt();
        }
        logger.info("Service {} unit {} terminated", serviceName, id);
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return exitLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void run() {
        boolean started = false;
        Throwable crash = null;
        try {
            try {
                statistics.initialize(serviceName);
                handler.preStart(context);
                started = true;
            } catch (RuntimeException | Error e) {
                startupFailure = e;
                logger.error("Service {} unit {} failed to start", serviceName, id, e);
                return;
            }
            beat();
            readyLatch.countDown();
            logger.info("Service {} running as unit {}", serviceName, id);
            processLoop();
        } catch (RuntimeException | Error e) {
            crash = e;
            logger.error("Service {} unit {} crashed", serviceName, id, e);
        } finally {
            readyLatch.countDown();
            if (started) {
                try {
                    handler.postStop(context);
                } catch (RuntimeException e) {
                    logger.warn("Service {} postStop failed", serviceName, e);
                }
            }
            exitLatch.countDown();
            logger.info("Service {} unit {} exited", serviceName, id);
        }
        if (crash != null && !terminated) {
            crashListener.accept(this, crash);
        }
    }

    private void processLoop() {
        while (running && !terminated) {
            Message message;
            try {
                message = inbox.poll(heartbeatNanos, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                logger.debug("Service {} unit {} interrupted", serviceName, id);
                Thread.currentThread().interrupt();
                break;
            }
            if (message == null) {
                beat();
                continue;
            }
            if (terminated) {
                // Taken after the unit was killed; answer it so the caller is not left waiting
                reply(MessageProtocol.buildError(message, ErrorCode.SERVICE_UNAVAILABLE,
                        "Service " + serviceName + " was terminated", clock));
                break;
            }
            if (MessageProtocol.isShutdown(message)) {
                logger.info("Service {} received shutdown request", serviceName);
                running = false;
                break;
            }
            process(message);
            beat();
        }
    }

    private void process(Message message) {
        if (!message.isRequest()) {
            logger.warn("Service {} discarding unexpected {} message {}", serviceName, message.kind(), message.correlationId());
            return;
        }
        statistics.recordRequest(serviceName);

        Message answer;
        if (!MessageProtocol.validateEnvelope(message)) {
            answer = MessageProtocol.buildError(message, ErrorCode.MALFORMED_MESSAGE, "Malformed request envelope", clock);
        } else if (MessageProtocol.PING_ACTION.equals(message.action())) {
            answer = MessageProtocol.buildResponse(message, PONG, true, clock);
        } else {
            try {
                answer = invoke(message);
            } catch (Error e) {
                // answer the caller before the Error ends the loop
                statistics.recordError(serviceName);
                reply(MessageProtocol.buildError(message, ErrorCode.INTERNAL_ERROR,
                        "Service " + serviceName + " failed: " + e, clock));
                throw e;
            }
        }

        if (answer.isError()) {
            statistics.recordError(serviceName);
        }
        reply(answer);
    }

    private Message invoke(Message request) {
        try {
            Object command = handler.decode(request.action(), request.payload());
            Map<String, Object> result = handler.handle(command, context);
            return MessageProtocol.buildResponse(request, result, true, clock);
        } catch (ServiceException e) {
            logger.debug("Service {} rejected '{}': {} {}", serviceName, request.action(), e.getErrorCode(), e.getMessage());
            return MessageProtocol.buildError(request, e.getErrorCode(), e.getMessage(), clock);
        } catch (ServiceTimeoutException e) {
            return MessageProtocol.buildError(request, ErrorCode.SERVICE_UNAVAILABLE, e.getMessage(), clock);
        } catch (ServiceCallException e) {
            return MessageProtocol.buildError(request, ErrorCode.HANDLER_FAILURE, e.getMessage(), clock);
        } catch (RuntimeException e) {
            logger.error("Service {} error processing '{}' ({})", serviceName, request.action(), request.correlationId(), e);
            return MessageProtocol.buildError(request, ErrorCode.INTERNAL_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), clock);
        }
    }

    private void reply(Message answer) {
        try {
            replySink.accept(answer);
        } catch (RuntimeException e) {
            logger.error("Service {} could not deliver reply {}", serviceName, answer.correlationId(), e);
        }
    }

    private void beat() {
        if (!terminated) {
            statistics.recordHeartbeat(serviceName);
        }
    }

    @Override
    public String toString() {
        return "ServiceUnit[" + serviceName + "#" + id + (isAlive() ? ", alive" : ", exited") + "]";
    }
}
