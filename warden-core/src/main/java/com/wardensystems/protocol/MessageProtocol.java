package com.wardensystems.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds and checks the envelopes exchanged between services.
 *
 * <p>The correlation id is generated once per request and copied verbatim into the answer, so a
 * caller with several outstanding requests can match replies that arrive out of order. Only the
 * envelope is checked here; required payload fields are the receiving service's business.</p>
 */
public final class MessageProtocol {

    private static final Logger logger = LoggerFactory.getLogger(MessageProtocol.class);

    /** Payload key holding the {@link ErrorCode} of an ERROR message. */
    public static final String ERROR_KEY = "error";

    /** Payload key holding a human-readable detail. */
    public static final String MESSAGE_KEY = "message";

    /** Reserved action asking a service to finish in-flight work and exit. */
    public static final String SHUTDOWN_ACTION = "system.shutdown";

    /** Built-in liveness action every service answers with {@code {"pong": true}}. */
    public static final String PING_ACTION = "ping";

    private MessageProtocol() {
    }

    /**
     * Creates a REQUEST with a fresh correlation id.
     *
     * @param source the calling service
     * @param target the service that should handle the request
     * @param action the operation to perform
     * @param payload request data, may be null
     * @return a new request message
     */
    public static Message buildRequest(String source, String target, String action, Map<String, Object> payload) {
        return buildRequest(source, target, action, payload, Clock.systemUTC());
    }

    /**
     * Creates a REQUEST with a fresh correlation id, stamped with the given clock.
     *
     * @param source the calling service
     * @param target the service that should handle the request
     * @param action the operation to perform
     * @param payload request data, may be null
     * @param clock the time source for the timestamp
     * @return a new request message
     */
    public static Message buildRequest(String source, String target, String action, Map<String, Object> payload,
                                       Clock clock) {
        return new Message(newCorrelationId(), source, target, action, payload, MessageKind.REQUEST, clock.instant());
    }

    /**
     * Creates the answer to a request, reusing its correlation id and action and swapping source and target.
     *
     * @param request the request being answered
     * @param payload answer data, may be null
     * @param ok true for a RESPONSE, false for an ERROR
     * @return the answer message
     */
    public static Message buildResponse(Message request, Map<String, Object> payload, boolean ok) {
        return buildResponse(request, payload, ok, Clock.systemUTC());
    }

    /**
     * Creates the answer to a request, stamped with the given clock.
     *
     * @param request the request being answered
     * @param payload answer data, may be null
     * @param ok true for a RESPONSE, false for an ERROR
     * @param clock the time source for the timestamp
     * @return the answer message
     */
    public static Message buildResponse(Message request, Map<String, Object> payload, boolean ok, Clock clock) {
        Objects.requireNonNull(request, "request cannot be null");
        return new Message(
                request.correlationId(),
                request.targetService(),
                request.sourceService(),
                request.action(),
                payload,
                ok ? MessageKind.RESPONSE : MessageKind.ERROR,
                clock.instant());
    }

    /**
     * Creates an ERROR answer carrying a reason code and detail.
     *
     * @param request the request being answered
     * @param code the machine-readable reason
     * @param detail human-readable detail, may be null
     * @return the error message
     */
    public static Message buildError(Message request, ErrorCode code, String detail) {
        return buildError(request, code, detail, Clock.systemUTC());
    }

    public static Message buildError(Message request, ErrorCode code, String detail, Clock clock) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ERROR_KEY, code.name());
        if (detail != null) {
            payload.put(MESSAGE_KEY, detail);
        }
        return buildResponse(request, payload, false, clock);
    }

    /**
     * Creates the shutdown request sent to a service during a graceful stop.
     *
     * @param source the stopping party
     * @param target the service to stop
     * @return the shutdown request
     */
    public static Message buildShutdown(String source, String target) {
        return buildShutdown(source, target, Clock.systemUTC());
    }

    public static Message buildShutdown(String source, String target, Clock clock) {
        return buildRequest(source, target, SHUTDOWN_ACTION, null, clock);
    }

    public static boolean isShutdown(Message message) {
        return message.isRequest() && SHUTDOWN_ACTION.equals(message.action());
    }

    /**
     * Checks envelope shape: non-blank identifiers and action.
     *
     * @param message the message to check
     * @return true if the envelope is well formed
     */
    public static boolean validateEnvelope(Message message) {
        if (message == null) {
            logger.error("Invalid message: null");
            return false;
        }
        if (isBlank(message.correlationId())) {
            logger.error("Invalid message: missing correlationId");
            return false;
        }
        if (isBlank(message.sourceService()) || isBlank(message.targetService())) {
            logger.error("Invalid message {}: missing source or target", message.correlationId());
            return false;
        }
        if (isBlank(message.action())) {
            logger.error("Invalid message {}: missing action", message.correlationId());
            return false;
        }
        return true;
    }

    private static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
