package com.wardensystems.protocol;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unit of inter-service communication. Immutable once built; the payload is copied on construction.
 *
 * <p>Instances are normally created through {@link MessageProtocol} so that correlation ids are
 * generated and copied consistently.</p>
 *
 * @param correlationId links a REQUEST to its RESPONSE or ERROR
 * @param sourceService the sending service (or an external caller such as a gateway)
 * @param targetService the receiving service
 * @param action the operation the receiver should perform
 * @param payload structured key/value data
 * @param kind the role of this message
 * @param timestamp creation time
 */
public record Message(
        String correlationId,
        String sourceService,
        String targetService,
        String action,
        Map<String, Object> payload,
        MessageKind kind,
        Instant timestamp) {

    public Message {
        Objects.requireNonNull(correlationId, "correlationId cannot be null");
        Objects.requireNonNull(sourceService, "sourceService cannot be null");
        Objects.requireNonNull(targetService, "targetService cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        payload = payload == null || payload.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public boolean isRequest() {
        return kind == MessageKind.REQUEST;
    }

    public boolean isError() {
        return kind == MessageKind.ERROR;
    }

    /**
     * Returns the reason code of an ERROR message.
     *
     * @return the error code, or null for non-error messages
     */
    public ErrorCode errorCode() {
        if (kind != MessageKind.ERROR) {
            return null;
        }
        return ErrorCode.fromValue(payload.get(MessageProtocol.ERROR_KEY));
    }

    /**
     * Returns the human-readable detail of an ERROR message.
     *
     * @return the detail, or null if absent
     */
    public String errorMessage() {
        Object detail = payload.get(MessageProtocol.MESSAGE_KEY);
        return detail != null ? detail.toString() : null;
    }
}
