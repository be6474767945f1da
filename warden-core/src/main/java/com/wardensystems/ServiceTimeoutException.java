package com.wardensystems;

import java.time.Duration;

/**
 * Thrown when a call to another service receives no reply within its timeout.
 * The correlation id has been retired by the time this is thrown; a late reply is discarded.
 */
public class ServiceTimeoutException extends OrchestrationException {

    private final String action;
    private final String correlationId;
    private final Duration timeout;

    public ServiceTimeoutException(String serviceName, String action, String correlationId, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for " + serviceName + " to answer '" + action + "'",
                serviceName);
        this.action = action;
        this.correlationId = correlationId;
        this.timeout = timeout;
    }

    public String getAction() {
        return action;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
