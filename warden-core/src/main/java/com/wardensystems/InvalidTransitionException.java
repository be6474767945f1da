package com.wardensystems;

/**
 * Thrown when a status change is not permitted by the service lifecycle state machine.
 */
public class InvalidTransitionException extends OrchestrationException {

    private final String from;
    private final String to;

    public InvalidTransitionException(String serviceName, String from, String to) {
        super("Illegal status transition for " + serviceName + ": " + from + " -> " + to, serviceName);
        this.from = from;
        this.to = to;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
