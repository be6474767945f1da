package com.wardensystems;

/**
 * Thrown when a service unit does not become ready within the startup grace period,
 * or fails while initializing.
 */
public class StartupException extends OrchestrationException {

    public StartupException(String serviceName, String message) {
        super(message, serviceName);
    }

    public StartupException(String serviceName, String message, Throwable cause) {
        super(message, cause, serviceName);
    }
}
