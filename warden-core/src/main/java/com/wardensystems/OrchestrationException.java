package com.wardensystems;

/**
 * Base class for every error raised by the orchestration runtime.
 * Carries the name of the service the failure relates to, when there is one.
 */
public class OrchestrationException extends RuntimeException {

    /** The name of the service where the failure occurred. */
    private final String serviceName;

    /**
     * Creates a new OrchestrationException with the specified detail message.
     *
     * @param message the detail message
     */
    public OrchestrationException(String message) {
        super(message);
        this.serviceName = null;
    }

    /**
     * Creates a new OrchestrationException with the specified detail message and service name.
     *
     * @param message the detail message
     * @param serviceName the service the failure relates to
     */
    public OrchestrationException(String message, String serviceName) {
        super(message);
        this.serviceName = serviceName;
    }

    /**
     * Creates a new OrchestrationException with the specified detail message, cause, and service name.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param serviceName the service the failure relates to
     */
    public OrchestrationException(String message, Throwable cause, String serviceName) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    /**
     * Returns the name of the service where the failure occurred.
     *
     * @return the service name, or null if not specified
     */
    public String getServiceName() {
        return serviceName;
    }
}
