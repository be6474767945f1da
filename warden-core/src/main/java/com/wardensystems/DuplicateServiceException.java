package com.wardensystems;

/**
 * Thrown when a service name is registered while an active registration already holds it.
 */
public class DuplicateServiceException extends OrchestrationException {

    public DuplicateServiceException(String serviceName) {
        super("Service already registered and active: " + serviceName, serviceName);
    }
}
