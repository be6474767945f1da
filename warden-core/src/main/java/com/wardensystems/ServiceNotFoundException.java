package com.wardensystems;

/**
 * Thrown when a lifecycle operation names a service that is not registered.
 */
public class ServiceNotFoundException extends OrchestrationException {

    public ServiceNotFoundException(String serviceName) {
        super("No such service: " + serviceName, serviceName);
    }
}
