package com.wardensystems;

import com.wardensystems.protocol.ErrorCode;

/**
 * Thrown when a called service answers with an ERROR message, or cannot be reached at all.
 */
public class ServiceCallException extends OrchestrationException {

    private final ErrorCode errorCode;

    public ServiceCallException(String serviceName, ErrorCode errorCode, String message) {
        super(message, serviceName);
        this.errorCode = errorCode;
    }

    /**
     * Returns the machine-readable reason reported by the callee.
     *
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
