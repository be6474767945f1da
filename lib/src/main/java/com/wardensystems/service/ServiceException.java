package com.wardensystems.service;

import com.wardensystems.protocol.ErrorCode;

/**
 * Application-level failure raised by a handler; answered to the caller as an ERROR with the given code.
 */
public class ServiceException extends RuntimeException {

    private final ErrorCode errorCode;

    public ServiceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static ServiceException unknownAction(String action) {
        return new ServiceException(ErrorCode.UNKNOWN_ACTION, "Unknown action: " + action);
    }

    public static ServiceException invalidPayload(String message) {
        return new ServiceException(ErrorCode.INVALID_PAYLOAD, message);
    }

    public static ServiceException notFound(String message) {
        return new ServiceException(ErrorCode.NOT_FOUND, message);
    }

    public static ServiceException conflict(String message) {
        return new ServiceException(ErrorCode.CONFLICT, message);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
