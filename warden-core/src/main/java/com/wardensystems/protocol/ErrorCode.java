package com.wardensystems.protocol;

/**
 * Machine-readable reason codes carried by ERROR messages under {@link MessageProtocol#ERROR_KEY}.
 */
public enum ErrorCode {
    /** The receiving service has no handler for the requested action. */
    UNKNOWN_ACTION,
    /** The payload is missing required fields or has fields of the wrong type. */
    INVALID_PAYLOAD,
    /** The entity addressed by the request does not exist. */
    NOT_FOUND,
    /** The request conflicts with existing state, e.g. a duplicate key. */
    CONFLICT,
    /** The handler reported an application-level failure. */
    HANDLER_FAILURE,
    /** The handler threw unexpectedly; the service itself kept running. */
    INTERNAL_ERROR,
    /** The target is not registered, not running, or was stopped before handling the request. */
    SERVICE_UNAVAILABLE,
    /** The envelope itself was malformed. */
    MALFORMED_MESSAGE;

    /**
     * Parses a code read back from a payload, falling back to {@link #INTERNAL_ERROR} for unknown values.
     *
     * @param value the serialized code, may be null
     * @return the matching code
     */
    public static ErrorCode fromValue(Object value) {
        if (value instanceof ErrorCode code) {
            return code;
        }
        if (value != null) {
            for (ErrorCode code : values()) {
                if (code.name().equals(value.toString())) {
                    return code;
                }
            }
        }
        return INTERNAL_ERROR;
    }
}
