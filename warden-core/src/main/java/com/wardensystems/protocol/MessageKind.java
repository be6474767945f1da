package com.wardensystems.protocol;

/**
 * The role a {@link Message} plays in a call.
 */
public enum MessageKind {
    /** A call from one service to another; answered by exactly one RESPONSE or ERROR. */
    REQUEST,
    /** A successful answer to a REQUEST. */
    RESPONSE,
    /** A failed answer to a REQUEST, carrying an {@link ErrorCode}. */
    ERROR
}
