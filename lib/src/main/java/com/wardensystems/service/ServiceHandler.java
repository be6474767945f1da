package com.wardensystems.service;

import java.util.Map;

/**
 * Business logic of one service, run inside its own execution unit.
 *
 * <p>Requests arrive as a string action plus a key/value payload. {@link #decode} turns them into the
 * service's own command type, typically a sealed interface with one record per action, and is the only
 * place payloads are validated. {@link #handle} then works on typed commands. Unknown actions and
 * invalid payloads are reported by throwing {@link ServiceException}; the runtime answers the caller
 * with an ERROR and keeps the service running.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 * sealed interface Command {}
 * record Greet(String name) implements Command {}
 *
 * class Greeter implements ServiceHandler<Command> {
 *     public Command decode(String action, Map<String, Object> payload) {
 *         if ("greet".equals(action)) {
 *             return new Greet(Payloads.requireString(payload, "name"));
 *         }
 *         throw ServiceException.unknownAction(action);
 *     }
 *
 *     public Map<String, Object> handle(Command command, ServiceContext context) {
 *         Greet greet = (Greet) command;
 *         return Map.of("greeting", "Hello " + greet.name());
 *     }
 * }
 * }</pre>
 *
 * @param <C> The command type produced by decoding
 */
public interface ServiceHandler<C> {

    /**
     * Converts an incoming action and payload into a command.
     *
     * @param action the requested action
     * @param payload the request payload, never null
     * @return the decoded command
     * @throws ServiceException with UNKNOWN_ACTION or INVALID_PAYLOAD when the request cannot be decoded
     */
    C decode(String action, Map<String, Object> payload);

    /**
     * Executes a command.
     *
     * @param command the decoded command
     * @param context the service context
     * @return the response payload, may be null for an empty response
     * @throws ServiceException to answer with a specific error code
     */
    Map<String, Object> handle(C command, ServiceContext context);

    /**
     * Called in the execution unit before the first heartbeat. Throwing here fails the start.
     *
     * @param context the service context
     */
    default void preStart(ServiceContext context) {
        // Default implementation does nothing
    }

    /**
     * Called in the execution unit after its loop ends, including forced termination.
     *
     * @param context the service context
     */
    default void postStop(ServiceContext context) {
        // Default implementation does nothing
    }
}
