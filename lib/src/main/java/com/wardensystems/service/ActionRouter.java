package com.wardensystems.service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Handler built from one function per action, for services that need no command types of their own.
 * Actions without a registered function are answered with UNKNOWN_ACTION.
 *
 * <pre>{@code
 * ServiceEntrypoint echo = () -> ActionRouter.builder()
 *         .on("echo", (payload, context) -> payload)
 *         .build();
 * }</pre>
 */
public final class ActionRouter implements ServiceHandler<ActionRouter.Invocation> {

    /**
     * Function handling one action.
     */
    @FunctionalInterface
    public interface Action {
        Map<String, Object> apply(Map<String, Object> payload, ServiceContext context);
    }

    /**
     * A decoded request: the action that matched and its payload.
     *
     * @param action the action name
     * @param payload the request payload
     * @param function the function that will handle it
     */
    public record Invocation(String action, Map<String, Object> payload, Action function) {
    }

    private final Map<String, Action> actions;

    private ActionRouter(Map<String, Action> actions) {
        this.actions = Map.copyOf(actions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> actions() {
        return actions.keySet();
    }

    @Override
    public Invocation decode(String action, Map<String, Object> payload) {
        Action function = actions.get(action);
        if (function == null) {
            throw ServiceException.unknownAction(action);
        }
        return new Invocation(action, payload, function);
    }

    @Override
    public Map<String, Object> handle(Invocation invocation, ServiceContext context) {
        return invocation.function().apply(invocation.payload(), context);
    }

    /**
     * Builder collecting action functions.
     */
    public static final class Builder {
        private final Map<String, Action> actions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder on(String action, Action function) {
            Objects.requireNonNull(action, "action cannot be null");
            Objects.requireNonNull(function, "function cannot be null");
            if (actions.putIfAbsent(action, function) != null) {
                throw new IllegalArgumentException("Action already registered: " + action);
            }
            return this;
        }

        public ActionRouter build() {
            return new ActionRouter(actions);
        }
    }
}
