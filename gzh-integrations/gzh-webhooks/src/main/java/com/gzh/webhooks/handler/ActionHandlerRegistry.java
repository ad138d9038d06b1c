package com.gzh.webhooks.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe mapping from action type to {@link ActionHandler}.
 *
 * <p>Populated at startup and read by the dispatcher for every action.
 */
public class ActionHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers the handler for an action type.
     *
     * @throws IllegalStateException if a handler is already registered for {@code actionType}
     */
    public void register(String actionType, ActionHandler handler) {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("actionType must not be blank");
        }
        if (handlers.putIfAbsent(actionType, handler) != null) {
            throw new IllegalStateException("Handler for action type " + actionType + " already registered");
        }
        log.info("Registered action handler {} for type='{}'", handler.getClass().getSimpleName(), actionType);
    }

    public Optional<ActionHandler> find(String actionType) {
        return actionType == null ? Optional.empty() : Optional.ofNullable(handlers.get(actionType));
    }

    public boolean contains(String actionType) {
        return actionType != null && handlers.containsKey(actionType);
    }

    /** Registered action types in sorted order. */
    public Set<String> types() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    public int size() { return handlers.size(); }
}
