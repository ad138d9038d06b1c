package com.gzh.webhooks.rule;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One effect to trigger when a {@link Rule} matches.
 *
 * <p>{@code parameters} are opaque to the engine; the handler registered for
 * {@code type} validates and interprets them.
 */
public final class Action {

    private final String type;
    private final Map<String, Object> parameters;
    private final boolean async;
    private final String timeout;

    public Action(String type, Map<String, Object> parameters) {
        this(type, parameters, false, null);
    }

    public Action(String type, Map<String, Object> parameters, boolean async, String timeout) {
        this.type       = Objects.requireNonNull(type, "type");
        this.parameters = parameters == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.async      = async;
        this.timeout    = timeout == null || timeout.isBlank() ? null : timeout.trim();
    }

    public String getType()                   { return type; }
    /** May be {@code null} only for actions that never passed validation. */
    public Map<String, Object> getParameters() { return parameters; }
    public boolean isAsync()                  { return async; }
    public String getTimeout()                { return timeout; }

    /** Typed parameter lookup; empty when absent or of another type. */
    public <T> Optional<T> parameter(String name, Class<T> type) {
        if (parameters == null) {
            return Optional.empty();
        }
        Object value = parameters.get(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * Parsed {@link #getTimeout()}.
     *
     * @throws IllegalArgumentException if the timeout text is not a valid duration
     */
    public Optional<Duration> timeoutDuration() {
        return timeout == null ? Optional.empty() : Optional.of(Durations.parse(timeout));
    }

    @Override
    public String toString() {
        return "Action{type='" + type + "', async=" + async + (timeout == null ? "" : ", timeout=" + timeout) + '}';
    }
}
