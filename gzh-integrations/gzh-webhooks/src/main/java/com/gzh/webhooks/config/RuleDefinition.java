package com.gzh.webhooks.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One rule exactly as written in a rule file, before validation.  Condition
 * types, operators and timeouts are kept as text so that validation can
 * report them verbatim.
 */
public final class RuleDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final boolean enabled;
    private final int priority;
    private final List<ConditionDefinition> conditions;
    private final List<ActionDefinition> actions;
    private final Map<String, Object> metadata;

    public RuleDefinition(String id, String name, String description, boolean enabled, int priority,
                          List<ConditionDefinition> conditions, List<ActionDefinition> actions,
                          Map<String, Object> metadata) {
        this.id          = id;
        this.name        = name;
        this.description = description;
        this.enabled     = enabled;
        this.priority    = priority;
        this.conditions  = conditions == null ? List.of() : List.copyOf(conditions);
        this.actions     = actions == null ? List.of() : List.copyOf(actions);
        this.metadata    = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getId()                           { return id; }
    public String getName()                         { return name; }
    public String getDescription()                  { return description; }
    public boolean isEnabled()                      { return enabled; }
    public int getPriority()                        { return priority; }
    public List<ConditionDefinition> getConditions() { return conditions; }
    public List<ActionDefinition> getActions()      { return actions; }
    public Map<String, Object> getMetadata()        { return metadata; }

    /**
     * This rule with the settings of its own file applied: it is disabled when
     * {@code global} is, and actions without a timeout get its default timeout.
     */
    public RuleDefinition withDefaultsFrom(GlobalSettings global) {
        List<ActionDefinition> resolved = new ArrayList<>(actions.size());
        for (ActionDefinition action : actions) {
            resolved.add(action.withDefaultTimeout(global.getDefaultTimeout()));
        }
        return new RuleDefinition(id, name, description, enabled && global.isEnabled(), priority,
                conditions, resolved, metadata);
    }

    public static final class ConditionDefinition {

        private final String type;
        private final String field;
        private final String operator;
        private final Object value;
        private final Map<String, Object> parameters;

        public ConditionDefinition(String type, String field, String operator, Object value,
                                   Map<String, Object> parameters) {
            this.type       = type;
            this.field      = field;
            this.operator   = operator;
            this.value      = value;
            this.parameters = parameters;
        }

        public String getType()                   { return type; }
        public String getField()                  { return field; }
        public String getOperator()               { return operator; }
        public Object getValue()                  { return value; }
        public Map<String, Object> getParameters() { return parameters; }
    }

    public static final class ActionDefinition {

        private final String type;
        private final Map<String, Object> parameters;
        private final boolean async;
        private final String timeout;

        public ActionDefinition(String type, Map<String, Object> parameters, boolean async, String timeout) {
            this.type       = type;
            this.parameters = parameters;
            this.async      = async;
            this.timeout    = timeout;
        }

        public String getType()                   { return type; }
        /** {@code null} when the file has no {@code parameters} key. */
        public Map<String, Object> getParameters() { return parameters; }
        public boolean isAsync()                  { return async; }
        public String getTimeout()                { return timeout; }

        ActionDefinition withDefaultTimeout(String defaultTimeout) {
            return timeout != null ? this : new ActionDefinition(type, parameters, async, defaultTimeout);
        }
    }
}
