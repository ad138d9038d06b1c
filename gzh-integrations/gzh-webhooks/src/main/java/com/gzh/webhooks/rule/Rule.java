package com.gzh.webhooks.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named AND-predicate over an event plus the actions to trigger on match.
 *
 * <p>{@code priority} is stored and reported but does not change evaluation
 * order; rules run in registration order.  {@code metadata} is passed
 * through untouched.
 */
public final class Rule {

    private final String id;
    private final String name;
    private final String description;
    private final boolean enabled;
    private final int priority;
    private final List<Condition> conditions;
    private final List<Action> actions;
    private final Map<String, Object> metadata;

    private Rule(Builder b) {
        this.id          = b.id;
        this.name        = b.name;
        this.description = b.description;
        this.enabled     = b.enabled;
        this.priority    = b.priority;
        this.conditions  = Collections.unmodifiableList(new ArrayList<>(b.conditions));
        this.actions     = Collections.unmodifiableList(new ArrayList<>(b.actions));
        this.metadata    = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public String getId()                    { return id; }
    public String getName()                  { return name; }
    public String getDescription()           { return description; }
    public boolean isEnabled()               { return enabled; }
    public int getPriority()                 { return priority; }
    public List<Condition> getConditions()   { return conditions; }
    public List<Action> getActions()         { return actions; }
    public Map<String, Object> getMetadata() { return metadata; }

    public static Builder builder(String id, String name) {
        return new Builder().id(id).name(name);
    }

    /** Copy of this rule with a different enabled flag. */
    public Rule withEnabled(boolean enabled) {
        return new Builder().from(this).enabled(enabled).build();
    }

    @Override
    public String toString() {
        return "Rule{id='" + id + "', name='" + name + "', enabled=" + enabled + ", priority=" + priority + '}';
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description = "";
        private boolean enabled = true;
        private int priority;
        private final List<Condition> conditions = new ArrayList<>();
        private final List<Action> actions = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id)                      { this.id = id; return this; }
        public Builder name(String name)                  { this.name = name; return this; }
        public Builder description(String description)    { this.description = description == null ? "" : description; return this; }
        public Builder enabled(boolean enabled)           { this.enabled = enabled; return this; }
        public Builder priority(int priority)             { this.priority = priority; return this; }
        public Builder condition(Condition condition)     { this.conditions.add(condition); return this; }
        public Builder conditions(List<Condition> list)   { this.conditions.addAll(list); return this; }
        public Builder action(Action action)              { this.actions.add(action); return this; }
        public Builder actions(List<Action> list)         { this.actions.addAll(list); return this; }
        public Builder metadata(Map<String, Object> map)  { if (map != null) this.metadata.putAll(map); return this; }

        Builder from(Rule rule) {
            return id(rule.id).name(rule.name).description(rule.description)
                    .enabled(rule.enabled).priority(rule.priority)
                    .conditions(rule.conditions).actions(rule.actions).metadata(rule.metadata);
        }

        /** Builds without validation; {@link com.gzh.webhooks.engine.RuleEngine} validates on registration. */
        public Rule build() {
            return new Rule(this);
        }
    }
}
