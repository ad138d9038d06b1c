package com.gzh.webhooks.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One predicate clause of a {@link Rule}.
 *
 * <p>{@code value} is typed by what the condition compares: a string for
 * most operators, a list for {@link Operator#IN}, a boolean for boolean
 * fields such as {@code repository.private}, a pattern string for
 * {@link Operator#MATCHES}.
 */
public final class Condition {

    private final ConditionType type;
    private final String field;
    private final Operator operator;
    private final Object value;
    private final Map<String, Object> parameters;

    public Condition(ConditionType type, String field, Operator operator, Object value) {
        this(type, field, operator, value, Map.of());
    }

    public Condition(ConditionType type, String field, Operator operator, Object value,
                     Map<String, Object> parameters) {
        this.type       = Objects.requireNonNull(type, "type");
        this.field      = field == null ? "" : field;
        this.operator   = Objects.requireNonNull(operator, "operator");
        this.value      = value;
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Condition eventType(Operator operator, Object value) {
        return new Condition(ConditionType.EVENT_TYPE, null, operator, value);
    }

    public static Condition repository(String field, Operator operator, Object value) {
        return new Condition(ConditionType.REPOSITORY, field, operator, value);
    }

    public static Condition sender(String field, Operator operator, Object value) {
        return new Condition(ConditionType.SENDER, field, operator, value);
    }

    public ConditionType getType()            { return type; }
    public String getField()                  { return field; }
    public Operator getOperator()             { return operator; }
    public Object getValue()                  { return value; }
    public Map<String, Object> getParameters() { return parameters; }

    @Override
    public String toString() {
        return type.wireName() + (field.isEmpty() ? "" : "." + field) + " " + operator.wireName() + " " + value;
    }
}
