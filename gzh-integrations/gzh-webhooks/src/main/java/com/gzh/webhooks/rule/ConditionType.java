package com.gzh.webhooks.rule;

import java.util.Arrays;
import java.util.Optional;

/**
 * What a {@link Condition} inspects.
 */
public enum ConditionType {

    EVENT_TYPE("event_type"),
    REPOSITORY("repository"),
    SENDER("sender"),
    /** Deep payload inspection; no field-path mechanism yet, so it never matches. */
    PAYLOAD("payload"),
    /** Time windows / business hours; no restriction yet, so it always matches. */
    TIME("time");

    private final String wireName;

    ConditionType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in rule files. */
    public String wireName() { return wireName; }

    /** Whether conditions of this type need a {@code field}. */
    public boolean requiresField() {
        return this == REPOSITORY || this == SENDER || this == PAYLOAD;
    }

    public static Optional<ConditionType> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst();
    }
}
