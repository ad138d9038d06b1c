package com.gzh.webhooks.rule;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Comparison applied by a {@link Condition}.  All string comparisons are
 * case-sensitive; {@link #MATCHES} is a regular-expression search, not a
 * full match.
 */
public enum Operator {

    EQUALS("equals", "=="),
    NOT_EQUALS("not_equals", "!="),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    MATCHES("matches"),
    IN("in");

    private final List<String> wireNames;

    Operator(String... wireNames) {
        this.wireNames = List.of(wireNames);
    }

    /** Canonical name used in rule files. */
    public String wireName() { return wireNames.get(0); }

    public static Optional<Operator> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(op -> op.wireNames.contains(name))
                .findFirst();
    }
}
