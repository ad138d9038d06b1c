package com.gzh.webhooks.engine;

/** Thrown when a rule handed to the {@link RuleEngine} is malformed or its id is already taken. */
public class RuleValidationException extends IllegalArgumentException {

    public RuleValidationException(String message) {
        super(message);
    }

    public RuleValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
