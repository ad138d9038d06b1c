package com.gzh.webhooks.parser;

/** Thrown by {@link EventParser} when a delivery cannot be turned into an event. */
public class EventParseException extends Exception {

    public EventParseException(String message) {
        super(message);
    }

    public EventParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
