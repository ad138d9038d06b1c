package com.gzh.webhooks.handler;

/**
 * Thrown when an action cannot be executed: the handler failed, no handler
 * is registered for its type, or its parameters are invalid.
 */
public class ActionException extends Exception {

    public ActionException(String message) {
        super(message);
    }

    public ActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
