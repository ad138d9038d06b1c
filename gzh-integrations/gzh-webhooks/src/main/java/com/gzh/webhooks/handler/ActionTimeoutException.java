package com.gzh.webhooks.handler;

import java.time.Duration;

/** Thrown when an action does not finish within its configured timeout. */
public class ActionTimeoutException extends ActionException {

    private final Duration timeout;

    public ActionTimeoutException(String actionType, Duration timeout) {
        super("Action '" + actionType + "' timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() { return timeout; }
}
