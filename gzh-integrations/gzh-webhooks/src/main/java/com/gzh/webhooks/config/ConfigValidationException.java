package com.gzh.webhooks.config;

/** Thrown when an automation rule file cannot be parsed or fails validation. */
public class ConfigValidationException extends Exception {

    public ConfigValidationException(String message) {
        super(message);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
