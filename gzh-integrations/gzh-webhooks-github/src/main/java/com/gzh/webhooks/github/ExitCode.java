package com.gzh.webhooks.github;

/** Process exit codes of {@link WebhookAutomationMain}. */
public enum ExitCode {
    SUCCESS(0),
    /** Rules failed to load or validate, or the server could not start. */
    FAILURE(1),
    INVALID_ARGS(2);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
