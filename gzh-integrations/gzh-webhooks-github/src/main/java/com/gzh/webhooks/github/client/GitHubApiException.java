package com.gzh.webhooks.github.client;

import java.io.IOException;

/** A GitHub REST call answered with an unexpected HTTP status. */
public class GitHubApiException extends IOException {

    private final int statusCode;

    public GitHubApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() { return statusCode; }
}
