package com.gzh.webhooks.model;

/**
 * GitHub webhook event-type constants.
 *
 * These match the strings GitHub places in the {@code X-GitHub-Event} header
 * of every delivery.  Rules refer to them in {@code event_type} conditions,
 * optionally qualified with the delivery's action ({@code pull_request.opened}).
 */
public final class EventType {

    private EventType() {}

    // ---------------------------------------------------------------
    // Code
    // ---------------------------------------------------------------
    public static final String PUSH    = "push";
    public static final String CREATE  = "create";
    public static final String DELETE  = "delete";
    public static final String RELEASE = "release";

    // ---------------------------------------------------------------
    // Pull requests
    // ---------------------------------------------------------------
    public static final String PULL_REQUEST        = "pull_request";
    public static final String PULL_REQUEST_REVIEW = "pull_request_review";

    // ---------------------------------------------------------------
    // Issues
    // ---------------------------------------------------------------
    public static final String ISSUES        = "issues";
    public static final String ISSUE_COMMENT = "issue_comment";

    // ---------------------------------------------------------------
    // CI
    // ---------------------------------------------------------------
    public static final String WORKFLOW_RUN = "workflow_run";
    public static final String CHECK_RUN    = "check_run";

    // ---------------------------------------------------------------
    // Repository / organisation
    // ---------------------------------------------------------------
    public static final String REPOSITORY = "repository";
    public static final String MEMBER     = "member";
    public static final String PING       = "ping";
}
