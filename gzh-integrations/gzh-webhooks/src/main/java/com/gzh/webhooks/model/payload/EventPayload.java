package com.gzh.webhooks.model.payload;

import java.util.Optional;

/**
 * Event-type-specific body of a delivery.
 *
 * <p>Known event types bind to a dedicated class ({@link PushPayload},
 * {@link PullRequestPayload}, {@link IssuesPayload},
 * {@link IssueCommentPayload}); everything else is kept as a
 * {@link GenericPayload}.
 */
public interface EventPayload {

    /**
     * Issue or pull-request number the delivery refers to, if any.
     * Handlers that comment, label or merge rely on this.
     */
    default Optional<Integer> issueOrPullRequestNumber() {
        return Optional.empty();
    }
}
