package com.gzh.webhooks.github.handler;

import com.gzh.webhooks.github.client.GitHubRestClient;
import com.gzh.webhooks.handler.ActionException;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.handler.TemplateRenderer;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * {@code merge_pr}: merges the pull request of the event.
 *
 * <p>Parameters: {@code merge_method} ({@code merge}, {@code squash} or
 * {@code rebase}; default {@code merge}), {@code commit_message} (template,
 * optional).
 */
public class MergePullRequestHandler extends GitHubActionHandler {

    public static final String TYPE = "merge_pr";

    private static final Logger log = LoggerFactory.getLogger(MergePullRequestHandler.class);
    private static final Set<String> MERGE_METHODS = Set.of("merge", "squash", "rebase");

    public MergePullRequestHandler(GitHubRestClient client, TemplateRenderer renderer) {
        super(client, renderer);
    }

    @Override
    protected String type() { return TYPE; }

    @Override
    protected void perform(ExecutionContext context, WebhookEvent event, Action action,
                           String owner, String repo) throws IOException, ActionException {
        int number = requireNumber(event);
        String method = action.parameter("merge_method", String.class).orElse("merge");
        if (!MERGE_METHODS.contains(method)) {
            throw new ActionException("invalid merge method: " + method);
        }
        String sha = client.mergePullRequest(context, owner, repo, number, method,
                renderedString(action, "commit_message", event));
        log.info("Merged {}/{}#{} with {} ({})", owner, repo, number, method, sha);
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        Object method = parameters.get("merge_method");
        if (method != null && !MERGE_METHODS.contains(String.valueOf(method))) {
            throw new ActionException("invalid merge method: " + method + " (expected merge, squash or rebase)");
        }
    }
}
