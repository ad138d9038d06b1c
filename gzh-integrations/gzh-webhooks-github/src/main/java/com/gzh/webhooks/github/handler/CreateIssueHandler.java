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

/**
 * {@code create_issue}: opens an issue in the event's repository.
 *
 * <p>Parameters: {@code title}, {@code body} (templates, required),
 * {@code labels}, {@code assignees} (optional lists).
 */
public class CreateIssueHandler extends GitHubActionHandler {

    public static final String TYPE = "create_issue";

    private static final Logger log = LoggerFactory.getLogger(CreateIssueHandler.class);

    public CreateIssueHandler(GitHubRestClient client, TemplateRenderer renderer) {
        super(client, renderer);
    }

    @Override
    protected String type() { return TYPE; }

    @Override
    protected void perform(ExecutionContext context, WebhookEvent event, Action action,
                           String owner, String repo) throws IOException {
        int number = client.createIssue(context, owner, repo,
                renderedString(action, "title", event),
                renderedString(action, "body", event),
                renderedList(action, "labels", event),
                renderedList(action, "assignees", event));
        log.info("Created issue {}/{}#{}", owner, repo, number);
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        requireString(parameters, "title");
        requireString(parameters, "body");
    }
}
