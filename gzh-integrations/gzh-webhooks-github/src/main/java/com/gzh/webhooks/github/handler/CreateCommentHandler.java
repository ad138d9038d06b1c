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

/** {@code create_comment}: comments {@code body} (template) on the issue or pull request of the event. */
public class CreateCommentHandler extends GitHubActionHandler {

    public static final String TYPE = "create_comment";

    private static final Logger log = LoggerFactory.getLogger(CreateCommentHandler.class);

    public CreateCommentHandler(GitHubRestClient client, TemplateRenderer renderer) {
        super(client, renderer);
    }

    @Override
    protected String type() { return TYPE; }

    @Override
    protected void perform(ExecutionContext context, WebhookEvent event, Action action,
                           String owner, String repo) throws IOException, ActionException {
        int number = requireNumber(event);
        long commentId = client.createComment(context, owner, repo, number, renderedString(action, "body", event));
        log.info("Created comment {} on {}/{}#{}", commentId, owner, repo, number);
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        requireString(parameters, "body");
    }
}
