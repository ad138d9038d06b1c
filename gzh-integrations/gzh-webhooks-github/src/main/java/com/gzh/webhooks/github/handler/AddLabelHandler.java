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
import java.util.List;
import java.util.Map;

/** {@code add_label}: adds {@code labels} to the issue or pull request of the event. */
public class AddLabelHandler extends GitHubActionHandler {

    public static final String TYPE = "add_label";

    private static final Logger log = LoggerFactory.getLogger(AddLabelHandler.class);

    public AddLabelHandler(GitHubRestClient client, TemplateRenderer renderer) {
        super(client, renderer);
    }

    @Override
    protected String type() { return TYPE; }

    @Override
    protected void perform(ExecutionContext context, WebhookEvent event, Action action,
                           String owner, String repo) throws IOException, ActionException {
        int number = requireNumber(event);
        List<String> labels = renderedList(action, "labels", event);
        if (labels.isEmpty()) {
            throw new ActionException("labels rendered empty for " + owner + "/" + repo + "#" + number);
        }
        client.addLabels(context, owner, repo, number, labels);
        log.info("Added labels {} to {}/{}#{}", labels, owner, repo, number);
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        requireStringList(parameters, "labels");
    }
}
