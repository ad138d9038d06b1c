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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code run_workflow}: triggers a {@code workflow_dispatch} run.
 *
 * <p>Parameters: {@code workflow_file} (required), {@code ref} (defaults to
 * the repository's default branch), {@code inputs} (map; string values are
 * rendered as templates).
 */
public class RunWorkflowHandler extends GitHubActionHandler {

    public static final String TYPE = "run_workflow";

    private static final Logger log = LoggerFactory.getLogger(RunWorkflowHandler.class);

    public RunWorkflowHandler(GitHubRestClient client, TemplateRenderer renderer) {
        super(client, renderer);
    }

    @Override
    protected String type() { return TYPE; }

    @Override
    protected void perform(ExecutionContext context, WebhookEvent event, Action action,
                           String owner, String repo) throws IOException, ActionException {
        String workflowFile = action.parameter("workflow_file", String.class)
                .orElseThrow(() -> new ActionException("workflow_file parameter is required"));
        String ref = renderedString(action, "ref", event);
        if (ref == null || ref.isBlank()) {
            ref = event.getRepository().getDefaultBranch();
        }
        if (ref == null || ref.isBlank()) {
            throw new ActionException("no ref given and repository has no default branch");
        }

        Map<String, Object> inputs = new LinkedHashMap<>();
        action.parameter("inputs", Map.class).ifPresent(raw -> raw.forEach((key, value) ->
                inputs.put(String.valueOf(key), value instanceof String s ? renderer.render(s, event) : value)));

        client.dispatchWorkflow(context, owner, repo, workflowFile, ref, inputs);
        log.info("Triggered workflow {} on {}/{}@{}", workflowFile, owner, repo, ref);
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        requireString(parameters, "workflow_file");
        Object inputs = parameters.get("inputs");
        if (inputs != null && !(inputs instanceof Map)) {
            throw new ActionException("inputs parameter must be a map");
        }
    }
}
