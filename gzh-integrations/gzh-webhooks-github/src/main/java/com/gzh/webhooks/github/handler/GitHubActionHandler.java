package com.gzh.webhooks.github.handler;

import com.gzh.webhooks.github.client.GitHubRestClient;
import com.gzh.webhooks.handler.ActionException;
import com.gzh.webhooks.handler.ActionHandler;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.handler.TemplateRenderer;
import com.gzh.webhooks.model.RepositoryInfo;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Base class for handlers that act on the repository of the event through
 * the GitHub REST API.
 *
 * <p>Resolves the target repository, checks the execution scope, and turns
 * client {@link IOException}s into {@link ActionException}s.
 */
public abstract class GitHubActionHandler implements ActionHandler {

    protected final GitHubRestClient client;
    protected final TemplateRenderer renderer;

    protected GitHubActionHandler(GitHubRestClient client, TemplateRenderer renderer) {
        this.client   = client;
        this.renderer = renderer;
    }

    /** Action type this handler is registered under; used in error messages. */
    protected abstract String type();

    protected abstract void perform(ExecutionContext context, WebhookEvent event, Action action,
                                    String owner, String repo) throws IOException, ActionException;

    @Override
    public final void execute(ExecutionContext context, WebhookEvent event, Action action) throws ActionException {
        RepositoryInfo repository = event.getRepository();
        if (repository == null || repository.getName() == null || repository.getOwnerLogin() == null) {
            throw new ActionException("repository information not available");
        }
        context.checkNotCancelled();
        try {
            perform(context, event, action, repository.getOwnerLogin(), repository.getName());
        } catch (IOException e) {
            throw new ActionException(type() + " failed for " + repository.getFullName() + ": " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Parameter helpers
    // ------------------------------------------------------------------

    protected static int requireNumber(WebhookEvent event) throws ActionException {
        return event.getPayload().issueOrPullRequestNumber()
                .orElseThrow(() -> new ActionException("could not determine issue/PR number from event"));
    }

    protected static void requireString(Map<String, Object> parameters, String name) throws ActionException {
        Object value = parameters.get(name);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new ActionException(name + " parameter is required");
        }
    }

    protected static void requireStringList(Map<String, Object> parameters, String name) throws ActionException {
        if (stringList(parameters.get(name)).isEmpty()) {
            throw new ActionException(name + " parameter is required and must be a list of strings");
        }
    }

    protected String renderedString(Action action, String name, WebhookEvent event) {
        return action.parameter(name, String.class).map(s -> renderer.render(s, event)).orElse(null);
    }

    protected List<String> renderedList(Action action, String name, WebhookEvent event) {
        List<String> rendered = new ArrayList<>();
        for (String item : stringList(action.getParameters() == null ? null : action.getParameters().get(name))) {
            String value = renderer.render(item, event);
            if (!value.isBlank()) {
                rendered.add(value);
            }
        }
        return rendered;
    }

    /** A single string or a collection of strings; anything else yields an empty list. */
    static List<String> stringList(Object value) {
        List<String> items = new ArrayList<>();
        if (value instanceof String s && !s.isBlank()) {
            items.add(s);
        } else if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (!(item instanceof String)) {
                    return List.of();
                }
                items.add((String) item);
            }
        }
        return items;
    }
}
