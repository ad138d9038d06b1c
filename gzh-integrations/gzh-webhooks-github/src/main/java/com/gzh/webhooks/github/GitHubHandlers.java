package com.gzh.webhooks.github;

import com.gzh.webhooks.github.client.GitHubRestClient;
import com.gzh.webhooks.github.handler.AddLabelHandler;
import com.gzh.webhooks.github.handler.CreateCommentHandler;
import com.gzh.webhooks.github.handler.CreateIssueHandler;
import com.gzh.webhooks.github.handler.MergePullRequestHandler;
import com.gzh.webhooks.github.handler.NotificationHandler;
import com.gzh.webhooks.github.handler.RunWorkflowHandler;
import com.gzh.webhooks.handler.ActionHandler;
import com.gzh.webhooks.handler.ActionHandlerRegistry;
import com.gzh.webhooks.handler.LoggingActionHandler;
import com.gzh.webhooks.handler.TemplateRenderer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Wiring of the built-in action handlers. */
public final class GitHubHandlers {

    /** Every action type the launcher registers. */
    public static final Set<String> TYPES = Set.of(
            CreateIssueHandler.TYPE,
            AddLabelHandler.TYPE,
            CreateCommentHandler.TYPE,
            MergePullRequestHandler.TYPE,
            RunWorkflowHandler.TYPE,
            NotificationHandler.TYPE,
            LoggingActionHandler.TYPE);

    private GitHubHandlers() {}

    /** Action type → handler, in registration order. */
    public static Map<String, ActionHandler> create(GitHubRestClient client,
                                                    NotificationHandler notifications,
                                                    TemplateRenderer renderer) {
        Map<String, ActionHandler> handlers = new LinkedHashMap<>();
        handlers.put(CreateIssueHandler.TYPE, new CreateIssueHandler(client, renderer));
        handlers.put(AddLabelHandler.TYPE, new AddLabelHandler(client, renderer));
        handlers.put(CreateCommentHandler.TYPE, new CreateCommentHandler(client, renderer));
        handlers.put(MergePullRequestHandler.TYPE, new MergePullRequestHandler(client, renderer));
        handlers.put(RunWorkflowHandler.TYPE, new RunWorkflowHandler(client, renderer));
        handlers.put(NotificationHandler.TYPE, notifications);
        handlers.put(LoggingActionHandler.TYPE, new LoggingActionHandler(renderer));
        return handlers;
    }

    public static ActionHandlerRegistry registry(Map<String, ActionHandler> handlers) {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        handlers.forEach(registry::register);
        return registry;
    }
}
