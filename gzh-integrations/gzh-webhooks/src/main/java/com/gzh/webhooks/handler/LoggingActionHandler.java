package com.gzh.webhooks.handler;

import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Reference handler that logs the matched event.  Registered as {@code log};
 * useful as a dry-run target and during integration testing.
 *
 * <p>Parameters: {@code message} (template, optional), {@code level}
 * ({@code debug}, {@code info} or {@code warn}; default {@code info}).
 */
public class LoggingActionHandler implements ActionHandler {

    public static final String TYPE = "log";

    private static final Logger log = LoggerFactory.getLogger(LoggingActionHandler.class);
    private static final Set<String> LEVELS = Set.of("debug", "info", "warn");

    private final TemplateRenderer renderer;

    public LoggingActionHandler() {
        this(new TemplateRenderer());
    }

    public LoggingActionHandler(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public void execute(ExecutionContext context, WebhookEvent event, Action action) {
        String message = action.parameter("message", String.class)
                .map(m -> renderer.render(m, event))
                .orElse("matched");
        String level = action.parameter("level", String.class).orElse("info");

        String fullName = event.getRepository() == null ? null : event.getRepository().getFullName();
        String sender   = event.getSender() == null ? null : event.getSender().getLogin();
        switch (level) {
            case "debug" -> log.debug("Webhook automation: {} (event={} type={} repo={} sender={})",
                    message, event.getId(), event.qualifiedType(), fullName, sender);
            case "warn"  -> log.warn("Webhook automation: {} (event={} type={} repo={} sender={})",
                    message, event.getId(), event.qualifiedType(), fullName, sender);
            default      -> log.info("Webhook automation: {} (event={} type={} repo={} sender={})",
                    message, event.getId(), event.qualifiedType(), fullName, sender);
        }
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        Object level = parameters.get("level");
        if (level != null && !LEVELS.contains(String.valueOf(level))) {
            throw new ActionException("level must be one of debug, info, warn");
        }
        Object message = parameters.get("message");
        if (message != null && !(message instanceof String)) {
            throw new ActionException("message parameter must be a string");
        }
    }
}
