package com.gzh.webhooks.github.handler;

import com.gzh.webhooks.github.client.WebhookNotifier;
import com.gzh.webhooks.handler.ActionException;
import com.gzh.webhooks.handler.ActionHandler;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.handler.TemplateRenderer;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code notification}: sends {@code message} (template) to the incoming
 * webhook registered for {@code type} ({@code default} when omitted).
 *
 * <p>Webhook URLs come from {@code global.notification_urls} of the rule
 * files and from the launcher's environment.
 */
public class NotificationHandler implements ActionHandler {

    public static final String TYPE = "notification";
    public static final String DEFAULT_CHANNEL = "default";

    private static final Logger log = LoggerFactory.getLogger(NotificationHandler.class);

    private final WebhookNotifier notifier;
    private final TemplateRenderer renderer;

    /** notification type → webhook URL */
    private final Map<String, String> webhooks = new ConcurrentHashMap<>();

    public NotificationHandler(WebhookNotifier notifier, TemplateRenderer renderer) {
        this.notifier = notifier;
        this.renderer = renderer;
    }

    public void registerWebhook(String notificationType, String url) {
        if (notificationType == null || notificationType.isBlank()) {
            throw new IllegalArgumentException("notificationType must not be blank");
        }
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new IllegalArgumentException("webhook URL for " + notificationType + " must be an http(s) URL");
        }
        webhooks.put(notificationType, url);
        log.info("Registered notification webhook for type='{}'", notificationType);
    }

    public Set<String> registeredTypes() {
        return new TreeSet<>(webhooks.keySet());
    }

    @Override
    public void execute(ExecutionContext context, WebhookEvent event, Action action) throws ActionException {
        String channel = action.parameter("type", String.class).filter(t -> !t.isBlank()).orElse(DEFAULT_CHANNEL);
        String message = action.parameter("message", String.class)
                .filter(m -> !m.isBlank())
                .orElseThrow(() -> new ActionException("message parameter is required"));

        String url = webhooks.get(channel);
        if (url == null) {
            throw new ActionException("no webhook configured for notification type: " + channel);
        }
        context.checkNotCancelled();
        try {
            notifier.send(context, url, renderer.render(message, event));
        } catch (IOException e) {
            throw new ActionException("notification to " + channel + " failed: " + e.getMessage(), e);
        }
        log.info("Sent {} notification for event {}", channel, event.getId());
    }

    @Override
    public void validateParameters(Map<String, Object> parameters) throws ActionException {
        Object message = parameters.get("message");
        if (!(message instanceof String) || ((String) message).isBlank()) {
            throw new ActionException("message parameter is required");
        }
        Object type = parameters.get("type");
        if (type != null && !(type instanceof String)) {
            throw new ActionException("type parameter must be a string");
        }
    }
}
