package com.gzh.webhooks.handler;

import com.gzh.webhooks.model.RepositoryInfo;
import com.gzh.webhooks.model.SenderInfo;
import com.gzh.webhooks.model.WebhookEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{...}}} placeholders in action parameters with values
 * from the event.
 *
 * <pre>
 *   {{event.type}}  {{event.action}}  {{event.id}}
 *   {{repo.name}}   {{repo.full_name}} {{repo.owner}} {{repo.default_branch}}
 *   {{sender.login}}
 *   {{vars.NAME}}   global variable from the rule configuration
 * </pre>
 *
 * Known placeholders without a value render as an empty string; unknown
 * placeholders are left untouched.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");
    private static final String VARS_PREFIX = "vars.";

    private final Map<String, Object> variables;

    public TemplateRenderer() {
        this(Map.of());
    }

    public TemplateRenderer(Map<String, Object> variables) {
        this.variables = variables == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public String render(String template, WebhookEvent event) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value = resolve(m.group(1), event);
            m.appendReplacement(out, Matcher.quoteReplacement(value == null ? m.group() : value));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Returns {@code null} for unknown keys. */
    private String resolve(String key, WebhookEvent event) {
        if (key.startsWith(VARS_PREFIX)) {
            String name = key.substring(VARS_PREFIX.length());
            return variables.containsKey(name) ? String.valueOf(variables.get(name)) : null;
        }
        RepositoryInfo repo = event.getRepository();
        SenderInfo sender   = event.getSender();
        return switch (key) {
            case "event.type"          -> event.getType();
            case "event.action"        -> event.getAction();
            case "event.id"            -> event.getId();
            case "repo.name"           -> repo == null ? "" : nullToEmpty(repo.getName());
            case "repo.full_name"      -> repo == null ? "" : nullToEmpty(repo.getFullName());
            case "repo.owner"          -> repo == null ? "" : nullToEmpty(repo.getOwnerLogin());
            case "repo.default_branch" -> repo == null ? "" : nullToEmpty(repo.getDefaultBranch());
            case "sender.login"        -> sender == null ? "" : nullToEmpty(sender.getLogin());
            default                    -> null;
        };
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
