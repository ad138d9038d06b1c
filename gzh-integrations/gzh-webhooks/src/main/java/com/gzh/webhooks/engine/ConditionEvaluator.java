package com.gzh.webhooks.engine;

import com.gzh.webhooks.model.RepositoryInfo;
import com.gzh.webhooks.model.SenderInfo;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Condition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a single {@link Condition} against an event.
 *
 * <h2>Condition types</h2>
 * <ul>
 *   <li>{@code event_type} – the event's qualified type ({@code type} or
 *       {@code type.action}) through the string operators.</li>
 *   <li>{@code repository} – string fields {@code name}, {@code full_name},
 *       {@code language}, {@code default_branch}, {@code owner}; boolean
 *       field {@code private}.</li>
 *   <li>{@code sender} – string fields {@code login}, {@code type}; boolean
 *       field {@code site_admin}.</li>
 *   <li>{@code payload} – never matches.</li>
 *   <li>{@code time} – always matches.</li>
 * </ul>
 * A missing repository/sender or an unknown field never matches.  Boolean
 * fields only support {@code equals} and {@code not_equals}.
 *
 * <p>Thread-safe; compiled regular expressions are cached.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    /** pattern source → compiled pattern, empty when the source does not compile */
    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    public boolean evaluate(Condition condition, WebhookEvent event) {
        return switch (condition.getType()) {
            case EVENT_TYPE -> evaluateString(condition, event.qualifiedType());
            case REPOSITORY -> evaluateRepository(condition, event.getRepository());
            case SENDER     -> evaluateSender(condition, event.getSender());
            case PAYLOAD    -> false;
            case TIME       -> true;
        };
    }

    private boolean evaluateRepository(Condition condition, RepositoryInfo repo) {
        if (repo == null) {
            return false;
        }
        return switch (condition.getField()) {
            case "name"           -> evaluateString(condition, repo.getName());
            case "full_name"      -> evaluateString(condition, repo.getFullName());
            case "language"       -> evaluateString(condition, repo.getLanguage());
            case "default_branch" -> evaluateString(condition, repo.getDefaultBranch());
            case "owner"          -> evaluateString(condition, repo.getOwnerLogin());
            case "private"        -> evaluateBoolean(condition, repo.isPrivate());
            default               -> false;
        };
    }

    private boolean evaluateSender(Condition condition, SenderInfo sender) {
        if (sender == null) {
            return false;
        }
        return switch (condition.getField()) {
            case "login"      -> evaluateString(condition, sender.getLogin());
            case "type"       -> evaluateString(condition, sender.getType());
            case "site_admin" -> evaluateBoolean(condition, sender.isSiteAdmin());
            default           -> false;
        };
    }

    // ------------------------------------------------------------------
    // Operators
    // ------------------------------------------------------------------

    boolean evaluateString(Condition condition, String actual) {
        String value = actual == null ? "" : actual;
        Object expected = condition.getValue();

        switch (condition.getOperator()) {
            case IN:
                if (!(expected instanceof Collection<?> candidates)) {
                    return false;
                }
                for (Object candidate : candidates) {
                    if (candidate instanceof String s && s.equals(value)) {
                        return true;
                    }
                }
                return false;
            case MATCHES:
                if (!(expected instanceof String regex)) {
                    return false;
                }
                return pattern(regex).map(p -> p.matcher(value).find()).orElse(false);
            default:
                break;
        }

        if (!(expected instanceof String s)) {
            return false;
        }
        return switch (condition.getOperator()) {
            case EQUALS      -> value.equals(s);
            case NOT_EQUALS  -> !value.equals(s);
            case CONTAINS    -> value.contains(s);
            case STARTS_WITH -> value.startsWith(s);
            case ENDS_WITH   -> value.endsWith(s);
            default          -> false;
        };
    }

    boolean evaluateBoolean(Condition condition, boolean actual) {
        Boolean expected = asBoolean(condition.getValue());
        if (expected == null) {
            return false;
        }
        return switch (condition.getOperator()) {
            case EQUALS     -> actual == expected;
            case NOT_EQUALS -> actual != expected;
            default         -> false;
        };
    }

    private static Boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if ("true".equals(value)) {
            return Boolean.TRUE;
        }
        if ("false".equals(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private Optional<Pattern> pattern(String regex) {
        return patterns.computeIfAbsent(regex, source -> {
            try {
                return Optional.of(Pattern.compile(source));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid regular expression '{}' in condition: {}", source, e.getDescription());
                return Optional.empty();
            }
        });
    }
}
