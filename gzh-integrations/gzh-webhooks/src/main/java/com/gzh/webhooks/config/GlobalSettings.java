package com.gzh.webhooks.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code global} section of an automation rule file.
 *
 * <pre>
 * global:
 *   enabled: true
 *   default_timeout: "30s"
 *   max_concurrency: 10
 *   notification_urls: {slack: "https://hooks.slack.com/..."}
 *   variables: {team: "platform"}
 * </pre>
 */
public final class GlobalSettings {

    public static final String DEFAULT_TIMEOUT         = "30s";
    public static final int    DEFAULT_MAX_CONCURRENCY = 10;

    private final boolean             enabled;
    private final String              defaultTimeout;
    private final int                 maxConcurrency;
    private final Map<String, String> notificationUrls;
    private final Map<String, Object> variables;

    public GlobalSettings(boolean enabled, String defaultTimeout, int maxConcurrency,
                          Map<String, String> notificationUrls, Map<String, Object> variables) {
        this.enabled          = enabled;
        this.defaultTimeout   = defaultTimeout == null || defaultTimeout.isBlank() ? DEFAULT_TIMEOUT : defaultTimeout;
        this.maxConcurrency   = maxConcurrency <= 0 ? DEFAULT_MAX_CONCURRENCY : maxConcurrency;
        this.notificationUrls = notificationUrls == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(notificationUrls));
        this.variables        = variables == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static GlobalSettings defaults() {
        return new GlobalSettings(true, DEFAULT_TIMEOUT, DEFAULT_MAX_CONCURRENCY, null, null);
    }

    public boolean isEnabled()                      { return enabled; }
    public String getDefaultTimeout()               { return defaultTimeout; }
    public int getMaxConcurrency()                  { return maxConcurrency; }
    public Map<String, String> getNotificationUrls() { return notificationUrls; }
    public Map<String, Object> getVariables()       { return variables; }

    /**
     * Combines two settings blocks: scalars from {@code override}, URL and
     * variable maps merged with {@code override} winning on conflicts.
     */
    public GlobalSettings mergedWith(GlobalSettings override) {
        Map<String, String> urls = new LinkedHashMap<>(notificationUrls);
        urls.putAll(override.notificationUrls);
        Map<String, Object> vars = new LinkedHashMap<>(variables);
        vars.putAll(override.variables);
        return new GlobalSettings(override.enabled, override.defaultTimeout, override.maxConcurrency, urls, vars);
    }
}
