package com.gzh.webhooks.config;

import java.util.ArrayList;
import java.util.List;

/** Parsed content of one automation rule file, or of several merged together. */
public final class AutomationConfig {

    public static final String SUPPORTED_VERSION = "1.0";

    private final String               version;
    private final GlobalSettings       global;
    private final List<RuleDefinition> rules;

    public AutomationConfig(String version, GlobalSettings global, List<RuleDefinition> rules) {
        this.version = version == null || version.isBlank() ? SUPPORTED_VERSION : version;
        this.global  = global == null ? GlobalSettings.defaults() : global;
        this.rules   = rules == null ? List.of() : List.copyOf(rules);
    }

    public String getVersion()               { return version; }
    public GlobalSettings getGlobal()        { return global; }
    public List<RuleDefinition> getRules()   { return rules; }

    /**
     * Combines configs in order.  Each file's {@code enabled} flag and
     * {@code default_timeout} are applied to that file's own rules before the
     * rules are concatenated, so the merged global section is always enabled.
     * Its timeout and {@code max_concurrency} come from the last config;
     * notification URLs and variables are merged.
     */
    public static AutomationConfig merge(List<AutomationConfig> configs) {
        List<RuleDefinition> rules = new ArrayList<>();
        GlobalSettings global = null;
        String version = SUPPORTED_VERSION;
        for (AutomationConfig config : configs) {
            for (RuleDefinition rule : config.rules) {
                rules.add(rule.withDefaultsFrom(config.global));
            }
            global  = global == null ? config.global : global.mergedWith(config.global);
            version = config.version;
        }
        if (global != null) {
            global = new GlobalSettings(true, global.getDefaultTimeout(), global.getMaxConcurrency(),
                    global.getNotificationUrls(), global.getVariables());
        }
        return new AutomationConfig(version, global, rules);
    }
}
