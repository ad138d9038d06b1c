package com.gzh.webhooks.config;

import com.gzh.webhooks.config.RuleDefinition.ActionDefinition;
import com.gzh.webhooks.config.RuleDefinition.ConditionDefinition;
import com.gzh.webhooks.rule.Action;
import com.gzh.webhooks.rule.Condition;
import com.gzh.webhooks.rule.ConditionType;
import com.gzh.webhooks.rule.Durations;
import com.gzh.webhooks.rule.Operator;
import com.gzh.webhooks.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads automation rule files (YAML) and turns them into engine {@link Rule}s.
 *
 * <pre>
 *   AutomationConfigLoader loader = new AutomationConfigLoader();
 *   AutomationConfig config = loader.loadDirectory(Path.of("/etc/gzh/rules"));
 *   loader.validate(config, registry.types());
 *   engine.replaceRules(loader.toRules(config));
 * </pre>
 */
public class AutomationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(AutomationConfigLoader.class);

    // ------------------------------------------------------------------
    // Loading
    // ------------------------------------------------------------------

    /**
     * Parses one rule file.  Missing {@code version}, {@code default_timeout}
     * and {@code max_concurrency} take their defaults; a rule without
     * {@code enabled} is enabled.
     *
     * @throws IOException               if the file cannot be read
     * @throws ConfigValidationException if the file is not a well-formed rule document
     */
    public AutomationConfig load(Path path) throws IOException, ConfigValidationException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Rule file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            AutomationConfig config = parse(reader, path.toString());
            log.debug("Loaded {} rule(s) from {}", config.getRules().size(), path);
            return config;
        }
    }

    public AutomationConfig parse(String yaml) throws ConfigValidationException {
        return parse(new StringReader(yaml), "<inline>");
    }

    AutomationConfig parse(Reader reader, String source) throws ConfigValidationException {
        Object rootObj;
        try {
            rootObj = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new ConfigValidationException("Failed to parse YAML rules at " + source + ": " + e.getMessage(), e);
        }
        if (rootObj == null) {
            return new AutomationConfig(null, null, null);
        }
        try {
            Map<String, Object> root = asMap(rootObj, "root");
            String version = toOptionalString(root.get("version"));
            GlobalSettings global = root.get("global") == null
                    ? GlobalSettings.defaults()
                    : parseGlobal(asMap(root.get("global"), "global"));

            List<RuleDefinition> rules = new ArrayList<>();
            for (Object ruleNode : asList(root.get("rules"), "rules")) {
                rules.add(parseRule(asMap(ruleNode, "rule")));
            }
            return new AutomationConfig(version, global, rules);
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(source + ": " + e.getMessage(), e);
        }
    }

    /** The {@code *.yaml} and {@code *.yml} files of a directory, sorted by name. */
    public List<Path> configFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Rule directory not found: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(AutomationConfigLoader::isYaml)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /** Loads every rule file of {@code directory} separately. */
    public List<AutomationConfig> loadAll(Path directory) throws IOException, ConfigValidationException {
        List<AutomationConfig> configs = new ArrayList<>();
        for (Path file : configFiles(directory)) {
            configs.add(load(file));
        }
        return configs;
    }

    /** Loads every rule file of {@code directory} and merges them in file-name order. */
    public AutomationConfig loadDirectory(Path directory) throws IOException, ConfigValidationException {
        List<AutomationConfig> configs = loadAll(directory);
        log.info("Loaded {} rule file(s) from {}", configs.size(), directory);
        return AutomationConfig.merge(configs);
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Checks the version and the shape of every rule.
     *
     * @param knownActionTypes action types that may be referenced; empty to accept any
     * @throws ConfigValidationException describing the first problem found
     */
    public void validate(AutomationConfig config, Set<String> knownActionTypes) throws ConfigValidationException {
        if (!AutomationConfig.SUPPORTED_VERSION.equals(config.getVersion())) {
            throw new ConfigValidationException("unsupported config version: " + config.getVersion());
        }
        validateTimeout(config.getGlobal().getDefaultTimeout(), "global default_timeout");

        Set<String> ids = new HashSet<>();
        List<RuleDefinition> rules = config.getRules();
        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            String where = "rule[" + i + "]";
            if (isBlank(rule.getId())) {
                throw new ConfigValidationException(where + " missing ID");
            }
            if (!ids.add(rule.getId())) {
                throw new ConfigValidationException("duplicate rule ID: " + rule.getId());
            }
            if (isBlank(rule.getName())) {
                throw new ConfigValidationException(where + " missing name");
            }
            if (rule.getConditions().isEmpty()) {
                throw new ConfigValidationException(where + " has no conditions");
            }
            if (rule.getActions().isEmpty()) {
                throw new ConfigValidationException(where + " has no actions");
            }
            for (int c = 0; c < rule.getConditions().size(); c++) {
                validateCondition(rule.getConditions().get(c), where + " condition[" + c + "]");
            }
            for (int a = 0; a < rule.getActions().size(); a++) {
                validateAction(rule.getActions().get(a), knownActionTypes, where + " action[" + a + "]");
            }
        }
    }

    void validateCondition(ConditionDefinition condition, String where) throws ConfigValidationException {
        if (isBlank(condition.getType())) {
            throw new ConfigValidationException(where + ": missing type");
        }
        ConditionType type = ConditionType.fromWireName(condition.getType())
                .orElseThrow(() -> new ConfigValidationException(where + ": invalid type: " + condition.getType()));
        if (isBlank(condition.getOperator())) {
            throw new ConfigValidationException(where + ": missing operator");
        }
        if (Operator.fromWireName(condition.getOperator()).isEmpty()) {
            throw new ConfigValidationException(where + ": invalid operator: " + condition.getOperator());
        }
        if (condition.getValue() == null) {
            throw new ConfigValidationException(where + ": missing value");
        }
        if (type.requiresField() && isBlank(condition.getField())) {
            throw new ConfigValidationException(where + ": missing field for " + type.wireName() + " condition");
        }
    }

    void validateAction(ActionDefinition action, Set<String> knownActionTypes, String where)
            throws ConfigValidationException {
        if (isBlank(action.getType())) {
            throw new ConfigValidationException(where + ": missing type");
        }
        if (!knownActionTypes.isEmpty() && !knownActionTypes.contains(action.getType())) {
            throw new ConfigValidationException(where + ": invalid type: " + action.getType());
        }
        if (action.getParameters() == null) {
            throw new ConfigValidationException(where + ": missing parameters");
        }
        if (action.getTimeout() != null) {
            validateTimeout(action.getTimeout(), where + " timeout");
        }
    }

    private static void validateTimeout(String timeout, String where) throws ConfigValidationException {
        try {
            Durations.parse(timeout);
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(where + ": invalid duration " + timeout);
        }
    }

    // ------------------------------------------------------------------
    // Conversion
    // ------------------------------------------------------------------

    /**
     * Validates {@code config} and converts its rules.  Actions without a
     * timeout get the global {@code default_timeout}; when the global section
     * is disabled every rule is disabled.
     */
    public List<Rule> toRules(AutomationConfig config) throws ConfigValidationException {
        validate(config, Set.of());
        GlobalSettings global = config.getGlobal();

        List<Rule> rules = new ArrayList<>();
        for (RuleDefinition def : config.getRules()) {
            Rule.Builder builder = Rule.builder(def.getId(), def.getName())
                    .description(def.getDescription())
                    .enabled(def.isEnabled() && global.isEnabled())
                    .priority(def.getPriority())
                    .metadata(def.getMetadata());
            for (ConditionDefinition c : def.getConditions()) {
                builder.condition(new Condition(
                        ConditionType.fromWireName(c.getType()).orElseThrow(),
                        c.getField(),
                        Operator.fromWireName(c.getOperator()).orElseThrow(),
                        c.getValue(),
                        c.getParameters()));
            }
            for (ActionDefinition a : def.getActions()) {
                String timeout = a.getTimeout() == null ? global.getDefaultTimeout() : a.getTimeout();
                builder.action(new Action(a.getType(), a.getParameters(), a.isAsync(), timeout));
            }
            rules.add(builder.build());
        }
        return rules;
    }

    // ------------------------------------------------------------------
    // YAML node helpers
    // ------------------------------------------------------------------

    private GlobalSettings parseGlobal(Map<String, Object> map) {
        Object enabled = map.get("enabled");
        Map<String, String> urls = new LinkedHashMap<>();
        asMapOrEmpty(map.get("notification_urls"), "notification_urls")
                .forEach((k, v) -> urls.put(k, toOptionalString(v)));
        return new GlobalSettings(
                enabled == null || toBoolean(enabled, "enabled"),
                toOptionalString(map.get("default_timeout")),
                map.get("max_concurrency") == null ? 0 : toInt(map.get("max_concurrency"), "max_concurrency"),
                urls,
                asMapOrEmpty(map.get("variables"), "variables"));
    }

    private RuleDefinition parseRule(Map<String, Object> map) {
        List<ConditionDefinition> conditions = new ArrayList<>();
        for (Object node : asList(map.get("conditions"), "conditions")) {
            Map<String, Object> c = asMap(node, "condition");
            conditions.add(new ConditionDefinition(
                    toOptionalString(c.get("type")),
                    toOptionalString(c.get("field")),
                    toOptionalString(c.get("operator")),
                    c.get("value"),
                    asMapOrEmpty(c.get("parameters"), "parameters")));
        }
        List<ActionDefinition> actions = new ArrayList<>();
        for (Object node : asList(map.get("actions"), "actions")) {
            Map<String, Object> a = asMap(node, "action");
            actions.add(new ActionDefinition(
                    toOptionalString(a.get("type")),
                    a.get("parameters") == null ? null : asMap(a.get("parameters"), "parameters"),
                    a.get("async") != null && toBoolean(a.get("async"), "async"),
                    toOptionalString(a.get("timeout"))));
        }
        Object enabled = map.get("enabled");
        return new RuleDefinition(
                toOptionalString(map.get("id")),
                toOptionalString(map.get("name")),
                toOptionalString(map.get("description")),
                enabled == null || toBoolean(enabled, "enabled"),
                map.get("priority") == null ? 0 : toInt(map.get("priority"), "priority"),
                conditions,
                actions,
                asMapOrEmpty(map.get("metadata"), "metadata"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node, String name) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException(name + " must be a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) raw).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static Map<String, Object> asMapOrEmpty(Object node, String name) {
        return node == null ? new LinkedHashMap<>() : asMap(node, name);
    }

    private static List<?> asList(Object node, String name) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> list)) {
            throw new IllegalArgumentException(name + " must be a list");
        }
        return list;
    }

    private static String toOptionalString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static boolean toBoolean(Object value, String name) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException(name + " must be true or false, got " + value);
    }

    private static int toInt(Object value, String name) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got " + value);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
