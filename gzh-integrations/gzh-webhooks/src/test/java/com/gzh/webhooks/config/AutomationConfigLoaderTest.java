package com.gzh.webhooks.config;

import com.gzh.webhooks.config.RuleDefinition.ActionDefinition;
import com.gzh.webhooks.config.RuleDefinition.ConditionDefinition;
import com.gzh.webhooks.rule.Action;
import com.gzh.webhooks.rule.ConditionType;
import com.gzh.webhooks.rule.Operator;
import com.gzh.webhooks.rule.Rule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutomationConfigLoaderTest {

    private static final Set<String> KNOWN = Set.of("create_issue", "add_label", "notification");

    private static final String FULL = """
            version: "1.0"
            global:
              enabled: true
              default_timeout: "60s"
              max_concurrency: 5
              notification_urls:
                slack: "https://hooks.slack.com/test"
              variables:
                test_var: "test_value"

            rules:
              - id: "test-rule"
                name: "Test Rule"
                description: "A test automation rule"
                enabled: true
                priority: 100
                conditions:
                  - type: "event_type"
                    operator: "equals"
                    value: "push"
                  - type: "repository"
                    field: "private"
                    operator: "=="
                    value: false
                actions:
                  - type: "create_issue"
                    parameters:
                      title: "Test Issue"
                      body: "Test issue body"
                  - type: "add_label"
                    async: true
                    timeout: "5s"
                    parameters:
                      labels: ["triage", "bot"]
            """;

    private final AutomationConfigLoader loader = new AutomationConfigLoader();

    @TempDir
    Path dir;

    private static String minimalRule(String id, String eventType) {
        return """
                rules:
                  - id: "%s"
                    name: "Rule %s"
                    conditions:
                      - type: "event_type"
                        operator: "equals"
                        value: "%s"
                    actions:
                      - type: "create_issue"
                        parameters:
                          title: "Issue"
                """.formatted(id, id, eventType);
    }

    @Test
    void loadsFullDocument() throws Exception {
        Path file = Files.writeString(dir.resolve("automation.yaml"), FULL);

        AutomationConfig config = loader.load(file);

        assertThat(config.getVersion()).isEqualTo("1.0");
        GlobalSettings global = config.getGlobal();
        assertThat(global.isEnabled()).isTrue();
        assertThat(global.getDefaultTimeout()).isEqualTo("60s");
        assertThat(global.getMaxConcurrency()).isEqualTo(5);
        assertThat(global.getNotificationUrls()).containsEntry("slack", "https://hooks.slack.com/test");
        assertThat(global.getVariables()).containsEntry("test_var", "test_value");

        assertThat(config.getRules()).hasSize(1);
        RuleDefinition rule = config.getRules().get(0);
        assertThat(rule.getId()).isEqualTo("test-rule");
        assertThat(rule.getName()).isEqualTo("Test Rule");
        assertThat(rule.isEnabled()).isTrue();
        assertThat(rule.getPriority()).isEqualTo(100);
        assertThat(rule.getConditions()).hasSize(2);
        assertThat(rule.getActions()).hasSize(2);
        loader.validate(config, KNOWN);
    }

    @Test
    void appliesDefaults() throws Exception {
        AutomationConfig config = loader.parse(minimalRule("minimal-rule", "push"));

        assertThat(config.getVersion()).isEqualTo("1.0");
        assertThat(config.getGlobal().getMaxConcurrency()).isEqualTo(10);
        assertThat(config.getGlobal().getDefaultTimeout()).isEqualTo("30s");
        assertThat(config.getRules().get(0).isEnabled()).isTrue();
    }

    @Test
    void emptyDocumentHasNoRules() throws Exception {
        assertThat(loader.parse("").getRules()).isEmpty();
    }

    @Test
    void convertsToEngineRules() throws Exception {
        List<Rule> rules = loader.toRules(loader.parse(FULL));

        Rule rule = rules.get(0);
        assertThat(rule.getConditions().get(0).getType()).isEqualTo(ConditionType.EVENT_TYPE);
        assertThat(rule.getConditions().get(1).getOperator()).isEqualTo(Operator.EQUALS);
        assertThat(rule.getConditions().get(1).getValue()).isEqualTo(false);

        Action issue = rule.getActions().get(0);
        assertThat(issue.getTimeout()).isEqualTo("60s");
        assertThat(issue.isAsync()).isFalse();
        Action label = rule.getActions().get(1);
        assertThat(label.getTimeout()).isEqualTo("5s");
        assertThat(label.isAsync()).isTrue();
        assertThat(label.getParameters()).containsEntry("labels", List.of("triage", "bot"));
    }

    @Test
    void globallyDisabledConfigDisablesRules() throws Exception {
        List<Rule> rules = loader.toRules(loader.parse("global:\n  enabled: false\n" + minimalRule("r", "push")));

        assertThat(rules).extracting(Rule::isEnabled).containsExactly(false);
    }

    @Test
    void loadsEveryYamlFileOfDirectory() throws Exception {
        Files.writeString(dir.resolve("config1.yaml"), minimalRule("rule-1", "push"));
        Files.writeString(dir.resolve("config2.yml"), minimalRule("rule-2", "pull_request"));
        Files.writeString(dir.resolve("readme.txt"), "This should be ignored");

        assertThat(loader.configFiles(dir)).extracting(p -> p.getFileName().toString())
                .containsExactly("config1.yaml", "config2.yml");
        assertThat(loader.loadAll(dir)).hasSize(2);
        AutomationConfig merged = loader.loadDirectory(dir);
        assertThat(merged.getRules()).extracting(RuleDefinition::getId).containsExactly("rule-1", "rule-2");
    }

    @Test
    void globalSettingsOfOneFileOnlyApplyToItsOwnRules() throws Exception {
        Files.writeString(dir.resolve("a-paused.yaml"),
                "global:\n  enabled: false\n  default_timeout: \"1s\"\n" + minimalRule("paused", "push"));
        Files.writeString(dir.resolve("b-active.yaml"), minimalRule("active", "push"));

        List<Rule> rules = loader.toRules(loader.loadDirectory(dir));

        assertThat(rules).extracting(Rule::getId).containsExactly("paused", "active");
        assertThat(rules.get(0).isEnabled()).isFalse();
        assertThat(rules.get(0).getActions()).extracting(Action::getTimeout).containsExactly("1s");
        assertThat(rules.get(1).isEnabled()).isTrue();
        assertThat(rules.get(1).getActions()).extracting(Action::getTimeout).containsExactly("30s");
    }

    @Test
    void disabledLastFileDoesNotDisableEarlierFiles() throws Exception {
        Files.writeString(dir.resolve("a-active.yaml"), minimalRule("active", "push"));
        Files.writeString(dir.resolve("b-paused.yaml"), "global:\n  enabled: false\n" + minimalRule("paused", "push"));

        List<Rule> rules = loader.toRules(loader.loadDirectory(dir));

        assertThat(rules).extracting(Rule::isEnabled).containsExactly(true, false);
    }

    @Test
    void missingFileAndDirectoryAreIoErrors() {
        assertThatThrownBy(() -> loader.load(dir.resolve("nope.yaml"))).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> loader.loadDirectory(dir.resolve("nope"))).isInstanceOf(IOException.class);
    }

    @Test
    void mergeConcatenatesRulesAndMergesGlobals() {
        AutomationConfig first = new AutomationConfig("1.0",
                new GlobalSettings(true, "30s", 5, Map.of("slack", "https://slack.com/webhook1"), Map.of("var1", "value1")),
                List.of(definition("rule-1")));
        AutomationConfig second = new AutomationConfig("1.0",
                new GlobalSettings(true, "60s", 10, Map.of("discord", "https://discord.com/webhook1"), Map.of("var2", "value2")),
                List.of(definition("rule-2")));

        AutomationConfig merged = AutomationConfig.merge(List.of(first, second));

        assertThat(merged.getVersion()).isEqualTo("1.0");
        assertThat(merged.getRules()).extracting(RuleDefinition::getId).containsExactly("rule-1", "rule-2");
        assertThat(merged.getGlobal().getDefaultTimeout()).isEqualTo("60s");
        assertThat(merged.getGlobal().getMaxConcurrency()).isEqualTo(10);
        assertThat(merged.getGlobal().getNotificationUrls())
                .containsEntry("slack", "https://slack.com/webhook1")
                .containsEntry("discord", "https://discord.com/webhook1");
        assertThat(merged.getGlobal().getVariables()).containsEntry("var1", "value1").containsEntry("var2", "value2");
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    private static RuleDefinition definition(String id) {
        return rule(id, "Rule " + id,
                List.of(new ConditionDefinition("event_type", null, "equals", "push", Map.of())),
                List.of(new ActionDefinition("create_issue", Map.of("title", "t"), false, null)));
    }

    private static RuleDefinition rule(String id, String name,
                                       List<ConditionDefinition> conditions, List<ActionDefinition> actions) {
        return new RuleDefinition(id, name, null, true, 0, conditions, actions, null);
    }

    private void assertInvalid(AutomationConfig config, String message) {
        assertThatThrownBy(() -> loader.validate(config, KNOWN))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining(message);
    }

    private static AutomationConfig config(RuleDefinition... rules) {
        return new AutomationConfig("1.0", null, List.of(rules));
    }

    @Test
    void validatesRuleShape() throws Exception {
        loader.validate(config(definition("ok")), KNOWN);

        assertInvalid(new AutomationConfig("2.0", null, List.of()), "unsupported config version: 2.0");
        assertInvalid(config(definition("duplicate-id"), definition("duplicate-id")), "duplicate rule ID: duplicate-id");
        RuleDefinition valid = definition("x");
        assertInvalid(config(rule(null, "n", valid.getConditions(), valid.getActions())), "rule[0] missing ID");
        assertInvalid(config(rule("x", "", valid.getConditions(), valid.getActions())), "rule[0] missing name");
        assertInvalid(config(rule("x", "n", List.of(), valid.getActions())), "rule[0] has no conditions");
        assertInvalid(config(rule("x", "n", valid.getConditions(), List.of())), "rule[0] has no actions");
    }

    @Test
    void validatesConditions() {
        String[][] cases = {
                {null, "equals", "missing type"},
                {"invalid_type", "equals", "invalid type: invalid_type"},
                {"event_type", null, "missing operator"},
                {"event_type", "invalid_op", "invalid operator: invalid_op"},
        };
        for (String[] c : cases) {
            ConditionDefinition condition = new ConditionDefinition(c[0], null, c[1], "push", Map.of());
            assertInvalid(config(rule("x", "n", List.of(condition), definition("x").getActions())), c[2]);
        }
        ConditionDefinition noValue = new ConditionDefinition("event_type", null, "equals", null, Map.of());
        assertInvalid(config(rule("x", "n", List.of(noValue), definition("x").getActions())), "missing value");
        ConditionDefinition noField = new ConditionDefinition("repository", null, "equals", "r1", Map.of());
        assertInvalid(config(rule("x", "n", List.of(noField), definition("x").getActions())), "missing field");
    }

    @Test
    void validatesActions() throws Exception {
        List<ConditionDefinition> conditions = definition("x").getConditions();

        assertInvalid(config(rule("x", "n", conditions,
                List.of(new ActionDefinition(null, Map.of("title", "t"), false, null)))), "missing type");
        assertInvalid(config(rule("x", "n", conditions,
                List.of(new ActionDefinition("invalid_action", Map.of("title", "t"), false, null)))),
                "invalid type: invalid_action");
        assertInvalid(config(rule("x", "n", conditions,
                List.of(new ActionDefinition("create_issue", null, false, null)))), "missing parameters");
        assertInvalid(config(rule("x", "n", conditions,
                List.of(new ActionDefinition("create_issue", Map.of(), false, "later")))), "invalid duration");

        // without a known-type set any action type is accepted
        loader.validate(config(rule("x", "n", conditions,
                List.of(new ActionDefinition("custom", Map.of(), false, null)))), Set.of());
    }

    @Test
    void malformedYamlIsAValidationError() {
        assertThatThrownBy(() -> loader.parse("rules: [unclosed"))
                .isInstanceOf(ConfigValidationException.class);
        assertThatThrownBy(() -> loader.parse("rules: \"not a list\""))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("rules must be a list");
        assertThatThrownBy(() -> loader.parse("rules:\n  - id: x\n    enabled: maybe\n"))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("enabled");
    }
}
