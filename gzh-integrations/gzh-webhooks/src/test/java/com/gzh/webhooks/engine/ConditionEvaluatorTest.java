package com.gzh.webhooks.engine;

import com.gzh.webhooks.TestEvents;
import com.gzh.webhooks.model.RepositoryInfo;
import com.gzh.webhooks.model.SenderInfo;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.rule.Condition;
import com.gzh.webhooks.rule.ConditionType;
import com.gzh.webhooks.rule.Operator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final WebhookEvent push = TestEvents.push();
    private final WebhookEvent prOpened = TestEvents.event("pull_request", "opened");

    private boolean eval(Condition condition, WebhookEvent event) {
        return evaluator.evaluate(condition, event);
    }

    @Test
    void eventTypeUsesQualifiedType() {
        assertThat(eval(Condition.eventType(Operator.EQUALS, "push"), push)).isTrue();
        assertThat(eval(Condition.eventType(Operator.EQUALS, "pull_request"), prOpened)).isFalse();
        assertThat(eval(Condition.eventType(Operator.EQUALS, "pull_request.opened"), prOpened)).isTrue();
        assertThat(eval(Condition.eventType(Operator.STARTS_WITH, "pull_request"), prOpened)).isTrue();
        assertThat(eval(Condition.eventType(Operator.NOT_EQUALS, "push"), prOpened)).isTrue();
    }

    @Test
    void matchesIsRegexSearchNotFullMatch() {
        assertThat(eval(Condition.eventType(Operator.MATCHES, "us"), push)).isTrue();
        assertThat(eval(Condition.eventType(Operator.MATCHES, "^pu"), push)).isTrue();
        assertThat(eval(Condition.eventType(Operator.MATCHES, "\\.open"), prOpened)).isTrue();
        assertThat(eval(Condition.repository("name", Operator.MATCHES, "r\\d"), push)).isTrue();
    }

    @Test
    void invalidRegexNeverMatches() {
        assertThat(eval(Condition.eventType(Operator.MATCHES, "(unclosed"), push)).isFalse();
        assertThat(eval(Condition.eventType(Operator.MATCHES, "(unclosed"), push)).isFalse();
    }

    @Test
    void inMatchesListMembership() {
        assertThat(eval(Condition.eventType(Operator.IN, List.of("push", "release")), push)).isTrue();
        assertThat(eval(Condition.eventType(Operator.IN, List.of("release", "create")), push)).isFalse();
        assertThat(eval(Condition.eventType(Operator.IN, List.of()), push)).isFalse();
        assertThat(eval(Condition.eventType(Operator.IN, "push"), push)).isFalse();
        assertThat(eval(Condition.sender("login", Operator.IN, List.of("bot", "u1")), push)).isTrue();
    }

    @Test
    void stringOperatorsAreCaseSensitive() {
        assertThat(eval(Condition.eventType(Operator.EQUALS, "PUSH"), push)).isFalse();
        assertThat(eval(Condition.repository("full_name", Operator.CONTAINS, "ACME"), push)).isFalse();
        assertThat(eval(Condition.repository("full_name", Operator.CONTAINS, "acme"), push)).isTrue();
        assertThat(eval(Condition.repository("full_name", Operator.ENDS_WITH, "/r1"), push)).isTrue();
    }

    @Test
    void repositoryFields() {
        assertThat(eval(Condition.repository("name", Operator.EQUALS, "r1"), push)).isTrue();
        assertThat(eval(Condition.repository("language", Operator.EQUALS, "Java"), push)).isTrue();
        assertThat(eval(Condition.repository("default_branch", Operator.EQUALS, "main"), push)).isTrue();
        assertThat(eval(Condition.repository("owner", Operator.EQUALS, "acme"), push)).isTrue();
        assertThat(eval(Condition.repository("stars", Operator.EQUALS, "10"), push)).isFalse();
    }

    @Test
    void booleanFieldsSupportOnlyEquality() {
        WebhookEvent privateRepo = WebhookEvent.builder().id("d").type("push")
                .repository(new RepositoryInfo("r", "acme/r", true, null, "main", null))
                .sender(new SenderInfo("root", "User", true))
                .build();

        assertThat(eval(Condition.repository("private", Operator.EQUALS, true), privateRepo)).isTrue();
        assertThat(eval(Condition.repository("private", Operator.EQUALS, "true"), privateRepo)).isTrue();
        assertThat(eval(Condition.repository("private", Operator.NOT_EQUALS, true), privateRepo)).isFalse();
        assertThat(eval(Condition.repository("private", Operator.EQUALS, false), push)).isTrue();
        assertThat(eval(Condition.repository("private", Operator.CONTAINS, "tr"), privateRepo)).isFalse();
        assertThat(eval(Condition.repository("private", Operator.EQUALS, "yes"), privateRepo)).isFalse();
        assertThat(eval(Condition.sender("site_admin", Operator.EQUALS, true), privateRepo)).isTrue();
    }

    @Test
    void missingRepositoryOrSenderNeverMatches() {
        WebhookEvent bare = WebhookEvent.builder().id("d").type("ping").build();

        assertThat(eval(Condition.repository("name", Operator.NOT_EQUALS, "x"), bare)).isFalse();
        assertThat(eval(Condition.sender("login", Operator.NOT_EQUALS, "x"), bare)).isFalse();
    }

    @Test
    void nonStringComparandNeverMatches() {
        assertThat(eval(Condition.eventType(Operator.EQUALS, 42), push)).isFalse();
        assertThat(eval(Condition.eventType(Operator.EQUALS, null), push)).isFalse();
    }

    @Test
    void payloadNeverMatchesAndTimeAlwaysMatches() {
        Condition payload = new Condition(ConditionType.PAYLOAD, "ref", Operator.EQUALS, "refs/heads/main");
        Condition time = new Condition(ConditionType.TIME, null, Operator.EQUALS, "business_hours");

        assertThat(eval(payload, push)).isFalse();
        assertThat(eval(time, push)).isTrue();
    }
}
