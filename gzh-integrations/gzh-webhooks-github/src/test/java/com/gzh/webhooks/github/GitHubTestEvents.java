package com.gzh.webhooks.github;

import com.gzh.webhooks.model.RepositoryInfo;
import com.gzh.webhooks.model.SenderInfo;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.model.payload.GenericPayload;

import java.util.Map;

/** Event fixtures for handler tests. */
public final class GitHubTestEvents {

    private GitHubTestEvents() {}

    public static WebhookEvent pullRequest(int number) {
        return WebhookEvent.builder()
                .id("delivery-7")
                .type("pull_request")
                .action("opened")
                .repository(new RepositoryInfo("widgets", "acme/widgets", false, "Java", "main", "acme"))
                .sender(new SenderInfo("octocat", "User", false))
                .payload(new GenericPayload(Map.of("number", number)))
                .build();
    }

    public static WebhookEvent push() {
        return WebhookEvent.builder()
                .id("delivery-8")
                .type("push")
                .repository(new RepositoryInfo("widgets", "acme/widgets", false, "Java", "main", "acme"))
                .sender(new SenderInfo("octocat", "User", false))
                .build();
    }

    public static WebhookEvent withoutRepository() {
        return WebhookEvent.builder()
                .id("delivery-9")
                .type("ping")
                .sender(new SenderInfo("octocat", "User", false))
                .build();
    }
}
