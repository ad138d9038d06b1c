package com.gzh.webhooks.github.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gzh.webhooks.handler.ExecutionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitHubRestClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutionContext context = ExecutionContext.background();

    private StubApiServer api;
    private GitHubRestClient client;

    @BeforeEach
    void setUp() throws Exception {
        api = new StubApiServer();
        client = new GitHubRestClient(GitHubClientConfig.builder()
                .baseUrl(api.baseUrl() + "/")
                .token("ghp_test")
                .build());
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        api.close();
    }

    private StubApiServer.Recorded lastRequest() throws InterruptedException {
        StubApiServer.Recorded recorded = api.requests.poll(5, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        return recorded;
    }

    @Test
    void createIssuePostsJsonWithCredentials() throws Exception {
        api.respond(201, "{\"number\":17}");

        int number = client.createIssue(context, "acme", "widgets", "Broken build", "Details", List.of("bug"), List.of());

        assertThat(number).isEqualTo(17);
        StubApiServer.Recorded req = lastRequest();
        assertThat(req.method).isEqualTo("POST");
        assertThat(req.path).isEqualTo("/repos/acme/widgets/issues");
        assertThat(req.authorization).isEqualTo("Bearer ghp_test");
        assertThat(req.accept).isEqualTo("application/vnd.github+json");
        assertThat(req.userAgent).isEqualTo("gzh-webhooks");
        JsonNode body = mapper.readTree(req.body);
        assertThat(body.get("title").asText()).isEqualTo("Broken build");
        assertThat(body.get("labels").get(0).asText()).isEqualTo("bug");
        assertThat(body.has("assignees")).isFalse();
    }

    @Test
    void mergeUsesPutAndReturnsSha() throws Exception {
        api.respond(200, "{\"sha\":\"6dcb09b\",\"merged\":true}");

        String sha = client.mergePullRequest(context, "acme", "widgets", 9, "squash", null);

        assertThat(sha).isEqualTo("6dcb09b");
        StubApiServer.Recorded req = lastRequest();
        assertThat(req.method).isEqualTo("PUT");
        assertThat(req.path).isEqualTo("/repos/acme/widgets/pulls/9/merge");
        assertThat(mapper.readTree(req.body).get("merge_method").asText()).isEqualTo("squash");
        assertThat(mapper.readTree(req.body).has("commit_message")).isFalse();
    }

    @Test
    void workflowDispatchAcceptsEmptyResponse() throws Exception {
        api.respond(204, "");

        client.dispatchWorkflow(context, "acme", "widgets", "ci.yml", "main", Map.of("level", "full"));

        StubApiServer.Recorded req = lastRequest();
        assertThat(req.path).isEqualTo("/repos/acme/widgets/actions/workflows/ci.yml/dispatches");
        JsonNode body = mapper.readTree(req.body);
        assertThat(body.get("ref").asText()).isEqualTo("main");
        assertThat(body.get("inputs").get("level").asText()).isEqualTo("full");
    }

    @Test
    void errorStatusCarriesGitHubMessage() {
        api.respond(404, "{\"message\":\"Not Found\"}");

        assertThatThrownBy(() -> client.addLabels(context, "acme", "widgets", 1, List.of("x")))
                .isInstanceOf(GitHubApiException.class)
                .hasMessageContaining("HTTP 404")
                .hasMessageContaining("Not Found")
                .satisfies(e -> assertThat(((GitHubApiException) e).getStatusCode()).isEqualTo(404));
    }

    @Test
    void cancelledContextSendsNothing() {
        ExecutionContext cancelled = ExecutionContext.background();
        cancelled.cancel();

        assertThatThrownBy(() -> client.createComment(cancelled, "acme", "widgets", 1, "hi"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("cancelled");
        assertThat(api.requests).isEmpty();
    }

    @Test
    void responseTimeoutFollowsContextDeadline() {
        api.delay(2_000);
        ExecutionContext shortLived = context.withTimeout(Duration.ofMillis(200));

        assertThatThrownBy(() -> client.createComment(shortLived, "acme", "widgets", 1, "hi"))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(GitHubApiException.class);
    }

    @Test
    void connectTimeoutBoundsUnreachableHost() throws Exception {
        // non-routable address: the SYN is never answered
        GitHubRestClient unreachable = new GitHubRestClient(GitHubClientConfig.builder()
                .baseUrl("http://10.255.255.1:81/")
                .connectTimeout(Duration.ofMillis(300))
                .responseTimeout(Duration.ofMinutes(5))
                .build());
        try (unreachable) {
            long started = System.nanoTime();

            assertThatThrownBy(() -> unreachable.createComment(context, "acme", "widgets", 1, "hi"))
                    .isInstanceOf(IOException.class)
                    .isNotInstanceOf(GitHubApiException.class);
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(10_000);
        }
    }

    @Test
    void notifierPostsTextPayload() throws Exception {
        api.respond(200, "ok");

        try (WebhookNotifier notifier = new WebhookNotifier()) {
            notifier.send(context, api.baseUrl() + "/hooks/slack", "Release published");
        }

        StubApiServer.Recorded req = lastRequest();
        assertThat(req.path).isEqualTo("/hooks/slack");
        assertThat(req.authorization).isNull();
        assertThat(mapper.readTree(req.body).get("text").asText()).isEqualTo("Release published");
    }

    @Test
    void notifierFailsOnErrorStatus() {
        api.respond(500, "boom");

        assertThatThrownBy(() -> {
            try (WebhookNotifier notifier = new WebhookNotifier()) {
                notifier.send(context, api.baseUrl() + "/hooks/slack", "x");
            }
        }).isInstanceOf(IOException.class).hasMessageContaining("HTTP 500");
    }

    @Test
    void configRejectsNonHttpBaseUrl() {
        assertThatThrownBy(() -> GitHubClientConfig.builder().baseUrl("ftp://example.com").build())
                .isInstanceOf(IllegalStateException.class);
    }
}
