package com.gzh.webhooks.github.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gzh.webhooks.handler.ExecutionContext;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpPut;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP client for the GitHub REST API calls made by the action handlers.
 *
 * <p>Every call takes the {@link ExecutionContext} of the action: a cancelled
 * context fails fast, and the response timeout of the request is capped by
 * the time the context has left.
 */
public class GitHubRestClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GitHubRestClient.class);

    private static final String ACCEPT      = "application/vnd.github+json";
    private static final String API_VERSION = "2022-11-28";

    private final GitHubClientConfig  config;
    private final CloseableHttpClient http;
    private final ObjectMapper        mapper;

    public GitHubRestClient(GitHubClientConfig config) {
        this.config = config;
        Timeout connectTimeout = Timeout.ofMilliseconds(config.getConnectTimeout().toMillis());
        this.http   = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(connectTimeout)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(connectTimeout)
                        .setResponseTimeout(Timeout.ofMilliseconds(config.getResponseTimeout().toMillis()))
                        .build())
                .build();
        this.mapper = new ObjectMapper();
        if (!config.hasToken()) {
            log.warn("No GitHub token configured: API calls to {} will be unauthenticated", config.getBaseUrl());
        }
    }

    // ------------------------------------------------------------------
    // Issues
    // ------------------------------------------------------------------

    /**
     * {@code POST /repos/{owner}/{repo}/issues}
     *
     * @return number of the created issue
     */
    public int createIssue(ExecutionContext context, String owner, String repo, String title, String body,
                           List<String> labels, List<String> assignees) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("body", body);
        if (!labels.isEmpty()) {
            payload.put("labels", labels);
        }
        if (!assignees.isEmpty()) {
            payload.put("assignees", assignees);
        }
        JsonNode created = send(new HttpPost(uri("repos", owner, repo, "issues")), payload, context);
        return created.path("number").asInt();
    }

    /** {@code POST /repos/{owner}/{repo}/issues/{number}/labels} */
    public void addLabels(ExecutionContext context, String owner, String repo, int number, List<String> labels)
            throws IOException {
        send(new HttpPost(uri("repos", owner, repo, "issues", String.valueOf(number), "labels")),
                Map.of("labels", labels), context);
    }

    /**
     * {@code POST /repos/{owner}/{repo}/issues/{number}/comments}
     *
     * @return id of the created comment
     */
    public long createComment(ExecutionContext context, String owner, String repo, int number, String body)
            throws IOException {
        JsonNode created = send(new HttpPost(uri("repos", owner, repo, "issues", String.valueOf(number), "comments")),
                Map.of("body", body), context);
        return created.path("id").asLong();
    }

    // ------------------------------------------------------------------
    // Pull requests and workflows
    // ------------------------------------------------------------------

    /**
     * {@code PUT /repos/{owner}/{repo}/pulls/{number}/merge}
     *
     * @param commitMessage optional; {@code null} or blank keeps GitHub's default
     * @return SHA of the merge commit
     */
    public String mergePullRequest(ExecutionContext context, String owner, String repo, int number,
                                   String mergeMethod, String commitMessage) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("merge_method", mergeMethod);
        if (commitMessage != null && !commitMessage.isBlank()) {
            payload.put("commit_message", commitMessage);
        }
        JsonNode result = send(new HttpPut(uri("repos", owner, repo, "pulls", String.valueOf(number), "merge")),
                payload, context);
        return result.path("sha").asText(null);
    }

    /** {@code POST /repos/{owner}/{repo}/actions/workflows/{workflowFile}/dispatches} */
    public void dispatchWorkflow(ExecutionContext context, String owner, String repo, String workflowFile,
                                 String ref, Map<String, Object> inputs) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("ref", ref);
        if (inputs != null && !inputs.isEmpty()) {
            payload.put("inputs", inputs);
        }
        send(new HttpPost(uri("repos", owner, repo, "actions", "workflows", workflowFile, "dispatches")),
                payload, context);
    }

    @Override
    public void close() throws IOException {
        http.close();
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private URI uri(String... segments) throws IOException {
        try {
            return new URIBuilder(config.getBaseUrl()).appendPathSegments(segments).build();
        } catch (URISyntaxException e) {
            throw new IOException("Invalid GitHub URL for " + String.join("/", segments), e);
        }
    }

    private JsonNode send(HttpUriRequestBase req, Object payload, ExecutionContext context) throws IOException {
        if (context.isCancelled()) {
            throw new IOException("Request cancelled before it was sent: " + req.getMethod() + " " + req.getPath());
        }
        req.setHeader("Accept", ACCEPT);
        req.setHeader("X-GitHub-Api-Version", API_VERSION);
        req.setHeader("User-Agent", config.getUserAgent());
        if (config.hasToken()) {
            req.setHeader("Authorization", "Bearer " + config.getToken());
        }
        req.setEntity(new StringEntity(mapper.writeValueAsString(payload), ContentType.APPLICATION_JSON));
        context.remaining().ifPresent(left -> req.setConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(min(left, config.getResponseTimeout()).toMillis()))
                .build()));

        String target = req.getMethod() + " " + req.getPath();
        log.debug("GitHub API {}", target);
        return http.execute(req, response -> {
            int status = response.getCode();
            byte[] body = response.getEntity() == null
                    ? new byte[0]
                    : response.getEntity().getContent().readAllBytes();
            if (status < 200 || status >= 300) {
                throw new GitHubApiException(status, "GitHub API " + target + " failed: HTTP " + status
                        + errorMessage(body));
            }
            return body.length == 0 ? mapper.createObjectNode() : mapper.readTree(body);
        });
    }

    private String errorMessage(byte[] body) {
        if (body.length == 0) {
            return "";
        }
        try {
            JsonNode message = mapper.readTree(body).get("message");
            return message == null ? "" : " (" + message.asText() + ")";
        } catch (IOException e) {
            return "";
        }
    }

    private static Duration min(Duration a, Duration b) {
        Duration smaller = a.compareTo(b) <= 0 ? a : b;
        return smaller.isZero() ? Duration.ofMillis(1) : smaller;
    }
}
