package com.gzh.webhooks.github.handler;

import com.gzh.webhooks.github.GitHubTestEvents;
import com.gzh.webhooks.github.client.GitHubApiException;
import com.gzh.webhooks.github.client.GitHubRestClient;
import com.gzh.webhooks.handler.ActionException;
import com.gzh.webhooks.handler.ExecutionContext;
import com.gzh.webhooks.handler.TemplateRenderer;
import com.gzh.webhooks.rule.Action;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GitHubActionHandlersTest {

    @Mock
    private GitHubRestClient client;

    private final TemplateRenderer renderer = new TemplateRenderer(Map.of("team", "platform"));
    private final ExecutionContext context = ExecutionContext.background();

    @Test
    void createIssueRendersTemplatesAndTargetsEventRepository() throws Exception {
        when(client.createIssue(any(), anyString(), anyString(), anyString(), anyString(), any(), any()))
                .thenReturn(12);
        Action action = new Action("create_issue", Map.of(
                "title", "Opened by {{sender.login}}",
                "body", "Ping {{vars.team}} about {{repo.full_name}}",
                "labels", List.of("triage", "{{event.type}}")));

        new CreateIssueHandler(client, renderer).execute(context, GitHubTestEvents.push(), action);

        verify(client).createIssue(context, "acme", "widgets", "Opened by octocat",
                "Ping platform about acme/widgets", List.of("triage", "push"), List.of());
    }

    @Test
    void createIssueRequiresTitleAndBody() {
        CreateIssueHandler handler = new CreateIssueHandler(client, renderer);

        assertThatThrownBy(() -> handler.validateParameters(Map.of("body", "b")))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("title");
        assertThatThrownBy(() -> handler.validateParameters(Map.of("title", "t")))
                .hasMessageContaining("body");
        assertThatCode(() -> handler.validateParameters(Map.of("title", "t", "body", "b")))
                .doesNotThrowAnyException();
    }

    @Test
    void addLabelUsesIssueNumberFromPayload() throws Exception {
        Action action = new Action("add_label", Map.of("labels", List.of("needs-review")));

        new AddLabelHandler(client, renderer).execute(context, GitHubTestEvents.pullRequest(42), action);

        verify(client).addLabels(context, "acme", "widgets", 42, List.of("needs-review"));
    }

    @Test
    void addLabelAcceptsYamlListsAndRejectsOtherShapes() {
        AddLabelHandler handler = new AddLabelHandler(client, renderer);

        assertThatCode(() -> handler.validateParameters(Map.of("labels", List.of("a", "b"))))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> handler.validateParameters(Map.of("labels", List.of(1, 2))))
                .isInstanceOf(ActionException.class);
        assertThatThrownBy(() -> handler.validateParameters(Map.of()))
                .isInstanceOf(ActionException.class);
    }

    @Test
    void commentFailsWithoutIssueNumber() {
        Action action = new Action("create_comment", Map.of("body", "hi"));

        assertThatThrownBy(() -> new CreateCommentHandler(client, renderer)
                .execute(context, GitHubTestEvents.push(), action))
                .isInstanceOf(ActionException.class)
                .hasMessage("could not determine issue/PR number from event");
        verifyNoInteractions(client);
    }

    @Test
    void commentRendersBody() throws Exception {
        Action action = new Action("create_comment", Map.of("body", "Welcome @{{sender.login}}!"));

        new CreateCommentHandler(client, renderer).execute(context, GitHubTestEvents.pullRequest(3), action);

        verify(client).createComment(context, "acme", "widgets", 3, "Welcome @octocat!");
    }

    @Test
    void handlersFailWithoutRepository() {
        Action action = new Action("create_issue", Map.of("title", "t", "body", "b"));

        assertThatThrownBy(() -> new CreateIssueHandler(client, renderer)
                .execute(context, GitHubTestEvents.withoutRepository(), action))
                .isInstanceOf(ActionException.class)
                .hasMessage("repository information not available");
    }

    @Test
    void mergeDefaultsToMergeMethod() throws Exception {
        when(client.mergePullRequest(any(), anyString(), anyString(), anyInt(), anyString(), isNull()))
                .thenReturn("abc123");

        new MergePullRequestHandler(client, renderer)
                .execute(context, GitHubTestEvents.pullRequest(5), new Action("merge_pr", Map.of()));

        verify(client).mergePullRequest(context, "acme", "widgets", 5, "merge", null);
    }

    @Test
    void mergeRejectsUnknownMethod() {
        MergePullRequestHandler handler = new MergePullRequestHandler(client, renderer);

        assertThatThrownBy(() -> handler.validateParameters(Map.of("merge_method", "octopus")))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("octopus");
        assertThatCode(() -> handler.validateParameters(Map.of("merge_method", "squash")))
                .doesNotThrowAnyException();
    }

    @Test
    void workflowDefaultsRefToDefaultBranchAndRendersInputs() throws Exception {
        Action action = new Action("run_workflow", Map.of(
                "workflow_file", "ci.yml",
                "inputs", Map.of("requested_by", "{{sender.login}}")));

        new RunWorkflowHandler(client, renderer).execute(context, GitHubTestEvents.push(), action);

        verify(client).dispatchWorkflow(context, "acme", "widgets", "ci.yml", "main",
                Map.of("requested_by", "octocat"));
    }

    @Test
    void apiErrorsBecomeActionExceptions() throws Exception {
        when(client.createIssue(any(), anyString(), anyString(), anyString(), anyString(), any(), any()))
                .thenThrow(new GitHubApiException(422, "Validation Failed"));
        Action action = new Action("create_issue", Map.of("title", "t", "body", "b"));

        assertThatThrownBy(() -> new CreateIssueHandler(client, renderer)
                .execute(context, GitHubTestEvents.push(), action))
                .isInstanceOf(ActionException.class)
                .hasMessageContaining("create_issue failed for acme/widgets")
                .hasCauseInstanceOf(GitHubApiException.class);
    }

    @Test
    void cancelledContextSkipsTheCall() {
        ExecutionContext cancelled = ExecutionContext.background();
        cancelled.cancel();
        Action action = new Action("add_label", Map.of("labels", List.of("x")));

        assertThatThrownBy(() -> new AddLabelHandler(client, renderer)
                .execute(cancelled, GitHubTestEvents.pullRequest(1), action))
                .isInstanceOf(ActionException.class);
        verifyNoInteractions(client);
    }

    @Test
    void stringListAcceptsSingleString() {
        assertThat(GitHubActionHandler.stringList("one")).containsExactly("one");
        assertThat(GitHubActionHandler.stringList(null)).isEmpty();
        assertThat(GitHubActionHandler.stringList(Map.of())).isEmpty();
    }
}
