package com.gzh.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/** Body of an {@code issue_comment} delivery; the issue may also be a pull request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssueCommentPayload extends TypedPayload {

    @JsonProperty("issue")
    private IssuesPayload.Issue issue;

    @JsonProperty("comment")
    private Comment comment;

    public IssuesPayload.Issue getIssue() { return issue; }
    public Comment getComment()           { return comment; }

    @Override
    public Optional<Integer> issueOrPullRequestNumber() {
        return Optional.ofNullable(issue).map(IssuesPayload.Issue::getNumber);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Comment {

        @JsonProperty("id")
        private Long id;

        @JsonProperty("body")
        private String body;

        @JsonProperty("user")
        private UserRef user;

        public Long getId()      { return id; }
        public String getBody()  { return body; }
        public UserRef getUser() { return user; }
    }
}
