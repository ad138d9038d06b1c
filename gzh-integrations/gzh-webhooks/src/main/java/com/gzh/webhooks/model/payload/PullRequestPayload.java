package com.gzh.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/** Body of a {@code pull_request} delivery. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestPayload extends TypedPayload {

    @JsonProperty("number")
    private Integer number;

    @JsonProperty("pull_request")
    private PullRequest pullRequest;

    public Integer getNumber()           { return number; }
    public PullRequest getPullRequest()  { return pullRequest; }

    @Override
    public Optional<Integer> issueOrPullRequestNumber() {
        if (number != null) {
            return Optional.of(number);
        }
        return Optional.ofNullable(pullRequest).map(PullRequest::getNumber);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PullRequest {

        @JsonProperty("number")
        private Integer number;

        @JsonProperty("title")
        private String title;

        @JsonProperty("state")
        private String state;

        @JsonProperty("merged")
        private boolean merged;

        @JsonProperty("draft")
        private boolean draft;

        @JsonProperty("user")
        private UserRef user;

        @JsonProperty("head")
        private BranchRef head;

        @JsonProperty("base")
        private BranchRef base;

        public Integer getNumber()  { return number; }
        public String getTitle()    { return title; }
        public String getState()    { return state; }
        public boolean isMerged()   { return merged; }
        public boolean isDraft()    { return draft; }
        public UserRef getUser()    { return user; }
        public BranchRef getHead()  { return head; }
        public BranchRef getBase()  { return base; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BranchRef {

        @JsonProperty("ref")
        private String ref;

        @JsonProperty("sha")
        private String sha;

        public String getRef() { return ref; }
        public String getSha() { return sha; }
    }
}
