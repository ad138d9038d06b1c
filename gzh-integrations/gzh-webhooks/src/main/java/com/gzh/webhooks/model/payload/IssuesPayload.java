package com.gzh.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Body of an {@code issues} delivery. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IssuesPayload extends TypedPayload {

    @JsonProperty("issue")
    private Issue issue;

    public Issue getIssue() { return issue; }

    @Override
    public Optional<Integer> issueOrPullRequestNumber() {
        return Optional.ofNullable(issue).map(Issue::getNumber);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Issue {

        @JsonProperty("number")
        private Integer number;

        @JsonProperty("title")
        private String title;

        @JsonProperty("state")
        private String state;

        @JsonProperty("user")
        private UserRef user;

        @JsonProperty("labels")
        private List<Label> labels;

        public Integer getNumber() { return number; }
        public String getTitle()   { return title; }
        public String getState()   { return state; }
        public UserRef getUser()   { return user; }

        public List<Label> getLabels() {
            return labels == null ? Collections.emptyList() : Collections.unmodifiableList(labels);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Label {

        @JsonProperty("name")
        private String name;

        public String getName() { return name; }
    }
}
