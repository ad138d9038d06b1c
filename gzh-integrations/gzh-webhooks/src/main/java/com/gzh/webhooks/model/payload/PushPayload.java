package com.gzh.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/** Body of a {@code push} delivery. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushPayload extends TypedPayload {

    private static final String BRANCH_PREFIX = "refs/heads/";

    @JsonProperty("ref")
    private String ref;

    @JsonProperty("before")
    private String before;

    @JsonProperty("after")
    private String after;

    @JsonProperty("created")
    private boolean created;

    @JsonProperty("deleted")
    private boolean deleted;

    @JsonProperty("forced")
    private boolean forced;

    @JsonProperty("commits")
    private List<Commit> commits;

    public String getRef()        { return ref; }
    public String getBefore()     { return before; }
    public String getAfter()      { return after; }
    public boolean isCreated()    { return created; }
    public boolean isDeleted()    { return deleted; }
    public boolean isForced()     { return forced; }

    public List<Commit> getCommits() {
        return commits == null ? Collections.emptyList() : Collections.unmodifiableList(commits);
    }

    /** Branch name for branch pushes, {@code null} for tag pushes. */
    public String getBranch() {
        return ref != null && ref.startsWith(BRANCH_PREFIX) ? ref.substring(BRANCH_PREFIX.length()) : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Commit {

        @JsonProperty("id")
        private String id;

        @JsonProperty("message")
        private String message;

        public String getId()      { return id; }
        public String getMessage() { return message; }
    }
}
