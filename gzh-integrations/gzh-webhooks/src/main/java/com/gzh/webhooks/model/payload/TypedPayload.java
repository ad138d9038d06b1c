package com.gzh.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gzh.webhooks.model.RepositoryInfo;
import com.gzh.webhooks.model.SenderInfo;

/**
 * Fields every known GitHub payload carries at the top level.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TypedPayload implements EventPayload {

    @JsonProperty("action")
    private String action;

    @JsonProperty("repository")
    private RepositoryInfo repository;

    @JsonProperty("sender")
    private SenderInfo sender;

    public String getAction()             { return action; }
    public RepositoryInfo getRepository() { return repository; }
    public SenderInfo getSender()         { return sender; }
}
