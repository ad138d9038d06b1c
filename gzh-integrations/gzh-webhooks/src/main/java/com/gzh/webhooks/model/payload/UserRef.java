package com.gzh.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Author / owner reference embedded in issues, pull requests and comments. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserRef {

    @JsonProperty("login")
    private String login;

    public String getLogin() { return login; }
}
