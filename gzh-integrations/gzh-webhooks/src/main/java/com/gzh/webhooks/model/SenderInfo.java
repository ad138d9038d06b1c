package com.gzh.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Normalized subset of the {@code sender} object of a delivery. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SenderInfo {

    @JsonProperty("login")
    private String login;

    @JsonProperty("type")
    private String type;

    @JsonProperty("site_admin")
    private boolean siteAdmin;

    public SenderInfo() {}

    public SenderInfo(String login, String type, boolean siteAdmin) {
        this.login     = login;
        this.type      = type;
        this.siteAdmin = siteAdmin;
    }

    public String getLogin()    { return login; }
    public String getType()     { return type; }
    public boolean isSiteAdmin() { return siteAdmin; }

    @Override
    public String toString() {
        return "SenderInfo{login='" + login + "', type='" + type + "'}";
    }
}
