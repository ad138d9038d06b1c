package com.gzh.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized subset of the {@code repository} object carried by most
 * GitHub deliveries.  Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepositoryInfo {

    @JsonProperty("name")
    private String name;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("private")
    private boolean privateRepository;

    @JsonProperty("language")
    private String language;

    @JsonProperty("default_branch")
    private String defaultBranch;

    @JsonProperty("owner")
    private Owner owner;

    public RepositoryInfo() {}

    public RepositoryInfo(String name, String fullName, boolean privateRepository,
                          String language, String defaultBranch, String ownerLogin) {
        this.name              = name;
        this.fullName          = fullName;
        this.privateRepository = privateRepository;
        this.language          = language;
        this.defaultBranch     = defaultBranch;
        this.owner             = ownerLogin == null ? null : new Owner(ownerLogin);
    }

    public String getName()            { return name; }
    public String getFullName()        { return fullName; }
    public boolean isPrivate()         { return privateRepository; }
    public String getLanguage()        { return language; }
    public String getDefaultBranch()   { return defaultBranch; }
    public Owner getOwner()            { return owner; }

    /** Owner login, falling back to the prefix of {@code full_name}. */
    public String getOwnerLogin() {
        if (owner != null && owner.getLogin() != null) {
            return owner.getLogin();
        }
        if (fullName != null && fullName.indexOf('/') > 0) {
            return fullName.substring(0, fullName.indexOf('/'));
        }
        return null;
    }

    @Override
    public String toString() {
        return "RepositoryInfo{fullName='" + fullName + "', private=" + privateRepository + '}';
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Owner {

        @JsonProperty("login")
        private String login;

        public Owner() {}

        public Owner(String login) { this.login = login; }

        public String getLogin() { return login; }
    }
}
