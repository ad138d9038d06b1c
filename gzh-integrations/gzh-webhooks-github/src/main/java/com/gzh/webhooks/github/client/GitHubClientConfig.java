package com.gzh.webhooks.github.client;

import java.time.Duration;

/**
 * Immutable settings for {@link GitHubRestClient}.
 *
 * <pre>
 *   GitHubClientConfig config = GitHubClientConfig.builder()
 *       .token(System.getenv("GITHUB_TOKEN"))
 *       .baseUrl("https://github.example.com/api/v3")   // GitHub Enterprise
 *       .build();
 * </pre>
 */
public final class GitHubClientConfig {

    public static final String DEFAULT_BASE_URL = "https://api.github.com";

    private final String   baseUrl;
    private final String   token;
    private final String   userAgent;
    private final Duration connectTimeout;
    private final Duration responseTimeout;

    private GitHubClientConfig(Builder b) {
        this.baseUrl         = b.baseUrl;
        this.token           = b.token;
        this.userAgent       = b.userAgent;
        this.connectTimeout  = b.connectTimeout;
        this.responseTimeout = b.responseTimeout;
    }

    public String   getBaseUrl()         { return baseUrl; }
    public String   getToken()           { return token; }
    public String   getUserAgent()       { return userAgent; }
    public Duration getConnectTimeout()  { return connectTimeout; }
    public Duration getResponseTimeout() { return responseTimeout; }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String   baseUrl         = DEFAULT_BASE_URL;
        private String   token;
        private String   userAgent       = "gzh-webhooks";
        private Duration connectTimeout  = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(30);

        public Builder baseUrl(String baseUrl)             { this.baseUrl = baseUrl; return this; }
        public Builder token(String token)                 { this.token = token; return this; }
        public Builder userAgent(String userAgent)         { this.userAgent = userAgent; return this; }
        public Builder connectTimeout(Duration timeout)    { this.connectTimeout = timeout; return this; }
        public Builder responseTimeout(Duration timeout)   { this.responseTimeout = timeout; return this; }

        public GitHubClientConfig build() {
            if (baseUrl == null || !(baseUrl.startsWith("http://") || baseUrl.startsWith("https://"))) {
                throw new IllegalStateException("baseUrl must be an http(s) URL, got " + baseUrl);
            }
            while (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }
            if (userAgent == null || userAgent.isBlank()) {
                throw new IllegalStateException("userAgent must not be blank");
            }
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()
                    || responseTimeout == null || responseTimeout.isNegative() || responseTimeout.isZero()) {
                throw new IllegalStateException("timeouts must be positive");
            }
            return new GitHubClientConfig(this);
        }
    }
}
