package com.gzh.webhooks.config;

import com.gzh.webhooks.queue.EventQueue;
import com.gzh.webhooks.queue.WorkerPool;

import java.time.Duration;

/**
 * Immutable configuration for {@link com.gzh.webhooks.server.WebhookAutomationServer}.
 *
 * Build with the nested {@link Builder}:
 * <pre>
 *   WebhookServerConfig config = WebhookServerConfig.builder()
 *       .port(8080)
 *       .path("/webhook")
 *       .sharedSecret("my-webhook-secret")
 *       .workers(10)
 *       .queueCapacity(100)
 *       .build();
 * </pre>
 *
 * The platform name determines the request headers: platform {@code GitHub}
 * reads {@code X-GitHub-Event} and {@code X-GitHub-Delivery}.  Without a
 * shared secret, signature verification is skipped.
 */
public final class WebhookServerConfig {

    public static final String DEFAULT_PLATFORM = "GitHub";

    private final int      port;
    private final String   path;
    private final String   sharedSecret;
    private final String   platform;
    private final int      workers;
    private final int      queueCapacity;
    private final int      maxThreads;
    private final Duration shutdownGracePeriod;

    private WebhookServerConfig(Builder b) {
        this.port                = b.port;
        this.path                = b.path;
        this.sharedSecret        = b.sharedSecret;
        this.platform            = b.platform;
        this.workers             = b.workers;
        this.queueCapacity       = b.queueCapacity;
        this.maxThreads          = b.maxThreads;
        this.shutdownGracePeriod = b.shutdownGracePeriod;
    }

    public int      getPort()                { return port; }
    public String   getPath()                { return path; }
    public String   getSharedSecret()        { return sharedSecret; }
    public String   getPlatform()            { return platform; }
    public int      getWorkers()             { return workers; }
    public int      getQueueCapacity()       { return queueCapacity; }
    public int      getMaxThreads()          { return maxThreads; }
    public Duration getShutdownGracePeriod() { return shutdownGracePeriod; }

    public boolean isSignatureVerificationEnabled() {
        return sharedSecret != null && !sharedSecret.isBlank();
    }

    public String getEventHeader()    { return "X-" + platform + "-Event"; }
    public String getDeliveryHeader() { return "X-" + platform + "-Delivery"; }
    public String getHeaderPrefix()   { return "X-" + platform + "-"; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int      port          = 8080;
        private String   path          = "/webhook";
        private String   sharedSecret;
        private String   platform      = DEFAULT_PLATFORM;
        private int      workers       = WorkerPool.DEFAULT_WORKERS;
        private int      queueCapacity = EventQueue.DEFAULT_CAPACITY;
        private int      maxThreads    = 50;
        private Duration shutdownGracePeriod = Duration.ofSeconds(10);

        public Builder port(int port)                      { this.port = port; return this; }
        public Builder path(String path)                   { this.path = path; return this; }
        public Builder sharedSecret(String secret)         { this.sharedSecret = secret; return this; }
        public Builder platform(String platform)           { this.platform = platform; return this; }
        public Builder workers(int workers)                { this.workers = workers; return this; }
        public Builder queueCapacity(int queueCapacity)    { this.queueCapacity = queueCapacity; return this; }
        public Builder maxThreads(int maxThreads)          { this.maxThreads = maxThreads; return this; }
        public Builder shutdownGracePeriod(Duration grace) { this.shutdownGracePeriod = grace; return this; }

        public WebhookServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalStateException("port must be between 0 and 65535, got " + port);
            }
            if (path == null || !path.startsWith("/")) {
                throw new IllegalStateException("path must start with '/', got " + path);
            }
            if (path.equals("/health") || path.equals("/metrics")) {
                throw new IllegalStateException("path " + path + " is reserved");
            }
            if (platform == null || platform.isBlank()) {
                throw new IllegalStateException("platform must not be blank");
            }
            if (workers < 1) {
                throw new IllegalStateException("workers must be >= 1, got " + workers);
            }
            if (queueCapacity < 1) {
                throw new IllegalStateException("queueCapacity must be >= 1, got " + queueCapacity);
            }
            if (maxThreads < 4) {
                throw new IllegalStateException("maxThreads must be >= 4, got " + maxThreads);
            }
            if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
                throw new IllegalStateException("shutdownGracePeriod must not be negative");
            }
            return new WebhookServerConfig(this);
        }
    }
}
