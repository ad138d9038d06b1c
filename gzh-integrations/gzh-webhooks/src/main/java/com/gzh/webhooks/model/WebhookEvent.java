package com.gzh.webhooks.model;

import com.gzh.webhooks.model.payload.EventPayload;
import com.gzh.webhooks.model.payload.GenericPayload;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized, immutable representation of one webhook delivery.
 *
 * Created by {@link com.gzh.webhooks.parser.EventParser} once the delivery's
 * signature has been verified, then owned by the worker that processes it.
 * Events are never persisted.
 */
public final class WebhookEvent {

    /** Delivery id from the platform, or a generated UUID.  A label only; never used for deduplication. */
    private final String id;

    /** Event category, e.g. "push", "pull_request". */
    private final String type;

    /** Sub-action for compound types ("opened"); empty when not applicable. */
    private final String action;

    private final RepositoryInfo repository;
    private final SenderInfo     sender;
    private final EventPayload   payload;
    private final byte[]         rawPayload;
    private final Instant        receivedAt;

    /** Platform-prefixed request headers, kept for troubleshooting. */
    private final Map<String, String> headers;

    private WebhookEvent(Builder b) {
        this.id         = Objects.requireNonNull(b.id, "id");
        this.type       = Objects.requireNonNull(b.type, "type");
        this.action     = b.action == null ? "" : b.action;
        this.repository = b.repository;
        this.sender     = b.sender;
        this.payload    = b.payload == null ? new GenericPayload(Map.of()) : b.payload;
        this.rawPayload = b.rawPayload == null ? new byte[0] : b.rawPayload.clone();
        this.receivedAt = b.receivedAt == null ? Instant.now() : b.receivedAt;
        this.headers    = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
    }

    public String getId()                  { return id; }
    public String getType()                { return type; }
    public String getAction()              { return action; }
    public RepositoryInfo getRepository()  { return repository; }
    public SenderInfo getSender()          { return sender; }
    public EventPayload getPayload()       { return payload; }
    public byte[] getRawPayload()          { return rawPayload.clone(); }
    public Instant getReceivedAt()         { return receivedAt; }
    public Map<String, String> getHeaders() { return headers; }

    /**
     * The type rules match against: {@code type}, or {@code type.action}
     * when the delivery carries an action.
     */
    public String qualifiedType() {
        return action.isEmpty() ? type : type + "." + action;
    }

    public boolean hasRepository() { return repository != null; }

    public boolean hasSender() { return sender != null; }

    /** Narrows the payload to a known payload class, or {@code null} when it is of another kind. */
    public <T extends EventPayload> T payloadAs(Class<T> payloadClass) {
        return payloadClass.isInstance(payload) ? payloadClass.cast(payload) : null;
    }

    public static Builder builder() { return new Builder(); }

    @Override
    public String toString() {
        return "WebhookEvent{id='" + id + '\'' +
               ", type='" + qualifiedType() + '\'' +
               ", repository=" + (repository == null ? null : repository.getFullName()) +
               ", receivedAt=" + receivedAt + '}';
    }

    public static final class Builder {
        private String id;
        private String type;
        private String action;
        private RepositoryInfo repository;
        private SenderInfo sender;
        private EventPayload payload;
        private byte[] rawPayload;
        private Instant receivedAt;
        private final Map<String, String> headers = new LinkedHashMap<>();

        public Builder id(String id)                         { this.id = id; return this; }
        public Builder type(String type)                     { this.type = type; return this; }
        public Builder action(String action)                 { this.action = action; return this; }
        public Builder repository(RepositoryInfo repository) { this.repository = repository; return this; }
        public Builder sender(SenderInfo sender)             { this.sender = sender; return this; }
        public Builder payload(EventPayload payload)         { this.payload = payload; return this; }
        public Builder rawPayload(byte[] rawPayload)         { this.rawPayload = rawPayload; return this; }
        public Builder receivedAt(Instant receivedAt)        { this.receivedAt = receivedAt; return this; }
        public Builder header(String name, String value)     { this.headers.put(name, value); return this; }
        public Builder headers(Map<String, String> headers)  { this.headers.putAll(headers); return this; }

        public WebhookEvent build() {
            return new WebhookEvent(this);
        }
    }
}
