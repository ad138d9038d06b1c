package com.gzh.webhooks.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gzh.webhooks.model.EventType;
import com.gzh.webhooks.model.RepositoryInfo;
import com.gzh.webhooks.model.SenderInfo;
import com.gzh.webhooks.model.WebhookEvent;
import com.gzh.webhooks.model.payload.GenericPayload;
import com.gzh.webhooks.model.payload.IssueCommentPayload;
import com.gzh.webhooks.model.payload.IssuesPayload;
import com.gzh.webhooks.model.payload.PullRequestPayload;
import com.gzh.webhooks.model.payload.PushPayload;
import com.gzh.webhooks.model.payload.TypedPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a raw delivery (event-type header, delivery id, body, headers) into a
 * {@link WebhookEvent}.
 *
 * <p>Known event types are bound to their payload class, which also yields
 * the normalized repository, sender and action.  Any other type is parsed as
 * a generic JSON object and {@code repository}, {@code sender} and
 * {@code action} are picked up from its top level when present.
 */
public class EventParser {

    private static final Logger log = LoggerFactory.getLogger(EventParser.class);

    public static final String DEFAULT_HEADER_PREFIX = "X-GitHub-";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final String headerPrefix;

    /** eventType → payload class */
    private final Map<String, Class<? extends TypedPayload>> payloadTypes = new HashMap<>();

    public EventParser() {
        this(DEFAULT_HEADER_PREFIX);
    }

    /**
     * @param headerPrefix prefix of the platform headers retained on the event (case-insensitive)
     */
    public EventParser(String headerPrefix) {
        this.mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        this.headerPrefix = headerPrefix;
        payloadTypes.put(EventType.PUSH, PushPayload.class);
        payloadTypes.put(EventType.PULL_REQUEST, PullRequestPayload.class);
        payloadTypes.put(EventType.ISSUES, IssuesPayload.class);
        payloadTypes.put(EventType.ISSUE_COMMENT, IssueCommentPayload.class);
    }

    /**
     * Parses one delivery.
     *
     * @param eventType  value of the event-type header (required)
     * @param deliveryId value of the delivery header; a UUID is generated when absent
     * @param body       raw request body
     * @param headers    request headers; only platform-prefixed ones are kept
     * @throws EventParseException if the event type is missing or the body is not a JSON object
     */
    public WebhookEvent parse(String eventType,
                              String deliveryId,
                              byte[] body,
                              Map<String, String> headers) throws EventParseException {
        if (eventType == null || eventType.isBlank()) {
            throw new EventParseException("Missing event type header");
        }
        if (body == null || body.length == 0) {
            throw new EventParseException("Empty payload");
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new EventParseException("Malformed JSON payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new EventParseException("Payload must be a JSON object");
        }

        String type = eventType.trim();
        WebhookEvent.Builder builder = WebhookEvent.builder()
                .id(deliveryId == null || deliveryId.isBlank() ? UUID.randomUUID().toString() : deliveryId.trim())
                .type(type)
                .rawPayload(body)
                .receivedAt(Instant.now())
                .headers(platformHeaders(headers));

        Class<? extends TypedPayload> payloadClass = payloadTypes.get(type);
        if (payloadClass != null) {
            parseKnown(root, payloadClass, builder);
        } else {
            parseGeneric(root, builder);
        }
        return builder.build();
    }

    // ------------------------------------------------------------------
    // Type-specific extraction
    // ------------------------------------------------------------------

    private void parseKnown(JsonNode root,
                            Class<? extends TypedPayload> payloadClass,
                            WebhookEvent.Builder builder) throws EventParseException {
        TypedPayload payload;
        try {
            payload = mapper.treeToValue(root, payloadClass);
        } catch (JsonProcessingException e) {
            throw new EventParseException("Invalid " + payloadClass.getSimpleName() + " body", e);
        }
        builder.payload(payload)
               .action(payload.getAction())
               .repository(payload.getRepository())
               .sender(payload.getSender());
    }

    private void parseGeneric(JsonNode root, WebhookEvent.Builder builder) {
        builder.payload(new GenericPayload(mapper.convertValue(root, MAP_TYPE)));

        JsonNode action = root.get("action");
        if (action != null && action.isTextual()) {
            builder.action(action.asText());
        }
        builder.repository(optionalObject(root, "repository", RepositoryInfo.class));
        builder.sender(optionalObject(root, "sender", SenderInfo.class));
    }

    private <T> T optionalObject(JsonNode root, String field, Class<T> type) {
        JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable '{}' object in generic payload: {}", field, e.getOriginalMessage());
            return null;
        }
    }

    private Map<String, String> platformHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> kept = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (name != null && name.regionMatches(true, 0, headerPrefix, 0, headerPrefix.length())) {
                kept.put(name, value);
            }
        });
        return kept;
    }
}
