package com.gzh.webhooks.model.payload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Structural fallback for event types without a dedicated payload class.
 * Values are whatever Jackson produced for the JSON tree (maps, lists,
 * strings, numbers, booleans).
 */
public class GenericPayload implements EventPayload {

    private final Map<String, Object> fields;

    public GenericPayload(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Map<String, Object> getFields() { return fields; }

    public Object get(String key) { return fields.get(key); }

    @Override
    public Optional<Integer> issueOrPullRequestNumber() {
        Object number = fields.get("number");
        if (number instanceof Number n) {
            return Optional.of(n.intValue());
        }
        for (String container : new String[] {"issue", "pull_request"}) {
            Object nested = fields.get(container);
            if (nested instanceof Map<?, ?> map && map.get("number") instanceof Number n) {
                return Optional.of(n.intValue());
            }
        }
        return Optional.empty();
    }
}
