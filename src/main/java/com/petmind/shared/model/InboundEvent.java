package com.petmind.shared.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw envelope handed over by speech, vision and window-polling collaborators
 * before it is turned into a memory {@link Event}.
 *
 * <p>{@code timestamp} is when the producer saw the event. It is informational
 * only: memory stamps every stored event with its own clock on arrival.
 */
public record InboundEvent(
    String type,
    Map<String, Object> fields,
    Instant timestamp
) {
    public InboundEvent {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String text(String key, String fallback) {
        var value = fields.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    public boolean flag(String key) {
        var value = fields.get(key);
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }
}
