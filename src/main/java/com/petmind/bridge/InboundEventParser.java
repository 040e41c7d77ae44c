package com.petmind.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.petmind.shared.model.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Reads one JSON object per line, e.g.
 * {@code {"type":"APP_SWITCH","app":"Blender","category":"creative","curious":true}}.
 * Everything except {@code type} and {@code timestamp} becomes a field.
 */
public class InboundEventParser {

    private static final Logger log = LoggerFactory.getLogger(InboundEventParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Clock clock;

    public InboundEventParser() {
        this(Clock.systemUTC());
    }

    public InboundEventParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<InboundEvent> parse(String line) {
        if (line == null || line.isBlank()) return Optional.empty();
        try {
            var node = MAPPER.readTree(line);
            if (!(node instanceof ObjectNode obj)) {
                log.warn("Inbound event is not a JSON object: {}", abbreviate(line));
                return Optional.empty();
            }
            var type = obj.path("type").asText("");
            if (type.isBlank()) {
                log.warn("Inbound event without type: {}", abbreviate(line));
                return Optional.empty();
            }
            var fields = new LinkedHashMap<String, Object>();
            var it = obj.fields();
            while (it.hasNext()) {
                var entry = it.next();
                var key = entry.getKey();
                if ("type".equals(key) || "timestamp".equals(key)) continue;
                fields.put(key, MAPPER.treeToValue(entry.getValue(), Object.class));
            }
            return Optional.of(new InboundEvent(type, fields, timestamp(obj)));
        } catch (JsonProcessingException e) {
            log.warn("Malformed inbound event: {} ({})", abbreviate(line), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Instant timestamp(ObjectNode obj) {
        var ts = obj.get("timestamp");
        if (ts == null || ts.isNull()) return clock.instant();
        if (ts.isNumber()) return Instant.ofEpochMilli(Math.round(ts.asDouble() * 1000));
        try {
            return Instant.parse(ts.asText());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp {}, using clock", ts.asText());
            return clock.instant();
        }
    }

    private static String abbreviate(String line) {
        return line.length() > 120 ? line.substring(0, 120) + "..." : line;
    }
}
