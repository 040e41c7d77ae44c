package com.petmind.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kind-specific event content. Known kinds with structure get their own record;
 * everything else keeps its raw fields in {@link Generic}.
 */
public sealed interface EventPayload
        permits EventPayload.Chat, EventPayload.Vision, EventPayload.AppActivity,
                EventPayload.Location, EventPayload.Generic {

    String kind();

    Map<String, Object> asMap();

    record Chat(String who, String text) implements EventPayload {
        public Chat {
            who = who == null ? "user" : who;
            text = text == null ? "" : text;
        }

        @Override public String kind() { return EventKinds.CHAT; }

        @Override public Map<String, Object> asMap() {
            return Map.of("who", who, "text", text);
        }
    }

    record Vision(String summary, String path) implements EventPayload {
        public Vision {
            summary = summary == null ? "" : summary;
        }

        @Override public String kind() { return EventKinds.VISION; }

        @Override public Map<String, Object> asMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("summary", summary);
            if (path != null) map.put("path", path);
            return Collections.unmodifiableMap(map);
        }
    }

    record AppActivity(String app, String category, boolean surprised, boolean curious) implements EventPayload {
        public AppActivity {
            app = app == null ? "Unknown" : app;
            category = category == null ? "unknown" : category;
        }

        @Override public String kind() { return EventKinds.APP_ACTIVITY; }

        @Override public Map<String, Object> asMap() {
            return Map.of("app", app, "category", category,
                    "surprised", surprised, "curious", curious);
        }
    }

    record Location(double x, double y, double z) implements EventPayload {
        @Override public String kind() { return EventKinds.LOCATION; }

        @Override public Map<String, Object> asMap() {
            return Map.of("pos", List.of(x, y, z));
        }
    }

    record Generic(String kind, Map<String, Object> fields) implements EventPayload {
        public Generic {
            kind = EventKinds.normalize(kind);
            fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override public Map<String, Object> asMap() { return fields; }
    }

    /**
     * Shapes a loosely typed map into the variant for {@code kind}. Missing or
     * mistyped keys fall back to defaults instead of failing.
     */
    static EventPayload of(String kind, Map<String, ?> raw) {
        var k = EventKinds.normalize(kind);
        Map<String, ?> data = raw == null ? Map.of() : raw;
        switch (k) {
            case EventKinds.CHAT:
                return new Chat(string(data.get("who"), "user"), string(data.get("text"), ""));
            case EventKinds.VISION:
                return new Vision(string(data.get("summary"), ""), string(data.get("path"), null));
            case EventKinds.APP_ACTIVITY:
                return new AppActivity(string(data.get("app"), "Unknown"),
                        string(data.get("category"), "unknown"),
                        bool(data.get("surprised")), bool(data.get("curious")));
            case EventKinds.LOCATION:
                if (data.get("pos") instanceof List<?> pos) {
                    return new Location(coord(pos, 0), coord(pos, 1), coord(pos, 2));
                }
                return new Location(number(data.get("x")), number(data.get("y")), number(data.get("z")));
            default:
                var fields = new LinkedHashMap<String, Object>();
                data.forEach(fields::put);
                return new Generic(k, fields);
        }
    }

    private static String string(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    private static double coord(List<?> pos, int index) {
        return index < pos.size() ? number(pos.get(index)) : 0;
    }

    private static double number(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value == null) return 0;
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
