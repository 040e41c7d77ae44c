package com.petmind.memory;

import com.petmind.shared.model.Event;
import com.petmind.shared.model.EventPayload;

/** One-line rendering of an event for the context summary. Line breaks are flattened. */
class EventFormatter {

    static final int TEXT_LENGTH = 80;
    static final int FIELDS_LENGTH = 60;

    String format(Event event) {
        return render(event).replaceAll("[\\r\\n]+", " ");
    }

    private String render(Event event) {
        var payload = event.payload();
        if (payload instanceof EventPayload.Chat chat) {
            return chat.who() + ": " + Text.truncate(chat.text(), TEXT_LENGTH);
        }
        if (payload instanceof EventPayload.Vision vision) {
            return "[vision] " + Text.truncate(vision.summary(), TEXT_LENGTH);
        }
        if (payload instanceof EventPayload.AppActivity app) {
            return "[using] " + app.app() + " (" + app.category() + ")";
        }
        if (payload instanceof EventPayload.Location loc) {
            return "[at] " + coord(loc.x()) + ", " + coord(loc.y()) + ", " + coord(loc.z());
        }
        return "[" + payload.kind() + "] " + Text.truncate(String.valueOf(payload.asMap()), FIELDS_LENGTH);
    }

    private static String coord(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
