package com.petmind.shared.model;

import java.time.Instant;
import java.util.Objects;

public record Event(
    EventPayload payload,
    Instant timestamp
) {
    public Event {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public String kind() {
        return payload.kind();
    }
}
