package com.petmind.memory;

import com.petmind.shared.model.Event;
import com.petmind.shared.model.EventPayload;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** All events archived for one local calendar date. */
class DayBucket {

    static final int FRAGMENT_TEXT_LENGTH = 50;

    private final LocalDate date;
    private final List<Event> events = new ArrayList<>();
    private final Set<String> fragments = new LinkedHashSet<>();
    private final StringBuilder rollingSummary = new StringBuilder();
    private final Instant firstTimestamp;

    DayBucket(LocalDate date, Instant firstTimestamp) {
        this.date = date;
        this.firstTimestamp = firstTimestamp;
    }

    void append(Event event) {
        events.add(event);
        if (event.payload() instanceof EventPayload.Chat chat) {
            var fragment = chat.who() + ": " + Text.truncate(chat.text(), FRAGMENT_TEXT_LENGTH);
            if (fragments.add(fragment)) {
                rollingSummary.append(fragment).append("; ");
            }
        }
    }

    ArchiveDay snapshot() {
        return new ArchiveDay(date, events.size(), firstTimestamp,
                List.copyOf(events), rollingSummary.toString());
    }
}
