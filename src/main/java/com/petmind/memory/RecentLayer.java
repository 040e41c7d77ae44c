package com.petmind.memory;

import com.petmind.shared.model.Event;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/** Fixed-size FIFO holding the true tail of the event stream. */
class RecentLayer {

    private final int capacity;
    private final ArrayDeque<Event> events;

    RecentLayer(int capacity) {
        this.capacity = capacity;
        this.events = new ArrayDeque<>(capacity);
    }

    void append(Event event) {
        if (events.size() == capacity) {
            events.pollFirst();
        }
        events.addLast(event);
    }

    /** Last {@code count} events, oldest first. */
    List<Event> tail(int count) {
        if (count <= 0) return List.of();
        var all = new ArrayList<>(events);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    int size() {
        return events.size();
    }

    void clear() {
        events.clear();
    }
}
