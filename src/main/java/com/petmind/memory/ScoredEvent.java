package com.petmind.memory;

import com.petmind.shared.model.Event;

/**
 * An event held in the important layer. The event is immutable; only its
 * importance moves, and only downwards, when a sweep decays it.
 */
public final class ScoredEvent {

    private final Event event;
    private double importance;

    ScoredEvent(Event event, double importance) {
        this.event = event;
        this.importance = importance;
    }

    public Event event() { return event; }

    public double importance() { return importance; }

    void decayTo(double importance) {
        this.importance = Math.min(this.importance, importance);
    }

    ScoredEvent copy() {
        return new ScoredEvent(event, importance);
    }

    @Override
    public String toString() {
        return "ScoredEvent[" + event.kind() + ", importance=" + importance + "]";
    }
}
