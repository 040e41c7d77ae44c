package com.petmind.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scored events that cleared the promotion threshold, bounded by capacity.
 * Insertion order is kept so that equal scores rank in a stable order.
 */
class ImportantLayer {

    private static final Comparator<ScoredEvent> BY_IMPORTANCE_DESC =
            Comparator.comparingDouble(ScoredEvent::importance).reversed();

    private final int capacity;
    private List<ScoredEvent> entries = new ArrayList<>();

    ImportantLayer(int capacity) {
        this.capacity = capacity;
    }

    void add(ScoredEvent entry) {
        entries.add(entry);
    }

    /**
     * Keeps the {@code capacity} highest-scoring entries and discards the rest.
     *
     * @return number of entries discarded
     */
    int trim() {
        if (entries.size() <= capacity) return 0;
        var sorted = new ArrayList<>(entries);
        sorted.sort(BY_IMPORTANCE_DESC);
        int discarded = sorted.size() - capacity;
        entries = new ArrayList<>(sorted.subList(0, capacity));
        return discarded;
    }

    List<ScoredEvent> entries() {
        return entries;
    }

    void replaceWith(List<ScoredEvent> kept) {
        entries = new ArrayList<>(kept);
    }

    /** Top {@code count} entries by importance, as detached copies. */
    List<ScoredEvent> top(int count) {
        if (count <= 0) return List.of();
        var sorted = new ArrayList<>(entries);
        sorted.sort(BY_IMPORTANCE_DESC);
        return sorted.stream().limit(count).map(ScoredEvent::copy).toList();
    }

    int size() {
        return entries.size();
    }

    void clear() {
        entries.clear();
    }
}
