package com.petmind.memory;

import com.petmind.shared.model.Event;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/** Date-keyed buckets of archived events. Nothing is ever evicted from here. */
class ArchiveLayer {

    private final TreeMap<LocalDate, DayBucket> buckets = new TreeMap<>();

    void archive(Event event, ZoneId zone) {
        var date = LocalDate.ofInstant(event.timestamp(), zone);
        buckets.computeIfAbsent(date, d -> new DayBucket(d, event.timestamp())).append(event);
    }

    Optional<ArchiveDay> get(LocalDate date) {
        return Optional.ofNullable(buckets.get(date)).map(DayBucket::snapshot);
    }

    /** Most recent {@code count} dates, newest first. */
    List<ArchiveDay> latest(int count) {
        return buckets.descendingMap().values().stream()
                .limit(Math.max(0, count))
                .map(DayBucket::snapshot)
                .toList();
    }

    int days() {
        return buckets.size();
    }

    void clear() {
        buckets.clear();
    }
}
