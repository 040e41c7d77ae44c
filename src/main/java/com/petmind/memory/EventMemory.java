package com.petmind.memory;

import com.petmind.shared.model.Event;
import com.petmind.shared.model.EventPayload;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface EventMemory {

    int DEFAULT_SUMMARY_LINES = 15;
    int DEFAULT_READ_COUNT = 10;

    void add(String kind, Map<String, ?> payload);

    void add(EventPayload payload);

    default void addChat(String text) {
        addChat(text, "user");
    }

    default void addChat(String text, String who) {
        add(new EventPayload.Chat(who, text));
    }

    default void addVision(String summary, String path) {
        add(new EventPayload.Vision(summary, path));
    }

    default void addAppActivity(String app, String category, boolean surprised, boolean curious) {
        add(new EventPayload.AppActivity(app, category, surprised, curious));
    }

    String getContextSummary(int maxLines);

    default String getContextSummary() {
        return getContextSummary(DEFAULT_SUMMARY_LINES);
    }

    List<Event> getRecent(int count);

    default List<Event> getRecent() {
        return getRecent(DEFAULT_READ_COUNT);
    }

    List<ScoredEvent> getImportant(int count);

    default List<ScoredEvent> getImportant() {
        return getImportant(DEFAULT_READ_COUNT);
    }

    Optional<ArchiveDay> getArchiveForDate(String isoDate);

    MemoryStats getMemoryStats();

    void clear();
}
