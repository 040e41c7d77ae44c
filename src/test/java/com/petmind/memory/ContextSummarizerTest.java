package com.petmind.memory;

import com.petmind.shared.model.Event;
import com.petmind.shared.model.EventPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ContextSummarizerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final ContextSummarizer summarizer = new ContextSummarizer(new EventFormatter());
    private RecentLayer recent;
    private ImportantLayer important;
    private ArchiveLayer archive;

    @BeforeEach
    void setUp() {
        recent = new RecentLayer(20);
        important = new ImportantLayer(100);
        archive = new ArchiveLayer();
    }

    private static Event event(EventPayload payload) {
        return new Event(payload, T0);
    }

    private static List<String> lines(String summary) {
        return summary.isEmpty() ? List.of() : List.of(summary.split("\n", -1));
    }

    @Test
    void emptyStoreRendersNothing() {
        assertEquals("", summarizer.summarize(recent, important, archive, 15));
    }

    @Test
    void rendersSectionsInFixedOrder() {
        recent.append(event(new EventPayload.AppActivity("Blender", "creative", false, true)));
        important.add(new ScoredEvent(event(new EventPayload.Chat("user", "my cat is Miso")), 1.0));
        archive.archive(new Event(new EventPayload.Chat("user", "old"), Instant.parse("2026-02-20T10:00:00Z")),
                ZoneId.of("UTC"));

        assertThat(lines(summarizer.summarize(recent, important, archive, 15))).containsExactly(
                ContextSummarizer.RECENT_HEADER,
                "[using] Blender (creative)",
                "",
                ContextSummarizer.IMPORTANT_HEADER,
                "user: my cat is Miso",
                "",
                ContextSummarizer.ARCHIVE_HEADER,
                "[2026-02-20] 1 events");
    }

    @Test
    void omitsEmptySectionsWithoutLeadingBlank() {
        important.add(new ScoredEvent(event(new EventPayload.Vision("a new item", null)), 0.8));
        assertThat(lines(summarizer.summarize(recent, important, archive, 15))).containsExactly(
                ContextSummarizer.IMPORTANT_HEADER,
                "[vision] a new item");
    }

    @Test
    void recentShowsLastFiveChronologically() {
        for (int i = 1; i <= 8; i++) recent.append(event(new EventPayload.Chat("user", "line " + i)));
        var out = lines(summarizer.summarize(recent, important, archive, 15));
        assertThat(out).containsExactly(ContextSummarizer.RECENT_HEADER,
                "user: line 4", "user: line 5", "user: line 6", "user: line 7", "user: line 8");
    }

    @Test
    void importantShowsTopFiveByScore() {
        for (int i = 1; i <= 7; i++) {
            important.add(new ScoredEvent(event(new EventPayload.Chat("user", "fact " + i)), 0.4 + i * 0.05));
        }
        var out = lines(summarizer.summarize(recent, important, archive, 15));
        assertThat(out).containsExactly(ContextSummarizer.IMPORTANT_HEADER,
                "user: fact 7", "user: fact 6", "user: fact 5", "user: fact 4", "user: fact 3");
    }

    @Test
    void truncatesToMaxLines() {
        for (int i = 1; i <= 5; i++) recent.append(event(new EventPayload.Chat("user", "r" + i)));
        important.add(new ScoredEvent(event(new EventPayload.Chat("user", "fact")), 0.9));
        for (int max = 0; max <= 10; max++) {
            assertTrue(lines(summarizer.summarize(recent, important, archive, max)).size() <= max);
        }
        assertThat(lines(summarizer.summarize(recent, important, archive, 3)))
                .containsExactly(ContextSummarizer.RECENT_HEADER, "user: r1", "user: r2");
    }

    @Test
    void multiLineTextStaysOnOneLine() {
        recent.append(event(new EventPayload.Chat("user", "one\ntwo\r\nthree")));
        assertThat(lines(summarizer.summarize(recent, important, archive, 2)))
                .containsExactly(ContextSummarizer.RECENT_HEADER, "user: one two three");
    }

    @Test
    void chatCutKeepsSupplementaryCharacterWhole() {
        var smile = "\uD83D\uDE00";
        recent.append(event(new EventPayload.Chat("user", "a".repeat(79) + smile + " tail")));

        var line = lines(summarizer.summarize(recent, important, archive, 2)).get(1);

        assertEquals("user: " + "a".repeat(79) + smile, line);
        assertFalse(Character.isHighSurrogate(line.charAt(line.length() - 1)));
    }

    @Test
    void formatsEachKind() {
        var formatter = new EventFormatter();
        assertEquals("user: " + "a".repeat(80), formatter.format(event(new EventPayload.Chat("user", "a".repeat(100)))));
        assertEquals("[vision] desk", formatter.format(event(new EventPayload.Vision("desk", "/tmp/x.png"))));
        assertEquals("[using] Unknown (unknown)", formatter.format(event(EventPayload.of("app_activity", Map.of()))));
        assertEquals("[at] 10, 64, -3", formatter.format(event(EventPayload.of("location", Map.of("pos", List.of(10, 64, -3))))));
        assertEquals("[at] 1.5, 0, 0", formatter.format(event(EventPayload.of("location", Map.of("x", 1.5)))));
        assertEquals("[inventory] {item=diamond}", formatter.format(event(EventPayload.of("inventory", Map.of("item", "diamond")))));
    }

    @Test
    void unknownKindFieldsAreCutAtSixtyCharacters() {
        var line = new EventFormatter().format(event(EventPayload.of("mood", Map.of("note", "z".repeat(100)))));
        assertEquals("[mood] " + ("{note=" + "z".repeat(100)).substring(0, 60), line);
    }
}
