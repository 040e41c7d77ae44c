package com.petmind.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the three layers as a short, line-based digest for a prompt:
 * recent tail, top important entries, then pointers to the latest archive days.
 * Empty sections are left out and the result never exceeds {@code maxLines}.
 */
class ContextSummarizer {

    static final String RECENT_HEADER = "=== RECENT (last events) ===";
    static final String IMPORTANT_HEADER = "=== IMPORTANT (remembered facts) ===";
    static final String ARCHIVE_HEADER = "=== ARCHIVE (past sessions) ===";

    static final int RECENT_LINES = 5;
    static final int IMPORTANT_LINES = 5;
    static final int ARCHIVE_DAYS = 3;

    private final EventFormatter formatter;

    ContextSummarizer(EventFormatter formatter) {
        this.formatter = formatter;
    }

    String summarize(RecentLayer recent, ImportantLayer important, ArchiveLayer archive, int maxLines) {
        if (maxLines <= 0) return "";

        var lines = new ArrayList<String>();
        var recentEvents = recent.tail(RECENT_LINES);
        if (!recentEvents.isEmpty()) {
            section(lines, RECENT_HEADER);
            recentEvents.forEach(e -> lines.add(formatter.format(e)));
        }

        var top = important.top(IMPORTANT_LINES);
        if (!top.isEmpty()) {
            section(lines, IMPORTANT_HEADER);
            top.forEach(s -> lines.add(formatter.format(s.event())));
        }

        var days = archive.latest(ARCHIVE_DAYS);
        if (!days.isEmpty()) {
            section(lines, ARCHIVE_HEADER);
            days.forEach(d -> lines.add("[" + d.date() + "] " + d.eventCount() + " events"));
        }

        List<String> bounded = lines.size() > maxLines ? lines.subList(0, maxLines) : lines;
        return String.join("\n", bounded);
    }

    private static void section(List<String> lines, String header) {
        if (!lines.isEmpty()) lines.add("");
        lines.add(header);
    }
}
