package com.petmind.memory;

import com.petmind.shared.model.Event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** Read-only view of one archive bucket. */
public record ArchiveDay(
    LocalDate date,
    int eventCount,
    Instant firstTimestamp,
    List<Event> events,
    String rollingSummary
) {}
