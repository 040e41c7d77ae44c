package com.petmind.memory;

/**
 * Layer sizes at one instant. {@code memoryRatio} is important / (recent + 1),
 * a rough measure of how much of the stream was judged worth keeping.
 */
public record MemoryStats(
    int recentItems,
    int importantItems,
    int archiveDays,
    long totalEvents,
    double memoryRatio
) {}
