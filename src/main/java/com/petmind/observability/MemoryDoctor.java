package com.petmind.observability;

import com.petmind.memory.EventMemory;
import com.petmind.shared.config.MemoryConfig;

import java.util.ArrayList;
import java.util.Locale;

public class MemoryDoctor {

    private static final double NEAR_CAPACITY = 0.9;

    private final EventMemory memory;
    private final MemoryConfig config;

    public MemoryDoctor(EventMemory memory, MemoryConfig config) {
        this.memory = memory;
        this.config = config;
    }

    public String run() {
        var stats = memory.getMemoryStats();
        var results = new ArrayList<String>();
        results.add(checkRecent(stats.recentItems()));
        results.add(checkImportant(stats.importantItems()));
        results.add("[OK] Archive holds " + stats.archiveDays() + " day(s), "
                + stats.totalEvents() + " events since last reset");
        results.add(String.format(Locale.ROOT, "[OK] Memory ratio %.2f", stats.memoryRatio()));
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkRecent(int recentItems) {
        return recentItems < config.recentCapacity()
                ? "[WARN] Recent layer warming up (" + recentItems + "/" + config.recentCapacity() + ")"
                : "[OK] Recent layer full (" + recentItems + "/" + config.recentCapacity() + ")";
    }

    private String checkImportant(int importantItems) {
        var capacity = config.importantCapacity();
        return importantItems >= capacity * NEAR_CAPACITY
                ? "[WARN] Important layer near capacity (" + importantItems + "/" + capacity + "), overflow is discarded"
                : "[OK] Important layer " + importantItems + "/" + capacity;
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
