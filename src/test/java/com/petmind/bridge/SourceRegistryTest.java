package com.petmind.bridge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest {

    private static EventSource source(String id, List<String> log) {
        return new EventSource() {
            @Override public String id() { return id; }
            @Override public void start(EventSink sink) { log.add("start:" + id); }
            @Override public void stop() { log.add("stop:" + id); }
        };
    }

    @Test
    void rejectsDuplicateIds() {
        var registry = new SourceRegistry();
        registry.register(source("stt", new ArrayList<>()));
        assertThrows(IllegalArgumentException.class, () -> registry.register(source("stt", new ArrayList<>())));
    }

    @Test
    void startsInOrderAndStopsInReverse() {
        var log = new ArrayList<String>();
        var registry = new SourceRegistry();
        registry.register(source("stt", log));
        registry.register(source("vision", log));
        registry.startAll(e -> {});
        registry.stopAll();
        assertEquals(List.of("start:stt", "start:vision", "stop:vision", "stop:stt"), log);
    }

    @Test
    void allStoppedOnceEverySourceUnregisters() {
        var registry = new SourceRegistry();
        registry.register(source("stt", new ArrayList<>()));
        assertFalse(registry.allStopped());
        registry.unregister("stt");
        assertTrue(registry.allStopped());
    }
}
