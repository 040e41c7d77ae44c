package com.petmind.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event sources keyed by id. Sources start in registration order and stop in
 * reverse order.
 */
public class SourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final Map<String, EventSource> sources = new LinkedHashMap<>();

    public synchronized void register(EventSource source) {
        if (sources.putIfAbsent(source.id(), source) != null) {
            throw new IllegalArgumentException("Duplicate event source: " + source.id());
        }
    }

    public void startAll(EventSink sink) {
        for (var source : snapshot()) {
            log.info("Starting event source {}", source.id());
            source.start(sink);
        }
    }

    public void stopAll() {
        var stopping = snapshot();
        Collections.reverse(stopping);
        for (var source : stopping) {
            source.stop();
        }
    }

    public synchronized void unregister(String id) {
        sources.remove(id);
    }

    public synchronized boolean allStopped() {
        return sources.isEmpty();
    }

    private synchronized List<EventSource> snapshot() {
        return new ArrayList<>(sources.values());
    }
}
