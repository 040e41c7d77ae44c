package com.petmind.bridge;

import com.petmind.memory.EventMemory;
import com.petmind.shared.config.BridgeConfig;
import com.petmind.shared.model.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-writer front of the memory. Sources hand events over through
 * {@link #accept}, which never blocks and evicts the oldest pending event when
 * the queue is full; one worker thread drains the queue and
 * writes to the memory in arrival order.
 */
public class MemoryBridge implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(MemoryBridge.class);
    private static final long POLL_MILLIS = 250;

    public static final String STT_COMMAND = "STT_COMMAND";
    public static final String CHAT = "CHAT";
    public static final String VISION_SNAPSHOT = "VISION_SNAPSHOT";
    public static final String APP_SWITCH = "APP_SWITCH";
    public static final String MEMORY_EVENT = "MEMORY_EVENT";

    private final EventMemory memory;
    private final BridgeConfig config;
    private final BlockingQueue<InboundEvent> queue;
    private volatile boolean running;
    private Thread worker;

    public MemoryBridge(EventMemory memory, BridgeConfig config) {
        this.memory = memory;
        this.config = config;
        this.queue = new ArrayBlockingQueue<>(config.queueCapacity());
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        worker = new Thread(this::runLoop, "memory-bridge");
        worker.setDaemon(true);
        worker.start();
        log.info("Memory bridge started (queue capacity {})", config.queueCapacity());
    }

    @Override
    public void accept(InboundEvent event) {
        if (event == null) return;
        while (!queue.offer(event)) {
            var evicted = queue.poll();
            if (evicted != null) {
                log.warn("Memory bridge queue full, evicting oldest {} event", evicted.type());
            }
        }
    }

    public String contextSummary() {
        return memory.getContextSummary(config.summaryMaxLines());
    }

    public int pending() {
        return queue.size();
    }

    public void stop(Duration wait) {
        Thread t;
        synchronized (this) {
            running = false;
            t = worker;
            worker = null;
        }
        if (t == null) return;
        try {
            t.join(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("Memory bridge worker did not stop within {}", wait);
            t.interrupt();
        }
        log.info("Memory bridge stopped");
    }

    private void runLoop() {
        while (running || !queue.isEmpty()) {
            InboundEvent event;
            try {
                event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event == null) continue;
            try {
                dispatch(event);
            } catch (RuntimeException e) {
                log.error("Memory write failed for {} event", event.type(), e);
            }
        }
    }

    void dispatch(InboundEvent event) {
        if (event.type() == null) {
            log.debug("Ignoring inbound event without type");
            return;
        }
        switch (event.type()) {
            case STT_COMMAND -> memory.addChat(event.text("text", ""), "user");
            case CHAT -> memory.addChat(event.text("text", ""), event.text("who", "user"));
            case VISION_SNAPSHOT -> memory.addVision(event.text("summary", ""), event.text("path", null));
            case APP_SWITCH -> memory.addAppActivity(event.text("app", "Unknown"),
                    event.text("category", "unknown"), event.flag("surprised"), event.flag("curious"));
            case MEMORY_EVENT -> memory.add(event.text("kind", null), payloadOf(event));
            default -> log.debug("Ignoring inbound event type {}", event.type());
        }
    }

    private static Map<String, Object> payloadOf(InboundEvent event) {
        if (event.fields().get("payload") instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return Map.of();
    }
}
