package com.petmind;

import com.petmind.bridge.InboundEventParser;
import com.petmind.bridge.MemoryBridge;
import com.petmind.bridge.SourceRegistry;
import com.petmind.bridge.StdinEventSource;
import com.petmind.memory.EventMemory;
import com.petmind.memory.TieredMemory;
import com.petmind.observability.MemoryDoctor;
import com.petmind.observability.MemoryMetrics;
import com.petmind.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

public class PetMindApp {

    private static final Logger log = LoggerFactory.getLogger(PetMindApp.class);

    public static void main(String[] args) throws InterruptedException {
        var config = ConfigLoader.load();

        // Memory
        var metrics = new MemoryMetrics();
        var memory = new TieredMemory(config.memory(), Clock.systemDefaultZone(), metrics);
        metrics.bindLayerGauges(memory);
        var doctor = new MemoryDoctor(memory, config.memory());
        log.info("Tiered memory ready: recent={}, important={}, sweep every {} events",
                config.memory().recentCapacity(), config.memory().importantCapacity(),
                config.memory().sweepInterval());

        // Bridge
        var bridge = new MemoryBridge(memory, config.bridge());
        bridge.start();

        // Sources
        var done = new CountDownLatch(1);
        var registry = new SourceRegistry();
        var stdin = new StdinEventSource(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, new InboundEventParser(), cmd -> handleCommand(cmd, bridge, memory, doctor));
        stdin.onStop(() -> {
            registry.unregister(stdin.id());
            if (registry.allStopped()) done.countDown();
        });
        registry.register(stdin);
        registry.startAll(bridge);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            registry.stopAll();
            bridge.stop(Duration.ofSeconds(5));
        }, "petmind-shutdown"));

        done.await();
        bridge.stop(Duration.ofSeconds(5));
    }

    static String handleCommand(String command, MemoryBridge bridge, EventMemory memory, MemoryDoctor doctor) {
        switch (command) {
            case "/context":
                var summary = bridge.contextSummary();
                return summary.isEmpty() ? "(memory is empty)" : summary;
            case "/stats":
                return doctor.run();
            case "/clear":
                memory.clear();
                return "Memory cleared.";
            default:
                return "Unknown command: " + command;
        }
    }
}
