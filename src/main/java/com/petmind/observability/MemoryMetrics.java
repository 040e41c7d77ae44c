package com.petmind.observability;

import com.petmind.memory.EventMemory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MemoryMetrics {

    private final MeterRegistry registry;
    private final Counter ingested;
    private final Counter promoted;
    private final Counter archived;
    private final Counter dropped;
    private final Counter trimmed;
    private final Timer sweep;

    public MemoryMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MemoryMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.ingested = Counter.builder("petmind.memory.events").register(registry);
        this.promoted = Counter.builder("petmind.memory.promoted").register(registry);
        this.archived = Counter.builder("petmind.memory.archived").register(registry);
        this.dropped = Counter.builder("petmind.memory.dropped").register(registry);
        this.trimmed = Counter.builder("petmind.memory.trimmed").register(registry);
        this.sweep = Timer.builder("petmind.memory.sweep").register(registry);
    }

    public MeterRegistry registry() { return registry; }

    public Counter ingested() { return ingested; }

    public Counter promoted() { return promoted; }

    public Counter archived() { return archived; }

    public Counter dropped() { return dropped; }

    public Counter trimmed() { return trimmed; }

    public Timer sweep() { return sweep; }

    public Timer.Sample startSweep() {
        return Timer.start(registry);
    }

    public void stopSweep(Timer.Sample sample) {
        sample.stop(sweep);
    }

    /** Layer-size gauges read through {@link EventMemory#getMemoryStats()}. */
    public void bindLayerGauges(EventMemory memory) {
        Gauge.builder("petmind.memory.layer.size", memory, m -> m.getMemoryStats().recentItems())
                .tag("layer", "recent").register(registry);
        Gauge.builder("petmind.memory.layer.size", memory, m -> m.getMemoryStats().importantItems())
                .tag("layer", "important").register(registry);
        Gauge.builder("petmind.memory.layer.size", memory, m -> m.getMemoryStats().archiveDays())
                .tag("layer", "archive").register(registry);
    }
}
