package com.petmind.memory;

import com.petmind.observability.MemoryMetrics;
import com.petmind.shared.config.MemoryConfig;
import com.petmind.shared.model.Event;
import com.petmind.shared.model.EventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-layer event memory: a recent tail, a scored important layer that decays
 * with age, and daily archive buckets for old entries that decayed away.
 *
 * <p>Every event lands in the recent layer. Events scoring above the promotion
 * threshold are also kept in the important layer. Every {@code sweepInterval}-th
 * event triggers a decay sweep inline, before {@link #add} returns.
 *
 * <p>All public methods take the same lock, so producers, the sweep and readers
 * building prompts can share one instance across threads.
 */
public class TieredMemory implements EventMemory {

    private static final Logger log = LoggerFactory.getLogger(TieredMemory.class);

    private final MemoryConfig config;
    private final Clock clock;
    private final MemoryMetrics metrics;
    private final ImportanceScorer scorer;
    private final DecaySweeper sweeper;
    private final ContextSummarizer summarizer;
    private final ReentrantLock lock = new ReentrantLock();

    private final RecentLayer recent;
    private final ImportantLayer important;
    private final ArchiveLayer archive = new ArchiveLayer();
    private long eventCounter;

    public TieredMemory() {
        this(MemoryConfig.defaults());
    }

    public TieredMemory(MemoryConfig config) {
        this(config, Clock.systemDefaultZone(), new MemoryMetrics());
    }

    public TieredMemory(MemoryConfig config, Clock clock, MemoryMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.scorer = new ImportanceScorer();
        this.sweeper = new DecaySweeper(config);
        this.summarizer = new ContextSummarizer(new EventFormatter());
        this.recent = new RecentLayer(config.recentCapacity());
        this.important = new ImportantLayer(config.importantCapacity());
    }

    public MemoryConfig config() {
        return config;
    }

    @Override
    public void add(String kind, Map<String, ?> payload) {
        add(EventPayload.of(kind, payload));
    }

    @Override
    public void add(EventPayload payload) {
        if (payload == null) {
            log.debug("Ignoring null payload");
            payload = EventPayload.of(null, Map.of());
        }
        lock.lock();
        try {
            var event = new Event(payload, clock.instant());
            recent.append(event);
            metrics.ingested().increment();

            double score = scorer.score(payload);
            if (score > config.promotionThreshold()) {
                important.add(new ScoredEvent(event, score));
                metrics.promoted().increment();
                log.debug("Promoted {} event with importance {}", event.kind(), score);
                trimLocked();
            }

            eventCounter++;
            if (eventCounter % config.sweepInterval() == 0) {
                sweepLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Runs a decay and archival pass now, independent of the event counter. */
    public SweepResult sweep() {
        lock.lock();
        try {
            return sweepLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enforces the important-layer capacity, discarding the lowest scores.
     *
     * @return number of entries discarded
     */
    public int trimImportant() {
        lock.lock();
        try {
            return trimLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getContextSummary(int maxLines) {
        lock.lock();
        try {
            return summarizer.summarize(recent, important, archive, maxLines);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> getRecent(int count) {
        lock.lock();
        try {
            return recent.tail(count);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ScoredEvent> getImportant(int count) {
        lock.lock();
        try {
            return important.top(count);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ArchiveDay> getArchiveForDate(String isoDate) {
        if (isoDate == null) return Optional.empty();
        LocalDate date;
        try {
            date = LocalDate.parse(isoDate.trim());
        } catch (DateTimeParseException e) {
            log.debug("Not an ISO date: {}", isoDate);
            return Optional.empty();
        }
        lock.lock();
        try {
            return archive.get(date);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MemoryStats getMemoryStats() {
        lock.lock();
        try {
            int recentItems = recent.size();
            int importantItems = important.size();
            return new MemoryStats(recentItems, importantItems, archive.days(), eventCounter,
                    (double) importantItems / (recentItems + 1));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            recent.clear();
            important.clear();
            archive.clear();
            eventCounter = 0;
            log.info("Memory cleared");
        } finally {
            lock.unlock();
        }
    }

    private SweepResult sweepLocked() {
        var sample = metrics.startSweep();
        var result = sweeper.sweep(important, archive, clock.instant(), clock.getZone());
        metrics.stopSweep(sample);
        metrics.archived().increment(result.archived());
        metrics.dropped().increment(result.dropped());
        if (result.archived() > 0 || result.dropped() > 0) {
            log.info("Memory sweep after {} events: kept={}, archived={}, dropped={}",
                    eventCounter, result.kept(), result.archived(), result.dropped());
        }
        return result;
    }

    private int trimLocked() {
        int discarded = important.trim();
        if (discarded > 0) {
            metrics.trimmed().increment(discarded);
            log.debug("Important layer over capacity, discarded {} lowest entries", discarded);
        }
        return discarded;
    }
}
