package com.petmind.memory;

import com.petmind.shared.config.MemoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;

/**
 * Applies exponential age decay to the important layer. Entries that fall to the
 * residual floor leave the layer: old ones go to the archive, young ones are dropped.
 */
class DecaySweeper {

    private static final Logger log = LoggerFactory.getLogger(DecaySweeper.class);

    private final double halfLifeSeconds;
    private final double archiveAfterSeconds;
    private final double residualFloor;

    DecaySweeper(MemoryConfig config) {
        this.halfLifeSeconds = seconds(config.halfLife());
        this.archiveAfterSeconds = seconds(config.archiveAfter());
        this.residualFloor = config.residualFloor();
    }

    SweepResult sweep(ImportantLayer important, ArchiveLayer archive, Instant now, ZoneId zone) {
        if (important.size() == 0) return SweepResult.EMPTY;

        var kept = new ArrayList<ScoredEvent>(important.size());
        int archived = 0;
        int dropped = 0;
        for (var entry : important.entries()) {
            double age = ageSeconds(entry, now);
            double decayed = decay(entry.importance(), age);
            if (decayed > residualFloor) {
                entry.decayTo(decayed);
                kept.add(entry);
            } else if (age > archiveAfterSeconds) {
                archive.archive(entry.event(), zone);
                archived++;
            } else {
                dropped++;
            }
        }
        important.replaceWith(kept);
        return new SweepResult(kept.size(), archived, dropped);
    }

    double decay(double importance, double ageSeconds) {
        return importance * Math.pow(0.5, ageSeconds / halfLifeSeconds);
    }

    private static double ageSeconds(ScoredEvent entry, Instant now) {
        double age = Duration.between(entry.event().timestamp(), now).toMillis() / 1000.0;
        if (age < 0) {
            log.debug("Event timestamp {} is ahead of clock {}, treating age as zero",
                    entry.event().timestamp(), now);
            return 0;
        }
        return age;
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
