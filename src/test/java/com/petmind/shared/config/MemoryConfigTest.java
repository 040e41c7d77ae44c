package com.petmind.shared.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MemoryConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        var cfg = MemoryConfig.defaults();
        assertEquals(20, cfg.recentCapacity());
        assertEquals(100, cfg.importantCapacity());
        assertEquals(0.4, cfg.promotionThreshold());
        assertEquals(0.1, cfg.residualFloor());
        assertEquals(Duration.ofHours(1), cfg.halfLife());
        assertEquals(Duration.ofDays(1), cfg.archiveAfter());
        assertEquals(100, cfg.sweepInterval());
    }

    @Test
    void floorMustStayBelowThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryConfig(
                20, 100, 0.4, 0.4, Duration.ofHours(1), Duration.ofDays(1), 100));
    }

    @Test
    void archiveAfterMayBeZero() {
        assertDoesNotThrow(() -> new MemoryConfig(
                20, 100, 0.4, 0.1, Duration.ofHours(1), Duration.ZERO, 100));
    }

    @Test
    void rejectsMissingDurations() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryConfig(
                20, 100, 0.4, 0.1, null, Duration.ofDays(1), 100));
        assertThrows(IllegalArgumentException.class, () -> new MemoryConfig(
                20, 100, 0.4, 0.1, Duration.ofHours(1), Duration.ofSeconds(-1), 100));
    }
}
