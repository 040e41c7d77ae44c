package com.petmind.shared.config;

import java.time.Duration;

/**
 * Fixed tuning for one memory instance. Values are checked once here since they
 * cannot change for the lifetime of the store.
 */
public record MemoryConfig(
    int recentCapacity,
    int importantCapacity,
    double promotionThreshold,
    double residualFloor,
    Duration halfLife,
    Duration archiveAfter,
    int sweepInterval
) {
    public MemoryConfig {
        if (recentCapacity <= 0) {
            throw new IllegalArgumentException("recentCapacity must be positive: " + recentCapacity);
        }
        if (importantCapacity <= 0) {
            throw new IllegalArgumentException("importantCapacity must be positive: " + importantCapacity);
        }
        if (sweepInterval <= 0) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        if (promotionThreshold < 0 || promotionThreshold > 1) {
            throw new IllegalArgumentException("promotionThreshold must be within [0, 1]: " + promotionThreshold);
        }
        if (residualFloor < 0 || residualFloor >= promotionThreshold) {
            throw new IllegalArgumentException("residualFloor must be within [0, promotionThreshold): " + residualFloor);
        }
        if (halfLife == null || halfLife.isNegative() || halfLife.isZero()) {
            throw new IllegalArgumentException("halfLife must be positive: " + halfLife);
        }
        if (archiveAfter == null || archiveAfter.isNegative()) {
            throw new IllegalArgumentException("archiveAfter must not be negative: " + archiveAfter);
        }
    }

    public static MemoryConfig defaults() {
        return new MemoryConfig(20, 100, 0.4, 0.1,
                Duration.ofHours(1), Duration.ofDays(1), 100);
    }
}
