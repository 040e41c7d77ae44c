package com.petmind.shared.config;

public record BridgeConfig(int queueCapacity, int summaryMaxLines) {

    public BridgeConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
    }

    public static BridgeConfig defaults() {
        return new BridgeConfig(256, 15);
    }
}
