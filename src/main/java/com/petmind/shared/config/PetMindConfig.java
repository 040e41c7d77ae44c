package com.petmind.shared.config;

public record PetMindConfig(
    MemoryConfig memory,
    BridgeConfig bridge
) {
    public static PetMindConfig defaults() {
        return new PetMindConfig(MemoryConfig.defaults(), BridgeConfig.defaults());
    }
}
