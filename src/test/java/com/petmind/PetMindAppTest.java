package com.petmind;

import com.petmind.bridge.MemoryBridge;
import com.petmind.memory.TieredMemory;
import com.petmind.observability.MemoryDoctor;
import com.petmind.shared.config.BridgeConfig;
import com.petmind.shared.config.MemoryConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PetMindAppTest {

    private final TieredMemory memory = new TieredMemory();
    private final MemoryBridge bridge = new MemoryBridge(memory, BridgeConfig.defaults());
    private final MemoryDoctor doctor = new MemoryDoctor(memory, MemoryConfig.defaults());

    @Test
    void contextCommandOnEmptyMemory() {
        assertEquals("(memory is empty)", PetMindApp.handleCommand("/context", bridge, memory, doctor));
    }

    @Test
    void contextCommandRendersSummary() {
        memory.addChat("I love fish", "user");
        assertThat(PetMindApp.handleCommand("/context", bridge, memory, doctor))
                .contains("=== RECENT (last events) ===")
                .contains("user: I love fish");
    }

    @Test
    void statsAndClearCommands() {
        memory.addChat("hi", "user");
        assertThat(PetMindApp.handleCommand("/stats", bridge, memory, doctor)).contains("Important layer 1/100");
        assertEquals("Memory cleared.", PetMindApp.handleCommand("/clear", bridge, memory, doctor));
        assertEquals(0, memory.getMemoryStats().totalEvents());
    }

    @Test
    void unknownCommand() {
        assertEquals("Unknown command: /dance", PetMindApp.handleCommand("/dance", bridge, memory, doctor));
    }
}
