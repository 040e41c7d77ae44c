package com.petmind.observability;

import com.petmind.memory.EventMemory;
import com.petmind.memory.MemoryStats;
import com.petmind.shared.config.MemoryConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class MemoryDoctorTest {

    @Test
    void reportsWarmingUpAndHealthyImportantLayer() {
        var memory = mock(EventMemory.class);
        when(memory.getMemoryStats()).thenReturn(new MemoryStats(4, 2, 0, 4, 0.4));

        var report = new MemoryDoctor(memory, MemoryConfig.defaults()).run();

        assertThat(report).contains("[WARN] Recent layer warming up (4/20)");
        assertThat(report).contains("[OK] Important layer 2/100");
        assertThat(report).contains("[OK] Memory ratio 0.40");
        assertThat(report).contains("[OK] Java");
        verify(memory, times(1)).getMemoryStats();
    }

    @Test
    void warnsWhenImportantLayerNearCapacity() {
        var memory = mock(EventMemory.class);
        when(memory.getMemoryStats()).thenReturn(new MemoryStats(20, 95, 3, 900, 95 / 21.0));

        var report = new MemoryDoctor(memory, MemoryConfig.defaults()).run();

        assertThat(report).contains("[OK] Recent layer full (20/20)");
        assertThat(report).contains("[WARN] Important layer near capacity (95/100)");
        assertThat(report).contains("Archive holds 3 day(s), 900 events");
    }
}
