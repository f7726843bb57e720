package io.caretaker.core.monitor;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemResourceProbeTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportMemoryAndDiskPercentagesWithinRange() throws Exception {
        SystemResourceProbe probe = new SystemResourceProbe();

        assertThat(probe.memoryPercent()).isBetween(0.0, 100.0);
        assertThat(probe.diskPercent(tempDir)).isBetween(0.0, 100.0);
    }
}
