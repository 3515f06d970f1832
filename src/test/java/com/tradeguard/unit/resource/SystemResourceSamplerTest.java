package com.tradeguard.unit.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.sun.management.OperatingSystemMXBean;
import com.tradeguard.resource.ResourceSnapshot;
import com.tradeguard.resource.SystemResourceSampler;
import com.tradeguard.unit.support.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemResourceSamplerTest {

    private static final long GIB = 1024L * 1024 * 1024;
    private static final long GIB_IN_KB = 1024L * 1024;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private OperatingSystemMXBean osBean;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        osBean = mock(OperatingSystemMXBean.class);
        when(osBean.getCpuLoad()).thenReturn(0.25);
    }

    private Path meminfo(String... lines) throws IOException {
        return Files.write(tempDir.resolve("meminfo"), String.join("\n", lines).getBytes());
    }

    private ResourceSnapshot sample(Path meminfo) {
        return new SystemResourceSampler(osBean, tempDir.toFile(), meminfo, clock).sample();
    }

    @Test
    @DisplayName("Counts reclaimable page cache as available memory")
    void usesMemAvailable() throws IOException {
        when(osBean.getTotalMemorySize()).thenReturn(16 * GIB);
        when(osBean.getFreeMemorySize()).thenReturn(GIB);
        Path file = meminfo(
                "MemTotal:       " + 16 * GIB_IN_KB + " kB",
                "MemFree:        " + GIB_IN_KB + " kB",
                "MemAvailable:   " + 10 * GIB_IN_KB + " kB",
                "Buffers:          204800 kB",
                "Cached:         " + 8 * GIB_IN_KB + " kB");

        ResourceSnapshot snapshot = sample(file);

        assertThat(snapshot.memoryPercent()).isCloseTo(37.5, within(0.001));
        assertThat(snapshot.cpuPercent()).isCloseTo(25.0, within(0.001));
        assertThat(snapshot.sampledAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Uses the MXBean under a cgroup limit smaller than the host's memory")
    void cgroupLimitUsesMxBean() throws IOException {
        when(osBean.getTotalMemorySize()).thenReturn(4 * GIB);
        when(osBean.getFreeMemorySize()).thenReturn(GIB);
        Path file = meminfo(
                "MemTotal:       " + 16 * GIB_IN_KB + " kB",
                "MemAvailable:   " + 10 * GIB_IN_KB + " kB");

        assertThat(sample(file).memoryPercent()).isCloseTo(75.0, within(0.001));
    }

    @Test
    @DisplayName("Falls back to the MXBean when meminfo is missing or has no MemAvailable")
    void fallsBackWithoutMeminfo() throws IOException {
        when(osBean.getTotalMemorySize()).thenReturn(16 * GIB);
        when(osBean.getFreeMemorySize()).thenReturn(GIB);

        assertThat(sample(tempDir.resolve("absent")).memoryPercent()).isCloseTo(93.75, within(0.001));

        Path oldKernel = meminfo("MemTotal:       " + 16 * GIB_IN_KB + " kB", "MemFree:        " + GIB_IN_KB + " kB");
        assertThat(sample(oldKernel).memoryPercent()).isCloseTo(93.75, within(0.001));
    }
}
