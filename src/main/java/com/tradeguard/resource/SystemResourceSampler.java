package com.tradeguard.resource;

import com.sun.management.OperatingSystemMXBean;
import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples the host through the platform {@link OperatingSystemMXBean}, with memory
 * taken from {@code /proc/meminfo} where Linux provides it.
 *
 * <p>{@code getCpuLoad()} reports usage since the previous call, so it returns
 * immediately but the very first reading after JVM start is not meaningful.
 * {@link ResourceMonitor} throws that one away.
 *
 * <p>Memory usage is {@code MemTotal - MemAvailable}. The MXBean's free memory
 * leaves out reclaimable page cache, so on a long-running host it reads close to
 * full. Under a cgroup memory limit the MXBean total is the limit and smaller than
 * the host's {@code MemTotal}; {@code /proc/meminfo} then describes the host, not
 * this process, and the MXBean figures are used instead.
 */
public class SystemResourceSampler implements ResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(SystemResourceSampler.class);

    private static final Path PROC_MEMINFO = Path.of("/proc/meminfo");

    private final OperatingSystemMXBean osBean;
    private final File diskRoot;
    private final Path meminfo;
    private final Clock clock;

    private volatile boolean meminfoWarned;

    public SystemResourceSampler(Clock clock) {
        this(ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class), new File("/"), PROC_MEMINFO, clock);
    }

    public SystemResourceSampler(OperatingSystemMXBean osBean, File diskRoot, Path meminfo, Clock clock) {
        this.osBean = osBean;
        this.diskRoot = diskRoot;
        this.meminfo = meminfo;
        this.clock = clock;
    }

    @Override
    public ResourceSnapshot sample() {
        double cpuLoad = osBean.getCpuLoad();
        double cpuPercent = cpuLoad < 0 ? 0.0 : cpuLoad * 100.0;

        long totalDisk = diskRoot.getTotalSpace();
        long usableDisk = diskRoot.getUsableSpace();
        double diskPercent = totalDisk > 0 ? (totalDisk - usableDisk) * 100.0 / totalDisk : 0.0;

        return new ResourceSnapshot(cpuPercent, memoryPercent(), diskPercent, clock.instant());
    }

    private double memoryPercent() {
        long beanTotal = osBean.getTotalMemorySize();
        MemInfo info = readMeminfo();
        if (info != null && info.total() > 0 && beanTotal >= info.total() * 99 / 100) {
            long available = Math.min(info.available(), info.total());
            return (info.total() - available) * 100.0 / info.total();
        }
        long free = osBean.getFreeMemorySize();
        return beanTotal > 0 ? (beanTotal - free) * 100.0 / beanTotal : 0.0;
    }

    /** Returns null when the file is missing or lacks MemTotal/MemAvailable. */
    private MemInfo readMeminfo() {
        if (meminfo == null || !Files.isReadable(meminfo)) {
            return null;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(meminfo);
        } catch (IOException e) {
            if (!meminfoWarned) {
                meminfoWarned = true;
                log.warn("Cannot read {}, memory usage falls back to the MXBean: {}", meminfo, e.getMessage());
            }
            return null;
        }
        OptionalLong total = field(lines, "MemTotal:");
        OptionalLong available = field(lines, "MemAvailable:");
        if (total.isEmpty() || available.isEmpty()) {
            return null;
        }
        return new MemInfo(total.getAsLong(), available.getAsLong());
    }

    /** Value of a {@code Name:   12345 kB} line, in bytes. */
    private static OptionalLong field(List<String> lines, String name) {
        for (String line : lines) {
            if (!line.startsWith(name)) {
                continue;
            }
            String[] parts = line.substring(name.length()).trim().split("\\s+");
            try {
                long value = Long.parseLong(parts[0]);
                return OptionalLong.of(parts.length > 1 && "kB".equals(parts[1]) ? value * 1024 : value);
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private record MemInfo(long total, long available) {}
}
