package com.tradeguard.resource;

import java.time.Instant;

/**
 * Point-in-time host utilization, all values in percent (0-100).
 *
 * <p>Replaced wholesale by the monitor on every sample; readers never see a
 * partially updated snapshot.
 */
public record ResourceSnapshot(double cpuPercent, double memoryPercent, double diskPercent, Instant sampledAt) {

    /** Snapshot used before the first real sample lands. Reports an idle host. */
    public static ResourceSnapshot idle(Instant at) {
        return new ResourceSnapshot(0.0, 0.0, 0.0, at);
    }

    public boolean exceedsAny(double cpuThreshold, double memoryThreshold, double diskThreshold) {
        return cpuPercent > cpuThreshold || memoryPercent > memoryThreshold || diskPercent > diskThreshold;
    }

    public boolean cpuAndMemoryBelow(double threshold) {
        return cpuPercent < threshold && memoryPercent < threshold;
    }
}
