package com.tradeguard.stream;

import com.tradeguard.resource.ResourceSnapshot;
import java.time.Duration;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Processing tier of a stream or service. Controls the resource gate, the
 * fallback interval scaling and the minimum fallback interval.
 */
@Getter
@RequiredArgsConstructor
public enum StreamPriority {
    CRITICAL(95.0, 0.5, Duration.ofSeconds(1)),
    IMPORTANT(85.0, 1.0, Duration.ofSeconds(30)),
    BACKGROUND(70.0, 2.0, Duration.ofSeconds(300));

    /** CPU and memory must both be below this percentage for work to proceed. */
    private final double resourceGatePercent;

    private final double intervalFactor;
    private final Duration minimumFallbackInterval;

    public boolean canProcess(ResourceSnapshot snapshot) {
        return snapshot.cpuAndMemoryBelow(resourceGatePercent);
    }
}
