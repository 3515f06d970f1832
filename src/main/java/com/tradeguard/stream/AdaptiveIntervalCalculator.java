package com.tradeguard.stream;

import com.tradeguard.resource.ResourceSnapshot;
import java.time.Duration;

/**
 * Scales a service's base fallback interval by host load and priority.
 *
 * <p>{@code interval = base * memoryFactor * cpuFactor * priorityFactor}, then
 * floored at the priority's minimum interval and capped at {@code maxInterval}.
 */
public class AdaptiveIntervalCalculator {

    private final Duration maxInterval;

    public AdaptiveIntervalCalculator(Duration maxInterval) {
        this.maxInterval = maxInterval;
    }

    public Duration calculate(Duration baseInterval, StreamPriority priority, ResourceSnapshot resources) {
        double factor = memoryFactor(resources.memoryPercent())
                * cpuFactor(resources.cpuPercent())
                * priority.getIntervalFactor();
        long millis = Math.round(baseInterval.toMillis() * factor);
        Duration interval = Duration.ofMillis(millis);
        if (interval.compareTo(priority.getMinimumFallbackInterval()) < 0) {
            interval = priority.getMinimumFallbackInterval();
        }
        return interval.compareTo(maxInterval) > 0 ? maxInterval : interval;
    }

    static double memoryFactor(double memoryPercent) {
        if (memoryPercent > 85) return 2.0;
        if (memoryPercent > 70) return 1.5;
        if (memoryPercent < 50) return 0.75;
        return 1.0;
    }

    static double cpuFactor(double cpuPercent) {
        if (cpuPercent > 90) return 3.0;
        if (cpuPercent > 75) return 2.0;
        if (cpuPercent < 40) return 0.8;
        return 1.0;
    }
}
