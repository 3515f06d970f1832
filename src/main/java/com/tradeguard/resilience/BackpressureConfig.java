package com.tradeguard.resilience;

import com.tradeguard.exception.ConfigurationException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Immutable admission-control limits, validated on construction. */
@Getter
@ToString
public final class BackpressureConfig {

    private final int maxConcurrentRequests;
    private final double cpuThresholdPercent;
    private final double memoryThresholdPercent;
    private final double diskThresholdPercent;
    private final Map<CallPriority, Integer> queueCapacities;

    /** Bound applied to an operation when the caller gives none. */
    private final Duration defaultTimeout;

    @Builder(toBuilder = true)
    private BackpressureConfig(
            int maxConcurrentRequests,
            double cpuThresholdPercent,
            double memoryThresholdPercent,
            double diskThresholdPercent,
            Map<CallPriority, Integer> queueCapacities,
            Duration defaultTimeout) {
        if (maxConcurrentRequests < 1) {
            throw new ConfigurationException("maxConcurrentRequests must be >= 1, was " + maxConcurrentRequests);
        }
        requirePercent("cpuThresholdPercent", cpuThresholdPercent);
        requirePercent("memoryThresholdPercent", memoryThresholdPercent);
        requirePercent("diskThresholdPercent", diskThresholdPercent);
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new ConfigurationException("defaultTimeout must be a positive duration, was " + defaultTimeout);
        }
        EnumMap<CallPriority, Integer> capacities = new EnumMap<>(CallPriority.class);
        for (CallPriority priority : CallPriority.values()) {
            Integer capacity = queueCapacities != null ? queueCapacities.get(priority) : null;
            if (capacity == null || capacity < 0) {
                throw new ConfigurationException("queue capacity for " + priority + " must be >= 0, was " + capacity);
            }
            capacities.put(priority, capacity);
        }
        this.maxConcurrentRequests = maxConcurrentRequests;
        this.cpuThresholdPercent = cpuThresholdPercent;
        this.memoryThresholdPercent = memoryThresholdPercent;
        this.diskThresholdPercent = diskThresholdPercent;
        this.queueCapacities = capacities;
        this.defaultTimeout = defaultTimeout;
    }

    public static BackpressureConfigBuilder defaults() {
        Map<CallPriority, Integer> capacities = new EnumMap<>(CallPriority.class);
        capacities.put(CallPriority.CRITICAL, 200);
        capacities.put(CallPriority.HIGH, 150);
        capacities.put(CallPriority.MEDIUM, 100);
        capacities.put(CallPriority.LOW, 50);
        return builder()
                .maxConcurrentRequests(50)
                .cpuThresholdPercent(85.0)
                .memoryThresholdPercent(80.0)
                .diskThresholdPercent(90.0)
                .queueCapacities(capacities)
                .defaultTimeout(Duration.ofSeconds(30));
    }

    public int queueCapacity(CallPriority priority) {
        return queueCapacities.get(priority);
    }

    private static void requirePercent(String field, double value) {
        if (value <= 0.0 || value > 100.0) {
            throw new ConfigurationException(field + " must be within (0, 100], was " + value);
        }
    }
}
