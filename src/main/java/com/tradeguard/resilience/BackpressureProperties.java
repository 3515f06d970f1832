package com.tradeguard.resilience;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Binds to {@code tradeguard.backpressure.*}. */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "tradeguard.backpressure")
public class BackpressureProperties {

    @Min(1)
    private int maxConcurrentRequests = 50;

    @DecimalMax("100.0")
    private double cpuThresholdPercent = 85.0;

    @DecimalMax("100.0")
    private double memoryThresholdPercent = 80.0;

    @DecimalMax("100.0")
    private double diskThresholdPercent = 90.0;

    @NotNull
    private Duration defaultTimeout = Duration.ofSeconds(30);

    /** Waiting-room size per priority. Missing entries keep the built-in default. */
    private Map<CallPriority, Integer> queueCapacity = new EnumMap<>(CallPriority.class);

    public BackpressureConfig toConfig() {
        BackpressureConfig defaults = BackpressureConfig.defaults().build();
        Map<CallPriority, Integer> capacities = new EnumMap<>(defaults.getQueueCapacities());
        capacities.putAll(queueCapacity);
        return defaults.toBuilder()
                .maxConcurrentRequests(maxConcurrentRequests)
                .cpuThresholdPercent(cpuThresholdPercent)
                .memoryThresholdPercent(memoryThresholdPercent)
                .diskThresholdPercent(diskThresholdPercent)
                .defaultTimeout(defaultTimeout)
                .queueCapacities(capacities)
                .build();
    }
}
