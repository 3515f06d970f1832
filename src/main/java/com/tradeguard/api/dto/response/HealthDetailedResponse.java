package com.tradeguard.api.dto.response;

import com.tradeguard.market.MarketDataManager;
import com.tradeguard.resilience.BackpressureStats;
import com.tradeguard.resilience.CircuitBreakerStats;
import com.tradeguard.resource.ResourceSnapshot;
import com.tradeguard.stream.EventStreamManager;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Returned by GET /api/health/detailed: one status line per subsystem plus the
 * full statistics each component reports about itself.
 */
@Getter
@Builder
public class HealthDetailedResponse {

    /** "UP" or "DEGRADED". */
    private final String status;

    private final Map<String, SubsystemHealth> subsystems;

    private final ResourceSnapshot resources;
    private final List<CircuitBreakerStats> circuitBreakers;
    private final BackpressureStats backpressure;
    private final EventStreamManager.EventStreamStatus eventStreams;
    private final MarketDataManager.MarketDataStatus marketData;

    @Getter
    @Builder
    public static class SubsystemHealth {
        private final String status;
        private final String message;
    }
}
