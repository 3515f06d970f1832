package com.tradeguard.api.controller;

import com.tradeguard.api.dto.response.HealthDetailedResponse;
import com.tradeguard.api.dto.response.HealthDetailedResponse.SubsystemHealth;
import com.tradeguard.market.MarketDataManager;
import com.tradeguard.market.feed.ExchangeConnectionState;
import com.tradeguard.market.feed.ExchangeConnectionSupervisor;
import com.tradeguard.resilience.BackpressureManager;
import com.tradeguard.resilience.BackpressureStats;
import com.tradeguard.resilience.CircuitBreakerRegistry;
import com.tradeguard.resilience.CircuitBreakerStats;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.resource.ResourceSnapshot;
import com.tradeguard.stream.EventStreamManager;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints.
 *
 * <ul>
 *   <li>GET /api/health -- shallow liveness probe, never touches subsystems</li>
 *   <li>GET /api/health/detailed -- per-subsystem status and statistics</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final String UP = "UP";
    private static final String DEGRADED = "DEGRADED";
    private static final String DOWN = "DOWN";

    private final ResourceMonitor resourceMonitor;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final BackpressureManager backpressureManager;
    private final EventStreamManager eventStreamManager;
    private final MarketDataManager marketDataManager;

    public HealthController(
            ResourceMonitor resourceMonitor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            BackpressureManager backpressureManager,
            EventStreamManager eventStreamManager,
            MarketDataManager marketDataManager) {
        this.resourceMonitor = resourceMonitor;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.backpressureManager = backpressureManager;
        this.eventStreamManager = eventStreamManager;
        this.marketDataManager = marketDataManager;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", UP));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthDetailedResponse> detailedHealth() {
        Map<String, SubsystemHealth> subsystems = new LinkedHashMap<>();

        ResourceSnapshot resources = resourceMonitor.getSnapshot();
        subsystems.put("resources", SubsystemHealth.builder()
                .status(resourceMonitor.isStale() ? DEGRADED : UP)
                .message(String.format("cpu=%.0f%% memory=%.0f%% disk=%.0f%%",
                        resources.cpuPercent(), resources.memoryPercent(), resources.diskPercent()))
                .build());

        CircuitBreakerRegistry.RegistryStatus breakerStatus = circuitBreakerRegistry.getStatus();
        subsystems.put("circuitBreakers", SubsystemHealth.builder()
                .status(breakerStatus.isHealthy() ? UP : DEGRADED)
                .message(breakerStatus.openCircuits().isEmpty()
                        ? breakerStatus.breakers().size() + " breakers, all closed"
                        : "open: " + String.join(", ", breakerStatus.openCircuits()))
                .build());

        BackpressureStats backpressure = backpressureManager.getStats();
        subsystems.put("backpressure", SubsystemHealth.builder()
                .status(backpressure.isUnderPressure() ? DEGRADED : UP)
                .message(backpressure.getActiveRequests() + "/" + backpressure.getMaxConcurrentRequests() + " active")
                .build());

        EventStreamManager.EventStreamStatus streams = eventStreamManager.getStatus();
        subsystems.put("eventStreams", SubsystemHealth.builder()
                .status(streams.getLifecycle() == EventStreamManager.Lifecycle.RUNNING ? UP : DOWN)
                .message(streams.getFailureReason() != null
                        ? streams.getFailureReason()
                        : streams.getLifecycle() + ", " + streams.getServices().size() + " services")
                .build());

        MarketDataManager.MarketDataStatus marketData = marketDataManager.getStatus();
        long streaming = marketData.getExchanges().stream()
                .filter(exchange -> exchange.getState() == ExchangeConnectionState.STREAMING)
                .count();
        subsystems.put("marketData", SubsystemHealth.builder()
                .status(marketDataStatus(marketData, streaming))
                .message(streaming + "/" + marketData.getExchanges().size() + " exchanges streaming")
                .build());

        List<CircuitBreakerStats> breakers = List.copyOf(breakerStatus.breakers().values());

        HealthDetailedResponse response = HealthDetailedResponse.builder()
                .status(deriveOverallStatus(subsystems))
                .subsystems(subsystems)
                .resources(resources)
                .circuitBreakers(breakers)
                .backpressure(backpressure)
                .eventStreams(streams)
                .marketData(marketData)
                .build();
        return ResponseEntity.ok(response);
    }

    private static String marketDataStatus(MarketDataManager.MarketDataStatus marketData, long streaming) {
        List<ExchangeConnectionSupervisor.ExchangeStatus> exchanges = marketData.getExchanges();
        if (exchanges.isEmpty() || streaming == exchanges.size()) {
            return UP;
        }
        return DEGRADED;
    }

    private static String deriveOverallStatus(Map<String, SubsystemHealth> subsystems) {
        boolean allUp = subsystems.values().stream().allMatch(s -> UP.equals(s.getStatus()));
        return allUp ? UP : DEGRADED;
    }
}
