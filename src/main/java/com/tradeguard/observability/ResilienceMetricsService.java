package com.tradeguard.observability;

import com.tradeguard.market.MarketDataManager;
import com.tradeguard.resilience.BackpressureManager;
import com.tradeguard.resilience.CircuitBreaker;
import com.tradeguard.resilience.CircuitBreakerRegistry;
import com.tradeguard.resilience.CircuitState;
import com.tradeguard.resilience.CircuitStateChangedEvent;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.stream.StreamPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the protection layer and the data pipeline.
 *
 * <ul>
 *   <li><b>tradeguard.circuit.state</b> (gauge per breaker): 0 closed, 1 half-open, 2 open</li>
 *   <li><b>tradeguard.circuit.transitions</b> (counter): state changes by breaker and target state</li>
 *   <li><b>tradeguard.backpressure.active</b> (gauge) and rejected/completed counters</li>
 *   <li><b>tradeguard.resource.*</b> (gauges): last CPU, memory and disk sample</li>
 *   <li><b>tradeguard.stream.published</b> (counter): events appended by this process</li>
 *   <li><b>tradeguard.market.updates</b> (counter): price points ingested</li>
 * </ul>
 *
 * <p>Gauges and function counters are read at scrape time; only transitions are
 * counted from events.
 */
@Service
public class ResilienceMetricsService {

    private static final Logger log = LoggerFactory.getLogger(ResilienceMetricsService.class);

    private final MeterRegistry meterRegistry;

    public ResilienceMetricsService(
            MeterRegistry meterRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry,
            BackpressureManager backpressureManager,
            ResourceMonitor resourceMonitor,
            StreamPublisher streamPublisher,
            MarketDataManager marketDataManager) {
        this.meterRegistry = meterRegistry;

        circuitBreakerRegistry.onBreakerCreated(this::registerBreakerGauge);

        Gauge.builder("tradeguard.backpressure.active", backpressureManager, BackpressureManager::getActiveRequests)
                .description("Requests currently admitted by backpressure")
                .register(meterRegistry);
        FunctionCounter.builder("tradeguard.backpressure.rejected", backpressureManager,
                        manager -> manager.getStats().getRejectedRequests())
                .description("Requests refused by backpressure")
                .register(meterRegistry);
        FunctionCounter.builder("tradeguard.backpressure.completed", backpressureManager,
                        manager -> manager.getStats().getCompletedRequests())
                .description("Requests that ran to completion under backpressure")
                .register(meterRegistry);

        meterRegistry.gauge("tradeguard.resource.cpu", resourceMonitor, monitor -> monitor.getSnapshot().cpuPercent());
        meterRegistry.gauge("tradeguard.resource.memory", resourceMonitor,
                monitor -> monitor.getSnapshot().memoryPercent());
        meterRegistry.gauge("tradeguard.resource.disk", resourceMonitor, monitor -> monitor.getSnapshot().diskPercent());

        FunctionCounter.builder("tradeguard.stream.published", streamPublisher, StreamPublisher::getPublishedCount)
                .description("Events appended to streams by this instance")
                .register(meterRegistry);
        FunctionCounter.builder("tradeguard.market.updates", marketDataManager,
                        manager -> manager.getStatus().getTotalUpdates())
                .description("Price points ingested from feeds and REST")
                .register(meterRegistry);
    }

    private void registerBreakerGauge(CircuitBreaker breaker) {
        Gauge.builder("tradeguard.circuit.state", breaker, ResilienceMetricsService::stateValue)
                .description("Circuit state: 0 closed, 1 half-open, 2 open")
                .tag("name", breaker.getName())
                .register(meterRegistry);
    }

    /** Runs after the breaker's own listeners so the count reflects completed transitions. */
    @EventListener
    @Order(20)
    public void onCircuitStateChanged(CircuitStateChangedEvent event) {
        Counter.builder("tradeguard.circuit.transitions")
                .description("Circuit breaker state transitions")
                .tag("name", event.getCircuitName())
                .tag("to", event.getNewState().name())
                .register(meterRegistry)
                .increment();
        if (event.getNewState() == CircuitState.OPEN) {
            log.warn("Circuit {} opened: {}", event.getCircuitName(), event.getReason());
        }
    }

    static double stateValue(CircuitBreaker breaker) {
        return switch (breaker.getState()) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
