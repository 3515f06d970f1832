package com.tradeguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.concurrent.TimeBoundedCalls;
import com.tradeguard.resilience.BackpressureManager;
import com.tradeguard.resilience.BackpressureProperties;
import com.tradeguard.resilience.CircuitBreakerConfig;
import com.tradeguard.resilience.CircuitBreakerProperties;
import com.tradeguard.resilience.CircuitBreakerRegistry;
import com.tradeguard.resilience.DefaultCircuitBreakers;
import com.tradeguard.resilience.GuardedCallService;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.resource.ResourceMonitorProperties;
import com.tradeguard.resource.SystemResourceSampler;
import com.tradeguard.store.KeyValueStore;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the protection layer: resource monitor, breaker registry, backpressure
 * and the guarded call entry point. Property classes are converted into the
 * immutable configs here, so invalid settings fail startup.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public ResourceMonitor resourceMonitor(ResourceMonitorProperties properties, Clock clock) {
        return new ResourceMonitor(new SystemResourceSampler(clock), properties.getSampleInterval(), clock);
    }

    @Bean
    public TimeBoundedCalls timeBoundedCalls(@Qualifier("guardedCallExecutor") ExecutorService guardedCallExecutor) {
        return new TimeBoundedCalls(guardedCallExecutor);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            CircuitBreakerProperties properties,
            KeyValueStore keyValueStore,
            ObjectMapper objectMapper,
            Clock clock,
            TimeBoundedCalls timeBoundedCalls,
            ApplicationEventPublisher eventPublisher) {
        CircuitBreakerConfig defaultConfig = properties.getDefaults().applyTo(CircuitBreakerConfig.defaults().build());

        Map<String, CircuitBreakerConfig> catalog = new LinkedHashMap<>(DefaultCircuitBreakers.catalog());
        properties.getBreakers().forEach((name, settings) ->
                catalog.put(name, settings.applyTo(catalog.getOrDefault(name, defaultConfig))));

        return new CircuitBreakerRegistry(
                catalog,
                defaultConfig,
                keyValueStore,
                objectMapper,
                clock,
                timeBoundedCalls,
                eventPublisher,
                properties.getSyncInterval(),
                properties.getStateTtl());
    }

    @Bean
    public BackpressureManager backpressureManager(
            BackpressureProperties properties, ResourceMonitor resourceMonitor, TimeBoundedCalls timeBoundedCalls) {
        return new BackpressureManager(properties.toConfig(), resourceMonitor, timeBoundedCalls);
    }

    @Bean
    public GuardedCallService guardedCallService(
            CircuitBreakerRegistry circuitBreakerRegistry, BackpressureManager backpressureManager) {
        return new GuardedCallService(circuitBreakerRegistry, backpressureManager);
    }
}
