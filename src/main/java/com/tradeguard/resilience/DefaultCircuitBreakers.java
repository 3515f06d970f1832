package com.tradeguard.resilience;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Breakers every deployment starts with. Entries in application.properties override these. */
public final class DefaultCircuitBreakers {

    public static final String REDIS_OPERATIONS = "redis_operations";
    public static final String DATABASE_OPERATIONS = "database_operations";
    public static final String EXTERNAL_APIS = "external_apis";
    public static final String WEBSOCKET_CONNECTIONS = "websocket_connections";
    public static final String TRADING_EXECUTION = "trading_execution";

    private DefaultCircuitBreakers() {}

    public static Map<String, CircuitBreakerConfig> catalog() {
        Map<String, CircuitBreakerConfig> catalog = new LinkedHashMap<>();
        catalog.put(REDIS_OPERATIONS, CircuitBreakerConfig.defaults()
                .failureThreshold(10)
                .timeout(Duration.ofSeconds(30))
                .maxTimeout(Duration.ofSeconds(120))
                .failureWindow(Duration.ofSeconds(60))
                .callTimeout(Duration.ofSeconds(5))
                .build());
        catalog.put(DATABASE_OPERATIONS, CircuitBreakerConfig.defaults()
                .failureThreshold(5)
                .timeout(Duration.ofSeconds(60))
                .maxTimeout(Duration.ofSeconds(300))
                .failureWindow(Duration.ofSeconds(120))
                .build());
        catalog.put(EXTERNAL_APIS, CircuitBreakerConfig.defaults()
                .failureThreshold(3)
                .timeout(Duration.ofSeconds(120))
                .maxTimeout(Duration.ofSeconds(600))
                .failureWindow(Duration.ofSeconds(300))
                .slowCallThreshold(Duration.ofMillis(3000))
                .callTimeout(Duration.ofSeconds(10))
                .build());
        catalog.put(WEBSOCKET_CONNECTIONS, CircuitBreakerConfig.defaults()
                .failureThreshold(5)
                .timeout(Duration.ofSeconds(30))
                .maxTimeout(Duration.ofSeconds(180))
                .failureWindow(Duration.ofSeconds(60))
                .build());
        catalog.put(TRADING_EXECUTION, CircuitBreakerConfig.defaults()
                .failureThreshold(2)
                .timeout(Duration.ofSeconds(10))
                .maxTimeout(Duration.ofSeconds(60))
                .failureWindow(Duration.ofSeconds(30))
                .slowCallThreshold(Duration.ofMillis(1000))
                .callTimeout(Duration.ofSeconds(5))
                .build());
        return catalog;
    }
}
