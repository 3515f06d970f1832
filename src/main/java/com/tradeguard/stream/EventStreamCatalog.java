package com.tradeguard.stream;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The fixed set of streams and consuming services. Not mutated at runtime. */
public final class EventStreamCatalog {

    public static final String TRADE_SIGNALS = "trade_signals";
    public static final String RISK_ALERTS = "risk_alerts";
    public static final String MARKET_UPDATES = "market_updates";
    public static final String PORTFOLIO_CHANGES = "portfolio_changes";
    public static final String BALANCE_UPDATES = "balance_updates";
    public static final String SYSTEM_EVENTS = "system_events";
    public static final String CLEANUP_EVENTS = "cleanup_events";

    public static final String TRADE_EXECUTION = "trade_execution";
    public static final String RISK_MONITOR = "risk_monitor";
    public static final String PORTFOLIO_SYNC = "portfolio_sync";
    public static final String BALANCE_SYNC = "balance_sync";
    public static final String MARKET_DATA_PROCESSOR = "market_data_processor";
    public static final String HEALTH_MONITOR = "health_monitor";
    public static final String CLEANUP_SERVICE = "cleanup_service";
    public static final String METRICS_COLLECTOR = "metrics_collector";

    private static final Map<String, EventStreamConfig> STREAMS = new LinkedHashMap<>();
    private static final Map<String, ServiceConsumerConfig> SERVICES = new LinkedHashMap<>();

    static {
        stream(TRADE_SIGNALS, 50_000, Duration.ofMinutes(30), "trading_services", StreamPriority.CRITICAL);
        stream(RISK_ALERTS, 10_000, Duration.ofMinutes(15), "risk_services", StreamPriority.CRITICAL);
        stream(MARKET_UPDATES, 100_000, Duration.ofHours(1), "market_services", StreamPriority.IMPORTANT);
        stream(PORTFOLIO_CHANGES, 25_000, Duration.ofMinutes(30), "portfolio_services", StreamPriority.IMPORTANT);
        stream(BALANCE_UPDATES, 20_000, Duration.ofMinutes(30), "balance_services", StreamPriority.IMPORTANT);
        stream(SYSTEM_EVENTS, 15_000, Duration.ofHours(2), "system_services", StreamPriority.BACKGROUND);
        stream(CLEANUP_EVENTS, 5_000, Duration.ofHours(4), "cleanup_services", StreamPriority.BACKGROUND);

        service(TRADE_EXECUTION, TRADE_SIGNALS, StreamPriority.CRITICAL, Duration.ofSeconds(1), 1, Duration.ofMillis(100));
        service(RISK_MONITOR, PORTFOLIO_CHANGES, StreamPriority.CRITICAL, Duration.ofSeconds(5), 5, Duration.ofMillis(500));
        service(PORTFOLIO_SYNC, MARKET_UPDATES, StreamPriority.IMPORTANT, Duration.ofSeconds(120), 10, Duration.ofSeconds(2));
        service(BALANCE_SYNC, BALANCE_UPDATES, StreamPriority.IMPORTANT, Duration.ofSeconds(300), 15, Duration.ofSeconds(3));
        service(MARKET_DATA_PROCESSOR, MARKET_UPDATES, StreamPriority.IMPORTANT, Duration.ofSeconds(60), 25,
                Duration.ofMillis(1500));
        service(HEALTH_MONITOR, SYSTEM_EVENTS, StreamPriority.BACKGROUND, Duration.ofSeconds(300), 20, Duration.ofSeconds(5));
        service(CLEANUP_SERVICE, CLEANUP_EVENTS, StreamPriority.BACKGROUND, Duration.ofSeconds(3600), 50,
                Duration.ofSeconds(10));
        service(METRICS_COLLECTOR, SYSTEM_EVENTS, StreamPriority.BACKGROUND, Duration.ofSeconds(600), 30,
                Duration.ofSeconds(8));
    }

    private EventStreamCatalog() {}

    private static void stream(
            String name, long maxLength, Duration retention, String group, StreamPriority priority) {
        STREAMS.put(name, new EventStreamConfig(name, maxLength, retention, group, priority));
    }

    private static void service(
            String name, String stream, StreamPriority priority, Duration fallback, int batchSize, Duration timeout) {
        SERVICES.put(name, new ServiceConsumerConfig(name, stream, priority, fallback, batchSize, timeout));
    }

    public static List<EventStreamConfig> streams() {
        return List.copyOf(STREAMS.values());
    }

    public static Optional<EventStreamConfig> stream(String name) {
        return Optional.ofNullable(STREAMS.get(name));
    }

    /** Services ordered by priority, catalog order within a tier. */
    public static List<ServiceConsumerConfig> servicesInStartOrder() {
        return SERVICES.values().stream()
                .sorted(Comparator.comparing(ServiceConsumerConfig::priority))
                .toList();
    }

    public static Optional<ServiceConsumerConfig> service(String name) {
        return Optional.ofNullable(SERVICES.get(name));
    }
}
