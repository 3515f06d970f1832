package com.tradeguard.config;

import com.tradeguard.exception.ConfigurationException;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.store.KeyValueStore;
import com.tradeguard.stream.EventStreamCatalog;
import com.tradeguard.stream.EventStreamManager;
import com.tradeguard.stream.EventStreamProperties;
import com.tradeguard.stream.InMemoryStreamBroker;
import com.tradeguard.stream.RedisStreamBroker;
import com.tradeguard.stream.StreamBroker;
import com.tradeguard.stream.StreamEventHandler;
import com.tradeguard.stream.StreamHandlerRegistry;
import com.tradeguard.stream.StreamPublisher;
import com.tradeguard.stream.StreamTrimmer;
import com.tradeguard.stream.handler.HealthMonitorHandler;
import com.tradeguard.stream.handler.LoggingEventHandler;
import com.tradeguard.stream.handler.MetricsCollectorHandler;
import com.tradeguard.stream.handler.PriceChangeDetector;
import com.tradeguard.stream.handler.StreamCleanupHandler;
import io.lettuce.core.RedisClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Event pipeline wiring: broker, publisher, trimmer, the service handlers and the manager. */
@Configuration
public class StreamConfig {

    @Bean
    public StreamBroker streamBroker(
            EventStreamProperties properties, ObjectProvider<RedisClient> streamRedisClient, Clock clock) {
        if (properties.getBroker() == EventStreamProperties.BrokerType.MEMORY) {
            return new InMemoryStreamBroker(clock);
        }
        RedisClient client = streamRedisClient.getIfAvailable();
        if (client == null) {
            throw new ConfigurationException("Redis stream broker selected but no Redis client is configured");
        }
        return new RedisStreamBroker(client);
    }

    @Bean
    public StreamPublisher streamPublisher(StreamBroker streamBroker, Clock clock) {
        return new StreamPublisher(streamBroker, clock);
    }

    @Bean
    public StreamTrimmer streamTrimmer(StreamBroker streamBroker, Clock clock) {
        return new StreamTrimmer(streamBroker, clock);
    }

    @Bean
    public StreamHandlerRegistry streamHandlerRegistry(
            KeyValueStore keyValueStore,
            StreamPublisher streamPublisher,
            StreamTrimmer streamTrimmer,
            StreamBroker streamBroker,
            ResourceMonitor resourceMonitor,
            MeterRegistry meterRegistry) {
        List<StreamEventHandler> handlers = List.of(
                new LoggingEventHandler(EventStreamCatalog.TRADE_EXECUTION, true),
                new LoggingEventHandler(EventStreamCatalog.RISK_MONITOR, true),
                new LoggingEventHandler(EventStreamCatalog.PORTFOLIO_SYNC, false),
                new LoggingEventHandler(EventStreamCatalog.BALANCE_SYNC, false),
                new PriceChangeDetector(keyValueStore, streamPublisher),
                new HealthMonitorHandler(resourceMonitor, streamPublisher),
                new StreamCleanupHandler(streamTrimmer),
                new MetricsCollectorHandler(meterRegistry, streamBroker, resourceMonitor));
        return new StreamHandlerRegistry(handlers);
    }

    @Bean
    public EventStreamManager eventStreamManager(
            StreamBroker streamBroker,
            StreamHandlerRegistry streamHandlerRegistry,
            StreamPublisher streamPublisher,
            StreamTrimmer streamTrimmer,
            ResourceMonitor resourceMonitor,
            EventStreamProperties properties,
            Clock clock) {
        return new EventStreamManager(
                streamBroker, streamHandlerRegistry, streamPublisher, streamTrimmer, resourceMonitor, properties, clock);
    }
}
