package com.tradeguard.unit.stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.tradeguard.exception.ConfigurationException;
import com.tradeguard.exception.StreamBrokerException;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.resource.ResourceSnapshot;
import com.tradeguard.stream.EventStreamCatalog;
import com.tradeguard.stream.EventStreamManager;
import com.tradeguard.stream.EventStreamProperties;
import com.tradeguard.stream.EventType;
import com.tradeguard.stream.InMemoryStreamBroker;
import com.tradeguard.stream.StreamBroker;
import com.tradeguard.stream.StreamEntry;
import com.tradeguard.stream.StreamEventHandler;
import com.tradeguard.stream.StreamHandlerRegistry;
import com.tradeguard.stream.StreamPublisher;
import com.tradeguard.stream.StreamTrimmer;
import com.tradeguard.stream.handler.LoggingEventHandler;
import com.tradeguard.unit.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventStreamManagerTest {

    private MutableClock clock;
    private InMemoryStreamBroker broker;
    private ResourceMonitor resourceMonitor;
    private EventStreamProperties properties;
    private List<StreamEntry> riskEvents;
    private EventStreamManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        broker = new InMemoryStreamBroker(clock);
        resourceMonitor = new ResourceMonitor(
                () -> new ResourceSnapshot(20.0, 30.0, 40.0, clock.instant()), Duration.ofSeconds(1), clock);
        properties = new EventStreamProperties();
        properties.setBroker(EventStreamProperties.BrokerType.MEMORY);
        properties.setPollTimeout(Duration.ofMillis(20));
        properties.setCriticalStartStagger(Duration.ofMillis(1));
        properties.setDefaultStartStagger(Duration.ofMillis(1));
        properties.setShutdownGracePeriod(Duration.ofSeconds(2));
        riskEvents = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.stop();
        }
    }

    private EventStreamManager manager(StreamBroker streamBroker, List<StreamEventHandler> handlers) {
        StreamHandlerRegistry registry = new StreamHandlerRegistry(handlers);
        return new EventStreamManager(streamBroker, registry, new StreamPublisher(streamBroker, clock),
                new StreamTrimmer(streamBroker, clock), resourceMonitor, properties, clock);
    }

    private StreamEventHandler riskHandler() {
        return new StreamEventHandler() {
            @Override
            public String serviceName() {
                return EventStreamCatalog.RISK_MONITOR;
            }

            @Override
            public void handle(StreamEntry entry) {
                riskEvents.add(entry);
            }
        };
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTransitions {

        @Test
        @DisplayName("Starts a worker for each service with a handler and routes events to it")
        void startsWorkersAndDeliversEvents() throws InterruptedException {
            manager = manager(broker, List.of(
                    riskHandler(), new LoggingEventHandler(EventStreamCatalog.TRADE_EXECUTION, true)));

            manager.start();
            manager.publish(EventType.PORTFOLIO_CHANGE, Map.of("symbol", "BTCUSDT", "change_percent", "1.2"));

            long deadline = System.currentTimeMillis() + 5_000;
            while (riskEvents.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }

            assertThat(manager.getLifecycle()).isEqualTo(EventStreamManager.Lifecycle.RUNNING);
            assertThat(manager.getWorkers()).containsOnlyKeys(
                    EventStreamCatalog.RISK_MONITOR, EventStreamCatalog.TRADE_EXECUTION);
            assertThat(riskEvents).hasSize(1);
            assertThat(riskEvents.get(0).field("symbol")).isEqualTo("BTCUSDT");
        }

        @Test
        @DisplayName("Status reports every catalog stream once running")
        void statusCoversCatalog() {
            manager = manager(broker, List.of(riskHandler()));
            manager.start();
            manager.publish(EventType.RISK_ALERT, Map.of("level", "WARNING"));

            EventStreamManager.EventStreamStatus status = manager.getStatus();

            assertThat(status.getStreams()).hasSize(EventStreamCatalog.streams().size());
            assertThat(status.getStreams().get(EventStreamCatalog.RISK_ALERTS).length()).isEqualTo(1);
            assertThat(status.getStreams().get(EventStreamCatalog.RISK_ALERTS).lastEntryAgeMs()).isZero();
            assertThat(status.getStreams().get(EventStreamCatalog.TRADE_SIGNALS).lastEntryAgeMs()).isNull();
            assertThat(status.getPublishedEvents()).isEqualTo(1);
            assertThat(status.getServices()).hasSize(1);
        }

        @Test
        @DisplayName("Stops all loops and reports STOPPED")
        void stopsCleanly() {
            manager = manager(broker, List.of(riskHandler()));
            manager.start();

            manager.stop();

            assertThat(manager.getLifecycle()).isEqualTo(EventStreamManager.Lifecycle.STOPPED);
            assertThat(manager.getStatus().getActiveTasks()).isZero();
            assertThat(manager.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Enters FAILED without throwing when the broker cannot initialize")
        void brokerFailureIsContained() {
            StreamBroker failing = mock(StreamBroker.class);
            doThrow(new StreamBrokerException("connection refused")).when(failing).initialize();
            manager = manager(failing, List.of(riskHandler()));

            manager.start();

            assertThat(manager.getLifecycle()).isEqualTo(EventStreamManager.Lifecycle.FAILED);
            assertThat(manager.getStatus().getFailureReason()).contains("connection refused");
            assertThat(manager.getWorkers()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Handler registry")
    class HandlerRegistry {

        @Test
        @DisplayName("Rejects a handler for a service that is not in the catalog")
        void rejectsUnknownService() {
            assertThatThrownBy(() -> new StreamHandlerRegistry(List.of(new LoggingEventHandler("ghost", false))))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("Rejects two handlers for one service")
        void rejectsDuplicates() {
            assertThatThrownBy(() -> new StreamHandlerRegistry(List.of(
                            new LoggingEventHandler(EventStreamCatalog.RISK_MONITOR, false),
                            new LoggingEventHandler(EventStreamCatalog.RISK_MONITOR, true))))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    @DisplayName("Catalog starts services in priority order")
    void startOrderFollowsPriority() {
        assertThat(EventStreamCatalog.servicesInStartOrder())
                .extracting(service -> service.serviceName())
                .startsWith(EventStreamCatalog.TRADE_EXECUTION, EventStreamCatalog.RISK_MONITOR)
                .endsWith(EventStreamCatalog.HEALTH_MONITOR, EventStreamCatalog.CLEANUP_SERVICE,
                        EventStreamCatalog.METRICS_COLLECTOR);
    }
}
