package com.tradeguard.stream;

import com.tradeguard.concurrent.TaskSupervisor;
import com.tradeguard.exception.BaseException;
import com.tradeguard.resource.ResourceMonitor;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the event pipeline: consumer groups for every catalog stream and a
 * {@link ServiceWorker} for every catalog service that has a handler.
 *
 * <p>Startup verifies the broker, creates the groups, then starts services in
 * priority order with a short stagger between them. If the broker cannot be
 * initialized the manager enters {@link Lifecycle#FAILED} and stays out of the
 * way; the rest of the application keeps running without the pipeline.
 *
 * <p>Shutdown cancels all loops, waits up to {@code shutdownGracePeriod} for
 * in-flight batches, then interrupts them. Entries of interrupted batches stay
 * pending and are reclaimed on the next start.
 */
public class EventStreamManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EventStreamManager.class);

    public enum Lifecycle {
        NEW,
        RUNNING,
        FAILED,
        STOPPED
    }

    private final StreamBroker broker;
    private final StreamHandlerRegistry handlerRegistry;
    private final StreamPublisher publisher;
    private final StreamTrimmer trimmer;
    private final ResourceMonitor resourceMonitor;
    private final AdaptiveIntervalCalculator intervalCalculator;
    private final EventStreamProperties properties;
    private final Clock clock;

    private final Map<String, ServiceWorker> workers = new LinkedHashMap<>();
    private volatile Lifecycle lifecycle = Lifecycle.NEW;
    private volatile String failureReason;
    private TaskSupervisor supervisor;
    private ExecutorService batchExecutor;

    public EventStreamManager(
            StreamBroker broker,
            StreamHandlerRegistry handlerRegistry,
            StreamPublisher publisher,
            StreamTrimmer trimmer,
            ResourceMonitor resourceMonitor,
            EventStreamProperties properties,
            Clock clock) {
        this.broker = broker;
        this.handlerRegistry = handlerRegistry;
        this.publisher = publisher;
        this.trimmer = trimmer;
        this.resourceMonitor = resourceMonitor;
        this.intervalCalculator = new AdaptiveIntervalCalculator(properties.getMaxFallbackInterval());
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (lifecycle == Lifecycle.RUNNING) {
            return;
        }
        try {
            broker.initialize();
        } catch (BaseException e) {
            lifecycle = Lifecycle.FAILED;
            failureReason = e.getMessage();
            log.error("Event stream pipeline not started, broker unavailable: {}", e.getMessage());
            return;
        }

        for (EventStreamConfig stream : EventStreamCatalog.streams()) {
            try {
                broker.createGroup(stream.streamName(), stream.consumerGroup());
            } catch (RuntimeException e) {
                log.warn("Could not create group {} on {}: {}", stream.consumerGroup(), stream.streamName(), e.getMessage());
            }
        }

        supervisor = new TaskSupervisor("event-streams");
        batchExecutor = Executors.newCachedThreadPool(new BatchThreadFactory());
        workers.clear();
        lifecycle = Lifecycle.RUNNING;
        failureReason = null;

        try {
            for (ServiceConsumerConfig service : EventStreamCatalog.servicesInStartOrder()) {
                if (!startService(service)) {
                    continue;
                }
                Duration stagger = service.priority() == StreamPriority.CRITICAL
                        ? properties.getCriticalStartStagger()
                        : properties.getDefaultStartStagger();
                if (supervisor.sleep(stagger)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Event stream pipeline started: {} services on {} streams",
                workers.size(), EventStreamCatalog.streams().size());
    }

    private boolean startService(ServiceConsumerConfig service) {
        StreamEventHandler handler = handlerRegistry.find(service.serviceName()).orElse(null);
        if (handler == null) {
            log.warn("No handler registered for service {}, not starting it", service.serviceName());
            return false;
        }
        String group = EventStreamCatalog.stream(service.stream())
                .map(EventStreamConfig::consumerGroup)
                .orElseThrow(() -> new IllegalStateException("Service " + service.serviceName()
                        + " bound to unknown stream " + service.stream()));
        ServiceWorker worker = new ServiceWorker(service, group, handler, broker, resourceMonitor,
                intervalCalculator, properties, batchExecutor, clock);
        workers.put(service.serviceName(), worker);
        TaskSupervisor owner = supervisor;
        owner.spawn(service.serviceName() + "-consumer", () -> worker.consumeLoop(owner));
        owner.spawn(service.serviceName() + "-fallback", () -> worker.fallbackLoop(owner));
        log.info("Started service {} ({}) on {}", service.serviceName(), service.priority(), service.stream());
        return true;
    }

    @Override
    public synchronized void stop() {
        if (lifecycle != Lifecycle.RUNNING) {
            return;
        }
        log.info("Stopping event stream pipeline");
        supervisor.shutdown(properties.getShutdownGracePeriod());
        batchExecutor.shutdownNow();
        broker.close();
        lifecycle = Lifecycle.STOPPED;
    }

    @Override
    public boolean isRunning() {
        return lifecycle == Lifecycle.RUNNING;
    }

    /** After the resource monitor and breakers, before market data. */
    @Override
    public int getPhase() {
        return 100;
    }

    /** Publishes an event to its default stream. */
    public StreamEntryId publish(EventType eventType, Map<String, ?> data) {
        return publisher.publish(eventType, data);
    }

    public StreamEntryId publish(EventType eventType, Map<String, ?> data, String streamOverride) {
        return publisher.publish(eventType, data, streamOverride);
    }

    /** Trims every catalog stream by age and then length. */
    public List<StreamTrimmer.TrimResult> cleanupStreams() {
        return trimmer.trimAll();
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public synchronized Map<String, ServiceWorker> getWorkers() {
        return Map.copyOf(workers);
    }

    public synchronized EventStreamStatus getStatus() {
        List<ServiceWorker.ServiceStatus> services = new ArrayList<>();
        workers.values().forEach(worker -> services.add(worker.getStatus()));

        Map<String, StreamStatus> streams = new LinkedHashMap<>();
        if (lifecycle == Lifecycle.RUNNING) {
            for (EventStreamConfig stream : EventStreamCatalog.streams()) {
                try {
                    StreamInfo info = broker.info(stream.streamName());
                    Long lastEntryAgeMs = info.lastEntry()
                            .map(id -> Math.max(0, clock.millis() - id.millis()))
                            .orElse(null);
                    long pending = broker.pendingCount(stream.streamName(), stream.consumerGroup());
                    streams.put(stream.streamName(), new StreamStatus(info.length(), pending, lastEntryAgeMs));
                } catch (RuntimeException e) {
                    log.debug("Stream status unavailable for {}: {}", stream.streamName(), e.getMessage());
                }
            }
        }

        return EventStreamStatus.builder()
                .lifecycle(lifecycle)
                .failureReason(failureReason)
                .publishedEvents(publisher.getPublishedCount())
                .activeTasks(supervisor != null ? supervisor.activeTaskCount() : 0)
                .services(services)
                .streams(streams)
                .build();
    }

    /** {@code lastEntryAgeMs} is null when the stream has never had an entry. */
    public record StreamStatus(long length, long pending, Long lastEntryAgeMs) {}

    @Value
    @Builder
    public static class EventStreamStatus {
        Lifecycle lifecycle;
        String failureReason;
        long publishedEvents;
        int activeTasks;
        List<ServiceWorker.ServiceStatus> services;
        Map<String, StreamStatus> streams;
    }

    private static final class BatchThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "stream-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
