package com.tradeguard.stream;

import com.tradeguard.concurrent.TaskSupervisor;
import com.tradeguard.resource.ResourceMonitor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The two loops of one consuming service: a consumer-group reader and an
 * adaptive fallback poller.
 *
 * <p>The reader first reclaims entries left pending by earlier consumers, then
 * reads batches and hands each entry to the service's handler in parallel. A
 * batch is acknowledged only after every handler returned normally; a failing or
 * slow batch stays pending and comes back through the reclaim pass, which also
 * reruns every {@code reclaimInterval}.
 *
 * <p>The fallback loop runs the handler's periodic work when the stream has
 * gone quiet, at an interval stretched by host load.
 */
public class ServiceWorker {

    private static final Logger log = LoggerFactory.getLogger(ServiceWorker.class);

    private final ServiceConsumerConfig service;
    private final String consumerGroup;
    private final String consumerName;
    private final StreamEventHandler handler;
    private final StreamBroker broker;
    private final ResourceMonitor resourceMonitor;
    private final AdaptiveIntervalCalculator intervalCalculator;
    private final EventStreamProperties properties;
    private final ExecutorService batchExecutor;
    private final Clock clock;

    private final AtomicLong processedEntries = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();
    private final AtomicLong timedOutBatches = new AtomicLong();
    private final AtomicLong reclaimedEntries = new AtomicLong();
    private final AtomicLong fallbackRuns = new AtomicLong();
    private final AtomicLong fallbackFailures = new AtomicLong();
    private final AtomicLong brokerErrors = new AtomicLong();

    private volatile ConsumerState state = ConsumerState.STARTING;
    private volatile Duration currentFallbackInterval;
    private volatile Instant lastFallbackAt;

    public ServiceWorker(
            ServiceConsumerConfig service,
            String consumerGroup,
            StreamEventHandler handler,
            StreamBroker broker,
            ResourceMonitor resourceMonitor,
            AdaptiveIntervalCalculator intervalCalculator,
            EventStreamProperties properties,
            ExecutorService batchExecutor,
            Clock clock) {
        this.service = service;
        this.consumerGroup = consumerGroup;
        this.handler = handler;
        this.broker = broker;
        this.resourceMonitor = resourceMonitor;
        this.intervalCalculator = intervalCalculator;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
        this.consumerName = service.serviceName() + "_" + clock.instant().getEpochSecond();
        this.currentFallbackInterval = service.fallbackInterval();
    }

    /** Reader loop. Returns when the supervisor is cancelled or the thread is interrupted. */
    public void consumeLoop(TaskSupervisor supervisor) {
        log.info("Consumer {} starting on stream {} group {}", consumerName, service.stream(), consumerGroup);
        try {
            state = ConsumerState.RECOVERING_PENDING;
            recoverPending();
            Instant nextReclaim = clock.instant().plus(properties.getReclaimInterval());

            while (!supervisor.isCancelled()) {
                if (!service.priority().canProcess(resourceMonitor.getSnapshot())) {
                    if (state != ConsumerState.BACKING_OFF) {
                        log.info("Consumer {} pausing: resources above {}% gate",
                                consumerName, service.priority().getResourceGatePercent());
                    }
                    state = ConsumerState.BACKING_OFF;
                    if (supervisor.sleep(properties.getResourceBackoff())) {
                        break;
                    }
                    continue;
                }
                state = ConsumerState.CONSUMING;
                try {
                    if (!clock.instant().isBefore(nextReclaim)) {
                        recoverPending();
                        state = ConsumerState.CONSUMING;
                        nextReclaim = clock.instant().plus(properties.getReclaimInterval());
                    }
                    List<StreamEntry> entries = broker.readGroup(
                            service.stream(), consumerGroup, consumerName, service.batchSize(), properties.getPollTimeout());
                    if (!entries.isEmpty()) {
                        processBatch(entries);
                    }
                } catch (RuntimeException e) {
                    brokerErrors.incrementAndGet();
                    log.warn("Consumer {} read failed, backing off {}ms: {}",
                            consumerName, properties.getErrorBackoff().toMillis(), e.getMessage());
                    state = ConsumerState.BACKING_OFF;
                    if (supervisor.sleep(properties.getErrorBackoff())) {
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = ConsumerState.STOPPED;
            log.info("Consumer {} stopped: processed={} failedBatches={} timedOutBatches={}",
                    consumerName, processedEntries.get(), failedBatches.get(), timedOutBatches.get());
        }
    }

    /**
     * Claims entries idle for at least {@code reclaimMinIdle}, batch by batch until
     * the pending list is exhausted, and reprocesses them.
     *
     * @return number of entries claimed
     */
    public int recoverPending() throws InterruptedException {
        int claimedTotal = 0;
        String cursor = ClaimResult.SCAN_START;
        try {
            while (true) {
                ClaimResult result = broker.claimIdle(service.stream(), consumerGroup, consumerName,
                        properties.getReclaimMinIdle(), cursor, properties.getReclaimBatchSize());
                if (!result.entries().isEmpty()) {
                    claimedTotal += result.entries().size();
                    reclaimedEntries.addAndGet(result.entries().size());
                    for (StreamEntry entry : result.entries()) {
                        log.info("Consumer {} reclaimed pending entry {} on {}", consumerName, entry.id(), entry.stream());
                    }
                    processBatch(result.entries());
                }
                if (result.entries().isEmpty() || result.isScanComplete()) {
                    break;
                }
                cursor = result.nextCursor();
            }
        } catch (RuntimeException e) {
            brokerErrors.incrementAndGet();
            log.warn("Consumer {} pending reclaim failed: {}", consumerName, e.getMessage());
        }
        return claimedTotal;
    }

    /**
     * Runs the handler over every entry in parallel under the service's batch
     * timeout and acknowledges the batch only if all of them succeeded.
     *
     * @return true if the batch was acknowledged
     */
    public boolean processBatch(List<StreamEntry> entries) throws InterruptedException {
        List<Callable<Void>> tasks = new ArrayList<>(entries.size());
        for (StreamEntry entry : entries) {
            tasks.add(() -> {
                handler.handle(entry);
                return null;
            });
        }

        List<Future<Void>> results =
                batchExecutor.invokeAll(tasks, service.batchTimeout().toMillis(), TimeUnit.MILLISECONDS);

        Throwable failure = null;
        boolean timedOut = false;
        for (Future<Void> result : results) {
            if (result.isCancelled()) {
                timedOut = true;
                continue;
            }
            try {
                result.get();
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause();
                }
            }
        }

        if (timedOut) {
            timedOutBatches.incrementAndGet();
            log.warn("Consumer {} batch of {} exceeded {}ms, leaving it unacknowledged",
                    consumerName, entries.size(), service.batchTimeout().toMillis());
            return false;
        }
        if (failure != null) {
            failedBatches.incrementAndGet();
            log.error("Consumer {} handler failed, batch of {} left unacknowledged",
                    consumerName, entries.size(), failure);
            return false;
        }

        List<StreamEntryId> ids = entries.stream().map(StreamEntry::id).toList();
        broker.acknowledge(service.stream(), consumerGroup, ids);
        processedEntries.addAndGet(entries.size());
        return true;
    }

    /** Fallback loop. Returns when the supervisor is cancelled. */
    public void fallbackLoop(TaskSupervisor supervisor) {
        try {
            while (!supervisor.isCancelled()) {
                runFallbackIfQuiet();
                Duration interval = intervalCalculator.calculate(
                        service.fallbackInterval(), service.priority(), resourceMonitor.getSnapshot());
                currentFallbackInterval = interval;
                log.trace("Fallback for {} sleeping {}ms", service.serviceName(), interval.toMillis());
                if (supervisor.sleep(interval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs the handler's fallback work if the resource gate allows it and the
     * stream has been quiet.
     *
     * @return true if fallback work ran and completed
     */
    public boolean runFallbackIfQuiet() throws InterruptedException {
        if (!service.priority().canProcess(resourceMonitor.getSnapshot())) {
            log.debug("Fallback for {} skipped: resources above gate", service.serviceName());
            return false;
        }
        if (!isStreamQuiet()) {
            return false;
        }
        try {
            handler.runFallback();
            fallbackRuns.incrementAndGet();
            lastFallbackAt = clock.instant();
            return true;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            fallbackFailures.incrementAndGet();
            log.warn("Fallback work for {} failed: {}", service.serviceName(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * True when the bound stream has no entry newer than the activity window, has
     * never had an entry, or cannot be inspected.
     */
    public boolean isStreamQuiet() {
        try {
            StreamInfo info = broker.info(service.stream());
            return info.lastEntry()
                    .map(id -> Duration.between(id.timestamp(), clock.instant())
                                    .compareTo(properties.getActivityWindow())
                            > 0)
                    .orElse(true);
        } catch (RuntimeException e) {
            log.debug("Cannot inspect stream {}, treating it as quiet: {}", service.stream(), e.getMessage());
            return true;
        }
    }

    public ConsumerState getState() {
        return state;
    }

    public String getConsumerName() {
        return consumerName;
    }

    public ServiceConsumerConfig getService() {
        return service;
    }

    public ServiceStatus getStatus() {
        return ServiceStatus.builder()
                .serviceName(service.serviceName())
                .stream(service.stream())
                .priority(service.priority())
                .consumerName(consumerName)
                .state(state)
                .processedEntries(processedEntries.get())
                .failedBatches(failedBatches.get())
                .timedOutBatches(timedOutBatches.get())
                .reclaimedEntries(reclaimedEntries.get())
                .fallbackRuns(fallbackRuns.get())
                .fallbackFailures(fallbackFailures.get())
                .brokerErrors(brokerErrors.get())
                .currentFallbackIntervalMs(currentFallbackInterval.toMillis())
                .lastFallbackAt(lastFallbackAt)
                .build();
    }

    @Value
    @Builder
    public static class ServiceStatus {
        String serviceName;
        String stream;
        StreamPriority priority;
        String consumerName;
        ConsumerState state;
        long processedEntries;
        long failedBatches;
        long timedOutBatches;
        long reclaimedEntries;
        long fallbackRuns;
        long fallbackFailures;
        long brokerErrors;
        long currentFallbackIntervalMs;
        Instant lastFallbackAt;
    }
}
