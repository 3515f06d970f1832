package com.tradeguard.resilience;

import com.tradeguard.concurrent.TimeBoundedCalls;
import com.tradeguard.exception.BackpressureException;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.resource.ResourceSnapshot;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Priority-tiered admission control for outbound work.
 *
 * <p>Admission order:
 * <ol>
 *   <li>Under severe resource pressure only CRITICAL and HIGH calls are admitted.</li>
 *   <li>Below {@code maxConcurrentRequests} in flight, calls run immediately.</li>
 *   <li>At the limit CRITICAL calls bypass it; everything else waits in a bounded
 *       per-priority queue for at most half of its timeout.</li>
 * </ol>
 *
 * <p>When a call completes its slot is handed to the highest-priority waiter, so
 * the in-flight count never exceeds the limit except through CRITICAL bypasses.
 * Slots taken by a bypass are returned rather than handed over.
 */
public class BackpressureManager {

    private static final Logger log = LoggerFactory.getLogger(BackpressureManager.class);

    private static final Duration PRESSURE_RETRY_AFTER = Duration.ofSeconds(5);
    private static final int WAIT_SAMPLES = 1000;

    private final BackpressureConfig config;
    private final ResourceMonitor resourceMonitor;
    private final TimeBoundedCalls timeBoundedCalls;

    private final AtomicInteger activeRequests = new AtomicInteger();
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<CallPriority, Deque<Waiter>> queues = new EnumMap<>(CallPriority.class);
    private final LatencyWindow queueWaits = new LatencyWindow(WAIT_SAMPLES);

    private final AtomicLong queuedRequests = new AtomicLong();
    private final AtomicLong rejectedRequests = new AtomicLong();
    private final AtomicLong completedRequests = new AtomicLong();
    private final AtomicLong criticalBypasses = new AtomicLong();
    private final AtomicLong pressureRejections = new AtomicLong();

    public BackpressureManager(
            BackpressureConfig config, ResourceMonitor resourceMonitor, TimeBoundedCalls timeBoundedCalls) {
        this.config = config;
        this.resourceMonitor = resourceMonitor;
        this.timeBoundedCalls = timeBoundedCalls;
        for (CallPriority priority : CallPriority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
    }

    public <T> T execute(Callable<T> operation, CallPriority priority) throws Exception {
        return execute(operation, priority, config.getDefaultTimeout());
    }

    /**
     * Admits, runs and releases one operation.
     *
     * @throws BackpressureException if the call is shed or its queue wait expires
     * @throws java.util.concurrent.TimeoutException if the operation exceeds {@code timeout}
     */
    public <T> T execute(Callable<T> operation, CallPriority priority, Duration timeout) throws Exception {
        admit(priority, timeout);
        try {
            return timeBoundedCalls.call(operation, timeout);
        } finally {
            completedRequests.incrementAndGet();
            releaseSlot();
        }
    }

    private void admit(CallPriority priority, Duration timeout) throws InterruptedException {
        ResourceSnapshot resources = resourceMonitor.getSnapshot();
        if (!priority.survivesResourcePressure() && isUnderPressure(resources)) {
            rejectedRequests.incrementAndGet();
            pressureRejections.incrementAndGet();
            log.warn("Shedding {} call under resource pressure: cpu={}% memory={}% disk={}%",
                    priority, Math.round(resources.cpuPercent()), Math.round(resources.memoryPercent()),
                    Math.round(resources.diskPercent()));
            throw new BackpressureException("System under resource pressure", priority, PRESSURE_RETRY_AFTER);
        }

        Duration queueDeadline = timeout.dividedBy(2);
        Waiter waiter;
        lock.lock();
        try {
            if (activeRequests.get() < config.getMaxConcurrentRequests()) {
                activeRequests.incrementAndGet();
                return;
            }
            if (priority == CallPriority.CRITICAL) {
                int active = activeRequests.incrementAndGet();
                criticalBypasses.incrementAndGet();
                log.warn("CRITICAL call bypassing concurrency limit: active={} max={}",
                        active, config.getMaxConcurrentRequests());
                return;
            }
            Deque<Waiter> queue = queues.get(priority);
            if (queue.size() >= config.queueCapacity(priority)) {
                rejectedRequests.incrementAndGet();
                log.warn("Rejecting {} call: queue full ({} waiting)", priority, queue.size());
                throw new BackpressureException(priority + " queue is full", priority, queueDeadline);
            }
            waiter = new Waiter();
            queue.addLast(waiter);
            queuedRequests.incrementAndGet();
            log.debug("Queued {} call: depth={} active={}", priority, queue.size(), activeRequests.get());
        } finally {
            lock.unlock();
        }

        long waitStart = System.nanoTime();
        boolean granted;
        try {
            granted = waiter.latch.await(queueDeadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            if (!abandon(priority, waiter)) {
                releaseSlot();
            }
            throw e;
        }
        if (!granted) {
            granted = !abandon(priority, waiter);
        }
        queueWaits.record(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - waitStart));
        if (!granted) {
            rejectedRequests.incrementAndGet();
            log.warn("Rejecting {} call: no slot within {}ms", priority, queueDeadline.toMillis());
            throw new BackpressureException("Timed out waiting for a " + priority + " slot", priority, queueDeadline);
        }
    }

    /**
     * Withdraws a waiter that gave up.
     *
     * @return false if a slot was handed to the waiter before it could leave
     */
    private boolean abandon(CallPriority priority, Waiter waiter) {
        lock.lock();
        try {
            if (waiter.granted) {
                return false;
            }
            queues.get(priority).remove(waiter);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void releaseSlot() {
        lock.lock();
        try {
            if (activeRequests.get() > config.getMaxConcurrentRequests()) {
                activeRequests.decrementAndGet();
                return;
            }
            Waiter next = pollHighestPriorityWaiter();
            if (next != null) {
                next.granted = true;
                next.latch.countDown();
            } else {
                activeRequests.decrementAndGet();
            }
        } finally {
            lock.unlock();
        }
    }

    /** Must be called with the lock held. */
    private Waiter pollHighestPriorityWaiter() {
        for (CallPriority priority : CallPriority.values()) {
            Waiter waiter = queues.get(priority).pollFirst();
            if (waiter != null) {
                return waiter;
            }
        }
        return null;
    }

    private boolean isUnderPressure(ResourceSnapshot resources) {
        return resources.exceedsAny(
                config.getCpuThresholdPercent(), config.getMemoryThresholdPercent(), config.getDiskThresholdPercent());
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    public BackpressureConfig getConfig() {
        return config;
    }

    public BackpressureStats getStats() {
        Map<CallPriority, Integer> depths = new EnumMap<>(CallPriority.class);
        lock.lock();
        try {
            queues.forEach((priority, queue) -> depths.put(priority, queue.size()));
        } finally {
            lock.unlock();
        }
        ResourceSnapshot resources = resourceMonitor.getSnapshot();
        return BackpressureStats.builder()
                .activeRequests(activeRequests.get())
                .maxConcurrentRequests(config.getMaxConcurrentRequests())
                .queueDepths(depths)
                .queuedRequests(queuedRequests.get())
                .rejectedRequests(rejectedRequests.get())
                .completedRequests(completedRequests.get())
                .criticalBypasses(criticalBypasses.get())
                .pressureRejections(pressureRejections.get())
                .queueWaitP50Ms(queueWaits.percentile(0.50))
                .queueWaitP95Ms(queueWaits.percentile(0.95))
                .queueWaitP99Ms(queueWaits.percentile(0.99))
                .underPressure(isUnderPressure(resources))
                .resources(resources)
                .build();
    }

    private static final class Waiter {
        private final CountDownLatch latch = new CountDownLatch(1);
        private boolean granted;
    }
}
