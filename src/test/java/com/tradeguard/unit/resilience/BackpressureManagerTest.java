package com.tradeguard.unit.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeguard.concurrent.TimeBoundedCalls;
import com.tradeguard.exception.BackpressureException;
import com.tradeguard.resilience.BackpressureConfig;
import com.tradeguard.resilience.BackpressureManager;
import com.tradeguard.resilience.BackpressureStats;
import com.tradeguard.resilience.CallPriority;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.resource.ResourceSnapshot;
import com.tradeguard.unit.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BackpressureManager: the concurrency limit under parallel load,
 * CRITICAL bypass, queue limits and waits, priority hand-off and resource shedding.
 */
class BackpressureManagerTest {

    private static final Duration LONG_TIMEOUT = Duration.ofSeconds(10);

    private MutableClock clock;
    private AtomicReference<ResourceSnapshot> hostLoad;
    private ResourceMonitor resourceMonitor;
    private ExecutorService callers;
    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        hostLoad = new AtomicReference<>(new ResourceSnapshot(20.0, 30.0, 40.0, clock.instant()));
        resourceMonitor = new ResourceMonitor(hostLoad::get, Duration.ofSeconds(1), clock);
        callers = Executors.newCachedThreadPool();
        workers = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        workers.shutdownNow();
    }

    private BackpressureManager manager(int maxConcurrent, int queueCapacity) {
        Map<CallPriority, Integer> capacities = new EnumMap<>(CallPriority.class);
        for (CallPriority priority : CallPriority.values()) {
            capacities.put(priority, queueCapacity);
        }
        BackpressureConfig config = BackpressureConfig.defaults()
                .maxConcurrentRequests(maxConcurrent)
                .queueCapacities(capacities)
                .build();
        return new BackpressureManager(config, resourceMonitor, new TimeBoundedCalls(workers));
    }

    /** Occupies one slot until the returned latch is released. */
    private CountDownLatch holdSlot(BackpressureManager manager, CallPriority priority) {
        CountDownLatch release = new CountDownLatch(1);
        callers.submit(() -> manager.execute(() -> release.await(10, TimeUnit.SECONDS), priority, LONG_TIMEOUT));
        return release;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }

    private static int queued(BackpressureManager manager, CallPriority priority) {
        return manager.getStats().getQueueDepths().get(priority);
    }

    @Nested
    @DisplayName("Concurrency limit")
    class ConcurrencyLimit {

        @Test
        @DisplayName("Runs the call immediately while below the limit")
        void runsImmediatelyBelowLimit() throws Exception {
            BackpressureManager manager = manager(2, 10);

            String result = manager.execute(() -> "done", CallPriority.LOW, LONG_TIMEOUT);

            assertThat(result).isEqualTo("done");
            assertThat(manager.getActiveRequests()).isZero();
            assertThat(manager.getStats().getCompletedRequests()).isEqualTo(1);
        }

        @Test
        @DisplayName("Parallel non-CRITICAL callers never exceed maxConcurrentRequests")
        void parallelCallersRespectLimit() throws Exception {
            BackpressureManager manager = manager(5, 100);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            CallPriority[] priorities = {CallPriority.HIGH, CallPriority.MEDIUM, CallPriority.LOW};

            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 60; i++) {
                CallPriority priority = priorities[i % priorities.length];
                int id = i;
                results.add(callers.submit(() -> manager.execute(() -> {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    assertThat(manager.getActiveRequests()).isLessThanOrEqualTo(5);
                    Thread.sleep(10);
                    running.decrementAndGet();
                    return id;
                }, priority, LONG_TIMEOUT)));
            }
            for (Future<Integer> result : results) {
                result.get(20, TimeUnit.SECONDS);
            }

            assertThat(peak.get()).isLessThanOrEqualTo(5);
            assertThat(manager.getActiveRequests()).isZero();
            assertThat(manager.getStats().getCompletedRequests()).isEqualTo(60);
            assertThat(manager.getStats().getRejectedRequests()).isZero();
        }

        @Test
        @DisplayName("CRITICAL calls bypass a saturated limit")
        void criticalBypassesLimit() throws Exception {
            BackpressureManager manager = manager(1, 10);
            CountDownLatch release = holdSlot(manager, CallPriority.LOW);
            awaitCondition(() -> manager.getActiveRequests() == 1);

            String result = manager.execute(() -> "critical", CallPriority.CRITICAL, LONG_TIMEOUT);

            assertThat(result).isEqualTo("critical");
            assertThat(manager.getStats().getCriticalBypasses()).isEqualTo(1);
            release.countDown();
            awaitCondition(() -> manager.getActiveRequests() == 0);
        }
    }

    @Nested
    @DisplayName("Queueing")
    class Queueing {

        @Test
        @DisplayName("Rejects at once when the priority's queue is full")
        void rejectsWhenQueueFull() throws Exception {
            BackpressureManager manager = manager(1, 0);
            CountDownLatch release = holdSlot(manager, CallPriority.HIGH);
            awaitCondition(() -> manager.getActiveRequests() == 1);

            assertThatThrownBy(() -> manager.execute(() -> "x", CallPriority.MEDIUM, LONG_TIMEOUT))
                    .isInstanceOf(BackpressureException.class)
                    .hasMessageContaining("queue is full");

            release.countDown();
        }

        @Test
        @DisplayName("Gives up after half the timeout without a free slot")
        void queueWaitExpires() throws Exception {
            BackpressureManager manager = manager(1, 5);
            CountDownLatch release = holdSlot(manager, CallPriority.HIGH);
            awaitCondition(() -> manager.getActiveRequests() == 1);

            long start = System.nanoTime();
            assertThatThrownBy(() -> manager.execute(() -> "x", CallPriority.LOW, Duration.ofMillis(200)))
                    .isInstanceOf(BackpressureException.class)
                    .satisfies(e -> assertThat(((BackpressureException) e).getRetryAfter())
                            .isEqualTo(Duration.ofMillis(100)));
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(90);
            assertThat(queued(manager, CallPriority.LOW)).isZero();

            release.countDown();
            awaitCondition(() -> manager.getActiveRequests() == 0);
        }

        @Test
        @DisplayName("A released slot goes to the highest-priority waiter")
        void releaseFavoursHigherPriority() throws Exception {
            BackpressureManager manager = manager(1, 5);
            CountDownLatch release = holdSlot(manager, CallPriority.HIGH);
            awaitCondition(() -> manager.getActiveRequests() == 1);

            List<CallPriority> order = new CopyOnWriteArrayList<>();
            Future<?> low = callers.submit(() ->
                    manager.execute(() -> order.add(CallPriority.LOW), CallPriority.LOW, LONG_TIMEOUT));
            awaitCondition(() -> queued(manager, CallPriority.LOW) == 1);
            Future<?> high = callers.submit(() ->
                    manager.execute(() -> order.add(CallPriority.HIGH), CallPriority.HIGH, LONG_TIMEOUT));
            awaitCondition(() -> queued(manager, CallPriority.HIGH) == 1);

            release.countDown();
            high.get(5, TimeUnit.SECONDS);
            low.get(5, TimeUnit.SECONDS);

            assertThat(order).containsExactly(CallPriority.HIGH, CallPriority.LOW);
            assertThat(manager.getActiveRequests()).isZero();
        }
    }

    @Nested
    @DisplayName("Resource pressure")
    class ResourcePressure {

        @Test
        @DisplayName("Sheds MEDIUM and LOW calls but admits HIGH and CRITICAL")
        void shedsLowPriorityUnderPressure() throws Exception {
            BackpressureManager manager = manager(10, 10);
            hostLoad.set(new ResourceSnapshot(92.0, 50.0, 40.0, clock.instant()));
            resourceMonitor.sampleOnce();
            resourceMonitor.sampleOnce();

            assertThatThrownBy(() -> manager.execute(() -> "x", CallPriority.MEDIUM, LONG_TIMEOUT))
                    .isInstanceOf(BackpressureException.class)
                    .satisfies(e -> assertThat(((BackpressureException) e).getRetryAfterSeconds()).isEqualTo(5));
            assertThat(manager.execute(() -> "high", CallPriority.HIGH, LONG_TIMEOUT)).isEqualTo("high");
            assertThat(manager.execute(() -> "critical", CallPriority.CRITICAL, LONG_TIMEOUT)).isEqualTo("critical");

            BackpressureStats stats = manager.getStats();
            assertThat(stats.isUnderPressure()).isTrue();
            assertThat(stats.getPressureRejections()).isEqualTo(1);
        }
    }
}
