package com.tradeguard.unit.stream;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeguard.concurrent.TaskSupervisor;
import com.tradeguard.resource.ResourceMonitor;
import com.tradeguard.resource.ResourceSnapshot;
import com.tradeguard.stream.AdaptiveIntervalCalculator;
import com.tradeguard.stream.ConsumerState;
import com.tradeguard.stream.EventStreamProperties;
import com.tradeguard.stream.InMemoryStreamBroker;
import com.tradeguard.stream.ServiceConsumerConfig;
import com.tradeguard.stream.ServiceWorker;
import com.tradeguard.stream.StreamEntry;
import com.tradeguard.stream.StreamEventHandler;
import com.tradeguard.stream.StreamPriority;
import com.tradeguard.unit.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ServiceWorker: batch acknowledgement, failure and timeout
 * handling, pending reclaim after a crash, and the quiet-stream fallback.
 */
class ServiceWorkerTest {

    private static final String STREAM = "portfolio_changes";
    private static final String GROUP = "portfolio_services";

    private MutableClock clock;
    private InMemoryStreamBroker broker;
    private AtomicReference<ResourceSnapshot> hostLoad;
    private ResourceMonitor resourceMonitor;
    private EventStreamProperties properties;
    private ExecutorService batchExecutor;
    private RecordingHandler handler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
        broker = new InMemoryStreamBroker(clock);
        broker.createGroup(STREAM, GROUP);
        hostLoad = new AtomicReference<>(new ResourceSnapshot(20.0, 30.0, 40.0, clock.instant()));
        resourceMonitor = new ResourceMonitor(hostLoad::get, Duration.ofSeconds(1), clock);
        properties = new EventStreamProperties();
        properties.setPollTimeout(Duration.ofMillis(20));
        batchExecutor = Executors.newCachedThreadPool();
        handler = new RecordingHandler();
    }

    @AfterEach
    void tearDown() {
        batchExecutor.shutdownNow();
    }

    private ServiceWorker worker(Duration batchTimeout) {
        ServiceConsumerConfig service = new ServiceConsumerConfig(
                "risk_monitor", STREAM, StreamPriority.CRITICAL, Duration.ofSeconds(5), 5, batchTimeout);
        return new ServiceWorker(service, GROUP, handler, broker, resourceMonitor,
                new AdaptiveIntervalCalculator(Duration.ofHours(2)), properties, batchExecutor, clock);
    }

    private void publish(int count) {
        for (int i = 0; i < count; i++) {
            broker.append(STREAM, Map.of("event_type", "PORTFOLIO_CHANGE", "n", String.valueOf(i)), 0);
        }
    }

    private List<StreamEntry> read(String consumer) throws InterruptedException {
        return broker.readGroup(STREAM, GROUP, consumer, 10, Duration.ZERO);
    }

    private void applyLoad(double cpu, double memory) {
        hostLoad.set(new ResourceSnapshot(cpu, memory, 40.0, clock.instant()));
        resourceMonitor.sampleOnce();
        resourceMonitor.sampleOnce();
    }

    @Nested
    @DisplayName("Batch processing")
    class BatchProcessing {

        @Test
        @DisplayName("Acknowledges the whole batch when every handler succeeds")
        void acknowledgesSuccessfulBatch() throws InterruptedException {
            ServiceWorker worker = worker(Duration.ofSeconds(2));
            publish(3);

            boolean acked = worker.processBatch(read("c1"));

            assertThat(acked).isTrue();
            assertThat(handler.handled.get()).isEqualTo(3);
            assertThat(broker.pendingCount(STREAM, GROUP)).isZero();
            assertThat(worker.getStatus().getProcessedEntries()).isEqualTo(3);
        }

        @Test
        @DisplayName("Leaves the whole batch pending when one handler throws")
        void failureLeavesBatchPending() throws InterruptedException {
            ServiceWorker worker = worker(Duration.ofSeconds(2));
            publish(3);
            handler.failOn.add("1");

            boolean acked = worker.processBatch(read("c1"));

            assertThat(acked).isFalse();
            assertThat(broker.pendingCount(STREAM, GROUP)).isEqualTo(3);
            assertThat(worker.getStatus().getFailedBatches()).isEqualTo(1);
        }

        @Test
        @DisplayName("Leaves a batch that exceeds its timeout unacknowledged")
        void timeoutLeavesBatchPending() throws InterruptedException {
            ServiceWorker worker = worker(Duration.ofMillis(50));
            publish(2);
            handler.delay = Duration.ofSeconds(2);

            boolean acked = worker.processBatch(read("c1"));

            assertThat(acked).isFalse();
            assertThat(broker.pendingCount(STREAM, GROUP)).isEqualTo(2);
            assertThat(worker.getStatus().getTimedOutBatches()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Pending reclaim")
    class PendingReclaim {

        @Test
        @DisplayName("Entries left by a crashed consumer are reprocessed and acknowledged")
        void crashedConsumerEntriesAreReprocessed() throws InterruptedException {
            publish(4);
            List<StreamEntry> inFlight = read("crashed_consumer");
            assertThat(inFlight).hasSize(4);

            clock.advance(Duration.ofSeconds(61));
            ServiceWorker rescuer = worker(Duration.ofSeconds(2));
            int claimed = rescuer.recoverPending();

            assertThat(claimed).isEqualTo(4);
            assertThat(handler.seen).containsExactlyInAnyOrder("0", "1", "2", "3");
            assertThat(broker.pendingCount(STREAM, GROUP)).isZero();
            assertThat(rescuer.getStatus().getReclaimedEntries()).isEqualTo(4);
        }

        @Test
        @DisplayName("Entries not yet idle long enough are left to their consumer")
        void recentPendingIsNotClaimed() throws InterruptedException {
            publish(2);
            read("busy_consumer");

            clock.advance(Duration.ofSeconds(10));
            int claimed = worker(Duration.ofSeconds(2)).recoverPending();

            assertThat(claimed).isZero();
            assertThat(broker.pendingCount(STREAM, GROUP)).isEqualTo(2);
        }

        @Test
        @DisplayName("A batch that failed once is retried through reclaim and not lost")
        void failedBatchIsRetried() throws InterruptedException {
            ServiceWorker worker = worker(Duration.ofSeconds(2));
            publish(2);
            handler.failOn.add("0");
            worker.processBatch(read(worker.getConsumerName()));

            handler.failOn.clear();
            clock.advance(Duration.ofSeconds(61));
            worker.recoverPending();

            assertThat(broker.pendingCount(STREAM, GROUP)).isZero();
            assertThat(handler.seen).contains("0", "1");
        }
    }

    @Nested
    @DisplayName("Fallback work")
    class FallbackWork {

        @Test
        @DisplayName("Runs only when the stream has been quiet for the activity window")
        void runsOnlyWhenQuiet() throws InterruptedException {
            ServiceWorker worker = worker(Duration.ofSeconds(2));
            publish(1);

            assertThat(worker.runFallbackIfQuiet()).isFalse();

            clock.advance(Duration.ofSeconds(31));
            assertThat(worker.runFallbackIfQuiet()).isTrue();
            assertThat(handler.fallbacks.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("A stream that never had entries is quiet")
        void emptyStreamIsQuiet() {
            assertThat(worker(Duration.ofSeconds(2)).isStreamQuiet()).isTrue();
        }

        @Test
        @DisplayName("Skips fallback work while the resource gate is closed")
        void resourceGateBlocksFallback() throws InterruptedException {
            ServiceWorker worker = worker(Duration.ofSeconds(2));
            applyLoad(97.0, 50.0);

            assertThat(worker.runFallbackIfQuiet()).isFalse();
            assertThat(handler.fallbacks.get()).isZero();
        }

        @Test
        @DisplayName("A failing fallback is counted and does not escape")
        void fallbackFailureIsContained() throws InterruptedException {
            ServiceWorker worker = worker(Duration.ofSeconds(2));
            handler.failFallback = true;

            assertThat(worker.runFallbackIfQuiet()).isFalse();
            assertThat(worker.getStatus().getFallbackFailures()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Consumer loop drains the stream and stops on cancellation")
    void consumeLoopDrainsAndStops() throws InterruptedException {
        ServiceWorker worker = worker(Duration.ofSeconds(2));
        TaskSupervisor supervisor = new TaskSupervisor("worker-test");
        supervisor.spawn("consumer", () -> worker.consumeLoop(supervisor));
        publish(7);

        long deadline = System.currentTimeMillis() + 5_000;
        while (broker.pendingCount(STREAM, GROUP) > 0 || handler.handled.get() < 7) {
            if (System.currentTimeMillis() > deadline) {
                break;
            }
            Thread.sleep(10);
        }
        supervisor.shutdown(Duration.ofSeconds(2));

        assertThat(handler.handled.get()).isEqualTo(7);
        assertThat(broker.pendingCount(STREAM, GROUP)).isZero();
        assertThat(worker.getState()).isEqualTo(ConsumerState.STOPPED);
    }

    private static final class RecordingHandler implements StreamEventHandler {

        private final AtomicInteger handled = new AtomicInteger();
        private final AtomicInteger fallbacks = new AtomicInteger();
        private final Set<String> seen = ConcurrentHashMap.newKeySet();
        private final Set<String> failOn = ConcurrentHashMap.newKeySet();
        private volatile Duration delay = Duration.ZERO;
        private volatile boolean failFallback;

        @Override
        public String serviceName() {
            return "risk_monitor";
        }

        @Override
        public void handle(StreamEntry entry) throws Exception {
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
            String n = entry.field("n");
            if (failOn.contains(n)) {
                throw new IllegalStateException("cannot process " + n);
            }
            seen.add(n);
            handled.incrementAndGet();
        }

        @Override
        public void runFallback() {
            if (failFallback) {
                throw new IllegalStateException("fallback failed");
            }
            fallbacks.incrementAndGet();
        }
    }
}
