package com.tradeguard.resource;

import com.tradeguard.concurrent.TaskSupervisor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Single writer of the shared {@link ResourceSnapshot}.
 *
 * <p>A background loop samples the host every {@code sampleInterval} and swaps
 * the volatile snapshot reference. Backpressure, stream consumers and the
 * adaptive fallback loops only ever read it. The first sample after startup is
 * discarded because the CPU reading has no prior window yet.
 */
public class ResourceMonitor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final ResourceSampler sampler;
    private final Duration sampleInterval;
    private final Clock clock;
    private final AtomicLong sampleCount = new AtomicLong();

    private volatile ResourceSnapshot snapshot;
    private volatile TaskSupervisor supervisor;

    public ResourceMonitor(ResourceSampler sampler, Duration sampleInterval, Clock clock) {
        this.sampler = sampler;
        this.sampleInterval = sampleInterval;
        this.clock = clock;
        this.snapshot = ResourceSnapshot.idle(clock.instant());
    }

    @Override
    public synchronized void start() {
        if (supervisor != null) {
            return;
        }
        supervisor = new TaskSupervisor("resource-monitor");
        supervisor.spawn("sampler", this::sampleLoop);
        log.info("ResourceMonitor started: interval={}ms", sampleInterval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (supervisor == null) {
            return;
        }
        supervisor.shutdown(sampleInterval);
        supervisor = null;
        log.info("ResourceMonitor stopped after {} samples", sampleCount.get());
    }

    @Override
    public boolean isRunning() {
        return supervisor != null;
    }

    /** Starts first and stops last: every other component reads the snapshot. */
    @Override
    public int getPhase() {
        return 0;
    }

    /** Latest snapshot. Never null; an idle placeholder until the first real sample. */
    public ResourceSnapshot getSnapshot() {
        return snapshot;
    }

    /** True when the snapshot is older than two sample intervals, i.e. the loop has stalled. */
    public boolean isStale() {
        Instant sampledAt = snapshot.sampledAt();
        return Duration.between(sampledAt, clock.instant()).compareTo(sampleInterval.multipliedBy(2)) > 0;
    }

    /**
     * Takes one sample. The first call only primes the CPU window and leaves the
     * published snapshot untouched.
     *
     * @return true if the snapshot was replaced
     */
    public boolean sampleOnce() {
        ResourceSnapshot next = sampler.sample();
        if (sampleCount.incrementAndGet() == 1) {
            log.debug("Discarding priming resource sample: cpu={}%", Math.round(next.cpuPercent()));
            return false;
        }
        snapshot = next;
        if (log.isDebugEnabled()) {
            log.debug("Resource sample: cpu={}% memory={}% disk={}%",
                    Math.round(next.cpuPercent()), Math.round(next.memoryPercent()), Math.round(next.diskPercent()));
        }
        return true;
    }

    public long getSampleCount() {
        return sampleCount.get();
    }

    private void sampleLoop() {
        TaskSupervisor owner = supervisor;
        try {
            while (!owner.isCancelled()) {
                try {
                    sampleOnce();
                } catch (RuntimeException e) {
                    log.warn("Resource sampling failed, keeping previous snapshot: {}", e.getMessage());
                }
                if (owner.sleep(sampleInterval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
