package com.tradeguard.resilience;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/** Bounded ring of recent latency samples (milliseconds) with percentile reads. */
public class LatencyWindow {

    private final int capacity;
    private final Deque<Long> samples;

    public LatencyWindow(int capacity) {
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    public synchronized void record(long millis) {
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(millis);
    }

    public synchronized int size() {
        return samples.size();
    }

    /** Nearest-rank percentile, 0 when no samples exist. */
    public synchronized long percentile(double percentile) {
        if (samples.isEmpty()) {
            return 0L;
        }
        long[] sorted = samples.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(percentile * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(rank, sorted.length - 1))];
    }

    public synchronized double average() {
        return samples.stream().mapToLong(Long::longValue).average().orElse(0.0);
    }

    public synchronized long max() {
        return samples.stream().mapToLong(Long::longValue).max().orElse(0L);
    }
}
