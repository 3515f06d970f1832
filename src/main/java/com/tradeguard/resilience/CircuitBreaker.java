package com.tradeguard.resilience;

import com.tradeguard.concurrent.TimeBoundedCalls;
import com.tradeguard.exception.CircuitOpenException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLOSED/OPEN/HALF_OPEN guard for one named dependency.
 *
 * <p>Failures are timestamped into a sliding window of {@code failureWindow}; the
 * circuit opens once the window holds {@code failureThreshold} entries. While
 * OPEN every call is rejected with {@link CircuitOpenException} until
 * {@code min(timeout * multiplier, maxTimeout)} has passed since the last state
 * change. Then exactly one probe is admitted at a time (HALF_OPEN). A failed
 * probe reopens the circuit and doubles the multiplier (at most 8x);
 * {@code successThreshold} successful probes in a row close it and reset the
 * multiplier to 1x.
 *
 * <p>All state lives behind one lock per breaker. The guarded operation itself
 * runs outside the lock.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    static final int MAX_BACKOFF_MULTIPLIER = 8;
    private static final int LATENCY_SAMPLES = 1000;
    private static final Duration PROBE_BUSY_RETRY = Duration.ofSeconds(1);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final TimeBoundedCalls timeBoundedCalls;
    private final CircuitStateListener listener;
    private final ReentrantLock lock = new ReentrantLock();
    private final LatencyWindow latencies = new LatencyWindow(LATENCY_SAMPLES);
    private final Deque<Instant> failureTimes = new ArrayDeque<>();

    private CircuitState state = CircuitState.CLOSED;
    private Instant lastStateChange;
    private Instant lastFailure;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int backoffMultiplier = 1;
    private boolean probeInFlight;
    // false until this breaker changes state or adopts a shared snapshot
    private boolean hasStateHistory;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long timeoutCalls;
    private long slowCalls;
    private long rejectedCalls;
    private long ignoredErrors;
    private long stateChanges;

    public CircuitBreaker(
            String name,
            CircuitBreakerConfig config,
            Clock clock,
            TimeBoundedCalls timeBoundedCalls,
            CircuitStateListener listener) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.timeBoundedCalls = timeBoundedCalls;
        this.listener = listener != null ? listener : event -> {};
        this.lastStateChange = clock.instant();
    }

    /**
     * Runs the operation if the circuit admits it.
     *
     * @throws CircuitOpenException if the circuit is open or a probe is already running
     * @throws TimeoutException if the operation exceeded {@code callTimeout}
     */
    public <T> T call(Callable<T> operation) throws Exception {
        boolean probe = acquirePermission();
        long startNanos = System.nanoTime();
        try {
            T result = timeBoundedCalls.call(operation, config.getCallTimeout());
            onSuccess(Duration.ofNanos(System.nanoTime() - startNanos).toMillis(), probe);
            return result;
        } catch (TimeoutException e) {
            onFailure(true, probe, e);
            throw e;
        } catch (InterruptedException e) {
            onIgnored(probe, e);
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            if (config.isIgnored(e)) {
                onIgnored(probe, e);
            } else {
                onFailure(false, probe, e);
            }
            throw e;
        } catch (Error e) {
            onIgnored(probe, e);
            throw e;
        }
    }

    /** Admits or rejects a call. Returns true when the admitted call is the half-open probe. */
    private boolean acquirePermission() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitState.OPEN) {
                Duration remaining = remainingOpenTime(now);
                if (!remaining.isZero()) {
                    rejectedCalls++;
                    log.debug("Circuit {} rejected call: state=OPEN retryAfter={}ms", name, remaining.toMillis());
                    throw new CircuitOpenException(name, remaining);
                }
                transitionTo(CircuitState.HALF_OPEN, now, "recovery timeout of " + currentTimeout().toSeconds()
                        + "s elapsed");
            }
            if (state == CircuitState.HALF_OPEN) {
                if (probeInFlight) {
                    rejectedCalls++;
                    log.debug("Circuit {} rejected call: probe already in flight", name);
                    throw new CircuitOpenException(name, PROBE_BUSY_RETRY);
                }
                probeInFlight = true;
                totalCalls++;
                log.debug("Circuit {} admitted probe call", name);
                return true;
            }
            totalCalls++;
            log.trace("Circuit {} admitted call: state=CLOSED failuresInWindow={}", name, failureTimes.size());
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(long latencyMillis, boolean probe) {
        lock.lock();
        try {
            latencies.record(latencyMillis);
            successfulCalls++;
            if (latencyMillis > config.getSlowCallThreshold().toMillis()) {
                slowCalls++;
                log.warn("Circuit {} slow call: latency={}ms threshold={}ms",
                        name, latencyMillis, config.getSlowCallThreshold().toMillis());
            }
            consecutiveFailures = 0;
            if (probe) {
                probeInFlight = false;
                consecutiveSuccesses++;
                if (state == CircuitState.HALF_OPEN && consecutiveSuccesses >= config.getSuccessThreshold()) {
                    transitionTo(CircuitState.CLOSED, clock.instant(),
                            consecutiveSuccesses + " consecutive probe successes");
                }
            } else if (state == CircuitState.CLOSED) {
                consecutiveSuccesses++;
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(boolean timedOut, boolean probe, Exception error) {
        lock.lock();
        try {
            Instant now = clock.instant();
            failedCalls++;
            if (timedOut) {
                timeoutCalls++;
            }
            lastFailure = now;
            failureTimes.addLast(now);
            pruneFailureWindow(now);
            consecutiveFailures++;
            consecutiveSuccesses = 0;
            if (probe) {
                probeInFlight = false;
            }
            log.debug("Circuit {} recorded failure: timeout={} failuresInWindow={} error={}",
                    name, timedOut, failureTimes.size(), error.toString());

            if (state == CircuitState.HALF_OPEN) {
                backoffMultiplier = Math.min(backoffMultiplier * 2, MAX_BACKOFF_MULTIPLIER);
                transitionTo(CircuitState.OPEN, now, "probe failed");
            } else if (state == CircuitState.CLOSED && failureTimes.size() >= config.getFailureThreshold()) {
                transitionTo(CircuitState.OPEN, now, failureTimes.size() + " failures within "
                        + config.getFailureWindow().toSeconds() + "s");
            }
        } finally {
            lock.unlock();
        }
    }

    private void onIgnored(boolean probe, Throwable error) {
        lock.lock();
        try {
            ignoredErrors++;
            if (probe) {
                probeInFlight = false;
            }
            log.debug("Circuit {} passed through ignored error: {}", name, error.toString());
        } finally {
            lock.unlock();
        }
    }

    /** Opens the circuit regardless of its health, e.g. during planned maintenance of the dependency. */
    public void forceOpen() {
        lock.lock();
        try {
            if (state != CircuitState.OPEN) {
                transitionTo(CircuitState.OPEN, clock.instant(), "forced open");
            }
        } finally {
            lock.unlock();
        }
    }

    public void forceClose() {
        lock.lock();
        try {
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED, clock.instant(), "forced closed");
            }
        } finally {
            lock.unlock();
        }
    }

    /** Must be called with the lock held. */
    private void transitionTo(CircuitState newState, Instant now, String reason) {
        CircuitBreakerSnapshot before = snapshotLocked();
        CircuitState previous = state;
        state = newState;
        lastStateChange = now;
        hasStateHistory = true;
        stateChanges++;
        consecutiveSuccesses = 0;
        probeInFlight = false;
        if (newState == CircuitState.CLOSED) {
            consecutiveFailures = 0;
            failureTimes.clear();
            backoffMultiplier = 1;
        }
        CircuitBreakerSnapshot after = snapshotLocked();
        if (newState == CircuitState.OPEN) {
            log.warn("Circuit {} {} -> {} ({}), recovery in {}s: before={} after={}",
                    name, previous, newState, reason, currentTimeout().toSeconds(), before, after);
        } else {
            log.info("Circuit {} {} -> {} ({}): before={} after={}", name, previous, newState, reason, before, after);
        }
        listener.onStateChange(new CircuitStateChangedEvent(this, name, previous, newState, reason, now));
    }

    private void pruneFailureWindow(Instant now) {
        Instant cutoff = now.minus(config.getFailureWindow());
        while (!failureTimes.isEmpty() && failureTimes.peekFirst().isBefore(cutoff)) {
            failureTimes.removeFirst();
        }
    }

    /** Recovery timeout with backoff applied. */
    Duration currentTimeout() {
        Duration scaled = config.getTimeout().multipliedBy(backoffMultiplier);
        return scaled.compareTo(config.getMaxTimeout()) > 0 ? config.getMaxTimeout() : scaled;
    }

    private Duration remainingOpenTime(Instant now) {
        Duration remaining = currentTimeout().minus(Duration.between(lastStateChange, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Adopts a snapshot written by another process if it records a newer state change.
     * A breaker without state history adopts any snapshot, whatever its age.
     *
     * @return true if local state was replaced
     */
    public boolean restore(CircuitBreakerSnapshot snapshot) {
        lock.lock();
        try {
            if (hasStateHistory && snapshot.lastStateChangeMillis() <= lastStateChange.toEpochMilli()) {
                return false;
            }
            hasStateHistory = true;
            CircuitState previous = state;
            state = snapshot.state();
            lastStateChange = Instant.ofEpochMilli(snapshot.lastStateChangeMillis());
            consecutiveFailures = snapshot.consecutiveFailures();
            consecutiveSuccesses = snapshot.consecutiveSuccesses();
            backoffMultiplier = Math.max(1, Math.min(snapshot.backoffMultiplier(), MAX_BACKOFF_MULTIPLIER));
            probeInFlight = false;
            if (state == CircuitState.CLOSED) {
                failureTimes.clear();
            }
            if (previous != state) {
                stateChanges++;
                log.info("Circuit {} adopted shared state {} -> {}", name, previous, state);
                listener.onStateChange(
                        new CircuitStateChangedEvent(this, name, previous, state, "shared state", lastStateChange));
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    private CircuitBreakerSnapshot snapshotLocked() {
        return new CircuitBreakerSnapshot(
                name, state, consecutiveFailures, consecutiveSuccesses, backoffMultiplier,
                lastStateChange.toEpochMilli());
    }

    /**
     * True once this breaker has changed state or adopted shared state. A fresh
     * breaker has nothing to share and must not overwrite a sibling's snapshot.
     */
    public boolean hasStateHistory() {
        lock.lock();
        try {
            return hasStateHistory;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            Instant now = clock.instant();
            pruneFailureWindow(now);
            long completed = successfulCalls + failedCalls;
            return CircuitBreakerStats.builder()
                    .name(name)
                    .state(state)
                    .health(healthLocked())
                    .consecutiveFailures(consecutiveFailures)
                    .consecutiveSuccesses(consecutiveSuccesses)
                    .failuresInWindow(failureTimes.size())
                    .backoffMultiplier(backoffMultiplier)
                    .currentTimeoutSeconds(currentTimeout().toSeconds())
                    .retryAfterSeconds(state == CircuitState.OPEN ? remainingOpenTime(now).toSeconds() : 0)
                    .totalCalls(totalCalls)
                    .successfulCalls(successfulCalls)
                    .failedCalls(failedCalls)
                    .timeoutCalls(timeoutCalls)
                    .slowCalls(slowCalls)
                    .rejectedCalls(rejectedCalls)
                    .ignoredErrors(ignoredErrors)
                    .stateChanges(stateChanges)
                    .failureRate(completed > 0 ? (double) failedCalls / completed : 0.0)
                    .averageLatencyMs(latencies.average())
                    .p50LatencyMs(latencies.percentile(0.50))
                    .p95LatencyMs(latencies.percentile(0.95))
                    .p99LatencyMs(latencies.percentile(0.99))
                    .maxLatencyMs(latencies.max())
                    .lastStateChange(lastStateChange)
                    .lastFailure(lastFailure)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private CircuitHealth healthLocked() {
        if (state == CircuitState.OPEN) {
            return CircuitHealth.UNHEALTHY;
        }
        if (state == CircuitState.HALF_OPEN) {
            return CircuitHealth.RECOVERING;
        }
        if (successfulCalls > 0 && slowCalls * 2 > successfulCalls) {
            return CircuitHealth.DEGRADED;
        }
        return CircuitHealth.HEALTHY;
    }
}
