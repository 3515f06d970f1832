package com.tradeguard.concurrent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns a group of long-running background loops and tears them down together.
 *
 * <p>Loops spawned here must check {@link #isCancelled()} between iterations and
 * wait through {@link #sleep(Duration)} rather than {@link Thread#sleep(long)}, so
 * a shutdown request wakes them immediately. {@link #shutdown(Duration)} signals
 * cancellation, gives in-flight work a grace period, then interrupts whatever is
 * still running and waits for the threads to exit.
 *
 * <p>A supervisor is single-use: once shut down it refuses new tasks.
 */
public class TaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    private final String name;
    private final ExecutorService executor;
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final Map<String, Future<?>> tasks = new LinkedHashMap<>();

    public TaskSupervisor(String name) {
        this.name = name;
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory(name));
    }

    /**
     * Starts a named loop. Exceptions escaping the runnable are logged; the loop is
     * expected to handle its own retries.
     */
    public synchronized void spawn(String taskName, Runnable task) {
        if (isCancelled()) {
            throw new IllegalStateException("Supervisor " + name + " is shut down, cannot spawn " + taskName);
        }
        Future<?> future = executor.submit(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Supervised task {}/{} terminated with error", name, taskName, e);
            }
        });
        tasks.put(taskName, future);
        log.debug("Spawned supervised task {}/{}", name, taskName);
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    /**
     * Waits for the given duration or until cancellation, whichever comes first.
     *
     * @return true if the supervisor was cancelled while waiting
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return cancelSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Number of spawned tasks that have not finished yet. */
    public synchronized int activeTaskCount() {
        int active = 0;
        for (Future<?> future : tasks.values()) {
            if (!future.isDone()) {
                active++;
            }
        }
        return active;
    }

    public synchronized List<String> activeTaskNames() {
        List<String> names = new ArrayList<>();
        tasks.forEach((taskName, future) -> {
            if (!future.isDone()) {
                names.add(taskName);
            }
        });
        return names;
    }

    /**
     * Cancels all tasks and joins them.
     *
     * @param gracePeriod how long loops get to finish their current iteration before interruption
     * @return true if every task exited
     */
    public boolean shutdown(Duration gracePeriod) {
        cancelSignal.countDown();
        executor.shutdown();
        try {
            if (executor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Supervisor {} stopped cleanly", name);
                return true;
            }
            log.warn("Supervisor {} grace period of {}ms elapsed, interrupting tasks {}",
                    name, gracePeriod.toMillis(), activeTaskNames());
            executor.shutdownNow();
            boolean terminated = executor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                log.error("Supervisor {} tasks did not exit after interruption: {}", name, activeTaskNames());
            }
            return terminated;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getName() {
        return name;
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
