package com.tradeguard.config;

import com.tradeguard.market.MarketDataProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Runs market data subscriber callbacks. Bounded queue with the default abort
     * policy: when subscribers fall behind, updates for them are dropped rather
     * than pushed back onto the feed threads.
     */
    @Bean("subscriberExecutor")
    public ThreadPoolTaskExecutor subscriberExecutor(MarketDataProperties marketDataProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(marketDataProperties.getSubscribers().getThreads());
        executor.setMaxPoolSize(marketDataProperties.getSubscribers().getThreads());
        executor.setQueueCapacity(marketDataProperties.getSubscribers().getQueueCapacity());
        executor.setThreadNamePrefix("price-subscriber-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /** Worker threads for time-bounded guarded calls; the caller waits on them with a deadline. */
    @Bean(name = "guardedCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService guardedCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "guarded-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
