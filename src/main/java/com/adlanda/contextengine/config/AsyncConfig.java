package com.adlanda.contextengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used off the request path.
 *
 * - usageTrackingExecutor: fire-and-forget usage write-backs. Bounded queue;
 *   rejected tasks surface as TaskRejectedException and are dropped by the caller.
 * - retrievalExecutor: tier searches, so the retriever can enforce a deadline.
 *   Rejects when saturated so a search never runs on the request thread and
 *   escapes the deadline.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    private static final int RETRIEVAL_QUEUE_CAPACITY = 100;

    @Bean(name = "usageTrackingExecutor")
    public ThreadPoolTaskExecutor usageTrackingExecutor(UsageTrackingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(properties.getCorePoolSize(), properties.getMaxPoolSize()));
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("usage-tracking-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Usage tracking executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), properties.getQueueCapacity());

        return executor;
    }

    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(RETRIEVAL_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("tier-search-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();

        log.info("Retrieval executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), RETRIEVAL_QUEUE_CAPACITY);

        return executor;
    }
}
