package com.adlanda.contextengine.service;

import com.adlanda.contextengine.repository.ContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;

/**
 * Records that contexts were returned by retrieval.
 *
 * One background task per context on the bounded usage tracking executor.
 * Nothing here reaches the caller: rejected tasks are dropped and failures
 * are logged. No retries.
 */
@Component
public class UsageTracker {

    private static final Logger log = LoggerFactory.getLogger(UsageTracker.class);

    private final ContextStore contextStore;
    private final TaskExecutor executor;

    public UsageTracker(ContextStore contextStore,
                        @Qualifier("usageTrackingExecutor") TaskExecutor executor) {
        this.contextStore = contextStore;
        this.executor = executor;
    }

    /**
     * Dispatches one usage write-back per id.
     *
     * @return number of tasks accepted by the executor
     */
    public int trackUsage(Collection<String> contextIds, Instant accessedAt) {
        int dispatched = 0;
        for (String contextId : contextIds) {
            try {
                executor.execute(() -> recordUsage(contextId, accessedAt));
                dispatched++;
            } catch (TaskRejectedException e) {
                log.warn("Usage tracking queue full, dropped update for context {}", contextId);
            }
        }
        return dispatched;
    }

    private void recordUsage(String contextId, Instant accessedAt) {
        try {
            if (!contextStore.incrementUsage(contextId, accessedAt)) {
                log.debug("Usage not recorded, context {} no longer exists", contextId);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record usage for context {}: {}", contextId, e.getMessage());
        }
    }
}
