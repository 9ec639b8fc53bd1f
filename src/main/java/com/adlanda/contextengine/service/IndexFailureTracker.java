package com.adlanda.contextengine.service;

import com.adlanda.contextengine.model.IndexFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records vector index failures that need repair.
 *
 * Keeps the latest failure per context, bounded to {@code capacity} contexts
 * (oldest evicted first). Failed writes are reported here instead of being
 * thrown to the caller.
 */
@Component
public class IndexFailureTracker {

    private static final Logger log = LoggerFactory.getLogger(IndexFailureTracker.class);

    static final int DEFAULT_CAPACITY = 1000;

    private final Map<String, IndexFailure> pending;
    private IndexFailure lastFailure;

    public IndexFailureTracker() {
        this(DEFAULT_CAPACITY);
    }

    public IndexFailureTracker(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.pending = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, IndexFailure> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized IndexFailure record(String contextId, IndexFailure.Operation operation, String reason) {
        IndexFailure failure = new IndexFailure(contextId, operation, reason, Instant.now());
        pending.remove(contextId);
        pending.put(contextId, failure);
        lastFailure = failure;
        log.warn("Vector index {} failed for context {}: {}", operation, contextId, reason);
        return failure;
    }

    /**
     * Clears the pending entry of a context after it was indexed or deleted successfully.
     */
    public synchronized void resolve(String contextId) {
        if (pending.remove(contextId) != null) {
            log.debug("Index failure resolved for context {}", contextId);
        }
    }

    /**
     * Pending failures, most recent first.
     */
    public synchronized List<IndexFailure> pending() {
        List<IndexFailure> failures = new ArrayList<>(pending.values());
        Collections.reverse(failures);
        return failures;
    }

    public synchronized boolean isPending(String contextId) {
        return pending.containsKey(contextId);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized Optional<IndexFailure> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }
}
