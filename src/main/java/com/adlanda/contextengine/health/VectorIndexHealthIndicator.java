package com.adlanda.contextengine.health;

import com.adlanda.contextengine.model.IndexFailure;
import com.adlanda.contextengine.repository.VectorIndex;
import com.adlanda.contextengine.service.IndexFailureTracker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Health indicator for the vector index.
 *
 * Reports:
 * - Whether the index can be reached
 * - Number of points it holds
 * - Number of contexts waiting for repair
 * - The most recent index failure
 */
@Component
public class VectorIndexHealthIndicator implements HealthIndicator {

    private final VectorIndex vectorIndex;
    private final IndexFailureTracker failureTracker;

    public VectorIndexHealthIndicator(VectorIndex vectorIndex, IndexFailureTracker failureTracker) {
        this.vectorIndex = vectorIndex;
        this.failureTracker = failureTracker;
    }

    @Override
    public Health health() {
        Health.Builder builder;
        try {
            builder = Health.up().withDetail("points", vectorIndex.count());
        } catch (RuntimeException e) {
            builder = Health.down().withDetail("error", String.valueOf(e.getMessage()));
        }

        builder.withDetail("pendingRepairs", failureTracker.pendingCount());

        Optional<IndexFailure> last = failureTracker.lastFailure();
        if (last.isPresent()) {
            IndexFailure failure = last.get();
            builder.withDetail("lastFailure", failure.operation() + " " + failure.contextId()
                    + " at " + failure.occurredAt() + ": " + failure.reason());
        }

        return builder.build();
    }
}
