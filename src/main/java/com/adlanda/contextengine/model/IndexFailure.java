package com.adlanda.contextengine.model;

import java.time.Instant;

/**
 * A vector index divergence that needs repair.
 *
 * @param contextId  Affected context
 * @param operation  What was being attempted
 * @param reason     Error message or description
 * @param occurredAt When it was observed
 */
public record IndexFailure(
        String contextId,
        Operation operation,
        String reason,
        Instant occurredAt
) {
    public enum Operation {
        /** Vector upsert failed; the context is stored but not searchable. */
        UPSERT,
        /** Payload patch failed; the stored projection is out of date. */
        PAYLOAD_UPDATE,
        /** Vector delete failed; an orphaned point may remain. */
        DELETE,
        /** Search returned a point whose context no longer exists. */
        STALE_ENTRY
    }
}
