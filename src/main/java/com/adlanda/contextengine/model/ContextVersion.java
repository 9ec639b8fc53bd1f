package com.adlanda.contextengine.model;

import java.time.Instant;

/**
 * Immutable snapshot of a context's content and metadata, taken before an update.
 *
 * @param contextId     Context the snapshot belongs to
 * @param versionNumber Monotonically increasing from 1; 0 on a draft not yet stored
 * @param content       Content before the update
 * @param metadata      Metadata before the update
 * @param createdAt     When the snapshot was taken
 */
public record ContextVersion(
        String contextId,
        int versionNumber,
        String content,
        ContextMetadata metadata,
        Instant createdAt
) {
    /**
     * Snapshot of the given context's current state; the store assigns the number.
     */
    public static ContextVersion snapshotOf(Context context, Instant now) {
        return new ContextVersion(context.id(), 0, context.content(), context.metadata(), now);
    }
}
