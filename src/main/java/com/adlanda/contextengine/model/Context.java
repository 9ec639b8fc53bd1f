package com.adlanda.contextengine.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A retrievable unit of contextual knowledge.
 *
 * @param id           Identifier assigned by the primary store on insert (null before that)
 * @param workspaceId  Owning workspace, immutable after create
 * @param tier         Search-order bucket
 * @param type         Kind of knowledge
 * @param content      Text payload
 * @param metadata     Source, tags, usage, confidence and extension attributes
 * @param embedding    Vector for {@code content}; only present right after storage generated it
 * @param createdAt    Creation time
 * @param updatedAt    Last mutation time
 * @param lastAccessed Last time retrieval returned this context, null if never
 * @param indexed      Whether the vector index is known to hold the current generation
 * @param indexable    False when the creator opted out of embeddings or indexing; such a
 *                     context is never written to the vector index, repair included
 */
public record Context(
        String id,
        String workspaceId,
        ContextTier tier,
        ContextType type,
        String content,
        ContextMetadata metadata,
        List<Double> embedding,
        Instant createdAt,
        Instant updatedAt,
        Instant lastAccessed,
        boolean indexed,
        boolean indexable
) {
    public Context {
        metadata = metadata == null ? ContextMetadata.empty() : metadata;
    }

    public Context(String id, String workspaceId, ContextTier tier, ContextType type, String content,
                   ContextMetadata metadata, List<Double> embedding, Instant createdAt, Instant updatedAt,
                   Instant lastAccessed, boolean indexed) {
        this(id, workspaceId, tier, type, content, metadata, embedding, createdAt, updatedAt, lastAccessed,
                indexed, true);
    }

    /**
     * Creates a new, not yet stored context.
     */
    public static Context draft(String workspaceId, ContextTier tier, ContextType type,
                                String content, ContextMetadata metadata, Instant now) {
        return draft(workspaceId, tier, type, content, metadata, now, true);
    }

    public static Context draft(String workspaceId, ContextTier tier, ContextType type,
                                String content, ContextMetadata metadata, Instant now, boolean indexable) {
        return new Context(null, workspaceId, tier, type, content, metadata, null, now, now, null, false, indexable);
    }

    public Context withId(String id) {
        return new Context(id, workspaceId, tier, type, content, metadata, embedding, createdAt, updatedAt,
                lastAccessed, indexed, indexable);
    }

    public Context withEmbedding(List<Double> embedding) {
        return new Context(id, workspaceId, tier, type, content, metadata, embedding, createdAt, updatedAt,
                lastAccessed, indexed, indexable);
    }

    public Context withIndexed(boolean indexed) {
        return new Context(id, workspaceId, tier, type, content, metadata, embedding, createdAt, updatedAt,
                lastAccessed, indexed, indexable);
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    /**
     * Timestamp used for recency: last access, falling back to last update.
     */
    public Instant recencyTimestamp() {
        return lastAccessed != null ? lastAccessed : updatedAt;
    }

    /**
     * Filterable projection stored alongside the vector. Never contains {@code content}.
     */
    public Map<String, Object> indexPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(VectorFilter.WORKSPACE_ID, workspaceId);
        payload.put(VectorFilter.TIER, tier.value());
        payload.put(VectorFilter.TYPE, type.value());
        payload.put(VectorFilter.SOURCE, metadata.source() != null ? metadata.source() : "");
        payload.put(VectorFilter.TAGS, metadata.tags());
        payload.put("usageCount", metadata.usageCount());
        payload.put(VectorFilter.CONFIDENCE, metadata.effectiveConfidence());
        payload.put("createdAt", createdAt != null ? createdAt.toString() : null);
        payload.put("updatedAt", updatedAt != null ? updatedAt.toString() : null);
        return payload;
    }
}
