package com.adlanda.contextengine.model;

/**
 * Request to create a context.
 *
 * @param workspaceId        Owning workspace (required)
 * @param tier               Tier (required)
 * @param type               Type (required)
 * @param content            Non-empty content (required)
 * @param metadata           Optional metadata; usage count and confidence start from their defaults
 * @param generateEmbeddings Embed the content (default true)
 * @param indexInVectorDB    Upsert the embedding into the vector index (default true)
 */
public record ContextCreateRequest(
        String workspaceId,
        ContextTier tier,
        ContextType type,
        String content,
        ContextMetadata metadata,
        Boolean generateEmbeddings,
        Boolean indexInVectorDB
) {
    public ContextCreateRequest {
        if (metadata == null) {
            metadata = ContextMetadata.empty();
        }
        if (generateEmbeddings == null) {
            generateEmbeddings = true;
        }
        if (indexInVectorDB == null) {
            indexInVectorDB = true;
        }
    }

    public static ContextCreateRequest of(String workspaceId, ContextTier tier, ContextType type,
                                          String content, ContextMetadata metadata) {
        return new ContextCreateRequest(workspaceId, tier, type, content, metadata, true, true);
    }
}
