package com.adlanda.contextengine.model;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Request for context retrieval.
 *
 * @param query         Search text; blank queries return an empty result
 * @param workspaceId   Workspace to search (required)
 * @param entities      Extracted entities for query expansion
 * @param tier          Restrict the search to one tier; null searches all tiers in order
 * @param types         Restrict to these context types; empty means any
 * @param limit         Maximum contexts to return; null uses the configured default
 * @param minSimilarity Minimum raw similarity; null uses the configured default
 * @param timeout       Overall search deadline; null uses the configured default
 */
public record RetrievalRequest(
        String query,
        String workspaceId,
        List<QueryEntity> entities,
        ContextTier tier,
        Set<ContextType> types,
        Integer limit,
        Double minSimilarity,
        Duration timeout
) {
    public RetrievalRequest {
        entities = entities == null ? List.of() : List.copyOf(entities);
        types = types == null ? Set.of() : Set.copyOf(types);
    }

    public static RetrievalRequest of(String workspaceId, String query, int limit) {
        return new RetrievalRequest(query, workspaceId, List.of(), null, Set.of(), limit, null, null);
    }

    public RetrievalRequest withEntities(List<QueryEntity> entities) {
        return new RetrievalRequest(query, workspaceId, entities, tier, types, limit, minSimilarity, timeout);
    }

    public RetrievalRequest withTimeout(Duration timeout) {
        return new RetrievalRequest(query, workspaceId, entities, tier, types, limit, minSimilarity, timeout);
    }

    public RetrievalRequest withTier(ContextTier tier) {
        return new RetrievalRequest(query, workspaceId, entities, tier, types, limit, minSimilarity, timeout);
    }
}
