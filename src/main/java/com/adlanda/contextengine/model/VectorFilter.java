package com.adlanda.contextengine.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload filter for vector index search, listing and deletion.
 *
 * All set fields must match (AND). {@code types} and {@code tags} match when
 * any of their values match.
 */
public record VectorFilter(
        String workspaceId,
        ContextTier tier,
        Set<ContextType> types,
        String source,
        List<String> tags,
        Double minConfidence
) {
    public static final String WORKSPACE_ID = "workspaceId";
    public static final String TIER = "tier";
    public static final String TYPE = "type";
    public static final String SOURCE = "source";
    public static final String TAGS = "tags";
    public static final String CONFIDENCE = "confidence";

    public VectorFilter {
        types = types == null ? Set.of() : Set.copyOf(types);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static VectorFilter forWorkspace(String workspaceId) {
        return new VectorFilter(workspaceId, null, null, null, null, null);
    }

    public static VectorFilter forTier(String workspaceId, ContextTier tier, Set<ContextType> types) {
        return new VectorFilter(workspaceId, tier, types, null, null, null);
    }

    public boolean isEmpty() {
        return workspaceId == null && tier == null && types.isEmpty()
                && source == null && tags.isEmpty() && minConfidence == null;
    }

    /**
     * Evaluates this filter against a stored payload.
     */
    public boolean matches(Map<String, Object> payload) {
        if (workspaceId != null && !workspaceId.equals(payload.get(WORKSPACE_ID))) {
            return false;
        }
        if (tier != null && !tier.value().equals(payload.get(TIER))) {
            return false;
        }
        if (!types.isEmpty() && types.stream().noneMatch(t -> t.value().equals(payload.get(TYPE)))) {
            return false;
        }
        if (source != null && !source.equals(payload.get(SOURCE))) {
            return false;
        }
        if (!tags.isEmpty()) {
            Object stored = payload.get(TAGS);
            if (!(stored instanceof Collection<?> storedTags) || tags.stream().noneMatch(storedTags::contains)) {
                return false;
            }
        }
        if (minConfidence != null) {
            Object stored = payload.get(CONFIDENCE);
            double confidence = stored instanceof Number n ? n.doubleValue() : ContextMetadata.DEFAULT_CONFIDENCE;
            return confidence >= minConfidence;
        }
        return true;
    }
}
