package com.adlanda.contextengine.model;

import java.util.Map;

/**
 * A single vector search result.
 *
 * @param id      Context id the point was stored under
 * @param score   Raw cosine similarity
 * @param payload Stored payload (no content)
 */
public record VectorHit(
        String id,
        double score,
        Map<String, Object> payload
) {}
