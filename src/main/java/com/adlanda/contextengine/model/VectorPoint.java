package com.adlanda.contextengine.model;

import java.util.List;
import java.util.Map;

/**
 * A vector index entry: context id, embedding and filterable payload.
 */
public record VectorPoint(
        String id,
        List<Double> vector,
        Map<String, Object> payload
) {
    public static VectorPoint of(Context context) {
        if (!context.hasEmbedding()) {
            throw new IllegalArgumentException("Cannot index context without embedding: " + context.id());
        }
        return new VectorPoint(context.id(), context.embedding(), context.indexPayload());
    }
}
