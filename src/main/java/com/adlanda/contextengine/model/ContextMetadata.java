package com.adlanda.contextengine.model;

import java.util.List;
import java.util.Map;

/**
 * Metadata attached to a context.
 *
 * A small set of first-class fields plus an open, string-keyed attribute map
 * for anything else callers want to carry along (file path, language, ...).
 *
 * @param source      Where the context came from (file path, URL, conversation id)
 * @param tags        Free-form tags, usable as a vector index filter
 * @param usageCount  Number of times the context was returned by retrieval (never negative)
 * @param confidence  Confidence in [0, 1], owned by the evolution engine; null means "not yet rated"
 * @param attributes  Extension attributes
 */
public record ContextMetadata(
        String source,
        List<String> tags,
        long usageCount,
        Double confidence,
        Map<String, String> attributes
) {
    /**
     * Confidence assumed for contexts that have never been rated or decayed.
     */
    public static final double DEFAULT_CONFIDENCE = 1.0;

    public ContextMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (usageCount < 0) {
            throw new IllegalArgumentException("usageCount must not be negative");
        }
    }

    public static ContextMetadata empty() {
        return new ContextMetadata(null, List.of(), 0, null, Map.of());
    }

    public static ContextMetadata of(String source, List<String> tags) {
        return new ContextMetadata(source, tags, 0, null, Map.of());
    }

    /**
     * Returns the stored confidence, or {@link #DEFAULT_CONFIDENCE} when absent.
     */
    public double effectiveConfidence() {
        return confidence != null ? confidence : DEFAULT_CONFIDENCE;
    }

    public ContextMetadata withConfidence(Double confidence) {
        return new ContextMetadata(source, tags, usageCount, confidence, attributes);
    }

    public ContextMetadata withUsageCount(long usageCount) {
        return new ContextMetadata(source, tags, usageCount, confidence, attributes);
    }
}
