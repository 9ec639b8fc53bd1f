package com.adlanda.contextengine.model;

/**
 * Confidence statistics for a workspace.
 */
public record EvolutionStats(
        long totalContexts,
        double averageConfidence,
        long lowConfidenceContexts
) {}
