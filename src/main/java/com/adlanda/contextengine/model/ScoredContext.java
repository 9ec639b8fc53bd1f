package com.adlanda.contextengine.model;

/**
 * A hydrated context with its ranking scores. Request-scoped, never persisted.
 *
 * @param context        The full context from the primary store
 * @param similarity     Raw vector similarity
 * @param scoreBreakdown Individual ranking signals, each in [0, 1]
 * @param score          Weighted blend of the signals
 */
public record ScoredContext(
        Context context,
        double similarity,
        ScoreBreakdown scoreBreakdown,
        double score
) {
    /**
     * Ranking signals that make up {@link #score()}.
     */
    public record ScoreBreakdown(
            double semantic,
            double freshness,
            double usage,
            double confidence
    ) {}
}
