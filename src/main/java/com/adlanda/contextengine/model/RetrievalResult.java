package com.adlanda.contextengine.model;

import java.util.List;

/**
 * Result of a context retrieval.
 *
 * @param contexts      Selected contexts, highest score first
 * @param query         Query as received
 * @param totalFound    Hydrated candidates considered before selection
 * @param latencyMs     Time taken in milliseconds
 * @param tiersSearched Tiers whose search completed, in search order
 * @param degraded      True when a tier search timed out and the result is partial
 */
public record RetrievalResult(
        List<ScoredContext> contexts,
        String query,
        int totalFound,
        long latencyMs,
        List<ContextTier> tiersSearched,
        boolean degraded
) {
    public RetrievalResult {
        contexts = List.copyOf(contexts);
        tiersSearched = List.copyOf(tiersSearched);
    }

    public static RetrievalResult empty(String query, long latencyMs) {
        return new RetrievalResult(List.of(), query, 0, latencyMs, List.of(), false);
    }
}
