package com.adlanda.contextengine.model;

import java.util.List;

/**
 * Outcome of an evolution sweep.
 *
 * @param updated           Contexts whose confidence was persisted
 * @param consolidated      Always 0
 * @param conflictsResolved Always 0
 * @param flaggedContextIds Contexts whose confidence is below the minimum threshold
 * @param removed           Flagged contexts deleted (only when deletion is configured)
 * @param cancelled         True when the sweep stopped early on a cancellation request
 * @param latencyMs         Wall-clock duration
 * @param summary           Human-readable summary
 */
public record EvolutionResult(
        int updated,
        int consolidated,
        int conflictsResolved,
        List<String> flaggedContextIds,
        int removed,
        boolean cancelled,
        long latencyMs,
        String summary
) {
    public EvolutionResult {
        flaggedContextIds = List.copyOf(flaggedContextIds);
    }
}
