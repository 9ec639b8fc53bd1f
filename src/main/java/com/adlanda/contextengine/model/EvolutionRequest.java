package com.adlanda.contextengine.model;

/**
 * Parameters for an evolution sweep over a workspace.
 *
 * @param workspaceId        Workspace to evolve
 * @param applyTemporalDecay Whether to decay confidence by age
 * @param consolidateSimilar Accepted for compatibility; consolidation is not performed
 * @param resolveConflicts   Accepted for compatibility; conflict resolution is not performed
 */
public record EvolutionRequest(
        String workspaceId,
        boolean applyTemporalDecay,
        boolean consolidateSimilar,
        boolean resolveConflicts
) {
    public static EvolutionRequest temporalDecay(String workspaceId) {
        return new EvolutionRequest(workspaceId, true, false, false);
    }
}
