package com.adlanda.contextengine.model;

import java.util.List;

/**
 * Divergence between the primary store and the vector index for one workspace.
 *
 * @param workspaceId      Workspace that was compared
 * @param missingFromIndex Ids stored in the primary store but not searchable
 * @param orphanedInIndex  Ids in the vector index without a primary record
 */
public record ReconciliationReport(
        String workspaceId,
        List<String> missingFromIndex,
        List<String> orphanedInIndex
) {
    public ReconciliationReport {
        missingFromIndex = List.copyOf(missingFromIndex);
        orphanedInIndex = List.copyOf(orphanedInIndex);
    }

    public boolean isConsistent() {
        return missingFromIndex.isEmpty() && orphanedInIndex.isEmpty();
    }
}
